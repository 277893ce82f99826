package com.modelspec.models;

import com.modelspec.exception.ArgumentValidationException;
import com.modelspec.expr.DeferredValue;
import com.modelspec.registry.ModelRegistry;
import com.modelspec.registry.Modes;
import com.modelspec.registry.model.DataInterface;
import com.modelspec.registry.model.FitModule;
import com.modelspec.registry.model.FunctionRef;
import com.modelspec.registry.model.PredictModule;
import com.modelspec.registry.model.PredictionType;
import com.modelspec.translate.TranslationHook;
import com.modelspec.translate.TranslationHooks;

/**
 * {@code mixture_da}: mixture discriminant analysis with the mda engine.
 */
public class MixtureDaDefinition implements ModelDefinition {

    public static final String MODEL = "mixture_da";
    static final String ENGINE = "mda";

    private static final FunctionRef PREDICT = FunctionRef.of("mda", "predict.mda");

    @Override
    public String modelName() {
        return MODEL;
    }

    @Override
    public void register(ModelRegistry registry, TranslationHooks hooks) {
        registry.registerModel(MODEL);
        registry.registerMode(MODEL, Modes.CLASSIFICATION);
        registry.registerEngine(MODEL, Modes.CLASSIFICATION, ENGINE);
        registry.registerDependency(MODEL, ENGINE, "mda");
        registry.registerArgument(MODEL, ENGINE, "sub_classes", "subclasses", FunctionRef.of("dials", "sub_classes"), false);

        registry.registerFit(MODEL, ENGINE, Modes.CLASSIFICATION, FitModule.builder()
                .dataInterface(DataInterface.FORMULA)
                .protectedArgument("formula")
                .protectedArgument("data")
                .protectedArgument("weights")
                .function(FunctionRef.of("mda", "mda"))
                .build());

        registry.registerPredict(MODEL, ENGINE, Modes.CLASSIFICATION, PredictionType.CLASS, PredictModule.builder()
                .function(PREDICT)
                .argument("object", DeferredValue.expression("object"))
                .argument("newdata", DeferredValue.expression("new_data"))
                .argument("type", DeferredValue.literal("class"))
                .build());
        registry.registerPredict(MODEL, ENGINE, Modes.CLASSIFICATION, PredictionType.PROB, PredictModule.builder()
                .function(PREDICT)
                .argument("object", DeferredValue.expression("object"))
                .argument("newdata", DeferredValue.expression("new_data"))
                .argument("type", DeferredValue.literal("posterior"))
                .build());

        hooks.register(MODEL, subclassesHook());
    }

    /**
     * {@code subclasses} must be a positive whole number.
     */
    static TranslationHook subclassesHook() {
        return (context, arguments) -> {
            DeferredValue value = arguments.get("subclasses");
            if (value == null || !value.isLiteral()) {
                return arguments;
            }
            Object v = value.resolve();
            boolean valid = v instanceof Number n
                    && !(v instanceof Double d && (d.isNaN() || d.isInfinite()))
                    && n.doubleValue() >= 1
                    && n.doubleValue() == Math.floor(n.doubleValue());
            if (!valid) {
                throw new ArgumentValidationException("sub_classes",
                        "The number of subclasses should be a single positive integer, got " + v + ".");
            }
            return arguments;
        };
    }
}
