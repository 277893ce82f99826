package com.modelspec.models;

import com.modelspec.expr.DeferredValue;
import com.modelspec.registry.ModelRegistry;
import com.modelspec.registry.Modes;
import com.modelspec.registry.model.DataInterface;
import com.modelspec.registry.model.FitModule;
import com.modelspec.registry.model.FunctionRef;
import com.modelspec.registry.model.PredictModule;
import com.modelspec.registry.model.PredictionType;
import com.modelspec.translate.TranslationHooks;

/**
 * {@code linear_reg}: linear regression with the lm, glm, rlm and glmnet engines.
 */
public class LinearRegDefinition implements ModelDefinition {

    public static final String MODEL = "linear_reg";

    private static final FunctionRef STATS_PREDICT = FunctionRef.of("stats", "predict");

    @Override
    public String modelName() {
        return MODEL;
    }

    @Override
    public void register(ModelRegistry registry, TranslationHooks hooks) {
        registry.registerModel(MODEL);
        registry.registerMode(MODEL, Modes.REGRESSION);

        registerFormulaEngine(registry, "lm", "stats", FunctionRef.of("stats", "lm"), null);
        registerFormulaEngine(registry, "glm", "stats", FunctionRef.of("stats", "glm"), "gaussian");
        registerFormulaEngine(registry, "rlm", "MASS", FunctionRef.of("MASS", "rlm"), null);

        registry.registerEngine(MODEL, Modes.REGRESSION, GlmnetSupport.ENGINE);
        registry.registerDependency(MODEL, GlmnetSupport.ENGINE, GlmnetSupport.PACKAGE);
        GlmnetSupport.registerArguments(registry, MODEL);
        registry.registerFit(MODEL, GlmnetSupport.ENGINE, Modes.REGRESSION, FitModule.builder()
                .dataInterface(DataInterface.MATRIX)
                .protectedArgument("x")
                .protectedArgument("y")
                .protectedArgument("weights")
                .function(GlmnetSupport.FIT)
                .defaultArgument("family", DeferredValue.literal("gaussian"))
                .build());
        registry.registerPredict(MODEL, GlmnetSupport.ENGINE, Modes.REGRESSION, PredictionType.NUMERIC,
                PredictModule.builder()
                        .pre(GlmnetSupport.singlePenalty())
                        .post(GlmnetSupport.firstNumericColumn())
                        .function(GlmnetSupport.PREDICT)
                        .argument("object", GlmnetSupport.object())
                        .argument("newx", GlmnetSupport.newx())
                        .argument("s", GlmnetSupport.s())
                        .argument("type", DeferredValue.literal("response"))
                        .build());
        hooks.register(MODEL, GlmnetSupport.pathHook());
    }

    private static void registerFormulaEngine(ModelRegistry registry, String engine, String pkg,
                                              FunctionRef function, String family) {
        registry.registerEngine(MODEL, Modes.REGRESSION, engine);
        registry.registerDependency(MODEL, engine, pkg);

        FitModule.FitModuleBuilder fit = FitModule.builder()
                .dataInterface(DataInterface.FORMULA)
                .protectedArgument("formula")
                .protectedArgument("data")
                .protectedArgument("weights")
                .function(function);
        if (family != null) {
            fit.defaultArgument("family", DeferredValue.literal(family));
        }
        registry.registerFit(MODEL, engine, Modes.REGRESSION, fit.build());

        PredictModule.PredictModuleBuilder predict = PredictModule.builder()
                .function(STATS_PREDICT)
                .argument("object", DeferredValue.expression("object"))
                .argument("newdata", DeferredValue.expression("new_data"));
        if (family != null) {
            predict.argument("type", DeferredValue.literal("response"));
        }
        registry.registerPredict(MODEL, engine, Modes.REGRESSION, PredictionType.NUMERIC, predict.build());
    }
}
