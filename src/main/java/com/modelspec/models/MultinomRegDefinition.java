package com.modelspec.models;

import com.modelspec.expr.DeferredValue;
import com.modelspec.registry.ModelRegistry;
import com.modelspec.registry.Modes;
import com.modelspec.registry.model.DataInterface;
import com.modelspec.registry.model.FitModule;
import com.modelspec.registry.model.PredictModule;
import com.modelspec.registry.model.PredictionType;
import com.modelspec.translate.TranslationHooks;

/**
 * {@code multinom_reg}: multinomial regression for classification, fitted with glmnet.
 *
 * Class predictions come back as a label matrix and probabilities as a
 * rows x classes x penalties array; the post hooks keep the single penalty's slice.
 */
public class MultinomRegDefinition implements ModelDefinition {

    public static final String MODEL = "multinom_reg";

    @Override
    public String modelName() {
        return MODEL;
    }

    @Override
    public void register(ModelRegistry registry, TranslationHooks hooks) {
        registry.registerModel(MODEL);
        registry.registerMode(MODEL, Modes.CLASSIFICATION);
        registry.registerEngine(MODEL, Modes.CLASSIFICATION, GlmnetSupport.ENGINE);
        registry.registerDependency(MODEL, GlmnetSupport.ENGINE, GlmnetSupport.PACKAGE);
        GlmnetSupport.registerArguments(registry, MODEL);

        registry.registerFit(MODEL, GlmnetSupport.ENGINE, Modes.CLASSIFICATION, FitModule.builder()
                .dataInterface(DataInterface.MATRIX)
                .protectedArgument("x")
                .protectedArgument("y")
                .protectedArgument("weights")
                .function(GlmnetSupport.FIT)
                .defaultArgument("family", DeferredValue.literal("multinomial"))
                .build());

        registry.registerPredict(MODEL, GlmnetSupport.ENGINE, Modes.CLASSIFICATION, PredictionType.CLASS,
                PredictModule.builder()
                        .pre(GlmnetSupport.singlePenalty())
                        .post(GlmnetSupport.firstClassColumn())
                        .function(GlmnetSupport.PREDICT)
                        .argument("object", GlmnetSupport.object())
                        .argument("newx", GlmnetSupport.newx())
                        .argument("s", GlmnetSupport.s())
                        .argument("type", DeferredValue.literal("class"))
                        .build());
        registry.registerPredict(MODEL, GlmnetSupport.ENGINE, Modes.CLASSIFICATION, PredictionType.PROB,
                PredictModule.builder()
                        .pre(GlmnetSupport.singlePenalty())
                        .post(GlmnetSupport.firstResponseSlice())
                        .function(GlmnetSupport.PREDICT)
                        .argument("object", GlmnetSupport.object())
                        .argument("newx", GlmnetSupport.newx())
                        .argument("s", GlmnetSupport.s())
                        .argument("type", DeferredValue.literal("response"))
                        .build());
        registry.registerPredict(MODEL, GlmnetSupport.ENGINE, Modes.CLASSIFICATION, PredictionType.RAW,
                PredictModule.builder()
                        .function(GlmnetSupport.PREDICT)
                        .argument("object", GlmnetSupport.object())
                        .argument("newx", GlmnetSupport.newx())
                        .build());

        hooks.register(MODEL, GlmnetSupport.pathHook());
    }
}
