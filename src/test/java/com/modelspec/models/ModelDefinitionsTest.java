package com.modelspec.models;

import java.util.List;

import com.modelspec.ModelSpecRuntime;
import com.modelspec.exception.DuplicateModelException;
import com.modelspec.registry.ModelRegistry;
import com.modelspec.registry.Modes;
import com.modelspec.registry.model.DataInterface;
import com.modelspec.registry.model.PredictionType;
import com.modelspec.testing.SampleRandForestDefinition;
import com.modelspec.translate.TranslationHooks;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for loading the model definitions.
 */
class ModelDefinitionsTest {

    @Test
    void testDiscoveredDefinitionsComeFromTheClassPath() {
        List<ModelDefinition> discovered = ModelDefinitions.discovered();

        assertThat(discovered).hasSize(1);
        assertThat(discovered.get(0)).isInstanceOf(SampleRandForestDefinition.class);
    }

    @Test
    void testDefaultRuntimeRegistersEverythingAndFreezes() {
        ModelRegistry registry = ModelSpecRuntime.withDefaults().getRegistry();

        assertThat(registry.modelNames())
                .containsExactlyInAnyOrder("linear_reg", "multinom_reg", "mixture_da", "rand_forest");
        assertThat(registry.isFrozen()).isTrue();
        assertThatThrownBy(() -> registry.registerModel("boost_tree"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testLinearRegressionEngines() {
        ModelRegistry registry = new ModelRegistry();
        ModelDefinitions.register(registry, new TranslationHooks(), List.of(new LinearRegDefinition()));

        assertThat(registry.modes(LinearRegDefinition.MODEL)).containsExactly(Modes.REGRESSION);
        assertThat(registry.engines(LinearRegDefinition.MODEL, Modes.REGRESSION))
                .containsExactlyInAnyOrder("lm", "glm", "rlm", "glmnet");
        assertThat(registry.dependencies(LinearRegDefinition.MODEL, "rlm")).containsExactly("MASS");
        assertThat(registry.fitModule(LinearRegDefinition.MODEL, "glmnet", Modes.REGRESSION))
                .hasValueSatisfying(fit -> assertThat(fit.getDataInterface()).isEqualTo(DataInterface.MATRIX));
        assertThat(registry.predictionTypes(LinearRegDefinition.MODEL, "lm", Modes.REGRESSION))
                .containsExactly(PredictionType.NUMERIC);
    }

    @Test
    void testGlmnetRegistersOnlyPenaltyAsSubmodel() {
        ModelRegistry registry = new ModelRegistry();
        TranslationHooks hooks = new TranslationHooks();
        ModelDefinitions.register(registry, hooks, List.of(new MultinomRegDefinition()));

        assertThat(registry.submodelArguments(MultinomRegDefinition.MODEL, "glmnet"))
                .extracting(d -> d.getExposedName())
                .containsExactly("penalty");
        assertThat(registry.tunableArguments(MultinomRegDefinition.MODEL, "glmnet")).hasSize(2);
        assertThat(hooks.hooksFor(MultinomRegDefinition.MODEL)).hasSize(1);
        assertThat(hooks.hooksFor(LinearRegDefinition.MODEL)).isEmpty();
    }

    @Test
    void testRegisteringTwiceFails() {
        ModelRegistry registry = new ModelRegistry();
        ModelDefinitions.register(registry, new TranslationHooks(), List.of(new MixtureDaDefinition()));

        assertThatThrownBy(() -> ModelDefinitions.register(registry, new TranslationHooks(),
                List.of(new MixtureDaDefinition())))
                .isInstanceOf(DuplicateModelException.class);
    }
}
