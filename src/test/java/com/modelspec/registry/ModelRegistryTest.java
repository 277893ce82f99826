package com.modelspec.registry;

import java.util.List;

import com.modelspec.exception.DuplicateArgumentException;
import com.modelspec.exception.DuplicateModelException;
import com.modelspec.exception.InvalidModeException;
import com.modelspec.exception.ProtectedArgumentException;
import com.modelspec.exception.UnknownEngineException;
import com.modelspec.exception.UnknownModelException;
import com.modelspec.exception.UnsupportedCombinationException;
import com.modelspec.expr.DeferredValue;
import com.modelspec.registry.model.ArgumentDescriptor;
import com.modelspec.registry.model.DataInterface;
import com.modelspec.registry.model.EngineMode;
import com.modelspec.registry.model.FitModule;
import com.modelspec.registry.model.FunctionRef;
import com.modelspec.registry.model.ModelInfo;
import com.modelspec.registry.model.PredictModule;
import com.modelspec.registry.model.PredictionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ModelRegistry registration rules and lookups.
 */
class ModelRegistryTest {

    private ModelRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ModelRegistry();
        registry.registerModel("boost_tree");
        registry.registerMode("boost_tree", Modes.CLASSIFICATION);
        registry.registerMode("boost_tree", Modes.REGRESSION);
        registry.registerEngine("boost_tree", Modes.CLASSIFICATION, "xgboost");
        registry.registerEngine("boost_tree", Modes.REGRESSION, "xgboost");
        registry.registerEngine("boost_tree", Modes.CLASSIFICATION, "C5.0");
    }

    private static FitModule xgboostFit() {
        return FitModule.builder()
                .dataInterface(DataInterface.MATRIX)
                .protectedArgument("x")
                .protectedArgument("y")
                .function(FunctionRef.of("xgboost", "xgb.train"))
                .defaultArgument("nthread", DeferredValue.literal(1))
                .dataArgument("x", "data")
                .build();
    }

    @Test
    void testDuplicateModelIsRejected() {
        assertThatThrownBy(() -> registry.registerModel("boost_tree"))
                .isInstanceOf(DuplicateModelException.class);
    }

    @Test
    void testModeRequiresModel() {
        assertThatThrownBy(() -> registry.registerMode("svm_rbf", Modes.REGRESSION))
                .isInstanceOf(UnknownModelException.class);
    }

    @Test
    void testUnknownModeIsImplicit() {
        assertThatThrownBy(() -> registry.registerMode("boost_tree", Modes.UNKNOWN))
                .isInstanceOf(InvalidModeException.class);
        assertThat(registry.modes("boost_tree")).containsExactly(Modes.CLASSIFICATION, Modes.REGRESSION);
    }

    @Test
    void testRegistrationIsIdempotentForModesAndEngines() {
        registry.registerMode("boost_tree", Modes.REGRESSION);
        registry.registerEngine("boost_tree", Modes.REGRESSION, "xgboost");

        assertThat(registry.modes("boost_tree")).hasSize(2);
        assertThat(registry.engines("boost_tree", Modes.REGRESSION)).containsExactly("xgboost");
    }

    @Test
    void testEngineRequiresRegisteredMode() {
        assertThatThrownBy(() -> registry.registerEngine("boost_tree", Modes.CENSORED_REGRESSION, "mboost"))
                .isInstanceOf(InvalidModeException.class);
    }

    @Test
    void testUnknownModeListsEnginesOfEveryMode() {
        assertThat(registry.engines("boost_tree", Modes.UNKNOWN)).containsExactly("xgboost", "C5.0");
        assertThat(registry.hasEngine("boost_tree", Modes.UNKNOWN, "C5.0")).isTrue();
        assertThat(registry.hasEngine("boost_tree", Modes.REGRESSION, "C5.0")).isFalse();
    }

    @Test
    void testArgumentRequiresEngineUnderSomeMode() {
        assertThatThrownBy(() -> registry.registerArgument("boost_tree", "lightgbm", "trees", "num_iterations", null, false))
                .isInstanceOf(UnknownEngineException.class);
    }

    @Test
    void testDuplicateArgumentIsRejectedWithoutDuplicatingLookups() {
        registry.registerArgument("boost_tree", "xgboost", "trees", "nrounds", FunctionRef.of("dials", "trees"), true);

        assertThatThrownBy(() -> registry.registerArgument("boost_tree", "xgboost", "trees", "nrounds", null, true))
                .isInstanceOf(DuplicateArgumentException.class);
        assertThat(registry.arguments("boost_tree", "xgboost")).hasSize(1);
    }

    @Test
    void testSubmodelAndTunableArguments() {
        registry.registerArgument("boost_tree", "xgboost", "trees", "nrounds", FunctionRef.of("dials", "trees"), true);
        registry.registerArgument("boost_tree", "xgboost", "learn_rate", "eta", FunctionRef.of("dials", "learn_rate"), false);
        registry.registerArgument("boost_tree", "xgboost", "stop_iter", "early_stop", null, false);

        assertThat(registry.submodelArguments("boost_tree", "xgboost"))
                .extracting(ArgumentDescriptor::getExposedName)
                .containsExactly("trees");
        assertThat(registry.tunableArguments("boost_tree", "xgboost"))
                .extracting(ArgumentDescriptor::getExposedName)
                .containsExactly("trees", "learn_rate");
        assertThat(registry.exposedArgumentNames("boost_tree")).containsExactly("trees", "learn_rate", "stop_iter");
    }

    @Test
    void testFitRequiresRegisteredCombination() {
        assertThatThrownBy(() -> registry.registerFit("boost_tree", "C5.0", Modes.REGRESSION, xgboostFit()))
                .isInstanceOf(UnsupportedCombinationException.class);
    }

    @Test
    void testFitDefaultsMustNotSetProtectedArguments() {
        FitModule bad = xgboostFit().toBuilder().defaultArgument("x", DeferredValue.literal("oops")).build();

        assertThatThrownBy(() -> registry.registerFit("boost_tree", "xgboost", Modes.REGRESSION, bad))
                .isInstanceOf(ProtectedArgumentException.class)
                .hasMessageContaining("x");
    }

    @Test
    void testSecondFitModuleForSameCombinationIsRejected() {
        registry.registerFit("boost_tree", "xgboost", Modes.REGRESSION, xgboostFit());

        assertThatThrownBy(() -> registry.registerFit("boost_tree", "xgboost", Modes.REGRESSION, xgboostFit()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testSeveralPredictTypesPerCombination() {
        PredictModule predict = PredictModule.builder()
                .function(FunctionRef.of("stats", "predict"))
                .argument("object", DeferredValue.expression("object"))
                .build();
        registry.registerPredict("boost_tree", "xgboost", Modes.CLASSIFICATION, PredictionType.CLASS, predict);
        registry.registerPredict("boost_tree", "xgboost", Modes.CLASSIFICATION, PredictionType.PROB, predict);

        assertThat(registry.predictionTypes("boost_tree", "xgboost", Modes.CLASSIFICATION))
                .containsExactly(PredictionType.CLASS, PredictionType.PROB);
        assertThat(registry.predictModule("boost_tree", "xgboost", Modes.REGRESSION, PredictionType.CLASS)).isEmpty();
        assertThatThrownBy(() -> registry.registerPredict("boost_tree", "xgboost", Modes.CLASSIFICATION,
                PredictionType.CLASS, predict))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testLookupReturnsWhatWasRegistered() {
        FitModule fit = xgboostFit();
        registry.registerFit("boost_tree", "xgboost", Modes.REGRESSION, fit);
        registry.registerArgument("boost_tree", "xgboost", "trees", "nrounds", null, true);
        registry.registerDependency("boost_tree", "xgboost", "xgboost");

        ModelInfo info = registry.lookup("boost_tree", Modes.REGRESSION, "xgboost");

        assertThat(info.getName()).isEqualTo("boost_tree");
        assertThat(info.getModes()).containsExactly(Modes.REGRESSION);
        assertThat(info.getEngines()).containsOnlyKeys(Modes.REGRESSION);
        assertThat(info.getFitModules().get(EngineMode.of("xgboost", Modes.REGRESSION))).isEqualTo(fit);
        assertThat(info.getArguments().get("xgboost")).extracting(ArgumentDescriptor::getOriginalName)
                .containsExactly("nrounds");
        assertThat(info.getDependencies().get("xgboost")).containsExactly("xgboost");
        assertThat(registry.fitModule("boost_tree", "xgboost", Modes.REGRESSION)).contains(fit);
    }

    @Test
    void testUnfilteredLookupCoversEveryMode() {
        ModelInfo info = registry.lookup("boost_tree");

        assertThat(info.getModes()).containsExactly(Modes.CLASSIFICATION, Modes.REGRESSION);
        assertThat(info.getEngines().get(Modes.CLASSIFICATION)).containsExactly("xgboost", "C5.0");
        assertThatThrownBy(() -> registry.lookup("boost_tree", null, "ranger"))
                .isInstanceOf(UnknownEngineException.class);
    }

    @Test
    void testFrozenRegistryRejectsRegistrationButAnswersQueries() {
        registry.freeze();
        registry.freeze();

        assertThat(registry.isFrozen()).isTrue();
        assertThat(registry.modelNames()).isEqualTo(List.of("boost_tree"));
        assertThatThrownBy(() -> registry.registerModel("svm_rbf"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("frozen");
    }
}
