package com.modelspec.predict;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.modelspec.ModelSpecRuntime;
import com.modelspec.data.DataFrame;
import com.modelspec.data.Factor;
import com.modelspec.data.Formula;
import com.modelspec.exception.ArgumentValidationException;
import com.modelspec.exception.FitExecutionException;
import com.modelspec.exception.InterfaceMismatchException;
import com.modelspec.exception.NoSubmodelSupportException;
import com.modelspec.exception.PredictionShapeException;
import com.modelspec.exception.UnsupportedPredictionTypeException;
import com.modelspec.expr.DeferredValue;
import com.modelspec.fit.FitDispatcher;
import com.modelspec.fit.FunctionCatalog;
import com.modelspec.models.LinearRegDefinition;
import com.modelspec.models.MixtureDaDefinition;
import com.modelspec.models.MultinomRegDefinition;
import com.modelspec.registry.model.FunctionRef;
import com.modelspec.registry.model.PredictionType;
import com.modelspec.spec.ModelFit;
import com.modelspec.spec.ModelSpec;
import com.modelspec.spec.ModelSpecFactory;
import com.modelspec.testing.FakeEngines;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link PredictDispatcher}, mostly against multinomial regression fitted
 * with glmnet.
 */
class PredictDispatcherTest {

    private static final List<Double> LAMBDAS = List.of(0.01, 0.1);

    private FakeEngines engines;
    private ModelSpecFactory specs;
    private FitDispatcher fitter;
    private PredictDispatcher predictor;

    @BeforeEach
    void setUp() {
        engines = new FakeEngines();
        ModelSpecRuntime runtime = ModelSpecRuntime.withDefaults(engines.catalog());
        specs = runtime.getSpecs();
        fitter = runtime.getFitDispatcher();
        predictor = runtime.getPredictDispatcher();
    }

    private ModelFit fitMultinom(Object penalty) {
        ModelSpec spec = specs.setEngine(specs.create(MultinomRegDefinition.MODEL, Map.of("penalty", penalty)), "glmnet");
        return fitter.fitXy(spec, FakeEngines.predictors(), FakeEngines.species());
    }

    private Object predictDirectly(ModelFit fit, DataFrame newData, Object s, String type) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("object", fit.getFit());
        args.put("newx", newData.toMatrix());
        args.put("s", s);
        args.put("type", type);
        return engines.predictGlmnet(args);
    }

    private static DataFrame nested(DataFrame result, int row) {
        return (DataFrame) result.column(PredictDispatcher.NESTED_COLUMN).get(row);
    }

    @Test
    void testClassPredictionMatchesEngine() {
        ModelFit fit = fitMultinom(0.1);
        DataFrame newData = FakeEngines.predictors();

        DataFrame predictions = predictor.predict(fit, newData, PredictionType.CLASS);

        String[][] direct = (String[][]) predictDirectly(fit, newData, 0.1, "class");
        List<String> expected = new ArrayList<>();
        for (String[] row : direct) {
            expected.add(row[0]);
        }
        assertThat(predictions.names()).containsExactly(".pred_class");
        assertThat(predictions.nrow()).isEqualTo(newData.nrow());
        assertThat(List.copyOf(predictions.column(".pred_class"))).isEqualTo(expected);
        assertThat(List.copyOf(predictions.column(".pred_class"))).isEqualTo(List.copyOf(FakeEngines.species()));
        assertThat(((Factor) predictions.column(".pred_class")).getLevels()).isEqualTo(FakeEngines.SPECIES);
        assertThat(engines.predictCalls().get(engines.predictCalls().size() - 2)).containsEntry("s", 0.1);
    }

    @Test
    void testDefaultTypeForClassificationIsClass() {
        ModelFit fit = fitMultinom(0.1);

        assertThat(predictor.predict(fit, FakeEngines.predictors()).names()).containsExactly(".pred_class");
    }

    @Test
    void testProbabilityColumnsFollowTheOutcomeLevels() {
        ModelFit fit = fitMultinom(0.1);
        DataFrame newData = FakeEngines.predictors().slice(List.of(0, 2, 4));

        DataFrame predictions = predictor.predict(fit, newData, PredictionType.PROB);

        assertThat(predictions.names()).containsExactly(".pred_setosa", ".pred_versicolor", ".pred_virginica");
        assertThat(predictions.nrow()).isEqualTo(3);
        double[][][] direct = (double[][][]) predictDirectly(fit, newData, 0.1, "response");
        for (int i = 0; i < 3; i++) {
            double total = 0;
            for (int k = 0; k < FakeEngines.SPECIES.size(); k++) {
                double p = ((Number) predictions.column(".pred_" + FakeEngines.SPECIES.get(k)).get(i)).doubleValue();
                assertThat(p).isCloseTo(direct[i][k][0], within(1e-12));
                total += p;
            }
            assertThat(total).isCloseTo(1.0, within(1e-9));
        }
    }

    @Test
    void testSeveralPenaltiesCannotPredictDirectly() {
        ModelFit fit = fitMultinom(LAMBDAS);

        assertThatThrownBy(() -> predictor.predict(fit, FakeEngines.predictors(), PredictionType.CLASS))
                .isInstanceOf(ArgumentValidationException.class)
                .hasMessageContaining("multi_predict");
        assertThatThrownBy(() -> predictor.predict(fit, FakeEngines.predictors(), PredictionType.PROB))
                .isInstanceOf(ArgumentValidationException.class)
                .hasMessageContaining("single number");
    }

    @Test
    void testMultiPredictProbabilities() {
        ModelFit fit = fitMultinom(LAMBDAS);
        DataFrame newData = FakeEngines.predictors().slice(List.of(1, 3, 5));

        DataFrame result = predictor.multiPredict(fit, newData, Map.of("penalty", LAMBDAS), PredictionType.PROB);

        assertThat(result.names()).containsExactly(".pred");
        assertThat(result.nrow()).isEqualTo(3);
        double[][][] direct = (double[][][]) predictDirectly(fit, newData, LAMBDAS, "response");
        for (int i = 0; i < 3; i++) {
            DataFrame row = nested(result, i);
            assertThat(row.names())
                    .containsExactly(".pred_setosa", ".pred_versicolor", ".pred_virginica", "penalty");
            assertThat(List.copyOf(row.column("penalty"))).isEqualTo(LAMBDAS);
            for (int m = 0; m < LAMBDAS.size(); m++) {
                for (int k = 0; k < FakeEngines.SPECIES.size(); k++) {
                    double p = ((Number) row.column(".pred_" + FakeEngines.SPECIES.get(k)).get(m)).doubleValue();
                    assertThat(p).isCloseTo(direct[i][k][m], within(1e-12));
                }
            }
        }
    }

    @Test
    void testMultiPredictDefaultsToClass() {
        ModelFit fit = fitMultinom(LAMBDAS);

        DataFrame result = predictor.multiPredict(fit, FakeEngines.predictors(), Map.of("penalty", LAMBDAS));

        DataFrame first = nested(result, 0);
        assertThat(first.names()).containsExactly(".pred_class", "penalty");
        assertThat(List.copyOf(first.column(".pred_class"))).isEqualTo(List.of("setosa", "setosa"));
    }

    @Test
    void testMultiPredictUsesTheFittedPenaltiesByDefault() {
        ModelFit fit = fitMultinom(LAMBDAS);

        DataFrame result = predictor.multiPredict(fit, FakeEngines.predictors(), Map.of(), PredictionType.PROB);

        assertThat(result.nrow()).isEqualTo(6);
        assertThat(List.copyOf(nested(result, 5).column("penalty"))).isEqualTo(LAMBDAS);
    }

    @Test
    void testArgumentsComputedFromTrainingDataStillPredict() {
        ModelSpec spec = specs.setEngine(specs.create(MultinomRegDefinition.MODEL,
                Map.of("penalty", 0.1, "mixture", DeferredValue.expression("1 / ncol(x)"))), "glmnet");
        ModelFit fit = fitter.fitXy(spec, FakeEngines.predictors(), FakeEngines.species());

        DataFrame classes = predictor.predict(fit, FakeEngines.predictors(), PredictionType.CLASS);
        DataFrame nestedProbabilities = predictor.multiPredict(fit, FakeEngines.predictors(),
                Map.of("penalty", LAMBDAS), PredictionType.PROB);

        assertThat(List.copyOf(classes.column(".pred_class"))).isEqualTo(List.copyOf(FakeEngines.species()));
        assertThat(nested(nestedProbabilities, 0).nrow()).isEqualTo(2);
    }

    @Test
    void testMultiPredictNeedsAtLeastOneValue() {
        ModelFit fit = fitMultinom(LAMBDAS);

        assertThatThrownBy(() -> predictor.multiPredict(fit, FakeEngines.predictors(), Map.of("penalty", List.of())))
                .isInstanceOf(ArgumentValidationException.class)
                .hasMessage("At least one value of 'penalty' is needed for multi_predict");
    }

    @Test
    void testMultiPredictSuggestsTheArgumentName() {
        ModelFit fit = fitMultinom(LAMBDAS);

        assertThatThrownBy(() -> predictor.multiPredict(fit, FakeEngines.predictors(), Map.of("penalt", LAMBDAS)))
                .isInstanceOf(ArgumentValidationException.class)
                .hasMessageContaining("Did you mean 'penalty'?");
    }

    @Test
    void testSubmodelArguments() {
        ModelFit fit = fitMultinom(0.1);

        assertThat(predictor.hasMultiPredict(fit)).isTrue();
        assertThat(predictor.multiPredictArgs(fit)).isEqualTo(List.of("penalty"));
    }

    @Test
    void testEngineWithoutSubmodels() {
        ModelSpec spec = specs.setEngine(specs.create(MixtureDaDefinition.MODEL), "mda");
        ModelFit fit = fitter.fit(spec, Formula.parse("Species ~ ."), FakeEngines.flowers());

        assertThat(predictor.hasMultiPredict(fit)).isFalse();
        assertThatThrownBy(() -> predictor.multiPredict(fit, FakeEngines.flowers(), Map.of()))
                .isInstanceOf(NoSubmodelSupportException.class);
    }

    @Test
    void testFormulaFitPredictsFromFullData() {
        ModelSpec spec = specs.setEngine(specs.create(MixtureDaDefinition.MODEL), "mda");
        ModelFit fit = fitter.fit(spec, Formula.parse("Species ~ ."), FakeEngines.flowers());

        DataFrame classes = predictor.predict(fit, FakeEngines.flowers());
        DataFrame probabilities = predictor.predict(fit, FakeEngines.flowers(), PredictionType.PROB);

        assertThat(List.copyOf(classes.column(".pred_class"))).isEqualTo(List.copyOf(FakeEngines.species()));
        assertThat(probabilities.names()).containsExactly(".pred_setosa", ".pred_versicolor", ".pred_virginica");
        assertThat(engines.predictCalls().get(0).get("newdata"))
                .isEqualTo(FakeEngines.predictors());
    }

    @Test
    void testUnsupportedType() {
        ModelFit fit = fitMultinom(0.1);

        assertThatThrownBy(() -> predictor.predict(fit, FakeEngines.predictors(), PredictionType.NUMERIC))
                .isInstanceOf(UnsupportedPredictionTypeException.class)
                .hasMessageContaining("[class, prob, raw]");
    }

    @Test
    void testRawPredictionIsPassedThrough() {
        ModelFit fit = fitMultinom(0.1);

        Object raw = predictor.predictRaw(fit, FakeEngines.predictors(), PredictionType.RAW);

        assertThat(raw).isInstanceOf(double[][][].class);
        assertThat(((double[][][]) raw)).hasNumberOfRows(6);
    }

    @Test
    void testFailedFitCannotPredict() {
        ModelSpec spec = specs.setEngine(specs.create(MultinomRegDefinition.MODEL, Map.of("penalty", 0.1)), "glmnet");
        ModelFit failed = ModelFit.failure(spec, new FitExecutionException("did not converge"));

        assertThatThrownBy(() -> predictor.predict(failed, FakeEngines.predictors()))
                .isInstanceOf(FitExecutionException.class)
                .hasMessageContaining("did not converge");
    }

    @Test
    void testMissingPredictorColumn() {
        ModelFit fit = fitMultinom(0.1);

        assertThatThrownBy(() -> predictor.predict(fit, FakeEngines.predictors().without("Petal.Width")))
                .isInstanceOf(InterfaceMismatchException.class)
                .hasMessage("New data is missing predictor columns [Petal.Width]");
    }

    @Test
    void testNumericPredictions() {
        ModelSpec lm = specs.setEngine(specs.create(LinearRegDefinition.MODEL), "lm");
        ModelFit lmFit = fitter.fit(lm, Formula.parse("Sepal.Length ~ Petal.Length"), FakeEngines.flowers());
        ModelSpec glmnet = specs.setEngine(specs.create(LinearRegDefinition.MODEL, Map.of("penalty", 1.0)), "glmnet");
        ModelFit glmnetFit = fitter.fitXy(glmnet, FakeEngines.predictors().without("Sepal.Length"),
                FakeEngines.flowers().column("Sepal.Length"));

        DataFrame fromLm = predictor.predict(lmFit, FakeEngines.flowers());
        DataFrame fromGlmnet = predictor.predict(glmnetFit, FakeEngines.flowers(), PredictionType.NUMERIC);

        assertThat(fromLm.names()).containsExactly(".pred");
        assertThat(((Number) fromLm.column(".pred").get(0)).doubleValue()).isCloseTo(35.5 / 6, within(1e-9));
        assertThat(((Number) fromGlmnet.column(".pred").get(3)).doubleValue()).isCloseTo(35.5 / 12, within(1e-9));
    }

    @Test
    void testWrongNumberOfRowsIsRejected() {
        FunctionCatalog catalog = engines.catalog()
                .register(FunctionRef.of("stats", "predict"), args -> List.of(1.0));
        ModelSpecRuntime runtime = ModelSpecRuntime.withDefaults(catalog);
        ModelSpec spec = runtime.getSpecs().setEngine(runtime.getSpecs().create(LinearRegDefinition.MODEL), "lm");
        ModelFit fit = runtime.getFitDispatcher().fit(spec, Formula.parse("Sepal.Length ~ ."), FakeEngines.predictors());

        assertThatThrownBy(() -> runtime.getPredictDispatcher().predict(fit, FakeEngines.predictors()))
                .isInstanceOf(PredictionShapeException.class)
                .hasMessage("Prediction of type 'numeric' returned 1 rows for 6 rows of new data");
    }

    @Test
    void testEngineFailureDuringPrediction() {
        FunctionCatalog catalog = engines.catalog()
                .register(FunctionRef.of("stats", "predict"), args -> {
                    throw new IllegalArgumentException("singular fit");
                });
        ModelSpecRuntime runtime = ModelSpecRuntime.withDefaults(catalog);
        ModelSpec spec = runtime.getSpecs().setEngine(runtime.getSpecs().create(LinearRegDefinition.MODEL), "lm");
        ModelFit fit = runtime.getFitDispatcher().fit(spec, Formula.parse("Sepal.Length ~ ."), FakeEngines.predictors());

        assertThatThrownBy(() -> runtime.getPredictDispatcher().predict(fit, FakeEngines.predictors()))
                .isInstanceOf(FitExecutionException.class)
                .hasMessageContaining("singular fit")
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }
}
