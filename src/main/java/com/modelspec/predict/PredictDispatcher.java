package com.modelspec.predict;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelspec.data.DataFrame;
import com.modelspec.exception.ArgumentValidationException;
import com.modelspec.exception.FitExecutionException;
import com.modelspec.exception.InterfaceMismatchException;
import com.modelspec.exception.NoSubmodelSupportException;
import com.modelspec.exception.UnsupportedPredictionTypeException;
import com.modelspec.expr.DeferredValue;
import com.modelspec.fit.EngineFunction;
import com.modelspec.fit.FunctionCatalog;
import com.modelspec.registry.ModelRegistry;
import com.modelspec.registry.Modes;
import com.modelspec.registry.model.ArgumentDescriptor;
import com.modelspec.registry.model.PredictModule;
import com.modelspec.registry.model.PredictionType;
import com.modelspec.spec.ModelFit;
import com.modelspec.spec.ModelSpec;
import com.modelspec.util.NamingUtil;

import lombok.RequiredArgsConstructor;

/**
 * Produces predictions from a fitted model through the predict modules its engine
 * registered.
 *
 * Predict module arguments are resolved against three bindings: {@code object} (the
 * engine's fitted object), {@code new_data} (the new data after the module's
 * {@code pre} hook) and {@code model_fit} (the {@link ModelFit} itself).
 */
@RequiredArgsConstructor
public class PredictDispatcher {
    private static final Logger log = LoggerFactory.getLogger(PredictDispatcher.class);

    public static final String NESTED_COLUMN = ".pred";

    private final ModelRegistry registry;
    private final FunctionCatalog catalog;

    /**
     * Predicts with the mode's default type: {@code class} for classification,
     * {@code numeric} otherwise.
     */
    public DataFrame predict(ModelFit fit, DataFrame newData) {
        return predict(fit, newData, defaultType(fit.getSpec()));
    }

    /**
     * Predicts and formats the result as a frame with one row per row of {@code newData}.
     */
    public DataFrame predict(ModelFit fit, DataFrame newData, PredictionType type) {
        return PredictionFormatter.format(predictRaw(fit, newData, type), type);
    }

    /**
     * Predicts and returns the canonical value for the type without formatting: a
     * {@link com.modelspec.data.Factor} for {@code class}, a frame with one column per level
     * for {@code prob}, a list of doubles for {@code numeric}, the engine output otherwise.
     */
    public Object predictRaw(ModelFit fit, DataFrame newData, PredictionType type) {
        if (fit.isFailed()) {
            throw new FitExecutionException("Cannot predict from a model that failed to fit: "
                    + fit.getError().getMessage(), fit.getError());
        }
        ModelSpec spec = fit.getSpec();
        PredictModule module = predictModule(spec, type);

        DataFrame restricted = restrictToPredictors(fit, newData);
        Object prepared = module.getPre() == null ? restricted : module.getPre().apply(restricted, fit);

        Map<String, Object> bindings = new LinkedHashMap<>();
        bindings.put("object", fit.getFit());
        bindings.put("new_data", prepared);
        bindings.put("model_fit", fit);

        Map<String, Object> arguments = new LinkedHashMap<>();
        module.getArgs().forEach((name, value) -> {
            Object resolved = value.resolve(bindings);
            if (resolved != null) {
                arguments.put(name, resolved);
            }
        });

        EngineFunction function = catalog.require(module.getFunction());
        log.debug("Predicting {} for {} ({}) with {}", type.getCode(), spec.getModelName(), spec.getEngine(),
                module.getFunction());
        Object raw;
        try {
            raw = function.invoke(arguments);
        } catch (Exception e) {
            throw new FitExecutionException("Engine '" + spec.getEngine() + "' failed to predict " + type.getCode()
                    + " for model '" + spec.getModelName() + "': " + e.getMessage(), e);
        }

        Object output = module.getPost() == null ? raw : module.getPost().apply(raw, fit);
        List<String> levels = fit.getPreproc() == null ? null : fit.getPreproc().getOutcomeLevels();
        return PredictionCanonicalizer.canonicalize(output, type, levels, newData.nrow());
    }

    /**
     * Predicts once per combination of submodel parameter values. The result has one row
     * per row of {@code newData} and a single {@value #NESTED_COLUMN} column holding a frame
     * with one row per combination: the prediction columns plus one column per varying
     * parameter.
     *
     * @param varying exposed submodel argument names to the values to predict at; empty to
     *        use the values set on the specification
     */
    public DataFrame multiPredict(ModelFit fit, DataFrame newData, Map<String, ? extends List<?>> varying,
                                  PredictionType type) {
        ModelSpec spec = fit.getSpec();
        List<String> submodelArgs = multiPredictArgs(fit);
        if (submodelArgs.isEmpty()) {
            throw new NoSubmodelSupportException("Engine '" + spec.getEngine() + "' of model '" + spec.getModelName()
                    + "' cannot predict several submodels at once");
        }

        Map<String, List<?>> grid = varying.isEmpty() ? currentValues(spec, submodelArgs) : new LinkedHashMap<>(varying);
        for (String name : grid.keySet()) {
            if (!submodelArgs.contains(name)) {
                throw new ArgumentValidationException(name, "'" + name + "' cannot be varied in multi_predict; "
                        + "submodel arguments are " + submodelArgs + "." + NamingUtil.didYouMean(name, submodelArgs));
            }
            if (grid.get(name).isEmpty()) {
                throw new ArgumentValidationException(name, "At least one value of '" + name
                        + "' is needed for multi_predict");
            }
        }

        List<DataFrame> perCombination = new ArrayList<>();
        for (Map<String, Object> combination : combinations(grid)) {
            Map<String, DeferredValue> args = new LinkedHashMap<>(spec.getArgs());
            combination.forEach((name, value) -> args.put(name, DeferredValue.literal(value)));
            ModelFit submodel = fit.toBuilder()
                    .spec(spec.toBuilder().clearArgs().args(args).build())
                    .build();

            DataFrame predictions = predict(submodel, newData, type);
            for (Map.Entry<String, Object> e : combination.entrySet()) {
                predictions = predictions.withColumn(e.getKey(),
                        Collections.nCopies(predictions.nrow(), e.getValue()));
            }
            perCombination.add(predictions);
        }
        log.debug("Predicted {} submodel combinations of {} for {} rows", perCombination.size(),
                grid.keySet(), newData.nrow());

        List<DataFrame> nested = new ArrayList<>(newData.nrow());
        for (int row = 0; row < newData.nrow(); row++) {
            List<DataFrame> rows = new ArrayList<>(perCombination.size());
            for (DataFrame predictions : perCombination) {
                rows.add(predictions.slice(List.of(row)));
            }
            nested.add(DataFrame.bindRows(rows));
        }
        return DataFrame.builder().column(NESTED_COLUMN, nested).build();
    }

    public DataFrame multiPredict(ModelFit fit, DataFrame newData, Map<String, ? extends List<?>> varying) {
        return multiPredict(fit, newData, varying, defaultType(fit.getSpec()));
    }

    public boolean hasMultiPredict(ModelFit fit) {
        return !multiPredictArgs(fit).isEmpty();
    }

    /**
     * Exposed names of the arguments that can vary in {@link #multiPredict}.
     */
    public List<String> multiPredictArgs(ModelFit fit) {
        ModelSpec spec = fit.getSpec();
        return registry.submodelArguments(spec.getModelName(), spec.getEngine()).stream()
                .map(ArgumentDescriptor::getExposedName)
                .toList();
    }

    private PredictModule predictModule(ModelSpec spec, PredictionType type) {
        Map<PredictionType, PredictModule> modules = spec.isTranslated()
                ? spec.getMethod().getPredictModules()
                : registry.predictModules(spec.getModelName(), spec.getEngine(), spec.getMode());
        PredictModule module = modules.get(type);
        if (module == null) {
            throw new UnsupportedPredictionTypeException("Prediction type '" + type.getCode() + "' is not available for model '"
                    + spec.getModelName() + "' with engine '" + spec.getEngine() + "'. Available types: "
                    + modules.keySet().stream().map(PredictionType::getCode).toList());
        }
        return module;
    }

    private static DataFrame restrictToPredictors(ModelFit fit, DataFrame newData) {
        if (fit.getPreproc() == null) {
            return newData;
        }
        List<String> predictors = fit.getPreproc().getPredictorNames();
        List<String> missing = predictors.stream().filter(p -> !newData.hasColumn(p)).toList();
        if (!missing.isEmpty()) {
            throw new InterfaceMismatchException("New data is missing predictor columns " + missing);
        }
        return newData.select(predictors);
    }

    private static Map<String, List<?>> currentValues(ModelSpec spec, List<String> submodelArgs) {
        Map<String, List<?>> grid = new LinkedHashMap<>();
        for (String name : submodelArgs) {
            spec.getArg(name).ifPresent(value -> {
                Object resolved = value.resolve();
                grid.put(name, resolved instanceof List<?> list ? list : List.of(resolved));
            });
        }
        if (grid.isEmpty()) {
            throw new ArgumentValidationException(submodelArgs.get(0), "No values given for " + submodelArgs
                    + " and none are set on the specification");
        }
        return grid;
    }

    /**
     * Cartesian product of the grid, first parameter varying slowest.
     */
    private static List<Map<String, Object>> combinations(Map<String, List<?>> grid) {
        List<Map<String, Object>> result = new ArrayList<>();
        result.add(new LinkedHashMap<>());
        for (Map.Entry<String, List<?>> e : grid.entrySet()) {
            List<Map<String, Object>> expanded = new ArrayList<>();
            for (Map<String, Object> partial : result) {
                for (Object value : e.getValue()) {
                    Map<String, Object> next = new LinkedHashMap<>(partial);
                    next.put(e.getKey(), value);
                    expanded.add(next);
                }
            }
            result = expanded;
        }
        return result;
    }

    private static PredictionType defaultType(ModelSpec spec) {
        return Modes.CLASSIFICATION.equals(spec.getMode()) ? PredictionType.CLASS : PredictionType.NUMERIC;
    }
}
