package com.modelspec.fit;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelspec.data.DataFrame;
import com.modelspec.data.ExpandedFormula;
import com.modelspec.data.Factor;
import com.modelspec.data.Formula;
import com.modelspec.data.FormulaExpander;
import com.modelspec.exception.InterfaceMismatchException;
import com.modelspec.exception.InvalidOutcomeException;
import com.modelspec.registry.Modes;
import com.modelspec.registry.model.DataInterface;
import com.modelspec.spec.Preprocessing;

import lombok.RequiredArgsConstructor;

/**
 * Converts what the caller passed (formula + data, or x + y) into the data slots the
 * engine's interface declares.
 *
 * <ul>
 *   <li>FORMULA: slots {@code formula} and {@code data}; x/y input gets the synthetic
 *       formula {@code ..y ~ .}</li>
 *   <li>DATA_FRAME: slots {@code x} (frame) and {@code y}</li>
 *   <li>MATRIX: slots {@code x} (numeric matrix) and {@code y}; non-numeric predictors
 *       cannot be coerced</li>
 * </ul>
 */
@RequiredArgsConstructor
public class DataShaper {
    private static final Logger log = LoggerFactory.getLogger(DataShaper.class);

    static final String XY_OUTCOME = "..y";

    private final FormulaExpander formulaExpander;

    public ShapedData fromFormula(Formula formula, DataFrame data, DataInterface target, String mode) {
        ExpandedFormula expanded = formulaExpander.expand(formula, data);
        checkOutcome(expanded.getOutcome(), mode);

        Map<String, Object> slots = new LinkedHashMap<>();
        switch (target) {
            case FORMULA -> {
                slots.put("formula", formula);
                slots.put("data", data);
            }
            case DATA_FRAME -> {
                slots.put("x", expanded.getPredictors());
                slots.put("y", expanded.getOutcome());
            }
            case MATRIX -> {
                slots.put("x", expanded.getPredictors().toMatrix());
                slots.put("y", expanded.getOutcome());
            }
        }

        log.debug("Shaped formula input '{}' for the {} interface", formula, target);
        return ShapedData.builder()
                .slots(slots)
                .outcome(expanded.getOutcome())
                .preproc(preprocessing(target, formula, expanded.getPredictors().names(),
                        expanded.getOutcomeName(), expanded.getOutcome()))
                .build();
    }

    public ShapedData fromXy(DataFrame x, List<?> y, DataInterface target, String mode) {
        if (x.nrow() != y.size()) {
            throw new InterfaceMismatchException("x has " + x.nrow() + " rows but y has " + y.size() + " values");
        }
        checkOutcome(y, mode);

        Map<String, Object> slots = new LinkedHashMap<>();
        Formula formula = null;
        switch (target) {
            case FORMULA -> {
                if (x.hasColumn(XY_OUTCOME)) {
                    throw new InterfaceMismatchException("x cannot contain a column named '" + XY_OUTCOME + "'");
                }
                formula = Formula.allPredictors(XY_OUTCOME);
                slots.put("formula", formula);
                slots.put("data", x.withColumn(XY_OUTCOME, y));
            }
            case DATA_FRAME -> {
                slots.put("x", x);
                slots.put("y", y);
            }
            case MATRIX -> {
                slots.put("x", x.toMatrix());
                slots.put("y", y);
            }
        }

        log.debug("Shaped x/y input ({} rows, {} predictors) for the {} interface", x.nrow(), x.ncol(), target);
        return ShapedData.builder()
                .slots(slots)
                .outcome(y)
                .preproc(preprocessing(target, null, x.names(), XY_OUTCOME, y))
                .build();
    }

    private static Preprocessing preprocessing(DataInterface target, Formula formula, List<String> predictors,
                                               String outcomeName, List<?> outcome) {
        return Preprocessing.builder()
                .engineInterface(target)
                .formula(formula)
                .predictorNames(List.copyOf(predictors))
                .outcomeName(outcomeName)
                .outcomeLevels(outcome instanceof Factor factor ? factor.getLevels() : null)
                .build();
    }

    private static void checkOutcome(List<?> outcome, String mode) {
        if (Modes.CLASSIFICATION.equals(mode) && !(outcome instanceof Factor)) {
            throw new InvalidOutcomeException("For a classification model, the outcome should be a factor.");
        }
        if (Modes.REGRESSION.equals(mode)) {
            boolean numeric = !(outcome instanceof Factor)
                    && outcome.stream().allMatch(v -> v == null || v instanceof Number);
            if (!numeric) {
                throw new InvalidOutcomeException("For a regression model, the outcome should be numeric.");
            }
        }
    }
}
