package com.modelspec.data;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelspec.exception.InterfaceMismatchException;

/**
 * Expander for formulas made of plain column names and {@code .}.
 */
public class SimpleFormulaExpander implements FormulaExpander {
    private static final Logger log = LoggerFactory.getLogger(SimpleFormulaExpander.class);

    @Override
    public ExpandedFormula expand(Formula formula, DataFrame data) {
        String outcome = formula.getOutcome();
        if (!data.hasColumn(outcome)) {
            throw new InterfaceMismatchException("Outcome column '" + outcome + "' not found in data");
        }

        List<String> predictors = new ArrayList<>();
        for (String term : formula.getTerms()) {
            if (term.equals(".")) {
                for (String name : data.names()) {
                    if (!name.equals(outcome) && !predictors.contains(name)) {
                        predictors.add(name);
                    }
                }
            } else if (data.hasColumn(term)) {
                if (!predictors.contains(term)) {
                    predictors.add(term);
                }
            } else {
                throw new InterfaceMismatchException("Formula term '" + term + "' is not a column of the data");
            }
        }

        log.debug("Expanded formula '{}' to predictors {}", formula, predictors);
        return ExpandedFormula.builder()
                .predictors(data.select(predictors))
                .outcomeName(outcome)
                .outcome(data.column(outcome))
                .build();
    }
}
