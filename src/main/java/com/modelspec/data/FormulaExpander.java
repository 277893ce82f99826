package com.modelspec.data;

/**
 * Expands a model formula against a data table into predictors and outcome.
 *
 * Full formula algebra (interactions, transformations, dummy encoding) lives outside this
 * library; implementations can be plugged into the fit dispatcher.
 */
public interface FormulaExpander {

    ExpandedFormula expand(Formula formula, DataFrame data);
}
