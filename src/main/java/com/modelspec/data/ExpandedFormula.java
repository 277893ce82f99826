package com.modelspec.data;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Result of expanding a formula against a data frame.
 */
@Value
@Builder
public class ExpandedFormula {

    @NonNull
    DataFrame predictors;

    @NonNull
    String outcomeName;

    @NonNull
    List<?> outcome;
}
