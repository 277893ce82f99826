package com.modelspec.registry.model;

/**
 * Data shape an engine's fitting function expects.
 */
public enum DataInterface {

    /** A formula plus a data frame: slots {@code formula} and {@code data}. */
    FORMULA,

    /** Predictors as a data frame and an outcome vector: slots {@code x} and {@code y}. */
    DATA_FRAME,

    /** Predictors as a numeric matrix and an outcome vector: slots {@code x} and {@code y}. */
    MATRIX
}
