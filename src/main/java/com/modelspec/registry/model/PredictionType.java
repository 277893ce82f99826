package com.modelspec.registry.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * Kinds of prediction a predict module can produce.
 */
public enum PredictionType {
    CLASS("class", ".pred_class"),
    PROB("prob", ".pred_"),
    NUMERIC("numeric", ".pred"),
    QUANTILE("quantile", ".pred_quantile"),
    CONF_INT("conf_int", ".pred_"),
    PRED_INT("pred_int", ".pred_"),
    RAW("raw", ".pred_raw");

    private final String code;
    private final String columnPrefix;

    PredictionType(String code, String columnPrefix) {
        this.code = code;
        this.columnPrefix = columnPrefix;
    }

    public String getCode() {
        return code;
    }

    /**
     * Name (or name prefix) of the columns holding this prediction in formatted output.
     */
    public String getColumnPrefix() {
        return columnPrefix;
    }

    public static PredictionType fromCode(String code) {
        String needle = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.code.equals(needle))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown prediction type '" + code + "'"));
    }
}
