package com.modelspec.fit;

import java.util.Map;

import com.modelspec.spec.Preprocessing;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Training data in the shape a fit module declared, keyed by data slot name.
 */
@Value
@Builder
public class ShapedData {

    @NonNull
    Map<String, Object> slots;

    @NonNull
    Preprocessing preproc;

    @NonNull
    Object outcome;
}
