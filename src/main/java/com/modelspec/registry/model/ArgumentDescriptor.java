package com.modelspec.registry.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Maps one user-facing model argument to the engine's native argument.
 */
@Value
@Builder(toBuilder = true)
public class ArgumentDescriptor {

    /**
     * Name users pass to the model, e.g. "penalty".
     */
    @NonNull
    String exposedName;

    /**
     * Name the engine's fitting function expects, e.g. "lambda".
     */
    @NonNull
    String originalName;

    /**
     * Optional reference to the function that generates tuning values for this argument.
     */
    FunctionRef constructor;

    /**
     * Whether one fit can produce predictions for several values of this argument.
     */
    boolean supportsSubmodel;
}
