package com.modelspec.registry.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Composite key for module lookups within one model.
 */
@Value(staticConstructor = "of")
public class EngineMode {

    @NonNull
    String engine;

    @NonNull
    String mode;

    @Override
    public String toString() {
        return engine + "/" + mode;
    }
}
