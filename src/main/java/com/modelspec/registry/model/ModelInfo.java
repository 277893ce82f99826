package com.modelspec.registry.model;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Read-only snapshot of (part of) a registry entry, as returned by lookups.
 */
@Value
@Builder
public class ModelInfo {

    @NonNull
    String name;

    @NonNull
    @Singular
    List<String> modes;

    /**
     * Engines per mode.
     */
    @NonNull
    @Singular("enginesForMode")
    Map<String, List<String>> engines;

    /**
     * Argument descriptors per engine, in registration order.
     */
    @NonNull
    @Singular("argumentsForEngine")
    Map<String, List<ArgumentDescriptor>> arguments;

    @NonNull
    @Singular("fitModule")
    Map<EngineMode, FitModule> fitModules;

    @NonNull
    @Singular("predictModulesFor")
    Map<EngineMode, Map<PredictionType, PredictModule>> predictModules;

    /**
     * Required packages per engine.
     */
    @NonNull
    @Singular("dependenciesForEngine")
    Map<String, List<String>> dependencies;
}
