package com.modelspec.registry;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.modelspec.registry.model.ArgumentDescriptor;
import com.modelspec.registry.model.EngineMode;
import com.modelspec.registry.model.FitModule;
import com.modelspec.registry.model.PredictModule;
import com.modelspec.registry.model.PredictionType;

/**
 * Mutable registry state for one model. Only {@link ModelRegistry} touches it, under its lock.
 */
final class ModelEntry {

    final String name;
    final Set<String> modes = new LinkedHashSet<>();
    final Map<String, Set<String>> engines = new LinkedHashMap<>();
    final Map<String, List<ArgumentDescriptor>> arguments = new LinkedHashMap<>();
    final Map<EngineMode, FitModule> fitModules = new LinkedHashMap<>();
    final Map<EngineMode, Map<PredictionType, PredictModule>> predictModules = new LinkedHashMap<>();
    final Map<String, Set<String>> dependencies = new LinkedHashMap<>();

    ModelEntry(String name) {
        this.name = name;
    }

    boolean hasEngine(String engine) {
        return engines.values().stream().anyMatch(set -> set.contains(engine));
    }

    boolean hasEngine(String mode, String engine) {
        Set<String> set = engines.get(mode);
        return set != null && set.contains(engine);
    }

    /**
     * Distinct engines over all modes, in registration order.
     */
    List<String> allEngines() {
        Set<String> all = new LinkedHashSet<>();
        engines.values().forEach(all::addAll);
        return new ArrayList<>(all);
    }

    Map<PredictionType, PredictModule> predictModulesFor(EngineMode key) {
        return predictModules.computeIfAbsent(key, k -> new EnumMap<>(PredictionType.class));
    }
}
