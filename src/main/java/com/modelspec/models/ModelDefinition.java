package com.modelspec.models;

import com.modelspec.registry.ModelRegistry;
import com.modelspec.translate.TranslationHooks;

/**
 * Registers one model type: its modes, engines, argument mappings, fit and predict modules,
 * dependencies and translation hooks.
 *
 * Implementations outside this library are discovered with {@link java.util.ServiceLoader}
 * through {@code META-INF/services/com.modelspec.models.ModelDefinition}.
 */
public interface ModelDefinition {

    String modelName();

    void register(ModelRegistry registry, TranslationHooks hooks);
}
