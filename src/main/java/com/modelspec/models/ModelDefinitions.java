package com.modelspec.models;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelspec.registry.ModelRegistry;
import com.modelspec.translate.TranslationHooks;

import lombok.experimental.UtilityClass;

/**
 * Loads model definitions into a registry.
 */
@UtilityClass
public class ModelDefinitions {
    private static final Logger log = LoggerFactory.getLogger(ModelDefinitions.class);

    public static List<ModelDefinition> builtins() {
        return List.of(new LinearRegDefinition(), new MultinomRegDefinition(), new MixtureDaDefinition());
    }

    /**
     * Definitions provided on the class path through {@link ServiceLoader}.
     */
    public static List<ModelDefinition> discovered() {
        List<ModelDefinition> found = new ArrayList<>();
        ServiceLoader.load(ModelDefinition.class).forEach(found::add);
        return found;
    }

    public static void register(ModelRegistry registry, TranslationHooks hooks, List<ModelDefinition> definitions) {
        for (ModelDefinition definition : definitions) {
            definition.register(registry, hooks);
            log.debug("Registered model definition {}", definition.modelName());
        }
    }

    /**
     * Registers the bundled definitions followed by the discovered ones.
     */
    public static void registerAll(ModelRegistry registry, TranslationHooks hooks) {
        List<ModelDefinition> definitions = new ArrayList<>(builtins());
        definitions.addAll(discovered());
        register(registry, hooks, definitions);
        log.info("Registered {} model definitions", definitions.size());
    }
}
