package com.modelspec.translate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelspec.exception.InvalidModeException;
import com.modelspec.exception.NoEngineException;
import com.modelspec.exception.ProtectedArgumentException;
import com.modelspec.exception.UnsupportedCombinationException;
import com.modelspec.expr.DeferredValue;
import com.modelspec.registry.ModelRegistry;
import com.modelspec.registry.Modes;
import com.modelspec.registry.model.ArgumentDescriptor;
import com.modelspec.registry.model.FitModule;
import com.modelspec.spec.ModelMethod;
import com.modelspec.spec.ModelSpec;

import lombok.RequiredArgsConstructor;

/**
 * Turns a specification with an engine into an engine-native fit call.
 *
 * Merge order, later steps winning: fit module defaults, then the user's main arguments
 * renamed through the engine's argument descriptors, then engine arguments verbatim.
 * Protected arguments are rejected whatever their source. Model-specific hooks run last.
 *
 * The registry is only read here, so translating the same specification twice yields
 * equal descriptors.
 */
@RequiredArgsConstructor
public class Translator {
    private static final Logger log = LoggerFactory.getLogger(Translator.class);

    private final ModelRegistry registry;
    private final TranslationHooks hooks;

    /**
     * Translates for the specification's engine and returns a copy carrying the method.
     */
    public ModelSpec translate(ModelSpec spec) {
        CallDescriptor fitCall = translateCall(spec);
        ModelMethod method = ModelMethod.builder()
                .engine(spec.getEngine())
                .fitCall(fitCall)
                .predictModules(registry.predictModules(spec.getModelName(), spec.getEngine(), spec.getMode()))
                .build();
        return spec.toBuilder().method(method).build();
    }

    public CallDescriptor translateCall(ModelSpec spec) {
        String model = spec.getModelName();
        String engine = spec.getEngine();
        if (engine == null) {
            throw new NoEngineException("No engine has been set for this '" + model + "' specification");
        }
        if (Modes.UNKNOWN.equals(spec.getMode())) {
            throw new InvalidModeException("Please set the mode of the '" + model + "' specification before translating. "
                    + "Possible modes: " + registry.modes(model));
        }

        FitModule fitModule = registry.fitModule(model, engine, spec.getMode())
                .orElseThrow(() -> new UnsupportedCombinationException("No fit module is registered for model '" + model
                        + "' with engine '" + engine + "' in mode '" + spec.getMode() + "'"));
        List<ArgumentDescriptor> descriptors = registry.arguments(model, engine);

        // Step 1: defaults
        Map<String, DeferredValue> merged = new LinkedHashMap<>(fitModule.getDefaults());
        List<String> offending = new ArrayList<>();

        // Step 2: user arguments through the descriptor mapping
        for (ArgumentDescriptor d : descriptors) {
            DeferredValue value = spec.getArgs().get(d.getExposedName());
            if (value != null) {
                merged.put(d.getOriginalName(), value);
                addIfProtected(fitModule, d.getOriginalName(), offending);
            }
        }
        spec.getArgs().forEach((name, value) -> {
            if (value != null && descriptors.stream().noneMatch(d -> d.getExposedName().equals(name))) {
                log.warn("Argument '{}' is not used by engine '{}' for model '{}' and will be ignored", name, engine, model);
            }
        });

        // Step 3: engine arguments, verbatim; an explicit null drops the argument
        for (Map.Entry<String, DeferredValue> e : spec.getEngineArgs().entrySet()) {
            addIfProtected(fitModule, e.getKey(), offending);
            if (e.getValue() == null) {
                merged.remove(e.getKey());
            } else {
                merged.put(e.getKey(), e.getValue());
            }
        }

        // Step 4: protection is absolute
        if (!offending.isEmpty()) {
            throw new ProtectedArgumentException(engine, offending);
        }

        // Step 5: model-specific hooks
        List<TranslationHook> modelHooks = hooks.hooksFor(model);
        if (!modelHooks.isEmpty()) {
            TranslationContext context = TranslationContext.builder()
                    .spec(spec)
                    .engine(engine)
                    .fitModule(fitModule)
                    .descriptors(descriptors)
                    .build();
            for (TranslationHook hook : modelHooks) {
                merged = new LinkedHashMap<>(hook.apply(context, Collections.unmodifiableMap(merged)));
            }
            List<String> injected = new ArrayList<>();
            merged.keySet().forEach(name -> addIfProtected(fitModule, name, injected));
            if (!injected.isEmpty()) {
                throw new ProtectedArgumentException(engine, injected);
            }
        }

        // Step 6: freeze
        CallDescriptor call = CallDescriptor.builder()
                .engine(engine)
                .function(fitModule.getFunction())
                .args(merged)
                .dataInterface(fitModule.getDataInterface())
                .protectedArguments(Set.copyOf(fitModule.getProtectedArguments()))
                .dataArguments(Map.copyOf(fitModule.getDataArguments()))
                .build();
        log.debug("Translated {} ({}, {}) to {} with arguments {}", model, spec.getMode(), engine,
                call.getFunction(), call.getArgs().keySet());
        return call;
    }

    private static void addIfProtected(FitModule fitModule, String name, List<String> offending) {
        if (fitModule.getProtectedArguments().contains(name) && !offending.contains(name)) {
            offending.add(name);
        }
    }
}
