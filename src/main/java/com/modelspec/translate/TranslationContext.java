package com.modelspec.translate;

import java.util.List;

import com.modelspec.registry.model.ArgumentDescriptor;
import com.modelspec.registry.model.FitModule;
import com.modelspec.spec.ModelSpec;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * What a {@link TranslationHook} can see about the translation in progress.
 */
@Value
@Builder
public class TranslationContext {

    @NonNull
    ModelSpec spec;

    @NonNull
    String engine;

    @NonNull
    FitModule fitModule;

    @NonNull
    List<ArgumentDescriptor> descriptors;

    public String getMode() {
        return spec.getMode();
    }

    /**
     * Native name the engine uses for an exposed argument, if the engine maps it.
     */
    public String originalName(String exposedName) {
        return descriptors.stream()
                .filter(d -> d.getExposedName().equals(exposedName))
                .map(ArgumentDescriptor::getOriginalName)
                .findFirst()
                .orElse(null);
    }
}
