package com.modelspec.registry.model;

import java.util.Map;
import java.util.Set;

import com.modelspec.expr.DeferredValue;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * How an engine fits a model in one mode.
 */
@Value
@Builder(toBuilder = true)
public class FitModule {

    /**
     * Data shape the fitting function expects.
     */
    @NonNull
    DataInterface dataInterface;

    /**
     * Arguments users may never set; the dispatcher fills them from the data.
     */
    @NonNull
    @Singular("protectedArgument")
    Set<String> protectedArguments;

    @NonNull
    FunctionRef function;

    /**
     * Values used when the user supplies none, in call order.
     */
    @NonNull
    @Singular("defaultArgument")
    Map<String, DeferredValue> defaults;

    /**
     * Native argument names for the standard data slots, where they differ from the slot
     * names ({@code formula}, {@code data}, {@code x}, {@code y}, {@code weights}).
     */
    @NonNull
    @Singular("dataArgument")
    Map<String, String> dataArguments;

    public String nativeDataArgument(String slot) {
        return dataArguments.getOrDefault(slot, slot);
    }
}
