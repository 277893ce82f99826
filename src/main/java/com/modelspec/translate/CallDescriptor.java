package com.modelspec.translate;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.modelspec.expr.DeferredValue;
import com.modelspec.registry.model.DataInterface;
import com.modelspec.registry.model.FunctionRef;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Frozen, ready-to-invoke description of an engine fit call.
 *
 * Argument names are the engine's native names; values are still deferred. The data
 * slots are not part of {@link #getArgs()}: the dispatcher injects them at fit time.
 */
@Value
@Builder
public class CallDescriptor {

    @NonNull
    String engine;

    @NonNull
    FunctionRef function;

    @NonNull
    @Singular("argument")
    Map<String, DeferredValue> args;

    @NonNull
    DataInterface dataInterface;

    @NonNull
    Set<String> protectedArguments;

    /**
     * Native names of the data slots where they differ from the slot names.
     */
    @NonNull
    Map<String, String> dataArguments;

    /**
     * Resolves every argument against {@code bindings}. Arguments resolving to null are
     * left out of the call.
     */
    public Map<String, Object> resolveArgs(Map<String, ?> bindings) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        args.forEach((name, value) -> {
            Object v = value.resolve(bindings);
            if (v != null) {
                resolved.put(name, v);
            }
        });
        return resolved;
    }

    public String nativeDataArgument(String slot) {
        return dataArguments.getOrDefault(slot, slot);
    }
}
