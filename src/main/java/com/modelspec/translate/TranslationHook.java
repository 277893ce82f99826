package com.modelspec.translate;

import java.util.Map;

import com.modelspec.expr.DeferredValue;

/**
 * Model-specific step run after the generic argument merge. A hook may validate the
 * merged arguments (throwing {@link com.modelspec.exception.ArgumentValidationException})
 * or return a rewritten copy.
 */
@FunctionalInterface
public interface TranslationHook {

    /**
     * @param arguments merged arguments by native name, read-only
     * @return the arguments to continue with
     */
    Map<String, DeferredValue> apply(TranslationContext context, Map<String, DeferredValue> arguments);
}
