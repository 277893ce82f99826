package com.modelspec.translate;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Extension point: translation hooks keyed by model name, run in registration order.
 */
public class TranslationHooks {

    private final Map<String, List<TranslationHook>> hooks = new ConcurrentHashMap<>();

    public void register(String model, TranslationHook hook) {
        hooks.computeIfAbsent(model, m -> new CopyOnWriteArrayList<>()).add(hook);
    }

    public List<TranslationHook> hooksFor(String model) {
        return List.copyOf(hooks.getOrDefault(model, List.of()));
    }
}
