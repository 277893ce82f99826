package com.modelspec.fit;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelspec.exception.MissingDependencyException;
import com.modelspec.registry.model.FunctionRef;

/**
 * The engine callables available in this process, and the packages they come from.
 *
 * Registering a function also marks its package as installed.
 */
public class FunctionCatalog {
    private static final Logger log = LoggerFactory.getLogger(FunctionCatalog.class);

    private final Map<FunctionRef, EngineFunction> functions = new ConcurrentHashMap<>();
    private final Set<String> packages = ConcurrentHashMap.newKeySet();

    public FunctionCatalog register(FunctionRef ref, EngineFunction function) {
        functions.put(ref, function);
        if (ref.getPkg() != null) {
            packages.add(ref.getPkg());
        }
        log.debug("Registered engine function {}", ref);
        return this;
    }

    public FunctionCatalog installPackage(String pkg) {
        packages.add(pkg);
        return this;
    }

    public boolean isInstalled(String pkg) {
        return packages.contains(pkg);
    }

    public List<String> missingPackages(Collection<String> required) {
        return required.stream().filter(p -> !isInstalled(p)).toList();
    }

    /**
     * Finds a function. A reference without a package matches any package by name.
     */
    public Optional<EngineFunction> find(FunctionRef ref) {
        EngineFunction exact = functions.get(ref);
        if (exact != null || ref.getPkg() != null) {
            return Optional.ofNullable(exact);
        }
        return functions.entrySet().stream()
                .filter(e -> e.getKey().getName().equals(ref.getName()))
                .map(Map.Entry::getValue)
                .findFirst();
    }

    public EngineFunction require(FunctionRef ref) {
        return find(ref).orElseThrow(() -> new MissingDependencyException("Function " + ref
                + " is not available; register it with the function catalog"));
    }
}
