package com.modelspec.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelspec.exception.DuplicateArgumentException;
import com.modelspec.exception.DuplicateModelException;
import com.modelspec.exception.InvalidModeException;
import com.modelspec.exception.ProtectedArgumentException;
import com.modelspec.exception.UnknownEngineException;
import com.modelspec.exception.UnknownModelException;
import com.modelspec.exception.UnsupportedCombinationException;
import com.modelspec.registry.model.ArgumentDescriptor;
import com.modelspec.registry.model.EngineMode;
import com.modelspec.registry.model.FitModule;
import com.modelspec.registry.model.FunctionRef;
import com.modelspec.registry.model.ModelInfo;
import com.modelspec.registry.model.PredictModule;
import com.modelspec.registry.model.PredictionType;

/**
 * Store of model metadata: modes, engines, argument mappings, fit and predict modules and
 * package dependencies.
 *
 * Every {@code register*} call checks that its prerequisite exists (model before mode,
 * mode before engine, engine before arguments and modules). Registration is append-only.
 * Reads and writes are guarded by a read/write lock and {@link #freeze()} turns the
 * registry read-only once start-up registration is over.
 *
 * A process normally holds one registry; tests build their own to stay isolated.
 */
public class ModelRegistry {
    private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);

    private final Map<String, ModelEntry> models = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile boolean frozen;

    // ------------------------------------------------------------------
    // Registration
    // ------------------------------------------------------------------

    public void registerModel(String name) {
        write(() -> {
            requireName(name, "model");
            if (models.containsKey(name)) {
                throw new DuplicateModelException("Model '" + name + "' is already registered");
            }
            models.put(name, new ModelEntry(name));
            log.debug("Registered model {}", name);
        });
    }

    public void registerMode(String model, String mode) {
        write(() -> {
            ModelEntry entry = entry(model);
            requireName(mode, "mode");
            if (Modes.UNKNOWN.equals(mode)) {
                throw new InvalidModeException("'" + Modes.UNKNOWN + "' is implicit and cannot be registered as a mode");
            }
            if (entry.modes.add(mode)) {
                log.debug("Registered mode {} for model {}", mode, model);
            }
        });
    }

    public void registerEngine(String model, String mode, String engine) {
        write(() -> {
            ModelEntry entry = entry(model);
            requireName(engine, "engine");
            if (!entry.modes.contains(mode)) {
                throw new InvalidModeException("'" + mode + "' is not a known mode for model '" + model
                        + "'. Known modes: " + entry.modes);
            }
            if (entry.engines.computeIfAbsent(mode, m -> new LinkedHashSet<>()).add(engine)) {
                log.debug("Registered engine {} for {} in mode {}", engine, model, mode);
            }
        });
    }

    public void registerArgument(String model, String engine, String exposedName, String originalName,
                                 FunctionRef constructor, boolean supportsSubmodel) {
        registerArgument(model, engine, ArgumentDescriptor.builder()
                .exposedName(exposedName)
                .originalName(originalName)
                .constructor(constructor)
                .supportsSubmodel(supportsSubmodel)
                .build());
    }

    public void registerArgument(String model, String engine, ArgumentDescriptor descriptor) {
        write(() -> {
            ModelEntry entry = entry(model);
            requireEngine(entry, engine);
            List<ArgumentDescriptor> list = entry.arguments.computeIfAbsent(engine, e -> new ArrayList<>());
            boolean duplicate = list.stream().anyMatch(d -> d.getExposedName().equals(descriptor.getExposedName()));
            if (duplicate) {
                throw new DuplicateArgumentException("Argument '" + descriptor.getExposedName()
                        + "' is already registered for " + model + "/" + engine);
            }
            list.add(descriptor);
            log.debug("Registered argument {} -> {} for {}/{}", descriptor.getExposedName(),
                    descriptor.getOriginalName(), model, engine);
        });
    }

    public void registerFit(String model, String engine, String mode, FitModule fitModule) {
        write(() -> {
            ModelEntry entry = entry(model);
            requireCombination(entry, mode, engine);

            Set<String> clash = new LinkedHashSet<>(fitModule.getDefaults().keySet());
            clash.retainAll(fitModule.getProtectedArguments());
            if (!clash.isEmpty()) {
                throw new ProtectedArgumentException(engine, new ArrayList<>(clash));
            }

            EngineMode key = EngineMode.of(engine, mode);
            if (entry.fitModules.containsKey(key)) {
                throw new IllegalStateException("A fit module is already registered for " + model + " " + key);
            }
            entry.fitModules.put(key, fitModule);
            log.debug("Registered fit module {} for {} {}", fitModule.getFunction(), model, key);
        });
    }

    public void registerPredict(String model, String engine, String mode, PredictionType type,
                                PredictModule predictModule) {
        write(() -> {
            ModelEntry entry = entry(model);
            requireCombination(entry, mode, engine);
            Map<PredictionType, PredictModule> byType = entry.predictModulesFor(EngineMode.of(engine, mode));
            if (byType.containsKey(type)) {
                throw new IllegalStateException("A '" + type.getCode() + "' predict module is already registered for "
                        + model + " " + engine + "/" + mode);
            }
            byType.put(type, predictModule);
            log.debug("Registered {} predict module {} for {} {}/{}", type.getCode(), predictModule.getFunction(),
                    model, engine, mode);
        });
    }

    public void registerDependency(String model, String engine, String pkg) {
        write(() -> {
            ModelEntry entry = entry(model);
            requireEngine(entry, engine);
            requireName(pkg, "package");
            entry.dependencies.computeIfAbsent(engine, e -> new LinkedHashSet<>()).add(pkg);
        });
    }

    /**
     * Makes the registry read-only. Further registration fails.
     */
    public void freeze() {
        lock.writeLock().lock();
        try {
            if (frozen) {
                return;
            }
            frozen = true;
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Model registry frozen with {} models", models.size());
    }

    public boolean isFrozen() {
        return frozen;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public boolean isRegistered(String model) {
        return read(() -> models.containsKey(model));
    }

    public List<String> modelNames() {
        return read(() -> List.copyOf(models.keySet()));
    }

    /**
     * Registered modes of the model; the implicit unknown mode is not listed.
     */
    public List<String> modes(String model) {
        return read(() -> List.copyOf(entry(model).modes));
    }

    /**
     * Engines for the mode; for {@link Modes#UNKNOWN} the engines of every mode.
     */
    public List<String> engines(String model, String mode) {
        return read(() -> {
            ModelEntry entry = entry(model);
            if (Modes.UNKNOWN.equals(mode)) {
                return List.copyOf(entry.allEngines());
            }
            return List.copyOf(entry.engines.getOrDefault(mode, Set.of()));
        });
    }

    public boolean hasEngine(String model, String mode, String engine) {
        return read(() -> {
            ModelEntry entry = entry(model);
            return Modes.UNKNOWN.equals(mode) ? entry.hasEngine(engine) : entry.hasEngine(mode, engine);
        });
    }

    public List<ArgumentDescriptor> arguments(String model, String engine) {
        return read(() -> List.copyOf(entry(model).arguments.getOrDefault(engine, List.of())));
    }

    /**
     * Every exposed argument name registered for any engine of the model.
     */
    public Set<String> exposedArgumentNames(String model) {
        return read(() -> entry(model).arguments.values().stream()
                .flatMap(List::stream)
                .map(ArgumentDescriptor::getExposedName)
                .collect(Collectors.toCollection(LinkedHashSet::new)));
    }

    public Optional<FitModule> fitModule(String model, String engine, String mode) {
        return read(() -> Optional.ofNullable(entry(model).fitModules.get(EngineMode.of(engine, mode))));
    }

    public Optional<PredictModule> predictModule(String model, String engine, String mode, PredictionType type) {
        return read(() -> Optional.ofNullable(predictModules(entry(model), engine, mode).get(type)));
    }

    public Map<PredictionType, PredictModule> predictModules(String model, String engine, String mode) {
        return read(() -> Collections.unmodifiableMap(new LinkedHashMap<>(predictModules(entry(model), engine, mode))));
    }

    public Set<PredictionType> predictionTypes(String model, String engine, String mode) {
        return predictModules(model, engine, mode).keySet();
    }

    public List<String> dependencies(String model, String engine) {
        return read(() -> List.copyOf(entry(model).dependencies.getOrDefault(engine, Set.of())));
    }

    /**
     * Arguments of the engine that support prediction at several values from one fit.
     */
    public List<ArgumentDescriptor> submodelArguments(String model, String engine) {
        return arguments(model, engine).stream().filter(ArgumentDescriptor::isSupportsSubmodel).toList();
    }

    /**
     * Arguments of the engine with a registered tuning-value constructor.
     */
    public List<ArgumentDescriptor> tunableArguments(String model, String engine) {
        return arguments(model, engine).stream().filter(d -> d.getConstructor() != null).toList();
    }

    /**
     * Snapshot of the model's registration, optionally restricted to one mode and/or engine.
     */
    public ModelInfo lookup(String model, String mode, String engine) {
        return read(() -> {
            ModelEntry entry = entry(model);
            if (mode != null && !Modes.UNKNOWN.equals(mode) && !entry.modes.contains(mode)) {
                throw new InvalidModeException("'" + mode + "' is not a known mode for model '" + model + "'");
            }
            if (engine != null && !entry.hasEngine(engine)) {
                throw new UnknownEngineException("Engine '" + engine + "' is not registered for model '" + model + "'");
            }

            ModelInfo.ModelInfoBuilder info = ModelInfo.builder().name(entry.name);
            Set<String> engines = new LinkedHashSet<>();
            for (String m : entry.modes) {
                if (mode != null && !Modes.UNKNOWN.equals(mode) && !m.equals(mode)) {
                    continue;
                }
                List<String> forMode = entry.engines.getOrDefault(m, Set.of()).stream()
                        .filter(e -> engine == null || e.equals(engine))
                        .toList();
                if (engine != null && forMode.isEmpty()) {
                    continue;
                }
                info.mode(m);
                info.enginesForMode(m, forMode);
                engines.addAll(forMode);
            }
            for (String e : engines) {
                info.argumentsForEngine(e, List.copyOf(entry.arguments.getOrDefault(e, List.of())));
                info.dependenciesForEngine(e, List.copyOf(entry.dependencies.getOrDefault(e, Set.of())));
            }
            entry.fitModules.forEach((key, fit) -> {
                if (matches(key, mode, engine)) {
                    info.fitModule(key, fit);
                }
            });
            entry.predictModules.forEach((key, byType) -> {
                if (matches(key, mode, engine) && !byType.isEmpty()) {
                    info.predictModulesFor(key, Collections.unmodifiableMap(new LinkedHashMap<>(byType)));
                }
            });
            return info.build();
        });
    }

    public ModelInfo lookup(String model) {
        return lookup(model, null, null);
    }

    // ------------------------------------------------------------------
    // Internals
    // ------------------------------------------------------------------

    private static boolean matches(EngineMode key, String mode, String engine) {
        boolean modeOk = mode == null || Modes.UNKNOWN.equals(mode) || key.getMode().equals(mode);
        boolean engineOk = engine == null || key.getEngine().equals(engine);
        return modeOk && engineOk;
    }

    private static Map<PredictionType, PredictModule> predictModules(ModelEntry entry, String engine, String mode) {
        return entry.predictModules.getOrDefault(EngineMode.of(engine, mode), Map.of());
    }

    private ModelEntry entry(String model) {
        ModelEntry entry = models.get(model);
        if (entry == null) {
            throw new UnknownModelException("Model '" + model + "' has not been registered");
        }
        return entry;
    }

    private static void requireEngine(ModelEntry entry, String engine) {
        if (!entry.hasEngine(engine)) {
            throw new UnknownEngineException("Engine '" + engine + "' is not registered for model '" + entry.name
                    + "' under any mode");
        }
    }

    private static void requireCombination(ModelEntry entry, String mode, String engine) {
        if (!entry.modes.contains(mode) || !entry.hasEngine(mode, engine)) {
            throw new UnsupportedCombinationException("Model '" + entry.name + "' has no engine '" + engine
                    + "' registered for mode '" + mode + "'");
        }
    }

    private static void requireName(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("A " + what + " name must not be blank");
        }
    }

    private void write(Runnable action) {
        lock.writeLock().lock();
        try {
            if (frozen) {
                throw new IllegalStateException("The model registry is frozen; register models during start-up");
            }
            action.run();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private <T> T read(Supplier<T> query) {
        lock.readLock().lock();
        try {
            return query.get();
        } finally {
            lock.readLock().unlock();
        }
    }
}
