package com.modelspec.fit;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelspec.data.DataFrame;
import com.modelspec.data.Formula;
import com.modelspec.exception.FitExecutionException;
import com.modelspec.exception.InvalidModeException;
import com.modelspec.exception.MissingDependencyException;
import com.modelspec.exception.NoEngineException;
import com.modelspec.exception.UnresolvedSymbolException;
import com.modelspec.expr.DeferredValue;
import com.modelspec.registry.ModelRegistry;
import com.modelspec.registry.Modes;
import com.modelspec.spec.ModelFit;
import com.modelspec.spec.ModelSpec;
import com.modelspec.translate.CallDescriptor;
import com.modelspec.translate.Translator;

import lombok.RequiredArgsConstructor;

/**
 * Runs the engine fitting function a translated specification describes.
 *
 * Failures before the engine is called (missing engine, unset mode, missing packages, an
 * outcome that does not fit the mode, data the interface cannot take) always propagate.
 * Only the engine call itself is subject to {@link FitControl#isCatchErrors()}.
 */
@RequiredArgsConstructor
public class FitDispatcher {
    private static final Logger log = LoggerFactory.getLogger(FitDispatcher.class);

    private final ModelRegistry registry;
    private final Translator translator;
    private final FunctionCatalog catalog;
    private final DataShaper shaper;

    public ModelFit fit(ModelSpec spec, Formula formula, DataFrame data, FitControl control) {
        ModelSpec translated = prepare(spec);
        CallDescriptor call = translated.getMethod().getFitCall();
        ShapedData shaped = shaper.fromFormula(formula, data, call.getDataInterface(), translated.getMode());
        return invoke(translated, call, shaped, control);
    }

    public ModelFit fit(ModelSpec spec, Formula formula, DataFrame data) {
        return fit(spec, formula, data, FitControl.defaults());
    }

    public ModelFit fitXy(ModelSpec spec, DataFrame x, List<?> y, FitControl control) {
        ModelSpec translated = prepare(spec);
        CallDescriptor call = translated.getMethod().getFitCall();
        ShapedData shaped = shaper.fromXy(x, y, call.getDataInterface(), translated.getMode());
        return invoke(translated, call, shaped, control);
    }

    public ModelFit fitXy(ModelSpec spec, DataFrame x, List<?> y) {
        return fitXy(spec, x, y, FitControl.defaults());
    }

    private ModelSpec prepare(ModelSpec spec) {
        if (spec.getEngine() == null) {
            throw new NoEngineException("Please set an engine for the '" + spec.getModelName()
                    + "' specification before fitting. Available engines: "
                    + registry.engines(spec.getModelName(), spec.getMode()));
        }
        if (Modes.UNKNOWN.equals(spec.getMode())) {
            throw new InvalidModeException("Please set the mode of the '" + spec.getModelName()
                    + "' specification before fitting. Possible modes: " + registry.modes(spec.getModelName()));
        }

        List<String> missing = catalog.missingPackages(registry.dependencies(spec.getModelName(), spec.getEngine()));
        if (!missing.isEmpty()) {
            throw new MissingDependencyException("Engine '" + spec.getEngine() + "' of model '" + spec.getModelName()
                    + "' requires packages that are not installed: " + missing);
        }

        return spec.isTranslated() ? spec : translator.translate(spec);
    }

    private ModelFit invoke(ModelSpec translated, CallDescriptor call, ShapedData shaped, FitControl control) {
        ModelSpec spec = withResolvedArguments(translated, shaped.getSlots());
        Map<String, Object> arguments = new LinkedHashMap<>();
        shaped.getSlots().forEach((slot, value) -> arguments.put(call.nativeDataArgument(slot), value));
        call.resolveArgs(shaped.getSlots()).forEach(arguments::putIfAbsent);

        EngineFunction function = catalog.require(call.getFunction());
        if (control.getVerbosity() >= 2) {
            log.info("Fitting {} ({}) with {}({})", spec.getModelName(), spec.getEngine(), call.getFunction(),
                    String.join(", ", arguments.keySet()));
        }

        long start = System.nanoTime();
        Object fitted;
        try {
            fitted = function.invoke(arguments);
        } catch (Exception e) {
            FitExecutionException error = new FitExecutionException("Engine '" + spec.getEngine() + "' failed to fit model '"
                    + spec.getModelName() + "': " + e.getMessage(), e);
            if (!control.isCatchErrors()) {
                throw error;
            }
            if (control.getVerbosity() >= 1) {
                log.warn(error.getMessage());
            }
            return ModelFit.failure(spec, error);
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        log.debug("Fitted {} with {} in {} ms", spec.getModelName(), spec.getEngine(), elapsed.toMillis());
        return ModelFit.builder()
                .spec(spec)
                .fit(fitted)
                .preproc(shaped.getPreproc())
                .elapsed(elapsed)
                .build();
    }

    /**
     * The specification with its arguments evaluated against the training data. Predictions
     * read these values and no longer have the data to evaluate them with.
     */
    private static ModelSpec withResolvedArguments(ModelSpec spec, Map<String, ?> bindings) {
        return spec.toBuilder()
                .clearArgs()
                .args(resolveAll(spec.getArgs(), bindings))
                .clearEngineArgs()
                .engineArgs(resolveAll(spec.getEngineArgs(), bindings))
                .build();
    }

    private static Map<String, DeferredValue> resolveAll(Map<String, DeferredValue> values, Map<String, ?> bindings) {
        Map<String, DeferredValue> resolved = new LinkedHashMap<>();
        values.forEach((name, value) -> {
            if (value == null || value.isLiteral()) {
                resolved.put(name, value);
                return;
            }
            try {
                Object v = value.resolve(bindings);
                resolved.put(name, v == null ? null : DeferredValue.literal(v));
            } catch (UnresolvedSymbolException e) {
                // kept deferred; the fit call itself fails if the engine needs it
                log.debug("Argument '{}' stays deferred: {}", name, e.getMessage());
                resolved.put(name, value);
            }
        });
        return resolved;
    }
}
