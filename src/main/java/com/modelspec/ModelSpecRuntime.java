package com.modelspec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelspec.data.FormulaExpander;
import com.modelspec.data.SimpleFormulaExpander;
import com.modelspec.fit.DataShaper;
import com.modelspec.fit.FitDispatcher;
import com.modelspec.fit.FunctionCatalog;
import com.modelspec.models.ModelDefinitions;
import com.modelspec.predict.PredictDispatcher;
import com.modelspec.registry.ModelRegistry;
import com.modelspec.spec.ModelSpecFactory;
import com.modelspec.translate.TranslationHooks;
import com.modelspec.translate.Translator;

import lombok.Builder;
import lombok.Getter;

/**
 * Wires a registry, its translation hooks, the engine function catalog and a formula
 * expander into the specification, translation, fit and predict services.
 */
@Getter
public class ModelSpecRuntime {
    private static final Logger log = LoggerFactory.getLogger(ModelSpecRuntime.class);

    private final ModelRegistry registry;
    private final TranslationHooks hooks;
    private final FunctionCatalog catalog;
    private final Translator translator;
    private final ModelSpecFactory specs;
    private final FitDispatcher fitDispatcher;
    private final PredictDispatcher predictDispatcher;

    @Builder
    private ModelSpecRuntime(ModelRegistry registry, TranslationHooks hooks, FunctionCatalog catalog,
                             FormulaExpander formulaExpander) {
        this.registry = registry != null ? registry : new ModelRegistry();
        this.hooks = hooks != null ? hooks : new TranslationHooks();
        this.catalog = catalog != null ? catalog : new FunctionCatalog();
        this.translator = new Translator(this.registry, this.hooks);
        this.specs = new ModelSpecFactory(this.registry, this.translator);
        this.fitDispatcher = new FitDispatcher(this.registry, this.translator, this.catalog,
                new DataShaper(formulaExpander != null ? formulaExpander : new SimpleFormulaExpander()));
        this.predictDispatcher = new PredictDispatcher(this.registry, this.catalog);
    }

    /**
     * A runtime whose registry holds the bundled and discovered model definitions and is
     * frozen.
     */
    public static ModelSpecRuntime withDefaults(FunctionCatalog catalog) {
        ModelSpecRuntime runtime = builder().catalog(catalog).build();
        ModelDefinitions.registerAll(runtime.registry, runtime.hooks);
        runtime.registry.freeze();
        log.debug("Model registry ready with models {}", runtime.registry.modelNames());
        return runtime;
    }

    public static ModelSpecRuntime withDefaults() {
        return withDefaults(new FunctionCatalog());
    }
}
