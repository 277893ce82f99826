package com.modelspec.cli.output;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.modelspec.exception.ModelSpecException;
import com.modelspec.registry.model.ArgumentDescriptor;
import com.modelspec.registry.model.EngineMode;
import com.modelspec.registry.model.FitModule;
import com.modelspec.registry.model.ModelInfo;
import com.modelspec.registry.model.PredictionType;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders registry snapshots as text through the {@code model-info.ftl} template.
 */
public class ModelInfoRenderer {

    static final String TEMPLATE = "model-info.ftl";

    private final Configuration freemarkerConfig;

    public ModelInfoRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String render(List<ModelInfo> models) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("models", models.stream().map(ModelInfoRenderer::modelView).toList());
        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE);
            StringWriter out = new StringWriter();
            template.process(root, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new ModelSpecException("Could not render the model description: " + e.getMessage(), e);
        }
    }

    private static Map<String, Object> modelView(ModelInfo info) {
        List<Map<String, Object>> modes = new ArrayList<>();
        info.getEngines().forEach((mode, engines) -> {
            List<Map<String, Object>> engineViews = new ArrayList<>();
            for (String engine : engines) {
                engineViews.add(engineView(info, EngineMode.of(engine, mode)));
            }
            Map<String, Object> modeView = new LinkedHashMap<>();
            modeView.put("name", mode);
            modeView.put("engines", engineViews);
            modes.add(modeView);
        });

        Map<String, Object> view = new LinkedHashMap<>();
        view.put("name", info.getName());
        view.put("modes", modes);
        return view;
    }

    private static Map<String, Object> engineView(ModelInfo info, EngineMode key) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("name", key.getEngine());
        view.put("dependencies", info.getDependencies().getOrDefault(key.getEngine(), List.of()));

        List<Map<String, Object>> arguments = new ArrayList<>();
        for (ArgumentDescriptor d : info.getArguments().getOrDefault(key.getEngine(), List.of())) {
            Map<String, Object> argument = new LinkedHashMap<>();
            argument.put("exposed", d.getExposedName());
            argument.put("original", d.getOriginalName());
            argument.put("submodel", d.isSupportsSubmodel());
            argument.put("tunable", d.getConstructor() != null);
            arguments.add(argument);
        }
        view.put("arguments", arguments);

        FitModule fit = info.getFitModules().get(key);
        if (fit != null) {
            Map<String, Object> fitView = new LinkedHashMap<>();
            fitView.put("function", fit.getFunction().toString());
            fitView.put("dataInterface", fit.getDataInterface().name());
            fitView.put("protected", List.copyOf(fit.getProtectedArguments()));
            Map<String, String> defaults = new LinkedHashMap<>();
            fit.getDefaults().forEach((name, value) -> defaults.put(name, value.source()));
            fitView.put("defaults", defaults);
            view.put("fit", fitView);
        }

        view.put("predictTypes", info.getPredictModules().getOrDefault(key, Map.of()).keySet().stream()
                .map(PredictionType::getCode)
                .toList());
        return view;
    }
}
