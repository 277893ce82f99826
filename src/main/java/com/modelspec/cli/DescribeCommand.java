package com.modelspec.cli;

import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelspec.ModelSpecRuntime;
import com.modelspec.cli.exception.OptionsValidationException;
import com.modelspec.cli.model.DescribeOptions;
import com.modelspec.cli.output.ModelInfoRenderer;
import com.modelspec.cli.validation.DescribeOptionsValidator;
import com.modelspec.registry.ModelRegistry;
import com.modelspec.registry.model.ModelInfo;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Prints what the registry knows about one model or all of them.
 */
@Command(
        name = "describe",
        mixinStandardHelpOptions = true,
        description = "Describes registered models: modes, engines, argument mappings, fit and predict modules."
)
public class DescribeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DescribeCommand.class);

    @Mixin
    private DescribeOptions options = new DescribeOptions();

    @Spec
    private CommandSpec spec;

    private final ModelRegistry registry;
    private final DescribeOptionsValidator validator;
    private final ModelInfoRenderer renderer;

    public DescribeCommand(ModelSpecRuntime runtime) {
        this.registry = runtime.getRegistry();
        this.validator = new DescribeOptionsValidator(registry);
        this.renderer = new ModelInfoRenderer();
    }

    public DescribeCommand() {
        this(ModelSpecRuntime.withDefaults());
    }

    @Override
    public Integer call() {
        try {
            validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error(error));
            spec.commandLine().getErr().println(e.getMessage());
            return 2;
        }

        List<ModelInfo> models = options.getModel() == null
                ? registry.modelNames().stream()
                        .filter(name -> options.getMode() == null || registry.modes(name).contains(options.getMode()))
                        .map(name -> registry.lookup(name, options.getMode(), null))
                        .toList()
                : List.of(registry.lookup(options.getModel(), options.getMode(), options.getEngine()));

        spec.commandLine().getOut().print(renderer.render(models));
        spec.commandLine().getOut().flush();
        return 0;
    }
}
