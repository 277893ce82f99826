package com.modelspec.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level {@code model-spec} command; the work happens in its subcommands.
 */
@Command(
        name = "model-spec",
        mixinStandardHelpOptions = true,
        version = "model-spec 1.0.0",
        description = "Inspects the model specification registry."
)
public class ModelSpecCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
