package com.modelspec;

import com.modelspec.cli.DescribeCommand;
import com.modelspec.cli.ModelSpecCommand;

import picocli.CommandLine;

/**
 * Main entry point of the {@code model-spec} command line tool.
 */
public class ModelSpecApplication {

    public static void main(String[] args) {
        System.exit(commandLine(ModelSpecRuntime.withDefaults()).execute(args));
    }

    static CommandLine commandLine(ModelSpecRuntime runtime) {
        return new CommandLine(new ModelSpecCommand())
                .addSubcommand("describe", new DescribeCommand(runtime))
                .setCaseInsensitiveEnumValuesAllowed(true);
    }
}
