package com.modelspec.cli.model;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Options of the "describe" command. No validation, no execution logic, no printing.
 */
@Getter
public class DescribeOptions {

	@Option(names = { "--model", "-m" }, description = "Model type to describe (default: all registered models)")
	private String model;

	@Option(names = { "--mode" }, description = "Only show this mode, e.g. classification or regression")
	private String mode;

	@Option(names = { "--engine", "-e" }, description = "Only show this engine; requires --model")
	private String engine;
}
