package com.modelspec.exception;

import java.util.List;

/**
 * Raised when a translated call would set arguments that are reserved for the
 * data injected at fit time (formula, data, x, y, weights...).
 */
public class ProtectedArgumentException extends ModelSpecException {

	private static final long serialVersionUID = 1L;
	private final List<String> arguments;

	public ProtectedArgumentException(String engine, List<String> arguments) {
		super("The following arguments cannot be manually modified for engine '" + engine
				+ "' and must be removed: " + String.join(", ", arguments));
		this.arguments = List.copyOf(arguments);
	}

	public List<String> getArguments() {
		return arguments;
	}
}
