package com.modelspec.exception;

/**
 * A model argument failed validation: unknown name, wrong type or a value the
 * engine cannot accept. The message always names the argument.
 */
public class ArgumentValidationException extends ModelSpecException {

	private static final long serialVersionUID = 1L;
	private final String argument;

	public ArgumentValidationException(String argument, String message) {
		super(message);
		this.argument = argument;
	}

	public String getArgument() {
		return argument;
	}
}
