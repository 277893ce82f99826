package com.modelspec.exception;

/**
 * Exception thrown when an argument expression cannot be parsed.
 */
public class ExpressionParseException extends ModelSpecException {

	private static final long serialVersionUID = 1L;

	public ExpressionParseException(String message) {
		super(message);
	}

	public ExpressionParseException(String message, int line, int column) {
		super(message + " at line " + line + ", column " + column);
	}
}
