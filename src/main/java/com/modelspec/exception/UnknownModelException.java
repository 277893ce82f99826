package com.modelspec.exception;

/**
 * Raised when a model name has not been registered.
 */
public class UnknownModelException extends ModelSpecException {

	private static final long serialVersionUID = 1L;

	public UnknownModelException(String message) {
		super(message);
	}
}
