package com.modelspec.exception;

/**
 * An argument with the same exposed name was already registered for the engine.
 */
public class DuplicateArgumentException extends ModelSpecException {

	private static final long serialVersionUID = 1L;

	public DuplicateArgumentException(String message) {
		super(message);
	}
}
