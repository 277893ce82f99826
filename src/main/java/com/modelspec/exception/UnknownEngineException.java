package com.modelspec.exception;

/**
 * Raised when an engine is not registered for the model (and mode) in question.
 */
public class UnknownEngineException extends ModelSpecException {

	private static final long serialVersionUID = 1L;

	public UnknownEngineException(String message) {
		super(message);
	}
}
