package com.modelspec.exception;

/** Raised when an operation needs an engine and none was given or set. */
public class NoEngineException extends ModelSpecException {

	private static final long serialVersionUID = 1L;

	public NoEngineException(String message) {
		super(message);
	}
}
