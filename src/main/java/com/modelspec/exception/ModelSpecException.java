package com.modelspec.exception;

/**
 * Root of every error raised by the registry, translator and dispatchers.
 */
public class ModelSpecException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public ModelSpecException(String message) {
		super(message);
	}

	public ModelSpecException(String message, Throwable cause) {
		super(message, cause);
	}
}
