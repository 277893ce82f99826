package com.modelspec.exception;

/**
 * Raised when a model name is registered twice.
 */
public class DuplicateModelException extends ModelSpecException {

	private static final long serialVersionUID = 1L;

	public DuplicateModelException(String message) {
		super(message);
	}
}
