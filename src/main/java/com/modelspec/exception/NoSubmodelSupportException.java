package com.modelspec.exception;

/**
 * Raised by multi-prediction when no argument of the engine supports submodels.
 */
public class NoSubmodelSupportException extends ModelSpecException {

	private static final long serialVersionUID = 1L;

	public NoSubmodelSupportException(String message) {
		super(message);
	}
}
