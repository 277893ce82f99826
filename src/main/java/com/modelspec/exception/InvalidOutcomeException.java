package com.modelspec.exception;

/**
 * The outcome handed to a fit does not suit the specification's mode.
 */
public class InvalidOutcomeException extends ModelSpecException {

	private static final long serialVersionUID = 1L;

	public InvalidOutcomeException(String message) {
		super(message);
	}
}
