package com.modelspec.exception;

/**
 * No predict module is registered for the requested prediction type.
 */
public class UnsupportedPredictionTypeException extends ModelSpecException {

	private static final long serialVersionUID = 1L;

	public UnsupportedPredictionTypeException(String message) {
		super(message);
	}
}
