package com.modelspec.exception;

/**
 * The requested mode is not one the model declares, or the mode is still unknown
 * where a concrete one is needed.
 */
public class InvalidModeException extends ModelSpecException {

	private static final long serialVersionUID = 1L;

	public InvalidModeException(String message) {
		super(message);
	}
}
