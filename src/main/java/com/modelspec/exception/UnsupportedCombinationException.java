package com.modelspec.exception;

/**
 * No fit module (or registered engine) exists for a model/mode/engine combination.
 */
public class UnsupportedCombinationException extends ModelSpecException {

	private static final long serialVersionUID = 1L;

	public UnsupportedCombinationException(String message) {
		super(message);
	}
}
