package com.modelspec.exception;

/**
 * An engine needs packages the function catalog does not provide.
 */
public class MissingDependencyException extends ModelSpecException {

	private static final long serialVersionUID = 1L;

	public MissingDependencyException(String message) {
		super(message);
	}
}
