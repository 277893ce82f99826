package com.modelspec.exception;

/**
 * Supplied data cannot be shaped into the interface a fit module declares.
 */
public class InterfaceMismatchException extends ModelSpecException {

	private static final long serialVersionUID = 1L;

	public InterfaceMismatchException(String message) {
		super(message);
	}
}
