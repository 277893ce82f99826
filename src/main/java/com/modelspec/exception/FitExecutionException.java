package com.modelspec.exception;

/**
 * The underlying engine function failed while fitting.
 */
public class FitExecutionException extends ModelSpecException {

	private static final long serialVersionUID = 1L;

	public FitExecutionException(String message) {
		super(message);
	}

	public FitExecutionException(String message, Throwable cause) {
		super(message, cause);
	}
}
