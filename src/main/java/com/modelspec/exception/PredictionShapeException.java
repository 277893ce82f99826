package com.modelspec.exception;

/**
 * A prediction did not come back with one value per input row.
 */
public class PredictionShapeException extends ModelSpecException {

	private static final long serialVersionUID = 1L;

	public PredictionShapeException(String message) {
		super(message);
	}
}
