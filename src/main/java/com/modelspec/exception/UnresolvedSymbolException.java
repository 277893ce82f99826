package com.modelspec.exception;

/**
 * A deferred expression referenced a symbol that neither the bindings nor the
 * captured environment define.
 */
public class UnresolvedSymbolException extends ModelSpecException {

	private static final long serialVersionUID = 1L;
	private final String symbol;

	public UnresolvedSymbolException(String symbol) {
		super("Object '" + symbol + "' not found while resolving a deferred expression");
		this.symbol = symbol;
	}

	public String getSymbol() {
		return symbol;
	}
}
