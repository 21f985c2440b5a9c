package com.jay.valuation.exception;

import lombok.Getter;

/**
 * Thrown when a symbol cannot be valued at all: no share count, or no income metric
 * for any model to start from.
 */
@Getter
public class ValuationUnavailableException extends RuntimeException {

    private final String symbol;

    public ValuationUnavailableException(String symbol, String message) {
        super(message);
        this.symbol = symbol;
    }
}
