package com.jay.valuation.exception;

import lombok.Getter;

/**
 * Statement data could not be acquired from the market-data provider.
 */
@Getter
public class StatementSourceException extends RuntimeException {

    private final String symbol;
    /** HTTP status returned by the provider, null for transport failures. */
    private final Integer statusCode;

    public StatementSourceException(String symbol, String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.symbol = symbol;
        this.statusCode = statusCode;
    }

    public StatementSourceException(String symbol, String message) {
        this(symbol, message, null, null);
    }
}
