package com.fintech.metals.ingestion;

/**
 * Thrown when a payload is not JSON or matches none of the known shapes.
 * Missing or malformed individual fields never cause this.
 */
public class QuoteParseException extends Exception {

    public QuoteParseException(String message) {
        super(message);
    }

    public QuoteParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
