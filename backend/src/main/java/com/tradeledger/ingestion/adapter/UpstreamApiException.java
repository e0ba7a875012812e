package com.tradeledger.ingestion.adapter;

/**
 * Thrown when an upstream exchange call fails (transport error, non-2xx status or unreadable body).
 */
public class UpstreamApiException extends RuntimeException {

    public UpstreamApiException(String message) {
        super(message);
    }

    public UpstreamApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
