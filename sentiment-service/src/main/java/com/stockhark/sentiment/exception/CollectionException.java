package com.stockhark.sentiment.exception;

/** A collection cycle failed after ingestion started (persistence or aggregation). */
public class CollectionException extends RuntimeException {

    public CollectionException(String message) {
        super(message);
    }

    public CollectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
