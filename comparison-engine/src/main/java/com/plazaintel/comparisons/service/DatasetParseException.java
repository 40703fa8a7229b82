package com.plazaintel.comparisons.service;

public class DatasetParseException extends RuntimeException {

    public DatasetParseException(String message) {
        super(message);
    }

    public DatasetParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
