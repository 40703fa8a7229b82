package com.plazaintel.comparisons.model;

/**
 * Bad year/month input. Raised before any I/O and never retried.
 */
public class InvalidPeriodException extends IllegalArgumentException {

    public InvalidPeriodException(String message) {
        super(message);
    }
}
