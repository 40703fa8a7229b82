package com.plazaintel.comparisons.service;

/**
 * A comparison that cannot be answered with the data at hand.
 */
public class ComparisonException extends RuntimeException {

    public ComparisonException(String message) {
        super(message);
    }
}
