package com.plazaintel.comparisons.model;

/**
 * Why a historical period could not be made resident.
 */
public enum FetchFailureType {

    NO_INDEX_ENTRY(false),
    NO_LOCATOR(false),
    TIMEOUT(true),
    HTTP_ERROR(true),
    NETWORK_ERROR(true),
    PARSE_FAILED(true),
    EXHAUSTED_RETRIES(false);

    private final boolean retryable;

    FetchFailureType(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public String code() {
        return name().toLowerCase();
    }
}
