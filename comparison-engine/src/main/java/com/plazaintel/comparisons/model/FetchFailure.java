package com.plazaintel.comparisons.model;

/**
 * Typed fetch failure. {@code lastCause} is only set for EXHAUSTED_RETRIES.
 */
public record FetchFailure(
        FetchFailureType type,
        String label,
        String detail,
        Integer httpStatus,
        FetchFailure lastCause) {

    public static FetchFailure of(FetchFailureType type, String label, String detail) {
        return new FetchFailure(type, label, detail, null, null);
    }

    public static FetchFailure http(String label, int status) {
        return new FetchFailure(FetchFailureType.HTTP_ERROR, label, "HTTP " + status, status, null);
    }

    public static FetchFailure exhausted(String label, int attempts, FetchFailure lastCause) {
        return new FetchFailure(FetchFailureType.EXHAUSTED_RETRIES, label,
                String.valueOf(attempts), null, lastCause);
    }

    /** e.g. "http_error(503) 2023-05" or "exhausted_retries(3 attempts): timeout 2023-05" */
    public String reason() {
        return switch (type) {
            case HTTP_ERROR -> "http_error(" + httpStatus + ") " + label;
            case EXHAUSTED_RETRIES -> type.code() + "(" + detail + " attempts): "
                    + (lastCause != null ? lastCause.reason() : "unknown");
            default -> type.code() + " " + label + (detail == null || detail.isBlank() ? "" : ": " + detail);
        };
    }
}
