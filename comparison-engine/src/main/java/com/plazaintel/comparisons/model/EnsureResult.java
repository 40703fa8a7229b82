package com.plazaintel.comparisons.model;

/**
 * Outcome of making a period resident: ok flag, a short reason for logs and
 * responses, and the typed failure when not ok.
 */
public record EnsureResult(boolean ok, String reason, FetchFailure failure) {

    public static EnsureResult success(String reason) {
        return new EnsureResult(true, reason, null);
    }

    public static EnsureResult failed(FetchFailure failure) {
        return new EnsureResult(false, failure.reason(), failure);
    }
}
