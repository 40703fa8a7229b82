package com.plazaintel.comparisons.service;

import com.plazaintel.comparisons.model.FetchFailure;
import lombok.Getter;

/**
 * Thrown by the download and parse steps; carries the typed failure so the
 * retry policy can decide whether another attempt makes sense.
 */
@Getter
public class FetchFailedException extends RuntimeException {

    private final FetchFailure failure;

    public FetchFailedException(FetchFailure failure) {
        super(failure.reason());
        this.failure = failure;
    }

    public FetchFailedException(FetchFailure failure, Throwable cause) {
        super(failure.reason(), cause);
        this.failure = failure;
    }

    public boolean isRetryable() {
        return failure.type().isRetryable();
    }
}
