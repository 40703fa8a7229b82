package com.plazaintel.comparisons.service;

import com.plazaintel.comparisons.model.EnsureResult;
import com.plazaintel.comparisons.model.PeriodKey;
import lombok.Getter;

@Getter
public class PeriodUnavailableException extends ComparisonException {

    private final int key;
    private final EnsureResult ensureResult;

    public PeriodUnavailableException(int key, EnsureResult ensureResult) {
        super("Period " + PeriodKey.label(key) + " unavailable: " + ensureResult.reason());
        this.key = key;
        this.ensureResult = ensureResult;
    }
}
