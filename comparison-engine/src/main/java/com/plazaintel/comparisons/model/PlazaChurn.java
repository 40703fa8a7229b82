package com.plazaintel.comparisons.model;

/**
 * Plazas gained and lost between two periods.
 * {@code exact} is true when computed from plaza keys, false when it is the
 * count-difference approximation.
 */
public record PlazaChurn(
        long totalPeriod1,
        long totalPeriod2,
        long newPlazas,
        long removedPlazas,
        long operatingPeriod2,
        boolean exact) {
}
