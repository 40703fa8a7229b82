package com.plazaintel.comparisons.model;

/**
 * Summed metrics of one region in one period (or across the months of a year).
 */
public record RegionAggregate(
        int regionId,
        long plazas,
        long inscriptions,
        long attendances,
        long certificationInitial,
        long certificationPrimary,
        long certificationSecondary,
        long certificationTotal) {

    public static RegionAggregate empty(int regionId) {
        return new RegionAggregate(regionId, 0, 0, 0, 0, 0, 0, 0);
    }

    public long get(Metric metric) {
        return switch (metric) {
            case CERTIFICATION_TOTAL -> certificationTotal;
            case CERTIFICATION_INITIAL -> certificationInitial;
            case CERTIFICATION_PRIMARY -> certificationPrimary;
            case CERTIFICATION_SECONDARY -> certificationSecondary;
            case INSCRIPTIONS -> inscriptions;
            case ATTENDANCES -> attendances;
        };
    }

    /** Adds one row; negative cells count as zero. */
    public RegionAggregate plus(PlazaRecord row) {
        return new RegionAggregate(
                regionId,
                plazas + 1,
                inscriptions + positive(row.getInscriptions()),
                attendances + positive(row.getAttendances()),
                certificationInitial + positive(row.getCertificationInitial()),
                certificationPrimary + positive(row.getCertificationPrimary()),
                certificationSecondary + positive(row.getCertificationSecondary()),
                certificationTotal + positive(row.effectiveCertificationTotal()));
    }

    public RegionAggregate plus(RegionAggregate other) {
        return new RegionAggregate(
                regionId,
                plazas + other.plazas,
                inscriptions + other.inscriptions,
                attendances + other.attendances,
                certificationInitial + other.certificationInitial,
                certificationPrimary + other.certificationPrimary,
                certificationSecondary + other.certificationSecondary,
                certificationTotal + other.certificationTotal);
    }

    private static long positive(long value) {
        return Math.max(0, value);
    }
}
