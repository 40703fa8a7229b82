package com.plazaintel.comparisons.model;

import lombok.Builder;
import lombok.Value;

/**
 * One plaza row of a period dataset, normalised for aggregation.
 *
 * Schema notes:
 *  - region_id (Clave_Edo) is the group-by dimension; rows without one are skipped
 *  - plaza_key (Clave_Plaza) is optional; when both periods carry it, churn is exact
 *  - certification_total (CN_Tot_Acum) is nullable; when absent it is derived
 *    from the three accumulators
 */
@Value
@Builder
public class PlazaRecord {

    // ── Identity ────────────────────────────────────────────────────────────
    /** Numeric region id, e.g. 9 for Ciudad de México. Null if the cell was unparseable. */
    Integer regionId;

    /** Region display name as found in the dataset, e.g. "Ciudad de México" */
    String regionName;

    /** Stable plaza identifier, used for new/removed plaza detection */
    String plazaKey;

    // ── Metrics ─────────────────────────────────────────────────────────────
    long inscriptions;

    long attendances;

    long certificationInitial;

    long certificationPrimary;

    long certificationSecondary;

    /** Explicit total from the dataset, if the column exists */
    Long certificationTotal;

    public long effectiveCertificationTotal() {
        if (certificationTotal != null) {
            return certificationTotal;
        }
        return certificationInitial + certificationPrimary + certificationSecondary;
    }
}
