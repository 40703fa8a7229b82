package com.plazaintel.comparisons.model;

/**
 * Metrics compared between periods, in report order.
 * Each carries the dataset column it is summed from.
 */
public enum Metric {

    CERTIFICATION_TOTAL("CN_Tot_Acum"),
    CERTIFICATION_INITIAL("CN_Inicial_Acum"),
    CERTIFICATION_PRIMARY("CN_Prim_Acum"),
    CERTIFICATION_SECONDARY("CN_Sec_Acum"),
    INSCRIPTIONS("Inc_Total"),
    ATTENDANCES("Aten_Total");

    private final String column;

    Metric(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }
}
