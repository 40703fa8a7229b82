package com.plazaintel.comparisons.service;

import lombok.Getter;

@Getter
public class NoDataForYearException extends ComparisonException {

    private final int year;

    public NoDataForYearException(int year, String detail) {
        super("No data for year " + year + ": " + detail);
        this.year = year;
    }
}
