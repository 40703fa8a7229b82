package com.plazaintel.comparisons.service;

import com.plazaintel.comparisons.model.Metric;
import com.plazaintel.comparisons.model.PlazaRecord;
import com.plazaintel.comparisons.model.TabularDataset;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps raw dataset rows to {@link PlazaRecord}s.
 *
 * Columns are located by name with a few historical spellings. A missing
 * metric column reads as zero; a missing CN_Tot_Acum leaves the total to be
 * derived from the three accumulators.
 */
@Component
@Slf4j
public class PlazaRecordMapper {

    static final String[] REGION_ID = {"Clave_Edo", "clave_edo"};
    static final String[] REGION_NAME = {"Estado", "estado"};
    static final String[] PLAZA_KEY = {"Clave_Plaza", "clave", "Clave"};
    static final String[] INSCRIPTIONS = {Metric.INSCRIPTIONS.column()};
    static final String[] ATTENDANCES = {Metric.ATTENDANCES.column()};
    static final String[] CERT_TOTAL = {Metric.CERTIFICATION_TOTAL.column()};
    static final String[] CERT_INITIAL = {Metric.CERTIFICATION_INITIAL.column()};
    static final String[] CERT_PRIMARY = {Metric.CERTIFICATION_PRIMARY.column()};
    static final String[] CERT_SECONDARY = {Metric.CERTIFICATION_SECONDARY.column()};

    public List<PlazaRecord> map(TabularDataset dataset) {
        if (dataset.isEmpty()) return List.of();

        String regionId = dataset.findColumn(REGION_ID).orElse(null);
        if (regionId == null) {
            log.warn("Dataset has no region id column (Clave_Edo); columns = {}", dataset.columns());
        }
        String regionName = dataset.findColumn(REGION_NAME).orElse(null);
        String plazaKey = dataset.findColumn(PLAZA_KEY).orElse(null);
        String inscriptions = dataset.findColumn(INSCRIPTIONS).orElse(null);
        String attendances = dataset.findColumn(ATTENDANCES).orElse(null);
        String certTotal = dataset.findColumn(CERT_TOTAL).orElse(null);
        String certInitial = dataset.findColumn(CERT_INITIAL).orElse(null);
        String certPrimary = dataset.findColumn(CERT_PRIMARY).orElse(null);
        String certSecondary = dataset.findColumn(CERT_SECONDARY).orElse(null);

        List<PlazaRecord> records = new ArrayList<>(dataset.size());
        for (Map<String, String> row : dataset.rows()) {
            records.add(PlazaRecord.builder()
                    .regionId(parseInteger(cell(row, regionId)))
                    .regionName(emptyToNull(cell(row, regionName)))
                    .plazaKey(emptyToNull(cell(row, plazaKey)))
                    .inscriptions(parseLong(cell(row, inscriptions)))
                    .attendances(parseLong(cell(row, attendances)))
                    .certificationTotal(certTotal == null ? null : parseLong(cell(row, certTotal)))
                    .certificationInitial(parseLong(cell(row, certInitial)))
                    .certificationPrimary(parseLong(cell(row, certPrimary)))
                    .certificationSecondary(parseLong(cell(row, certSecondary)))
                    .build());
        }
        return records;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String cell(Map<String, String> row, String column) {
        if (column == null) return null;
        String val = row.get(column);
        return val == null ? null : val.trim();
    }

    /** "9", "9.0" → 9; anything else → null */
    static Integer parseInteger(String val) {
        if (val == null || val.isBlank()) return null;
        try {
            return new BigDecimal(val).intValue();
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Unparseable cells count as zero, like a coerced numeric column. */
    static long parseLong(String val) {
        if (val == null || val.isBlank()) return 0L;
        try {
            return new BigDecimal(val).longValue();
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    private String emptyToNull(String val) {
        return (val == null || val.isBlank() || val.equalsIgnoreCase("nan")) ? null : val;
    }
}
