package com.plazaintel.comparisons.support;

import com.plazaintel.comparisons.model.PlazaRecord;
import com.plazaintel.comparisons.model.TabularDataset;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Small datasets shaped like the monthly plaza exports.
 */
public final class Fixtures {

    public static final List<String> COLUMNS = List.of(
            "Año", "Cve-mes", "Clave_Edo", "Estado", "Clave_Plaza",
            "Inc_Total", "Aten_Total", "CN_Inicial_Acum", "CN_Prim_Acum", "CN_Sec_Acum", "CN_Tot_Acum");

    private Fixtures() {
    }

    public static PlazaRecord record(int region, String name, String plaza, long certTotal) {
        return PlazaRecord.builder()
                .regionId(region)
                .regionName(name)
                .plazaKey(plaza)
                .inscriptions(1)
                .attendances(2)
                .certificationInitial(0)
                .certificationPrimary(0)
                .certificationSecondary(0)
                .certificationTotal(certTotal)
                .build();
    }

    public static Map<String, String> row(int year, int month, int region, String name, String plaza, long certTotal) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("Año", String.valueOf(year));
        row.put("Cve-mes", String.valueOf(month));
        row.put("Clave_Edo", String.valueOf(region));
        row.put("Estado", name);
        row.put("Clave_Plaza", plaza);
        row.put("Inc_Total", "1");
        row.put("Aten_Total", "2");
        row.put("CN_Inicial_Acum", "0");
        row.put("CN_Prim_Acum", "0");
        row.put("CN_Sec_Acum", "0");
        row.put("CN_Tot_Acum", String.valueOf(certTotal));
        return row;
    }

    /**
     * One row per month for region 9 ("Jalisco") with certification total
     * {@code 100 * month}.
     */
    public static TabularDataset monthlyDataset(int year, int fromMonth, int toMonth) {
        List<Map<String, String>> rows = new ArrayList<>();
        for (int m = fromMonth; m <= toMonth; m++) {
            rows.add(row(year, m, 9, "Jalisco", "P-9-1", 100L * m));
        }
        return new TabularDataset(COLUMNS, rows);
    }

    public static byte[] csv(List<Map<String, String>> rows) {
        StringBuilder sb = new StringBuilder(String.join(",", COLUMNS)).append('\n');
        for (Map<String, String> row : rows) {
            List<String> cells = new ArrayList<>();
            for (String column : COLUMNS) {
                cells.add(row.getOrDefault(column, ""));
            }
            sb.append(String.join(",", cells)).append('\n');
        }
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }
}
