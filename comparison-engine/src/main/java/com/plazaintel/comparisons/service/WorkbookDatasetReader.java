package com.plazaintel.comparisons.service;

import com.plazaintel.comparisons.model.TabularDataset;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the first sheet of an Excel workbook (xlsx or legacy xls).
 * The first non-empty row is the header; cells are rendered the way Excel
 * displays them, with formulas evaluated.
 */
final class WorkbookDatasetReader {

    private WorkbookDatasetReader() {
    }

    static TabularDataset read(byte[] bytes) {
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(bytes))) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new DatasetParseException("workbook has no sheets");
            }
            Sheet sheet = workbook.getSheetAt(0);
            DataFormatter formatter = new DataFormatter();
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();

            Row header = sheet.getRow(sheet.getFirstRowNum());
            if (header == null || sheet.getPhysicalNumberOfRows() == 0) {
                throw new DatasetParseException("sheet '" + sheet.getSheetName() + "' has no header row");
            }

            List<String> columns = new ArrayList<>();
            List<Integer> positions = new ArrayList<>();
            for (Cell cell : header) {
                String name = formatter.formatCellValue(cell, evaluator).trim();
                if (name.isEmpty()) continue;
                columns.add(name);
                positions.add(cell.getColumnIndex());
            }

            List<Map<String, String>> rows = new ArrayList<>();
            for (int r = header.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) continue;
                Map<String, String> cells = new LinkedHashMap<>();
                boolean blank = true;
                for (int c = 0; c < columns.size(); c++) {
                    Cell cell = row.getCell(positions.get(c));
                    String value = cell == null ? "" : formatter.formatCellValue(cell, evaluator);
                    if (!value.isBlank()) blank = false;
                    cells.put(columns.get(c), value);
                }
                if (!blank) rows.add(cells);
            }
            return new TabularDataset(columns, rows);

        } catch (DatasetParseException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new DatasetParseException("workbook could not be read: " + e.getMessage(), e);
        }
    }
}
