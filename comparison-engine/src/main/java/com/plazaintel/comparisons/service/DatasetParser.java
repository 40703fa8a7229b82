package com.plazaintel.comparisons.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import com.plazaintel.comparisons.model.TabularDataset;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns the bytes of a period file into a {@link TabularDataset}.
 *
 * Format comes from the file name when it has a known extension, otherwise
 * from the first bytes. CSV and JSON are read here; Parquet goes through
 * {@link ParquetDatasetReader} and Excel workbooks through
 * {@link WorkbookDatasetReader}.
 *
 * CSV exports arrive in several encodings. Strict UTF-8 is tried first (a
 * leading BOM is dropped), then Windows-1252, then ISO-8859-1, which accepts
 * any byte sequence.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DatasetParser {

    private static final List<Charset> CSV_ENCODINGS = List.of(
            StandardCharsets.UTF_8,
            Charset.forName("windows-1252"),
            StandardCharsets.ISO_8859_1);

    private static final char BOM = '\uFEFF';

    // legacy .xls container
    private static final byte[] OLE2_MAGIC = {(byte) 0xD0, (byte) 0xCF, 0x11, (byte) 0xE0};

    private final ObjectMapper objectMapper;

    enum Format { CSV, JSON, PARQUET, EXCEL }

    public TabularDataset parse(byte[] bytes, String name) {
        if (bytes == null || bytes.length == 0) {
            throw new DatasetParseException("empty payload");
        }
        Format format = detectFormat(bytes, name);
        log.debug("Parsing {} ({} bytes) as {}", name, bytes.length, format);

        return switch (format) {
            case CSV -> parseCsv(bytes);
            case JSON -> parseJson(bytes);
            case PARQUET -> ParquetDatasetReader.read(bytes);
            case EXCEL -> WorkbookDatasetReader.read(bytes);
        };
    }

    static Format detectFormat(byte[] bytes, String name) {
        if (name != null) {
            String lower = name.toLowerCase(Locale.ROOT);
            if (lower.endsWith(".csv")) return Format.CSV;
            if (lower.endsWith(".json")) return Format.JSON;
            if (lower.endsWith(".parquet")) return Format.PARQUET;
            if (lower.endsWith(".xlsx") || lower.endsWith(".xls")) return Format.EXCEL;
        }
        if (startsWith(bytes, "PAR1")) return Format.PARQUET;
        if (startsWith(bytes, "PK") || startsWith(bytes, OLE2_MAGIC)) return Format.EXCEL;

        for (byte b : bytes) {
            if (Character.isWhitespace(b) || b == (byte) 0xEF || b == (byte) 0xBB || b == (byte) 0xBF) continue;
            return (b == '[' || b == '{') ? Format.JSON : Format.CSV;
        }
        return Format.CSV;
    }

    // ── CSV ──────────────────────────────────────────────────────────────────

    private TabularDataset parseCsv(byte[] bytes) {
        String text = decode(bytes);
        if (!text.isEmpty() && text.charAt(0) == BOM) {
            text = text.substring(1);
        }

        List<String[]> lines;
        try (CSVReader reader = new CSVReader(new StringReader(text))) {
            lines = reader.readAll();
        } catch (IOException | CsvException e) {
            throw new DatasetParseException("CSV could not be read: " + e.getMessage(), e);
        }

        if (lines.isEmpty()) {
            throw new DatasetParseException("CSV has no header row");
        }

        List<String> columns = new ArrayList<>();
        for (String col : lines.get(0)) {
            columns.add(col.trim());
        }

        List<Map<String, String>> rows = new ArrayList<>(lines.size() - 1);
        for (int i = 1; i < lines.size(); i++) {
            String[] cells = lines.get(i);
            if (isBlank(cells)) continue;
            Map<String, String> row = new LinkedHashMap<>();
            for (int c = 0; c < columns.size(); c++) {
                row.put(columns.get(c), c < cells.length ? cells[c] : "");
            }
            rows.add(row);
        }
        return new TabularDataset(columns, rows);
    }

    static String decode(byte[] bytes) {
        for (Charset charset : CSV_ENCODINGS) {
            try {
                return charset.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .decode(ByteBuffer.wrap(bytes))
                        .toString();
            } catch (CharacterCodingException e) {
                log.debug("Payload is not valid {}, trying next encoding", charset.name());
            }
        }
        // ISO-8859-1 maps every byte, so the loop always returns
        throw new DatasetParseException("no usable encoding");
    }

    // ── JSON ─────────────────────────────────────────────────────────────────

    /** Accepts an array of row objects, or an object holding one under "rows" or "data". */
    private TabularDataset parseJson(byte[] bytes) {
        JsonNode root;
        try {
            root = objectMapper.readTree(bytes);
        } catch (IOException e) {
            throw new DatasetParseException("JSON could not be read: " + e.getMessage(), e);
        }

        JsonNode array = root;
        if (root != null && root.isObject()) {
            array = root.has("rows") ? root.get("rows") : root.get("data");
        }
        if (array == null || !array.isArray()) {
            throw new DatasetParseException("JSON payload is not an array of rows");
        }

        Set<String> columns = new LinkedHashSet<>();
        List<Map<String, String>> rows = new ArrayList<>(array.size());
        for (JsonNode node : array) {
            if (!node.isObject()) continue;
            Map<String, String> row = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                columns.add(field.getKey());
                row.put(field.getKey(), value == null || value.isNull() ? "" : value.asText());
            }
            rows.add(row);
        }
        return new TabularDataset(new ArrayList<>(columns), rows);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static boolean startsWith(byte[] bytes, String magic) {
        return startsWith(bytes, magic.getBytes(StandardCharsets.US_ASCII));
    }

    private static boolean startsWith(byte[] bytes, byte[] m) {
        if (bytes.length < m.length) return false;
        for (int i = 0; i < m.length; i++) {
            if (bytes[i] != m[i]) return false;
        }
        return true;
    }

    private static boolean isBlank(String[] cells) {
        for (String cell : cells) {
            if (cell != null && !cell.isBlank()) return false;
        }
        return true;
    }
}
