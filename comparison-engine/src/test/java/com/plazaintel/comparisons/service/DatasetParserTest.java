package com.plazaintel.comparisons.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.plazaintel.comparisons.model.TabularDataset;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.SimpleGroupFactory;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.example.ExampleParquetWriter;
import org.apache.parquet.io.OutputFile;
import org.apache.parquet.io.PositionOutputStream;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;
import org.apache.parquet.schema.Types;
import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatasetParserTest {

    private final DatasetParser parser = new DatasetParser(new ObjectMapper());

    @Test
    @DisplayName("reads UTF-8 CSV with quoted cells")
    void utf8Csv() {
        String csv = "Año,Cve-mes,Estado,CN_Tot_Acum\n2024,1,\"Michoacán, de Ocampo\",100\n";

        TabularDataset dataset = parser.parse(csv.getBytes(StandardCharsets.UTF_8), "plazas.csv");

        assertThat(dataset.columns()).containsExactly("Año", "Cve-mes", "Estado", "CN_Tot_Acum");
        assertThat(dataset.rows()).hasSize(1);
        assertThat(dataset.rows().get(0)).containsEntry("Estado", "Michoacán, de Ocampo");
    }

    @Test
    @DisplayName("drops a UTF-8 byte order mark from the first header")
    void utf8Bom() {
        String csv = "\uFEFFAño,Cve-mes\n2024,3\n";

        TabularDataset dataset = parser.parse(csv.getBytes(StandardCharsets.UTF_8), "plazas.csv");

        assertThat(dataset.findColumn("Año")).contains("Año");
    }

    @Test
    @DisplayName("falls back to Windows-1252 when the bytes are not valid UTF-8")
    void legacyEncoding() {
        String csv = "Año,Estado\n2024,Nuevo León\n";

        TabularDataset dataset = parser.parse(csv.getBytes(Charset.forName("windows-1252")), "plazas.csv");

        assertThat(dataset.columns()).contains("Año");
        assertThat(dataset.rows().get(0)).containsEntry("Estado", "Nuevo León");
    }

    @Test
    @DisplayName("short rows are padded and blank lines skipped")
    void raggedRows() {
        String csv = "A,B,C\n1,2\n\n4,5,6\n";

        TabularDataset dataset = parser.parse(csv.getBytes(StandardCharsets.UTF_8), "x.csv");

        assertThat(dataset.size()).isEqualTo(2);
        assertThat(dataset.rows().get(0)).containsEntry("C", "");
    }

    @Test
    @DisplayName("reads a JSON array of rows, and a rows wrapper")
    void json() {
        String array = "[{\"Año\": 2024, \"Cve-mes\": \"02\", \"Clave_Edo\": 9}, {\"Año\": 2024, \"Extra\": null}]";
        String wrapped = "{\"rows\": " + array + "}";

        TabularDataset fromArray = parser.parse(array.getBytes(StandardCharsets.UTF_8), "p.json");
        TabularDataset fromWrapper = parser.parse(wrapped.getBytes(StandardCharsets.UTF_8), null);

        assertThat(fromArray.columns()).containsExactly("Año", "Cve-mes", "Clave_Edo", "Extra");
        assertThat(fromArray.rows().get(0)).containsEntry("Clave_Edo", "9");
        assertThat(fromArray.rows().get(1)).containsEntry("Extra", "");
        assertThat(fromWrapper.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("format is sniffed from content when the name gives no hint")
    void sniffing() {
        assertThat(DatasetParser.detectFormat("  [{}]".getBytes(StandardCharsets.UTF_8), null))
                .isEqualTo(DatasetParser.Format.JSON);
        assertThat(DatasetParser.detectFormat("a,b\n".getBytes(StandardCharsets.UTF_8), "file"))
                .isEqualTo(DatasetParser.Format.CSV);
        assertThat(DatasetParser.detectFormat(new byte[]{'P', 'A', 'R', '1'}, null))
                .isEqualTo(DatasetParser.Format.PARQUET);
        assertThat(DatasetParser.detectFormat(new byte[]{'P', 'K', 3, 4}, null))
                .isEqualTo(DatasetParser.Format.EXCEL);
    }

    @Test
    @DisplayName("reads Parquet columns in schema order, dropping the pandas index")
    void parquet() throws IOException {
        MessageType schema = Types.buildMessage()
                .required(PrimitiveTypeName.INT32).named("Año")
                .required(PrimitiveTypeName.BINARY).as(LogicalTypeAnnotation.stringType()).named("Cve-mes")
                .required(PrimitiveTypeName.BINARY).as(LogicalTypeAnnotation.stringType()).named("Estado")
                .optional(PrimitiveTypeName.INT64).named("CN_Tot_Acum")
                .required(PrimitiveTypeName.INT64).named("__index_level_0__")
                .named("plazas");
        SimpleGroupFactory groups = new SimpleGroupFactory(schema);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ParquetWriter<Group> writer = ExampleParquetWriter.builder(new InMemoryOutputFile(out))
                .withType(schema)
                .build()) {
            writer.write(groups.newGroup().append("Año", 2024).append("Cve-mes", "01")
                    .append("Estado", "Nuevo León").append("CN_Tot_Acum", 100L).append("__index_level_0__", 0L));
            writer.write(groups.newGroup().append("Año", 2024).append("Cve-mes", "01")
                    .append("Estado", "Jalisco").append("__index_level_0__", 1L));
        }

        TabularDataset dataset = parser.parse(out.toByteArray(), "plazas.parquet");

        assertThat(dataset.columns()).containsExactly("Año", "Cve-mes", "Estado", "CN_Tot_Acum");
        assertThat(dataset.rows()).hasSize(2);
        assertThat(dataset.rows().get(0))
                .containsEntry("Año", "2024")
                .containsEntry("Estado", "Nuevo León")
                .containsEntry("CN_Tot_Acum", "100");
        assertThat(dataset.rows().get(1)).containsEntry("CN_Tot_Acum", "");
    }

    @Test
    @DisplayName("reads the first xlsx sheet as displayed, evaluating formulas and skipping blank rows")
    void xlsx() throws IOException {
        byte[] bytes;
        try (Workbook workbook = new XSSFWorkbook()) {
            bytes = write(workbook);
        }

        TabularDataset dataset = parser.parse(bytes, "plazas.xlsx");

        assertThat(dataset.columns()).containsExactly("Año", "Cve-mes", "Estado", "CN_Tot_Acum");
        assertThat(dataset.rows()).hasSize(2);
        assertThat(dataset.rows().get(0))
                .containsEntry("Año", "2024")
                .containsEntry("Cve-mes", "5")
                .containsEntry("CN_Tot_Acum", "100");
        assertThat(dataset.rows().get(1)).containsEntry("Estado", "Jalisco");
    }

    @Test
    @DisplayName("a legacy xls workbook is recognised from its container bytes")
    void legacyXls() throws IOException {
        byte[] bytes;
        try (Workbook workbook = new HSSFWorkbook()) {
            bytes = write(workbook);
        }

        assertThat(DatasetParser.detectFormat(bytes, null)).isEqualTo(DatasetParser.Format.EXCEL);
        TabularDataset dataset = parser.parse(bytes, null);

        assertThat(dataset.rows().get(0)).containsEntry("Estado", "Nuevo León");
    }

    @Test
    @DisplayName("corrupt parquet, corrupt workbooks and empty payloads are rejected")
    void unreadable() {
        assertThatThrownBy(() -> parser.parse(new byte[]{1, 2, 3}, "plazas.parquet"))
                .isInstanceOf(DatasetParseException.class)
                .hasMessageContaining("Parquet");
        assertThatThrownBy(() -> parser.parse(new byte[]{'P', 'K', 3, 4}, null))
                .isInstanceOf(DatasetParseException.class)
                .hasMessageContaining("workbook");
        assertThatThrownBy(() -> parser.parse(new byte[0], "plazas.csv"))
                .isInstanceOf(DatasetParseException.class);
    }

    private static byte[] write(Workbook workbook) throws IOException {
        Sheet sheet = workbook.createSheet("plazas");
        Row header = sheet.createRow(0);
        String[] columns = {"Año", "Cve-mes", "Estado", "CN_Tot_Acum"};
        for (int c = 0; c < columns.length; c++) {
            header.createCell(c).setCellValue(columns[c]);
        }
        Row first = sheet.createRow(1);
        first.createCell(0).setCellValue(2024);
        first.createCell(1).setCellValue(5);
        first.createCell(2).setCellValue("Nuevo León");
        first.createCell(3).setCellFormula("40+60");
        sheet.createRow(2);
        Row second = sheet.createRow(3);
        second.createCell(0).setCellValue(2024);
        second.createCell(1).setCellValue(5);
        second.createCell(2).setCellValue("Jalisco");
        second.createCell(3).setCellValue(250);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        workbook.write(out);
        return out.toByteArray();
    }

    private static final class InMemoryOutputFile implements OutputFile {

        private final ByteArrayOutputStream out;

        InMemoryOutputFile(ByteArrayOutputStream out) {
            this.out = out;
        }

        @Override
        public PositionOutputStream create(long blockSizeHint) {
            return new PositionOutputStream() {
                @Override
                public long getPos() {
                    return out.size();
                }

                @Override
                public void write(int b) {
                    out.write(b);
                }

                @Override
                public void write(byte[] b, int off, int len) {
                    out.write(b, off, len);
                }
            };
        }

        @Override
        public PositionOutputStream createOrOverwrite(long blockSizeHint) {
            out.reset();
            return create(blockSizeHint);
        }

        @Override
        public boolean supportsBlockSize() {
            return false;
        }

        @Override
        public long defaultBlockSize() {
            return 0;
        }

        public String getPath() {
            return "memory:plazas.parquet";
        }
    }
}
