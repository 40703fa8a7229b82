package com.plazaintel.comparisons.service;

import com.plazaintel.comparisons.model.TabularDataset;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.api.ReadSupport;
import org.apache.parquet.hadoop.example.GroupReadSupport;
import org.apache.parquet.io.DelegatingSeekableInputStream;
import org.apache.parquet.io.InputFile;
import org.apache.parquet.io.SeekableInputStream;
import org.apache.parquet.schema.GroupType;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a Parquet file held in memory into string cells.
 *
 * Columns come from the file schema in order; the pandas index column
 * ({@code __index_level_0__}) is dropped. Records are read as untyped groups,
 * so column names such as {@code Cve-mes} need no escaping. Nulls become "".
 */
final class ParquetDatasetReader {

    private static final String PANDAS_INDEX_PREFIX = "__index_level_";

    private ParquetDatasetReader() {
    }

    static TabularDataset read(byte[] bytes) {
        List<String> columns = null;
        List<Map<String, String>> rows = new ArrayList<>();

        try (ParquetReader<Group> reader = new GroupReaderBuilder(new InMemoryInputFile(bytes)).build()) {
            Group record;
            while ((record = reader.read()) != null) {
                GroupType type = record.getType();
                if (columns == null) {
                    columns = columnsOf(type);
                }
                Map<String, String> row = new LinkedHashMap<>();
                for (String column : columns) {
                    int index = type.getFieldIndex(column);
                    row.put(column, record.getFieldRepetitionCount(index) == 0
                            ? ""
                            : record.getValueToString(index, 0));
                }
                rows.add(row);
            }
        } catch (IOException | RuntimeException e) {
            throw new DatasetParseException("Parquet could not be read: " + e.getMessage(), e);
        }

        return new TabularDataset(columns == null ? List.of() : columns, rows);
    }

    private static List<String> columnsOf(GroupType type) {
        List<String> columns = new ArrayList<>();
        for (int i = 0; i < type.getFieldCount(); i++) {
            String name = type.getFieldName(i);
            if (!name.startsWith(PANDAS_INDEX_PREFIX)) {
                columns.add(name);
            }
        }
        return columns;
    }

    private static final class GroupReaderBuilder extends ParquetReader.Builder<Group> {

        GroupReaderBuilder(InputFile file) {
            super(file);
        }

        @Override
        protected ReadSupport<Group> getReadSupport() {
            return new GroupReadSupport();
        }
    }

    static final class InMemoryInputFile implements InputFile {

        private final byte[] bytes;

        InMemoryInputFile(byte[] bytes) {
            this.bytes = bytes;
        }

        @Override
        public long getLength() {
            return bytes.length;
        }

        @Override
        public SeekableInputStream newStream() {
            SeekableBytes source = new SeekableBytes(bytes);
            return new DelegatingSeekableInputStream(source) {
                @Override
                public long getPos() {
                    return source.position();
                }

                @Override
                public void seek(long newPos) {
                    source.seek(newPos);
                }
            };
        }
    }

    private static final class SeekableBytes extends ByteArrayInputStream {

        SeekableBytes(byte[] bytes) {
            super(bytes);
        }

        long position() {
            return pos;
        }

        void seek(long newPos) {
            pos = (int) Math.min(newPos, count);
        }
    }
}
