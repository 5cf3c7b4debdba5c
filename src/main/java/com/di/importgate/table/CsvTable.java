package com.di.importgate.table;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.Getter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A CSV file read fully into memory: the header plus every non-empty data row.
 * Rows are kept as read; short rows are padded with empty cells on access.
 */
@Getter
public final class CsvTable {

    private static final CsvMapper CSV_MAPPER = new CsvMapper()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES);

    private final Path source;
    private final List<String> header;
    private final List<List<String>> rows;

    public CsvTable(Path source, List<String> header, List<List<String>> rows) {
        this.source = source;
        this.header = List.copyOf(header);
        this.rows = rows.stream().map(r -> Collections.unmodifiableList(new ArrayList<>(r))).toList();
    }

    public static CsvTable read(Path path) throws IOException {
        List<String[]> records;
        try (MappingIterator<String[]> it = CSV_MAPPER.readerFor(String[].class).readValues(path.toFile())) {
            records = it.readAll();
        }
        if (records.isEmpty()) {
            return new CsvTable(path, List.of(), List.of());
        }
        List<String> header = Arrays.stream(records.get(0)).map(CsvTable::stripBom).toList();
        List<List<String>> rows = new ArrayList<>(records.size() - 1);
        for (int i = 1; i < records.size(); i++) {
            rows.add(Arrays.asList(records.get(i)));
        }
        return new CsvTable(path, header, rows);
    }

    /**
     * Writes a header and rows as CSV, quoting where needed.
     */
    public static void write(Path path, List<String> header, List<List<String>> rows) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (SequenceWriter writer = CSV_MAPPER.writerFor(String[].class)
                .with(CsvSchema.emptySchema())
                .writeValues(path.toFile())) {
            writer.write(header.toArray(String[]::new));
            for (List<String> row : rows) {
                writer.write(row.toArray(String[]::new));
            }
        }
    }

    public boolean hasHeader() {
        return !header.isEmpty();
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return header.size();
    }

    /** Index of the first column with this name, ignoring surrounding whitespace, or -1. */
    public int columnIndex(String name) {
        if (name == null) {
            return -1;
        }
        String wanted = name.trim();
        for (int c = 0; c < header.size(); c++) {
            if (header.get(c) != null && header.get(c).trim().equals(wanted)) {
                return c;
            }
        }
        return -1;
    }

    /** Cell value, or an empty string when the row is shorter than the header. */
    public String cell(int row, int column) {
        List<String> r = rows.get(row);
        if (column >= r.size() || r.get(column) == null) {
            return "";
        }
        return r.get(column);
    }

    /** Values of one column across all rows. */
    public List<String> column(int column) {
        List<String> values = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            values.add(cell(i, column));
        }
        return Collections.unmodifiableList(values);
    }

    /** File line of a data row, assuming no blank lines or embedded newlines precede it. */
    public static int lineOf(int rowIndex) {
        return rowIndex + 2;
    }

    private static String stripBom(String value) {
        return value != null && value.startsWith("\uFEFF") ? value.substring(1) : value;
    }
}
