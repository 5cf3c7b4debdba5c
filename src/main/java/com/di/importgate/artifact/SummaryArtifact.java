package com.di.importgate.artifact;

import com.di.importgate.table.CsvTable;
import com.di.importgate.util.DateFormatUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalLong;

/**
 * Per-variable summary table written by the generation tool ({@code summary_report.csv}).
 *
 * <p>Columns: StatVar, NumPlaces, NumObservations, MinValue, MaxValue, MinDate, MaxDate, Units.
 */
@Slf4j
public final class SummaryArtifact {

    public static final String FILE_NAME = "summary_report.csv";
    public static final String NUM_OBSERVATIONS = "NumObservations";

    private final CsvTable table;

    private SummaryArtifact(CsvTable table) {
        this.table = table;
    }

    public static SummaryArtifact read(Path path) throws IOException {
        return new SummaryArtifact(CsvTable.read(path));
    }

    public CsvTable table() {
        return table;
    }

    /**
     * Sum of the NumObservations column.
     *
     * @return empty when the column is absent or holds a non-integer value
     */
    public OptionalLong totalObservations() {
        int col = table.columnIndex(NUM_OBSERVATIONS);
        if (col < 0) {
            return OptionalLong.empty();
        }
        long total = 0;
        for (String value : table.column(col)) {
            if (value.isBlank()) {
                continue;
            }
            try {
                total += Math.round(Double.parseDouble(value.trim()));
            } catch (NumberFormatException e) {
                log.warn("[SUMMARY] Non-numeric {} value '{}' in {}", NUM_OBSERVATIONS, value, table.getSource());
                return OptionalLong.empty();
            }
        }
        return OptionalLong.of(total);
    }

    /**
     * Columns whose name ends with "Date" and that hold at least one bare year.
     */
    public List<Integer> bareYearDateColumns() {
        List<Integer> columns = new ArrayList<>();
        for (int c = 0; c < table.columnCount(); c++) {
            if (!table.getHeader().get(c).toLowerCase(Locale.ROOT).endsWith("date")) {
                continue;
            }
            if (table.column(c).stream().anyMatch(DateFormatUtils::isBareYear)) {
                columns.add(c);
            }
        }
        return columns;
    }

    /**
     * Writes a copy in which every bare year of a date column is expanded to a full
     * calendar date. Other values, including month-granularity dates, are kept.
     *
     * @return {@code target} when a column was rewritten, otherwise the original path
     */
    public Path normalizeDates(Path target) throws IOException {
        List<Integer> columns = bareYearDateColumns();
        if (columns.isEmpty()) {
            return table.getSource();
        }
        List<List<String>> rows = new ArrayList<>(table.rowCount());
        for (int r = 0; r < table.rowCount(); r++) {
            List<String> row = new ArrayList<>(table.columnCount());
            for (int c = 0; c < table.columnCount(); c++) {
                String value = table.cell(r, c);
                row.add(columns.contains(c) ? DateFormatUtils.yearToCalendarDate(value) : value);
            }
            rows.add(row);
        }
        CsvTable.write(target, table.getHeader(), rows);
        log.info("[SUMMARY] Normalized bare-year date column(s) {} into {}",
                columns.stream().map(c -> table.getHeader().get(c)).toList(), target);
        return target;
    }
}
