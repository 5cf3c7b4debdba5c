package com.di.importgate.stage;

import com.di.importgate.config.ImportGateProperties;
import com.di.importgate.pipeline.FailureCode;
import com.di.importgate.pipeline.Finding;
import com.di.importgate.pipeline.Locator;
import com.di.importgate.pipeline.PipelineState;
import com.di.importgate.pipeline.Severity;
import com.di.importgate.pipeline.StageResult;
import com.di.importgate.pipeline.StageStatus;
import com.di.importgate.table.CsvTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Scans the data table for structural problems. Every check runs, so one pass
 * reports every violation:
 * <ol>
 *   <li>duplicate column names</li>
 *   <li>wholly empty columns (blocking or advisory, see {@code importgate.quality.empty-column-blocking})</li>
 *   <li>duplicate rows</li>
 *   <li>non-numeric cells in the measurement column</li>
 * </ol>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DataQualityChecker {

    /** Findings per check beyond which only a count is reported. */
    static final int MAX_FINDINGS_PER_CHECK = 20;

    private static final Pattern NUMBER = Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?$");
    private static final Set<String> SPECIAL_NUMBERS = Set.of("nan", "inf", "+inf", "-inf", "infinity", "-infinity");

    private final ImportGateProperties properties;

    public StageResult check(Path dataTable) {
        String file = dataTable.toString();
        CsvTable table;
        try {
            table = CsvTable.read(dataTable);
        } catch (IOException | RuntimeException e) {
            log.error("[QUALITY] Cannot read {}: {}", dataTable, e.getMessage());
            return StageResult.failed(PipelineState.QUALITY, Finding.blocking(FailureCode.DATA_QUALITY_FAILED.name(),
                    "Cannot read data table: " + e.getMessage(), Locator.of(file)));
        }
        if (!table.hasHeader()) {
            return StageResult.failed(PipelineState.QUALITY,
                    Finding.blocking(FailureCode.MISSING_HEADER.name(), "Data table has no header row", Locator.at(file, 1)));
        }

        List<Finding> findings = new ArrayList<>();
        findings.addAll(duplicateColumns(table, file));
        findings.addAll(emptyColumns(table, file));
        findings.addAll(duplicateRows(table, file));
        findings.addAll(nonNumericValues(table, file));

        boolean blocking = findings.stream().anyMatch(Finding::isBlocking);
        log.info("[QUALITY] {} row(s), {} column(s): {} finding(s), blocking={}",
                table.rowCount(), table.columnCount(), findings.size(), blocking);
        return StageResult.builder()
                .stage(PipelineState.QUALITY)
                .status(blocking ? StageStatus.FAILED : StageStatus.PASSED)
                .severity(Severity.BLOCKING)
                .failureCode(blocking ? firstBlockingCode(findings) : null)
                .findings(findings)
                .build();
    }

    // ---- checks ----

    List<Finding> duplicateColumns(CsvTable table, String file) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        table.getHeader().forEach(h -> counts.merge(h.trim(), 1, Integer::sum));
        List<String> repeated = counts.entrySet().stream().filter(e -> e.getValue() > 1).map(Map.Entry::getKey).toList();
        if (repeated.isEmpty()) {
            return List.of();
        }
        return List.of(Finding.blocking(FailureCode.DUPLICATE_COLUMN.name(),
                "Duplicate column name(s): " + String.join(", ", repeated), Locator.at(file, 1)));
    }

    List<Finding> emptyColumns(CsvTable table, String file) {
        if (table.rowCount() == 0) {
            return List.of();
        }
        boolean blocking = properties.getQuality().isEmptyColumnBlocking();
        List<Finding> findings = new ArrayList<>();
        for (int c = 0; c < table.columnCount(); c++) {
            String name = table.getHeader().get(c);
            if (name.isBlank()) {
                continue;
            }
            if (table.column(c).stream().allMatch(String::isBlank)) {
                String message = "Column is entirely empty: " + name;
                Locator locator = Locator.at(file, 1, c + 1);
                findings.add(blocking
                        ? Finding.blocking(FailureCode.EMPTY_COLUMN.name(), message, locator)
                        : Finding.advisory(FailureCode.EMPTY_COLUMN.name(), message, locator));
            }
        }
        return findings;
    }

    List<Finding> duplicateRows(CsvTable table, String file) {
        Map<List<String>, Integer> firstSeen = new HashMap<>();
        List<String> duplicates = new ArrayList<>();
        Integer firstLine = null;
        for (int r = 0; r < table.rowCount(); r++) {
            List<String> key = new ArrayList<>(table.columnCount());
            for (int c = 0; c < table.columnCount(); c++) {
                key.add(table.cell(r, c).trim());
            }
            Integer previous = firstSeen.putIfAbsent(key, r);
            if (previous != null) {
                int line = CsvTable.lineOf(r);
                duplicates.add(String.format("row %d duplicates row %d", line, CsvTable.lineOf(previous)));
                if (firstLine == null) {
                    firstLine = line;
                }
            }
        }
        if (duplicates.isEmpty()) {
            return List.of();
        }
        return List.of(Finding.blocking(FailureCode.DUPLICATE_ROW.name(),
                String.format("%d duplicate row(s) (header is row 1): %s", duplicates.size(), summarize(duplicates)),
                Locator.at(file, firstLine)));
    }

    List<Finding> nonNumericValues(CsvTable table, String file) {
        String column = properties.getQuality().getMeasurementColumn();
        int col = table.columnIndex(column);
        if (col < 0) {
            return List.of();
        }
        List<Finding> findings = new ArrayList<>();
        int bad = 0;
        for (int r = 0; r < table.rowCount(); r++) {
            String value = table.cell(r, col);
            if (isNumericOrEmpty(value)) {
                continue;
            }
            bad++;
            if (findings.size() < MAX_FINDINGS_PER_CHECK) {
                int line = CsvTable.lineOf(r);
                findings.add(Finding.blocking(FailureCode.NON_NUMERIC_VALUE.name(),
                        String.format("Non-numeric value '%s' in column '%s' at row %d", value, column, line),
                        Locator.at(file, line, col + 1)));
            }
        }
        if (bad > MAX_FINDINGS_PER_CHECK) {
            findings.add(Finding.blocking(FailureCode.NON_NUMERIC_VALUE.name(),
                    String.format("%d more non-numeric value(s) in column '%s'", bad - MAX_FINDINGS_PER_CHECK, column),
                    Locator.of(file)));
        }
        return findings;
    }

    static boolean isNumericOrEmpty(String value) {
        if (value == null || value.isBlank()) {
            return true;
        }
        String v = value.trim();
        return NUMBER.matcher(v).matches() || SPECIAL_NUMBERS.contains(v.toLowerCase(Locale.ROOT));
    }

    private static String summarize(List<String> items) {
        if (items.size() <= MAX_FINDINGS_PER_CHECK) {
            return String.join("; ", items);
        }
        return String.join("; ", items.subList(0, MAX_FINDINGS_PER_CHECK))
                + String.format(" (and %d more)", items.size() - MAX_FINDINGS_PER_CHECK);
    }

    private static String firstBlockingCode(List<Finding> findings) {
        return findings.stream().filter(Finding::isBlocking).map(Finding::getCode).findFirst()
                .orElse(FailureCode.DATA_QUALITY_FAILED.name());
    }
}
