package com.di.importgate.pipeline;

/**
 * Position of a finding: a file and, where known, a 1-based line and column.
 */
public record Locator(String file, Integer line, Integer column) {

    public static Locator of(String file) {
        return new Locator(file, null, null);
    }

    public static Locator at(String file, int line) {
        return new Locator(file, line, null);
    }

    public static Locator at(String file, int line, int column) {
        return new Locator(file, line, column);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(file == null ? "<unknown>" : file);
        if (line != null) {
            sb.append(':').append(line);
            if (column != null) {
                sb.append(':').append(column);
            }
        }
        return sb.toString();
    }
}
