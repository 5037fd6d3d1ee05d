package com.vidnyan.conclint.domain.model;

import java.util.Comparator;

/**
 * Source code location.
 */
public record Location(
    String filePath,
    int line,
    int column,
    int endLine,
    int endColumn
) implements Comparable<Location> {

    private static final Comparator<Location> ORDER = Comparator
            .comparing(Location::filePath, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingInt(Location::line)
            .thenComparingInt(Location::column)
            .thenComparingInt(Location::endLine)
            .thenComparingInt(Location::endColumn);

    /**
     * Create a location with just line information.
     */
    public static Location at(String filePath, int line, int column) {
        return new Location(filePath, line, column, line, column);
    }

    /**
     * Format as readable string.
     */
    public String format() {
        return filePath + ":" + line + ":" + column;
    }

    @Override
    public int compareTo(Location other) {
        return ORDER.compare(this, other);
    }
}
