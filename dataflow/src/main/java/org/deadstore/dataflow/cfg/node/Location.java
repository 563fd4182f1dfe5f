package org.deadstore.dataflow.cfg.node;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A source range: the position of the first character of a node and the position just past its
 * last character. Lines and columns are 1-based and 0-based respectively.
 *
 * <p>Locations are used as map and set keys by the analyses and are totally ordered by start
 * position, then stop position.
 */
public final class Location implements Comparable<Location> {

    /** The line on which the range starts. */
    private final int line;

    /** The column at which the range starts. */
    private final int column;

    /** The line on which the range stops. */
    private final int stopLine;

    /** The column at which the range stops. */
    private final int stopColumn;

    /**
     * Create a new location.
     *
     * @param line the start line
     * @param column the start column
     * @param stopLine the stop line
     * @param stopColumn the stop column
     */
    public Location(int line, int column, int stopLine, int stopColumn) {
        this.line = line;
        this.column = column;
        this.stopLine = stopLine;
        this.stopColumn = stopColumn;
    }

    /**
     * Create an empty range at the given position.
     *
     * @param line the line
     * @param column the column
     * @return a location that starts and stops at {@code line:column}
     */
    public static Location of(int line, int column) {
        return new Location(line, column, line, column);
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getStopLine() {
        return stopLine;
    }

    public int getStopColumn() {
        return stopColumn;
    }

    @Override
    public int compareTo(Location other) {
        int result = Integer.compare(line, other.line);
        if (result == 0) {
            result = Integer.compare(column, other.column);
        }
        if (result == 0) {
            result = Integer.compare(stopLine, other.stopLine);
        }
        if (result == 0) {
            result = Integer.compare(stopColumn, other.stopColumn);
        }
        return result;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!(obj instanceof Location)) {
            return false;
        }
        Location other = (Location) obj;
        return line == other.line
                && column == other.column
                && stopLine == other.stopLine
                && stopColumn == other.stopColumn;
    }

    @Override
    public int hashCode() {
        return Objects.hash(line, column, stopLine, stopColumn);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
