package com.vidnyan.conclint.domain.ast;

/**
 * Source range of a node, 1-based and inclusive of the start position.
 */
public record Span(
    int startLine,
    int startColumn,
    int endLine,
    int endColumn
) {

    public static Span at(int line, int column) {
        return new Span(line, column, line, column);
    }

    /**
     * Check whether this span starts before another one.
     */
    public boolean startsBefore(Span other) {
        if (startLine != other.startLine) {
            return startLine < other.startLine;
        }
        return startColumn < other.startColumn;
    }

    public boolean sameStart(Span other) {
        return startLine == other.startLine && startColumn == other.startColumn;
    }
}
