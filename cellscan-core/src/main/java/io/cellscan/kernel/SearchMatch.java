package io.cellscan.kernel;

/**
 * Half-open character span {@code [start, start + length)} in the original
 * cell text.
 */
public record SearchMatch(int start, int length) implements Comparable<SearchMatch> {
    public SearchMatch {
        if (start < 0) {
            throw new IllegalArgumentException("start must be non-negative: " + start);
        }
        if (length <= 0) {
            throw new IllegalArgumentException("length must be positive: " + length);
        }
    }

    public int end() {
        return start + length;
    }

    @Override
    public int compareTo(SearchMatch other) {
        int byStart = Integer.compare(start, other.start);
        return byStart != 0 ? byStart : Integer.compare(length, other.length);
    }
}
