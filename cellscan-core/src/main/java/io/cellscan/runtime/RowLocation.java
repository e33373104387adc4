package io.cellscan.runtime;

/**
 * Outcome of resolving the current row index of an item.
 *
 * @param status resolution status
 * @param index  the row index when {@code status == FOUND}, else -1
 */
public record RowLocation(Status status, int index) {

    private static final RowLocation ABSENT = new RowLocation(Status.ABSENT, -1);
    private static final RowLocation AMBIGUOUS = new RowLocation(Status.AMBIGUOUS, -1);

    public enum Status {
        FOUND,
        ABSENT,
        AMBIGUOUS
    }

    public RowLocation {
        if (status == null) {
            throw new IllegalArgumentException("status required");
        }
        if (status == Status.FOUND && index < 0) {
            throw new IllegalArgumentException("index must be non-negative: " + index);
        }
    }

    public static RowLocation at(int index) {
        return new RowLocation(Status.FOUND, index);
    }

    public static RowLocation absent() {
        return ABSENT;
    }

    public static RowLocation ambiguous() {
        return AMBIGUOUS;
    }
}
