package io.cellscan.kernel;

/**
 * Combination rule for multi-term literal queries.
 */
public enum TermCombineMode {
    /** At least one term must match. */
    ANY,
    /** Every term must match somewhere in the cell text. */
    ALL
}
