package io.cellscan.kernel;

/**
 * Kind of edit reported for the row source.
 */
public enum ChangeKind {
    ADD,
    REMOVE,
    REPLACE,
    MOVE,
    RESET
}
