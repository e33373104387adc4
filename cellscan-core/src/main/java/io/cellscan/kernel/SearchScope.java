package io.cellscan.kernel;

public enum SearchScope {
    ALL_COLUMNS,
    VISIBLE_COLUMNS,
    EXPLICIT_COLUMNS
}
