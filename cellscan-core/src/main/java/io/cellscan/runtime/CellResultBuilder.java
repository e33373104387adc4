package io.cellscan.runtime;

import io.cellscan.kernel.SearchMatch;
import io.cellscan.kernel.SearchMatches;
import io.cellscan.kernel.SearchResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates matches for one (row, column) cell across descriptor plans.
 */
final class CellResultBuilder<T> {

    private final T item;
    private final int rowIndex;
    private final BoundColumn<T> column;
    private final String text;
    private final List<SearchMatch> matches = new ArrayList<>();

    CellResultBuilder(T item, int rowIndex, BoundColumn<T> column, String text) {
        this.item = item;
        this.rowIndex = rowIndex;
        this.column = column;
        this.text = text;
    }

    void addMatches(List<SearchMatch> found) {
        matches.addAll(found);
    }

    SearchResult<T> build() {
        return new SearchResult<>(item, rowIndex, column.columnId(), column.columnIndex(), text,
                SearchMatches.mergeOverlaps(matches));
    }
}
