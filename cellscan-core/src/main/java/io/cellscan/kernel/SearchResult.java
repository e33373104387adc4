package io.cellscan.kernel;

import java.util.List;

/**
 * All matches found in one (row, column) cell.
 * <p>
 * {@code rowIndex} is the row's position in the current iteration order of the
 * source and changes whenever rows are inserted or removed before it.
 *
 * @param item        the row item
 * @param rowIndex    current position of the row
 * @param columnId    host column identifier
 * @param columnIndex stable column index
 * @param text        cell text the matches refer to
 * @param matches     sorted, non-overlapping spans in {@code text}
 */
public record SearchResult<T>(T item, int rowIndex, Object columnId, int columnIndex, String text,
        List<SearchMatch> matches) {

    public SearchResult {
        if (rowIndex < 0) {
            throw new IllegalArgumentException("rowIndex must be non-negative: " + rowIndex);
        }
        if (columnId == null) {
            throw new IllegalArgumentException("columnId required");
        }
        if (text == null) {
            throw new IllegalArgumentException("text required");
        }
        matches = List.copyOf(matches);
    }

    /**
     * @return start of the first match, used as the last ordering key
     */
    public int leadingMatchStart() {
        return matches.isEmpty() ? 0 : matches.get(0).start();
    }

    public SearchResult<T> withRowIndex(int newRowIndex) {
        if (newRowIndex == rowIndex) {
            return this;
        }
        return new SearchResult<>(item, newRowIndex, columnId, columnIndex, text, matches);
    }
}
