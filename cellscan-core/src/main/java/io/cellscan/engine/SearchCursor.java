package io.cellscan.engine;

import io.cellscan.kernel.SearchResult;

import java.util.List;
import java.util.Objects;

/**
 * Current-match position over a results snapshot, for "next match" and
 * "previous match" navigation.
 * <p>
 * The cursor holds no reference to the engine. Hand it each new snapshot with
 * {@link #update(List)}; the position follows the same cell when it is still
 * matched.
 */
public final class SearchCursor<T> {

    private List<SearchResult<T>> results;
    private int currentIndex = -1;

    public SearchCursor() {
        this(List.of());
    }

    public SearchCursor(List<SearchResult<T>> results) {
        this.results = List.copyOf(Objects.requireNonNull(results, "results"));
    }

    /**
     * @return position of the current match, or -1 when there is none
     */
    public int currentIndex() {
        return currentIndex;
    }

    /**
     * @return the current match, or {@code null} when there is none
     */
    public SearchResult<T> current() {
        return currentIndex >= 0 ? results.get(currentIndex) : null;
    }

    public int size() {
        return results.size();
    }

    public List<SearchResult<T>> results() {
        return results;
    }

    public boolean moveNext(boolean wrap) {
        if (results.isEmpty()) {
            return false;
        }
        int next = currentIndex + 1;
        if (next >= results.size()) {
            if (!wrap) {
                return false;
            }
            next = 0;
        }
        currentIndex = next;
        return true;
    }

    public boolean movePrevious(boolean wrap) {
        if (results.isEmpty()) {
            return false;
        }
        if (currentIndex < 0) {
            currentIndex = results.size() - 1;
            return true;
        }
        int previous = currentIndex - 1;
        if (previous < 0) {
            if (!wrap) {
                return false;
            }
            previous = results.size() - 1;
        }
        currentIndex = previous;
        return true;
    }

    /**
     * Jump to {@code index}; -1 clears the position.
     *
     * @throws IndexOutOfBoundsException for any other index outside the results
     */
    public void moveTo(int index) {
        if (index == -1) {
            currentIndex = -1;
            return;
        }
        Objects.checkIndex(index, results.size());
        currentIndex = index;
    }

    /**
     * Replace the snapshot. The position is kept on the cell with the same
     * item (by reference) and column id, if that cell is still in the results.
     */
    public void update(List<SearchResult<T>> newResults) {
        Objects.requireNonNull(newResults, "newResults");
        SearchResult<T> previous = current();
        results = List.copyOf(newResults);
        currentIndex = previous == null ? -1 : indexOfCell(previous);
    }

    private int indexOfCell(SearchResult<T> cell) {
        for (int i = 0; i < results.size(); i++) {
            SearchResult<T> candidate = results.get(i);
            if (candidate.item() == cell.item() && Objects.equals(candidate.columnId(), cell.columnId())) {
                return i;
            }
        }
        return -1;
    }
}
