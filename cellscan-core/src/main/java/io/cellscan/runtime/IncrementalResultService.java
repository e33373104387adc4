package io.cellscan.runtime;

import io.cellscan.kernel.ChangeKind;
import io.cellscan.kernel.CollectionChange;
import io.cellscan.kernel.SearchDescriptor;
import io.cellscan.kernel.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Keeps a row-ordered result list consistent with queued edits of the row
 * source, without rescanning it.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>Edits are queued as they are reported and applied together by
 *       {@link #tryApplyPending}.</li>
 *   <li>Cached results are only reused for a descriptor list equal,
 *       element-wise, to the one they were computed for.</li>
 *   <li>Reset, Move, unknown or out-of-range indexes, and items that occur
 *       more than once make the flush fail. A failed flush drops the cached
 *       state and every queued edit; the caller must run a full scan.</li>
 *   <li>The result list stays sorted by row index, which makes every range
 *       lookup a binary search.</li>
 * </ul>
 * <p>
 * Not thread-safe; owned by one engine instance.
 */
public final class IncrementalResultService<T> {

    private static final Logger LOG = LoggerFactory.getLogger(IncrementalResultService.class);

    /**
     * Produces the results of one row at a given index.
     */
    @FunctionalInterface
    public interface RowEvaluator<T> {
        List<SearchResult<T>> evaluate(T item, int rowIndex);
    }

    private final boolean trackItemChanges;
    private final List<CollectionChange<T>> pendingChanges = new ArrayList<>();
    private final Set<T> pendingItems = Collections.newSetFromMap(new IdentityHashMap<>());
    private List<SearchDescriptor> activeDescriptors = List.of();
    private List<SearchResult<T>> activeResults;
    private int rowCount;
    private boolean pendingReset;

    public IncrementalResultService(boolean trackItemChanges) {
        this.trackItemChanges = trackItemChanges;
    }

    /**
     * Queue a collection edit. Ignored while there are no cached results.
     *
     * @return true if the edit was queued
     */
    public boolean recordCollectionChange(CollectionChange<T> change) {
        Objects.requireNonNull(change, "change");
        if (activeResults == null) {
            return false;
        }
        if (change.kind() == ChangeKind.RESET) {
            pendingReset = true;
        }
        pendingChanges.add(change);
        return true;
    }

    /**
     * Queue an in-place change of one row item. Ignored when item tracking is
     * off or there are no cached results.
     *
     * @return true if the item was queued
     */
    public boolean recordItemChange(T item) {
        if (!trackItemChanges || item == null || activeResults == null) {
            return false;
        }
        pendingItems.add(item);
        return true;
    }

    /**
     * Cache freshly computed results. Any queued edit is dropped because the
     * results already reflect it.
     */
    public void setActiveState(List<SearchDescriptor> descriptors, List<SearchResult<T>> results, int rowCount) {
        if (descriptors == null || descriptors.isEmpty()) {
            clearState();
            return;
        }
        this.activeDescriptors = List.copyOf(descriptors);
        this.activeResults = new ArrayList<>(results);
        this.rowCount = rowCount;
        clearPendingChanges();
    }

    public void clearState() {
        activeDescriptors = List.of();
        activeResults = null;
        rowCount = 0;
        clearPendingChanges();
    }

    public boolean hasActiveState() {
        return activeResults != null;
    }

    public boolean hasPendingChanges() {
        return !pendingChanges.isEmpty() || (trackItemChanges && !pendingItems.isEmpty());
    }

    public int rowCount() {
        return rowCount;
    }

    /**
     * Apply every queued edit to the cached results.
     *
     * @param descriptors  the descriptor list currently requested
     * @param rowEvaluator matches one row, used for inserted and changed rows
     * @param rowLocator   finds the current index of a changed item
     * @return the patched results, or the reason a full scan is required
     */
    public FlushOutcome<T> tryApplyPending(List<SearchDescriptor> descriptors, RowEvaluator<T> rowEvaluator,
            RowLocator<T> rowLocator) {
        Objects.requireNonNull(rowEvaluator, "rowEvaluator");
        Objects.requireNonNull(rowLocator, "rowLocator");

        if (descriptors == null || descriptors.isEmpty()) {
            clearState();
            return FlushOutcome.applied(List.of(), 0);
        }
        if (activeResults == null) {
            clearPendingChanges();
            return FlushOutcome.fallback(FallbackReason.NO_ACTIVE_STATE);
        }
        if (!activeDescriptors.equals(descriptors)) {
            clearState();
            return FlushOutcome.fallback(FallbackReason.DESCRIPTORS_CHANGED);
        }
        if (!hasPendingChanges()) {
            return FlushOutcome.applied(activeResults, 0);
        }
        if (pendingReset) {
            return fail(FallbackReason.RESET);
        }

        // Patch a working copy; any exception leaves no cached state behind.
        activeResults = new ArrayList<>(activeResults);
        boolean completed = false;
        int applied = 0;
        try {
            for (CollectionChange<T> change : pendingChanges) {
                FallbackReason failure = applyCollectionChange(change, rowEvaluator);
                if (failure != null) {
                    return fail(failure);
                }
                applied++;
            }

            if (trackItemChanges) {
                for (T item : pendingItems) {
                    FallbackReason failure = applyItemChange(item, rowEvaluator, rowLocator);
                    if (failure != null) {
                        return fail(failure);
                    }
                    applied++;
                }
            }
            completed = true;
        } finally {
            if (!completed) {
                clearState();
            }
        }

        clearPendingChanges();
        return FlushOutcome.applied(activeResults, applied);
    }

    private FlushOutcome<T> fail(FallbackReason reason) {
        clearState();
        return FlushOutcome.fallback(reason);
    }

    private FallbackReason applyCollectionChange(CollectionChange<T> change, RowEvaluator<T> rowEvaluator) {
        LOG.trace("Applying {} (new={}, old={}, +{}, -{})", change.kind(), change.newStartingIndex(),
                change.oldStartingIndex(), change.newCount(), change.oldCount());
        switch (change.kind()) {
            case ADD:
                return applyAdd(change, rowEvaluator);
            case REMOVE:
                return applyRemove(change);
            case REPLACE:
                return applyReplace(change, rowEvaluator);
            case RESET:
                return FallbackReason.RESET;
            case MOVE:
            default:
                return FallbackReason.MOVE;
        }
    }

    private FallbackReason applyAdd(CollectionChange<T> change, RowEvaluator<T> rowEvaluator) {
        int count = change.newCount();
        if (count == 0) {
            return null;
        }
        int start = change.newStartingIndex();
        if (start < 0) {
            return FallbackReason.UNKNOWN_INDEX;
        }
        if (start > rowCount) {
            return FallbackReason.INDEX_OUT_OF_RANGE;
        }
        shiftRowIndexes(start, count);
        insertResults(start, evaluateRows(change.newItems(), start, rowEvaluator));
        rowCount += count;
        return null;
    }

    private FallbackReason applyRemove(CollectionChange<T> change) {
        int count = change.oldCount();
        if (count == 0) {
            return null;
        }
        int start = change.oldStartingIndex();
        if (start < 0) {
            return FallbackReason.UNKNOWN_INDEX;
        }
        if (start + count > rowCount) {
            return FallbackReason.INDEX_OUT_OF_RANGE;
        }
        removeRowRange(start, count);
        shiftRowIndexes(start + count, -count);
        rowCount -= count;
        return null;
    }

    private FallbackReason applyReplace(CollectionChange<T> change, RowEvaluator<T> rowEvaluator) {
        int oldCount = change.oldCount();
        int newCount = change.newCount();
        if (oldCount == 0 && newCount == 0) {
            return null;
        }
        int newStart = change.newStartingIndex();
        int oldStart = change.oldStartingIndex();
        int base = newStart >= 0 ? newStart : oldStart;
        if (base < 0) {
            return FallbackReason.UNKNOWN_INDEX;
        }
        if (newStart >= 0 && oldStart >= 0 && newStart != oldStart) {
            return FallbackReason.MISMATCHED_REPLACE;
        }
        if (base + oldCount > rowCount) {
            return FallbackReason.INDEX_OUT_OF_RANGE;
        }

        removeRowRange(base, oldCount);
        int delta = newCount - oldCount;
        if (delta != 0) {
            shiftRowIndexes(base + oldCount, delta);
        }
        if (newCount > 0) {
            insertResults(base, evaluateRows(change.newItems(), base, rowEvaluator));
        }
        rowCount += delta;
        return null;
    }

    private FallbackReason applyItemChange(T item, RowEvaluator<T> rowEvaluator, RowLocator<T> rowLocator) {
        RowLocation location = rowLocator.locate(item);
        switch (location.status()) {
            case ABSENT:
                return null;
            case AMBIGUOUS:
                return FallbackReason.AMBIGUOUS_ITEM;
            default:
                break;
        }
        int rowIndex = location.index();
        if (rowIndex >= rowCount) {
            return FallbackReason.INDEX_OUT_OF_RANGE;
        }
        removeRowRange(rowIndex, 1);
        insertResults(rowIndex, rowEvaluator.evaluate(item, rowIndex));
        return null;
    }

    private List<SearchResult<T>> evaluateRows(List<T> items, int startRowIndex, RowEvaluator<T> rowEvaluator) {
        List<SearchResult<T>> results = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            List<SearchResult<T>> rowResults = rowEvaluator.evaluate(items.get(i), startRowIndex + i);
            if (rowResults != null) {
                results.addAll(rowResults);
            }
        }
        return results;
    }

    private void removeRowRange(int startRow, int count) {
        if (count <= 0 || activeResults.isEmpty()) {
            return;
        }
        int from = firstIndexAtOrAfter(startRow);
        int to = firstIndexAtOrAfter(startRow + count);
        if (to > from) {
            activeResults.subList(from, to).clear();
        }
    }

    private void shiftRowIndexes(int startRow, int delta) {
        if (delta == 0 || activeResults.isEmpty()) {
            return;
        }
        for (int i = firstIndexAtOrAfter(startRow); i < activeResults.size(); i++) {
            SearchResult<T> current = activeResults.get(i);
            activeResults.set(i, current.withRowIndex(current.rowIndex() + delta));
        }
    }

    private void insertResults(int startRow, List<SearchResult<T>> results) {
        if (results == null || results.isEmpty()) {
            return;
        }
        activeResults.addAll(firstIndexAtOrAfter(startRow), results);
    }

    /**
     * Binary search for the first cached result whose row index is at least
     * {@code rowIndex}.
     */
    int firstIndexAtOrAfter(int rowIndex) {
        int low = 0;
        int high = activeResults.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (activeResults.get(mid).rowIndex() < rowIndex) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    private void clearPendingChanges() {
        pendingChanges.clear();
        pendingItems.clear();
        pendingReset = false;
    }
}
