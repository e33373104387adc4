package io.cellscan.kernel;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One edit of the row source, recorded when it happens and applied later.
 * <p>
 * New items travel with the change because by flush time the rows at
 * {@code newStartingIndex} may already have moved again.
 *
 * @param kind             edit kind
 * @param newStartingIndex first index of the inserted rows, -1 if unknown
 * @param oldStartingIndex first index of the removed rows, -1 if unknown
 * @param newItems         inserted rows, in order
 * @param oldCount         number of removed rows
 */
public record CollectionChange<T>(ChangeKind kind, int newStartingIndex, int oldStartingIndex, List<T> newItems,
        int oldCount) {

    public CollectionChange {
        if (kind == null) {
            throw new IllegalArgumentException("kind required");
        }
        if (oldCount < 0) {
            throw new IllegalArgumentException("oldCount must be non-negative: " + oldCount);
        }
        // null rows are allowed
        newItems = newItems == null || newItems.isEmpty()
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(newItems));
    }

    public static <T> CollectionChange<T> added(int index, List<T> items) {
        return new CollectionChange<>(ChangeKind.ADD, index, -1, items, 0);
    }

    @SafeVarargs
    public static <T> CollectionChange<T> added(int index, T... items) {
        return added(index, Arrays.asList(items));
    }

    public static <T> CollectionChange<T> removed(int index, int count) {
        return new CollectionChange<>(ChangeKind.REMOVE, -1, index, List.of(), count);
    }

    public static <T> CollectionChange<T> replaced(int index, int oldCount, List<T> items) {
        return new CollectionChange<>(ChangeKind.REPLACE, index, index, items, oldCount);
    }

    public static <T> CollectionChange<T> moved(int oldIndex, int newIndex, List<T> items) {
        return new CollectionChange<>(ChangeKind.MOVE, newIndex, oldIndex, items, items == null ? 0 : items.size());
    }

    public static <T> CollectionChange<T> reset() {
        return new CollectionChange<>(ChangeKind.RESET, -1, -1, List.of(), 0);
    }

    public int newCount() {
        return newItems.size();
    }
}
