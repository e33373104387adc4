package io.cellscan.kernel;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Ordered view of the rows being searched. Row indexes are positions in
 * iteration order.
 * <p>
 * Sources that can answer "where is this item now" without scanning should
 * also implement {@link ReferenceIndexLookup}.
 *
 * @param <T> row item type
 */
public interface RowSource<T> extends Iterable<T> {

    /**
     * Wrap a live list. Later mutations of the list are visible to the source.
     */
    static <T> RowSource<T> of(List<T> rows) {
        Objects.requireNonNull(rows, "rows");
        return new RowSource<>() {
            @Override
            public Iterator<T> iterator() {
                return rows.iterator();
            }

            @Override
            public String toString() {
                return "RowSource" + rows;
            }
        };
    }
}
