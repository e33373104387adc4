package io.cellscan.runtime;

import io.cellscan.kernel.ReferenceIndexLookup;
import io.cellscan.kernel.RowSource;

import java.util.Objects;

/**
 * Resolves an item's current row index by reference.
 * <p>
 * Uses the source's {@link ReferenceIndexLookup} when available; otherwise one
 * scan that gives up on the second occurrence of the item.
 */
public final class SourceRowLocator<T> implements RowLocator<T> {

    private final RowSource<T> source;

    public SourceRowLocator(RowSource<T> source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    @Override
    public RowLocation locate(T item) {
        if (item == null) {
            return RowLocation.absent();
        }
        if (source instanceof ReferenceIndexLookup lookup) {
            int index = lookup.referenceIndexOf(item);
            return index >= 0 ? RowLocation.at(index) : RowLocation.absent();
        }
        int found = -1;
        int index = 0;
        for (T candidate : source) {
            if (candidate == item) {
                if (found >= 0) {
                    return RowLocation.ambiguous();
                }
                found = index;
            }
            index++;
        }
        return found >= 0 ? RowLocation.at(found) : RowLocation.absent();
    }
}
