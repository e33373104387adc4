package io.cellscan.kernel;

/**
 * Fast item-to-index lookup using reference semantics.
 * <p>
 * Implementations must return the single position of {@code item}; a source
 * that may hold the same instance twice should not implement this interface.
 */
public interface ReferenceIndexLookup {

    /**
     * @param item the row instance to locate
     * @return current row index, or -1 if the item is not in the source
     */
    int referenceIndexOf(Object item);
}
