package io.cellscan.runtime;

@FunctionalInterface
public interface RowLocator<T> {

    RowLocation locate(T item);
}
