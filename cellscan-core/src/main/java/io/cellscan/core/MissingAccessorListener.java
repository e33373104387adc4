package io.cellscan.core;

/**
 * Receives a diagnostic for every searchable column without an accessor.
 * Invoked synchronously from the scan that resolved the columns.
 */
@FunctionalInterface
public interface MissingAccessorListener {

    void onMissingAccessor(MissingAccessorDiagnostic diagnostic);
}
