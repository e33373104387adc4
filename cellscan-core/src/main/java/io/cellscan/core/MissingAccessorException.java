package io.cellscan.core;

/**
 * Raised in fail-fast mode when a searchable column exposes neither a text
 * provider nor a value getter.
 */
public class MissingAccessorException extends CellScanException {

    private final transient MissingAccessorDiagnostic diagnostic;

    public MissingAccessorException(MissingAccessorDiagnostic diagnostic) {
        super(diagnostic.message());
        this.diagnostic = diagnostic;
    }

    public MissingAccessorDiagnostic diagnostic() {
        return diagnostic;
    }
}
