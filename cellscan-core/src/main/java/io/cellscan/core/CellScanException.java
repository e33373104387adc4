package io.cellscan.core;

public class CellScanException extends RuntimeException {

    public CellScanException(Throwable cause) {
        super(cause);
    }

    public CellScanException(String message, Throwable cause) {
        super(message, cause);
    }

    public CellScanException(String message) {
        super(message);
    }

}
