package io.cellscan.core;

import java.util.Objects;

/**
 * Describes a column that was excluded from matching because no text could be
 * extracted from it.
 *
 * @param columnId the host column identifier
 * @param header   the column header, may be {@code null}
 * @param message  human readable description
 */
public record MissingAccessorDiagnostic(Object columnId, String header, String message) {
    public MissingAccessorDiagnostic {
        Objects.requireNonNull(message, "message");
    }
}
