package io.cellscan.runtime;

import io.cellscan.kernel.SearchResult;

import java.util.List;

/**
 * Result of trying to apply queued edits to cached results.
 *
 * @param applied      true if the cached results are current
 * @param results      the patched results, {@code null} on fallback
 * @param changeCount  number of queued edits applied
 * @param reason       why a full scan is required, {@code null} when applied
 */
public record FlushOutcome<T>(boolean applied, List<SearchResult<T>> results, int changeCount,
        FallbackReason reason) {

    public static <T> FlushOutcome<T> applied(List<SearchResult<T>> results, int changeCount) {
        return new FlushOutcome<>(true, results, changeCount, null);
    }

    public static <T> FlushOutcome<T> fallback(FallbackReason reason) {
        return new FlushOutcome<>(false, null, 0, reason);
    }
}
