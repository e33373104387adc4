package io.cellscan.engine;

/**
 * How the current results were produced by the last refresh.
 */
public enum RefreshKind {
    /** Nothing has been refreshed yet. */
    NONE,
    /** No descriptors are applied; results are empty. */
    CLEARED,
    /** Cached results were still current. */
    CACHED,
    /** Cached results were patched from queued edits. */
    INCREMENTAL,
    /** The whole source was rescanned. */
    FULL_SCAN
}
