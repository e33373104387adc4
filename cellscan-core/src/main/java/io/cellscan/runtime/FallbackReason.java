package io.cellscan.runtime;

/**
 * Why queued edits could not be applied incrementally.
 */
public enum FallbackReason {
    NO_ACTIVE_STATE,
    DESCRIPTORS_CHANGED,
    RESET,
    MOVE,
    UNKNOWN_INDEX,
    INDEX_OUT_OF_RANGE,
    MISMATCHED_REPLACE,
    AMBIGUOUS_ITEM
}
