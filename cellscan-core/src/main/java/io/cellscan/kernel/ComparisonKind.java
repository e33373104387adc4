package io.cellscan.kernel;

/**
 * Requested string comparison. Only the case sensitivity matters for
 * matching; the culture kinds compare char by char like the ordinal ones.
 */
public enum ComparisonKind {
    ORDINAL(false),
    ORDINAL_IGNORE_CASE(true),
    INVARIANT_CULTURE(false),
    INVARIANT_CULTURE_IGNORE_CASE(true),
    CURRENT_CULTURE(false),
    CURRENT_CULTURE_IGNORE_CASE(true);

    public static final ComparisonKind DEFAULT = ORDINAL_IGNORE_CASE;

    private final boolean ignoreCase;

    ComparisonKind(boolean ignoreCase) {
        this.ignoreCase = ignoreCase;
    }

    public boolean ignoreCase() {
        return ignoreCase;
    }
}
