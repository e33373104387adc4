package io.cellscan.query;

import io.cellscan.kernel.ComparisonKind;

import java.util.regex.Pattern;

/**
 * Centralized derivation of {@link Pattern} flags from a comparison kind.
 * <p>
 * Java patterns are locale independent, so culture invariance needs no flag.
 */
public final class PatternFlags {

    private PatternFlags() {
        // utility class
    }

    public static int forComparison(ComparisonKind comparison) {
        ComparisonKind effective = comparison != null ? comparison : ComparisonKind.DEFAULT;
        int flags = 0;
        if (effective.ignoreCase()) {
            flags |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        }
        return flags;
    }
}
