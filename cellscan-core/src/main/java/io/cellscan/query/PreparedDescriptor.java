package io.cellscan.query;

import io.cellscan.kernel.MatchMode;
import io.cellscan.kernel.TermCombineMode;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Compiled, reusable form of a {@link io.cellscan.kernel.SearchDescriptor}.
 * <p>
 * This is the output of {@link QueryCompiler#compile} and carries everything
 * the row matcher needs at match time: either the literal terms or the
 * compiled pattern, plus the flags that shape matching.
 *
 * @param matchMode           match grammar
 * @param termMode            how literal terms combine
 * @param ignoreCase          case-insensitive literal comparison
 * @param wholeWord           matches must sit on word boundaries
 * @param normalizeWhitespace collapse whitespace runs in cell text
 * @param ignoreDiacritics    strip combining marks from cell text
 * @param allowEmpty          an empty query matches every non-empty text
 * @param hasQuery            false when the query is empty
 * @param valid               false when the pattern did not compile
 * @param terms               literal terms, empty for pattern modes
 * @param pattern             compiled pattern, {@code null} for literal modes
 */
public record PreparedDescriptor(
        MatchMode matchMode,
        TermCombineMode termMode,
        boolean ignoreCase,
        boolean wholeWord,
        boolean normalizeWhitespace,
        boolean ignoreDiacritics,
        boolean allowEmpty,
        boolean hasQuery,
        boolean valid,
        List<String> terms,
        Pattern pattern
) {

    public PreparedDescriptor {
        if (matchMode == null) {
            throw new IllegalArgumentException("matchMode required");
        }
        if (termMode == null) {
            throw new IllegalArgumentException("termMode required");
        }
        terms = terms == null ? List.of() : List.copyOf(terms);
    }

    /**
     * @return true if this descriptor can never produce a match
     */
    public boolean matchesNothing() {
        if (!hasQuery) {
            return !allowEmpty;
        }
        if (!valid) {
            return true;
        }
        return matchMode.isPattern() ? pattern == null : terms.isEmpty();
    }
}
