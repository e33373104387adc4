package io.cellscan.kernel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public final class SearchMatches {

    private SearchMatches() {
    }

    /**
     * Merge overlapping and adjacent spans into the minimal disjoint covering set.
     * <p>
     * Spans are ordered by start, then by length. A span starting inside or
     * directly at the end of the previous one extends it.
     *
     * @param matches spans in any order, may be {@code null}
     * @return sorted, non-overlapping, unmodifiable list
     */
    public static List<SearchMatch> mergeOverlaps(Collection<SearchMatch> matches) {
        if (matches == null || matches.isEmpty()) {
            return List.of();
        }
        List<SearchMatch> ordered = new ArrayList<>(matches.size());
        for (SearchMatch match : matches) {
            if (match != null) {
                ordered.add(match);
            }
        }
        if (ordered.isEmpty()) {
            return List.of();
        }
        ordered.sort(null);

        List<SearchMatch> merged = new ArrayList<>(ordered.size());
        SearchMatch last = ordered.get(0);
        for (int i = 1; i < ordered.size(); i++) {
            SearchMatch current = ordered.get(i);
            if (current.start() <= last.end()) {
                int end = Math.max(last.end(), current.end());
                last = new SearchMatch(last.start(), end - last.start());
            } else {
                merged.add(last);
                last = current;
            }
        }
        merged.add(last);
        return List.copyOf(merged);
    }
}
