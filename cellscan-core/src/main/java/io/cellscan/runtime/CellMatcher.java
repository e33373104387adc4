package io.cellscan.runtime;

import io.cellscan.kernel.MatchMode;
import io.cellscan.kernel.SearchMatch;
import io.cellscan.kernel.SearchMatches;
import io.cellscan.kernel.TermCombineMode;
import io.cellscan.query.PreparedDescriptor;
import io.cellscan.text.NormalizedText;
import io.cellscan.text.TextNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Runs a prepared descriptor against the text of one cell.
 * <p>
 * Returned spans are sorted, non-overlapping and expressed in the coordinates
 * of the original (un-normalized) text.
 */
public final class CellMatcher {

    private CellMatcher() {
    }

    public static List<SearchMatch> findMatches(String text, PreparedDescriptor descriptor) {
        if (descriptor == null || text == null || text.isEmpty()) {
            return List.of();
        }
        if (!descriptor.hasQuery()) {
            return descriptor.allowEmpty() ? List.of(new SearchMatch(0, text.length())) : List.of();
        }
        if (!descriptor.valid()) {
            return List.of();
        }

        NormalizedText normalized = TextNormalizer.normalize(
                text, descriptor.normalizeWhitespace(), descriptor.ignoreDiacritics());

        if (descriptor.matchMode().isPattern()) {
            return findPatternMatches(normalized, descriptor);
        }
        if (descriptor.terms().isEmpty()) {
            return List.of();
        }

        List<SearchMatch> collected = new ArrayList<>();
        for (String term : descriptor.terms()) {
            int before = collected.size();
            findTermMatches(normalized.text(), term, descriptor, collected);
            if (collected.size() == before && descriptor.termMode() == TermCombineMode.ALL) {
                return List.of();
            }
        }
        if (collected.isEmpty()) {
            return List.of();
        }
        return toOriginal(SearchMatches.mergeOverlaps(collected), normalized);
    }

    private static List<SearchMatch> findPatternMatches(NormalizedText normalized, PreparedDescriptor descriptor) {
        if (descriptor.pattern() == null) {
            return List.of();
        }
        List<SearchMatch> matches = new ArrayList<>();
        Matcher matcher = descriptor.pattern().matcher(normalized.text());
        while (matcher.find()) {
            int length = matcher.end() - matcher.start();
            if (length > 0) {
                matches.add(new SearchMatch(matcher.start(), length));
            }
        }
        return toOriginal(matches, normalized);
    }

    static void findTermMatches(String text, String term, PreparedDescriptor descriptor, List<SearchMatch> sink) {
        boolean ignoreCase = descriptor.ignoreCase();
        boolean wholeWord = descriptor.wholeWord();
        int length = term.length();
        MatchMode mode = descriptor.matchMode();

        if (mode == MatchMode.STARTS_WITH) {
            if (text.regionMatches(ignoreCase, 0, term, 0, length) && isWholeWord(text, 0, length, wholeWord)) {
                sink.add(new SearchMatch(0, length));
            }
        } else if (mode == MatchMode.ENDS_WITH) {
            int start = text.length() - length;
            if (start >= 0 && text.regionMatches(ignoreCase, start, term, 0, length)
                    && isWholeWord(text, start, length, wholeWord)) {
                sink.add(new SearchMatch(start, length));
            }
        } else if (mode == MatchMode.EQUALS) {
            if (ignoreCase ? text.equalsIgnoreCase(term) : text.equals(term)) {
                sink.add(new SearchMatch(0, length));
            }
        } else {
            int index = 0;
            while ((index = indexOf(text, term, index, ignoreCase)) >= 0) {
                if (isWholeWord(text, index, length, wholeWord)) {
                    sink.add(new SearchMatch(index, length));
                }
                index += length;
            }
        }
    }

    static int indexOf(String text, String term, int from, boolean ignoreCase) {
        if (!ignoreCase) {
            return text.indexOf(term, from);
        }
        int last = text.length() - term.length();
        for (int i = from; i <= last; i++) {
            if (text.regionMatches(true, i, term, 0, term.length())) {
                return i;
            }
        }
        return -1;
    }

    /**
     * A span is a whole word when the characters around it, if any, are not
     * letters, digits or underscores.
     */
    static boolean isWholeWord(String text, int start, int length, boolean wholeWord) {
        if (!wholeWord) {
            return true;
        }
        int end = start + length;
        if (start > 0 && isWordChar(text.charAt(start - 1))) {
            return false;
        }
        return end >= text.length() || !isWordChar(text.charAt(end));
    }

    private static boolean isWordChar(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_';
    }

    private static List<SearchMatch> toOriginal(List<SearchMatch> matches, NormalizedText normalized) {
        if (matches.isEmpty()) {
            return List.of();
        }
        if (normalized.isIdentity()) {
            return List.copyOf(matches);
        }
        List<SearchMatch> mapped = new ArrayList<>(matches.size());
        for (SearchMatch match : matches) {
            SearchMatch original = normalized.toOriginal(match.start(), match.length());
            if (original != null) {
                mapped.add(original);
            }
        }
        return List.copyOf(mapped);
    }
}
