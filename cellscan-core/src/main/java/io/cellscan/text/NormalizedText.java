package io.cellscan.text;

import io.cellscan.kernel.SearchMatch;

/**
 * Comparison form of a cell text plus the mapping back to the original.
 * <p>
 * {@code map[i]} is the offset in the original text of the character that
 * produced normalized character {@code i}. A {@code null} map means the text
 * was not changed and offsets translate to themselves.
 *
 * @param text normalized text
 * @param map  normalized-to-original offsets, {@code null} for identity
 */
public record NormalizedText(String text, int[] map) {

    public NormalizedText {
        if (text == null) {
            throw new IllegalArgumentException("text required");
        }
        if (map != null && map.length != text.length()) {
            throw new IllegalArgumentException("map length " + map.length
                    + " does not match text length " + text.length());
        }
    }

    public static NormalizedText identity(String text) {
        return new NormalizedText(text, null);
    }

    public boolean isIdentity() {
        return map == null;
    }

    /**
     * Translate a span of the normalized text into original coordinates.
     *
     * @param start  start offset in the normalized text
     * @param length span length in the normalized text
     * @return the original span, or {@code null} if the span is empty or falls
     *         outside the normalized text
     */
    public SearchMatch toOriginal(int start, int length) {
        if (length <= 0 || start < 0) {
            return null;
        }
        if (map == null) {
            return start + length <= text.length() ? new SearchMatch(start, length) : null;
        }
        int last = start + length - 1;
        if (last >= map.length) {
            return null;
        }
        int mappedStart = map[start];
        int mappedLength = map[last] - mappedStart + 1;
        return mappedLength > 0 ? new SearchMatch(mappedStart, mappedLength) : null;
    }
}
