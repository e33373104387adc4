package io.cellscan.text;

import java.text.Normalizer;
import java.util.Arrays;

/**
 * Converts cell text into its comparison form.
 * <p>
 * Whitespace normalization collapses every run of Unicode whitespace into a
 * single U+0020. Diacritic removal canonically decomposes each non-ASCII
 * character and drops the non-spacing marks. Both keep an offset map so match
 * spans can be reported against the original text.
 */
public final class TextNormalizer {

    private static final char SPACE = ' ';

    private TextNormalizer() {
    }

    public static NormalizedText normalize(String text, boolean normalizeWhitespace, boolean ignoreDiacritics) {
        if (text == null) {
            return NormalizedText.identity("");
        }
        if (!normalizeWhitespace && !ignoreDiacritics) {
            return NormalizedText.identity(text);
        }

        boolean collapse = normalizeWhitespace && needsWhitespaceNormalization(text);
        if (!ignoreDiacritics && !collapse) {
            return NormalizedText.identity(text);
        }

        boolean ascii = ignoreDiacritics && isAscii(text);
        if (ascii && !collapse) {
            return NormalizedText.identity(text);
        }

        Sink sink = new Sink(text.length(), normalizeWhitespace);
        for (int i = 0; i < text.length(); i++) {
            char source = text.charAt(i);
            if (ignoreDiacritics && !ascii && source > 0x7F) {
                String decomposed = Normalizer.normalize(String.valueOf(source), Normalizer.Form.NFD);
                for (int j = 0; j < decomposed.length(); j++) {
                    char ch = decomposed.charAt(j);
                    if (Character.getType(ch) != Character.NON_SPACING_MARK) {
                        sink.append(ch, i);
                    }
                }
            } else {
                sink.append(source, i);
            }
        }
        return sink.toNormalizedText();
    }

    /**
     * Normalize a query with the same rules as the cell text it is matched
     * against. No offset map is needed for queries.
     */
    public static String normalizeQuery(String query, boolean normalizeWhitespace, boolean ignoreDiacritics) {
        if (!normalizeWhitespace && !ignoreDiacritics) {
            return query;
        }
        return normalize(query, normalizeWhitespace, ignoreDiacritics).text();
    }

    /**
     * Unicode whitespace, including the no-break spaces that
     * {@link Character#isWhitespace(char)} leaves out.
     */
    public static boolean isWhitespace(char ch) {
        return Character.isWhitespace(ch) || Character.isSpaceChar(ch);
    }

    static boolean needsWhitespaceNormalization(String text) {
        boolean wasWhitespace = false;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (!isWhitespace(ch)) {
                wasWhitespace = false;
                continue;
            }
            if (ch != SPACE || wasWhitespace) {
                return true;
            }
            wasWhitespace = true;
        }
        return false;
    }

    static boolean isAscii(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) > 0x7F) {
                return false;
            }
        }
        return true;
    }

    private static final class Sink {
        private final StringBuilder builder;
        private final boolean collapseWhitespace;
        private int[] map;
        private int size;
        private boolean wasWhitespace;

        Sink(int capacity, boolean collapseWhitespace) {
            this.builder = new StringBuilder(capacity);
            this.map = new int[Math.max(16, capacity)];
            this.collapseWhitespace = collapseWhitespace;
        }

        void append(char ch, int sourceIndex) {
            if (collapseWhitespace && isWhitespace(ch)) {
                if (wasWhitespace) {
                    return;
                }
                ch = SPACE;
                wasWhitespace = true;
            } else {
                wasWhitespace = false;
            }
            if (size == map.length) {
                map = Arrays.copyOf(map, size * 2);
            }
            map[size++] = sourceIndex;
            builder.append(ch);
        }

        NormalizedText toNormalizedText() {
            return new NormalizedText(builder.toString(), Arrays.copyOf(map, size));
        }
    }
}
