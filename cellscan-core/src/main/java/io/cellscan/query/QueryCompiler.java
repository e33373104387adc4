package io.cellscan.query;

import io.cellscan.kernel.ComparisonKind;
import io.cellscan.kernel.MatchMode;
import io.cellscan.kernel.SearchDescriptor;
import io.cellscan.text.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles search descriptors into prepared matchers.
 * <p>
 * Pipeline: normalize query → (pattern modes) translate wildcard, wrap for
 * whole-word, compile → (literal modes) split into terms.
 * <p>
 * Compilation never throws for user input: a malformed pattern yields a
 * descriptor with {@code valid = false} that matches nothing.
 */
public final class QueryCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(QueryCompiler.class);

    /**
     * Compile a descriptor.
     *
     * @param descriptor the descriptor to compile
     * @return the prepared descriptor
     */
    public PreparedDescriptor compile(SearchDescriptor descriptor) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor required");
        }
        ComparisonKind comparison = descriptor.effectiveComparison();

        if (!descriptor.hasQuery()) {
            return prepared(descriptor, comparison, false, true, List.of(), null);
        }

        String normalizedQuery = TextNormalizer.normalizeQuery(
                descriptor.query(), descriptor.normalizeWhitespace(), descriptor.ignoreDiacritics());

        if (descriptor.matchMode().isPattern()) {
            String regex = descriptor.matchMode() == MatchMode.WILDCARD
                    ? wildcardToRegex(normalizedQuery)
                    : normalizedQuery;
            if (descriptor.wholeWord()) {
                regex = "\\b(?:" + regex + ")\\b";
            }
            try {
                Pattern pattern = Pattern.compile(regex, PatternFlags.forComparison(comparison));
                return prepared(descriptor, comparison, true, true, List.of(), pattern);
            } catch (PatternSyntaxException ex) {
                LOG.debug("Query '{}' does not compile as {}: {}", descriptor.query(),
                        descriptor.matchMode(), ex.getDescription());
                return prepared(descriptor, comparison, true, false, List.of(), null);
            }
        }

        return prepared(descriptor, comparison, true, true, tokenize(normalizedQuery), null);
    }

    /**
     * Translate a wildcard query into a regular expression: {@code *} matches
     * any run of characters, {@code ?} exactly one, everything else literally.
     */
    static String wildcardToRegex(String wildcard) {
        StringBuilder regex = new StringBuilder(wildcard.length() + 8);
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < wildcard.length(); i++) {
            char ch = wildcard.charAt(i);
            if (ch == '*' || ch == '?') {
                flushLiteral(regex, literal);
                regex.append(ch == '*' ? ".*" : ".");
            } else {
                literal.append(ch);
            }
        }
        flushLiteral(regex, literal);
        return regex.toString();
    }

    /**
     * Split on single spaces, dropping empty entries.
     */
    static List<String> tokenize(String query) {
        List<String> terms = new ArrayList<>();
        int start = 0;
        for (int i = 0; i <= query.length(); i++) {
            if (i == query.length() || query.charAt(i) == ' ') {
                if (i > start) {
                    terms.add(query.substring(start, i));
                }
                start = i + 1;
            }
        }
        return terms;
    }

    private static void flushLiteral(StringBuilder regex, StringBuilder literal) {
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
            literal.setLength(0);
        }
    }

    private static PreparedDescriptor prepared(SearchDescriptor descriptor, ComparisonKind comparison,
            boolean hasQuery, boolean valid, List<String> terms, Pattern pattern) {
        return new PreparedDescriptor(
                descriptor.matchMode(),
                descriptor.termMode(),
                comparison.ignoreCase(),
                descriptor.wholeWord(),
                descriptor.normalizeWhitespace(),
                descriptor.ignoreDiacritics(),
                descriptor.allowEmpty(),
                hasQuery,
                valid,
                terms,
                pattern);
    }
}
