package io.cellscan.kernel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable, user-supplied search request: query text, match grammar, column
 * scope and normalization flags.
 * <p>
 * Equality is structural, so two descriptor lists can be compared
 * element-wise to detect whether the requested search changed.
 */
public final class SearchDescriptor {

    private final String query;
    private final MatchMode matchMode;
    private final TermCombineMode termMode;
    private final SearchScope scope;
    private final List<Object> columnIds;
    private final ComparisonKind comparison;
    private final Locale locale;
    private final boolean wholeWord;
    private final boolean normalizeWhitespace;
    private final boolean ignoreDiacritics;
    private final boolean allowEmpty;

    private SearchDescriptor(Builder builder) {
        this.query = builder.query == null ? "" : builder.query;
        this.matchMode = builder.matchMode;
        this.termMode = builder.termMode;
        this.scope = builder.scope;
        this.columnIds = List.copyOf(builder.columnIds);
        this.comparison = builder.comparison;
        this.locale = builder.locale;
        this.wholeWord = builder.wholeWord;
        this.normalizeWhitespace = builder.normalizeWhitespace;
        this.ignoreDiacritics = builder.ignoreDiacritics;
        this.allowEmpty = builder.allowEmpty;
    }

    public static SearchDescriptor of(String query) {
        return builder(query).build();
    }

    public static Builder builder(String query) {
        return new Builder(query);
    }

    /**
     * Start a builder pre-populated with this descriptor's values.
     */
    public Builder toBuilder() {
        Builder builder = new Builder(query)
                .matchMode(matchMode)
                .termMode(termMode)
                .scope(scope)
                .comparison(comparison)
                .locale(locale)
                .wholeWord(wholeWord)
                .normalizeWhitespace(normalizeWhitespace)
                .ignoreDiacritics(ignoreDiacritics)
                .allowEmpty(allowEmpty);
        builder.columnIds.addAll(columnIds);
        return builder;
    }

    public String query() {
        return query;
    }

    public boolean hasQuery() {
        return !query.isEmpty();
    }

    public MatchMode matchMode() {
        return matchMode;
    }

    public TermCombineMode termMode() {
        return termMode;
    }

    public SearchScope scope() {
        return scope;
    }

    /**
     * Column identifiers selected under {@link SearchScope#EXPLICIT_COLUMNS}.
     * An identifier matches a column by equality with the column id, or, for a
     * {@code String}, with the column's property path.
     */
    public List<Object> columnIds() {
        return columnIds;
    }

    /**
     * @return requested comparison, or {@code null} for the default
     * @see ComparisonKind#DEFAULT
     */
    public ComparisonKind comparison() {
        return comparison;
    }

    public ComparisonKind effectiveComparison() {
        return comparison != null ? comparison : ComparisonKind.DEFAULT;
    }

    /**
     * @return culture used to format cell values, or {@code null} to use the
     *         engine default
     */
    public Locale locale() {
        return locale;
    }

    public boolean wholeWord() {
        return wholeWord;
    }

    public boolean normalizeWhitespace() {
        return normalizeWhitespace;
    }

    public boolean ignoreDiacritics() {
        return ignoreDiacritics;
    }

    public boolean allowEmpty() {
        return allowEmpty;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        SearchDescriptor other = (SearchDescriptor) obj;
        return wholeWord == other.wholeWord
                && normalizeWhitespace == other.normalizeWhitespace
                && ignoreDiacritics == other.ignoreDiacritics
                && allowEmpty == other.allowEmpty
                && query.equals(other.query)
                && matchMode == other.matchMode
                && termMode == other.termMode
                && scope == other.scope
                && comparison == other.comparison
                && columnIds.equals(other.columnIds)
                && Objects.equals(locale, other.locale);
    }

    @Override
    public int hashCode() {
        return Objects.hash(query, matchMode, termMode, scope, columnIds, comparison, locale,
                wholeWord, normalizeWhitespace, ignoreDiacritics, allowEmpty);
    }

    @Override
    public String toString() {
        return "SearchDescriptor{query='" + query + "', matchMode=" + matchMode
                + ", termMode=" + termMode + ", scope=" + scope
                + (columnIds.isEmpty() ? "" : ", columnIds=" + columnIds)
                + ", comparison=" + effectiveComparison() + "}";
    }

    public static final class Builder {
        private final String query;
        private MatchMode matchMode = MatchMode.CONTAINS;
        private TermCombineMode termMode = TermCombineMode.ANY;
        private SearchScope scope = SearchScope.ALL_COLUMNS;
        private final List<Object> columnIds = new ArrayList<>();
        private ComparisonKind comparison;
        private Locale locale;
        private boolean wholeWord;
        private boolean normalizeWhitespace;
        private boolean ignoreDiacritics;
        private boolean allowEmpty;

        private Builder(String query) {
            this.query = query;
        }

        public Builder matchMode(MatchMode matchMode) {
            this.matchMode = Objects.requireNonNull(matchMode, "matchMode");
            return this;
        }

        public Builder termMode(TermCombineMode termMode) {
            this.termMode = Objects.requireNonNull(termMode, "termMode");
            return this;
        }

        public Builder scope(SearchScope scope) {
            this.scope = Objects.requireNonNull(scope, "scope");
            return this;
        }

        /**
         * Restrict the search to the given columns. Implies
         * {@link SearchScope#EXPLICIT_COLUMNS}.
         */
        public Builder columns(Object... ids) {
            return columns(List.of(ids));
        }

        public Builder columns(Collection<?> ids) {
            columnIds.clear();
            for (Object id : ids) {
                if (id == null) {
                    throw new IllegalArgumentException("column id required");
                }
                columnIds.add(id);
            }
            this.scope = SearchScope.EXPLICIT_COLUMNS;
            return this;
        }

        public Builder comparison(ComparisonKind comparison) {
            this.comparison = comparison;
            return this;
        }

        public Builder caseSensitive(boolean caseSensitive) {
            this.comparison = caseSensitive ? ComparisonKind.ORDINAL : ComparisonKind.ORDINAL_IGNORE_CASE;
            return this;
        }

        public Builder locale(Locale locale) {
            this.locale = locale;
            return this;
        }

        public Builder wholeWord(boolean wholeWord) {
            this.wholeWord = wholeWord;
            return this;
        }

        public Builder normalizeWhitespace(boolean normalizeWhitespace) {
            this.normalizeWhitespace = normalizeWhitespace;
            return this;
        }

        public Builder ignoreDiacritics(boolean ignoreDiacritics) {
            this.ignoreDiacritics = ignoreDiacritics;
            return this;
        }

        public Builder allowEmpty(boolean allowEmpty) {
            this.allowEmpty = allowEmpty;
            return this;
        }

        public SearchDescriptor build() {
            return new SearchDescriptor(this);
        }
    }
}
