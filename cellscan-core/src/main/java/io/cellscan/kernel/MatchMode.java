package io.cellscan.kernel;

/**
 * How a query is compared against cell text.
 */
public enum MatchMode {
    CONTAINS,
    STARTS_WITH,
    ENDS_WITH,
    EQUALS,
    WILDCARD,
    REGEX;

    /**
     * @return true if the query is compiled to a {@link java.util.regex.Pattern}
     */
    public boolean isPattern() {
        return this == WILDCARD || this == REGEX;
    }
}
