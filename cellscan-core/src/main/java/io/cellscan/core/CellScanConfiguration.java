package io.cellscan.core;

import java.util.Locale;
import java.util.Objects;

/**
 * Immutable configuration for a search engine instance.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * CellScanConfiguration config = CellScanConfiguration.builder()
 *     .incrementalSearch(true)
 *     .trackItemChanges(false)
 *     .build();
 * </pre>
 * <p>
 * All configuration is immutable once built.
 */
public final class CellScanConfiguration {

    private static final CellScanConfiguration DEFAULTS = builder().build();

    // Result maintenance
    private final boolean incrementalSearch;
    private final boolean trackItemChanges;

    // Column accessor diagnostics
    private final boolean throwOnMissingAccessor;
    private final MissingAccessorListener missingAccessorListener;

    // Text formatting
    private final Locale defaultLocale;

    private CellScanConfiguration(Builder builder) {
        this.incrementalSearch = builder.incrementalSearch;
        this.trackItemChanges = builder.trackItemChanges;
        this.throwOnMissingAccessor = builder.throwOnMissingAccessor;
        this.missingAccessorListener = builder.missingAccessorListener;
        this.defaultLocale = builder.defaultLocale != null ? builder.defaultLocale : Locale.ROOT;
    }

    /**
     * Create a new builder for CellScanConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Configuration with every option at its default value.
     *
     * @return the shared default configuration
     */
    public static CellScanConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Check if cached results are patched from queued collection edits instead
     * of being recomputed on every refresh.
     *
     * @return true if incremental maintenance is enabled (default: true)
     */
    public boolean incrementalSearch() {
        return incrementalSearch;
    }

    /**
     * Check if item-level change notifications are recorded and re-matched.
     * Only meaningful when incremental search is enabled.
     *
     * @return true if item changes are tracked (default: true)
     */
    public boolean trackItemChanges() {
        return trackItemChanges;
    }

    /**
     * Check if a searchable column without an accessor aborts the search.
     *
     * @return true for fail-fast mode (default: false)
     */
    public boolean throwOnMissingAccessor() {
        return throwOnMissingAccessor;
    }

    /**
     * Get the listener notified about columns without an accessor.
     *
     * @return the listener, or {@code null} when diagnostics are only logged
     */
    public MissingAccessorListener missingAccessorListener() {
        return missingAccessorListener;
    }

    /**
     * Get the locale used to format cell values when a descriptor names none.
     *
     * @return default locale (default: {@link Locale#ROOT})
     */
    public Locale defaultLocale() {
        return defaultLocale;
    }

    /**
     * Builder for CellScanConfiguration.
     * <p>
     * Provides a fluent API for building configuration instances.
     */
    public static final class Builder {
        private boolean incrementalSearch = true;
        private boolean trackItemChanges = true;
        private boolean throwOnMissingAccessor;
        private MissingAccessorListener missingAccessorListener;
        private Locale defaultLocale = Locale.ROOT;

        private Builder() {
        }

        /**
         * Enable or disable incremental maintenance of cached results.
         *
         * @param incrementalSearch true to patch results from queued edits
         * @return this builder for method chaining
         */
        public Builder incrementalSearch(boolean incrementalSearch) {
            this.incrementalSearch = incrementalSearch;
            return this;
        }

        /**
         * Enable or disable tracking of in-place item changes.
         *
         * @param trackItemChanges true to re-match rows reported as changed
         * @return this builder for method chaining
         */
        public Builder trackItemChanges(boolean trackItemChanges) {
            this.trackItemChanges = trackItemChanges;
            return this;
        }

        /**
         * Make a column without an accessor a hard failure.
         *
         * @param throwOnMissingAccessor true for fail-fast mode
         * @return this builder for method chaining
         */
        public Builder throwOnMissingAccessor(boolean throwOnMissingAccessor) {
            this.throwOnMissingAccessor = throwOnMissingAccessor;
            return this;
        }

        public Builder missingAccessorListener(MissingAccessorListener missingAccessorListener) {
            this.missingAccessorListener = missingAccessorListener;
            return this;
        }

        /**
         * Set the locale used for value formatting when a descriptor has none.
         *
         * @param defaultLocale the locale, not null
         * @return this builder for method chaining
         */
        public Builder defaultLocale(Locale defaultLocale) {
            this.defaultLocale = Objects.requireNonNull(defaultLocale, "defaultLocale");
            return this;
        }

        /**
         * Build the immutable CellScanConfiguration.
         *
         * @return a new CellScanConfiguration instance
         */
        public CellScanConfiguration build() {
            return new CellScanConfiguration(this);
        }
    }
}
