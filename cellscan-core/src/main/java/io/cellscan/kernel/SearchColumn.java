package io.cellscan.kernel;

import java.util.Locale;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Host-side description of a column and the ways text can be read from it.
 * <p>
 * A column is matchable when it has a {@code textProvider} or a
 * {@code valueGetter}. The text provider wins when both are set; otherwise the
 * value is passed through the optional converter and format.
 *
 * @param <T> row item type
 */
public final class SearchColumn<T> {

    private final Object id;
    private final String header;
    private final String propertyPath;
    private final int displayIndex;
    private final boolean visible;
    private final boolean searchable;
    private final Function<? super T, String> textProvider;
    private final Function<? super T, ?> valueGetter;
    private final BiFunction<Object, Locale, Object> converter;
    private final String stringFormat;
    private final Locale formatLocale;

    private SearchColumn(Builder<T> builder) {
        this.id = builder.id;
        this.header = builder.header;
        this.propertyPath = builder.propertyPath;
        this.displayIndex = builder.displayIndex;
        this.visible = builder.visible;
        this.searchable = builder.searchable;
        this.textProvider = builder.textProvider;
        this.valueGetter = builder.valueGetter;
        this.converter = builder.converter;
        this.stringFormat = builder.stringFormat;
        this.formatLocale = builder.formatLocale;
    }

    public static <T> Builder<T> builder(Object id) {
        return new Builder<>(id);
    }

    /**
     * Shorthand for a visible, searchable column reading text directly.
     */
    public static <T> SearchColumn<T> ofText(Object id, Function<? super T, String> textProvider) {
        return SearchColumn.<T>builder(id).textProvider(textProvider).build();
    }

    public Object id() {
        return id;
    }

    public String header() {
        return header;
    }

    public String propertyPath() {
        return propertyPath;
    }

    /**
     * @return host display index, or -1 when the host does not assign one
     */
    public int displayIndex() {
        return displayIndex;
    }

    public boolean visible() {
        return visible;
    }

    public boolean searchable() {
        return searchable;
    }

    public Function<? super T, String> textProvider() {
        return textProvider;
    }

    public Function<? super T, ?> valueGetter() {
        return valueGetter;
    }

    public BiFunction<Object, Locale, Object> converter() {
        return converter;
    }

    public String stringFormat() {
        return stringFormat;
    }

    public Locale formatLocale() {
        return formatLocale;
    }

    public boolean hasAccessor() {
        return textProvider != null || valueGetter != null;
    }

    @Override
    public String toString() {
        return "SearchColumn{id=" + id + (header == null ? "" : ", header='" + header + "'") + "}";
    }

    public static final class Builder<T> {
        private final Object id;
        private String header;
        private String propertyPath;
        private int displayIndex = -1;
        private boolean visible = true;
        private boolean searchable = true;
        private Function<? super T, String> textProvider;
        private Function<? super T, ?> valueGetter;
        private BiFunction<Object, Locale, Object> converter;
        private String stringFormat;
        private Locale formatLocale;

        private Builder(Object id) {
            this.id = Objects.requireNonNull(id, "id");
        }

        public Builder<T> header(String header) {
            this.header = header;
            return this;
        }

        public Builder<T> propertyPath(String propertyPath) {
            this.propertyPath = propertyPath;
            return this;
        }

        public Builder<T> displayIndex(int displayIndex) {
            this.displayIndex = displayIndex;
            return this;
        }

        public Builder<T> visible(boolean visible) {
            this.visible = visible;
            return this;
        }

        public Builder<T> searchable(boolean searchable) {
            this.searchable = searchable;
            return this;
        }

        public Builder<T> textProvider(Function<? super T, String> textProvider) {
            this.textProvider = textProvider;
            return this;
        }

        public Builder<T> valueGetter(Function<? super T, ?> valueGetter) {
            this.valueGetter = valueGetter;
            return this;
        }

        public Builder<T> converter(BiFunction<Object, Locale, Object> converter) {
            this.converter = converter;
            return this;
        }

        /**
         * @param stringFormat a {@link String#format} pattern applied to the
         *                     (converted) value
         */
        public Builder<T> stringFormat(String stringFormat) {
            this.stringFormat = stringFormat;
            return this;
        }

        public Builder<T> formatLocale(Locale formatLocale) {
            this.formatLocale = formatLocale;
            return this;
        }

        public SearchColumn<T> build() {
            return new SearchColumn<>(this);
        }
    }
}
