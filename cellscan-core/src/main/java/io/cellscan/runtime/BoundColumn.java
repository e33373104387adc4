package io.cellscan.runtime;

import io.cellscan.kernel.SearchColumn;

import java.math.BigDecimal;
import java.text.DecimalFormatSymbols;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.FormatStyle;
import java.time.temporal.TemporalAccessor;
import java.util.IllegalFormatException;
import java.util.Locale;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * A searchable column paired with its text extraction, built once per column
 * set and reused for every row.
 *
 * @param column      the host column
 * @param columnIndex stable index: display index when known, else an ordinal past the highest display index
 */
public record BoundColumn<T>(SearchColumn<T> column, int columnIndex) {

    public BoundColumn {
        if (column == null) {
            throw new IllegalArgumentException("column required");
        }
        if (!column.hasAccessor()) {
            throw new IllegalArgumentException("column has no accessor: " + column.id());
        }
    }

    public Object columnId() {
        return column.id();
    }

    /**
     * Extract the text to match for one row.
     *
     * @param item    the row item
     * @param culture locale for conversion and formatting
     * @return cell text, or {@code null} when the cell has no value
     */
    public String readText(T item, Locale culture) {
        if (item == null) {
            return null;
        }
        Function<? super T, String> textProvider = column.textProvider();
        if (textProvider != null) {
            return textProvider.apply(item);
        }

        Object value = column.valueGetter().apply(item);
        if (value == null) {
            return null;
        }
        BiFunction<Object, Locale, Object> converter = column.converter();
        if (converter != null) {
            value = converter.apply(value, culture);
            if (value == null) {
                return null;
            }
        }
        Locale formatLocale = column.formatLocale() != null ? column.formatLocale() : culture;
        String format = column.stringFormat();
        if (format != null && !format.isEmpty()) {
            try {
                return String.format(formatLocale, format, value);
            } catch (IllegalFormatException ex) {
                throw new IllegalStateException("Column " + column.id() + " has format '" + format
                        + "' that cannot format " + value.getClass().getName(), ex);
            }
        }
        return toDisplayString(value, formatLocale);
    }

    /**
     * Culture-aware text for values without an explicit format. Decimals use
     * the locale's separator without grouping; dates and times use the
     * locale's short date and medium time styles.
     */
    static String toDisplayString(Object value, Locale locale) {
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (Double.isNaN(number) || Double.isInfinite(number)) {
                return String.valueOf(value);
            }
            BigDecimal decimal = value instanceof Float
                    ? new BigDecimal(value.toString())
                    : BigDecimal.valueOf(number);
            return decimalText(decimal, locale);
        }
        if (value instanceof BigDecimal) {
            return decimalText((BigDecimal) value, locale);
        }
        if (value instanceof LocalDate) {
            return DateTimeFormatter.ofLocalizedDate(FormatStyle.SHORT).withLocale(locale).format((LocalDate) value);
        }
        if (value instanceof LocalTime) {
            return DateTimeFormatter.ofLocalizedTime(FormatStyle.MEDIUM).withLocale(locale).format((LocalTime) value);
        }
        if (value instanceof LocalDateTime || value instanceof ZonedDateTime || value instanceof OffsetDateTime) {
            return DateTimeFormatter.ofLocalizedDateTime(FormatStyle.SHORT, FormatStyle.MEDIUM)
                    .withLocale(locale)
                    .format((TemporalAccessor) value);
        }
        return String.valueOf(value);
    }

    private static String decimalText(BigDecimal decimal, Locale locale) {
        String plain = decimal.stripTrailingZeros().toPlainString();
        char separator = DecimalFormatSymbols.getInstance(locale).getDecimalSeparator();
        return separator == '.' ? plain : plain.replace('.', separator);
    }
}
