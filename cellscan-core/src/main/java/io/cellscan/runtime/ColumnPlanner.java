package io.cellscan.runtime;

import io.cellscan.core.CellScanConfiguration;
import io.cellscan.core.MissingAccessorDiagnostic;
import io.cellscan.core.MissingAccessorException;
import io.cellscan.core.MissingAccessorListener;
import io.cellscan.kernel.SearchColumn;
import io.cellscan.kernel.SearchDescriptor;
import io.cellscan.kernel.SearchScope;
import io.cellscan.query.PreparedDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Resolves descriptors against the live column set.
 * <p>
 * Binding happens once per column-set change; planning selects, per
 * descriptor, the bound columns in its scope.
 */
public final class ColumnPlanner<T> {

    private static final Logger LOG = LoggerFactory.getLogger(ColumnPlanner.class);

    private final CellScanConfiguration configuration;

    public ColumnPlanner(CellScanConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
    }

    /**
     * Bind every searchable column that has an accessor.
     * <p>
     * Each non-null column consumes a fallback ordinal, searchable or not, so
     * hiding a column from search does not renumber the ones after it.
     * Columns without a display index are numbered after the highest display
     * index in the set, so the two kinds of index never collide.
     *
     * @param columns live columns from the host, may be {@code null}
     * @return bound columns in host order
     * @throws MissingAccessorException in fail-fast mode, for the first column
     *                                  without an accessor
     */
    public List<BoundColumn<T>> bind(Iterable<? extends SearchColumn<T>> columns) {
        if (columns == null) {
            return List.of();
        }
        List<SearchColumn<T>> present = new ArrayList<>();
        int fallbackBase = 0;
        for (SearchColumn<T> column : columns) {
            if (column == null) {
                continue;
            }
            present.add(column);
            fallbackBase = Math.max(fallbackBase, column.displayIndex() + 1);
        }

        List<BoundColumn<T>> bound = new ArrayList<>();
        int ordinal = 0;
        for (SearchColumn<T> column : present) {
            int fallbackIndex = fallbackBase + ordinal++;
            if (!column.searchable()) {
                continue;
            }
            if (!column.hasAccessor()) {
                reportMissingAccessor(column);
                continue;
            }
            int columnIndex = column.displayIndex() >= 0 ? column.displayIndex() : fallbackIndex;
            bound.add(new BoundColumn<>(column, columnIndex));
        }
        return bound;
    }

    /**
     * Build one plan per usable descriptor. Descriptors with no column in
     * scope, or that can never match (empty query without empty matches,
     * invalid pattern, no terms), are dropped.
     */
    public List<DescriptorPlan<T>> plan(List<SearchDescriptor> descriptors, List<BoundColumn<T>> columns,
            PreparedDescriptorCache cache) {
        if (descriptors == null || descriptors.isEmpty() || columns.isEmpty()) {
            return List.of();
        }
        List<DescriptorPlan<T>> plans = new ArrayList<>(descriptors.size());
        for (SearchDescriptor descriptor : descriptors) {
            if (descriptor == null) {
                continue;
            }
            List<BoundColumn<T>> inScope = columnsInScope(descriptor, columns);
            if (inScope.isEmpty()) {
                continue;
            }
            if (!descriptor.hasQuery() && !descriptor.allowEmpty()) {
                continue;
            }
            PreparedDescriptor prepared = cache.get(descriptor);
            if (prepared.matchesNothing()) {
                continue;
            }
            Locale culture = descriptor.locale() != null ? descriptor.locale() : configuration.defaultLocale();
            plans.add(new DescriptorPlan<>(descriptor, prepared, inScope, culture));
        }
        return plans;
    }

    static <T> List<BoundColumn<T>> columnsInScope(SearchDescriptor descriptor, List<BoundColumn<T>> columns) {
        SearchScope scope = descriptor.scope();
        List<BoundColumn<T>> result = new ArrayList<>(columns.size());
        for (BoundColumn<T> column : columns) {
            if (scope == SearchScope.VISIBLE_COLUMNS && !column.column().visible()) {
                continue;
            }
            if (scope == SearchScope.EXPLICIT_COLUMNS && !isSelected(descriptor.columnIds(), column.column())) {
                continue;
            }
            result.add(column);
        }
        return result;
    }

    static boolean isSelected(List<Object> columnIds, SearchColumn<?> column) {
        for (Object id : columnIds) {
            if (id.equals(column.id())) {
                return true;
            }
            if (id instanceof String path && path.equals(column.propertyPath())) {
                return true;
            }
        }
        return false;
    }

    private void reportMissingAccessor(SearchColumn<T> column) {
        String label = column.header() != null ? column.header() : String.valueOf(column.id());
        MissingAccessorListener listener = configuration.missingAccessorListener();

        if (configuration.throwOnMissingAccessor()) {
            var diagnostic = new MissingAccessorDiagnostic(column.id(), column.header(),
                    "Search requires a value accessor for column '" + label + "'.");
            if (listener != null) {
                listener.onMissingAccessor(diagnostic);
            }
            throw new MissingAccessorException(diagnostic);
        }

        var diagnostic = new MissingAccessorDiagnostic(column.id(), column.header(),
                "Search skipped because no value accessor was found for column '" + label + "'.");
        if (listener != null) {
            listener.onMissingAccessor(diagnostic);
        } else {
            LOG.warn(diagnostic.message());
        }
    }
}
