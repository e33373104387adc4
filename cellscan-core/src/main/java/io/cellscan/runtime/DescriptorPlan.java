package io.cellscan.runtime;

import io.cellscan.kernel.SearchDescriptor;
import io.cellscan.query.PreparedDescriptor;

import java.util.List;
import java.util.Locale;

/**
 * One descriptor resolved against the live columns.
 *
 * @param descriptor the requested descriptor
 * @param prepared   its compiled matcher
 * @param columns    bound columns in scope, in column order
 * @param culture    locale used to read cell text
 */
public record DescriptorPlan<T>(SearchDescriptor descriptor, PreparedDescriptor prepared,
        List<BoundColumn<T>> columns, Locale culture) {

    public DescriptorPlan {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor required");
        }
        if (prepared == null) {
            throw new IllegalArgumentException("prepared required");
        }
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("columns required");
        }
        if (culture == null) {
            throw new IllegalArgumentException("culture required");
        }
        columns = List.copyOf(columns);
    }
}
