package io.cellscan.runtime;

import io.cellscan.kernel.SearchDescriptor;
import io.cellscan.query.PreparedDescriptor;
import io.cellscan.query.QueryCompiler;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Prepared matchers keyed by descriptor. Built lazily, immutable once built,
 * evicted when the descriptor is no longer applied.
 */
public final class PreparedDescriptorCache {

    private final QueryCompiler compiler;
    private final Map<SearchDescriptor, PreparedDescriptor> prepared = new HashMap<>();

    public PreparedDescriptorCache() {
        this(new QueryCompiler());
    }

    public PreparedDescriptorCache(QueryCompiler compiler) {
        this.compiler = Objects.requireNonNull(compiler, "compiler");
    }

    public PreparedDescriptor get(SearchDescriptor descriptor) {
        return prepared.computeIfAbsent(descriptor, compiler::compile);
    }

    public void retainOnly(Collection<SearchDescriptor> descriptors) {
        prepared.keySet().retainAll(descriptors);
    }

    public int size() {
        return prepared.size();
    }

    public void clear() {
        prepared.clear();
    }
}
