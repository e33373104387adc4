package io.cellscan.engine;

import io.cellscan.core.CellScanConfiguration;
import io.cellscan.kernel.CollectionChange;
import io.cellscan.kernel.RowSource;
import io.cellscan.kernel.SearchColumn;
import io.cellscan.kernel.SearchDescriptor;
import io.cellscan.kernel.SearchResult;
import io.cellscan.runtime.BoundColumn;
import io.cellscan.runtime.ColumnPlanner;
import io.cellscan.runtime.DescriptorPlan;
import io.cellscan.runtime.FlushOutcome;
import io.cellscan.runtime.FullScanEvaluator;
import io.cellscan.runtime.IncrementalResultService;
import io.cellscan.runtime.PreparedDescriptorCache;
import io.cellscan.runtime.RowLocator;
import io.cellscan.runtime.SourceRowLocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Full-text search over the cells of a row source, kept current under edits.
 * <p>
 * Typical host loop:
 * <pre>
 * CellSearchEngine&lt;Person&gt; engine = new CellSearchEngine&lt;&gt;(
 *     RowSource.of(people), () -&gt; columns, CellScanConfiguration.defaults());
 * engine.apply(SearchDescriptor.of("alpha"));
 *
 * people.add(0, newPerson);
 * engine.notifyCollectionChange(CollectionChange.added(0, newPerson));
 * engine.refresh();                      // patched, not rescanned
 * List&lt;SearchResult&lt;Person&gt;&gt; hits = engine.results();
 * </pre>
 * <p>
 * Single-threaded: all calls must come from the host's event loop. Refreshing
 * is not re-entrant; notifications raised while a refresh runs are queued and
 * applied by the next refresh. A refresh that throws drops the cached results
 * and the queue, so the next refresh rescans.
 *
 * @param <T> row item type
 */
public final class CellSearchEngine<T> {

    private static final Logger LOG = LoggerFactory.getLogger(CellSearchEngine.class);

    private final RowSource<T> source;
    private final Supplier<? extends Iterable<? extends SearchColumn<T>>> columnProvider;
    private final CellScanConfiguration configuration;
    private final ColumnPlanner<T> planner;
    private final FullScanEvaluator<T> evaluator = new FullScanEvaluator<>();
    private final PreparedDescriptorCache preparedCache = new PreparedDescriptorCache();
    private final IncrementalResultService<T> incremental;
    private final RowLocator<T> rowLocator;

    private final List<CollectionChange<T>> deferredChanges = new ArrayList<>();
    private final List<T> deferredItems = new ArrayList<>();

    private List<SearchDescriptor> requested = List.of();
    private List<DescriptorPlan<T>> activePlans = List.of();
    private List<SearchResult<T>> snapshot = List.of();
    private RefreshKind lastRefreshKind = RefreshKind.NONE;
    private long fullScanCount;
    private boolean refreshing;

    public CellSearchEngine(RowSource<T> source,
            Supplier<? extends Iterable<? extends SearchColumn<T>>> columnProvider,
            CellScanConfiguration configuration) {
        this.source = Objects.requireNonNull(source, "source");
        this.columnProvider = Objects.requireNonNull(columnProvider, "columnProvider");
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.planner = new ColumnPlanner<>(configuration);
        this.incremental = new IncrementalResultService<>(configuration.trackItemChanges());
        this.rowLocator = new SourceRowLocator<>(source);
    }

    public CellSearchEngine(RowSource<T> source,
            Supplier<? extends Iterable<? extends SearchColumn<T>>> columnProvider) {
        this(source, columnProvider, CellScanConfiguration.defaults());
    }

    public List<SearchResult<T>> apply(SearchDescriptor... descriptors) {
        return applyDescriptors(Arrays.asList(descriptors));
    }

    /**
     * Make {@code descriptors} the requested search and refresh the results.
     * <p>
     * Applying a list equal to the current one reuses the cached results and
     * flushes any queued edits into them.
     *
     * @param descriptors descriptors to apply, an empty list clears the search
     * @return the current results
     */
    public List<SearchResult<T>> applyDescriptors(List<SearchDescriptor> descriptors) {
        Objects.requireNonNull(descriptors, "descriptors");
        ensureNotRefreshing();
        List<SearchDescriptor> next = List.copyOf(descriptors);
        preparedCache.retainOnly(next);
        requested = next;
        return refresh();
    }

    /**
     * Bring the results up to date with every queued edit, patching the cached
     * results when possible and rescanning otherwise.
     *
     * @return the current results
     */
    public List<SearchResult<T>> refresh() {
        ensureNotRefreshing();
        refreshing = true;
        try {
            doRefresh();
        } catch (RuntimeException ex) {
            incremental.clearState();
            deferredChanges.clear();
            deferredItems.clear();
            throw ex;
        } finally {
            refreshing = false;
        }
        drainDeferred();
        return results();
    }

    public void notifyCollectionChange(CollectionChange<T> change) {
        Objects.requireNonNull(change, "change");
        if (!configuration.incrementalSearch()) {
            return;
        }
        if (refreshing) {
            deferredChanges.add(change);
            return;
        }
        incremental.recordCollectionChange(change);
    }

    public void notifyItemChange(T item) {
        if (item == null || !configuration.incrementalSearch() || !configuration.trackItemChanges()) {
            return;
        }
        if (refreshing) {
            deferredItems.add(item);
            return;
        }
        incremental.recordItemChange(item);
    }

    /**
     * Columns were added, removed, reordered, or changed visibility or
     * searchability. The next refresh rebinds them and rescans.
     */
    public void notifyColumnsChanged() {
        ensureNotRefreshing();
        incremental.clearState();
        activePlans = List.of();
    }

    /**
     * Drop the search and every cached result.
     */
    public void clear() {
        applyDescriptors(List.of());
    }

    /**
     * @return unmodifiable snapshot ordered by row index, column index and
     *         leading match start
     */
    public List<SearchResult<T>> results() {
        return snapshot;
    }

    public List<SearchDescriptor> descriptors() {
        return requested;
    }

    public RefreshKind lastRefreshKind() {
        return lastRefreshKind;
    }

    public long fullScanCount() {
        return fullScanCount;
    }

    public boolean hasPendingChanges() {
        return incremental.hasPendingChanges() || !deferredChanges.isEmpty() || !deferredItems.isEmpty();
    }

    private void doRefresh() {
        if (requested.isEmpty()) {
            incremental.clearState();
            activePlans = List.of();
            publish(List.of(), RefreshKind.CLEARED);
            return;
        }

        if (configuration.incrementalSearch()) {
            FlushOutcome<T> outcome = incremental.tryApplyPending(requested, this::evaluateRow, rowLocator);
            if (outcome.applied()) {
                if (outcome.changeCount() == 0) {
                    publish(outcome.results(), RefreshKind.CACHED);
                } else {
                    publish(outcome.results(), RefreshKind.INCREMENTAL);
                }
                return;
            }
            LOG.debug("Falling back to full scan: {}", outcome.reason());
        }

        fullScan();
    }

    private void fullScan() {
        long start = System.nanoTime();
        List<BoundColumn<T>> columns = planner.bind(columnProvider.get());
        List<DescriptorPlan<T>> plans = planner.plan(requested, columns, preparedCache);
        FullScanEvaluator.ScanResult<T> scan = evaluator.scan(source, plans);
        fullScanCount++;

        activePlans = plans;
        if (configuration.incrementalSearch()) {
            incremental.setActiveState(requested, scan.results(), scan.rowCount());
        } else {
            incremental.clearState();
        }
        publish(scan.results(), RefreshKind.FULL_SCAN);

        if (LOG.isDebugEnabled()) {
            LOG.debug("Full scan of {} rows with {} plan(s) matched {} cell(s) in {} us",
                    scan.rowCount(), plans.size(), scan.results().size(), (System.nanoTime() - start) / 1_000);
        }
    }

    private List<SearchResult<T>> evaluateRow(T item, int rowIndex) {
        return evaluator.evaluateRow(item, rowIndex, activePlans);
    }

    private void publish(List<SearchResult<T>> results, RefreshKind kind) {
        lastRefreshKind = kind;
        if (kind == RefreshKind.CACHED) {
            return;
        }
        snapshot = results.isEmpty() ? List.of() : Collections.unmodifiableList(new ArrayList<>(results));
    }

    private void drainDeferred() {
        if (deferredChanges.isEmpty() && deferredItems.isEmpty()) {
            return;
        }
        for (CollectionChange<T> change : deferredChanges) {
            incremental.recordCollectionChange(change);
        }
        for (T item : deferredItems) {
            incremental.recordItemChange(item);
        }
        deferredChanges.clear();
        deferredItems.clear();
    }

    private void ensureNotRefreshing() {
        if (refreshing) {
            throw new IllegalStateException("Search refresh is not re-entrant");
        }
    }
}
