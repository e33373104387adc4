package io.cellscan.runtime;

import io.cellscan.kernel.SearchMatch;
import io.cellscan.kernel.SearchResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates descriptor plans against rows.
 * <p>
 * {@link #scan} walks the whole source once and is the fallback whenever
 * incremental maintenance cannot apply. {@link #evaluateRow} matches a single
 * row and is shared by the incremental path, so both produce identical
 * results for the same row.
 */
public final class FullScanEvaluator<T> {

    /** Result order inside one row: column index, then leading match start. */
    static final Comparator<SearchResult<?>> CELL_ORDER = Comparator
            .<SearchResult<?>>comparingInt(SearchResult::columnIndex)
            .thenComparingInt(SearchResult::leadingMatchStart);

    /**
     * Scan every row in iteration order.
     *
     * @param rows  the rows, iterated exactly once
     * @param plans resolved descriptor plans
     * @return results ordered by row, column, leading match, plus the number
     *         of rows seen
     */
    public ScanResult<T> scan(Iterable<T> rows, List<DescriptorPlan<T>> plans) {
        List<SearchResult<T>> results = new ArrayList<>();
        int rowIndex = 0;
        if (rows == null) {
            return new ScanResult<>(results, 0);
        }
        for (T item : rows) {
            if (!plans.isEmpty()) {
                results.addAll(evaluateRow(item, rowIndex, plans));
            }
            rowIndex++;
        }
        return new ScanResult<>(results, rowIndex);
    }

    /**
     * Match one row against every plan, merging matches for the same column
     * found by different plans into one result.
     *
     * @return results for the row, ordered by column index then leading match
     */
    public List<SearchResult<T>> evaluateRow(T item, int rowIndex, List<DescriptorPlan<T>> plans) {
        if (item == null || plans == null || plans.isEmpty()) {
            return List.of();
        }
        Map<BoundColumn<T>, CellResultBuilder<T>> cells = null;
        for (DescriptorPlan<T> plan : plans) {
            for (BoundColumn<T> column : plan.columns()) {
                String text = column.readText(item, plan.culture());
                if (text == null || text.isEmpty()) {
                    continue;
                }
                List<SearchMatch> matches = CellMatcher.findMatches(text, plan.prepared());
                if (matches.isEmpty()) {
                    continue;
                }
                if (cells == null) {
                    cells = new LinkedHashMap<>();
                }
                cells.computeIfAbsent(column, c -> new CellResultBuilder<>(item, rowIndex, c, text))
                        .addMatches(matches);
            }
        }
        if (cells == null) {
            return List.of();
        }
        List<SearchResult<T>> rowResults = new ArrayList<>(cells.size());
        for (CellResultBuilder<T> builder : cells.values()) {
            rowResults.add(builder.build());
        }
        rowResults.sort(CELL_ORDER);
        return rowResults;
    }

    /**
     * @param results  row-ordered results
     * @param rowCount number of rows iterated
     */
    public record ScanResult<T>(List<SearchResult<T>> results, int rowCount) {
    }
}
