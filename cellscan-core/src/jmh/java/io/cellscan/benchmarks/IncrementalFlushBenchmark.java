package io.cellscan.benchmarks;

import io.cellscan.core.CellScanConfiguration;
import io.cellscan.engine.CellSearchEngine;
import io.cellscan.kernel.CollectionChange;
import io.cellscan.kernel.MatchMode;
import io.cellscan.kernel.RowSource;
import io.cellscan.kernel.SearchColumn;
import io.cellscan.kernel.SearchDescriptor;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Compares a full rescan against flushing a single insert and remove into
 * cached results.
 */
@State(Scope.Benchmark)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Warmup(iterations = 2, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 2, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class IncrementalFlushBenchmark {

    @Param({"10000", "100000"})
    public int rowCount;

    @Param({"CONTAINS", "WILDCARD"})
    public String matchMode;

    private List<Row> rows;
    private CellSearchEngine<Row> engine;
    private int cursor;

    @Setup(Level.Trial)
    public void setup() {
        rows = new ArrayList<>(rowCount + 1);
        for (int i = 0; i < rowCount; i++) {
            rows.add(row(i));
        }
        List<SearchColumn<Row>> columns = List.of(
                SearchColumn.<Row>ofText("name", Row::name),
                SearchColumn.<Row>ofText("city", Row::city));
        engine = new CellSearchEngine<>(RowSource.of(rows), () -> columns, CellScanConfiguration.defaults());

        MatchMode mode = MatchMode.valueOf(matchMode);
        String query = mode == MatchMode.WILDCARD ? "ali*smith" : "smith";
        engine.apply(SearchDescriptor.builder(query).matchMode(mode).build());
    }

    private static Row row(int index) {
        String[] names = {"Alice", "Bob", "Charlie", "David", "Emma", "Frank", "Grace", "Henry"};
        String[] surnames = {"Smith", "Johnson", "Williams", "Brown", "Jones", "Garcia", "Miller", "Davis"};
        String[] cities = {"Oslo", "Lima", "Porto", "Kyoto", "Quito"};
        String name = names[index % names.length] + " " + surnames[(index / names.length) % surnames.length];
        return new Row(name + " " + index, cities[index % cities.length]);
    }

    @Benchmark
    public void fullScan(Blackhole blackhole) {
        engine.notifyColumnsChanged();
        blackhole.consume(engine.refresh());
    }

    @Benchmark
    public void incrementalInsertAndRemove(Blackhole blackhole) {
        int index = cursor++ % rowCount;
        Row inserted = row(index);

        rows.add(index, inserted);
        engine.notifyCollectionChange(CollectionChange.added(index, inserted));
        blackhole.consume(engine.refresh());

        rows.remove(index);
        engine.notifyCollectionChange(CollectionChange.removed(index, 1));
        blackhole.consume(engine.refresh());
    }

    public record Row(String name, String city) {
    }
}
