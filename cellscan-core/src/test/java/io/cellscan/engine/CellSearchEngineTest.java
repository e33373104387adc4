package io.cellscan.engine;

import io.cellscan.core.CellScanConfiguration;
import io.cellscan.core.MissingAccessorException;
import io.cellscan.kernel.CollectionChange;
import io.cellscan.kernel.MatchMode;
import io.cellscan.kernel.RowSource;
import io.cellscan.kernel.SearchColumn;
import io.cellscan.kernel.SearchDescriptor;
import io.cellscan.kernel.SearchMatch;
import io.cellscan.kernel.SearchResult;
import io.cellscan.kernel.TermCombineMode;
import io.cellscan.testutil.IndexedRowSource;
import io.cellscan.testutil.Person;
import io.cellscan.testutil.PersonColumns;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class CellSearchEngineTest {

    private static List<Person> people(String... names) {
        List<Person> rows = new ArrayList<>();
        for (String name : names) {
            rows.add(Person.of(name));
        }
        return rows;
    }

    private static CellSearchEngine<Person> engine(List<Person> rows) {
        return new CellSearchEngine<>(RowSource.of(rows), PersonColumns::all);
    }

    private static List<SearchResult<Person>> freshScan(List<Person> rows, List<SearchDescriptor> descriptors) {
        return engine(rows).applyDescriptors(descriptors);
    }

    @Test
    void contains_caseInsensitive_shouldMatchSingleRow() {
        var engine = engine(people("Alpha", "Beta", "Gamma"));

        List<SearchResult<Person>> results = engine.apply(SearchDescriptor.of("AL"));

        assertThat(results).singleElement().satisfies(result -> {
            assertThat(result.rowIndex()).isZero();
            assertThat(result.columnId()).isEqualTo(PersonColumns.NAME);
            assertThat(result.matches()).containsExactly(new SearchMatch(0, 2));
        });
        assertThat(engine.lastRefreshKind()).isEqualTo(RefreshKind.FULL_SCAN);
    }

    @Test
    void wholeWordWildcard_shouldSkipPartialWords() {
        var engine = engine(people("alpha", "alphabet", "beta alpha"));

        List<SearchResult<Person>> results = engine.apply(SearchDescriptor.builder("alpha")
                .matchMode(MatchMode.WILDCARD)
                .wholeWord(true)
                .build());

        assertThat(results).extracting(SearchResult::rowIndex).containsExactly(0, 2);
        assertThat(results.get(1).matches()).containsExactly(new SearchMatch(5, 5));
    }

    @Test
    void insert_shouldShiftCachedRowIndexWithoutRescan() {
        // Given
        List<Person> rows = people("Alpha", "Beta");
        var engine = engine(rows);
        engine.apply(SearchDescriptor.of("Beta"));
        Person cachedBeta = rows.get(1);

        // When
        Person gamma = Person.of("Gamma");
        rows.add(0, gamma);
        engine.notifyCollectionChange(CollectionChange.added(0, gamma));
        List<SearchResult<Person>> results = engine.refresh();

        // Then
        assertThat(results).singleElement().satisfies(result -> {
            assertThat(result.item()).isSameAs(cachedBeta);
            assertThat(result.rowIndex()).isEqualTo(2);
        });
        assertThat(engine.lastRefreshKind()).isEqualTo(RefreshKind.INCREMENTAL);
        assertThat(engine.fullScanCount()).isEqualTo(1);
    }

    @Test
    void normalization_shouldMatchAccentedTextWithIrregularSpacing() {
        var engine = engine(people("Cr\u00e8me   Br\u00fbl\u00e9e", "Creme caramel"));

        List<SearchResult<Person>> results = engine.apply(SearchDescriptor.builder("creme brulee")
                .termMode(TermCombineMode.ALL)
                .normalizeWhitespace(true)
                .ignoreDiacritics(true)
                .build());

        assertThat(results).singleElement().satisfies(result -> {
            assertThat(result.rowIndex()).isZero();
            assertThat(result.matches()).containsExactly(new SearchMatch(0, 5), new SearchMatch(8, 6));
        });
    }

    @Test
    void reapplyingSameDescriptors_shouldReuseCachedResults() {
        var engine = engine(people("Alpha", "Beta"));
        List<SearchResult<Person>> first = engine.apply(SearchDescriptor.of("a"));

        List<SearchResult<Person>> second = engine.apply(SearchDescriptor.of("a"));

        assertThat(second).isEqualTo(first);
        assertThat(engine.lastRefreshKind()).isEqualTo(RefreshKind.CACHED);
        assertThat(engine.fullScanCount()).isEqualTo(1);
    }

    @Test
    void refreshWithoutEdits_shouldBeIdempotent() {
        var engine = engine(people("Alpha", "Beta", "Alphonse"));
        List<SearchResult<Person>> first = engine.apply(SearchDescriptor.of("alp"));

        assertThat(engine.refresh()).isEqualTo(first);
        assertThat(engine.refresh()).isEqualTo(first);
        assertThat(engine.fullScanCount()).isEqualTo(1);
    }

    @Test
    void changedDescriptors_shouldRescan() {
        var engine = engine(people("Alpha", "Beta"));
        engine.apply(SearchDescriptor.of("alpha"));

        List<SearchResult<Person>> results = engine.apply(SearchDescriptor.of("beta"));

        assertThat(results).extracting(SearchResult::rowIndex).containsExactly(1);
        assertThat(engine.lastRefreshKind()).isEqualTo(RefreshKind.FULL_SCAN);
        assertThat(engine.fullScanCount()).isEqualTo(2);
    }

    @Test
    void incrementalEdits_shouldMatchFullScanAfterEveryFlush() {
        // Given
        List<Person> rows = people("alpha", "beta", "gamma", "delta", "epsilon", "zeta", "eta", "theta");
        var source = new IndexedRowSource<>(rows);
        var engine = new CellSearchEngine<>(source, PersonColumns::all);
        List<SearchDescriptor> descriptors = List.of(
                SearchDescriptor.of("ta"),
                SearchDescriptor.builder("^e").matchMode(MatchMode.REGEX).build());
        engine.applyDescriptors(descriptors);
        Random random = new Random(7);
        String[] words = {"beta", "tango", "echo", "kilo", "eta", "delta", "x"};

        // When / Then
        for (int round = 0; round < 40; round++) {
            for (int edit = 0; edit < 3; edit++) {
                int op = random.nextInt(4);
                if (op == 0 || rows.isEmpty()) {
                    int index = random.nextInt(rows.size() + 1);
                    Person added = Person.of(words[random.nextInt(words.length)]);
                    rows.add(index, added);
                    engine.notifyCollectionChange(CollectionChange.added(index, added));
                } else if (op == 1) {
                    int index = random.nextInt(rows.size());
                    rows.remove(index);
                    engine.notifyCollectionChange(CollectionChange.removed(index, 1));
                } else if (op == 2) {
                    int index = random.nextInt(rows.size());
                    Person replacement = Person.of(words[random.nextInt(words.length)]);
                    rows.set(index, replacement);
                    engine.notifyCollectionChange(CollectionChange.replaced(index, 1, List.of(replacement)));
                } else {
                    Person changed = rows.get(random.nextInt(rows.size()));
                    changed.setName(words[random.nextInt(words.length)]);
                    engine.notifyItemChange(changed);
                }
            }

            List<SearchResult<Person>> incremental = engine.refresh();

            assertThat(engine.lastRefreshKind()).isEqualTo(RefreshKind.INCREMENTAL);
            assertThat(incremental).isEqualTo(freshScan(rows, descriptors));
        }
        assertThat(engine.fullScanCount()).isEqualTo(1);
    }

    @Test
    void itemChange_shouldRematchChangedRow() {
        List<Person> rows = people("Ann", "Bob");
        var engine = engine(rows);
        engine.apply(SearchDescriptor.of("bo"));

        rows.get(0).setName("Bodil");
        engine.notifyItemChange(rows.get(0));
        List<SearchResult<Person>> results = engine.refresh();

        assertThat(results).extracting(SearchResult::rowIndex).containsExactly(0, 1);
        assertThat(results.get(0).text()).isEqualTo("Bodil");
        assertThat(engine.lastRefreshKind()).isEqualTo(RefreshKind.INCREMENTAL);
    }

    @Test
    void reset_shouldFallBackToFullScan() {
        List<Person> rows = people("Ann", "Bob");
        var engine = engine(rows);
        engine.apply(SearchDescriptor.of("a"));

        rows.clear();
        rows.addAll(people("Carla", "Dan", "Eve"));
        engine.notifyCollectionChange(CollectionChange.reset());
        List<SearchResult<Person>> results = engine.refresh();

        assertThat(results).extracting(SearchResult::rowIndex).containsExactly(0, 1);
        assertThat(engine.lastRefreshKind()).isEqualTo(RefreshKind.FULL_SCAN);
        assertThat(engine.fullScanCount()).isEqualTo(2);
    }

    @Test
    void move_shouldFallBackToFullScan() {
        List<Person> rows = people("Ann", "Bob", "Cal");
        var engine = engine(rows);
        engine.apply(SearchDescriptor.of("a"));

        Person moved = rows.remove(0);
        rows.add(moved);
        engine.notifyCollectionChange(CollectionChange.moved(0, 2, List.of(moved)));
        List<SearchResult<Person>> results = engine.refresh();

        assertThat(results).extracting(SearchResult::item).extracting(Person::getName).containsExactly("Cal", "Ann");
        assertThat(engine.lastRefreshKind()).isEqualTo(RefreshKind.FULL_SCAN);
    }

    @Test
    void duplicatedItemChange_shouldFallBackToFullScan() {
        List<Person> rows = people("Ann", "Bob");
        var engine = engine(rows);
        engine.apply(SearchDescriptor.of("zed"));

        Person shared = rows.get(0);
        rows.add(shared);
        engine.notifyCollectionChange(CollectionChange.added(2, shared));
        shared.setName("Zed");
        engine.notifyItemChange(shared);
        List<SearchResult<Person>> results = engine.refresh();

        assertThat(results).extracting(SearchResult::rowIndex).containsExactly(0, 2);
        assertThat(engine.lastRefreshKind()).isEqualTo(RefreshKind.FULL_SCAN);
    }

    @Test
    void notificationsWithoutActiveSearch_shouldBeIgnored() {
        List<Person> rows = people("Ann");
        var engine = engine(rows);

        engine.notifyCollectionChange(CollectionChange.added(1, Person.of("Bea")));

        assertThat(engine.hasPendingChanges()).isFalse();
        assertThat(engine.lastRefreshKind()).isEqualTo(RefreshKind.NONE);
    }

    @Test
    void clear_shouldDropResultsAndDescriptors() {
        var engine = engine(people("Ann"));
        engine.apply(SearchDescriptor.of("a"));

        engine.clear();

        assertThat(engine.results()).isEmpty();
        assertThat(engine.descriptors()).isEmpty();
        assertThat(engine.lastRefreshKind()).isEqualTo(RefreshKind.CLEARED);
    }

    @Test
    void results_shouldBeUnmodifiableSnapshot() {
        List<Person> rows = people("Ann", "Bob");
        var engine = engine(rows);
        List<SearchResult<Person>> before = engine.apply(SearchDescriptor.of("b"));

        Person added = Person.of("Bo");
        rows.add(0, added);
        engine.notifyCollectionChange(CollectionChange.added(0, added));
        engine.refresh();

        assertThatThrownBy(() -> before.add(before.get(0)))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(before).extracting(SearchResult::rowIndex).containsExactly(1);
        assertThat(engine.results()).extracting(SearchResult::rowIndex).containsExactly(0, 2);
    }

    @Test
    void incrementalDisabled_shouldRescanOnEveryRefresh() {
        List<Person> rows = people("Ann", "Bob");
        var engine = new CellSearchEngine<>(RowSource.of(rows), PersonColumns::all,
                CellScanConfiguration.builder().incrementalSearch(false).build());
        engine.apply(SearchDescriptor.of("b"));

        Person added = Person.of("Bea");
        rows.add(added);
        engine.notifyCollectionChange(CollectionChange.added(2, added));
        List<SearchResult<Person>> results = engine.refresh();

        assertThat(engine.hasPendingChanges()).isFalse();
        assertThat(results).extracting(SearchResult::rowIndex).containsExactly(1, 2);
        assertThat(engine.lastRefreshKind()).isEqualTo(RefreshKind.FULL_SCAN);
        assertThat(engine.fullScanCount()).isEqualTo(2);
    }

    @Test
    void itemTrackingDisabled_shouldIgnoreItemChanges() {
        List<Person> rows = people("Ann", "Bob");
        var engine = new CellSearchEngine<>(RowSource.of(rows), PersonColumns::all,
                CellScanConfiguration.builder().trackItemChanges(false).build());
        engine.apply(SearchDescriptor.of("bob"));

        rows.get(0).setName("Bobby");
        engine.notifyItemChange(rows.get(0));

        assertThat(engine.hasPendingChanges()).isFalse();
        assertThat(engine.refresh()).extracting(SearchResult::rowIndex).containsExactly(1);
    }

    @Test
    void columnsChanged_shouldRebindOnNextRefresh() {
        List<Person> rows = List.of(new Person("Ann", "Annecy", null));
        List<SearchColumn<Person>> columns = new ArrayList<>(List.of(PersonColumns.name()));
        var engine = new CellSearchEngine<>(RowSource.of(rows), () -> columns);
        engine.apply(SearchDescriptor.of("ann"));

        columns.add(PersonColumns.city());
        engine.notifyColumnsChanged();
        List<SearchResult<Person>> results = engine.refresh();

        assertThat(results).extracting(SearchResult::columnId).containsExactly("name", "city");
        assertThat(engine.lastRefreshKind()).isEqualTo(RefreshKind.FULL_SCAN);
    }

    @Test
    void missingAccessorInFailFastMode_shouldFailApply() {
        var engine = new CellSearchEngine<>(RowSource.of(people("Ann")),
                () -> List.of(PersonColumns.name(), SearchColumn.<Person>builder("notes").header("Notes").build()),
                CellScanConfiguration.builder().throwOnMissingAccessor(true).build());

        assertThatThrownBy(() -> engine.apply(SearchDescriptor.of("a")))
                .isInstanceOf(MissingAccessorException.class)
                .hasMessageContaining("Notes");
    }

    @Test
    void reentrantRefresh_shouldBeRejected() {
        AtomicReference<CellSearchEngine<Person>> self = new AtomicReference<>();
        SearchColumn<Person> reentrant = SearchColumn.<Person>builder("name")
                .textProvider(person -> {
                    self.get().refresh();
                    return person.getName();
                })
                .build();
        var engine = new CellSearchEngine<>(RowSource.of(people("Ann")), () -> List.of(reentrant));
        self.set(engine);

        assertThatThrownBy(() -> engine.apply(SearchDescriptor.of("a")))
                .isInstanceOf(IllegalStateException.class);
        engine.clear();
        assertThat(engine.results()).isEmpty();
    }

    @Test
    void notificationRaisedDuringRefresh_shouldBeQueuedForNextRefresh() {
        List<Person> rows = people("Ann", "Bob");
        AtomicReference<CellSearchEngine<Person>> self = new AtomicReference<>();
        SearchColumn<Person> touching = SearchColumn.<Person>builder("name")
                .textProvider(person -> {
                    if (person.getName().equals("Bob")) {
                        person.setName("Ben");
                        self.get().notifyItemChange(person);
                    }
                    return person.getName();
                })
                .build();
        var engine = new CellSearchEngine<>(RowSource.of(rows), () -> List.of(touching));
        self.set(engine);

        engine.apply(SearchDescriptor.of("n"));

        assertThat(engine.hasPendingChanges()).isTrue();
        engine.refresh();
        assertThat(engine.lastRefreshKind()).isEqualTo(RefreshKind.INCREMENTAL);
        assertThat(engine.results()).extracting(SearchResult::rowIndex).containsExactly(0, 1);
    }

    @Test
    void accessorThrowingDuringFlush_shouldDropCacheAndRescanOnNextRefresh() {
        // Given
        List<Person> rows = people("x0", "x1", "x2");
        AtomicBoolean failing = new AtomicBoolean(true);
        SearchColumn<Person> flaky = SearchColumn.<Person>builder("name")
                .textProvider(person -> {
                    if (person.getName().equals("boom") && failing.getAndSet(false)) {
                        throw new IllegalStateException("accessor failed");
                    }
                    return person.getName();
                })
                .build();
        var engine = new CellSearchEngine<>(RowSource.of(rows), () -> List.of(flaky));
        engine.apply(SearchDescriptor.of("x"));

        // When
        Person xa = Person.of("xa");
        rows.add(0, xa);
        engine.notifyCollectionChange(CollectionChange.added(0, xa));
        Person boom = Person.of("boom");
        rows.add(0, boom);
        engine.notifyCollectionChange(CollectionChange.added(0, boom));

        // Then
        assertThatThrownBy(engine::refresh)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("accessor failed");
        assertThat(engine.hasPendingChanges()).isFalse();

        List<SearchResult<Person>> results = engine.refresh();

        assertThat(engine.lastRefreshKind()).isEqualTo(RefreshKind.FULL_SCAN);
        assertThat(results).extracting(SearchResult::rowIndex, SearchResult::text)
                .containsExactly(
                        tuple(1, "xa"),
                        tuple(2, "x0"),
                        tuple(3, "x1"),
                        tuple(4, "x2"));
    }

    @Test
    void converterReturningNull_shouldNotMatchLiteralNullText() {
        SearchColumn<Person> converted = SearchColumn.<Person>builder("city")
                .valueGetter(Person::getName)
                .converter((value, culture) -> null)
                .build();
        var engine = new CellSearchEngine<>(RowSource.of(people("Ann", "Bob")), () -> List.of(converted));

        assertThat(engine.apply(SearchDescriptor.of("null"))).isEmpty();
    }
}
