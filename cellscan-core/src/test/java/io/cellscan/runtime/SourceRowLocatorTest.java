package io.cellscan.runtime;

import io.cellscan.kernel.RowSource;
import io.cellscan.testutil.IndexedRowSource;
import io.cellscan.testutil.Person;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SourceRowLocatorTest {

    @Test
    void shouldLocateByReferenceNotEquality() {
        String first = new String("same");
        String second = new String("same");
        var locator = new SourceRowLocator<>(RowSource.of(List.of(first, second)));

        assertThat(locator.locate(second)).isEqualTo(RowLocation.at(1));
        assertThat(locator.locate(new String("same")).status()).isEqualTo(RowLocation.Status.ABSENT);
    }

    @Test
    void shouldReportAmbiguousOnSecondOccurrence() {
        Person shared = Person.of("shared");
        List<Person> rows = new ArrayList<>(List.of(shared, Person.of("other"), shared));
        var locator = new SourceRowLocator<>(RowSource.of(rows));

        assertThat(locator.locate(shared).status()).isEqualTo(RowLocation.Status.AMBIGUOUS);
    }

    @Test
    void shouldUseIndexLookupWhenSourceProvidesIt() {
        Person target = Person.of("target");
        var source = new IndexedRowSource<>(List.of(Person.of("a"), target));
        var locator = new SourceRowLocator<>(source);

        assertThat(locator.locate(target)).isEqualTo(RowLocation.at(1));
        assertThat(locator.locate(Person.of("missing"))).isEqualTo(RowLocation.absent());
        assertThat(source.lookups()).isEqualTo(2);
    }

    @Test
    void nullItem_shouldBeAbsent() {
        var locator = new SourceRowLocator<>(RowSource.of(new ArrayList<Person>()));

        assertThat(locator.locate(null).status()).isEqualTo(RowLocation.Status.ABSENT);
    }
}
