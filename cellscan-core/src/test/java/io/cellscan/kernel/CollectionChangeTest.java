package io.cellscan.kernel;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CollectionChangeTest {

    @Test
    void addedShouldCopyItems() {
        List<String> items = new ArrayList<>(List.of("a", "b"));

        CollectionChange<String> change = CollectionChange.added(3, items);
        items.clear();

        assertThat(change.kind()).isEqualTo(ChangeKind.ADD);
        assertThat(change.newStartingIndex()).isEqualTo(3);
        assertThat(change.newItems()).containsExactly("a", "b");
        assertThat(change.newCount()).isEqualTo(2);
    }

    @Test
    void shouldAllowNullRows() {
        CollectionChange<String> change = CollectionChange.added(0, (String) null);

        assertThat(change.newItems()).containsExactly((String) null);
    }

    @Test
    void removedShouldUseOldIndex() {
        CollectionChange<String> change = CollectionChange.removed(4, 2);

        assertThat(change.oldStartingIndex()).isEqualTo(4);
        assertThat(change.newStartingIndex()).isEqualTo(-1);
        assertThat(change.oldCount()).isEqualTo(2);
        assertThat(change.newItems()).isEmpty();
    }

    @Test
    void shouldRejectNegativeOldCount() {
        assertThatThrownBy(() -> new CollectionChange<String>(ChangeKind.REMOVE, -1, 0, null, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
