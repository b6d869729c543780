package io.roarindex.index;

import io.roarindex.kernel.IdSetFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PostingStoreTest {

    @Test
    void addStoresValueIds() {
        var store = new PostingStore();

        store.add(0, 5);
        store.add(0, 2);
        store.add(0, 5);

        assertThat(store.lookup(0).toIntArray()).containsExactly(2, 5);
        assertThat(store.contains(0, 2)).isTrue();
        assertThat(store.contains(0, 3)).isFalse();
    }

    @Test
    void keysShouldNotShareSets() {
        var store = new PostingStore();

        store.add(0, 1);
        store.add(1, 1);
        store.add(1, 2);
        store.removeAll(1);

        assertThat(store.lookup(0).toIntArray()).containsExactly(1);
        assertThat(store.contains(1, 1)).isFalse();
    }

    @Test
    void removeAllClearsKey() {
        var store = new PostingStore();
        store.add(3, 9);

        assertThat(store.removeAll(3)).isTrue();
        assertThat(store.removeAll(3)).isFalse();
        assertThat(store.hasPostings(3)).isFalse();
        assertThat(store.lookup(3).size()).isZero();
    }

    @Test
    void lookupOfUnknownKeyIsEmpty() {
        var store = new PostingStore();

        assertThat(store.lookup(42).size()).isZero();
        assertThat(store.contains(42, 0)).isFalse();
    }

    @Test
    void clearEmptiesStore() {
        var store = new PostingStore();
        store.add(0, 1);
        store.add(1, 2);

        store.clear();

        assertThat(store.size()).isZero();
    }

    @Test
    void optimizeCountsChangedSets() {
        var store = new PostingStore(IdSetFactory.defaultFactory(), 4);
        for (int i = 0; i < 5_000; i++) {
            store.add(0, i);
        }
        store.add(1, 7);

        assertThat(store.optimize()).isEqualTo(1);
        assertThat(store.lookup(0).size()).isEqualTo(5_000);
        assertThat(store.lookup(1).toIntArray()).containsExactly(7);
    }

    @Test
    void shouldRejectNegativeCapacity() {
        assertThatThrownBy(() -> new PostingStore(IdSetFactory.defaultFactory(), -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
