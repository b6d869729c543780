package io.roarindex.kernel;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoaringIdSetTest {

    @Test
    void shouldStartEmpty() {
        var set = new RoaringIdSet();
        assertThat(set.size()).isZero();
        assertThat(set.enumerator().hasNext()).isFalse();
    }

    @Test
    void shouldContainAddedElement() {
        var set = new RoaringIdSet();
        set.add(42);
        assertThat(set.contains(42)).isTrue();
        assertThat(set.contains(99)).isFalse();
    }

    @Test
    void shouldBeIdempotentForDuplicates() {
        var set = new RoaringIdSet();
        set.add(1);
        set.add(1);
        set.add(1);
        assertThat(set.size()).isEqualTo(1);
        assertThat(set.toIntArray()).containsExactly(1);
    }

    @Test
    void shouldBeIdempotentForRemove() {
        var set = new RoaringIdSet();
        set.add(1);
        set.remove(1);
        set.remove(1);
        set.remove(99);
        assertThat(set.size()).isZero();
    }

    @Test
    void shouldEnumerateInAscendingOrderRegardlessOfInsertionOrder() {
        var set = new RoaringIdSet();
        set.add(900_000);
        set.add(3);
        set.add(70_000);
        set.add(0);

        var values = new ArrayList<Integer>();
        var e = set.enumerator();
        while (e.hasNext()) {
            values.add(e.nextInt());
        }

        assertThat(values).containsExactly(0, 3, 70_000, 900_000);
        assertThat(set.toIntArray()).containsExactly(0, 3, 70_000, 900_000);
    }

    @Test
    void shouldTreatIdentifiersAsUnsigned() {
        var set = new RoaringIdSet();
        set.add(-1);
        set.add(Integer.MIN_VALUE);
        set.add(5);

        // 5 < 2^31 < 2^32 - 1
        assertThat(set.toIntArray()).containsExactly(5, Integer.MIN_VALUE, -1);
    }

    @Test
    void enumeratorShouldThrowWhenExhausted() {
        var set = new RoaringIdSet();
        set.add(7);
        var e = set.enumerator();
        assertThat(e.nextInt()).isEqualTo(7);

        assertThatThrownBy(e::nextInt).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void optimizeShouldCompressDenseRunsWithoutChangingContents() {
        var set = new RoaringIdSet();
        for (int i = 0; i < 10_000; i++) {
            set.add(i);
        }
        int before = set.sizeInBytes();

        assertThat(set.optimize()).isTrue();

        assertThat(set.hasRunCompression()).isTrue();
        assertThat(set.sizeInBytes()).isLessThan(before);
        assertThat(set.size()).isEqualTo(10_000);
        assertThat(set.contains(9_999)).isTrue();
    }

    @Test
    void runOptimizeOnAddShouldKeepDenseSetsCompressed() {
        var set = new RoaringIdSet(true);
        for (int i = 0; i < 5_000; i++) {
            set.add(i);
        }

        assertThat(set.hasRunCompression()).isTrue();
        assertThat(set.size()).isEqualTo(5_000);
    }
}
