package io.roarindex.kernel;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IdSetFactoryTest {

    @Test
    void defaultFactoryShouldNotCompactOnAdd() {
        assertThat(IdSetFactory.defaultFactory().runOptimizeOnAdd()).isFalse();
    }

    @Test
    void shouldCreateIndependentRoaringSets() {
        var factory = IdSetFactory.defaultFactory();

        MutableIdSet first = factory.create();
        MutableIdSet second = factory.create();
        first.add(1);

        assertThat(first).isInstanceOf(RoaringIdSet.class);
        assertThat(first).isNotSameAs(second);
        assertThat(second.contains(1)).isFalse();
    }

    @Test
    void compactingFactoryShouldProduceRunCompressedSets() {
        var factory = new IdSetFactory(true);
        var set = (RoaringIdSet) factory.create();
        for (int i = 0; i < 1_000; i++) {
            set.add(i);
        }

        assertThat(set.hasRunCompression()).isTrue();
    }
}
