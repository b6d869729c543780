package io.roarindex.kernel;

import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IdSetsTest {

    @Test
    void emptySetShouldHaveNoMembers() {
        IdSet empty = IdSets.empty();

        assertThat(empty.size()).isZero();
        assertThat(empty.contains(0)).isFalse();
        assertThat(empty.toIntArray()).isEmpty();
        assertThat(empty.enumerator().hasNext()).isFalse();
        assertThatThrownBy(() -> empty.enumerator().nextInt())
                .isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void emptySetShouldBeSingleton() {
        assertThat(IdSets.empty()).isSameAs(IdSets.empty());
    }
}
