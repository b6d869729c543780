package io.roarindex.kernel;

import java.util.NoSuchElementException;

public final class IdSets {
    private static final IntEnumerator EMPTY_ENUMERATOR = new IntEnumerator() {
        @Override
        public boolean hasNext() {
            return false;
        }

        @Override
        public int nextInt() {
            throw new NoSuchElementException();
        }
    };

    private static final IdSet EMPTY = new IdSet() {
        @Override
        public int size() {
            return 0;
        }

        @Override
        public boolean contains(int id) {
            return false;
        }

        @Override
        public int[] toIntArray() {
            return new int[0];
        }

        @Override
        public IntEnumerator enumerator() {
            return EMPTY_ENUMERATOR;
        }
    };

    private IdSets() {
    }

    public static IdSet empty() {
        return EMPTY;
    }
}
