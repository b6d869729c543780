package io.roarindex.kernel;

/**
 * Primitive iterator over identifiers.
 */
public interface IntEnumerator {
    boolean hasNext();

    int nextInt();
}
