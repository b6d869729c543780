package io.roarindex.kernel;

/**
 * Read-only view of a set of 32-bit identifiers.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>This is a <b>set</b> - no duplicate identifiers.</li>
 *   <li>Identifiers are unsigned: {@code -1} stands for {@code 2^32 - 1}.</li>
 *   <li>size() returns the cardinality (number of unique identifiers).</li>
 *   <li>toIntArray() and enumerator() produce identifiers in ascending unsigned order.</li>
 * </ul>
 * Implementations are not synchronized; callers serialize access.
 */
public interface IdSet {
    /**
     * Returns the number of unique identifiers in this set.
     * @return cardinality (always non-negative)
     */
    int size();

    /**
     * Tests if the given identifier is present in this set.
     * @param id the identifier to test
     * @return true if present, false otherwise
     */
    boolean contains(int id);

    /**
     * Returns a snapshot array of all identifiers in ascending unsigned order.
     * <p>
     * The returned array is a copy and safe to modify.
     * @return snapshot array of identifiers
     */
    int[] toIntArray();

    /**
     * Returns an enumerator over this set in ascending unsigned order.
     * <p>
     * The enumerator reads the live set; it must not outlive the caller's
     * hold on whatever guards the set.
     * @return ascending enumerator
     */
    IntEnumerator enumerator();
}
