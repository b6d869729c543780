package io.roarindex.kernel;

/**
 * Mutable set of identifiers.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>add() is idempotent.</li>
 *   <li>remove() is idempotent - no-op when value absent.</li>
 *   <li>Iteration order stays ascending unsigned after any mutation.</li>
 * </ul>
 */
public interface MutableIdSet extends IdSet {
    /**
     * Adds an identifier to this set.
     * <p>
     * If the identifier is already present, this is a no-op (idempotent).
     * @param id the identifier to add
     */
    void add(int id);

    /**
     * Removes an identifier from this set.
     * <p>
     * If the identifier is not present, this is a no-op (idempotent).
     * @param id the identifier to remove
     */
    void remove(int id);

    /**
     * Compacts the internal representation without changing the contents.
     * @return true if the representation changed
     */
    boolean optimize();
}
