package io.roarindex.index;

import io.roarindex.core.RoarIndexException;
import org.agrona.collections.Hashing;
import org.agrona.collections.Int2ObjectHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Bidirectional table between objects and dense 32-bit identifiers.
 * <p>
 * Identifiers are handed out in first-seen order starting at 0 and are never
 * reused: {@link #remove(Object)} drops both directions of the mapping but
 * leaves the counter untouched. Identifiers are unsigned, so once the counter
 * passes {@link Integer#MAX_VALUE} they show up as negative ints.
 * <p>
 * Not synchronized. {@link RoarIndex} calls {@link #intern(Object)} and
 * {@link #remove(Object)} only under its write lock.
 *
 * @param <T> interned type, compared by {@code equals}/{@code hashCode}
 */
public final class Interner<T> {
    private static final Logger log = LoggerFactory.getLogger(Interner.class);

    static final long ID_SPACE = 1L << 32;

    private final String namespace;
    private final Map<T, Integer> objectToId;
    private final Int2ObjectHashMap<T> idToObject;
    private long nextId;

    public Interner(String namespace) {
        this(namespace, 16);
    }

    public Interner(String namespace, int initialCapacity) {
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("initialCapacity must be non-negative");
        }
        this.objectToId = new HashMap<>(Math.max(initialCapacity, 1));
        // readers iterate concurrently under the shared lock, so no cached iterators
        this.idToObject = new Int2ObjectHashMap<>(Math.max(initialCapacity, 8), Hashing.DEFAULT_LOAD_FACTOR, false);
    }

    // Package-private for exhaustion tests
    Interner(String namespace, int initialCapacity, long firstId) {
        this(namespace, initialCapacity);
        this.nextId = firstId;
    }

    /**
     * Returns the identifier of the given object, assigning the next one if
     * the object has not been seen.
     *
     * @param object the object to intern
     * @return its identifier
     * @throws RoarIndexException if all 2^32 identifiers have been handed out
     */
    public int intern(T object) {
        if (object == null) {
            throw new IllegalArgumentException(namespace + " required");
        }
        Integer existing = objectToId.get(object);
        if (existing != null) {
            return existing;
        }
        if (nextId >= ID_SPACE) {
            throw new RoarIndexException(namespace + " identifier space exhausted");
        }
        int id = (int) nextId++;
        objectToId.put(object, id);
        idToObject.put(id, object);
        if (log.isTraceEnabled()) {
            log.trace("Assigned {} id {} to {}", namespace, Integer.toUnsignedString(id), object);
        }
        return id;
    }

    /**
     * Looks up the identifier of an object without assigning one.
     *
     * @return the identifier, or null if the object is not interned
     */
    public Integer idOf(T object) {
        if (object == null) {
            return null;
        }
        return objectToId.get(object);
    }

    /**
     * Looks up the object registered under an identifier.
     *
     * @return the object, or null if the identifier is unassigned or removed
     */
    public T objectOf(int id) {
        return idToObject.get(id);
    }

    /**
     * Drops both directions of the mapping for the given object.
     *
     * @return the identifier it held, or null if it was not interned
     */
    public Integer remove(T object) {
        if (object == null) {
            return null;
        }
        Integer id = objectToId.remove(object);
        if (id != null) {
            idToObject.remove(id.intValue());
        }
        return id;
    }

    /**
     * Forgets every object and restarts the counter at 0.
     */
    public void clear() {
        objectToId.clear();
        idToObject.clear();
        nextId = 0;
    }

    /**
     * Fresh copy of every currently interned object.
     */
    public Set<T> snapshot() {
        return new HashSet<>(objectToId.keySet());
    }

    public int size() {
        return objectToId.size();
    }

    /**
     * The identifier the next new object would receive, as an unsigned value.
     */
    public long nextId() {
        return nextId;
    }

    public String namespace() {
        return namespace;
    }
}
