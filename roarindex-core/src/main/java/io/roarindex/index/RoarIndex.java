package io.roarindex.index;

import io.roarindex.core.KeyNotFoundException;
import io.roarindex.core.RoarIndexConfiguration;
import io.roarindex.kernel.IdSet;
import io.roarindex.kernel.IdSetFactory;
import io.roarindex.kernel.IntEnumerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory inverted index from keys to duplicate-free sets of values.
 * <p>
 * Keys and values are interned into two independent spaces of dense 32-bit
 * identifiers; each key owns a compressed bitmap of value identifiers.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>{@link #pushMap} is idempotent per (key, value) pair.</li>
 *   <li>{@link #getMap} returns values in ascending value-identifier order, which is
 *       the order values were first seen by this index across <i>all</i> keys,
 *       not the order they were pushed under one key.</li>
 *   <li>Deleting a key retires its identifier for good; pushing the same key again
 *       starts from an empty set under a fresh identifier.</li>
 *   <li>Value identifiers are never released by {@link #deleteMap}; only
 *       {@link #clear()} resets the value space.</li>
 * </ul>
 * <p>
 * <b>Threading:</b> a single {@link ReentrantReadWriteLock} covers both interners
 * and the posting store. Mutations take the write lock, everything else the read
 * lock, so no reader ever observes half of a push.
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class RoarIndex<K, V> {
    private static final Logger log = LoggerFactory.getLogger(RoarIndex.class);

    private final Interner<K> keys;
    private final Interner<V> values;
    private final PostingStore postings;
    private final ReentrantReadWriteLock lock;

    public RoarIndex() {
        this(RoarIndexConfiguration.defaults());
    }

    public RoarIndex(RoarIndexConfiguration configuration) {
        Objects.requireNonNull(configuration, "configuration");
        this.keys = new Interner<>("key", configuration.initialKeyCapacity());
        this.values = new Interner<>("value", configuration.initialValueCapacity());
        this.postings = new PostingStore(new IdSetFactory(configuration.runOptimizeOnAdd()),
                configuration.initialKeyCapacity());
        this.lock = new ReentrantReadWriteLock(configuration.fairLock());
        log.debug("Created RoarIndex with {}", configuration);
    }

    public static <K, V> RoarIndex<K, V> create() {
        return new RoarIndex<>();
    }

    public static <K, V> RoarIndex<K, V> create(RoarIndexConfiguration configuration) {
        return new RoarIndex<>(configuration);
    }

    /**
     * Associate a value with a key.
     *
     * @param key   the key, made visible if it is not already
     * @param value the value to add to the key's set
     * @throws IllegalArgumentException if key or value is null
     */
    public void pushMap(K key, V value) {
        requireKey(key);
        if (value == null) {
            throw new IllegalArgumentException("value required");
        }
        var writeLock = lock.writeLock();
        writeLock.lock();
        try {
            // value first: a failed key mint must not leave a visible key without postings
            int valueId = values.intern(value);
            int keyId = keys.intern(key);
            postings.add(keyId, valueId);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Associate every value of the collection with a key under one lock acquisition.
     * Values are interned in the collection's iteration order. An empty collection
     * does not make the key visible.
     *
     * @throws IllegalArgumentException if key, the collection or any element is null
     */
    public void pushAll(K key, Collection<? extends V> newValues) {
        requireKey(key);
        if (newValues == null) {
            throw new IllegalArgumentException("values required");
        }
        if (newValues.isEmpty()) {
            return;
        }
        for (V value : newValues) {
            if (value == null) {
                throw new IllegalArgumentException("value required");
            }
        }
        var writeLock = lock.writeLock();
        writeLock.lock();
        try {
            int[] valueIds = new int[newValues.size()];
            int i = 0;
            for (V value : newValues) {
                valueIds[i++] = values.intern(value);
            }
            int keyId = keys.intern(key);
            for (int valueId : valueIds) {
                postings.add(keyId, valueId);
            }
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Values currently associated with a key, ascending by value identifier.
     *
     * @return a fresh list the caller may modify
     * @throws KeyNotFoundException if the key was never pushed or has been deleted
     */
    public List<V> getMap(K key) {
        var readLock = lock.readLock();
        readLock.lock();
        try {
            Integer keyId = keys.idOf(key);
            if (keyId == null) {
                throw new KeyNotFoundException(key);
            }
            return resolve(postings.lookup(keyId));
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Same as {@link #getMap} but signals an invisible key with an empty Optional.
     */
    public Optional<List<V>> findMap(K key) {
        var readLock = lock.readLock();
        readLock.lock();
        try {
            Integer keyId = keys.idOf(key);
            if (keyId == null) {
                return Optional.empty();
            }
            return Optional.of(resolve(postings.lookup(keyId)));
        } finally {
            readLock.unlock();
        }
    }

    public boolean hasValue(K key, V value) {
        var readLock = lock.readLock();
        readLock.lock();
        try {
            Integer keyId = keys.idOf(key);
            if (keyId == null) {
                return false;
            }
            Integer valueId = values.idOf(value);
            if (valueId == null) {
                return false;
            }
            return postings.contains(keyId, valueId);
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Number of values currently associated with a key, 0 if the key is not visible.
     */
    public int cardinality(K key) {
        var readLock = lock.readLock();
        readLock.lock();
        try {
            Integer keyId = keys.idOf(key);
            return keyId == null ? 0 : postings.lookup(keyId).size();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Remove a key and its whole value set. Absent keys are ignored.
     * Value identifiers stay interned.
     */
    public void deleteMap(K key) {
        if (key == null) {
            return;
        }
        var writeLock = lock.writeLock();
        writeLock.lock();
        try {
            Integer keyId = keys.remove(key);
            if (keyId == null) {
                return;
            }
            postings.removeAll(keyId);
            if (log.isDebugEnabled()) {
                log.debug("Deleted key {} (id {})", key, Integer.toUnsignedString(keyId));
            }
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Snapshot of the currently visible keys.
     */
    public Set<K> keys() {
        var readLock = lock.readLock();
        readLock.lock();
        try {
            return keys.snapshot();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Snapshot of every value ever interned, whether or not a visible key still holds it.
     */
    public Set<V> values() {
        var readLock = lock.readLock();
        readLock.lock();
        try {
            return values.snapshot();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Number of visible keys.
     */
    public int count() {
        var readLock = lock.readLock();
        readLock.lock();
        try {
            return keys.size();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Number of values ever interned.
     */
    public int valueCount() {
        var readLock = lock.readLock();
        readLock.lock();
        try {
            return values.size();
        } finally {
            readLock.unlock();
        }
    }

    public boolean isEmpty() {
        return count() == 0;
    }

    /**
     * Run-length compact every posting set. Contents are unchanged.
     */
    public void optimize() {
        var writeLock = lock.writeLock();
        writeLock.lock();
        try {
            int changed = postings.optimize();
            log.debug("Optimized {} of {} posting sets", changed, postings.size());
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Drop every key, every value and reset both identifier counters.
     */
    public void clear() {
        var writeLock = lock.writeLock();
        writeLock.lock();
        try {
            log.debug("Clearing {} keys and {} values", keys.size(), values.size());
            postings.clear();
            keys.clear();
            values.clear();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public String toString() {
        var readLock = lock.readLock();
        readLock.lock();
        try {
            return "RoarIndex{keys=" + keys.size() + ", values=" + values.size() + "}";
        } finally {
            readLock.unlock();
        }
    }

    // Caller holds the read or write lock
    private List<V> resolve(IdSet set) {
        List<V> result = new ArrayList<>(set.size());
        IntEnumerator e = set.enumerator();
        while (e.hasNext()) {
            V value = values.objectOf(e.nextInt());
            if (value != null) {
                result.add(value);
            }
        }
        return result;
    }

    private static void requireKey(Object key) {
        if (key == null) {
            throw new IllegalArgumentException("key required");
        }
    }
}
