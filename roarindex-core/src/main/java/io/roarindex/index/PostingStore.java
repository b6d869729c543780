package io.roarindex.index;

import io.roarindex.kernel.IdSet;
import io.roarindex.kernel.IdSetFactory;
import io.roarindex.kernel.IdSets;
import io.roarindex.kernel.MutableIdSet;
import org.agrona.collections.Hashing;
import org.agrona.collections.Int2ObjectHashMap;

import java.util.Objects;

/**
 * Maps key identifiers to compressed sets of value identifiers.
 * <p>
 * A key identifier is present only while at least one value has been added
 * to it and it has not been removed. Sets are never shared between keys.
 * Not synchronized; {@link RoarIndex} guards it.
 */
public final class PostingStore {
    private final Int2ObjectHashMap<MutableIdSet> postings;
    private final IdSetFactory setFactory;

    public PostingStore() {
        this(IdSetFactory.defaultFactory(), 16);
    }

    public PostingStore(IdSetFactory setFactory, int initialCapacity) {
        this.setFactory = Objects.requireNonNull(setFactory, "setFactory");
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("initialCapacity must be non-negative");
        }
        this.postings = new Int2ObjectHashMap<>(Math.max(initialCapacity, 8), Hashing.DEFAULT_LOAD_FACTOR, false);
    }

    public void add(int keyId, int valueId) {
        MutableIdSet set = postings.get(keyId);
        if (set == null) {
            set = setFactory.create();
            postings.put(keyId, set);
        }
        set.add(valueId);
    }

    /**
     * Remove the whole posting set of the given key.
     * @param keyId the key whose set should be discarded
     * @return true if a set was present
     */
    public boolean removeAll(int keyId) {
        return postings.remove(keyId) != null;
    }

    public IdSet lookup(int keyId) {
        MutableIdSet set = postings.get(keyId);
        return set == null ? IdSets.empty() : set;
    }

    public boolean contains(int keyId, int valueId) {
        MutableIdSet set = postings.get(keyId);
        return set != null && set.contains(valueId);
    }

    public boolean hasPostings(int keyId) {
        return postings.containsKey(keyId);
    }

    /**
     * Compact every posting set.
     * @return number of sets whose representation changed
     */
    public int optimize() {
        int changed = 0;
        for (MutableIdSet set : postings.values()) {
            if (set.optimize()) {
                changed++;
            }
        }
        return changed;
    }

    public void clear() {
        postings.clear();
    }

    public int size() {
        return postings.size();
    }
}
