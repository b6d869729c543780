package io.roarindex.kernel;

import org.roaringbitmap.IntIterator;
import org.roaringbitmap.RoaringBitmap;

import java.util.NoSuchElementException;

/**
 * Compressed identifier set backed by a {@link RoaringBitmap}.
 * <p>
 * Dense runs and sparse outliers are both stored compactly; enumeration is in
 * the bitmap's native ascending unsigned order.
 * <p>
 * <b>Threading:</b> not synchronized. The owning index guards every access
 * with its read/write lock, so readers may share an instance only while no
 * writer holds the lock.
 */
public final class RoaringIdSet implements MutableIdSet {
    private final RoaringBitmap bitmap;
    private final boolean runOptimizeOnAdd;

    public RoaringIdSet() {
        this(false);
    }

    public RoaringIdSet(boolean runOptimizeOnAdd) {
        this.bitmap = new RoaringBitmap();
        this.runOptimizeOnAdd = runOptimizeOnAdd;
    }

    @Override
    public void add(int id) {
        if (bitmap.checkedAdd(id) && runOptimizeOnAdd) {
            bitmap.runOptimize();
        }
    }

    @Override
    public void remove(int id) {
        bitmap.remove(id);
    }

    @Override
    public boolean optimize() {
        return bitmap.runOptimize();
    }

    @Override
    public int size() {
        return bitmap.getCardinality();
    }

    @Override
    public boolean contains(int id) {
        return bitmap.contains(id);
    }

    @Override
    public int[] toIntArray() {
        return bitmap.toArray();
    }

    @Override
    public IntEnumerator enumerator() {
        IntIterator it = bitmap.getIntIterator();
        return new IntEnumerator() {
            @Override
            public boolean hasNext() {
                return it.hasNext();
            }

            @Override
            public int nextInt() {
                if (!it.hasNext()) {
                    throw new NoSuchElementException();
                }
                return it.next();
            }
        };
    }

    /**
     * Serialized size of the underlying bitmap in bytes.
     */
    public int sizeInBytes() {
        return bitmap.serializedSizeInBytes();
    }

    /**
     * Whether the bitmap currently holds at least one run container.
     */
    public boolean hasRunCompression() {
        return bitmap.hasRunCompression();
    }

    @Override
    public String toString() {
        return "RoaringIdSet" + bitmap;
    }
}
