package io.roarindex.core;

/**
 * Thrown when a lookup targets a key that is not visible, either because it
 * was never pushed or because it has since been deleted.
 */
public class KeyNotFoundException extends RoarIndexException {

    private final transient Object key;

    public KeyNotFoundException(Object key) {
        super("key not found: " + key);
        this.key = key;
    }

    /**
     * The key that was looked up.
     */
    public Object key() {
        return key;
    }
}
