package com.ascherbakoff.ordmap.map;

/**
 * Thrown when a key outside of the map's key domain reaches it through an unchecked call.
 */
public class KeyDomainException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public KeyDomainException(Class<?> expected, Object key) {
        super("Key " + key + " of type " + key.getClass().getName() + " is not in the key domain " + expected.getName());
    }
}
