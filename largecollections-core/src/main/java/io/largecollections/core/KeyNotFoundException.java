package io.largecollections.core;

public class KeyNotFoundException extends LargeCollectionsException {

    public KeyNotFoundException(Object key) {
        super("key not found: " + key);
    }
}
