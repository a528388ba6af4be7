package io.largecollections.core;

public class LargeCollectionsException extends RuntimeException {

    public LargeCollectionsException(String message, Throwable cause) {
        super(message, cause);
    }

    public LargeCollectionsException(String message) {
        super(message);
    }

}
