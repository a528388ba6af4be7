package io.largecollections.core;

/**
 * Thrown when growth, load-factor or chunk parameters violate their required ranges.
 */
public class InvalidConfigurationException extends LargeCollectionsException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
