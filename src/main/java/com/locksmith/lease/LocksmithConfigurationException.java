package com.locksmith.lease;

/**
 * Raised synchronously when a {@link Locksmith} is configured with values it cannot work with:
 * an empty host, a port out of range, a non-positive timeout, a connection factory that
 * produced no connection or a missing default connection factory.
 * <p>
 * Configuration errors are never retried.
 * </p>
 */
public class LocksmithConfigurationException extends LocksmithException {

    public LocksmithConfigurationException(String message) {
        super(message);
    }

    public LocksmithConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

}
