package com.locksmith.lease;

/**
 * Raised by a {@link RemoteCaller} when the remote authority cannot be reached:
 * connection refused, socket errors, round-trip timeouts or an interrupted wait.
 * <p>
 * The client does not retry. Whether the call took effect at the authority is unknown.
 * </p>
 */
public class LocksmithNetworkException extends LocksmithException {

    public LocksmithNetworkException(String message) {
        super(message);
    }

    public LocksmithNetworkException(String message, Throwable cause) {
        super(message, cause);
    }

}
