package com.locksmith.lease;

/**
 * Raised when the remote authority was reached but reported an application level fault,
 * such as an unknown function, a malformed argument list or an internal error.
 */
public class LocksmithRemoteException extends LocksmithException {

    public LocksmithRemoteException(String message) {
        super(message);
    }

    public LocksmithRemoteException(String message, Throwable cause) {
        super(message, cause);
    }

}
