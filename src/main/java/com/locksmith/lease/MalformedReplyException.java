package com.locksmith.lease;

/**
 * Raised when a reply of the remote authority does not have the shape of the called function:
 * no result tuple at all, an empty first tuple, or a granted acquisition without the echoed
 * lock name and lease id.
 */
public class MalformedReplyException extends LocksmithRemoteException {

    public MalformedReplyException(String message) {
        super(message);
    }

}
