package com.locksmith.lease;

import java.util.List;

/**
 * The minimal capability the locksmith client needs from a transport: performing a named remote
 * call with positional arguments and returning the reply tuples.
 * <p>
 * Implementations must be safe for use by several threads at once, since a single instance
 * is shared by every caller of a {@link Locksmith}.
 * </p>
 * <p>
 * Failures to reach the authority are reported as {@link LocksmithNetworkException}, faults
 * reported by the authority as {@link LocksmithRemoteException}. The client passes both to
 * its callers unchanged.
 * </p>
 */
public interface RemoteCaller extends AutoCloseable {

    /**
     * Invokes a remote function.
     *
     * @param functionName the fully qualified remote function, e.g. {@code locksmith:acquire}.
     * @param args         the positional arguments, possibly empty, never {@code null}.
     * @return the reply composed of one or more result tuples.
     * @throws LocksmithNetworkException if the authority cannot be reached.
     * @throws LocksmithRemoteException  if the authority rejects or fails the call.
     */
    RemoteReply call(String functionName, List<?> args);

    /**
     * Releases the transport resources held by this caller.
     */
    @Override
    void close();

}
