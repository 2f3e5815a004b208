package com.locksmith.lease;

/**
 * Base class of every exception raised by the locksmith client.
 *
 * <p>
 * The client never raises an exception for the expected outcomes of lock contention:
 * losing an acquisition returns an empty {@link java.util.Optional}, and renewing or
 * releasing an unknown or expired lease returns {@code false}. Exceptions are reserved for
 * configuration mistakes and for failures of the transport or of the remote authority.
 * </p>
 *
 * <p>
 * Example usage:
 * <pre>
 * try {
 *     locksmith.acquire("reports", 30, TimeUnit.SECONDS, 0, TimeUnit.SECONDS)
 *             .ifPresent(lease -> runReports(lease));
 * } catch (LocksmithNetworkException ex) {
 *     // the authority could not be reached, the lock state is unknown
 * }
 * </pre>
 * </p>
 */
public class LocksmithException extends RuntimeException {

    /**
     * Constructs a new {@code LocksmithException} with the specified detail message.
     *
     * @param message a descriptive message providing context about the exception.
     */
    public LocksmithException(String message) {
        super(message);
    }

    /**
     * Constructs a new {@code LocksmithException} with the specified detail message and cause.
     *
     * @param message a descriptive message providing context about the exception.
     * @param cause   the underlying exception that caused this exception to be thrown.
     */
    public LocksmithException(String message, Throwable cause) {
        super(message, cause);
    }

}
