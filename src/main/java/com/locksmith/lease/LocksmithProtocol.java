package com.locksmith.lease;

import java.util.List;

import static java.lang.String.format;

/**
 * The call surface of the remote authority.
 * <p>
 * Builds the positional argument lists of the {@code locksmith:*} functions and decodes their
 * replies into typed values. Replies are decoded here only; nothing else in the client reads
 * raw tuples.
 * </p>
 * <p>
 * Reply shapes:
 * <ul>
 *   <li>{@code acquire}: {@code [(ok | nil, name, leaseId)]}</li>
 *   <li>{@code update}, {@code release}: {@code [(ok | nil)]}</li>
 *   <li>{@code statistics}: {@code [(stats)]}</li>
 * </ul>
 * </p>
 */
public final class LocksmithProtocol {

    public static final String ACQUIRE = "locksmith:acquire";
    public static final String UPDATE = "locksmith:update";
    public static final String RELEASE = "locksmith:release";
    public static final String STATISTICS = "locksmith:statistics";

    private LocksmithProtocol() {
    }

    /**
     * Builds the arguments of {@code locksmith:acquire}; the timeout is only sent when present.
     */
    static List<Object> acquireArgs(String lockName, double validitySeconds, Double timeoutSeconds) {
        if (timeoutSeconds == null) {
            return List.of(lockName, validitySeconds);
        }
        return List.of(lockName, validitySeconds, timeoutSeconds);
    }

    static List<Object> updateArgs(String leaseId, double validitySeconds) {
        return List.of(leaseId, validitySeconds);
    }

    static List<Object> releaseArgs(String leaseId) {
        return List.of(leaseId);
    }

    static AcquireReply decodeAcquire(RemoteReply reply) {
        var tuple = firstTuple(ACQUIRE, reply);
        if (tuple.get(0) == null) {
            return new AcquireReply(false, stringAt(tuple, 1), null);
        }
        if (tuple.size() < 3 || tuple.get(1) == null || tuple.get(2) == null) {
            throw new MalformedReplyException(format("Reply of %s grants a lease without name and id: %s", ACQUIRE, tuple));
        }
        return new AcquireReply(true, tuple.get(1).toString(), tuple.get(2).toString());
    }

    static LeaseReply decodeLease(String functionName, RemoteReply reply) {
        var tuple = firstTuple(functionName, reply);
        return new LeaseReply(tuple.get(0) != null);
    }

    static Object decodeStatistics(RemoteReply reply) {
        return firstTuple(STATISTICS, reply).get(0);
    }

    private static List<Object> firstTuple(String functionName, RemoteReply reply) {
        if (reply == null || reply.isEmpty()) {
            throw new MalformedReplyException(format("Reply of %s contains no tuple", functionName));
        }
        var tuple = reply.getTuples().get(0);
        if (tuple.isEmpty()) {
            throw new MalformedReplyException(format("Reply of %s starts with an empty tuple", functionName));
        }
        return tuple;
    }

    private static String stringAt(List<Object> tuple, int index) {
        if (tuple.size() <= index || tuple.get(index) == null) {
            return null;
        }
        return tuple.get(index).toString();
    }

}
