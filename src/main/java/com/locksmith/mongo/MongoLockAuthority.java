package com.locksmith.mongo;

import com.locksmith.lease.LocksmithNetworkException;
import com.locksmith.lease.LocksmithProtocol;
import com.locksmith.lease.LocksmithRemoteException;
import com.locksmith.lease.RemoteCaller;
import com.locksmith.lease.RemoteReply;
import com.mongodb.ErrorCategory;
import com.mongodb.MongoException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.MongoWriteException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import org.bson.Document;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static com.locksmith.mongo.MongoLockRepository.LOGGER;
import static java.lang.String.format;

/**
 * Lock authority backed by a MongoDB collection.
 * <p>
 * Serves the {@code locksmith:*} functions in process. Every decision is a single atomic write
 * on the lease document, so any number of clients sharing the collection see one lease per
 * lock name at a time. Waiting acquisitions poll with exponential backoff; waiters are not
 * served in arrival order.
 * </p>
 * <p>
 * Driver failures are translated here: socket and timeout failures become
 * {@link LocksmithNetworkException}, any other {@link MongoException} becomes
 * {@link LocksmithRemoteException}. Once closed, the authority fails every call, including
 * acquisitions still waiting, with a {@link LocksmithNetworkException}.
 * </p>
 */
public final class MongoLockAuthority implements RemoteCaller {

    // Expired leases are purged once every this many acquire calls.
    static final int PURGE_PERIOD = 10;

    private final MongoClient mongoClient;
    private final MongoCollection<Document> leaseCollection;
    private final BackoffStrategy backoffStrategy;
    private final AtomicLong acquireCounter = new AtomicLong();
    private final AtomicLong updateCounter = new AtomicLong();
    private final AtomicLong releaseCounter = new AtomicLong();
    private final AtomicLong deniedCounter = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean();

    /**
     * @param mongoClient     the client owning the collection, closed with this authority; may be {@code null}
     *                        when the client is owned elsewhere.
     * @param leaseCollection the lease collection.
     * @param backoffStrategy the delays between acquisition attempts.
     */
    MongoLockAuthority(MongoClient mongoClient, MongoCollection<Document> leaseCollection, BackoffStrategy backoffStrategy) {
        this.mongoClient = mongoClient;
        this.leaseCollection = leaseCollection;
        this.backoffStrategy = backoffStrategy;
    }

    /**
     * Creates an authority over a collection whose client is managed by the caller.
     */
    public MongoLockAuthority(MongoCollection<Document> leaseCollection) {
        this(null, leaseCollection, BackoffStrategy.getDefault());
    }

    @Override
    public RemoteReply call(String functionName, List<?> args) {
        checkOpen(functionName);
        try {
            switch (String.valueOf(functionName)) {
                case LocksmithProtocol.ACQUIRE:
                    return acquire(args);
                case LocksmithProtocol.UPDATE:
                    return update(args);
                case LocksmithProtocol.RELEASE:
                    return release(args);
                case LocksmithProtocol.STATISTICS:
                    return statistics();
                default:
                    throw new LocksmithRemoteException(format("Unknown function `%s'", functionName));
            }
        } catch (MongoSocketException | MongoTimeoutException ex) {
            throw new LocksmithNetworkException(format("Call of %s could not reach MongoDB", functionName), ex);
        } catch (MongoException ex) {
            throw new LocksmithRemoteException(format("Call of %s failed in MongoDB", functionName), ex);
        } catch (IllegalStateException ex) {
            // Raised by the driver when the client was closed under a running call.
            throw new LocksmithNetworkException(format("Call of %s lost its MongoDB client", functionName), ex);
        }
    }

    private void checkOpen(String functionName) {
        if (closed.get()) {
            throw new LocksmithNetworkException(format("Call of %s on a closed MongoDB authority", functionName));
        }
    }

    private RemoteReply acquire(List<?> args) {
        if (args == null || args.size() < 2 || args.size() > 3) {
            throw badArguments(LocksmithProtocol.ACQUIRE, args);
        }
        var lockName = stringArg(LocksmithProtocol.ACQUIRE, args, 0);
        var validityMillis = millisArg(LocksmithProtocol.ACQUIRE, args, 1);
        if (validityMillis <= 0) {
            throw badArguments(LocksmithProtocol.ACQUIRE, args);
        }
        Long timeoutMillis = args.size() == 3 ? millisArg(LocksmithProtocol.ACQUIRE, args, 2) : null;
        if (timeoutMillis != null && timeoutMillis < 0) {
            throw badArguments(LocksmithProtocol.ACQUIRE, args);
        }

        if (acquireCounter.incrementAndGet() % PURGE_PERIOD == 0) {
            purgeExpiredLeases();
        }

        var deadline = timeoutMillis == null ? 0 : System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        var attemptNo = 0;
        while (true) {
            var leaseId = tryAcquire(lockName, validityMillis);
            if (leaseId != null) {
                return RemoteReply.ofTuple(Boolean.TRUE, lockName, leaseId);
            }
            var delay = backoffStrategy.calculateDelay(attemptNo++);
            if (timeoutMillis != null) {
                var remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMillis <= 0) {
                    deniedCounter.incrementAndGet();
                    return RemoteReply.ofTuple(null, lockName);
                }
                delay = Math.min(delay, remainingMillis);
            }
            try {
                TimeUnit.MILLISECONDS.sleep(delay);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new LocksmithNetworkException(format("Acquisition of `%s' was interrupted", lockName), ex);
            }
            checkOpen(LocksmithProtocol.ACQUIRE);
        }
    }

    /**
     * Makes one acquisition attempt.
     *
     * @return the id of the new lease, or {@code null} if another unexpired lease holds the lock.
     */
    String tryAcquire(String lockName, long validityMillis) {
        var leaseId = UUID.randomUUID().toString();
        try {
            MongoLockRepository.insertLease(leaseCollection, lockName, leaseId, validityMillis);
            LOGGER.info("Lock `{}' was granted to lease `{}'", lockName, leaseId);
            return leaseId;
        } catch (MongoWriteException mongoEx) {
            var category = mongoEx.getError().getCategory();
            if (!ErrorCategory.DUPLICATE_KEY.equals(category)) {
                throw mongoEx;
            }
        }
        var previous = MongoLockRepository.takeOverExpiredLease(leaseCollection, lockName, leaseId, validityMillis);
        if (previous != null) {
            LOGGER.info("Lock `{}' was transferred from expired lease `{}' to `{}'",
                    lockName, previous.getString(MongoLockRepository.LEASE_ID), leaseId);
            return leaseId;
        }
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("Lock `{}' acquisition attempt failed", lockName);
        }
        return null;
    }

    private RemoteReply update(List<?> args) {
        if (args == null || args.size() != 2) {
            throw badArguments(LocksmithProtocol.UPDATE, args);
        }
        var leaseId = stringArg(LocksmithProtocol.UPDATE, args, 0);
        var validityMillis = millisArg(LocksmithProtocol.UPDATE, args, 1);
        if (validityMillis <= 0) {
            throw badArguments(LocksmithProtocol.UPDATE, args);
        }
        updateCounter.incrementAndGet();
        var result = MongoLockRepository.extendLease(leaseCollection, leaseId, validityMillis);
        return result.getMatchedCount() > 0 ? RemoteReply.ofTuple(Boolean.TRUE) : RemoteReply.ofTuple((Object) null);
    }

    private RemoteReply release(List<?> args) {
        if (args == null || args.size() != 1) {
            throw badArguments(LocksmithProtocol.RELEASE, args);
        }
        var leaseId = stringArg(LocksmithProtocol.RELEASE, args, 0);
        releaseCounter.incrementAndGet();
        var result = MongoLockRepository.deleteLease(leaseCollection, leaseId);
        return result.getDeletedCount() > 0 ? RemoteReply.ofTuple(Boolean.TRUE) : RemoteReply.ofTuple((Object) null);
    }

    private RemoteReply statistics() {
        var total = MongoLockRepository.countLeases(leaseCollection);
        var active = MongoLockRepository.countActiveLeases(leaseCollection);
        var stats = new Document("total", total)
                .append("active", active)
                .append("expired", Math.max(0, total - active))
                .append("acquire", acquireCounter.get())
                .append("update", updateCounter.get())
                .append("release", releaseCounter.get())
                .append("denied", deniedCounter.get());
        return RemoteReply.ofTuple(stats);
    }

    private void purgeExpiredLeases() {
        try {
            var result = MongoLockRepository.bulkDeleteExpiredLeases(leaseCollection);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("{} expired lease(s) purged", result.getDeletedCount());
            }
        } catch (MongoException ex) {
            LOGGER.warn("Expired leases could not be purged", ex);
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true) && mongoClient != null) {
            mongoClient.close();
        }
    }

    private static String stringArg(String functionName, List<?> args, int index) {
        var value = args.get(index);
        if (!(value instanceof String) || ((String) value).isEmpty()) {
            throw badArguments(functionName, args);
        }
        return (String) value;
    }

    // Durations travel as seconds.
    private static long millisArg(String functionName, List<?> args, int index) {
        var value = args.get(index);
        if (!(value instanceof Number)) {
            throw badArguments(functionName, args);
        }
        return Math.round(((Number) value).doubleValue() * 1000);
    }

    private static LocksmithRemoteException badArguments(String functionName, List<?> args) {
        return new LocksmithRemoteException(format("Bad arguments for %s: %s", functionName, args));
    }

}
