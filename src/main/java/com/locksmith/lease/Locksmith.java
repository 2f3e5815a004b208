package com.locksmith.lease;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;

import static com.locksmith.lease.LocksmithUtils.LOGGER;
import static com.locksmith.lease.LocksmithUtils.toSeconds;
import static java.lang.String.format;

/**
 * Client of a remote lock authority granting named, time-bounded leases.
 * <p>
 * At most one unexpired lease per lock name exists at the authority at any time. This class
 * only forwards requests: waiting, expiry and arbitration between competitors happen at the
 * authority. A lost acquisition or a stale lease is reported through the return value; only
 * configuration, transport and authority faults raise a {@link LocksmithException}.
 * </p>
 * <p>
 * Instances are thread safe. The channel to the authority is created on first use and shared
 * by all callers of the instance.
 * </p>
 * <pre>{@code
 * try (var locksmith = new Locksmith("authority.local", 33013)) {
 *     var lease = locksmith.acquire("invoices", 30, TimeUnit.SECONDS, 5, TimeUnit.SECONDS);
 *     if (lease.isPresent()) {
 *         try {
 *             // guarded work
 *         } finally {
 *             lease.get().release();
 *         }
 *     }
 * }
 * }</pre>
 */
public final class Locksmith implements AutoCloseable {

    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 33013;

    private static final double MIN_WAIT_SECONDS = 0.001;

    private final ConnectionManager connectionManager;

    public Locksmith() {
        this(DEFAULT_HOST, DEFAULT_PORT);
    }

    public Locksmith(String host, int port) {
        this(host, port, null, null);
    }

    public Locksmith(String host, int port, String user, String password) {
        this(new ConnectionSettings(host, port, user, password));
    }

    public Locksmith(String host, int port, String user, String password, long timeout, TimeUnit unit) {
        this(new ConnectionSettings(host, port, user, password, timeout, unit));
    }

    public Locksmith(ConnectionSettings settings) {
        if (settings == null) {
            throw new LocksmithConfigurationException("Connection settings must not be null");
        }
        this.connectionManager = new ConnectionManager(settings);
    }

    public ConnectionSettings getSettings() {
        return connectionManager.getSettings();
    }

    /**
     * Acquires a lease on {@code name}, waiting at the authority for as long as it takes.
     *
     * @param name     the lock name.
     * @param validity how long the lease stays valid once granted, must be positive.
     * @param unit     the unit of {@code validity}.
     * @return the granted lease, or empty if the authority denied it.
     */
    public Optional<Lease> acquire(String name, long validity, TimeUnit unit) {
        checkName(name);
        var validitySeconds = checkValidity(validity, unit);
        return acquire(name, LocksmithProtocol.acquireArgs(name, validitySeconds, null));
    }

    /**
     * Acquires a lease on {@code name}, letting the authority wait at most {@code timeout}.
     * <p>
     * A zero timeout makes a single attempt. A positive timeout under 1 millisecond is rounded up to 1 millisecond.
     * </p>
     *
     * @param name        the lock name.
     * @param validity    how long the lease stays valid once granted, must be positive.
     * @param unit        the unit of {@code validity}.
     * @param timeout     the longest wait at the authority, must not be negative.
     * @param timeoutUnit the unit of {@code timeout}.
     * @return the granted lease, or empty if the lock was not obtained within the timeout.
     */
    public Optional<Lease> acquire(String name, long validity, TimeUnit unit, long timeout, TimeUnit timeoutUnit) {
        checkName(name);
        var validitySeconds = checkValidity(validity, unit);
        Objects.requireNonNull(timeoutUnit, "timeoutUnit");
        if (timeout < 0) {
            throw new IllegalArgumentException(format("Timeout must not be negative, got %d %s", timeout, timeoutUnit));
        }
        // A positive timeout shorter than the wire precision still allows waiting.
        var timeoutSeconds = timeout > 0 && timeoutUnit.toMillis(timeout) == 0 ? MIN_WAIT_SECONDS : toSeconds(timeout, timeoutUnit);
        return acquire(name, LocksmithProtocol.acquireArgs(name, validitySeconds, timeoutSeconds));
    }

    private Optional<Lease> acquire(String name, List<Object> args) {
        var reply = LocksmithProtocol.decodeAcquire(call(LocksmithProtocol.ACQUIRE, args));
        if (!reply.isGranted()) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Lease for `{}' was denied", name);
            }
            return Optional.empty();
        }
        var lease = new Lease(this, reply.getName(), reply.getLeaseId());
        LOGGER.info("Lease for `{}' was granted as `{}'", lease.getName(), lease.getLeaseId());
        return Optional.of(lease);
    }

    /**
     * Extends a lease by {@code validity} counted from now.
     *
     * @param leaseId  the id of the lease.
     * @param validity the new validity, must be positive.
     * @param unit     the unit of {@code validity}.
     * @return {@code true} if the lease was still held and has been extended, {@code false} if it expired,
     * was released or never existed.
     */
    public boolean update(String leaseId, long validity, TimeUnit unit) {
        checkLeaseId(leaseId);
        var validitySeconds = checkValidity(validity, unit);
        var reply = LocksmithProtocol.decodeLease(LocksmithProtocol.UPDATE,
                call(LocksmithProtocol.UPDATE, LocksmithProtocol.updateArgs(leaseId, validitySeconds)));
        if (reply.isConfirmed()) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Lease `{}' was extended by {} s", leaseId, validitySeconds);
            }
        } else if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Lease `{}' was not held at update", leaseId);
        }
        return reply.isConfirmed();
    }

    /**
     * Releases a lease.
     *
     * @param leaseId the id of the lease.
     * @return {@code true} if the lease was still held and has been released.
     */
    public boolean release(String leaseId) {
        checkLeaseId(leaseId);
        var reply = LocksmithProtocol.decodeLease(LocksmithProtocol.RELEASE,
                call(LocksmithProtocol.RELEASE, LocksmithProtocol.releaseArgs(leaseId)));
        if (reply.isConfirmed()) {
            LOGGER.info("Lease `{}' was released", leaseId);
        } else if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Lease `{}' was not held at release", leaseId);
        }
        return reply.isConfirmed();
    }

    /**
     * Queries the authority's statistics.
     *
     * @return the statistics object exactly as the authority returned it.
     */
    public Object statistics() {
        return LocksmithProtocol.decodeStatistics(call(LocksmithProtocol.STATISTICS, List.of()));
    }

    public RemoteCallerFactory getRemoteCallerFactory() {
        return connectionManager.getRemoteCallerFactory();
    }

    /**
     * Replaces the factory of the channel to the authority. The current channel, if any, is closed.
     *
     * @param factory the new factory, or {@code null} to restore the default one.
     */
    public void setRemoteCallerFactory(RemoteCallerFactory factory) {
        connectionManager.setRemoteCallerFactory(factory);
    }

    public Lock getConnectionLock() {
        return connectionManager.getConnectionLock();
    }

    /**
     * Replaces the lock guarding the creation of the channel.
     *
     * @param lock the new lock, or {@code null} to restore a new {@link java.util.concurrent.locks.ReentrantLock}.
     */
    public void setConnectionLock(Lock lock) {
        connectionManager.setConnectionLock(lock);
    }

    /**
     * Closes the channel to the authority. Leases held at the authority are not released.
     */
    @Override
    public void close() {
        connectionManager.close();
    }

    private RemoteReply call(String functionName, List<Object> args) {
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("Calling {}{}", functionName, args);
        }
        return connectionManager.getConnection().call(functionName, args);
    }

    private static void checkName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Lock name must not be empty");
        }
    }

    private static void checkLeaseId(String leaseId) {
        if (leaseId == null || leaseId.isEmpty()) {
            throw new IllegalArgumentException("Lease id must not be empty");
        }
    }

    private static double checkValidity(long validity, TimeUnit unit) {
        Objects.requireNonNull(unit, "unit");
        if (validity <= 0 || unit.toMillis(validity) <= 0) {
            throw new IllegalArgumentException(format("Validity must be at least 1 millisecond, got %d %s", validity, unit));
        }
        return toSeconds(validity, unit);
    }

}
