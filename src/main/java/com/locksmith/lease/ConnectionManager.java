package com.locksmith.lease;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import static com.locksmith.lease.LocksmithUtils.LOGGER;
import static java.lang.String.format;

/**
 * Owns the single channel a {@link Locksmith} uses to reach the remote authority.
 * <p>
 * The channel is created lazily by the first caller that needs it. Concurrent first callers
 * block on the connection lock while the winner builds the channel and then all of them share
 * the same instance. The lock guards construction only and is never held during a remote call.
 * </p>
 * <p>
 * Both the connection factory and the connection lock can be substituted. Passing {@code null}
 * restores the default: the factory registered as a service, or a new {@link ReentrantLock}.
 * </p>
 */
final class ConnectionManager implements AutoCloseable {

    private final ConnectionSettings settings;
    private volatile RemoteCallerFactory remoteCallerFactory;
    private volatile Lock connectionLock = new ReentrantLock();
    private volatile RemoteCaller remoteCaller;

    ConnectionManager(ConnectionSettings settings) {
        this.settings = settings;
    }

    ConnectionSettings getSettings() {
        return settings;
    }

    /**
     * Returns the shared channel, creating it on first use.
     *
     * @return the shared channel.
     * @throws LocksmithConfigurationException if the factory cannot produce a channel.
     */
    RemoteCaller getConnection() {
        var caller = remoteCaller;
        if (caller == null) {
            var lock = getConnectionLock();
            lock.lock();
            try {
                caller = remoteCaller;
                if (caller == null) {
                    var factory = getRemoteCallerFactory();
                    caller = factory.connect(settings);
                    if (caller == null) {
                        throw new LocksmithConfigurationException(format("Connection factory %s returned no connection for %s",
                                factory.getClass().getName(), settings));
                    }
                    remoteCaller = caller;
                    LOGGER.info("Connection to `{}' was established", settings);
                }
            } finally {
                lock.unlock();
            }
        }
        return caller;
    }

    /**
     * @return {@code true} if the channel has been created and not closed since.
     */
    boolean isConnected() {
        return remoteCaller != null;
    }

    RemoteCallerFactory getRemoteCallerFactory() {
        var factory = remoteCallerFactory;
        if (factory == null) {
            factory = RemoteCallerFactory.loadDefault();
            remoteCallerFactory = factory;
        }
        return factory;
    }

    /**
     * Replaces the connection factory and drops the current channel, so that the next call
     * builds a channel with the new factory.
     *
     * @param factory the new factory, or {@code null} for the default one.
     */
    void setRemoteCallerFactory(RemoteCallerFactory factory) {
        var lock = getConnectionLock();
        lock.lock();
        try {
            remoteCallerFactory = factory;
            disconnect("factory replacement");
        } finally {
            lock.unlock();
        }
    }

    Lock getConnectionLock() {
        return connectionLock;
    }

    /**
     * Replaces the lock guarding channel construction.
     *
     * @param lock the new lock, or {@code null} for a new {@link ReentrantLock}.
     */
    void setConnectionLock(Lock lock) {
        connectionLock = lock == null ? new ReentrantLock() : lock;
    }

    /**
     * Closes the channel if one was created. Calling this method more than once has no effect.
     */
    @Override
    public void close() {
        var lock = getConnectionLock();
        lock.lock();
        try {
            disconnect("close");
        } finally {
            lock.unlock();
        }
    }

    private void disconnect(String by) {
        var caller = remoteCaller;
        remoteCaller = null;
        if (caller != null) {
            caller.close();
            LOGGER.info("Connection to `{}' was closed by {}", settings, by);
        }
    }

}
