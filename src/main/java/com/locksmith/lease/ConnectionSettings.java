package com.locksmith.lease;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

import static java.lang.String.format;

/**
 * Immutable parameters used to open the channel to the remote authority.
 * <p>
 * Values are validated on construction; invalid values raise a {@link LocksmithConfigurationException}.
 * </p>
 */
public final class ConnectionSettings {

    private final String host;
    private final int port;
    private final String user;
    private final String password;
    private final long timeoutMillis;

    /**
     * Creates settings using the environment driven default round-trip timeout.
     *
     * @param host     the authority host, must not be empty.
     * @param port     the authority port, between 1 and 65535.
     * @param user     the optional user name.
     * @param password the optional password.
     */
    public ConnectionSettings(String host, int port, String user, String password) {
        this(host, port, user, password, LocksmithUtils.getEffectiveSocketTimeoutMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Creates settings.
     *
     * @param host     the authority host, must not be empty.
     * @param port     the authority port, between 1 and 65535.
     * @param user     the optional user name.
     * @param password the optional password.
     * @param timeout  the round-trip timeout, must be positive.
     * @param unit     the unit of {@code timeout}.
     */
    public ConnectionSettings(String host, int port, String user, String password, long timeout, TimeUnit unit) {
        if (host == null || host.isBlank()) {
            throw new LocksmithConfigurationException("Host and port params must be not empty");
        }
        if (port <= 0 || port > 0xFFFF) {
            throw new LocksmithConfigurationException(format("Port must be between 1 and 65535, got %d", port));
        }
        if (unit == null) {
            throw new LocksmithConfigurationException("Timeout unit must not be null");
        }
        if (timeout <= 0 || unit.toMillis(timeout) <= 0) {
            throw new LocksmithConfigurationException(format("Timeout must be at least 1 millisecond, got %d %s", timeout, unit));
        }
        if (password != null && user == null) {
            throw new LocksmithConfigurationException("A password requires a user");
        }
        this.host = host.trim();
        this.port = port;
        this.user = user;
        this.password = password;
        this.timeoutMillis = unit.toMillis(timeout);
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getUser() {
        return user;
    }

    public String getPassword() {
        return password;
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    public boolean hasCredentials() {
        return user != null;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ConnectionSettings)) {
            return false;
        }
        var that = (ConnectionSettings) other;
        return port == that.port
                && timeoutMillis == that.timeoutMillis
                && host.equals(that.host)
                && Objects.equals(user, that.user)
                && Objects.equals(password, that.password);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port, user, password, timeoutMillis);
    }

    // The password is never rendered.
    @Override
    public String toString() {
        return format("%s@%s:%d (timeout %d ms)", user == null ? "<anonymous>" : user, host, port, timeoutMillis);
    }

}
