package com.locksmith.lease;

import java.util.ServiceLoader;

/**
 * Builds the {@link RemoteCaller} used by a {@link Locksmith}.
 * <p>
 * This is the substitution point for the connection type. A factory is invoked at most once
 * per channel, from the thread that won the initialization race.
 * </p>
 */
@FunctionalInterface
public interface RemoteCallerFactory {

    /**
     * Creates a caller connected (or lazily connectable) to the authority described by the settings.
     *
     * @param settings the immutable connection settings of the {@link Locksmith}.
     * @return a ready to use caller, never {@code null}.
     */
    RemoteCaller connect(ConnectionSettings settings);

    /**
     * Loads the first factory registered under {@code META-INF/services}.
     *
     * @return the default factory.
     * @throws LocksmithConfigurationException if no factory is registered.
     */
    static RemoteCallerFactory loadDefault() {
        return ServiceLoader.load(RemoteCallerFactory.class)
                .findFirst()
                .orElseThrow(() -> new LocksmithConfigurationException(
                        "No " + RemoteCallerFactory.class.getName() + " is registered as a service"));
    }

}
