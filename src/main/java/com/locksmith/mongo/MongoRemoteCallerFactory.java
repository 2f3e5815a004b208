package com.locksmith.mongo;

import com.locksmith.lease.ConnectionSettings;
import com.locksmith.lease.LocksmithNetworkException;
import com.locksmith.lease.LocksmithRemoteException;
import com.locksmith.lease.LocksmithUtils;
import com.locksmith.lease.RemoteCaller;
import com.locksmith.lease.RemoteCallerFactory;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCredential;
import com.mongodb.MongoException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.ServerAddress;
import com.mongodb.WriteConcern;
import com.mongodb.client.MongoClients;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static com.locksmith.mongo.MongoLockRepository.LOGGER;

/**
 * Default {@link RemoteCallerFactory}: connects to a MongoDB server acting as the lock authority.
 * <p>
 * Registered under {@code META-INF/services}. The lease collection is placed according to the
 * {@code LOCKSMITH_DATABASE_NAME} and {@code LOCKSMITH_COLLECTION_NAME} environment variables.
 * </p>
 */
public final class MongoRemoteCallerFactory implements RemoteCallerFactory {

    public static final String DATABASE_NAME_KEY = "LOCKSMITH_DATABASE_NAME";
    public static final String DEFAULT_DATABASE_NAME = "Locksmith";
    public static final String COLLECTION_NAME_KEY = "LOCKSMITH_COLLECTION_NAME";
    public static final String DEFAULT_COLLECTION_NAME = "leases";

    static final String CREDENTIAL_SOURCE = "admin";

    public MongoRemoteCallerFactory() {
    }

    @Override
    public RemoteCaller connect(ConnectionSettings settings) {
        var databaseName = LocksmithUtils.getEffectiveString(DATABASE_NAME_KEY, DEFAULT_DATABASE_NAME);
        var collectionName = LocksmithUtils.getEffectiveString(COLLECTION_NAME_KEY, DEFAULT_COLLECTION_NAME);
        var mongoClient = MongoClients.create(buildClientSettings(settings));
        try {
            var leaseCollection = MongoLockRepository.initializeLeaseCollection(mongoClient, databaseName, collectionName);
            LOGGER.info("Leases are stored in `{}.{}' at {}:{}", databaseName, collectionName, settings.getHost(), settings.getPort());
            return new MongoLockAuthority(mongoClient, leaseCollection, BackoffStrategy.getDefault());
        } catch (MongoSocketException | MongoTimeoutException ex) {
            mongoClient.close();
            throw new LocksmithNetworkException("Could not reach MongoDB at " + settings, ex);
        } catch (MongoException ex) {
            mongoClient.close();
            throw new LocksmithRemoteException("Could not initialize the lease collection at " + settings, ex);
        }
    }

    /**
     * Translates the connection settings into MongoDB client settings.
     * All timeouts equal the round-trip timeout; writes are acknowledged by a majority.
     */
    static MongoClientSettings buildClientSettings(ConnectionSettings settings) {
        var timeoutMillis = (int) Math.min(Integer.MAX_VALUE, settings.getTimeoutMillis());
        var builder = MongoClientSettings.builder()
                .applyToClusterSettings(cluster -> cluster
                        .hosts(List.of(new ServerAddress(settings.getHost(), settings.getPort())))
                        .serverSelectionTimeout(timeoutMillis, TimeUnit.MILLISECONDS))
                .applyToSocketSettings(socket -> socket
                        .connectTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                        .readTimeout(timeoutMillis, TimeUnit.MILLISECONDS))
                .writeConcern(WriteConcern.MAJORITY);
        if (settings.hasCredentials()) {
            var password = settings.getPassword() == null ? new char[0] : settings.getPassword().toCharArray();
            builder.credential(MongoCredential.createCredential(settings.getUser(), CREDENTIAL_SOURCE, password));
        }
        return builder.build();
    }

}
