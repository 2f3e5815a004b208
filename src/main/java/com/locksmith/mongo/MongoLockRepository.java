package com.locksmith.mongo;

import com.mongodb.WriteConcern;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.ReturnDocument;
import com.mongodb.client.model.UpdateOptions;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.MinKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static com.mongodb.client.model.Filters.*;
import static com.mongodb.client.model.Updates.set;

/**
 * Utility class for the MongoDB collection that stores leases.
 * <p>
 * The lease documents are structured as follows:
 * <ul>
 *   <li>{@code _id}: the lock name.</li>
 *   <li>{@code leaseId}: the id of the current lease, unique across grants.</li>
 *   <li>{@code validityMs}: the validity of the last grant or extension in milliseconds.</li>
 *   <li>{@code expiresAt}: the server time at which the lease expires.</li>
 * </ul>
 * </p>
 * <p>
 * Expiry is always evaluated against the server time ({@code $$NOW}).
 * </p>
 */
final class MongoLockRepository {

    @SuppressWarnings("all")
    static final Logger LOGGER = LoggerFactory.getLogger(MongoLockAuthority.class.getName());

    static final String LEASE_ID = "leaseId";
    static final String VALIDITY_MS = "validityMs";
    static final String EXPIRES_AT = "expiresAt";

    private MongoLockRepository() {
    }

    /**
     * Gets the lease collection and makes sure its indexes exist.
     *
     * @param syncMongoClient     the MongoDB client.
     * @param leaseDatabaseName   the database holding the lease collection.
     * @param leaseCollectionName the lease collection.
     * @return the lease collection.
     */
    static MongoCollection<Document> initializeLeaseCollection(MongoClient syncMongoClient
            , String leaseDatabaseName
            , String leaseCollectionName) {
        var leaseCollection = syncMongoClient.getDatabase(leaseDatabaseName).getCollection(leaseCollectionName);
        leaseCollection.createIndex(new Document(LEASE_ID, 1), new IndexOptions().unique(true));
        leaseCollection.createIndex(new Document(EXPIRES_AT, 1), new IndexOptions().unique(false));
        return leaseCollection;
    }

    /**
     * Inserts a lease for a lock name that has no document.
     * <p>
     * The filter can never match, so the upsert either inserts or fails with a duplicate key
     * error when a document for {@code lockName} already exists.
     * </p>
     *
     * @throws com.mongodb.MongoWriteException with {@code DUPLICATE_KEY} category if the name is taken.
     */
    static void insertLease(MongoCollection<Document> leaseCollection, String lockName, String leaseId, long validityMillis) {
        var query = and(eq("_id", lockName), lt("_id", new MinKey()));
        leaseCollection
                .withWriteConcern(WriteConcern.MAJORITY)
                .updateOne(query, grantUpdate(leaseId, validityMillis), new UpdateOptions().upsert(true));
    }

    /**
     * Hands the lock over to a new lease if the current one expired.
     *
     * @return the document as it was before the takeover, or {@code null} if the current lease is still valid.
     */
    static Document takeOverExpiredLease(MongoCollection<Document> leaseCollection, String lockName, String leaseId, long validityMillis) {
        var query = and(eq("_id", lockName), isExpired());
        var options = new FindOneAndUpdateOptions().returnDocument(ReturnDocument.BEFORE);
        return leaseCollection
                .withWriteConcern(WriteConcern.MAJORITY)
                .findOneAndUpdate(query, grantUpdate(leaseId, validityMillis), options);
    }

    /**
     * Moves the expiration of an unexpired lease to {@code validityMillis} from now.
     */
    static UpdateResult extendLease(MongoCollection<Document> leaseCollection, String leaseId, long validityMillis) {
        var query = and(eq(LEASE_ID, leaseId), isActive());
        var update = List.of(
                set(EXPIRES_AT, new Document("$add", List.of("$$NOW", validityMillis))),
                set(VALIDITY_MS, validityMillis)
        );
        return leaseCollection
                .withWriteConcern(WriteConcern.MAJORITY)
                .updateOne(query, update);
    }

    /**
     * Deletes an unexpired lease.
     */
    static DeleteResult deleteLease(MongoCollection<Document> leaseCollection, String leaseId) {
        return leaseCollection
                .withWriteConcern(WriteConcern.MAJORITY)
                .deleteOne(and(eq(LEASE_ID, leaseId), isActive()));
    }

    static long countLeases(MongoCollection<Document> leaseCollection) {
        return leaseCollection.countDocuments();
    }

    static long countActiveLeases(MongoCollection<Document> leaseCollection) {
        return leaseCollection.countDocuments(isActive());
    }

    /**
     * Deletes all expired lease documents.
     */
    static DeleteResult bulkDeleteExpiredLeases(MongoCollection<Document> leaseCollection) {
        return leaseCollection
                .withWriteConcern(WriteConcern.MAJORITY)
                .deleteMany(isExpired());
    }

    private static List<Bson> grantUpdate(String leaseId, long validityMillis) {
        return List.of(
                set(LEASE_ID, leaseId),
                set(VALIDITY_MS, validityMillis),
                set(EXPIRES_AT, new Document("$add", List.of("$$NOW", validityMillis)))
        );
    }

    private static Bson isExpired() {
        return expr(new Document("$lt", List.of("$" + EXPIRES_AT, "$$NOW")));
    }

    private static Bson isActive() {
        return expr(new Document("$gte", List.of("$" + EXPIRES_AT, "$$NOW")));
    }

}
