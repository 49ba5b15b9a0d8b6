package tech.manajer.platform.activitylog;

import io.quarkus.mongodb.panache.common.MongoEntity;
import org.bson.codecs.pojo.annotations.BsonId;
import org.bson.types.ObjectId;

import java.time.Instant;

/**
 * Record of an administrative action performed by a user.
 *
 * Entries are append-only; they are written by the services that perform the
 * action and read back through the admin API.
 */
@MongoEntity(collection = "activity_logs")
public class ActivityLog {

    @BsonId
    public ObjectId id;

    /**
     * The acting user, or null when the action was not attributable.
     */
    public ObjectId userId;

    /**
     * Dotted action name (e.g., "message.deleted").
     */
    public String action;

    /**
     * Transport verb the action arrived through (HTTP method, or "WS").
     */
    public String method;

    public String endpoint;

    public int statusCode;

    public String ipAddress;

    public Instant createdAt = Instant.now();

    public ActivityLog() {
    }
}
