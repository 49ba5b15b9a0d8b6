package tech.manajer.messaging.model;

import io.quarkus.mongodb.panache.common.MongoEntity;
import org.bson.codecs.pojo.annotations.BsonId;
import org.bson.types.ObjectId;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A chat message posted to a channel.
 *
 * Reactions are embedded. Every write to the reaction list goes through a
 * compare-and-set on {@link #version}, so concurrent reactors never overwrite
 * each other.
 */
@MongoEntity(collection = "messages")
public class Message {

    @BsonId
    public ObjectId id;

    public ObjectId channelId;

    /**
     * The author.
     */
    public ObjectId userId;

    public String content;

    /**
     * Wire value of {@link MessageType}.
     */
    public String messageType;

    /**
     * Storage reference of the attachment, for non-text messages.
     */
    public String mediaPath;

    public MediaMetadata mediaMetadata;

    public Instant createdAt;

    public Instant updatedAt;

    public boolean isPinned;

    public List<Reaction> reactions = new ArrayList<>();

    /**
     * Optimistic-concurrency counter for reaction writes.
     */
    public Long version;

    public Message() {
    }
}
