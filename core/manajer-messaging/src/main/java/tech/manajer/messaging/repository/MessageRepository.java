package tech.manajer.messaging.repository;

import org.bson.types.ObjectId;
import tech.manajer.messaging.model.Message;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Message entities.
 * Exposes only approved data access methods - Panache internals are hidden.
 *
 * Implementations must be safe for concurrent use from many connections.
 */
public interface MessageRepository {

    /**
     * Persist a new message, assigning its id and creation time.
     * The message starts unpinned with no reactions.
     */
    Message create(Message message);

    Optional<Message> findByIdOptional(ObjectId id);

    /**
     * Messages of a channel, newest first.
     */
    List<Message> findByChannel(ObjectId channelId, int limit, int skip);

    /**
     * Apply the non-null fields of {@code changes} and stamp the update time.
     *
     * @return the updated message, or empty if it does not exist
     */
    Optional<Message> update(ObjectId id, MessageChanges changes);

    /**
     * @return true if a message was deleted
     */
    boolean deleteById(ObjectId id);

    /**
     * Atomically add the user to the emoji's reaction bucket.
     *
     * @return the message after the change, or empty if it does not exist
     */
    Optional<Message> addReaction(ObjectId messageId, ObjectId userId, String emoji);

    /**
     * Atomically remove the user from the emoji's reaction bucket, pruning the
     * bucket when it becomes empty.
     *
     * @return the message after the change, or empty if it does not exist
     */
    Optional<Message> removeReaction(ObjectId messageId, ObjectId userId, String emoji);
}
