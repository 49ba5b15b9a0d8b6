package tech.manajer.messaging.repository;

import com.mongodb.client.model.Filters;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.ReturnDocument;
import com.mongodb.client.model.Sorts;
import com.mongodb.client.model.Updates;
import io.quarkus.mongodb.panache.PanacheMongoRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;
import jakarta.inject.Inject;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.jboss.logging.Logger;
import tech.manajer.messaging.config.MessagingConfig;
import tech.manajer.messaging.model.Message;
import tech.manajer.messaging.model.Reaction;
import tech.manajer.messaging.reaction.ReactionAggregator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * MongoDB implementation of MessageRepository.
 * Package-private to prevent direct injection - use MessageRepository interface.
 *
 * Reaction writes are optimistic: the new reaction list is written with a
 * filter on the version that was read, and the read-modify-write is retried
 * when another writer got there first.
 */
@ApplicationScoped
@Typed(MessageRepository.class)
class MongoMessageRepository implements PanacheMongoRepositoryBase<Message, ObjectId>, MessageRepository {

    private static final Logger LOG = Logger.getLogger(MongoMessageRepository.class);

    @Inject
    MessagingConfig config;

    @Override
    public Message create(Message message) {
        message.createdAt = Instant.now();
        message.updatedAt = null;
        message.isPinned = false;
        message.reactions = new ArrayList<>();
        message.version = 0L;
        PanacheMongoRepositoryBase.super.persist(message);
        return message;
    }

    @Override
    public Optional<Message> findByIdOptional(ObjectId id) {
        return PanacheMongoRepositoryBase.super.findByIdOptional(id);
    }

    @Override
    public List<Message> findByChannel(ObjectId channelId, int limit, int skip) {
        return mongoCollection()
            .find(Filters.eq("channelId", channelId))
            .sort(Sorts.orderBy(Sorts.descending("createdAt"), Sorts.descending("_id")))
            .skip(skip)
            .limit(limit)
            .into(new ArrayList<>());
    }

    @Override
    public Optional<Message> update(ObjectId id, MessageChanges changes) {
        List<Bson> updates = new ArrayList<>();
        if (changes.content() != null) {
            updates.add(Updates.set("content", changes.content()));
        }
        if (changes.messageType() != null) {
            updates.add(Updates.set("messageType", changes.messageType()));
        }
        if (changes.mediaPath() != null) {
            updates.add(Updates.set("mediaPath", changes.mediaPath()));
        }
        if (changes.mediaMetadata() != null) {
            updates.add(Updates.set("mediaMetadata", changes.mediaMetadata()));
        }
        if (changes.isPinned() != null) {
            updates.add(Updates.set("isPinned", changes.isPinned()));
        }
        updates.add(Updates.set("updatedAt", Instant.now()));

        Message updated = mongoCollection().findOneAndUpdate(
            Filters.eq("_id", id),
            Updates.combine(updates),
            new FindOneAndUpdateOptions().returnDocument(ReturnDocument.AFTER));
        return Optional.ofNullable(updated);
    }

    @Override
    public boolean deleteById(ObjectId id) {
        return PanacheMongoRepositoryBase.super.deleteById(id);
    }

    @Override
    public Optional<Message> addReaction(ObjectId messageId, ObjectId userId, String emoji) {
        return mutateReactions(messageId, reactions -> ReactionAggregator.add(reactions, userId, emoji));
    }

    @Override
    public Optional<Message> removeReaction(ObjectId messageId, ObjectId userId, String emoji) {
        return mutateReactions(messageId, reactions -> ReactionAggregator.remove(reactions, userId, emoji));
    }

    private Optional<Message> mutateReactions(ObjectId messageId, UnaryOperator<List<Reaction>> change) {
        int maxAttempts = Math.max(1, config.reactionMaxAttempts());

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Optional<Message> current = findByIdOptional(messageId);
            if (current.isEmpty()) {
                return Optional.empty();
            }

            Message message = current.get();
            List<Reaction> next = change.apply(message.reactions);
            if (next == message.reactions) {
                return current;
            }

            Message updated = mongoCollection().findOneAndUpdate(
                versionFilter(message),
                Updates.combine(Updates.set("reactions", next), Updates.inc("version", 1L)),
                new FindOneAndUpdateOptions().returnDocument(ReturnDocument.AFTER));
            if (updated != null) {
                return Optional.of(updated);
            }

            LOG.debugf("Reaction write on message [%s] lost a race (attempt %d of %d)",
                messageId, attempt, maxAttempts);
        }

        throw new IllegalStateException("Reaction update on message " + messageId
            + " did not settle after " + maxAttempts + " attempts");
    }

    // Messages written before versioning have no version field
    private static Bson versionFilter(Message message) {
        if (message.version == null) {
            return Filters.and(Filters.eq("_id", message.id), Filters.exists("version", false));
        }
        return Filters.and(Filters.eq("_id", message.id), Filters.eq("version", message.version));
    }
}
