package tech.manajer.messaging.model;

import org.bson.types.ObjectId;

import java.util.ArrayList;
import java.util.List;

/**
 * One emoji bucket on a message: the emoji and the users who reacted with it.
 *
 * Stored as an embedded document within the Message. A user id appears at
 * most once per bucket, and an empty bucket is never persisted.
 */
public class Reaction {

    /**
     * The emoji, compared by exact string equality.
     */
    public String emoji;

    /**
     * Users who reacted, in the order they reacted.
     */
    public List<ObjectId> userIds = new ArrayList<>();

    public Reaction() {
    }

    public Reaction(String emoji, List<ObjectId> userIds) {
        this.emoji = emoji;
        this.userIds = new ArrayList<>(userIds);
    }

    public String emoji() {
        return emoji;
    }

    public List<ObjectId> userIds() {
        return userIds;
    }
}
