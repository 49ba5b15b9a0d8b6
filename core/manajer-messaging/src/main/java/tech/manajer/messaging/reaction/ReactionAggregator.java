package tech.manajer.messaging.reaction;

import org.bson.types.ObjectId;
import tech.manajer.messaging.model.Reaction;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges a single user's reaction into, or out of, a message's reaction list.
 *
 * <p>The emoji string is the bucket key (exact match, no normalization). Both
 * operations are pure: they never mutate the input list or its buckets. When
 * the change is a no-op the input list itself is returned, so callers can skip
 * the write with an identity check.
 *
 * <ul>
 *   <li>add: append the user to the emoji's bucket, or append a new bucket
 *       holding only that user. A user already in the bucket is a no-op.</li>
 *   <li>remove: drop the user from the emoji's bucket and drop the bucket once
 *       it is empty. An absent user or bucket is a no-op.</li>
 * </ul>
 */
public final class ReactionAggregator {

    private ReactionAggregator() {
    }

    public static List<Reaction> add(List<Reaction> reactions, ObjectId userId, String emoji) {
        List<Reaction> current = reactions != null ? reactions : List.of();
        int index = indexOf(current, emoji);

        if (index >= 0 && hasUser(current.get(index), userId)) {
            return reactions;
        }

        List<Reaction> next = copy(current);
        if (index >= 0) {
            next.get(index).userIds.add(userId);
        } else {
            next.add(new Reaction(emoji, List.of(userId)));
        }
        return next;
    }

    public static List<Reaction> remove(List<Reaction> reactions, ObjectId userId, String emoji) {
        List<Reaction> current = reactions != null ? reactions : List.of();
        int index = indexOf(current, emoji);

        if (index < 0 || !hasUser(current.get(index), userId)) {
            return reactions;
        }

        List<Reaction> next = copy(current);
        Reaction bucket = next.get(index);
        bucket.userIds.remove(userId);
        if (bucket.userIds.isEmpty()) {
            next.remove(index);
        }
        return next;
    }

    private static int indexOf(List<Reaction> reactions, String emoji) {
        for (int i = 0; i < reactions.size(); i++) {
            if (reactions.get(i).emoji != null && reactions.get(i).emoji.equals(emoji)) {
                return i;
            }
        }
        return -1;
    }

    private static boolean hasUser(Reaction bucket, ObjectId userId) {
        return bucket.userIds != null && bucket.userIds.contains(userId);
    }

    private static List<Reaction> copy(List<Reaction> reactions) {
        List<Reaction> copy = new ArrayList<>(reactions.size() + 1);
        for (Reaction reaction : reactions) {
            copy.add(new Reaction(reaction.emoji, reaction.userIds != null ? reaction.userIds : List.of()));
        }
        return copy;
    }
}
