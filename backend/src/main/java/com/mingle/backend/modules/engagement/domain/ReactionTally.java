package com.mingle.backend.modules.engagement.domain;

/**
 * Like and dislike totals for one post.
 */
public record ReactionTally(long likes, long dislikes) {

    public static final ReactionTally EMPTY = new ReactionTally(0, 0);

    public ReactionTally plus(ReactionType type, long count) {
        return switch (type) {
            case LIKE -> new ReactionTally(likes + count, dislikes);
            case DISLIKE -> new ReactionTally(likes, dislikes + count);
        };
    }

    public long total() {
        return likes + dislikes;
    }
}
