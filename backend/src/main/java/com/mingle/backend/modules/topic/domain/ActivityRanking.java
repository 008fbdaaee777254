package com.mingle.backend.modules.topic.domain;

import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

/**
 * Orders posts by weighted engagement, highest first. Equal scores go to the
 * earliest created post, then the smaller id, so the winner is deterministic.
 */
public class ActivityRanking {

    private final long likeWeight;
    private final long dislikeWeight;
    private final long commentWeight;
    private final Comparator<PostActivity> order;

    public ActivityRanking(long likeWeight, long dislikeWeight, long commentWeight) {
        this.likeWeight = likeWeight;
        this.dislikeWeight = dislikeWeight;
        this.commentWeight = commentWeight;
        this.order = Comparator.comparingLong(this::score).reversed()
                .thenComparing(PostActivity::createdAt)
                .thenComparing(PostActivity::postId);
    }

    public long score(PostActivity activity) {
        return likeWeight * activity.likes()
                + dislikeWeight * activity.dislikes()
                + commentWeight * activity.comments();
    }

    public Optional<PostActivity> mostActive(Collection<PostActivity> candidates) {
        return candidates.stream().min(order);
    }
}
