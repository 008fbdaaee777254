package com.mingle.backend.modules.topic.application;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Weights applied to each engagement kind when ranking the most active post.
 */
@ConfigurationProperties(prefix = "mingle.ranking")
public record RankingProperties(
        @DefaultValue("1") long likeWeight,
        @DefaultValue("1") long dislikeWeight,
        @DefaultValue("1") long commentWeight
) {

    public RankingProperties {
        if (likeWeight < 0 || dislikeWeight < 0 || commentWeight < 0) {
            throw new IllegalArgumentException("mingle.ranking weights must not be negative");
        }
    }
}
