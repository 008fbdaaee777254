package com.mingle.backend.modules.engagement.domain;

public enum ReactionType {
    LIKE,
    DISLIKE
}
