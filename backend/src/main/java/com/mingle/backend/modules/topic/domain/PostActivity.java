package com.mingle.backend.modules.topic.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

public record PostActivity(
        UUID postId,
        OffsetDateTime createdAt,
        long likes,
        long dislikes,
        long comments
) {
}
