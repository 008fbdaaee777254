package com.mingle.backend.modules.engagement.presentation.dto;

public record EngagementCountersResponse(
        String message,
        long likesCount,
        long dislikesCount,
        long commentsCount
) {
}
