package com.mingle.backend.modules.post.presentation.dto;

import java.util.List;

public record CreatePostRequest(
        String title,
        List<String> topics,
        String body,
        Integer expiresInMinutes
) {
}
