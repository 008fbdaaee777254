package com.mingle.backend.modules.comment.presentation.dto;

public record CommentCreatedResponse(String message, long commentsCount, CommentResponse comment) {
}
