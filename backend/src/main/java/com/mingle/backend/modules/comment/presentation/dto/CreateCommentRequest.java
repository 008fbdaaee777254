package com.mingle.backend.modules.comment.presentation.dto;

public record CreateCommentRequest(String text) {
}
