package com.mingle.backend.modules.post.presentation.dto;

import java.util.UUID;

import com.mingle.backend.modules.auth.domain.MingleUser;

public record OwnerResponse(UUID userId, String name) {

    public static OwnerResponse of(MingleUser owner) {
        return new OwnerResponse(owner.getId(), owner.getName());
    }
}
