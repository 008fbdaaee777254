package com.mingle.backend.modules.auth.presentation.dto;

import java.util.UUID;

import com.mingle.backend.modules.auth.domain.MingleUser;

public record UserSummaryResponse(UUID userId, String name) {

    public static UserSummaryResponse of(MingleUser user) {
        return new UserSummaryResponse(user.getId(), user.getName());
    }
}
