package com.mingle.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UserProfileResponse(
        @JsonProperty("_id") UUID id,
        String name,
        String email,
        OffsetDateTime createdAt
) {
}
