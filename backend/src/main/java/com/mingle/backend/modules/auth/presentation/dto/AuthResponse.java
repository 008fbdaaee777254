package com.mingle.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

public record AuthResponse(
        UserProfileResponse user,
        String token,
        String tokenType,
        long expiresIn,
        OffsetDateTime issuedAt
) {
}
