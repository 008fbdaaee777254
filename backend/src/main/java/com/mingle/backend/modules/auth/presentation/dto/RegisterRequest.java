package com.mingle.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record RegisterRequest(
        @NotBlank(message = "name is required") String name,
        @NotBlank(message = "email is required") String email,
        @NotBlank(message = "password is required") String password
) {
}
