package com.soulsense.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record TwoFactorVerifyRequest(
        @NotBlank(message = "preAuthToken is required") String preAuthToken,
        @NotBlank(message = "code is required") String code
) {
}
