package com.soulsense.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record TwoFactorDisableRequest(@NotBlank(message = "currentPassword is required") String currentPassword) {
}
