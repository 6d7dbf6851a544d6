package com.soulsense.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record TwoFactorCodeRequest(@NotBlank(message = "code is required") String code) {
}
