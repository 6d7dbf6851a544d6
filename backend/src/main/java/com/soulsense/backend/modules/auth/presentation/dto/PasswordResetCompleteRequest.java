package com.soulsense.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public record PasswordResetCompleteRequest(
        @NotBlank(message = "email is required") @Email String email,
        @NotBlank(message = "code is required") String code,
        @NotBlank(message = "newPassword is required") String newPassword
) {
}
