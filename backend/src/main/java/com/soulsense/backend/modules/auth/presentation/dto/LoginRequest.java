package com.soulsense.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * The identifier is a username or an email address; both are matched case-insensitively.
 */
public record LoginRequest(
        @NotBlank(message = "identifier is required") @Size(max = 320) String identifier,
        @NotBlank(message = "password is required") String password
) {
}
