package com.soulsense.backend.modules.auth.presentation.dto;

import com.soulsense.backend.modules.auth.domain.RegistrationFields;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank(message = "username is required") @Size(max = 30) String username,
        @NotBlank(message = "email is required") @Email String email,
        @NotBlank(message = "password is required") @Size(max = 128) String password,
        @Size(max = 100) String firstName,
        @Size(max = 100) String lastName,
        Integer age,
        @Size(max = 20) String gender
) {

    public RegistrationFields toFields() {
        return new RegistrationFields(username, email, password, firstName, lastName, age, gender);
    }
}
