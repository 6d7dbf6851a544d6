package com.soulsense.backend.modules.auth.domain;

public record RegistrationFields(
        String username,
        String email,
        String password,
        String firstName,
        String lastName,
        Integer age,
        String gender
) {

    public static RegistrationFields of(String username, String email, String password) {
        return new RegistrationFields(username, email, password, null, null, null, null);
    }
}
