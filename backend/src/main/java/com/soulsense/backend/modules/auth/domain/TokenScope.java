package com.soulsense.backend.modules.auth.domain;

public enum TokenScope {
    ACCESS("access"),
    PRE_AUTH("pre_auth");

    private final String claimValue;

    TokenScope(String claimValue) {
        this.claimValue = claimValue;
    }

    public String getClaimValue() {
        return claimValue;
    }

    public static TokenScope fromClaim(String value) {
        for (TokenScope scope : values()) {
            if (scope.claimValue.equals(value)) {
                return scope;
            }
        }
        throw new IllegalArgumentException("Unknown token scope: " + value);
    }
}
