package com.tokenauth;

import java.util.Optional;

public enum TokenType {
    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    TokenType(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }

    public static Optional<TokenType> fromClaim(Object value) {
        if (value == null) return Optional.empty();
        for (TokenType type : values()) {
            if (type.claimValue.equals(value.toString())) return Optional.of(type);
        }
        return Optional.empty();
    }
}
