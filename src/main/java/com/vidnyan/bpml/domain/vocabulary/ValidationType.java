package com.vidnyan.bpml.domain.vocabulary;

import java.util.Optional;

public enum ValidationType implements VocabularyToken {
    REQUIRED("required"),
    MIN("min"),
    MAX("max"),
    MIN_LENGTH("minLength"),
    MAX_LENGTH("maxLength"),
    PATTERN("pattern"),
    EMAIL("email");

    private final String token;

    ValidationType(String token) {
        this.token = token;
    }

    @Override
    public String token() {
        return token;
    }

    public static Optional<ValidationType> fromToken(String token) {
        return VocabularyToken.lookup(values(), token);
    }
}
