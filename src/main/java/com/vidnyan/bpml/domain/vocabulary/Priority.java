package com.vidnyan.bpml.domain.vocabulary;

import java.util.Optional;

/**
 * Task priority.
 */
public enum Priority implements VocabularyToken {
    LOW("low"),
    NORMAL("normal"),
    HIGH("high"),
    CRITICAL("critical");

    private final String token;

    Priority(String token) {
        this.token = token;
    }

    @Override
    public String token() {
        return token;
    }

    public static Optional<Priority> fromToken(String token) {
        return VocabularyToken.lookup(values(), token);
    }
}
