package com.vidnyan.bpml.domain.vocabulary;

import java.util.Optional;

/**
 * How a gateway merges incoming branches.
 */
public enum JoinType implements VocabularyToken {
    ALL("all"),
    ANY("any"),
    FIRST("first");

    private final String token;

    JoinType(String token) {
        this.token = token;
    }

    @Override
    public String token() {
        return token;
    }

    public static Optional<JoinType> fromToken(String token) {
        return VocabularyToken.lookup(values(), token);
    }
}
