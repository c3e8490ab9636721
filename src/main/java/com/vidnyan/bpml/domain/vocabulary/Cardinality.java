package com.vidnyan.bpml.domain.vocabulary;

import java.util.Optional;

/**
 * Relationship multiplicity, written with a leading {@code @} in source.
 */
public enum Cardinality implements VocabularyToken {
    ZERO_OR_ONE("@0..1"),
    EXACTLY_ONE("@1..1"),
    ZERO_OR_MANY("@0..*"),
    ONE_OR_MANY("@1..*"),
    MANY_TO_ONE("@*..1"),
    MANY_TO_MANY("@*..*");

    private final String token;

    Cardinality(String token) {
        this.token = token;
    }

    @Override
    public String token() {
        return token;
    }

    public static Optional<Cardinality> fromToken(String token) {
        return VocabularyToken.lookup(values(), token);
    }
}
