package com.vidnyan.bpml.domain.vocabulary;

import java.util.Optional;

/**
 * Built-in attribute types. Any other attribute type must name a declared entity.
 */
public enum AttributeType implements VocabularyToken {
    INT("int"),
    STRING("string"),
    FLOAT("float"),
    BOOLEAN("boolean"),
    DATE("date"),
    DATE_TIME("dateTime"),
    EMAIL("email"),
    PHONE("phone"),
    URL("url"),
    TEXT("text");

    private final String token;

    AttributeType(String token) {
        this.token = token;
    }

    @Override
    public String token() {
        return token;
    }

    public static Optional<AttributeType> fromToken(String token) {
        return VocabularyToken.lookup(values(), token);
    }
}
