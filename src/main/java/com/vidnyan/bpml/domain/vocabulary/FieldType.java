package com.vidnyan.bpml.domain.vocabulary;

import java.util.Optional;

/**
 * Input widget type of a form field.
 */
public enum FieldType implements VocabularyToken {
    TEXT("text"),
    TEXTAREA("textarea"),
    NUMBER("number"),
    EMAIL("email"),
    PASSWORD("password"),
    DATE("date"),
    DATETIME("datetime"),
    CHECKBOX("checkbox"),
    SELECT("select"),
    RADIO("radio"),
    FILE("file"),
    ENTITY("entity");

    private final String token;

    FieldType(String token) {
        this.token = token;
    }

    @Override
    public String token() {
        return token;
    }

    public static Optional<FieldType> fromToken(String token) {
        return VocabularyToken.lookup(values(), token);
    }
}
