package com.vidnyan.bpml.domain.vocabulary;

import java.util.Optional;

public enum ScriptLanguage implements VocabularyToken {
    JAVASCRIPT("javascript"),
    GROOVY("groovy"),
    PYTHON("python");

    private final String token;

    ScriptLanguage(String token) {
        this.token = token;
    }

    @Override
    public String token() {
        return token;
    }

    public static Optional<ScriptLanguage> fromToken(String token) {
        return VocabularyToken.lookup(values(), token);
    }
}
