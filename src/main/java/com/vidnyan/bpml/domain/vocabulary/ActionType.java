package com.vidnyan.bpml.domain.vocabulary;

import java.util.Optional;

/**
 * Action offered on a dashboard list widget.
 */
public enum ActionType implements VocabularyToken {
    VIEW("view"),
    CLAIM("claim"),
    COMPLETE("complete"),
    CANCEL("cancel"),
    SUSPEND("suspend"),
    RESUME("resume"),
    REASSIGN("reassign"),
    DELETE("delete");

    private final String token;

    ActionType(String token) {
        this.token = token;
    }

    @Override
    public String token() {
        return token;
    }

    public static Optional<ActionType> fromToken(String token) {
        return VocabularyToken.lookup(values(), token);
    }
}
