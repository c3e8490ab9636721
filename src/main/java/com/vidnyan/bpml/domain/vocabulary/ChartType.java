package com.vidnyan.bpml.domain.vocabulary;

import java.util.Optional;

public enum ChartType implements VocabularyToken {
    BAR("bar"),
    LINE("line"),
    PIE("pie"),
    DOUGHNUT("doughnut"),
    AREA("area"),
    TABLE("table");

    private final String token;

    ChartType(String token) {
        this.token = token;
    }

    @Override
    public String token() {
        return token;
    }

    public static Optional<ChartType> fromToken(String token) {
        return VocabularyToken.lookup(values(), token);
    }
}
