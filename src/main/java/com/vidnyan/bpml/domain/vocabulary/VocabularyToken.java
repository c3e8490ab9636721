package com.vidnyan.bpml.domain.vocabulary;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * A member of a closed value set, identified by the token used in BPML source.
 */
public interface VocabularyToken {

    String token();

    /**
     * Exact, case-sensitive token lookup.
     */
    static <E extends Enum<E> & VocabularyToken> Optional<E> lookup(E[] values, String token) {
        if (token == null) {
            return Optional.empty();
        }
        return Arrays.stream(values)
                .filter(v -> v.token().equals(token))
                .findFirst();
    }

    static <E extends Enum<E> & VocabularyToken> List<String> tokens(E[] values) {
        return Arrays.stream(values)
                .map(VocabularyToken::token)
                .toList();
    }
}
