package com.vidnyan.bpml.domain.vocabulary;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VocabularyTokenTest {

    @Test
    void fromToken_ShouldMatchExactToken() {
        assertEquals(Priority.HIGH, Priority.fromToken("high").orElseThrow());
        assertEquals(Cardinality.ONE_OR_MANY, Cardinality.fromToken("@1..*").orElseThrow());
        assertEquals(AttributeType.DATE_TIME, AttributeType.fromToken("dateTime").orElseThrow());
        assertEquals(ValidationType.MIN_LENGTH, ValidationType.fromToken("minLength").orElseThrow());
    }

    @Test
    void fromToken_ShouldRejectCaseVariantsAndNull() {
        assertTrue(Priority.fromToken("HIGH").isEmpty());
        assertTrue(ChartType.fromToken(null).isEmpty());
        assertTrue(ScriptLanguage.fromToken("ruby").isEmpty());
    }

    @Test
    void tokens_ShouldFollowDeclarationOrder() {
        assertEquals(List.of("all", "any", "first"), VocabularyToken.tokens(JoinType.values()));
    }
}
