package com.vidnyan.bpml.domain.model;

/**
 * Guarded branch of a decision gateway: when {@code expression} holds, control goes to {@code target}.
 */
public record GatewayCondition(
    String expression,
    String target
) {
}
