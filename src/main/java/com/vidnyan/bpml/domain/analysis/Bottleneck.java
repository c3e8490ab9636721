package com.vidnyan.bpml.domain.analysis;

public record Bottleneck(
    String element,
    String type,
    String reason,
    Severity severity
) {
}
