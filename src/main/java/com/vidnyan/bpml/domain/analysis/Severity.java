package com.vidnyan.bpml.domain.analysis;

public enum Severity {
    HIGH,
    MEDIUM,
    LOW
}
