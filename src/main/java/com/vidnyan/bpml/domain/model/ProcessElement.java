package com.vidnyan.bpml.domain.model;

/**
 * A typed node within a process. Names are unique within the owning process.
 */
public interface ProcessElement {

    String name();

    ElementKind kind();

    String description();
}
