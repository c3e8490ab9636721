package com.vidnyan.bpml.domain.model;

/**
 * Member of an entity: either a plain {@link Attribute} or a {@link Relationship} to another entity.
 */
public interface EntityProperty {

    String name();

    boolean isOptional();
}
