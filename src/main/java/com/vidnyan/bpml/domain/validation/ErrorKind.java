package com.vidnyan.bpml.domain.validation;

/**
 * Kinds of semantic errors a model can fail validation with.
 */
public enum ErrorKind {
    PROJECT_INFO,               // missing or malformed project name
    DUPLICATE_NAME,             // name repeated within a uniqueness scope
    UNRESOLVED_REFERENCE,       // reference to an undeclared entity/role/state/task/element
    TASK_ASSIGNMENT,            // task is neither auto nor role-assigned, or both
    SELF_REFERENCE,             // task depends on itself, role supervises itself, transition loops on one state
    CIRCULAR_DEPENDENCY,        // cycle in role hierarchy or task dependencies
    INVALID_ENUM_VALUE,         // token outside its closed value set
    INVALID_TOPOLOGY,           // element violates required incoming/outgoing flow cardinality
    EMPTY_DEFINITION,           // required sub-structure absent
    INVALID_ATTRIBUTE_VALUE     // numeric attribute out of range
}
