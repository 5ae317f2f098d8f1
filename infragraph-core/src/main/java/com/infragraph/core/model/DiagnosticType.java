package com.infragraph.core.model;

/**
 * Kinds of findings reported by the hierarchy validator.
 */
public enum DiagnosticType {
    /** A resource has no parent of an allowed type. */
    HIERARCHY_VIOLATION,
    /** An un-numbered resource sits under more than one container of the same group type. */
    SHARED_PARENT_VIOLATION
}
