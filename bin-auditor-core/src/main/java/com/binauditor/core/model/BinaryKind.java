package com.binauditor.core.model;

/**
 * Role of a binary as declared by its header.
 */
public enum BinaryKind {
    EXECUTABLE,
    SHARED_LIBRARY,
    OBJECT,
    OTHER
}
