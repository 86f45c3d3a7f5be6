package com.driftsentinel.core.model;

/**
 * File-system change reported by a change source.
 */
public enum ChangeKind {
    CREATED,
    MODIFIED,
    DELETED
}
