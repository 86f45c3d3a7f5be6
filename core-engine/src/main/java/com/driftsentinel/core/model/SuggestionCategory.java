package com.driftsentinel.core.model;

/**
 * Kind of corrective action a {@link Suggestion} proposes.
 *
 * @since 1.0.0
 */
public enum SuggestionCategory {
    CODE_CHANGE,
    FILE_CREATION,
    DOCUMENTATION_UPDATE,
    CONFIGURATION_CHANGE,
    REFACTORING,
    DEPENDENCY_UPDATE,
    API_UPDATE
}
