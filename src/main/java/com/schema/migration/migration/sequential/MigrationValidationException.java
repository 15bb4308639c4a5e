package com.schema.migration.migration.sequential;

import com.schema.migration.migration.MigrationException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A migration list failed validation. Raised before any I/O.
 */
public class MigrationValidationException extends MigrationException {

    private final List<ValidationIssue> issues;

    public MigrationValidationException(List<ValidationIssue> issues) {
        super("Migration validation failed: " + issues.stream()
                .filter(ValidationIssue::isError)
                .map(ValidationIssue::toString)
                .collect(Collectors.joining("; ")));
        this.issues = List.copyOf(issues);
    }

    /**
     * All issues found, warnings included.
     */
    public List<ValidationIssue> getIssues() {
        return issues;
    }
}
