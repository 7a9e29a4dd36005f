package com.shadows.core.validation;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;

/**
 * @param suggestion  how a scenario author could fix the problem (nullable)
 * @param objectiveId objective the issue is about (nullable)
 */
public record ValidationIssue(
    IssueSeverity severity,
    IssueCode code,
    String message,
    String suggestion,
    String objectiveId
) implements Serializable {

    public static ValidationIssue of(IssueCode code, String message, String suggestion) {
        return new ValidationIssue(code.severity(), code, message, suggestion, null);
    }

    public static ValidationIssue forObjective(IssueCode code, String message, String suggestion, String objectiveId) {
        return new ValidationIssue(code.severity(), code, message, suggestion, objectiveId);
    }

    @JsonIgnore
    public boolean isError() {
        return severity == IssueSeverity.ERROR;
    }
}
