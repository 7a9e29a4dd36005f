package com.shadows.core.validation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Outcome of a winnability check. {@code winnable} holds exactly when no error-severity issue is present.
 *
 * @param confidence 0 to 100; 100 means no concerns were found
 */
public record ValidationResult(
    @JsonProperty("isWinnable") boolean winnable,
    int confidence,
    List<ValidationIssue> issues,
    ScenarioAnalysis analysis
) implements Serializable {

    public ValidationResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public List<ValidationIssue> errors() {
        return issues.stream().filter(ValidationIssue::isError).toList();
    }

    public List<ValidationIssue> warnings() {
        return issues.stream().filter(i -> !i.isError()).toList();
    }

    public boolean hasIssue(IssueCode code) {
        return issues.stream().anyMatch(i -> i.code() == code);
    }
}
