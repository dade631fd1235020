package com.tradegate.access.validation;

import java.util.List;
import java.util.stream.Collectors;

public class AccessValidationException extends RuntimeException {
    private final List<ValidationIssue> issues;

    public AccessValidationException(List<ValidationIssue> issues) {
        super(issues.stream().map(ValidationIssue::message).collect(Collectors.joining("; ")));
        this.issues = List.copyOf(issues);
    }

    public AccessValidationException(String code, String message, String ref) {
        this(List.of(new ValidationIssue(code, message, ref)));
    }

    public List<ValidationIssue> issues() {
        return issues;
    }
}
