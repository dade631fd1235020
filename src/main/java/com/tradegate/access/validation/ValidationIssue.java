package com.tradegate.access.validation;

public record ValidationIssue(String code, String message, String ref) {}
