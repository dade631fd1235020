package com.tradegate.access.validation;

import com.tradegate.access.domain.DomainModels.CompletionRequirement;
import com.tradegate.access.domain.DomainModels.EducationalContent;
import com.tradegate.access.domain.DomainModels.LearningPath;
import com.tradegate.access.domain.DomainModels.LearningPathItem;
import com.tradegate.access.domain.DomainModels.TradingPermission;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Structural checks on admin-authored catalog entries. Uniqueness against already
 * stored rows is left to the catalog, which owns the lookups.
 */
@Component
public class CatalogValidator {

    public List<ValidationIssue> validateContent(EducationalContent content) {
        List<ValidationIssue> issues = new ArrayList<>();
        required(content.id(), "content.id", content.id(), issues);
        required(content.slug(), "content.slug", content.id(), issues);
        required(content.title(), "content.title", content.id(), issues);
        if (content.type() == null || content.level() == null || content.completionRequirement() == null) {
            issues.add(new ValidationIssue("MISSING_FIELD", "type, level and completionRequirement are required", content.id()));
        }
        if (content.passingScore() != null) {
            if (content.completionRequirement() != CompletionRequirement.QUIZ) {
                issues.add(new ValidationIssue("PASSING_SCORE_NOT_QUIZ", "Passing score only applies to quiz completion", content.id()));
            }
            score(content.passingScore(), content.id(), issues);
        }
        ageRange(content.minAge(), content.maxAge(), content.id(), issues);
        return issues;
    }

    public List<ValidationIssue> validatePath(LearningPath path, Set<String> knownContentIds) {
        List<ValidationIssue> issues = new ArrayList<>();
        required(path.id(), "path.id", path.id(), issues);
        required(path.slug(), "path.slug", path.id(), issues);
        required(path.title(), "path.title", path.id(), issues);
        if (path.items() == null || path.items().isEmpty()) {
            issues.add(new ValidationIssue("EMPTY_PATH", "Learning path has no items", path.id()));
            return issues;
        }

        Map<String, Long> counts = path.items().stream()
                .collect(Collectors.groupingBy(LearningPathItem::contentId, Collectors.counting()));
        counts.forEach((contentId, count) -> {
            if (count > 1) {
                issues.add(new ValidationIssue("DUPLICATE_PATH_ITEM", "Content appears more than once in path: " + contentId, path.id()));
            }
        });
        path.items().forEach(item -> {
            if (!knownContentIds.contains(item.contentId())) {
                issues.add(new ValidationIssue("CONTENT_NOT_FOUND", "Path item references unknown content: " + item.contentId(), path.id()));
            }
        });
        return issues;
    }

    public List<ValidationIssue> validatePermission(TradingPermission permission,
                                                    Set<String> knownContentIds,
                                                    Set<String> knownPathIds) {
        List<ValidationIssue> issues = new ArrayList<>();
        required(permission.id(), "permission.id", permission.id(), issues);
        required(permission.typeKey(), "permission.typeKey", permission.id(), issues);
        required(permission.name(), "permission.name", permission.id(), issues);

        if (permission.minAge() != null && permission.minAge() < 0) {
            issues.add(new ValidationIssue("INVALID_AGE", "Minimum age must not be negative", permission.id()));
        }
        if (permission.minScore() != null) {
            if (permission.requiredContentId() == null) {
                issues.add(new ValidationIssue("SCORE_WITHOUT_CONTENT", "Minimum score requires a required content", permission.id()));
            }
            score(permission.minScore(), permission.id(), issues);
        }
        if (permission.requiredContentId() != null && !knownContentIds.contains(permission.requiredContentId())) {
            issues.add(new ValidationIssue("CONTENT_NOT_FOUND", "Permission references unknown content: " + permission.requiredContentId(), permission.id()));
        }
        if (permission.requiredLearningPathId() != null && !knownPathIds.contains(permission.requiredLearningPathId())) {
            issues.add(new ValidationIssue("PATH_NOT_FOUND", "Permission references unknown learning path: " + permission.requiredLearningPathId(), permission.id()));
        }
        return issues;
    }

    private void required(String value, String field, String ref, List<ValidationIssue> issues) {
        if (value == null || value.isBlank()) {
            issues.add(new ValidationIssue("MISSING_FIELD", field + " required", ref));
        }
    }

    private void score(double value, String ref, List<ValidationIssue> issues) {
        if (value < 0 || value > 100) {
            issues.add(new ValidationIssue("INVALID_SCORE", "Score must be between 0 and 100", ref));
        }
    }

    private void ageRange(Integer min, Integer max, String ref, List<ValidationIssue> issues) {
        if (min != null && max != null && min > max) {
            issues.add(new ValidationIssue("INVALID_AGE", "Minimum age exceeds maximum age", ref));
        }
    }
}
