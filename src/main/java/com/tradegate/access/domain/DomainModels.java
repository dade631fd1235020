package com.tradegate.access.domain;

import java.time.Instant;
import java.time.LocalDate;
import java.time.Period;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

public class DomainModels {
    public enum Role { USER, MINOR, GUARDIAN, ADMIN }

    public enum SubscriptionTier {
        FREE, BASIC, PREMIUM, FAMILY;

        public boolean atLeast(SubscriptionTier required) {
            return required == null || ordinal() >= required.ordinal();
        }
    }

    public enum ContentType { MODULE, QUIZ, ARTICLE, INTERACTIVE, VIDEO }

    public enum ContentLevel { BEGINNER, INTERMEDIATE, ADVANCED }

    public enum CompletionRequirement { NONE, QUIZ, TIME, INTERACTION }

    public enum ApprovalStatus { PENDING, APPROVED, DENIED }

    public record User(String id,
                       String displayName,
                       LocalDate birthdate,
                       Set<Role> roles,
                       SubscriptionTier tier,
                       String guardianId) {
        public OptionalInt ageOn(LocalDate today) {
            if (birthdate == null) return OptionalInt.empty();
            return OptionalInt.of(Period.between(birthdate, today).getYears());
        }

        public boolean hasRole(Role role) {
            return roles != null && roles.contains(role);
        }
    }

    public record EducationalContent(String id,
                                     String slug,
                                     String title,
                                     ContentType type,
                                     ContentLevel level,
                                     CompletionRequirement completionRequirement,
                                     Double passingScore,
                                     Integer estimatedMinutes,
                                     Integer minAge,
                                     Integer maxAge) {}

    /** {@code contentId} may only be started once {@code prerequisiteId} is completed. */
    public record PrerequisiteEdge(String prerequisiteId, String contentId) {}

    public record LearningPath(String id, String slug, String title, Integer minAge, List<LearningPathItem> items) {
        public List<LearningPathItem> requiredItems() {
            return items.stream().filter(LearningPathItem::required).toList();
        }
    }

    public record LearningPathItem(String pathId, String contentId, int order, boolean required) {}

    public record TradingPermission(String id,
                                    String typeKey,
                                    String name,
                                    String description,
                                    Integer minAge,
                                    boolean requiresGuardianApproval,
                                    String requiredLearningPathId,
                                    String requiredContentId,
                                    Double minScore) {}

    public record UserProgress(String userId,
                               String contentId,
                               Instant startedAt,
                               Instant completedAt,
                               Double score,
                               Boolean passed,
                               int attempts,
                               long timeSpentSeconds,
                               Instant lastAccessed) {
        public boolean completed() {
            return completedAt != null;
        }
    }

    public record UserPermission(String userId,
                                 String permissionId,
                                 Instant grantedAt,
                                 String grantedBy,
                                 String overrideReason,
                                 Instant evaluatedAt) {
        public static final String SYSTEM = "system";

        public boolean overridden() {
            return overrideReason != null;
        }
    }

    public record GuardianApproval(String id,
                                   String minorId,
                                   String guardianId,
                                   String permissionId,
                                   ApprovalStatus status,
                                   Instant requestedAt,
                                   Instant decidedAt) {}
}
