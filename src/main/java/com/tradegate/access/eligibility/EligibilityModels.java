package com.tradegate.access.eligibility;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.tradegate.access.domain.DomainModels.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public class EligibilityModels {

    /** One unmet requirement. Callers render the full list as a checklist. */
    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
    @JsonSubTypes({
            @JsonSubTypes.Type(value = AgeUnknown.class, name = "AgeUnknown"),
            @JsonSubTypes.Type(value = AgeBelowMinimum.class, name = "AgeBelowMinimum"),
            @JsonSubTypes.Type(value = LearningPathIncomplete.class, name = "LearningPathIncomplete"),
            @JsonSubTypes.Type(value = ContentNotCompleted.class, name = "ContentNotCompleted"),
            @JsonSubTypes.Type(value = ScoreBelowMinimum.class, name = "ScoreBelowMinimum"),
            @JsonSubTypes.Type(value = GuardianApprovalMissing.class, name = "GuardianApprovalMissing"),
            @JsonSubTypes.Type(value = GuardianApprovalPending.class, name = "GuardianApprovalPending"),
            @JsonSubTypes.Type(value = GuardianApprovalDenied.class, name = "GuardianApprovalDenied")
    })
    public sealed interface FailureReason permits AgeUnknown, AgeBelowMinimum, LearningPathIncomplete,
            ContentNotCompleted, ScoreBelowMinimum, GuardianApprovalMissing, GuardianApprovalPending, GuardianApprovalDenied {
        @JsonProperty("message")
        String message();
    }

    public record AgeUnknown(int minAge) implements FailureReason {
        public String message() {
            return "Verify your birthdate (minimum age " + minAge + ")";
        }
    }

    public record AgeBelowMinimum(int minAge, int age) implements FailureReason {
        public String message() {
            return "Minimum age is " + minAge + ", current age is " + age;
        }
    }

    public record LearningPathIncomplete(String pathId, String pathTitle, int completedRequired, int totalRequired,
                                         List<String> missingContentIds) implements FailureReason {
        public String message() {
            return "Complete " + pathTitle + " (" + completedRequired + "/" + totalRequired + " required items)";
        }
    }

    public record ContentNotCompleted(String contentId) implements FailureReason {
        public String message() {
            return "Complete content " + contentId;
        }
    }

    public record ScoreBelowMinimum(String contentId, double minScore, Double score) implements FailureReason {
        public String message() {
            return "Score " + minScore + " or higher on " + contentId + (score == null ? "" : " (best so far " + score + ")");
        }
    }

    public record GuardianApprovalMissing() implements FailureReason {
        public String message() {
            return "Ask your guardian to approve this permission";
        }
    }

    public record GuardianApprovalPending(String approvalId) implements FailureReason {
        public String message() {
            return "Waiting for guardian approval";
        }
    }

    public record GuardianApprovalDenied(String approvalId) implements FailureReason {
        public String message() {
            return "Guardian declined this permission";
        }
    }

    /**
     * {@code completedRequirements} lists the met checks as keys such as {@code age},
     * {@code learning_path:<id>}, {@code content:<id>}, {@code score:<id>} and
     * {@code guardian_approval}; {@code reasons} lists the unmet ones.
     */
    public record EligibilityResult(String userId,
                                    String permissionId,
                                    String typeKey,
                                    boolean eligible,
                                    List<FailureReason> reasons,
                                    List<String> completedRequirements,
                                    boolean requiresGuardianApproval,
                                    boolean alreadyGranted) {
        public EligibilityResult withAlreadyGranted(boolean granted) {
            return new EligibilityResult(userId, permissionId, typeKey, eligible, reasons, completedRequirements,
                    requiresGuardianApproval, granted);
        }
    }

    /**
     * Everything the evaluator reads. {@code path} is null when the permission has no
     * path requirement; {@code progressByContent} holds the user's rows for every content
     * the permission touches; {@code approvals} are the user's approvals for this
     * permission, oldest first.
     */
    public record EligibilitySnapshot(User user,
                                      TradingPermission permission,
                                      LocalDate today,
                                      LearningPath path,
                                      Map<String, EducationalContent> contentById,
                                      Map<String, UserProgress> progressByContent,
                                      List<GuardianApproval> approvals) {}

    public record PathProgress(String pathId,
                               String title,
                               int completedRequired,
                               int totalRequired,
                               double completionPercent,
                               List<String> missingContentIds) {
        public boolean complete() {
            return completedRequired == totalRequired;
        }
    }
}
