package com.tradegate.access.eligibility;

import com.tradegate.access.domain.DomainModels.*;
import com.tradegate.access.eligibility.EligibilityModels.*;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Decides whether a user currently satisfies a permission's requirements.
 * Stateless and side-effect free: the same snapshot always yields the same result,
 * so it is safe to call speculatively from UI-facing code.
 * <p>
 * Every check runs and every unmet one contributes a reason; the result is the
 * AND of all of them.
 */
public class EligibilityEvaluator {
    static final String REQ_AGE = "age";
    static final String REQ_PATH = "learning_path:";
    static final String REQ_CONTENT = "content:";
    static final String REQ_SCORE = "score:";
    static final String REQ_GUARDIAN = "guardian_approval";

    private final int adultAge;

    public EligibilityEvaluator(int adultAge) {
        this.adultAge = adultAge;
    }

    public EligibilityResult evaluate(EligibilitySnapshot snapshot) {
        User user = snapshot.user();
        TradingPermission permission = snapshot.permission();
        OptionalInt age = user.ageOn(snapshot.today());
        List<FailureReason> reasons = new ArrayList<>();
        List<String> met = new ArrayList<>();

        checkAge(permission, age, reasons, met);
        checkLearningPath(snapshot, reasons, met);
        checkContent(snapshot, reasons, met);
        checkGuardian(snapshot, age, reasons, met);

        return new EligibilityResult(user.id(), permission.id(), permission.typeKey(), reasons.isEmpty(),
                List.copyOf(reasons), List.copyOf(met), permission.requiresGuardianApproval(), false);
    }

    public PathProgress pathProgress(LearningPath path, Map<String, UserProgress> progressByContent) {
        List<LearningPathItem> required = path.requiredItems();
        List<String> missing = required.stream()
                .map(LearningPathItem::contentId)
                .filter(contentId -> !completed(progressByContent.get(contentId)))
                .toList();
        int completed = required.size() - missing.size();
        double percent = required.isEmpty() ? 100.0 : completed * 100.0 / required.size();
        return new PathProgress(path.id(), path.title(), completed, required.size(), percent, missing);
    }

    public boolean isMinor(User user, LocalDate today) {
        return isMinor(user.ageOn(today));
    }

    private boolean isMinor(OptionalInt age) {
        return age.isEmpty() || age.getAsInt() < adultAge;
    }

    private void checkAge(TradingPermission permission, OptionalInt age, List<FailureReason> reasons, List<String> met) {
        if (permission.minAge() == null) return;
        if (age.isEmpty()) {
            reasons.add(new AgeUnknown(permission.minAge()));
        } else if (age.getAsInt() < permission.minAge()) {
            reasons.add(new AgeBelowMinimum(permission.minAge(), age.getAsInt()));
        } else {
            met.add(REQ_AGE);
        }
    }

    private void checkLearningPath(EligibilitySnapshot snapshot, List<FailureReason> reasons, List<String> met) {
        if (snapshot.permission().requiredLearningPathId() == null) return;
        LearningPath path = snapshot.path();
        if (path == null) {
            // path deleted after authoring: nothing can satisfy it
            reasons.add(new LearningPathIncomplete(snapshot.permission().requiredLearningPathId(),
                    snapshot.permission().requiredLearningPathId(), 0, 0, List.of()));
            return;
        }
        PathProgress progress = pathProgress(path, snapshot.progressByContent());
        if (!progress.complete()) {
            reasons.add(new LearningPathIncomplete(path.id(), path.title(),
                    progress.completedRequired(), progress.totalRequired(), progress.missingContentIds()));
        } else {
            met.add(REQ_PATH + path.id());
        }
    }

    private void checkContent(EligibilitySnapshot snapshot, List<FailureReason> reasons, List<String> met) {
        TradingPermission permission = snapshot.permission();
        String contentId = permission.requiredContentId();
        if (contentId == null) return;

        UserProgress progress = snapshot.progressByContent().get(contentId);
        if (!completed(progress)) {
            reasons.add(new ContentNotCompleted(contentId));
            return;
        }
        met.add(REQ_CONTENT + contentId);

        EducationalContent content = snapshot.contentById().get(contentId);
        boolean scored = content != null && content.completionRequirement() == CompletionRequirement.QUIZ;
        if (scored && permission.minScore() != null
                && (progress.score() == null || progress.score() < permission.minScore())) {
            reasons.add(new ScoreBelowMinimum(contentId, permission.minScore(), progress.score()));
        } else if (scored && permission.minScore() != null) {
            met.add(REQ_SCORE + contentId);
        }
    }

    private void checkGuardian(EligibilitySnapshot snapshot, OptionalInt age, List<FailureReason> reasons, List<String> met) {
        if (!snapshot.permission().requiresGuardianApproval()) return;
        if (!isMinor(age)) return;

        List<GuardianApproval> approvals = snapshot.approvals();
        if (approvals.stream().anyMatch(a -> a.status() == ApprovalStatus.APPROVED)) {
            met.add(REQ_GUARDIAN);
            return;
        }
        if (approvals.isEmpty()) {
            reasons.add(new GuardianApprovalMissing());
            return;
        }

        GuardianApproval latest = approvals.get(approvals.size() - 1);
        if (latest.status() == ApprovalStatus.PENDING) {
            reasons.add(new GuardianApprovalPending(latest.id()));
        } else {
            reasons.add(new GuardianApprovalDenied(latest.id()));
        }
    }

    private static boolean completed(UserProgress progress) {
        return progress != null && progress.completed();
    }
}
