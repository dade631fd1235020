package com.tradegate.access.eligibility;

import com.tradegate.access.Fixtures;
import com.tradegate.access.domain.DomainModels.ApprovalStatus;
import com.tradegate.access.domain.DomainModels.EducationalContent;
import com.tradegate.access.domain.DomainModels.GuardianApproval;
import com.tradegate.access.domain.DomainModels.LearningPath;
import com.tradegate.access.domain.DomainModels.TradingPermission;
import com.tradegate.access.domain.DomainModels.User;
import com.tradegate.access.domain.DomainModels.UserProgress;
import com.tradegate.access.eligibility.EligibilityModels.*;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class EligibilityEvaluatorTest {
    private static final LocalDate TODAY = LocalDate.of(2026, 3, 1);

    private final EligibilityEvaluator evaluator = new EligibilityEvaluator(18);

    @Test
    void permissionWithoutRequirementsIsEligibleForAnyone() {
        TradingPermission open = Fixtures.permission("open", null, false, null, null, null);
        EligibilityResult result = evaluator.evaluate(snapshot(Fixtures.unknownAge("u"), open, null, Map.of(), Map.of(), List.of()));

        assertTrue(result.eligible());
        assertTrue(result.reasons().isEmpty());
    }

    @Test
    void unknownBirthdateIsIneligibleNotAnError() {
        TradingPermission gated = Fixtures.permission("gated", 13, false, null, null, null);
        EligibilityResult result = evaluator.evaluate(snapshot(Fixtures.unknownAge("u"), gated, null, Map.of(), Map.of(), List.of()));

        assertFalse(result.eligible());
        assertThat(result.reasons()).containsExactly(new AgeUnknown(13));
    }

    @Test
    void reasonsAggregateAcrossChecks() {
        EducationalContent quiz = Fixtures.quiz("q1", null);
        TradingPermission permission = Fixtures.permission("p", 21, false, null, "q1", 80.0);
        User user = userAged(19);

        EligibilityResult result = evaluator.evaluate(snapshot(user, permission, null,
                Map.of("q1", quiz), Map.of(), List.of()));

        assertThat(result.reasons()).containsExactly(new AgeBelowMinimum(21, 19), new ContentNotCompleted("q1"));
    }

    @Test
    void quizScoreMustReachMinimum() {
        EducationalContent quiz = Fixtures.quiz("q1", null);
        TradingPermission permission = Fixtures.permission("p", null, false, null, "q1", 80.0);

        EligibilityResult low = evaluator.evaluate(snapshot(userAged(30), permission, null,
                Map.of("q1", quiz), Map.of("q1", completed("q1", 79.5)), List.of()));
        EligibilityResult enough = evaluator.evaluate(snapshot(userAged(30), permission, null,
                Map.of("q1", quiz), Map.of("q1", completed("q1", 80.0)), List.of()));

        assertThat(low.reasons()).containsExactly(new ScoreBelowMinimum("q1", 80.0, 79.5));
        assertTrue(enough.eligible());
    }

    @Test
    void nonQuizContentOnlyNeedsCompletion() {
        EducationalContent module = Fixtures.module("m1");
        TradingPermission permission = Fixtures.permission("p", null, false, null, "m1", 80.0);

        EligibilityResult result = evaluator.evaluate(snapshot(userAged(30), permission, null,
                Map.of("m1", module), Map.of("m1", completed("m1", null)), List.of()));

        assertTrue(result.eligible());
    }

    @Test
    void optionalPathItemsAreIgnored() {
        LearningPath path = Fixtures.path("path", List.of("a", "b", "c"), "c");
        TradingPermission permission = Fixtures.permission("p", null, false, "path", null, null);

        Map<String, UserProgress> progress = new HashMap<>();
        progress.put("a", completed("a", null));
        EligibilityResult partial = evaluator.evaluate(snapshot(userAged(30), permission, path, Map.of(), progress, List.of()));
        assertThat(partial.reasons()).singleElement()
                .isInstanceOfSatisfying(LearningPathIncomplete.class, r -> {
                    assertEquals(1, r.completedRequired());
                    assertEquals(2, r.totalRequired());
                    assertEquals(List.of("b"), r.missingContentIds());
                });

        progress.put("b", completed("b", null));
        assertTrue(evaluator.evaluate(snapshot(userAged(30), permission, path, Map.of(), progress, List.of())).eligible());
        assertEquals(100.0, evaluator.pathProgress(path, progress).completionPercent());
    }

    @Test
    void pathWithoutRequiredItemsCountsAsComplete() {
        LearningPath path = Fixtures.path("path", List.of("a"), "a");
        PathProgress progress = evaluator.pathProgress(path, Map.of());

        assertTrue(progress.complete());
        assertEquals(100.0, progress.completionPercent());
    }

    @Test
    void minorsNeedAnApprovedGuardianDecision() {
        TradingPermission permission = Fixtures.permission("p", 13, true, null, null, null);
        User minor = userAged(16);

        assertThat(evaluator.evaluate(snapshot(minor, permission, null, Map.of(), Map.of(), List.of())).reasons())
                .containsExactly(new GuardianApprovalMissing());
        assertThat(evaluator.evaluate(snapshot(minor, permission, null, Map.of(), Map.of(),
                List.of(approval("a1", ApprovalStatus.PENDING)))).reasons())
                .containsExactly(new GuardianApprovalPending("a1"));
        assertThat(evaluator.evaluate(snapshot(minor, permission, null, Map.of(), Map.of(),
                List.of(approval("a1", ApprovalStatus.DENIED)))).reasons())
                .containsExactly(new GuardianApprovalDenied("a1"));
        assertTrue(evaluator.evaluate(snapshot(minor, permission, null, Map.of(), Map.of(),
                List.of(approval("a1", ApprovalStatus.DENIED), approval("a2", ApprovalStatus.APPROVED)))).eligible());
    }

    @Test
    void checklistReportsMetAndUnmetRequirements() {
        EducationalContent quiz = Fixtures.quiz("q1", null);
        LearningPath path = Fixtures.path("path", List.of("q1", "m1"));
        TradingPermission permission = Fixtures.permission("p", 13, true, "path", "q1", 80.0);

        EligibilityResult result = evaluator.evaluate(snapshot(userAged(16), permission, path,
                Map.of("q1", quiz), Map.of("q1", completed("q1", 85.0)), List.of()));

        assertFalse(result.eligible());
        assertTrue(result.requiresGuardianApproval());
        assertFalse(result.alreadyGranted());
        assertThat(result.completedRequirements()).containsExactly("age", "content:q1", "score:q1");
        assertThat(result.reasons()).hasSize(2)
                .anyMatch(r -> r instanceof LearningPathIncomplete)
                .anyMatch(r -> r instanceof GuardianApprovalMissing);
    }

    @Test
    void adultsSkipGuardianApproval() {
        TradingPermission permission = Fixtures.permission("p", 13, true, null, null, null);
        assertTrue(evaluator.evaluate(snapshot(userAged(18), permission, null, Map.of(), Map.of(), List.of())).eligible());
        assertTrue(evaluator.isMinor(Fixtures.unknownAge("u"), TODAY));
    }

    private static User userAged(int years) {
        User base = Fixtures.adult("u", null);
        return new User(base.id(), base.displayName(), TODAY.minusYears(years), base.roles(), base.tier(), null);
    }

    private static UserProgress completed(String contentId, Double score) {
        Instant at = Instant.parse("2026-02-01T10:00:00Z");
        return new UserProgress("u", contentId, at, at, score, score == null ? null : true, score == null ? 0 : 1, 60, at);
    }

    private static GuardianApproval approval(String id, ApprovalStatus status) {
        Instant at = Instant.parse("2026-02-01T10:00:00Z");
        return new GuardianApproval(id, "u", "g", "p", status, at, status == ApprovalStatus.PENDING ? null : at);
    }

    private static EligibilitySnapshot snapshot(User user, TradingPermission permission, LearningPath path,
                                                Map<String, EducationalContent> content,
                                                Map<String, UserProgress> progress,
                                                List<GuardianApproval> approvals) {
        return new EligibilitySnapshot(user, permission, TODAY, path, content, progress, approvals);
    }
}
