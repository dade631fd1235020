package com.tradegate.access;

import com.tradegate.access.catalog.PermissionCatalog;
import com.tradegate.access.domain.DomainModels.GuardianApproval;
import com.tradegate.access.domain.DomainModels.Role;
import com.tradegate.access.domain.DomainModels.SubscriptionTier;
import com.tradegate.access.domain.DomainModels.TradingPermission;
import com.tradegate.access.domain.DomainModels.UserPermission;
import com.tradegate.access.eligibility.EligibilityModels.GuardianApprovalMissing;
import com.tradegate.access.eligibility.EligibilityModels.LearningPathIncomplete;
import com.tradegate.access.eligibility.EligibilityService;
import com.tradegate.access.gate.CapabilityGate;
import com.tradegate.access.gate.GateModels.AccessSession;
import com.tradegate.access.gate.GateModels.Allow;
import com.tradegate.access.gate.GateModels.CapabilityRequest;
import com.tradegate.access.gate.GateModels.DenialReason;
import com.tradegate.access.gate.GateModels.Pending;
import com.tradegate.access.grant.PermissionGrantService;
import com.tradegate.access.guardian.GuardianApprovalWorkflow;
import com.tradegate.access.progress.ProgressModels.ProgressDelta;
import com.tradegate.access.progress.ProgressTracker;
import com.tradegate.access.reevaluation.ReevaluationQueue;
import com.tradegate.access.repository.GuardianJdbcRepository;
import com.tradegate.access.repository.UserPermissionJdbcRepository;
import com.tradegate.access.user.UserDirectory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/** Progress, guardian and grant services working together through the re-evaluation queue. */
@SpringBootTest
@ActiveProfiles("test")
class TradeStocksScenarioTest {
    @Autowired
    private PermissionCatalog catalog;
    @Autowired
    private UserDirectory users;
    @Autowired
    private ProgressTracker tracker;
    @Autowired
    private EligibilityService eligibility;
    @Autowired
    private GuardianApprovalWorkflow guardianWorkflow;
    @Autowired
    private ReevaluationQueue reevaluationQueue;
    @Autowired
    private PermissionGrantService grantService;
    @Autowired
    private CapabilityGate gate;
    @Autowired
    private UserPermissionJdbcRepository userPermissions;
    @Autowired
    private GuardianJdbcRepository approvals;

    @Test
    void minorEarnsTradeStocksAfterQuizAndGuardianApproval() {
        String quiz = catalog.createContent(Fixtures.quiz(Fixtures.id("beginner-quiz"), null)).id();
        String path = catalog.createPath(Fixtures.path(Fixtures.id("beginner-trading-path"), List.of(quiz))).id();
        TradingPermission tradeStocks = catalog.createPermission(
                Fixtures.permission(Fixtures.id("trade_stocks"), 13, true, path, quiz, 80.0));

        String guardian = users.register(Fixtures.adult(Fixtures.id("parent"), SubscriptionTier.FAMILY, Role.USER, Role.GUARDIAN)).id();
        String minor = users.register(Fixtures.minor(Fixtures.id("teen"), guardian, 16)).id();

        tracker.updateProgress(minor, quiz, ProgressDelta.attempt(85));
        assertEquals(100.0, eligibility.pathProgress(minor, path).completionPercent());

        reevaluationQueue.drain();
        assertFalse(grantService.hasPermission(minor, tradeStocks.typeKey()));
        assertThat(eligibility.evaluate(minor, tradeStocks.id()).reasons()).containsExactly(new GuardianApprovalMissing());

        GuardianApproval request = guardianWorkflow.requestApproval(minor, guardian, tradeStocks.id());
        var pending = gate.checkCapability(new AccessSession(minor, null),
                new CapabilityRequest("/trade/stocks", null, null, tradeStocks.typeKey()));
        assertEquals(DenialReason.GUARDIAN_APPROVAL_PENDING, ((Pending) pending).reason());

        guardianWorkflow.decide(request.id(), guardian, true);
        assertTrue(eligibility.evaluate(minor, tradeStocks.id()).eligible());

        reevaluationQueue.drain();

        UserPermission granted = userPermissions.find(minor, tradeStocks.id()).orElseThrow();
        GuardianApproval decided = approvals.find(request.id()).orElseThrow();
        assertEquals(UserPermission.SYSTEM, granted.grantedBy());
        assertFalse(granted.grantedAt().isBefore(decided.decidedAt()));
        assertInstanceOf(Allow.class, gate.checkCapability(new AccessSession(minor, null),
                new CapabilityRequest("/trade/stocks", null, null, tradeStocks.typeKey())));
        assertTrue(reevaluationQueue.pendingFor(minor).isEmpty());
    }

    @Test
    void completingTheLastRequiredItemGrantsThroughTheQueue() {
        String first = catalog.createContent(Fixtures.module(Fixtures.id("candles"))).id();
        String second = catalog.createContent(Fixtures.module(Fixtures.id("orders"))).id();
        String extra = catalog.createContent(Fixtures.module(Fixtures.id("history"))).id();
        String path = catalog.createPath(Fixtures.path(Fixtures.id("path"), List.of(first, second, extra), extra)).id();
        TradingPermission paperTrade = catalog.createPermission(
                Fixtures.permission(Fixtures.id("paper_trade"), null, false, path, null, null));
        String user = users.register(Fixtures.adult(Fixtures.id("adult"), SubscriptionTier.BASIC)).id();

        tracker.updateProgress(user, first, ProgressDelta.completion());
        reevaluationQueue.drain();
        assertFalse(grantService.hasPermission(user, paperTrade.typeKey()));
        assertThat(eligibility.evaluate(user, paperTrade.id()).reasons())
                .singleElement().isInstanceOf(LearningPathIncomplete.class);

        tracker.updateProgress(user, second, ProgressDelta.completion());
        reevaluationQueue.drain();
        reevaluationQueue.drain();

        assertTrue(grantService.hasPermission(user, paperTrade.typeKey()));
        assertEquals(1, userPermissions.count(user, paperTrade.id()));
    }

    @Test
    void retakeThatReachesTheMinimumScoreGrantsThroughTheQueue() {
        String quiz = catalog.createContent(Fixtures.quiz(Fixtures.id("options-quiz"), null)).id();
        TradingPermission options = catalog.createPermission(
                Fixtures.permission(Fixtures.id("trade_options"), null, false, null, quiz, 80.0));
        String user = users.register(Fixtures.adult(Fixtures.id("adult"), SubscriptionTier.BASIC)).id();

        assertEquals(1, tracker.updateProgress(user, quiz, ProgressDelta.attempt(70)).signalsEnqueued());
        reevaluationQueue.drain();
        assertFalse(grantService.hasPermission(user, options.typeKey()));

        assertEquals(1, tracker.updateProgress(user, quiz, ProgressDelta.attempt(90)).signalsEnqueued());
        reevaluationQueue.drain();

        assertTrue(grantService.hasPermission(user, options.typeKey()));
        var result = eligibility.evaluate(user, options.id());
        assertTrue(result.alreadyGranted());
        assertThat(result.completedRequirements()).containsExactly("content:" + quiz, "score:" + quiz);
    }
}
