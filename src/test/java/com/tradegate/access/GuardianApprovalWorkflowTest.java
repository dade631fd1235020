package com.tradegate.access;

import com.tradegate.access.catalog.PermissionCatalog;
import com.tradegate.access.domain.DomainModels.ApprovalStatus;
import com.tradegate.access.domain.DomainModels.GuardianApproval;
import com.tradegate.access.domain.DomainModels.Role;
import com.tradegate.access.domain.DomainModels.SubscriptionTier;
import com.tradegate.access.domain.NotFoundException;
import com.tradegate.access.eligibility.EligibilityModels.GuardianApprovalDenied;
import com.tradegate.access.eligibility.EligibilityService;
import com.tradegate.access.guardian.GuardianApprovalWorkflow;
import com.tradegate.access.reevaluation.ReevaluationQueue;
import com.tradegate.access.repository.ReevaluationJdbcRepository.SignalRow;
import com.tradegate.access.user.UserDirectory;
import com.tradegate.access.validation.AccessValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class GuardianApprovalWorkflowTest {
    @Autowired
    private GuardianApprovalWorkflow workflow;
    @Autowired
    private PermissionCatalog catalog;
    @Autowired
    private UserDirectory users;
    @Autowired
    private EligibilityService eligibility;
    @Autowired
    private ReevaluationQueue reevaluationQueue;

    private String guardian;
    private String minor;
    private String permission;

    @BeforeEach
    void setUp() {
        guardian = users.register(Fixtures.adult(Fixtures.id("parent"), SubscriptionTier.FAMILY, Role.USER, Role.GUARDIAN)).id();
        minor = users.register(Fixtures.minor(Fixtures.id("teen"), guardian, 15)).id();
        permission = catalog.createPermission(Fixtures.permission(Fixtures.id("options"), 13, true, null, null, null)).id();
    }

    @Test
    void repeatedRequestReturnsTheOpenOne() {
        GuardianApproval first = workflow.requestApproval(minor, guardian, permission);
        GuardianApproval second = workflow.requestApproval(minor, guardian, permission);

        assertEquals(first.id(), second.id());
        assertEquals(ApprovalStatus.PENDING, first.status());
        assertThat(workflow.pendingForGuardian(guardian)).extracting(GuardianApproval::id).containsExactly(first.id());
    }

    @Test
    void concurrentRequestsOpenOnePendingApproval() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<GuardianApproval>> futures = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                return workflow.requestApproval(minor, guardian, permission);
            }));
        }
        start.countDown();

        Set<String> ids = new HashSet<>();
        for (Future<GuardianApproval> f : futures) ids.add(f.get().id());
        pool.shutdown();

        assertEquals(1, ids.size());
        assertEquals(1, workflow.requestsForMinor(minor).size());
    }

    @Test
    void deniedRequestCanBeRaisedAgain() {
        GuardianApproval first = workflow.requestApproval(minor, guardian, permission);
        GuardianApproval denied = workflow.decide(first.id(), guardian, false);

        assertEquals(ApprovalStatus.DENIED, denied.status());
        assertNotNull(denied.decidedAt());
        assertThat(eligibility.evaluate(minor, permission).reasons()).containsExactly(new GuardianApprovalDenied(first.id()));
        assertTrue(reevaluationQueue.pendingFor(minor).isEmpty());

        GuardianApproval second = workflow.requestApproval(minor, guardian, permission);
        assertNotEquals(first.id(), second.id());
        assertEquals(2, workflow.requestsForMinor(minor).size());
    }

    @Test
    void decisionIsFinal() {
        GuardianApproval request = workflow.requestApproval(minor, guardian, permission);
        workflow.decide(request.id(), guardian, true);

        assertThrows(IllegalStateException.class, () -> workflow.decide(request.id(), guardian, false));
        assertThat(reevaluationQueue.pendingFor(minor)).extracting(SignalRow::permissionId).containsExactly(permission);
    }

    @Test
    void onlyTheLinkedGuardianMayActForAMinor() {
        String stranger = users.register(Fixtures.adult(Fixtures.id("stranger"), SubscriptionTier.FREE, Role.USER, Role.GUARDIAN)).id();
        String adult = users.register(Fixtures.adult(Fixtures.id("adult"), SubscriptionTier.FREE)).id();

        var mismatch = assertThrows(AccessValidationException.class, () -> workflow.requestApproval(minor, stranger, permission));
        assertEquals("GUARDIAN_MISMATCH", mismatch.issues().get(0).code());

        var notMinor = assertThrows(AccessValidationException.class, () -> workflow.requestApproval(adult, guardian, permission));
        assertEquals("NOT_A_MINOR", notMinor.issues().get(0).code());

        GuardianApproval request = workflow.requestApproval(minor, guardian, permission);
        var notGuardian = assertThrows(AccessValidationException.class, () -> workflow.decide(request.id(), stranger, true));
        assertEquals("NOT_GUARDIAN", notGuardian.issues().get(0).code());

        assertThrows(NotFoundException.class, () -> workflow.decide("no-such-request", guardian, true));
    }
}
