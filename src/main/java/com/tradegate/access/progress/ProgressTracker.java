package com.tradegate.access.progress;

import com.tradegate.access.catalog.PermissionCatalog;
import com.tradegate.access.domain.ContentLockedException;
import com.tradegate.access.domain.DomainModels.CompletionRequirement;
import com.tradegate.access.domain.DomainModels.EducationalContent;
import com.tradegate.access.domain.DomainModels.TradingPermission;
import com.tradegate.access.domain.DomainModels.UserProgress;
import com.tradegate.access.graph.PrerequisiteGraphService;
import com.tradegate.access.progress.ProgressModels.ProgressDelta;
import com.tradegate.access.progress.ProgressModels.ProgressUpdate;
import com.tradegate.access.reevaluation.ReevaluationQueue;
import com.tradegate.access.repository.ProgressJdbcRepository;
import com.tradegate.access.user.UserDirectory;
import com.tradegate.access.validation.AccessValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Records learner progress. Rows only move forward: attempts and time spent grow,
 * completion is set once. Completing content enqueues re-evaluation of every trading
 * permission that depends on it, in the same transaction as the progress write.
 */
@Service
public class ProgressTracker {
    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);

    private final ProgressJdbcRepository repository;
    private final PermissionCatalog catalog;
    private final PrerequisiteGraphService graph;
    private final UserDirectory users;
    private final ReevaluationQueue reevaluation;
    private final TransactionTemplate savepoint;
    private final Clock clock;

    public ProgressTracker(ProgressJdbcRepository repository,
                           PermissionCatalog catalog,
                           PrerequisiteGraphService graph,
                           UserDirectory users,
                           ReevaluationQueue reevaluation,
                           PlatformTransactionManager transactionManager,
                           Clock clock) {
        this.repository = repository;
        this.catalog = catalog;
        this.graph = graph;
        this.users = users;
        this.reevaluation = reevaluation;
        this.savepoint = new TransactionTemplate(transactionManager);
        this.savepoint.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
        this.clock = clock;
    }

    @Transactional
    public ProgressUpdate updateProgress(String userId, String contentId, ProgressDelta delta) {
        if (delta.timeSpentSeconds() < 0) {
            throw new AccessValidationException("NEGATIVE_TIME", "Time spent cannot be negative", contentId);
        }
        if (delta.attempted() && delta.score() != null && (delta.score() < 0 || delta.score() > 100)) {
            throw new AccessValidationException("INVALID_SCORE", "Score must be between 0 and 100", contentId);
        }
        users.user(userId);
        EducationalContent content = catalog.content(contentId);
        Instant now = clock.instant();

        var locked = repository.findForUpdate(userId, contentId);
        if (locked.isPresent()) {
            return apply(content, locked.get(), delta, now);
        }

        List<String> missing = graph.missingPrerequisites(userId, contentId);
        if (!missing.isEmpty()) {
            throw new ContentLockedException(contentId, missing);
        }

        UserProgress fresh = new UserProgress(userId, contentId, now, null, null, null, 0, 0, now);
        try {
            savepoint.executeWithoutResult(status -> repository.insert(fresh));
        } catch (DuplicateKeyException race) {
            log.debug("Progress row for user={} content={} created concurrently", userId, contentId);
        }
        UserProgress current = repository.findForUpdate(userId, contentId)
                .orElseThrow(() -> new IllegalStateException("Progress row vanished for " + userId + "/" + contentId));
        return apply(content, current, delta, now);
    }

    public List<UserProgress> progress(String userId) {
        users.user(userId);
        return repository.loadForUser(userId);
    }

    private ProgressUpdate apply(EducationalContent content, UserProgress current, ProgressDelta delta, Instant now) {
        int attempts = current.attempts();
        Double score = current.score();
        Boolean passed = current.passed();
        if (delta.attempted()) {
            attempts++;
            if (delta.score() != null) {
                score = delta.score();
                passed = content.passingScore() == null || score >= content.passingScore();
            }
        }

        boolean completing = delta.completed() && meetsRequirement(content, delta, score);
        boolean newlyCompleted = completing && !current.completed();
        Instant completedAt = current.completed() ? current.completedAt() : (completing ? now : null);

        UserProgress next = new UserProgress(current.userId(), current.contentId(), current.startedAt(), completedAt,
                score, passed, attempts, current.timeSpentSeconds() + delta.timeSpentSeconds(), now);
        repository.update(next);

        int signals = 0;
        if (newlyCompleted) {
            signals = signalDependents(next.userId(), content.id());
            log.info("User {} completed content {} (score={}); {} permission(s) queued for re-evaluation",
                    next.userId(), content.id(), score, signals);
        } else if (next.completed() && delta.attempted() && !Objects.equals(score, current.score())) {
            // a retake on completed content can still satisfy a minimum score
            signals = signalScoreDependents(next.userId(), content.id());
            if (signals > 0) {
                log.info("User {} rescored content {} ({} -> {}); {} permission(s) queued for re-evaluation",
                        next.userId(), content.id(), current.score(), score, signals);
            }
        }
        return new ProgressUpdate(next.userId(), next.contentId(), next.completed(), newlyCompleted,
                next.score(), next.passed(), next.attempts(), next.timeSpentSeconds(), signals);
    }

    // A graded quiz only completes on an attempt that reaches the passing score.
    private static boolean meetsRequirement(EducationalContent content, ProgressDelta delta, Double score) {
        if (content.completionRequirement() != CompletionRequirement.QUIZ || content.passingScore() == null) {
            return true;
        }
        return delta.attempted() && score != null && score >= content.passingScore();
    }

    private int signalDependents(String userId, String contentId) {
        List<TradingPermission> dependents = catalog.permissionsReferencing(contentId);
        for (TradingPermission permission : dependents) {
            reevaluation.enqueue(userId, permission.id(), "content_completed:" + contentId);
        }
        return dependents.size();
    }

    private int signalScoreDependents(String userId, String contentId) {
        List<TradingPermission> scored = catalog.permissionsScoredOn(contentId);
        for (TradingPermission permission : scored) {
            reevaluation.enqueue(userId, permission.id(), "content_rescored:" + contentId);
        }
        return scored.size();
    }
}
