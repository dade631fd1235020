package com.tradegate.access.eligibility;

import com.tradegate.access.catalog.PermissionCatalog;
import com.tradegate.access.domain.DomainModels.*;
import com.tradegate.access.eligibility.EligibilityModels.EligibilityResult;
import com.tradegate.access.eligibility.EligibilityModels.EligibilitySnapshot;
import com.tradegate.access.eligibility.EligibilityModels.PathProgress;
import com.tradegate.access.repository.CatalogJdbcRepository;
import com.tradegate.access.repository.GuardianJdbcRepository;
import com.tradegate.access.repository.ProgressJdbcRepository;
import com.tradegate.access.repository.UserPermissionJdbcRepository;
import com.tradegate.access.user.UserDirectory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only entry point: assembles the snapshot from the stores and hands it to the
 * pure {@link EligibilityEvaluator}. Explains, never grants.
 */
@Service
public class EligibilityService {
    private final EligibilityEvaluator evaluator;
    private final UserDirectory users;
    private final PermissionCatalog catalog;
    private final CatalogJdbcRepository catalogRepository;
    private final ProgressJdbcRepository progressRepository;
    private final GuardianJdbcRepository guardianRepository;
    private final UserPermissionJdbcRepository userPermissions;
    private final Clock clock;

    public EligibilityService(EligibilityEvaluator evaluator,
                              UserDirectory users,
                              PermissionCatalog catalog,
                              CatalogJdbcRepository catalogRepository,
                              ProgressJdbcRepository progressRepository,
                              GuardianJdbcRepository guardianRepository,
                              UserPermissionJdbcRepository userPermissions,
                              Clock clock) {
        this.evaluator = evaluator;
        this.users = users;
        this.catalog = catalog;
        this.catalogRepository = catalogRepository;
        this.progressRepository = progressRepository;
        this.guardianRepository = guardianRepository;
        this.userPermissions = userPermissions;
        this.clock = clock;
    }

    public EligibilityResult evaluate(String userId, String permissionId) {
        return evaluate(users.user(userId), catalog.permission(permissionId));
    }

    public EligibilityResult evaluateByTypeKey(String userId, String typeKey) {
        return evaluate(users.user(userId), catalog.permissionByTypeKey(typeKey));
    }

    public EligibilityResult evaluate(User user, TradingPermission permission) {
        EligibilityResult result = evaluator.evaluate(snapshot(user, permission));
        return result.withAlreadyGranted(userPermissions.find(user.id(), permission.id()).isPresent());
    }

    public PathProgress pathProgress(String userId, String pathId) {
        users.user(userId);
        LearningPath path = catalog.path(pathId);
        return evaluator.pathProgress(path, progressByContent(userId));
    }

    public boolean isMinor(User user) {
        return evaluator.isMinor(user, today());
    }

    EligibilitySnapshot snapshot(User user, TradingPermission permission) {
        LearningPath path = permission.requiredLearningPathId() == null
                ? null
                : catalogRepository.findPath(permission.requiredLearningPathId()).orElse(null);

        Set<String> touched = new HashSet<>();
        if (path != null) path.items().forEach(i -> touched.add(i.contentId()));
        if (permission.requiredContentId() != null) touched.add(permission.requiredContentId());

        Map<String, EducationalContent> contentById = catalogRepository.loadContent(touched).stream()
                .collect(Collectors.toMap(EducationalContent::id, Function.identity()));
        Map<String, UserProgress> progress = progressByContent(user.id());
        progress.keySet().retainAll(touched);

        return new EligibilitySnapshot(user, permission, today(), path, contentById, progress,
                guardianRepository.findFor(user.id(), permission.id()));
    }

    private Map<String, UserProgress> progressByContent(String userId) {
        return progressRepository.loadForUser(userId).stream()
                .collect(Collectors.toMap(UserProgress::contentId, Function.identity(), (a, b) -> b, HashMap::new));
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
