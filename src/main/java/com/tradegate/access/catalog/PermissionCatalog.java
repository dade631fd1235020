package com.tradegate.access.catalog;

import com.tradegate.access.domain.DomainModels.ContentLevel;
import com.tradegate.access.domain.DomainModels.ContentType;
import com.tradegate.access.domain.DomainModels.EducationalContent;
import com.tradegate.access.domain.DomainModels.LearningPath;
import com.tradegate.access.domain.DomainModels.LearningPathItem;
import com.tradegate.access.domain.DomainModels.PrerequisiteEdge;
import com.tradegate.access.domain.DomainModels.TradingPermission;
import com.tradegate.access.domain.NotFoundException;
import com.tradegate.access.graph.PrerequisiteGraphService;
import com.tradegate.access.repository.CatalogJdbcRepository;
import com.tradegate.access.validation.AccessValidationException;
import com.tradegate.access.validation.CatalogValidator;
import com.tradegate.access.validation.ValidationIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Admin-authored definitions: educational content, prerequisite edges, learning paths
 * and the trading permissions that reference them. Definitions are validated on write
 * and read as immutable values afterwards.
 */
@Service
public class PermissionCatalog {
    private static final Logger log = LoggerFactory.getLogger(PermissionCatalog.class);

    private final CatalogJdbcRepository repository;
    private final CatalogValidator validator;
    private final PrerequisiteGraphService graphService;

    public PermissionCatalog(CatalogJdbcRepository repository,
                             CatalogValidator validator,
                             PrerequisiteGraphService graphService) {
        this.repository = repository;
        this.validator = validator;
        this.graphService = graphService;
    }

    @Transactional
    public EducationalContent createContent(EducationalContent content) {
        List<ValidationIssue> issues = new ArrayList<>(validator.validateContent(content));
        if (issues.isEmpty()) {
            if (repository.findContent(content.id()).isPresent()) {
                issues.add(new ValidationIssue("DUPLICATE_CONTENT", "Content id already exists: " + content.id(), content.id()));
            }
            if (repository.contentSlugExists(content.slug())) {
                issues.add(new ValidationIssue("DUPLICATE_SLUG", "Content slug already exists: " + content.slug(), content.id()));
            }
        }
        failOn(issues);

        repository.insertContent(content);
        log.info("Created content {} ({}, {})", content.id(), content.type(), content.completionRequirement());
        return content;
    }

    public PrerequisiteEdge addPrerequisite(String prerequisiteId, String contentId) {
        return graphService.addPrerequisite(prerequisiteId, contentId);
    }

    @Transactional
    public LearningPath createPath(LearningPath path) {
        List<LearningPathItem> items = path.items() == null ? List.of() : path.items().stream()
                .map(i -> new LearningPathItem(path.id(), i.contentId(), i.order(), i.required()))
                .toList();
        LearningPath normalized = new LearningPath(path.id(), path.slug(), path.title(), path.minAge(), items);

        List<ValidationIssue> issues = new ArrayList<>(validator.validatePath(normalized, repository.contentIds()));
        if (issues.isEmpty()) {
            if (repository.findPath(path.id()).isPresent()) {
                issues.add(new ValidationIssue("DUPLICATE_PATH", "Learning path id already exists: " + path.id(), path.id()));
            }
            if (repository.pathSlugExists(path.slug())) {
                issues.add(new ValidationIssue("DUPLICATE_SLUG", "Learning path slug already exists: " + path.slug(), path.id()));
            }
        }
        failOn(issues);

        repository.insertPath(normalized);
        log.info("Created learning path {} with {} items ({} required)",
                path.id(), items.size(), normalized.requiredItems().size());
        return repository.findPath(path.id()).orElseThrow();
    }

    @Transactional
    public TradingPermission createPermission(TradingPermission permission) {
        List<ValidationIssue> issues = new ArrayList<>(
                validator.validatePermission(permission, repository.contentIds(), repository.pathIds()));
        if (issues.isEmpty()) {
            if (repository.findPermission(permission.id()).isPresent()) {
                issues.add(new ValidationIssue("DUPLICATE_PERMISSION", "Permission id already exists: " + permission.id(), permission.id()));
            }
            if (repository.findPermissionByTypeKey(permission.typeKey()).isPresent()) {
                issues.add(new ValidationIssue("DUPLICATE_TYPE_KEY", "Permission type key already exists: " + permission.typeKey(), permission.id()));
            }
        }
        failOn(issues);

        repository.insertPermission(permission);
        log.info("Created permission {} ({})", permission.id(), permission.typeKey());
        return permission;
    }

    public EducationalContent content(String contentId) {
        return repository.findContent(contentId).orElseThrow(() -> new NotFoundException("content", contentId));
    }

    public EducationalContent contentBySlug(String slug) {
        return repository.findContentBySlug(slug).orElseThrow(() -> new NotFoundException("content", slug));
    }

    /** Null filters match everything; {@code age} keeps content whose age band contains it. */
    public List<EducationalContent> listContent(ContentType type, ContentLevel level, Integer age) {
        return repository.listContent().stream()
                .filter(c -> type == null || c.type() == type)
                .filter(c -> level == null || c.level() == level)
                .filter(c -> age == null || ((c.minAge() == null || c.minAge() <= age) && (c.maxAge() == null || c.maxAge() >= age)))
                .toList();
    }

    public LearningPath path(String pathId) {
        return repository.findPath(pathId).orElseThrow(() -> new NotFoundException("learning path", pathId));
    }

    public List<LearningPath> listPaths(Integer age) {
        return repository.listPaths().stream()
                .filter(p -> age == null || p.minAge() == null || p.minAge() <= age)
                .toList();
    }

    public TradingPermission permission(String permissionId) {
        return repository.findPermission(permissionId).orElseThrow(() -> new NotFoundException("permission", permissionId));
    }

    public TradingPermission permissionByTypeKey(String typeKey) {
        return repository.findPermissionByTypeKey(typeKey).orElseThrow(() -> new NotFoundException("permission", typeKey));
    }

    public List<TradingPermission> listPermissions() {
        return repository.listPermissions();
    }

    /** Permissions requiring this content directly or through a learning path that contains it. */
    public List<TradingPermission> permissionsReferencing(String contentId) {
        return repository.permissionsReferencing(contentId, repository.pathsContaining(contentId));
    }

    /** Permissions whose minimum score is measured on this content. */
    public List<TradingPermission> permissionsScoredOn(String contentId) {
        return repository.permissionsReferencing(contentId, List.of()).stream()
                .filter(p -> p.minScore() != null)
                .toList();
    }

    private void failOn(List<ValidationIssue> issues) {
        if (!issues.isEmpty()) {
            log.info("Rejected catalog write: {}", issues);
            throw new AccessValidationException(issues);
        }
    }
}
