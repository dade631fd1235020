package com.tradegate.access.repository;

import com.tradegate.access.domain.DomainModels.*;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.*;

@Repository
public class CatalogJdbcRepository {
    private static final String CONTENT_COLUMNS =
            "id, slug, title, content_type, level, completion_requirement, passing_score, estimated_minutes, min_age, max_age";
    private static final String PERMISSION_COLUMNS =
            "id, type_key, name, description, min_age, requires_guardian_approval, required_learning_path_id, required_content_id, min_score";

    private static final RowMapper<EducationalContent> CONTENT_MAPPER = (rs, n) -> new EducationalContent(
            rs.getString(1), rs.getString(2), rs.getString(3),
            ContentType.valueOf(rs.getString(4)), ContentLevel.valueOf(rs.getString(5)),
            CompletionRequirement.valueOf(rs.getString(6)),
            (Double) rs.getObject(7), (Integer) rs.getObject(8), (Integer) rs.getObject(9), (Integer) rs.getObject(10));

    private static final RowMapper<TradingPermission> PERMISSION_MAPPER = (rs, n) -> new TradingPermission(
            rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4),
            (Integer) rs.getObject(5), rs.getBoolean(6), rs.getString(7), rs.getString(8), (Double) rs.getObject(9));

    private final JdbcTemplate jdbcTemplate;

    public CatalogJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insertContent(EducationalContent c) {
        jdbcTemplate.update(
                "INSERT INTO educational_content(" + CONTENT_COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?)",
                c.id(), c.slug(), c.title(), c.type().name(), c.level().name(), c.completionRequirement().name(),
                c.passingScore(), c.estimatedMinutes(), c.minAge(), c.maxAge());
    }

    public Optional<EducationalContent> findContent(String contentId) {
        return jdbcTemplate.query("SELECT " + CONTENT_COLUMNS + " FROM educational_content WHERE id = ?", CONTENT_MAPPER, contentId)
                .stream().findFirst();
    }

    public Optional<EducationalContent> findContentBySlug(String slug) {
        return jdbcTemplate.query("SELECT " + CONTENT_COLUMNS + " FROM educational_content WHERE slug = ?", CONTENT_MAPPER, slug)
                .stream().findFirst();
    }

    public boolean contentSlugExists(String slug) {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM educational_content WHERE slug = ?", Long.class, slug);
        return count != null && count > 0;
    }

    public Set<String> contentIds() {
        return new HashSet<>(jdbcTemplate.queryForList("SELECT id FROM educational_content", String.class));
    }

    public List<EducationalContent> loadContent(Collection<String> contentIds) {
        if (contentIds.isEmpty()) return List.of();
        String placeholders = String.join(",", Collections.nCopies(contentIds.size(), "?"));
        return jdbcTemplate.query("SELECT " + CONTENT_COLUMNS + " FROM educational_content WHERE id IN (" + placeholders + ")",
                CONTENT_MAPPER, contentIds.toArray());
    }

    public List<EducationalContent> listContent() {
        return jdbcTemplate.query("SELECT " + CONTENT_COLUMNS + " FROM educational_content ORDER BY id", CONTENT_MAPPER);
    }

    /** Serializes prerequisite authoring until the surrounding transaction ends. */
    public void lockPrerequisiteGraph() {
        jdbcTemplate.queryForList("SELECT name FROM catalog_locks WHERE name = 'prerequisite_graph' FOR UPDATE", String.class);
    }

    public void insertPrerequisite(PrerequisiteEdge edge) {
        jdbcTemplate.update("INSERT INTO content_prerequisites(content_id, prerequisite_id) VALUES (?,?)",
                edge.contentId(), edge.prerequisiteId());
    }

    public List<PrerequisiteEdge> loadPrerequisites() {
        return jdbcTemplate.query("SELECT prerequisite_id, content_id FROM content_prerequisites",
                (rs, n) -> new PrerequisiteEdge(rs.getString(1), rs.getString(2)));
    }

    public List<String> prerequisitesOf(String contentId) {
        return jdbcTemplate.queryForList(
                "SELECT prerequisite_id FROM content_prerequisites WHERE content_id = ? ORDER BY prerequisite_id",
                String.class, contentId);
    }

    public void insertPath(LearningPath path) {
        jdbcTemplate.update("INSERT INTO learning_paths(id, slug, title, min_age) VALUES (?,?,?,?)",
                path.id(), path.slug(), path.title(), path.minAge());
        path.items().forEach(item -> jdbcTemplate.update(
                "INSERT INTO learning_path_items(path_id, content_id, item_order, required) VALUES (?,?,?,?)",
                path.id(), item.contentId(), item.order(), item.required()));
    }

    public boolean pathSlugExists(String slug) {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM learning_paths WHERE slug = ?", Long.class, slug);
        return count != null && count > 0;
    }

    public Set<String> pathIds() {
        return new HashSet<>(jdbcTemplate.queryForList("SELECT id FROM learning_paths", String.class));
    }

    public Optional<LearningPath> findPath(String pathId) {
        List<PathRow> rows = jdbcTemplate.query("SELECT id, slug, title, min_age FROM learning_paths WHERE id = ?",
                (rs, n) -> new PathRow(rs.getString(1), rs.getString(2), rs.getString(3), (Integer) rs.getObject(4)),
                pathId);
        if (rows.isEmpty()) return Optional.empty();

        PathRow row = rows.get(0);
        List<LearningPathItem> items = jdbcTemplate.query(
                "SELECT path_id, content_id, item_order, required FROM learning_path_items WHERE path_id = ? ORDER BY item_order",
                (rs, n) -> new LearningPathItem(rs.getString(1), rs.getString(2), rs.getInt(3), rs.getBoolean(4)),
                pathId);
        return Optional.of(new LearningPath(row.id(), row.slug(), row.title(), row.minAge(), items));
    }

    public List<LearningPath> listPaths() {
        return jdbcTemplate.queryForList("SELECT id FROM learning_paths ORDER BY id", String.class).stream()
                .map(this::findPath)
                .flatMap(Optional::stream)
                .toList();
    }

    public List<String> pathsContaining(String contentId) {
        return jdbcTemplate.queryForList("SELECT path_id FROM learning_path_items WHERE content_id = ?", String.class, contentId);
    }

    public void insertPermission(TradingPermission p) {
        jdbcTemplate.update(
                "INSERT INTO trading_permissions(" + PERMISSION_COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?)",
                p.id(), p.typeKey(), p.name(), p.description(), p.minAge(), p.requiresGuardianApproval(),
                p.requiredLearningPathId(), p.requiredContentId(), p.minScore());
    }

    public Optional<TradingPermission> findPermission(String permissionId) {
        return jdbcTemplate.query("SELECT " + PERMISSION_COLUMNS + " FROM trading_permissions WHERE id = ?", PERMISSION_MAPPER, permissionId)
                .stream().findFirst();
    }

    public Optional<TradingPermission> findPermissionByTypeKey(String typeKey) {
        return jdbcTemplate.query("SELECT " + PERMISSION_COLUMNS + " FROM trading_permissions WHERE type_key = ?", PERMISSION_MAPPER, typeKey)
                .stream().findFirst();
    }

    public List<TradingPermission> listPermissions() {
        return jdbcTemplate.query("SELECT " + PERMISSION_COLUMNS + " FROM trading_permissions ORDER BY type_key", PERMISSION_MAPPER);
    }

    public List<TradingPermission> permissionsReferencing(String contentId, Collection<String> pathIds) {
        List<TradingPermission> direct = jdbcTemplate.query(
                "SELECT " + PERMISSION_COLUMNS + " FROM trading_permissions WHERE required_content_id = ?",
                PERMISSION_MAPPER, contentId);
        if (pathIds.isEmpty()) return direct;

        String placeholders = String.join(",", Collections.nCopies(pathIds.size(), "?"));
        List<TradingPermission> viaPath = jdbcTemplate.query(
                "SELECT " + PERMISSION_COLUMNS + " FROM trading_permissions WHERE required_learning_path_id IN (" + placeholders + ")",
                PERMISSION_MAPPER, pathIds.toArray());

        Map<String, TradingPermission> merged = new LinkedHashMap<>();
        direct.forEach(p -> merged.put(p.id(), p));
        viaPath.forEach(p -> merged.putIfAbsent(p.id(), p));
        return List.copyOf(merged.values());
    }

    private record PathRow(String id, String slug, String title, Integer minAge) {}
}
