package com.tradegate.access.graph;

import com.tradegate.access.domain.DomainModels.PrerequisiteEdge;
import com.tradegate.access.domain.DomainModels.UserProgress;
import com.tradegate.access.domain.NotFoundException;
import com.tradegate.access.graph.PrerequisiteGraphModels.ContentAvailability;
import com.tradegate.access.graph.PrerequisiteGraphModels.PrerequisiteGraph;
import com.tradegate.access.repository.CatalogJdbcRepository;
import com.tradegate.access.repository.ProgressJdbcRepository;
import com.tradegate.access.validation.AccessValidationException;
import com.tradegate.access.validation.ValidationIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.stream.Collectors;

@Service
public class PrerequisiteGraphService {
    private static final Logger log = LoggerFactory.getLogger(PrerequisiteGraphService.class);

    private final CatalogJdbcRepository catalog;
    private final ProgressJdbcRepository progress;

    public PrerequisiteGraphService(CatalogJdbcRepository catalog, ProgressJdbcRepository progress) {
        this.catalog = catalog;
        this.progress = progress;
    }

    /**
     * Adds "{@code contentId} requires {@code prerequisiteId}". The edge is rejected
     * before it is stored if it references unknown content or would close a cycle.
     * Re-adding an existing edge is a no-op. Concurrent authors are serialized so the
     * cycle check always sees every committed edge.
     */
    @Transactional
    public PrerequisiteEdge addPrerequisite(String prerequisiteId, String contentId) {
        catalog.lockPrerequisiteGraph();
        PrerequisiteEdge candidate = new PrerequisiteEdge(prerequisiteId, contentId);
        PrerequisiteGraph current = readGraph();
        if (current.edges().contains(candidate)) return candidate;

        List<PrerequisiteEdge> edges = new ArrayList<>(current.edges());
        edges.add(candidate);
        List<ValidationIssue> issues = validateGraph(new PrerequisiteGraph(current.contentNodes(), edges));
        if (!issues.isEmpty()) {
            log.info("Rejected prerequisite edge {} -> {}: {}", prerequisiteId, contentId, issues);
            throw new AccessValidationException(issues);
        }

        catalog.insertPrerequisite(candidate);
        return candidate;
    }

    public PrerequisiteGraph readGraph() {
        return new PrerequisiteGraph(catalog.contentIds(), catalog.loadPrerequisites());
    }

    public ContentAvailability explainContent(String userId, String contentId) {
        if (catalog.findContent(contentId).isEmpty()) {
            throw new NotFoundException("content", contentId);
        }
        Set<String> completed = completedContent(userId);
        return explain(contentId, catalog.prerequisitesOf(contentId), completed);
    }

    public List<String> missingPrerequisites(String userId, String contentId) {
        return explain(contentId, catalog.prerequisitesOf(contentId), completedContent(userId)).missingPrerequisites();
    }

    /** Content the user has not completed yet and whose prerequisites are all completed. */
    public List<String> availableContent(String userId) {
        PrerequisiteGraph graph = readGraph();
        Set<String> completed = completedContent(userId);
        Map<String, List<String>> requires = graph.edges().stream()
                .collect(Collectors.groupingBy(PrerequisiteEdge::contentId,
                        Collectors.mapping(PrerequisiteEdge::prerequisiteId, Collectors.toList())));

        return graph.contentNodes().stream()
                .filter(c -> !completed.contains(c))
                .filter(c -> completed.containsAll(requires.getOrDefault(c, List.of())))
                .sorted()
                .toList();
    }

    private ContentAvailability explain(String contentId, List<String> prerequisites, Set<String> completed) {
        List<String> missing = prerequisites.stream()
                .filter(p -> !completed.contains(p))
                .distinct()
                .sorted()
                .toList();
        return new ContentAvailability(contentId, missing.isEmpty(), completed.contains(contentId), missing);
    }

    private Set<String> completedContent(String userId) {
        return progress.loadForUser(userId).stream()
                .filter(UserProgress::completed)
                .map(UserProgress::contentId)
                .collect(Collectors.toSet());
    }

    private List<ValidationIssue> validateGraph(PrerequisiteGraph graph) {
        List<ValidationIssue> issues = new ArrayList<>();

        for (PrerequisiteEdge edge : graph.edges()) {
            String ref = edge.prerequisiteId() + "->" + edge.contentId();
            if (!graph.contentNodes().contains(edge.prerequisiteId()) || !graph.contentNodes().contains(edge.contentId())) {
                issues.add(new ValidationIssue("CONTENT_REF_NOT_FOUND", "Prerequisite edge references missing content", ref));
            } else if (edge.prerequisiteId().equals(edge.contentId())) {
                issues.add(new ValidationIssue("SELF_PREREQUISITE", "Content cannot require itself", ref));
            }
        }
        if (!issues.isEmpty()) return issues;

        Map<String, List<String>> adj = new HashMap<>();
        graph.contentNodes().forEach(c -> adj.put(c, new ArrayList<>()));
        graph.edges().forEach(e -> adj.get(e.contentId()).add(e.prerequisiteId()));

        Set<String> visiting = new HashSet<>();
        Set<String> visited = new HashSet<>();
        for (String node : graph.contentNodes()) {
            if (hasCycle(node, adj, visiting, visited)) {
                issues.add(new ValidationIssue("CYCLE_DETECTED", "Cycle detected in prerequisite graph", node));
                break;
            }
        }
        return issues;
    }

    private boolean hasCycle(String node, Map<String, List<String>> adj, Set<String> visiting, Set<String> visited) {
        if (visited.contains(node)) return false;
        if (visiting.contains(node)) return true;

        visiting.add(node);
        for (String next : adj.getOrDefault(node, List.of())) {
            if (hasCycle(next, adj, visiting, visited)) return true;
        }
        visiting.remove(node);
        visited.add(node);
        return false;
    }
}
