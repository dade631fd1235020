package com.tradegate.access.api;

import com.tradegate.access.catalog.PermissionCatalog;
import com.tradegate.access.domain.DomainModels.ContentLevel;
import com.tradegate.access.domain.DomainModels.ContentType;
import com.tradegate.access.domain.DomainModels.EducationalContent;
import com.tradegate.access.domain.DomainModels.LearningPath;
import com.tradegate.access.domain.DomainModels.PrerequisiteEdge;
import com.tradegate.access.domain.DomainModels.TradingPermission;
import com.tradegate.access.graph.PrerequisiteGraphModels.PrerequisiteGraph;
import com.tradegate.access.graph.PrerequisiteGraphService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/catalog")
public class CatalogController {
    private final PermissionCatalog catalog;
    private final PrerequisiteGraphService graphService;

    public CatalogController(PermissionCatalog catalog, PrerequisiteGraphService graphService) {
        this.catalog = catalog;
        this.graphService = graphService;
    }

    @PostMapping("/content")
    public ResponseEntity<EducationalContent> createContent(@RequestBody EducationalContent content) {
        return ResponseEntity.ok(catalog.createContent(content));
    }

    @GetMapping("/content")
    public ResponseEntity<List<EducationalContent>> listContent(@RequestParam(required = false) ContentType type,
                                                                @RequestParam(required = false) ContentLevel level,
                                                                @RequestParam(required = false) Integer age) {
        return ResponseEntity.ok(catalog.listContent(type, level, age));
    }

    @GetMapping("/content/by-slug/{slug}")
    public ResponseEntity<EducationalContent> contentBySlug(@PathVariable String slug) {
        return ResponseEntity.ok(catalog.contentBySlug(slug));
    }

    @PostMapping("/prerequisites")
    public ResponseEntity<PrerequisiteEdge> addPrerequisite(@Valid @RequestBody PrerequisiteRequest request) {
        return ResponseEntity.ok(catalog.addPrerequisite(request.prerequisiteId(), request.contentId()));
    }

    @GetMapping("/prerequisites")
    public ResponseEntity<PrerequisiteGraph> graph() {
        return ResponseEntity.ok(graphService.readGraph());
    }

    @PostMapping("/paths")
    public ResponseEntity<LearningPath> createPath(@RequestBody LearningPath path) {
        return ResponseEntity.ok(catalog.createPath(path));
    }

    @GetMapping("/paths")
    public ResponseEntity<List<LearningPath>> listPaths(@RequestParam(required = false) Integer age) {
        return ResponseEntity.ok(catalog.listPaths(age));
    }

    @GetMapping("/paths/{pathId}")
    public ResponseEntity<LearningPath> path(@PathVariable String pathId) {
        return ResponseEntity.ok(catalog.path(pathId));
    }

    @PostMapping("/permissions")
    public ResponseEntity<TradingPermission> createPermission(@RequestBody TradingPermission permission) {
        return ResponseEntity.ok(catalog.createPermission(permission));
    }

    @GetMapping("/permissions")
    public ResponseEntity<List<TradingPermission>> listPermissions() {
        return ResponseEntity.ok(catalog.listPermissions());
    }

    public record PrerequisiteRequest(@NotBlank String prerequisiteId, @NotBlank String contentId) {}
}
