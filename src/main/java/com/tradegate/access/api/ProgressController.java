package com.tradegate.access.api;

import com.tradegate.access.domain.DomainModels.UserProgress;
import com.tradegate.access.eligibility.EligibilityModels.PathProgress;
import com.tradegate.access.eligibility.EligibilityService;
import com.tradegate.access.graph.PrerequisiteGraphModels.ContentAvailability;
import com.tradegate.access.graph.PrerequisiteGraphService;
import com.tradegate.access.progress.ProgressModels.ProgressDelta;
import com.tradegate.access.progress.ProgressModels.ProgressUpdate;
import com.tradegate.access.progress.ProgressTracker;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Progress writes. Permissions that depend on completed content are re-evaluated
 * asynchronously, so a grant becomes visible within {@code access.reevaluation.fixed-delay-ms}
 * of the completion, not in this response.
 */
@RestController
@RequestMapping("/api/progress")
public class ProgressController {
    private final ProgressTracker tracker;
    private final EligibilityService eligibility;
    private final PrerequisiteGraphService graphService;

    public ProgressController(ProgressTracker tracker, EligibilityService eligibility, PrerequisiteGraphService graphService) {
        this.tracker = tracker;
        this.eligibility = eligibility;
        this.graphService = graphService;
    }

    @PostMapping
    public ResponseEntity<ProgressUpdate> update(@Valid @RequestBody ProgressRequest request) {
        return ResponseEntity.ok(tracker.updateProgress(request.userId(), request.contentId(),
                new ProgressDelta(request.completed(), request.score(), request.timeSpentSeconds(), request.attempted())));
    }

    @GetMapping("/{userId}")
    public ResponseEntity<List<UserProgress>> progress(@PathVariable String userId) {
        return ResponseEntity.ok(tracker.progress(userId));
    }

    @GetMapping("/{userId}/paths/{pathId}")
    public ResponseEntity<PathProgress> pathProgress(@PathVariable String userId, @PathVariable String pathId) {
        return ResponseEntity.ok(eligibility.pathProgress(userId, pathId));
    }

    @GetMapping("/{userId}/content/{contentId}/explain")
    public ResponseEntity<ContentAvailability> explain(@PathVariable String userId, @PathVariable String contentId) {
        return ResponseEntity.ok(graphService.explainContent(userId, contentId));
    }

    @GetMapping("/{userId}/available")
    public ResponseEntity<List<String>> available(@PathVariable String userId) {
        return ResponseEntity.ok(graphService.availableContent(userId));
    }

    public record ProgressRequest(@NotBlank String userId,
                                  @NotBlank String contentId,
                                  boolean completed,
                                  Double score,
                                  @PositiveOrZero long timeSpentSeconds,
                                  boolean attempted) {}
}
