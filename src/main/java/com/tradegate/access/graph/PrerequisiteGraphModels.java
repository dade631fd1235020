package com.tradegate.access.graph;

import com.tradegate.access.domain.DomainModels.PrerequisiteEdge;

import java.util.List;
import java.util.Set;

public class PrerequisiteGraphModels {
    public record PrerequisiteGraph(Set<String> contentNodes, List<PrerequisiteEdge> edges) {}

    public record ContentAvailability(String contentId, boolean available, boolean completed, List<String> missingPrerequisites) {}
}
