package com.optura.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record DependencyGraphView(
    @JsonProperty("project_id") long projectId,
    List<GraphNodeView> nodes,
    List<GraphEdgeView> edges
) {}
