package com.visaflow.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Reusable workflow template owned by a project.
 * Versioned by replacement: a new version never mutates running instances.
 * 
 * Invariants:
 * - exactly one node of type start is expected (the first one found is used)
 * - at least one status exists; the default one (or the first) seeds new instances
 * - edge sources and targets reference existing nodes
 */
public record WorkflowDefinition(
    // Identity
    String id,
    String name,
    String description,
    int version,
    String projectId,
    boolean active,
    
    // Graph structure
    List<WorkflowStatus> statuses,
    List<WorkflowNode> nodes,
    List<WorkflowEdge> edges,
    WorkflowSettings settings,
    
    // Metadata
    String createdBy,
    Instant createdAt,
    Instant updatedAt
) {
    public WorkflowDefinition {
        statuses = statuses == null ? List.of() : List.copyOf(statuses);
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        if (settings == null) {
            settings = WorkflowSettings.defaults();
        }
    }

    /**
     * Get the start node (the first node of type start).
     */
    public Optional<WorkflowNode> findStartNode() {
        return nodes.stream()
            .filter(n -> n.type() == NodeType.START)
            .findFirst();
    }

    /**
     * Get a node by ID.
     */
    public Optional<WorkflowNode> findNode(String nodeId) {
        return nodes.stream()
            .filter(n -> n.id().equals(nodeId))
            .findFirst();
    }

    /**
     * Get an edge by ID.
     */
    public Optional<WorkflowEdge> findEdge(String edgeId) {
        return edges.stream()
            .filter(e -> e.id().equals(edgeId))
            .findFirst();
    }

    /**
     * Get the edges leaving a node, in definition order.
     */
    public List<WorkflowEdge> outgoingEdges(String nodeId) {
        return edges.stream()
            .filter(e -> e.source().equals(nodeId))
            .toList();
    }

    /**
     * Get the status new instances start with: the default one, else the first.
     */
    public Optional<WorkflowStatus> initialStatus() {
        return statuses.stream()
            .filter(WorkflowStatus::defaultStatus)
            .findFirst()
            .or(() -> statuses.stream().findFirst());
    }

    /**
     * Get a status by ID.
     */
    public Optional<WorkflowStatus> findStatus(String statusId) {
        return statuses.stream()
            .filter(s -> s.id().equals(statusId))
            .findFirst();
    }

    /**
     * Builder for WorkflowDefinition.
     */
    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id).name(name).description(description).version(version)
            .projectId(projectId).active(active).statuses(statuses)
            .nodes(nodes).edges(edges).settings(settings)
            .createdBy(createdBy).createdAt(createdAt).updatedAt(updatedAt);
    }

    public static class Builder {
        private String id;
        private String name;
        private String description;
        private int version = 1;
        private String projectId;
        private boolean active = true;
        private List<WorkflowStatus> statuses = List.of();
        private List<WorkflowNode> nodes = List.of();
        private List<WorkflowEdge> edges = List.of();
        private WorkflowSettings settings = WorkflowSettings.defaults();
        private String createdBy;
        private Instant createdAt = Instant.now();
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder version(int version) {
            this.version = version;
            return this;
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder statuses(List<WorkflowStatus> statuses) {
            this.statuses = statuses;
            return this;
        }

        public Builder nodes(List<WorkflowNode> nodes) {
            this.nodes = nodes;
            return this;
        }

        public Builder edges(List<WorkflowEdge> edges) {
            this.edges = edges;
            return this;
        }

        public Builder settings(WorkflowSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(
                id, name, description, version, projectId, active,
                statuses, nodes, edges, settings,
                createdBy, createdAt, updatedAt != null ? updatedAt : createdAt
            );
        }
    }
}
