package com.visaflow.engine.config;

import com.visaflow.core.model.RetryPolicy;

import java.time.Duration;

/**
 * Tunables of the workflow engine.
 *
 * @param maxTraversalDepth   maximum number of hops a single trigger may make
 * @param collaboratorTimeout deadline applied to every store and collaborator call
 * @param commitRetryPolicy   retries applied to the commit writes of a transition sequence
 */
public record EngineSettings(
    int maxTraversalDepth,
    Duration collaboratorTimeout,
    RetryPolicy commitRetryPolicy
) {
    public static final int DEFAULT_MAX_TRAVERSAL_DEPTH = 100;
    public static final Duration DEFAULT_COLLABORATOR_TIMEOUT = Duration.ofSeconds(30);

    public EngineSettings {
        if (maxTraversalDepth < 1) {
            throw new IllegalArgumentException("maxTraversalDepth must be >= 1");
        }
        if (collaboratorTimeout == null || collaboratorTimeout.isNegative() || collaboratorTimeout.isZero()) {
            throw new IllegalArgumentException("collaboratorTimeout must be positive");
        }
        if (commitRetryPolicy == null) {
            commitRetryPolicy = RetryPolicy.defaultPolicy();
        }
    }

    public static EngineSettings defaults() {
        return new EngineSettings(DEFAULT_MAX_TRAVERSAL_DEPTH, DEFAULT_COLLABORATOR_TIMEOUT, RetryPolicy.defaultPolicy());
    }

    public EngineSettings withCommitRetryPolicy(RetryPolicy commitRetryPolicy) {
        return new EngineSettings(maxTraversalDepth, collaboratorTimeout, commitRetryPolicy);
    }

    public EngineSettings withMaxTraversalDepth(int maxTraversalDepth) {
        return new EngineSettings(maxTraversalDepth, collaboratorTimeout, commitRetryPolicy);
    }

    public EngineSettings withCollaboratorTimeout(Duration collaboratorTimeout) {
        return new EngineSettings(maxTraversalDepth, collaboratorTimeout, commitRetryPolicy);
    }
}
