package com.visaflow.api.config;

import com.visaflow.core.model.RetryPolicy;
import com.visaflow.engine.config.EngineSettings;
import com.visaflow.watcher.WatcherSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Service configuration bound from the {@code visaflow.*} keys of application.yml.
 */
@ConfigurationProperties(prefix = "visaflow")
public record VisaflowProperties(
    @DefaultValue Engine engine,
    @DefaultValue Watcher watcher,
    @DefaultValue Storage storage,
    @DefaultValue Webhook webhook
) {

    /**
     * @param maxTraversalDepth    hops allowed per trigger
     * @param collaboratorTimeout  deadline of each store and collaborator call
     * @param commitMaxAttempts    attempts per commit write
     * @param commitInitialBackoff first retry delay of a commit write
     */
    public record Engine(
        @DefaultValue("100") int maxTraversalDepth,
        @DefaultValue("30s") Duration collaboratorTimeout,
        @DefaultValue("3") int commitMaxAttempts,
        @DefaultValue("200ms") Duration commitInitialBackoff
    ) {
        public EngineSettings toSettings() {
            RetryPolicy commitPolicy = RetryPolicy.builder()
                .maxAttempts(commitMaxAttempts)
                .initialBackoff(commitInitialBackoff)
                .build();
            return new EngineSettings(maxTraversalDepth, collaboratorTimeout, commitPolicy);
        }
    }

    /**
     * @param autoStart            start watchers for active auto-start definitions on boot
     * @param defaultPollInterval  poll interval of watchers that do not set one
     * @param maxConsecutiveErrors failed polls after which a watcher stops
     * @param pollThreads          threads running poll cycles
     */
    public record Watcher(
        @DefaultValue("false") boolean autoStart,
        @DefaultValue("30s") Duration defaultPollInterval,
        @DefaultValue("10") int maxConsecutiveErrors,
        @DefaultValue("4") int pollThreads
    ) {
        public WatcherSettings toSettings() {
            return new WatcherSettings(defaultPollInterval, maxConsecutiveErrors, pollThreads);
        }
    }

    /**
     * @param root directory whose sub-directories are the folders of the local file service
     */
    public record Storage(
        @DefaultValue("./data/folders") Path root
    ) {}

    /**
     * @param timeout connect and request timeout of webhook calls
     */
    public record Webhook(
        @DefaultValue("10s") Duration timeout
    ) {}
}
