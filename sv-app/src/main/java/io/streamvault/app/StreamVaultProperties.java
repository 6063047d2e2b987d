package io.streamvault.app;

import io.streamvault.projection.UnmappedEventPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/** {@code streamvault.*} settings. Anything left out of the configuration takes the default shown here. */
@ConfigurationProperties("streamvault")
public record StreamVaultProperties(Projections projections, Archival archival, Feed feed) {

    public StreamVaultProperties {
        projections = projections == null ? new Projections(null, null, 0) : projections;
        archival = archival == null ? new Archival(null, null) : archival;
        feed = feed == null ? new Feed(0) : feed;
    }

    public enum RefreshMode { SYNC, ASYNC }

    /**
     * @param unmappedPolicy what an event type missing from the routing table refreshes
     * @param refreshMode    {@code sync} refreshes on the appending thread, {@code async} on a worker pool
     * @param workerThreads  size of that pool
     */
    public record Projections(UnmappedEventPolicy unmappedPolicy, RefreshMode refreshMode, int workerThreads) {
        public Projections {
            unmappedPolicy = unmappedPolicy == null ? UnmappedEventPolicy.REFRESH_ALL : unmappedPolicy;
            refreshMode = refreshMode == null ? RefreshMode.ASYNC : refreshMode;
            workerThreads = workerThreads <= 0 ? 2 : workerThreads;
        }
    }

    /**
     * @param cron      Spring cron expression for the archival job, {@code -} disables it
     * @param retention age after which events leave the hot log
     */
    public record Archival(String cron, Duration retention) {
        public Archival {
            cron = cron == null || cron.isBlank() ? "-" : cron;
            retention = retention == null ? Duration.ofDays(365) : retention;
        }
    }

    public record Feed(int batchSize) {
        public Feed {
            batchSize = batchSize <= 0 ? 256 : batchSize;
        }
    }
}
