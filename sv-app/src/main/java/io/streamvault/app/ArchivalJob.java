package io.streamvault.app;

import io.streamvault.store.archive.ArchivalService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Runs archival on {@code streamvault.archival.cron}; off unless an operator sets it. */
@Component
public class ArchivalJob {
    private static final Logger log = LoggerFactory.getLogger(ArchivalJob.class);

    private final ArchivalService archival;
    private final StreamVaultProperties properties;

    public ArchivalJob(ArchivalService archival, StreamVaultProperties properties) {
        this.archival = archival;
        this.properties = properties;
    }

    @Scheduled(cron = "${streamvault.archival.cron:-}")
    public void run() {
        var retention = properties.archival().retention();
        log.info("Archival run started, retention {}", retention);
        archival.archive(retention);
    }
}
