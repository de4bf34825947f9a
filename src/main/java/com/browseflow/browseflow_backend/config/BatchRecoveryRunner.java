package com.browseflow.browseflow_backend.config;

import com.browseflow.browseflow_backend.service.BatchPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Startup housekeeping: batches left running by a previous process are marked stopped,
 * and finished batches past the retention window are deleted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BatchRecoveryRunner implements ApplicationRunner {

    private final BatchPersistenceService persistence;

    @Value("${browseflow.batch.retention-days:30}")
    private int retentionDays;

    @Override
    public void run(ApplicationArguments args) {
        int interrupted = persistence.markInterruptedBatches();
        if (interrupted > 0) {
            log.warn("Marked {} batch(es) from a previous run as stopped", interrupted);
        }
        int removed = persistence.cleanupOldBatches(retentionDays);
        if (removed > 0) {
            log.info("Removed {} batch(es) older than {} days", removed, retentionDays);
        }
    }
}
