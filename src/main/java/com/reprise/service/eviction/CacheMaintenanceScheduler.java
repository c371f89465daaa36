package com.reprise.service.eviction;

import com.reprise.config.RepriseProperties;
import com.reprise.model.OptimizationResult;
import com.reprise.model.WarmupReport;
import com.reprise.service.warming.CacheWarmer;
import com.reprise.service.warming.WarmingQuerySource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background maintenance: expiry sweep plus capacity enforcement, and scheduled warming.
 * A run that is still in progress when the next one fires makes the next one a no-op.
 */
@Slf4j
public class CacheMaintenanceScheduler {

    private final EvictionEngine evictionEngine;
    private final CacheWarmer cacheWarmer;
    private final WarmingQuerySource warmingQuerySource;
    private final RepriseProperties.WarmingConfig warmingConfig;

    private final AtomicBoolean evictionRunning = new AtomicBoolean(false);
    private final AtomicBoolean warmingRunning = new AtomicBoolean(false);

    public CacheMaintenanceScheduler(EvictionEngine evictionEngine, CacheWarmer cacheWarmer,
                                     WarmingQuerySource warmingQuerySource,
                                     RepriseProperties.WarmingConfig warmingConfig) {
        this.evictionEngine = evictionEngine;
        this.cacheWarmer = cacheWarmer;
        this.warmingQuerySource = warmingQuerySource;
        this.warmingConfig = warmingConfig;
    }

    @Scheduled(fixedDelayString = "${reprise.cache.eviction-interval:PT5M}",
            initialDelayString = "${reprise.cache.eviction-interval:PT5M}")
    public void runEviction() {
        if (!evictionRunning.compareAndSet(false, true)) {
            log.debug("Eviction cycle still running, skipping");
            return;
        }
        try {
            OptimizationResult expired = evictionEngine.sweepExpired();
            OptimizationResult capacity = evictionEngine.enforceCapacity();
            log.debug("Eviction cycle done: expired={}, capacity={}",
                    expired.getEntriesEvicted(), capacity.getEntriesEvicted());
        } catch (RuntimeException e) {
            log.error("Eviction cycle failed", e);
        } finally {
            evictionRunning.set(false);
        }
    }

    @Scheduled(fixedDelayString = "${reprise.warming.interval:PT1H}",
            initialDelayString = "${reprise.warming.interval:PT1H}")
    public void runWarming() {
        if (!warmingConfig.isScheduledEnabled()) {
            return;
        }
        if (!warmingRunning.compareAndSet(false, true)) {
            log.debug("Warming run still in progress, skipping");
            return;
        }
        try {
            WarmupReport report = cacheWarmer.warmup(warmingQuerySource);
            if (!report.getUnresolved().isEmpty()) {
                log.info("{} warming queries have no expected response", report.getUnresolved().size());
            }
        } catch (RuntimeException e) {
            log.error("Scheduled warming failed", e);
        } finally {
            warmingRunning.set(false);
        }
    }
}
