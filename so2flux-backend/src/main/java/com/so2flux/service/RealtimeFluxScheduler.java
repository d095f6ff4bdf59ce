package com.so2flux.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Recalculates today's flux tables at a fixed delay while new scans keep arriving.
 * Enabled with {@code flux.realtime.enabled=true}.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "flux.realtime", name = "enabled", havingValue = "true")
public class RealtimeFluxScheduler {

    private static final Logger logger = LoggerFactory.getLogger(RealtimeFluxScheduler.class);

    private final FluxService fluxService;
    private final Clock clock;

    @Autowired
    public RealtimeFluxScheduler(FluxService fluxService) {
        this(fluxService, Clock.systemUTC());
    }

    RealtimeFluxScheduler(FluxService fluxService, Clock clock) {
        this.fluxService = fluxService;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${flux.realtime.interval-ms:60000}")
    public void recalculateToday() {
        LocalDate today = LocalDate.now(clock);
        try {
            fluxService.runDailyAnalysis(today, false);
        } catch (ScanCatalogException e) {
            logger.error("Realtime flux calculation for {} failed: {}", today, e.getMessage(), e);
        }
    }
}
