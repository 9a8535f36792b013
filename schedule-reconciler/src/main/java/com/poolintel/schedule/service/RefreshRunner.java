package com.poolintel.schedule.service;

import com.poolintel.schedule.config.ReconcilerProperties;
import com.poolintel.schedule.output.OutputRouter;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Startup hook.
 *
 *  1. Ensure the database schema exists (skipped in CSV-only mode)
 *  2. Optionally run one refresh if RUN_ON_STARTUP=true
 *
 * How often refreshes run is left to whatever launches the service.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RefreshRunner {

    private final ScheduleRefreshService refreshService;
    private final OutputRouter outputRouter;
    private final ReconcilerProperties properties;

    @PostConstruct
    public void onStartup() {
        try {
            outputRouter.ensureSchema();
        } catch (RuntimeException e) {
            log.warn("Could not initialise ClickHouse schema: {}", e.getMessage());
        }

        if (properties.getRun().isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, running refresh");
            try {
                refreshService.refresh();
            } catch (RuntimeException e) {
                log.error("Startup refresh failed: {}", e.getMessage(), e);
            }
        } else {
            log.info("Schedule reconciler ready.");
        }
    }
}
