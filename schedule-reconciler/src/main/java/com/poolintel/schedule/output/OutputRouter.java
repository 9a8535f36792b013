package com.poolintel.schedule.output;

import com.poolintel.schedule.config.ReconcilerProperties;
import com.poolintel.schedule.config.ReconcilerProperties.Output.OutputMode;
import com.poolintel.schedule.model.CanonicalSession;
import com.poolintel.schedule.model.RefreshRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * Routes accepted sessions to the configured sink(s).
 * Supports DATABASE, CSV, or BOTH modes.
 */
@Component
@Slf4j
public class OutputRouter {

    private final ClickHouseSessionStore sessionStore;
    private final SessionCsvWriter csvWriter;
    private final ReconcilerProperties properties;
    private final SessionUpserter upserter;

    public OutputRouter(ClickHouseSessionStore sessionStore, SessionCsvWriter csvWriter,
                        ReconcilerProperties properties) {
        this.sessionStore = sessionStore;
        this.csvWriter = csvWriter;
        this.properties = properties;
        this.upserter = new SessionUpserter(sessionStore);
    }

    public UpsertOutcome write(List<CanonicalSession> sessions, LocalDate runDate) {
        OutputMode mode = properties.getOutput().getMode();

        return switch (mode) {
            case DATABASE -> upserter.upsert(sessions);
            case CSV -> {
                csvWriter.write(sessions, runDate);
                yield new UpsertOutcome(sessions, 0, 0);
            }
            case BOTH -> {
                UpsertOutcome outcome = upserter.upsert(sessions);
                csvWriter.write(sessions, runDate);
                yield outcome;
            }
        };
    }

    public boolean usesDatabase() {
        return properties.getOutput().getMode() != OutputMode.CSV;
    }

    public void ensureSchema() {
        if (usesDatabase()) {
            sessionStore.ensureSchema();
        }
    }

    public void writeRefreshRun(RefreshRun run) {
        try {
            if (usesDatabase()) {
                sessionStore.writeRefreshRun(run);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to write refresh run metadata: {}", e.getMessage());
        }
    }
}
