package com.poolintel.schedule.output;

import com.poolintel.schedule.model.CanonicalSession;
import com.poolintel.schedule.model.RefreshRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

@Component
@Slf4j
@RequiredArgsConstructor
public class ClickHouseSessionStore implements SessionStore {

    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring ClickHouse schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS pool_intel.facilities
            (
                facility_id         String,
                name                String,
                address             Nullable(String),
                postal_code         Nullable(String)
            )
            ENGINE = ReplacingMergeTree()
            ORDER BY facility_id
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS pool_intel.sessions
            (
                content_hash        String,
                facility_id         String,
                swim_type           LowCardinality(String),
                session_date        Date,
                start_time          String,
                end_time            String,
                program_name        Nullable(String),
                location_name       Nullable(String),
                notes               Nullable(String),
                source              LowCardinality(String),
                source_url          Nullable(String),
                match_confidence    Float64,
                created_at          DateTime DEFAULT now()
            )
            ENGINE = ReplacingMergeTree()
            PARTITION BY toYYYYMM(session_date)
            ORDER BY content_hash
            SETTINGS index_granularity = 8192
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS pool_intel.refresh_runs
            (
                run_id              String,
                started_at          DateTime,
                completed_at        Nullable(DateTime),
                status              LowCardinality(String),
                weeks_ahead         Int32,
                sessions_generated  Int32,
                sessions_inserted   Int32,
                sessions_skipped    Int32,
                quality_score       Float64,
                error_message       Nullable(String)
            )
            ENGINE = MergeTree()
            ORDER BY started_at
        """);

        log.info("ClickHouse schema ready.");
    }

    @Override
    public boolean exists(String contentHash) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT count() FROM pool_intel.sessions WHERE content_hash = ?", Long.class, contentHash);
        return count != null && count > 0;
    }

    @Override
    public void insert(CanonicalSession session) {
        insertAll(List.of(session));
    }

    /**
     * Single INSERT ... VALUES statement with all rows, so a batch lands or fails as a whole.
     * This is the most reliable approach with the ClickHouse JDBC driver.
     */
    @Override
    public void insertAll(List<CanonicalSession> sessions) {
        if (sessions.isEmpty()) return;

        StringBuilder sql = new StringBuilder("""
            INSERT INTO pool_intel.sessions
            (content_hash, facility_id, swim_type, session_date, start_time, end_time,
             program_name, location_name, notes, source, source_url, match_confidence)
            VALUES
            """);

        String rows = sessions.stream()
                .map(this::toValueRow)
                .collect(Collectors.joining(",\n"));

        sql.append(rows);
        jdbcTemplate.execute(sql.toString());
        log.debug("Inserted {} sessions", sessions.size());
    }

    private String toValueRow(CanonicalSession s) {
        return String.format("(%s,%s,%s,%s,%s,%s,%s,%s,%s,%s,%s,%s)",
                sqlStr(s.getContentHash()),
                sqlStr(s.getFacilityId()),
                sqlStr(s.getSwimType()),
                sqlStr(s.getDate()),
                sqlStr(s.getStartTime()),
                sqlStr(s.getEndTime()),
                sqlStr(s.getProgramName()),
                sqlStr(s.getLocationName()),
                sqlStr(s.getNotes()),
                sqlStr(s.getSource() != null ? s.getSource() : ""),
                sqlStr(s.getSourceUrl()),
                s.getMatchConfidence()
        );
    }

    static String sqlStr(Object val) {
        if (val == null) return "NULL";
        return "'" + val.toString().replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    public void writeRefreshRun(RefreshRun run) {
        String sql = String.format("""
            INSERT INTO pool_intel.refresh_runs
            (run_id, started_at, completed_at, status, weeks_ahead, sessions_generated,
             sessions_inserted, sessions_skipped, quality_score, error_message)
            VALUES (%s,%s,%s,%s,%d,%d,%d,%d,%s,%s)
            """,
                sqlStr(run.getRunId()),
                sqlStr(run.getStartedAt().withNano(0)),
                run.getCompletedAt() != null ? sqlStr(run.getCompletedAt().withNano(0)) : "NULL",
                sqlStr(run.getStatus()),
                run.getWeeksAhead(),
                run.getSessionsGenerated(),
                run.getSessionsInserted(),
                run.getSessionsSkipped(),
                run.getQualityScore(),
                sqlStr(run.getErrorMessage())
        );
        jdbcTemplate.execute(sql);
    }
}
