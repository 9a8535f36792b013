package com.poolintel.schedule.source;

import com.poolintel.schedule.model.RawCourseRecord;
import com.poolintel.schedule.model.RunParameters;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Isolates failures per source: anything thrown by {@link #doFetch} is logged, counted
 * and turned into an empty result so other sources keep running.
 */
@Slf4j
public abstract class AbstractSourceAdapter implements SourceAdapter {

    private final AtomicInteger failures = new AtomicInteger();

    @Override
    public final List<RawCourseRecord> fetch(RunParameters parameters) {
        long start = System.currentTimeMillis();
        try {
            List<RawCourseRecord> records = doFetch(parameters);
            log.info("Source {}: {} records in {}ms", name(), records.size(), System.currentTimeMillis() - start);
            return records;
        } catch (Exception e) {
            recordFailure("fetch", e);
            return List.of();
        }
    }

    protected abstract List<RawCourseRecord> doFetch(RunParameters parameters) throws Exception;

    /** Counts a partial failure (one location, one dump) without aborting the source. */
    protected void recordFailure(String what, Exception e) {
        failures.incrementAndGet();
        log.warn("Source {} failed ({}): {}", name(), what, e.getMessage());
    }

    @Override
    public int drainFailures() {
        return failures.getAndSet(0);
    }
}
