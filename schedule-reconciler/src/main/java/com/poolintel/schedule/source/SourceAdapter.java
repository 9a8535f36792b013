package com.poolintel.schedule.source;

import com.poolintel.schedule.model.RawCourseRecord;
import com.poolintel.schedule.model.RunParameters;

import java.util.List;

/**
 * One upstream source. Implementations never throw from {@link #fetch}: failures are logged,
 * counted and reported through {@link #drainFailures()}.
 */
public interface SourceAdapter {

    /** Short tag used in logs and as {@code RawCourseRecord.source}. */
    String name();

    boolean isEnabled();

    List<RawCourseRecord> fetch(RunParameters parameters);

    /** Failures recorded since the last call, resetting the counter. */
    int drainFailures();
}
