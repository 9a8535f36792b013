package com.poolintel.schedule.output;

import com.poolintel.schedule.model.Facility;

import java.util.List;

/** Read-only registry of known facilities, snapshotted once per run. */
public interface FacilityDirectory {

    List<Facility> snapshot();
}
