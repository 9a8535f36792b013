package com.poolintel.schedule.model;

import java.time.LocalTime;

/**
 * A parsed start/end pair. Parsers only ever emit ranges with end after start.
 */
public record TimeRange(LocalTime start, LocalTime end) {}
