package com.poolintel.schedule.model;

public record HourCount(int hour, int count) {}
