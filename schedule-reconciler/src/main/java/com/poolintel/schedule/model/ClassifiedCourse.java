package com.poolintel.schedule.model;

import lombok.Value;

@Value
public class ClassifiedCourse {
    RawCourseRecord record;
    ClassificationResult classification;
}
