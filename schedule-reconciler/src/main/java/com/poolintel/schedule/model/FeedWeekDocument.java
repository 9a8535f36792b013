package com.poolintel.schedule.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw DTO for a location feed's {@code swim/week{n}.json}.
 * Kept separate from the domain model to isolate feed coupling.
 *
 * programs[].days[] is a titled section ("Lane Swim", "Leisure Swim"), and each of its
 * time slots names its own weekday.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class FeedWeekDocument {

    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<Program> programs = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Program {
        private String program;
        @JsonSetter(nulls = Nulls.AS_EMPTY)
        private List<Section> days = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Section {
        private String title;
        private String age;
        @JsonSetter(nulls = Nulls.AS_EMPTY)
        private List<TimeSlot> times = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TimeSlot {
        /** Weekday name, e.g. "Monday" */
        private String day;

        /** e.g. "07:15 AM - 08:10 AM" */
        private String title;
    }
}
