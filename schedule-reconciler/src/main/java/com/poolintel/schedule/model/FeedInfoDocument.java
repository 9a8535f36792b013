package com.poolintel.schedule.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw DTO for a location feed's {@code swim/info.json}.
 * Each week entry's title is the week start date, e.g. "2025-11-03".
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class FeedInfoDocument {

    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<Week> weeks = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Week {
        private String title;
    }
}
