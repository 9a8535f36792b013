package com.poolintel.schedule.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.poolintel.schedule.config.ReconcilerProperties;
import com.poolintel.schedule.model.RawCourseRecord;
import com.poolintel.schedule.model.RunParameters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LocationFeedAdapterTest {

    private static final String BASE = "https://feed.test/locations/2012/swim";

    @Mock
    private UpstreamClient client;

    private ReconcilerProperties properties;
    private LocationFeedAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new ReconcilerProperties();
        ReconcilerProperties.Sources.LocationFeed feed = properties.getSources().getLocationFeed();
        feed.setBaseUrl("https://feed.test/locations");
        ReconcilerProperties.Sources.FeedLocation location = new ReconcilerProperties.Sources.FeedLocation();
        location.setLocationId("2012");
        location.setName("High Park Pool");
        feed.getLocations().add(location);
        adapter = new LocationFeedAdapter(client, new ObjectMapper(), properties);
    }

    @Test
    void slotsBecomeDatedRecords() throws IOException {
        when(client.fetchText(BASE + "/info.json")).thenReturn(Fixtures.text("info.json"));
        when(client.fetchText(BASE + "/week1.json")).thenReturn(Fixtures.text("week1.json"));

        List<RawCourseRecord> records = adapter.fetch(params(1));

        assertThat(records).hasSize(3);
        assertThat(records).extracting(RawCourseRecord::getExplicitDate).containsExactly(
                LocalDate.of(2025, 11, 3), LocalDate.of(2025, 11, 5), LocalDate.of(2025, 11, 8));

        RawCourseRecord lane = records.get(0);
        assertThat(lane.getTitle()).isEqualTo("Lane Swim");
        assertThat(lane.getStartTimeText()).isEqualTo("07:15 AM");
        assertThat(lane.getEndTimeText()).isEqualTo("08:10 AM");
        assertThat(lane.getLocationName()).isEqualTo("High Park Pool");
        assertThat(lane.getNotes()).isEqualTo("Ages 16+; Swim Drop-In");
        assertThat(lane.getSourceUrl()).isEqualTo(BASE + "/week1.json");

        assertThat(records.get(2).getNotes()).isEqualTo("Swim Drop-In");
        verify(client, never()).fetchText(BASE + "/week2.json");
    }

    @Test
    void depthIsCappedByPublishedWeeksAndFailedWeekIsIsolated() throws IOException {
        when(client.fetchText(BASE + "/info.json")).thenReturn(Fixtures.text("info.json"));
        when(client.fetchText(BASE + "/week1.json")).thenReturn(Fixtures.text("week1.json"));
        when(client.fetchText(BASE + "/week2.json")).thenThrow(new IOException("HTTP 404"));

        List<RawCourseRecord> records = adapter.fetch(params(4));

        assertThat(records).hasSize(3);
        assertThat(adapter.drainFailures()).isEqualTo(1);
        verify(client, never()).fetchText(BASE + "/week3.json");
    }

    @Test
    void unreachableLocationYieldsNothing() throws IOException {
        when(client.fetchText(anyString())).thenThrow(new IOException("connect timed out"));

        assertThat(adapter.fetch(params(2))).isEmpty();
        assertThat(adapter.drainFailures()).isEqualTo(1);
    }

    @Test
    void nullListsInOneLocationDoNotCostTheOthers() throws IOException {
        String second = "https://feed.test/locations/2013/swim";
        addLocation("2013", "Regent Park Pool");
        when(client.fetchText(BASE + "/info.json")).thenReturn("{\"weeks\":[{\"title\":\"2025-11-03\"}]}");
        when(client.fetchText(BASE + "/week1.json")).thenReturn(
                "{\"programs\":[{\"program\":\"Swim Drop-In\",\"days\":[{\"title\":\"Lane Swim\",\"times\":null}]},"
                        + "{\"program\":\"Aquafit\",\"days\":null}]}");
        when(client.fetchText(second + "/info.json")).thenReturn("{\"weeks\":[{\"title\":\"2025-11-03\"}]}");
        when(client.fetchText(second + "/week1.json")).thenReturn(
                "{\"programs\":[{\"program\":\"Swim Drop-In\",\"days\":[{\"title\":\"Lane Swim\","
                        + "\"times\":[{\"day\":\"Tuesday\",\"title\":\"06:30 AM - 07:30 AM\"}]}]}]}");

        List<RawCourseRecord> records = adapter.fetch(params(1));

        assertThat(records).singleElement().satisfies(r -> {
            assertThat(r.getLocationName()).isEqualTo("Regent Park Pool");
            assertThat(r.getExplicitDate()).isEqualTo(LocalDate.of(2025, 11, 4));
        });
        assertThat(adapter.drainFailures()).isZero();
    }

    @Test
    void malformedWeekFailsOnlyItsOwnLocation() throws IOException {
        String second = "https://feed.test/locations/2013/swim";
        addLocation("2013", "Regent Park Pool");
        when(client.fetchText(BASE + "/info.json")).thenReturn("{\"weeks\":[{\"title\":\"2025-11-03\"}]}");
        when(client.fetchText(BASE + "/week1.json")).thenReturn("{\"programs\":[null]}");
        when(client.fetchText(second + "/info.json")).thenReturn("{\"weeks\":[{\"title\":\"2025-11-03\"}]}");
        when(client.fetchText(second + "/week1.json")).thenReturn(
                "{\"programs\":[{\"program\":\"Aquafit\",\"days\":[{\"title\":null,"
                        + "\"times\":[{\"day\":\"Friday\",\"title\":\"10:00 AM - 11:00 AM\"}]}]}]}");

        List<RawCourseRecord> records = adapter.fetch(params(1));

        assertThat(records).extracting(RawCourseRecord::getTitle).containsExactly("Aquafit");
        assertThat(records.get(0).getExplicitDate()).isEqualTo(LocalDate.of(2025, 11, 7));
        assertThat(adapter.drainFailures()).isEqualTo(1);
    }

    @Test
    void timeTitleSplitsOnTheDash() {
        assertThat(LocationFeedAdapter.splitTimes("07:15 AM - 08:10 AM")).containsExactly("07:15 AM", "08:10 AM");
        assertThat(LocationFeedAdapter.splitTimes("All day")).containsExactly(null, null);
    }

    private void addLocation(String id, String name) {
        ReconcilerProperties.Sources.FeedLocation location = new ReconcilerProperties.Sources.FeedLocation();
        location.setLocationId(id);
        location.setName(name);
        properties.getSources().getLocationFeed().getLocations().add(location);
    }

    private static RunParameters params(int weeks) {
        return RunParameters.builder().weeksAhead(weeks).optimize(true).matchThreshold(0.6).build();
    }
}
