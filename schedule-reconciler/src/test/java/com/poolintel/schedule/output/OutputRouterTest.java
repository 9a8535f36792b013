package com.poolintel.schedule.output;

import com.poolintel.schedule.config.ReconcilerProperties;
import com.poolintel.schedule.config.ReconcilerProperties.Output.OutputMode;
import com.poolintel.schedule.model.CanonicalSession;
import com.poolintel.schedule.model.RefreshRun;
import com.poolintel.schedule.model.SwimType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class OutputRouterTest {

    private static final LocalDate RUN_DATE = LocalDate.of(2025, 11, 3);

    @Mock
    private ClickHouseSessionStore store;

    @Mock
    private SessionCsvWriter csvWriter;

    private ReconcilerProperties properties;
    private OutputRouter router;

    @BeforeEach
    void setUp() {
        properties = new ReconcilerProperties();
        router = new OutputRouter(store, csvWriter, properties);
    }

    @Test
    void csvModeNeverTouchesTheDatabase() {
        properties.getOutput().setMode(OutputMode.CSV);
        List<CanonicalSession> sessions = List.of(session());

        UpsertOutcome outcome = router.write(sessions, RUN_DATE);
        router.ensureSchema();

        assertThat(outcome.inserted()).isEqualTo(1);
        verify(csvWriter).write(sessions, RUN_DATE);
        verifyNoInteractions(store);
    }

    @Test
    void bothModeUpsertsAndExports() {
        properties.getOutput().setMode(OutputMode.BOTH);
        List<CanonicalSession> sessions = List.of(session());

        UpsertOutcome outcome = router.write(sessions, RUN_DATE);

        assertThat(outcome.inserted()).isEqualTo(1);
        verify(store).insertAll(sessions);
        verify(csvWriter).write(sessions, RUN_DATE);
    }

    @Test
    void databaseModeSkipsCsv() {
        router.write(List.of(session()), RUN_DATE);

        verify(csvWriter, never()).write(any(), any());
    }

    @Test
    void refreshRunFailureIsNotFatal() {
        RefreshRun run = RefreshRun.builder().runId("r").status("SUCCESS").build();
        doThrow(new IllegalStateException("down")).when(store).writeRefreshRun(run);

        assertThatCode(() -> router.writeRefreshRun(run)).doesNotThrowAnyException();
    }

    private static CanonicalSession session() {
        return CanonicalSession.builder()
                .facilityId("F-1").contentHash("h1").swimType(SwimType.LANE_SWIM)
                .date(RUN_DATE).startTime(LocalTime.of(7, 0)).endTime(LocalTime.of(8, 0))
                .build();
    }
}
