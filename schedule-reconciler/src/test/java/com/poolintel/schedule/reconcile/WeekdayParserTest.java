package com.poolintel.schedule.reconcile;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;

import static java.time.DayOfWeek.*;
import static org.assertj.core.api.Assertions.assertThat;

class WeekdayParserTest {

    @Test
    void abbreviationsAndFullNames() {
        assertThat(WeekdayParser.parse("Mon/Wed 7:00 - 8:30 AM")).containsExactly(MONDAY, WEDNESDAY);
        assertThat(WeekdayParser.parse("Saturday, sun")).containsExactly(SATURDAY, SUNDAY);
    }

    @Test
    void pluralsAndDuplicatesCollapse() {
        assertThat(WeekdayParser.parse("Tuesdays and Thursdays, Tue")).containsExactly(TUESDAY, THURSDAY);
    }

    @Test
    void spans() {
        assertThat(WeekdayParser.parse("Mon-Fri")).containsExactly(MONDAY, TUESDAY, WEDNESDAY, THURSDAY, FRIDAY);
        assertThat(WeekdayParser.parse("Monday to Wednesday")).containsExactly(MONDAY, TUESDAY, WEDNESDAY);
    }

    @Test
    void unknownTokensAreIgnored() {
        assertThat(WeekdayParser.parse("times to be announced")).isEmpty();
        assertThat(WeekdayParser.parse(null)).isEmpty();
        assertThat(WeekdayParser.parseSingle(" Friday ")).contains(DayOfWeek.FRIDAY);
        assertThat(WeekdayParser.parseSingle("Program")).isEmpty();
    }
}
