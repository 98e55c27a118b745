package com.plaetzchen.community.domain.event;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("EventHistoryView")
class EventHistoryViewTest {

    @Test
    @DisplayName("attendance rate ignores upcoming registrations")
    void attendanceRate() {
        EventHistoryView history = EventHistoryView.of(4, 2, 1);

        assertThat(history.attendanceRate()).isEqualTo(66.7);
        assertThat(history.totalEvents()).isEqualTo(7);
        assertThat(history.upcomingEvents()).isEqualTo(4);
    }

    @Test
    @DisplayName("attendance rate is 0 without attended or cancelled events")
    void noData() {
        EventHistoryView history = EventHistoryView.of(0, 0, 0);

        assertThat(history.attendanceRate()).isZero();
        assertThat(history.engagementLevel()).isEqualTo("new");
    }

    @ParameterizedTest(name = "{0} events -> {1}")
    @CsvSource({"1, low", "2, low", "3, moderate", "9, moderate", "10, high", "24, high", "25, very_high"})
    @DisplayName("engagement level follows total participations")
    void engagementLevels(long total, String expected) {
        assertThat(EventHistoryView.engagementLevel(total)).isEqualTo(expected);
    }
}
