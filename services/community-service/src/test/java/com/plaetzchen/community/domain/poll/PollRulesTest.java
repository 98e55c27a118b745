package com.plaetzchen.community.domain.poll;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.plaetzchen.community.domain.common.BusinessRuleException;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("PollRules")
class PollRulesTest {

    @Nested
    @DisplayName("suggestedDuration")
    class SuggestedDuration {

        @Test
        @DisplayName("gives admin polls a week")
        void adminPoll() {
            assertThat(PollRules.suggestedDuration(PollType.ADMIN, 10)).isEqualTo(Duration.ofHours(168));
        }

        @Test
        @DisplayName("gives large thread audiences three days")
        void largeThread() {
            assertThat(PollRules.suggestedDuration(PollType.THREAD, 51)).isEqualTo(Duration.ofHours(72));
        }

        @Test
        @DisplayName("gives other thread polls two days")
        void smallThread() {
            assertThat(PollRules.suggestedDuration(PollType.THREAD, 50)).isEqualTo(Duration.ofHours(48));
            assertThat(PollRules.suggestedDuration(PollType.THREAD, null)).isEqualTo(Duration.ofHours(48));
        }
    }

    @Test
    @DisplayName("accepts between 2 and 10 options")
    void optionCount() {
        assertThatCode(() -> PollRules.checkOptionCount(List.of("a", "b"))).doesNotThrowAnyException();
        assertThatCode(() -> PollRules.checkOptionCount(Collections.nCopies(10, "x")))
                .doesNotThrowAnyException();

        assertThatThrownBy(() -> PollRules.checkOptionCount(List.of("only")))
                .isInstanceOf(BusinessRuleException.class)
                .hasMessage("Poll must have between 2 and 10 options");
        assertThatThrownBy(() -> PollRules.checkOptionCount(Collections.nCopies(11, "x")))
                .isInstanceOf(BusinessRuleException.class);
        assertThatThrownBy(() -> PollRules.checkOptionCount(null)).isInstanceOf(BusinessRuleException.class);
    }

    @Test
    @DisplayName("weighs created polls double for engagement")
    void engagement() {
        assertThat(PollRules.engagementLevel(0, 0)).isEqualTo("inactive");
        assertThat(PollRules.engagementLevel(2, 0)).isEqualTo("low");
        assertThat(PollRules.engagementLevel(2, 1)).isEqualTo("moderate");
        assertThat(PollRules.engagementLevel(5, 5)).isEqualTo("high");
    }
}
