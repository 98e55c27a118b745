package com.plaetzchen.community.domain.forum;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MentionParser")
class MentionParserTest {

    @Test
    @DisplayName("finds mentions in order of first appearance without duplicates")
    void distinctInOrder() {
        assertThat(MentionParser.parse("@anna and @Jörg_2, also @anna again"))
                .containsExactly("anna", "Jörg_2");
    }

    @Test
    @DisplayName("drops trailing dots so a sentence can end with a mention")
    void trailingDots() {
        assertThat(MentionParser.parse("Thanks @max.mueller.")).containsExactly("max.mueller");
    }

    @Test
    @DisplayName("ignores email addresses and single characters")
    void ignoresEmailsAndShortNames() {
        assertThat(MentionParser.parse("mail me at kim@example.org or ask @x")).isEmpty();
    }

    @Test
    @DisplayName("handles missing content")
    void nullContent() {
        assertThat(MentionParser.parse(null)).isEmpty();
    }
}
