package io.docanalytics.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TopicBroadcastTest {

    @Test
    void acceptsOrdinaryTopics() {
        TopicBroadcast broadcast = new TopicBroadcast("Getting Started", "");

        assertThat(broadcast.topic()).isEqualTo("Getting Started");
        assertThat(broadcast.content()).isEmpty();
    }

    @Test
    void rejectsBlankTopic() {
        assertThatThrownBy(() -> new TopicBroadcast(" ", "x")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsTopicsWithControlCharacters() {
        assertThatThrownBy(() -> new TopicBroadcast("a\nb", "x")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsTopicsLongerThanAShortString() {
        String tooLong = "é".repeat(128);

        assertThatThrownBy(() -> new TopicBroadcast(tooLong, "x"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("255");
    }
}
