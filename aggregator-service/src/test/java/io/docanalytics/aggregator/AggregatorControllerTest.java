package io.docanalytics.aggregator;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class AggregatorControllerTest {

    private TopicAggregatorRegistry registry;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        registry = new TopicAggregatorRegistry(List.of("Intro", "Usage"));
        mvc = MockMvcBuilders.standaloneSetup(new AggregatorController(registry)).build();
    }

    @Test
    void listsTopics() throws Exception {
        mvc.perform(get("/api/topics"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0]").value("Intro"))
            .andExpect(jsonPath("$[1]").value("Usage"));
    }

    @Test
    void returnsSnapshotForTopic() throws Exception {
        registry.find("Intro").orElseThrow().processContent("Line 1\nLine 2\nLine 3 with more words");

        mvc.perform(get("/api/topics/Intro/metrics"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.topic").value("Intro"))
            .andExpect(jsonPath("$.lineCount").value(3))
            .andExpect(jsonPath("$.wordCount").value(9))
            .andExpect(jsonPath("$.charCount").value(34))
            .andExpect(jsonPath("$.docCount").value(1));
    }

    @Test
    void unknownTopicIsNotFound() throws Exception {
        mvc.perform(get("/api/topics/FAQ/metrics"))
            .andExpect(status().isNotFound());
    }
}
