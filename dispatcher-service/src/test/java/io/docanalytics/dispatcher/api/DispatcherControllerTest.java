package io.docanalytics.dispatcher.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.docanalytics.dispatcher.domain.DistributionResult;
import io.docanalytics.dispatcher.domain.WorkDispatcher;
import io.docanalytics.dispatcher.results.AggregatorDirectory;
import io.docanalytics.dispatcher.results.ResultCollector;
import io.docanalytics.model.DistributionOutcome;
import io.docanalytics.model.InvalidInputException;
import io.docanalytics.model.TopicMetrics;
import io.docanalytics.model.WorkerDescriptor;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class DispatcherControllerTest {

    @Mock
    WorkDispatcher dispatcher;

    @Mock
    ResultCollector collector;

    private AggregatorDirectory aggregators;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        aggregators = new AggregatorDirectory(List.of());
        mvc = MockMvcBuilders.standaloneSetup(new DispatcherController(dispatcher, aggregators, collector))
            .setControllerAdvice(new ApiErrorHandler())
            .build();
    }

    @Test
    void registersDocuments() throws Exception {
        when(dispatcher.registerItems(List.of("a.md", "b.md"))).thenReturn(2);

        mvc.perform(post("/api/documents")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"documents\":[\"a.md\",\"b.md\"]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("success"))
            .andExpect(jsonPath("$.registered").value(2));
    }

    @Test
    void rejectsMissingDocumentList() throws Exception {
        mvc.perform(post("/api/documents")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value("error"))
            .andExpect(jsonPath("$.error").value("INVALID_INPUT"));
        verifyNoInteractions(dispatcher);
    }

    @Test
    void rejectsInvalidDocumentsReportedByDispatcher() throws Exception {
        when(dispatcher.registerItems(anyList())).thenThrow(new InvalidInputException("document 1 is blank"));

        mvc.perform(post("/api/documents")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"documents\":[\" \"]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("document 1 is blank"));
    }

    @Test
    void rejectsMalformedJson() throws Exception {
        mvc.perform(post("/api/workers")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{not json"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_INPUT"));
    }

    @Test
    void registersWorkerUsingLegacyUrlKey() throws Exception {
        mvc.perform(post("/api/workers")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"worker\":{\"id\":\"w1\",\"url\":\"http://w1:8081\"}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("success"));

        ArgumentCaptor<WorkerDescriptor> captor = ArgumentCaptor.forClass(WorkerDescriptor.class);
        verify(dispatcher).registerWorker(captor.capture());
        assertThat(captor.getValue()).isEqualTo(new WorkerDescriptor("w1", "http://w1:8081"));
    }

    @Test
    void rejectsRegistrationWithoutWorker() throws Exception {
        mvc.perform(post("/api/workers")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"id\":\"w1\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Missing worker data"));
    }

    @Test
    void listsAndRemovesWorkers() throws Exception {
        when(dispatcher.workers()).thenReturn(List.of(new WorkerDescriptor("w1", "amqp:q1")));
        when(dispatcher.removeWorker("w1")).thenReturn(1);

        mvc.perform(get("/api/workers"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].id").value("w1"))
            .andExpect(jsonPath("$[0].endpoint").value("amqp:q1"));
        mvc.perform(delete("/api/workers/w1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.removed").value(1));
    }

    @Test
    void distributeReportsCompletedPass() throws Exception {
        when(dispatcher.distribute()).thenReturn(
            new DistributionResult.Completed(new DistributionOutcome(3, 1, 0, List.of("Intro"))));

        mvc.perform(post("/api/distribute"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("completed"))
            .andExpect(jsonPath("$.processed").value(3))
            .andExpect(jsonPath("$.errors").value(1))
            .andExpect(jsonPath("$.unassigned").value(0))
            .andExpect(jsonPath("$.topics[0]").value("Intro"));
    }

    @Test
    void distributeWithoutWorkersIsConflict() throws Exception {
        when(dispatcher.distribute()).thenReturn(new DistributionResult.NoWorkersAvailable(4));

        mvc.perform(post("/api/distribute"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.status").value("error"))
            .andExpect(jsonPath("$.error").value("NO_WORKERS_AVAILABLE"))
            .andExpect(jsonPath("$.message").value("No workers available"));
    }

    @Test
    void resultsReturnCollectedSnapshots() throws Exception {
        when(collector.collect()).thenReturn(Map.of("Intro", new TopicMetrics("Intro", 3, 9, 34, 1)));

        mvc.perform(get("/api/results"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("success"))
            .andExpect(jsonPath("$.results.Intro.lineCount").value(3))
            .andExpect(jsonPath("$.results.Intro.docCount").value(1));
    }

    @Test
    void registersAggregatorTopic() throws Exception {
        mvc.perform(post("/api/aggregators")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"topic\":\"Usage\"}"))
            .andExpect(status().isOk());
        mvc.perform(post("/api/aggregators")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"topic\":\"\"}"))
            .andExpect(status().isBadRequest());

        assertThat(aggregators.all()).containsExactly("Usage");
    }
}
