package io.docanalytics.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.docanalytics.model.ProcessResponse;
import io.docanalytics.model.WorkerDescriptor;
import java.util.List;
import org.junit.jupiter.api.Test;

class RoutingWorkerClientTest {

    private final WorkerClient amqp = mock(WorkerClient.class);
    private final WorkerClient http = mock(WorkerClient.class);
    private final RoutingWorkerClient client = new RoutingWorkerClient(amqp, http);

    @Test
    void queueEndpointsGoOverAmqp() throws Exception {
        WorkerDescriptor worker = new WorkerDescriptor("w1", "docanalytics.worker.w1");
        when(amqp.process(worker, "a.md")).thenReturn(ProcessResponse.success("a.md", List.of()));

        assertThat(client.process(worker, "a.md").isSuccess()).isTrue();
        verifyNoInteractions(http);
    }

    @Test
    void urlEndpointsGoOverHttp() throws Exception {
        WorkerDescriptor worker = new WorkerDescriptor("w2", "http://w2:5555");
        when(http.process(worker, "b.md")).thenReturn(ProcessResponse.error("nope"));

        assertThat(client.process(worker, "b.md").isSuccess()).isFalse();
        verify(http).process(worker, "b.md");
        verifyNoInteractions(amqp);
    }
}
