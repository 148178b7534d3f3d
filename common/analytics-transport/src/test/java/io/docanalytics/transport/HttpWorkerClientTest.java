package io.docanalytics.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.docanalytics.model.ProcessResponse;
import io.docanalytics.model.WorkerDescriptor;
import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class HttpWorkerClientTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final WorkerDescriptor WORKER = new WorkerDescriptor("w1", "http://worker-1:5555");

    private final HttpClient httpClient = mock(HttpClient.class);
    private final HttpWorkerClient client = new HttpWorkerClient(httpClient, MAPPER, Duration.ofSeconds(30));

    @Test
    void postsToProcessEndpoint() throws Exception {
        stubResponse(200, "{\"status\":\"success\",\"topics\":[\"A\",\"B\"]}");

        ProcessResponse response = client.process(WORKER, "/documents/a.md");

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.topics()).containsExactly("A", "B");
        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertThat(request.getValue().uri().toString()).isEqualTo("http://worker-1:5555/process");
        assertThat(request.getValue().method()).isEqualTo("POST");
        assertThat(request.getValue().timeout()).contains(Duration.ofSeconds(30));
    }

    @Test
    void nonSuccessStatusIsRejected() throws Exception {
        stubResponse(500, "boom");

        assertThatThrownBy(() -> client.process(WORKER, "a.md"))
            .isInstanceOfSatisfying(WorkerCallException.class, e -> {
                assertThat(e.reason()).isEqualTo(WorkerCallException.Reason.REJECTED);
                assertThat(e.getMessage()).isEqualTo("HTTP 500 - boom");
            });
    }

    @Test
    void timeoutIsReportedAsSuch() throws Exception {
        doThrow(new HttpTimeoutException("request timed out")).when(httpClient).send(any(), any());

        assertThatThrownBy(() -> client.process(WORKER, "a.md"))
            .isInstanceOfSatisfying(WorkerCallException.class,
                e -> assertThat(e.reason()).isEqualTo(WorkerCallException.Reason.TIMEOUT));
    }

    @Test
    void connectionRefusedIsATransportError() throws Exception {
        doThrow(new ConnectException("refused")).when(httpClient).send(any(), any());

        assertThatThrownBy(() -> client.process(WORKER, "a.md"))
            .isInstanceOfSatisfying(WorkerCallException.class,
                e -> assertThat(e.reason()).isEqualTo(WorkerCallException.Reason.TRANSPORT));
    }

    @Test
    void unreadableBodyIsMalformed() throws Exception {
        stubResponse(200, "<html>");

        assertThatThrownBy(() -> client.process(WORKER, "a.md"))
            .isInstanceOfSatisfying(WorkerCallException.class,
                e -> assertThat(e.reason()).isEqualTo(WorkerCallException.Reason.MALFORMED_REPLY));
    }

    @SuppressWarnings("unchecked")
    private void stubResponse(int status, String body) throws Exception {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        doReturn(response).when(httpClient).send(any(), any());
    }
}
