package io.docanalytics.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.docanalytics.model.InvalidInputException;
import io.docanalytics.transport.WorkerEndpoint.Transport;
import org.junit.jupiter.api.Test;

class WorkerEndpointTest {

    @Test
    void bareNameIsAnAmqpQueue() {
        assertThat(WorkerEndpoint.parse("docanalytics.worker.w1"))
            .isEqualTo(new WorkerEndpoint(Transport.AMQP, "docanalytics.worker.w1"));
    }

    @Test
    void amqpPrefixIsStripped() {
        assertThat(WorkerEndpoint.parse("amqp:worker-q").target()).isEqualTo("worker-q");
        assertThat(WorkerEndpoint.parse("amqp://worker-q").target()).isEqualTo("worker-q");
    }

    @Test
    void httpUrlsLoseTrailingSlash() {
        assertThat(WorkerEndpoint.parse("http://10.0.0.5:5555/"))
            .isEqualTo(new WorkerEndpoint(Transport.HTTP, "http://10.0.0.5:5555"));
    }

    @Test
    void legacyTcpAddressIsCalledOverHttp() {
        assertThat(WorkerEndpoint.parse("tcp://doc-processor:5555"))
            .isEqualTo(new WorkerEndpoint(Transport.HTTP, "http://doc-processor:5555"));
    }

    @Test
    void legacyTcpPortIsReplacedByWorkerHttpPort() {
        assertThat(WorkerEndpoint.parse("tcp://doc-processor:5556"))
            .isEqualTo(new WorkerEndpoint(Transport.HTTP, "http://doc-processor:5555"));
        assertThat(WorkerEndpoint.parse("tcp://doc-processor"))
            .isEqualTo(new WorkerEndpoint(Transport.HTTP, "http://doc-processor"));
    }

    @Test
    void rejectsUnusableEndpoints() {
        assertThatThrownBy(() -> WorkerEndpoint.parse(" ")).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> WorkerEndpoint.parse("amqp:")).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> WorkerEndpoint.parse("ftp://host")).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> WorkerEndpoint.parse("http://")).isInstanceOf(InvalidInputException.class);
    }
}
