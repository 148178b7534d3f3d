package io.docanalytics.worker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.docanalytics.model.ProcessRequest;
import io.docanalytics.model.ProcessResponse;
import io.docanalytics.transport.JsonMessageCodec;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;

@ExtendWith(MockitoExtension.class)
class WorkerRequestListenerTest {

  @Mock
  DocumentWorker worker;

  private final JsonMessageCodec codec = new JsonMessageCodec(new ObjectMapper());

  @Test
  void repliesWithWorkerResultAndKeepsCorrelation() throws Exception {
    when(worker.process(ProcessRequest.process("doc.md")))
        .thenReturn(ProcessResponse.success("doc.md", List.of("Alpha")));
    Message request = json("{\"action\":\"process\",\"item\":\"doc.md\"}");
    request.getMessageProperties().setCorrelationId("corr-1");

    Message reply = new WorkerRequestListener(worker, codec).onRequest(request);

    assertThat(reply.getMessageProperties().getCorrelationId()).isEqualTo("corr-1");
    ProcessResponse response = codec.fromMessage(reply, ProcessResponse.class);
    assertThat(response.isSuccess()).isTrue();
    assertThat(response.topics()).containsExactly("Alpha");
  }

  @Test
  void acceptsLegacyFilepathKey() throws Exception {
    when(worker.process(ProcessRequest.process("/docs/a.md")))
        .thenReturn(ProcessResponse.success("/docs/a.md", List.of()));

    Message reply = new WorkerRequestListener(worker, codec)
        .onRequest(json("{\"action\":\"process\",\"filepath\":\"/docs/a.md\"}"));

    assertThat(codec.fromMessage(reply, ProcessResponse.class).isSuccess()).isTrue();
  }

  @Test
  void unreadableRequestGetsErrorReply() throws Exception {
    Message reply = new WorkerRequestListener(worker, codec).onRequest(json("not json"));

    ProcessResponse response = codec.fromMessage(reply, ProcessResponse.class);
    assertThat(response.status()).isEqualTo("error");
    assertThat(response.message()).isEqualTo("Invalid request");
    verifyNoInteractions(worker);
  }

  private static Message json(String body) {
    MessageProperties props = new MessageProperties();
    props.setContentType(MessageProperties.CONTENT_TYPE_JSON);
    return new Message(body.getBytes(StandardCharsets.UTF_8), props);
  }
}
