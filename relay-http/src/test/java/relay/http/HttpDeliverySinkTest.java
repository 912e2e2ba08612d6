package relay.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import relay.DeliveryResult;
import relay.model.ChannelEvent;
import relay.model.DeliveryTarget;
import relay.model.FormattingEntity;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpDeliverySinkTest {

  private static final DeliveryTarget TARGET =
      new DeliveryTarget(7, 1001, "news", "https://t.me/news");
  private static final Instant DATE = Instant.parse("2024-03-01T10:15:30Z");

  private final ObjectMapper mapper = RelayJson.newObjectMapper();
  private HttpServer server;
  private final AtomicReference<Captured> captured = new AtomicReference<>();
  private volatile int status = 200;
  private volatile String responseBody = "{\"ok\":true,\"processed\":2,\"pending\":0}";

  record Captured(String method, String path, String auth, String contentType, String batchId, byte[] body) {
  }

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/", exchange -> {
      byte[] body = exchange.getRequestBody().readAllBytes();
      captured.set(new Captured(
          exchange.getRequestMethod(),
          exchange.getRequestURI().getPath(),
          exchange.getRequestHeaders().getFirst("Authorization"),
          exchange.getRequestHeaders().getFirst("Content-Type"),
          exchange.getRequestHeaders().getFirst(HttpDeliverySink.BATCH_ID_HEADER),
          body));
      byte[] out = responseBody.getBytes(StandardCharsets.UTF_8);
      exchange.getResponseHeaders().add("Content-Type", "application/json");
      exchange.sendResponseHeaders(status, out.length == 0 ? -1 : out.length);
      if (out.length > 0) {
        try (OutputStream os = exchange.getResponseBody()) {
          os.write(out);
        }
      }
      exchange.close();
    });
    server.start();
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  private String baseUrl() {
    return "http://127.0.0.1:" + server.getAddress().getPort();
  }

  private HttpDeliverySink sink() {
    return HttpDeliverySink.builder()
        .baseUrl(baseUrl())
        .token("secret")
        .timeout(Duration.ofSeconds(5))
        .build();
  }

  private static List<ChannelEvent> twoEvents() {
    return List.of(
        ChannelEvent.builder(101, DATE)
            .message("first")
            .views(10)
            .forwards(1)
            .editDate(DATE.plusSeconds(60))
            .postAuthor("editor")
            .media("MessageMediaPhoto")
            .entities(List.of(new FormattingEntity("MessageEntityBold", 0, 5)))
            .replyTo(99L)
            .build(),
        ChannelEvent.builder(102, DATE.plusSeconds(5)).build());
  }

  // ── Builder validation ──────────────────────────────────────────

  @Test
  void builder_missingToken_throwsNPE() {
    assertThrows(NullPointerException.class, () -> HttpDeliverySink.builder().build());
  }

  @Test
  void builder_blankToken_throwsIAE() {
    assertThrows(IllegalArgumentException.class, () ->
        HttpDeliverySink.builder().token("  ").build());
  }

  @Test
  void builder_relativeBaseUrl_throwsIAE() {
    assertThrows(IllegalArgumentException.class, () ->
        HttpDeliverySink.builder().baseUrl("localhost").token("t").build());
  }

  @Test
  void builder_nonPositiveTimeout_throwsIAE() {
    assertThrows(IllegalArgumentException.class, () ->
        HttpDeliverySink.builder().timeout(Duration.ZERO));
  }

  @Test
  void builder_defaultsToLocalProcessEndpoint() {
    HttpDeliverySink sink = HttpDeliverySink.builder().token("t").build();
    assertEquals(URI.create("http://localhost:6969/process"), sink.endpoint());
  }

  @Test
  void resolveEndpoint_joinsSlashes() {
    assertEquals(URI.create("http://h:1/a/process"),
        HttpDeliverySink.resolveEndpoint("http://h:1/a/", "/process"));
    assertEquals(URI.create("http://h:1/process"),
        HttpDeliverySink.resolveEndpoint("http://h:1", "process"));
  }

  // ── Request shape ───────────────────────────────────────────────

  @Test
  void deliver_postsJsonWithBearerToken() throws IOException {
    DeliveryResult result = sink().deliver(TARGET, twoEvents(), "01HX0000000000000000000000");

    assertEquals(new DeliveryResult.Accepted(2, 0), result);
    Captured request = captured.get();
    assertEquals("POST", request.method());
    assertEquals("/process", request.path());
    assertEquals("Bearer secret", request.auth());
    assertEquals("application/json", request.contentType());
    assertEquals("01HX0000000000000000000000", request.batchId());

    JsonNode body = mapper.readTree(request.body());
    assertEquals(1001, body.get("channelId").asLong());
    assertEquals("news", body.get("channelUsername").asText());
    assertEquals("https://t.me/news", body.get("channelUrl").asText());
    assertEquals(2, body.get("messages").size());

    JsonNode first = body.get("messages").get(0);
    assertEquals(101, first.get("id").asLong());
    assertEquals("2024-03-01T10:15:30Z", first.get("date").asText());
    assertEquals("first", first.get("message").asText());
    assertEquals(10, first.get("views").asInt());
    assertEquals(1, first.get("forwards").asInt());
    assertEquals("2024-03-01T10:16:30Z", first.get("edit_date").asText());
    assertEquals("editor", first.get("post_author").asText());
    assertEquals("MessageMediaPhoto", first.get("media").asText());
    assertEquals("MessageEntityBold", first.get("entities").get(0).get("type").asText());
    assertEquals(5, first.get("entities").get(0).get("length").asInt());
    assertEquals(99, first.get("reply_to").asLong());

    JsonNode second = body.get("messages").get(1);
    assertEquals(102, second.get("id").asLong());
    assertTrue(second.has("edit_date"));
    assertTrue(second.get("edit_date").isNull());
    assertTrue(second.get("entities").isNull());
    assertTrue(second.get("reply_to").isNull());
  }

  @Test
  void deliver_withoutBatchId_omitsHeader() {
    sink().deliver(TARGET, twoEvents(), null);
    assertNull(captured.get().batchId());
  }

  // ── Response mapping ────────────────────────────────────────────

  @Test
  void deliver_okFalse_isHttpError() {
    responseBody = "{\"ok\":false,\"error\":{\"code\":400,\"message\":\"bad channel\"}}";

    DeliveryResult result = sink().deliver(TARGET, twoEvents(), null);

    assertEquals(new DeliveryResult.Rejected("bad channel", DeliveryResult.HTTP_ERROR), result);
  }

  @Test
  void deliver_non200WithOkTrue_isHttpError() {
    status = 202;

    DeliveryResult result = sink().deliver(TARGET, twoEvents(), null);

    assertFalse(result.isAccepted());
    assertEquals(DeliveryResult.HTTP_ERROR, ((DeliveryResult.Rejected) result).code());
  }

  @Test
  void deliver_errorWithoutMessage_isUnknownError() {
    status = 500;
    responseBody = "{\"ok\":false}";

    DeliveryResult result = sink().deliver(TARGET, twoEvents(), null);

    assertEquals(new DeliveryResult.Rejected("Unknown error", DeliveryResult.HTTP_ERROR), result);
  }

  @Test
  void deliver_nonJsonBody_isUnexpectedError() {
    status = 502;
    responseBody = "<html>bad gateway</html>";

    DeliveryResult result = sink().deliver(TARGET, twoEvents(), null);

    DeliveryResult.Rejected rejected = assertInstanceOf(DeliveryResult.Rejected.class, result);
    assertEquals(DeliveryResult.UNEXPECTED_ERROR, rejected.code());
    assertTrue(rejected.message().startsWith("Unexpected error: "), rejected.message());
  }

  @Test
  void deliver_okStatusWithNonJsonBody_isUnexpectedError() {
    responseBody = "processed";

    DeliveryResult result = sink().deliver(TARGET, twoEvents(), null);

    DeliveryResult.Rejected rejected = assertInstanceOf(DeliveryResult.Rejected.class, result);
    assertEquals(DeliveryResult.UNEXPECTED_ERROR, rejected.code());
  }

  @Test
  void deliver_emptyErrorBody_isUnknownHttpError() {
    status = 503;
    responseBody = "";

    DeliveryResult result = sink().deliver(TARGET, twoEvents(), null);

    assertEquals(new DeliveryResult.Rejected("Unknown error", DeliveryResult.HTTP_ERROR), result);
  }

  @Test
  void deliver_missingCounts_defaultToZero() {
    responseBody = "{\"ok\":true,\"extra\":\"ignored\"}";

    DeliveryResult result = sink().deliver(TARGET, twoEvents(), null);

    assertEquals(new DeliveryResult.Accepted(0, 0), result);
  }

  @Test
  void deliver_connectionRefused_isClientError() throws IOException {
    int port;
    try (ServerSocket socket = new ServerSocket(0)) {
      port = socket.getLocalPort();
    }
    HttpDeliverySink sink = HttpDeliverySink.builder()
        .baseUrl("http://127.0.0.1:" + port)
        .token("secret")
        .timeout(Duration.ofSeconds(2))
        .build();

    DeliveryResult result = sink.deliver(TARGET, twoEvents(), null);

    DeliveryResult.Rejected rejected = assertInstanceOf(DeliveryResult.Rejected.class, result);
    assertEquals(DeliveryResult.HTTP_CLIENT_ERROR, rejected.code());
    assertTrue(rejected.message().startsWith("HTTP client error: "));
  }
}
