package relay.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import relay.DeliveryResult;
import relay.model.ChannelEvent;
import relay.model.DeliveryTarget;
import relay.spi.DeliverySink;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link DeliverySink} that posts each batch to an HTTP processing endpoint.
 *
 * <p>The body is {@code {channelId, channelUsername, channelUrl, messages}} with dates in
 * ISO-8601. A batch counts as accepted only when the endpoint answers {@code 200} with
 * {@code "ok": true}; every other outcome maps to a {@link DeliveryResult.Rejected}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * DeliverySink sink = HttpDeliverySink.builder()
 *     .baseUrl("http://localhost:6969")
 *     .token(System.getenv("RELAY_TOKEN"))
 *     .build();
 * }</pre>
 */
public final class HttpDeliverySink implements DeliverySink {
  private static final Logger logger = Logger.getLogger(HttpDeliverySink.class.getName());

  /** Header carrying the batch correlation id. */
  public static final String BATCH_ID_HEADER = "X-Relay-Batch-Id";

  private final URI endpoint;
  private final String token;
  private final Duration timeout;
  private final HttpClient client;
  private final ObjectMapper mapper;

  private HttpDeliverySink(Builder builder) {
    this.endpoint = resolveEndpoint(builder.baseUrl, builder.path);
    this.token = builder.token;
    this.timeout = builder.timeout;
    this.client = builder.client != null
        ? builder.client
        : HttpClient.newBuilder().connectTimeout(builder.timeout).build();
    this.mapper = builder.mapper != null ? builder.mapper : RelayJson.newObjectMapper();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Absolute URI batches are posted to.
   */
  public URI endpoint() {
    return endpoint;
  }

  @Override
  public DeliveryResult deliver(DeliveryTarget target, List<ChannelEvent> events, String batchId) {
    try {
      byte[] body = mapper.writeValueAsBytes(ProcessRequest.of(target, events));
      HttpRequest.Builder request = HttpRequest.newBuilder(endpoint)
          .timeout(timeout)
          .header("Content-Type", "application/json")
          .header("Authorization", "Bearer " + token)
          .POST(HttpRequest.BodyPublishers.ofByteArray(body));
      if (batchId != null) {
        request.header(BATCH_ID_HEADER, batchId);
      }
      HttpResponse<byte[]> response = client.send(request.build(), HttpResponse.BodyHandlers.ofByteArray());
      return toResult(response.statusCode(), response.body());
    } catch (JsonProcessingException e) {
      logger.log(Level.SEVERE, "Failed to encode batch for channel " + target.channelId(), e);
      return DeliveryResult.rejected("Unexpected error: " + e.getMessage(), DeliveryResult.UNEXPECTED_ERROR);
    } catch (IOException e) {
      logger.log(Level.WARNING, "POST " + endpoint + " failed for channel " + target.channelId(), e);
      return DeliveryResult.rejected("HTTP client error: " + e, DeliveryResult.HTTP_CLIENT_ERROR);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return DeliveryResult.rejected("HTTP client error: interrupted", DeliveryResult.HTTP_CLIENT_ERROR);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Unexpected error delivering to " + endpoint, e);
      return DeliveryResult.rejected("Unexpected error: " + e, DeliveryResult.UNEXPECTED_ERROR);
    }
  }

  private DeliveryResult toResult(int status, byte[] body) {
    ProcessResponse response;
    try {
      response = parse(body);
    } catch (IOException e) {
      logger.log(Level.WARNING, "Endpoint answered " + status + " with a body that is not JSON", e);
      return DeliveryResult.rejected("Unexpected error: " + e.getMessage(), DeliveryResult.UNEXPECTED_ERROR);
    }
    if (status == 200 && response != null && response.ok()) {
      return DeliveryResult.accepted(orZero(response.processed()), orZero(response.pending()));
    }
    String message = response != null ? response.errorMessage() : "Unknown error";
    logger.log(Level.FINE, "Endpoint answered {0}: {1}", new Object[]{status, message});
    return DeliveryResult.rejected(message, DeliveryResult.HTTP_ERROR);
  }

  /** Returns {@code null} for an empty body. */
  private ProcessResponse parse(byte[] body) throws IOException {
    if (body == null || body.length == 0) {
      return null;
    }
    return mapper.readValue(body, ProcessResponse.class);
  }

  private static int orZero(Integer value) {
    return value == null ? 0 : value;
  }

  static URI resolveEndpoint(String baseUrl, String path) {
    String base = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
    String relative = path.startsWith("/") ? path.substring(1) : path;
    return URI.create(base + relative);
  }

  /**
   * Builder for {@link HttpDeliverySink}.
   */
  public static final class Builder {
    private String baseUrl = "http://localhost:6969";
    private String path = "process";
    private String token;
    private Duration timeout = Duration.ofSeconds(30);
    private HttpClient client;
    private ObjectMapper mapper;

    private Builder() {
    }

    /**
     * Optional. Defaults to {@code http://localhost:6969}.
     */
    public Builder baseUrl(String baseUrl) {
      this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
      return this;
    }

    /**
     * Optional. Path appended to the base URL. Defaults to {@code process}.
     */
    public Builder path(String path) {
      this.path = Objects.requireNonNull(path, "path");
      return this;
    }

    /**
     * <b>Required.</b> Bearer token sent on every request.
     */
    public Builder token(String token) {
      this.token = token;
      return this;
    }

    /**
     * Optional. Request timeout. Defaults to 30 seconds.
     */
    public Builder timeout(Duration timeout) {
      Objects.requireNonNull(timeout, "timeout");
      if (timeout.isZero() || timeout.isNegative()) {
        throw new IllegalArgumentException("timeout must be > 0");
      }
      this.timeout = timeout;
      return this;
    }

    /**
     * Optional. Defaults to a client with a connect timeout equal to {@link #timeout}.
     */
    public Builder httpClient(HttpClient client) {
      this.client = client;
      return this;
    }

    /**
     * Optional. Defaults to {@link RelayJson#newObjectMapper()}.
     */
    public Builder objectMapper(ObjectMapper mapper) {
      this.mapper = mapper;
      return this;
    }

    /**
     * @throws NullPointerException     if no token was set
     * @throws IllegalArgumentException if the token is blank or the base URL is not absolute
     */
    public HttpDeliverySink build() {
      Objects.requireNonNull(token, "token");
      if (token.isBlank()) {
        throw new IllegalArgumentException("token must not be blank");
      }
      if (!URI.create(baseUrl).isAbsolute()) {
        throw new IllegalArgumentException("baseUrl must be absolute: " + baseUrl);
      }
      return new HttpDeliverySink(this);
    }
  }
}
