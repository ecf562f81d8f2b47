package com.rudderstack.sdk;

import static org.assertj.core.api.Assertions.assertThat;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.zip.GZIPInputStream;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class HttpEventUploaderTest {
  private final MockWebServer server = new MockWebServer();
  private final FakeClock clock = new FakeClock();
  private final List<String> errors = new CopyOnWriteArrayList<>();
  private final List<Integer> errorCodes = new CopyOnWriteArrayList<>();
  private HttpEventUploader uploader;

  @BeforeEach
  public void setUp() throws IOException {
    server.start();
  }

  @AfterEach
  public void tearDown() throws IOException {
    if (uploader != null) {
      uploader.close();
    }
    server.shutdown();
  }

  private HttpEventUploader uploader(boolean compressRequest) {
    final RudderOptions options =
        RudderOptions.builder()
            .dataPlaneUrl(server.url("/").toString())
            .sslEnabled(false)
            .compressRequest(compressRequest)
            .errorHandler(
                (code, message) -> {
                  errorCodes.add(code);
                  errors.add(message);
                })
            .build();
    final Configuration configuration = DataPlaneEndpoint.configure("secret", options);
    uploader = new HttpEventUploader(configuration, DeliveryOptions.from(configuration), clock);
    return uploader;
  }

  private static List<JsonObject> batch() {
    final MessageSerializer serializer = new MessageSerializer(new FakeClock(), "test");
    return List.of(
        serializer.serialize(Message.track().event("a").userId("u1").build()),
        serializer.serialize(
            Message.identify().userId("u1").traits(Map.of("plan", "pro")).build()));
  }

  @Test
  public void postsBatchWithBasicAuth() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(200));
    clock.setNow(Instant.parse("2024-03-04T05:06:07Z"));

    final EventUploader.Outcome outcome = uploader(false).upload(batch()).get(5, TimeUnit.SECONDS);

    assertThat(outcome).isEqualTo(EventUploader.Outcome.DELIVERED);
    final RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
    assertThat(request.getMethod()).isEqualTo("POST");
    assertThat(request.getPath()).isEqualTo("/v1/batch");
    assertThat(request.getHeader("Authorization")).isEqualTo("Basic c2VjcmV0Og==");
    assertThat(request.getHeader("User-Agent")).startsWith("rudder-sdk-java/");
    assertThat(request.getHeader("Content-Type")).startsWith("application/json");
    assertThat(request.getHeader("Content-Encoding")).isNull();

    final JsonObject body = JsonParser.parseString(request.getBody().readUtf8()).getAsJsonObject();
    assertThat(body.get("sentAt").getAsString()).isEqualTo("2024-03-04T05:06:07Z");
    assertThat(body.getAsJsonArray("batch")).hasSize(2);
    assertThat(body.getAsJsonArray("batch").get(1).getAsJsonObject().get("type").getAsString())
        .isEqualTo("identify");
  }

  @Test
  public void compressesBodyWhenEnabled() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(200));

    uploader(true).upload(batch()).get(5, TimeUnit.SECONDS);

    final RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
    assertThat(request.getHeader("Content-Encoding")).isEqualTo("gzip");
    try (InputStreamReader reader =
        new InputStreamReader(
            new GZIPInputStream(request.getBody().inputStream()), StandardCharsets.UTF_8)) {
      final JsonObject body = JsonParser.parseReader(reader).getAsJsonObject();
      assertThat(body.getAsJsonArray("batch")).hasSize(2);
    }
  }

  @Test
  public void serverErrorsAreRetried() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(503));
    server.enqueue(new MockResponse().setResponseCode(429));

    assertThat(uploader(false).upload(batch()).get(5, TimeUnit.SECONDS))
        .isEqualTo(EventUploader.Outcome.RETRY);
    assertThat(uploader.upload(batch()).get(5, TimeUnit.SECONDS))
        .isEqualTo(EventUploader.Outcome.RETRY);
    assertThat(errors).isEmpty();
  }

  @Test
  public void networkFailuresAreRetried() throws Exception {
    server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));

    assertThat(uploader(false).upload(batch()).get(10, TimeUnit.SECONDS))
        .isEqualTo(EventUploader.Outcome.RETRY);
  }

  @Test
  public void clientErrorsAreRejectedAndReported() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(400));

    assertThat(uploader(false).upload(batch()).get(5, TimeUnit.SECONDS))
        .isEqualTo(EventUploader.Outcome.REJECTED);
    assertThat(errorCodes).containsExactly(400);
    assertThat(errors.get(0)).contains("rejected");
  }

  @Test
  public void recoverableStatuses() {
    assertThat(HttpEventUploader.isRecoverable(408)).isTrue();
    assertThat(HttpEventUploader.isRecoverable(429)).isTrue();
    assertThat(HttpEventUploader.isRecoverable(500)).isTrue();
    assertThat(HttpEventUploader.isRecoverable(400)).isFalse();
    assertThat(HttpEventUploader.isRecoverable(401)).isFalse();
    assertThat(HttpEventUploader.isRecoverable(404)).isFalse();
  }
}
