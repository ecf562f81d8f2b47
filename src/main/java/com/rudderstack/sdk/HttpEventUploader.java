package com.rudderstack.sdk;

import com.google.common.annotations.VisibleForTesting;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.zip.GZIPOutputStream;
import javax.annotation.Nonnull;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.Credentials;
import okhttp3.Headers;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Posts batches to {@code <protocol>://<dataPlaneUrl>/v1/batch}. */
class HttpEventUploader implements EventUploader {

  static final String BATCH_PATH = "/v1/batch";
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private static final Logger log = LoggerFactory.getLogger(HttpEventUploader.class);

  private final Gson gson = new Gson();
  private final OkHttpClient httpClient;
  private final String batchUrl;
  private final Headers headers;
  private final Clock clock;
  private final boolean compressRequest;
  private final Optional<ErrorHandler> errorHandler;

  HttpEventUploader(Configuration configuration, DeliveryOptions options, Clock clock) {
    this(
        configuration,
        options,
        clock,
        new OkHttpClient.Builder().callTimeout(options.requestTimeout()).build());
  }

  @VisibleForTesting
  HttpEventUploader(
      Configuration configuration,
      DeliveryOptions options,
      Clock clock,
      OkHttpClient httpClient) {
    this.httpClient = httpClient;
    this.batchUrl = trimTrailingSlash(configuration.baseUrl()) + BATCH_PATH;
    this.clock = clock;
    this.compressRequest = options.compressRequest();
    this.errorHandler = options.errorHandler();
    final Headers.Builder headersBuilder =
        new Headers.Builder()
            .add("Authorization", Credentials.basic(configuration.getSecretKey(), ""))
            .add("User-Agent", SdkUtils.userAgent());
    if (compressRequest) {
      headersBuilder.add("Content-Encoding", "gzip");
    }
    this.headers = headersBuilder.build();
  }

  @Override
  public CompletableFuture<Outcome> upload(List<JsonObject> batch) {
    final CompletableFuture<Outcome> result = new CompletableFuture<>();
    final Request request;
    try {
      request =
          new Request.Builder().url(batchUrl).headers(headers).post(body(batch)).build();
    } catch (IOException e) {
      log.error("Could not encode batch of {} events, dropping it", batch.size(), e);
      reportError(-1, "Could not encode batch: " + e.getMessage());
      result.complete(Outcome.REJECTED);
      return result;
    }

    log.debug("Posting {} event(s) to {}", batch.size(), batchUrl);
    httpClient
        .newCall(request)
        .enqueue(
            new Callback() {
              @Override
              public void onFailure(@Nonnull Call call, @Nonnull IOException e) {
                log.warn("Posting {} event(s) failed: {}", batch.size(), e.toString());
                result.complete(Outcome.RETRY);
              }

              @Override
              public void onResponse(@Nonnull Call call, @Nonnull Response response) {
                try (response) {
                  result.complete(outcomeOf(response, batch.size()));
                }
              }
            });
    return result;
  }

  private Outcome outcomeOf(Response response, int eventCount) {
    final int code = response.code();
    if (response.isSuccessful()) {
      log.debug("Successfully published {} events", eventCount);
      return Outcome.DELIVERED;
    }
    if (isRecoverable(code)) {
      log.warn("Publishing {} events failed with HTTP {}, will retry", eventCount, code);
      return Outcome.RETRY;
    }
    final String message =
        String.format("Publishing %d events was rejected with HTTP %d", eventCount, code);
    log.error(message);
    reportError(code, message);
    return Outcome.REJECTED;
  }

  static boolean isRecoverable(int statusCode) {
    return statusCode == 408 || statusCode == 429 || statusCode >= 500;
  }

  private RequestBody body(List<JsonObject> batch) throws IOException {
    final JsonArray events = new JsonArray(batch.size());
    batch.forEach(events::add);
    final JsonObject payload = new JsonObject();
    payload.add("batch", events);
    payload.addProperty("sentAt", clock.isoTimestamp());
    final String json = gson.toJson(payload);
    if (!compressRequest) {
      return RequestBody.create(json, JSON);
    }
    final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (GZIPOutputStream gzip = new GZIPOutputStream(bytes)) {
      gzip.write(json.getBytes(StandardCharsets.UTF_8));
    }
    return RequestBody.create(bytes.toByteArray(), JSON);
  }

  void reportError(int code, String message) {
    errorHandler.ifPresent(handler -> handler.onError(code, message));
  }

  private static String trimTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }

  @Override
  public void close() {
    httpClient.dispatcher().executorService().shutdown();
    httpClient.connectionPool().evictAll();
  }
}
