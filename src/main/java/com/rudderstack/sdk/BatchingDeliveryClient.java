package com.rudderstack.sdk;

import com.google.common.annotations.VisibleForTesting;
import com.google.gson.JsonObject;
import dev.failsafe.Failsafe;
import dev.failsafe.FailsafeExecutor;
import dev.failsafe.RetryPolicy;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.LockSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link DeliveryClient}: queues serialized messages in memory and uploads them in batches
 * from a single polling thread.
 *
 * <p>A batch is uploaded when it holds {@code batchSize} messages, when it would exceed {@link
 * #MAX_BATCH_BYTES}, when {@code flushInterval} has passed since the previous upload, on {@link
 * #flush()} and on {@link #close()}. Uploads that fail transiently are retried with exponential
 * backoff.
 */
class BatchingDeliveryClient implements DeliveryClient {

  static final int MAX_MESSAGE_BYTES = 32 * 1024;
  static final int MAX_BATCH_BYTES = 500 * 1024;
  static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofSeconds(1);

  private static final Logger log = LoggerFactory.getLogger(BatchingDeliveryClient.class);

  private final EventUploader eventUploader;
  private final MessageSerializer serializer;
  private final DeliveryOptions options;
  private final FailsafeExecutor<EventUploader.Outcome> uploadExecutor;
  private final ConcurrentLinkedQueue<QueuedMessage> sendQueue = new ConcurrentLinkedQueue<>();
  private final ConcurrentLinkedQueue<CompletableFuture<Boolean>> flushRequests =
      new ConcurrentLinkedQueue<>();
  private final Set<CompletableFuture<?>> pendingBatches = ConcurrentHashMap.newKeySet();
  private final AtomicInteger queuedMessages = new AtomicInteger(0);
  private final Thread pollingThread = new Thread(this::pollLoop, "rudder-delivery");
  private volatile boolean intakeClosed = false;

  // only touched by the polling thread
  private List<CompletableFuture<Boolean>> batchesSinceFlush = new ArrayList<>();

  private record QueuedMessage(JsonObject json, int bytes) {}

  @VisibleForTesting
  BatchingDeliveryClient(
      DeliveryOptions options,
      EventUploader eventUploader,
      MessageSerializer serializer,
      Duration initialBackoff) {
    this.options = options;
    this.eventUploader = eventUploader;
    this.serializer = serializer;
    this.uploadExecutor =
        Failsafe.with(
            RetryPolicy.<EventUploader.Outcome>builder()
                .handleResult(EventUploader.Outcome.RETRY)
                .withBackoff(initialBackoff, initialBackoff.multipliedBy(10))
                .withJitter(0.1)
                .withMaxRetries(options.maxRetries())
                .withMaxDuration(Duration.ofMinutes(30))
                .build());
    pollingThread.setDaemon(true);
    pollingThread.start();
  }

  static BatchingDeliveryClient create(Configuration configuration) {
    final DeliveryOptions options = DeliveryOptions.from(configuration);
    final Clock clock = Instant::now;
    return new BatchingDeliveryClient(
        options,
        new HttpEventUploader(configuration, options, clock),
        new MessageSerializer(clock),
        DEFAULT_INITIAL_BACKOFF);
  }

  @Override
  public boolean track(Message.Track message) {
    return enqueue(message);
  }

  @Override
  public boolean identify(Message.Identify message) {
    return enqueue(message);
  }

  @Override
  public boolean group(Message.Group message) {
    return enqueue(message);
  }

  @Override
  public boolean page(Message.Page message) {
    return enqueue(message);
  }

  @Override
  public boolean screen(Message.Screen message) {
    return enqueue(message);
  }

  @Override
  public boolean alias(Message.Alias message) {
    return enqueue(message);
  }

  private boolean enqueue(Message message) {
    if (intakeClosed) {
      log.warn("Delivery client is closed, dropping {} message", message.type());
      return false;
    }
    final JsonObject json = serializer.serialize(message);
    final int bytes = json.toString().getBytes(StandardCharsets.UTF_8).length;
    if (bytes > MAX_MESSAGE_BYTES) {
      log.warn(
          "Dropping {} message of {} bytes, the limit is {}",
          message.type(),
          bytes,
          MAX_MESSAGE_BYTES);
      return false;
    }
    if (queuedMessages.incrementAndGet() > options.maxQueueSize()) {
      queuedMessages.decrementAndGet();
      log.warn("Delivery queue is full, dropping {} message", message.type());
      return false;
    }
    sendQueue.add(new QueuedMessage(json, bytes));
    if (queuedMessages.get() >= options.batchSize()) {
      LockSupport.unpark(pollingThread);
    }
    return true;
  }

  /**
   * Uploads everything accepted before this call and waits for the outcome.
   *
   * @return {@code true} if every batch uploaded since the previous flush was delivered
   */
  @Override
  public boolean flush() {
    if (intakeClosed) {
      return false;
    }
    final CompletableFuture<Boolean> request = new CompletableFuture<>();
    flushRequests.add(request);
    LockSupport.unpark(pollingThread);
    try {
      return request.get(options.flushTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    } catch (TimeoutException e) {
      log.warn("Flush did not complete within {}", options.flushTimeout());
      return false;
    } catch (ExecutionException e) {
      log.warn("Flush failed", e.getCause());
      return false;
    }
  }

  private void pollLoop() {
    Instant latestUploadTime = Instant.now();
    List<JsonObject> batch = new ArrayList<>();
    int batchBytes = 0;
    while (true) {
      if (!flushRequests.isEmpty()) {
        final List<CompletableFuture<Boolean>> requests = new ArrayList<>();
        CompletableFuture<Boolean> request;
        while ((request = flushRequests.poll()) != null) {
          requests.add(request);
        }
        // everything enqueued before the requests is ahead of this snapshot
        for (int pending = sendQueue.size(); pending > 0; pending--) {
          final QueuedMessage message = sendQueue.poll();
          if (message == null) break;
          if (batchBytes + message.bytes() > MAX_BATCH_BYTES
              || batch.size() >= options.batchSize()) {
            upload(batch);
            batch = new ArrayList<>();
            batchBytes = 0;
          }
          batch.add(message.json());
          batchBytes += message.bytes();
        }
        upload(batch);
        batch = new ArrayList<>();
        batchBytes = 0;
        latestUploadTime = Instant.now();
        completeFlushRequests(requests);
        continue;
      }

      final QueuedMessage message = sendQueue.poll();
      if (message != null) {
        if (batchBytes + message.bytes() > MAX_BATCH_BYTES) {
          upload(batch);
          batch = new ArrayList<>();
          batchBytes = 0;
          latestUploadTime = Instant.now();
        }
        batch.add(message.json());
        batchBytes += message.bytes();
      } else {
        if (intakeClosed) break;
        LockSupport.parkUntil(latestUploadTime.plus(options.flushInterval()).toEpochMilli());
      }
      final boolean passedFlushInterval =
          Duration.between(latestUploadTime, Instant.now()).compareTo(options.flushInterval())
              >= 0;
      if (batch.size() >= options.batchSize() || passedFlushInterval) {
        upload(batch);
        batch = new ArrayList<>();
        batchBytes = 0;
        latestUploadTime = Instant.now();
      }
    }
    upload(batch);
  }

  private void upload(List<JsonObject> batch) {
    if (batch.isEmpty()) return;
    final CompletableFuture<EventUploader.Outcome> uploaded =
        uploadExecutor.getStageAsync(() -> eventUploader.upload(batch));
    pendingBatches.add(uploaded);
    // flush results are derived from the bookkeeping stage so they observe the freed queue slots
    final CompletableFuture<EventUploader.Outcome> settled =
        uploaded.whenComplete(
            (outcome, error) -> {
              pendingBatches.remove(uploaded);
              queuedMessages.addAndGet(-batch.size());
            });
    batchesSinceFlush.add(
        settled
            .thenApply(outcome -> delivered(outcome, batch.size()))
            .exceptionally(
                throwable -> {
                  log.error("Uploading {} events failed", batch.size(), throwable);
                  return false;
                }));
  }

  private boolean delivered(EventUploader.Outcome outcome, int batchSize) {
    if (outcome == EventUploader.Outcome.RETRY) {
      final String message =
          String.format("Giving up on %d events after %d retries", batchSize, options.maxRetries());
      log.error(message);
      options.errorHandler().ifPresent(handler -> handler.onError(-1, message));
    }
    return outcome == EventUploader.Outcome.DELIVERED;
  }

  private void completeFlushRequests(List<CompletableFuture<Boolean>> requests) {
    final List<CompletableFuture<Boolean>> batches = batchesSinceFlush;
    batchesSinceFlush = new ArrayList<>();
    CompletableFuture.allOf(batches.toArray(CompletableFuture[]::new))
        .thenApply(ignored -> batches.stream().allMatch(CompletableFuture::join))
        .whenComplete(
            (allDelivered, error) ->
                requests.forEach(r -> r.complete(error == null && allDelivered)));
  }

  private void awaitPending() {
    try {
      LockSupport.unpark(pollingThread);
      pollingThread.join();
      final CompletableFuture<?>[] pending =
          pendingBatches.stream()
              .map(future -> future.exceptionally(throwable -> null))
              .toArray(CompletableFuture[]::new);
      CompletableFuture.allOf(pending)
          .get(options.flushTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (ExecutionException | TimeoutException e) {
      log.warn("{} batches were still pending on close", pendingBatches.size());
    }
  }

  @VisibleForTesting
  int getQueuedMessages() {
    return queuedMessages.get();
  }

  @Override
  public synchronized void close() throws IOException {
    if (intakeClosed) return;
    intakeClosed = true;
    awaitPending();
    pendingBatches.forEach(batch -> batch.cancel(true));
    flushRequests.forEach(request -> request.complete(false));
    eventUploader.close();
  }
}
