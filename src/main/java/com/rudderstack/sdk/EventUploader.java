package com.rudderstack.sdk;

import com.google.gson.JsonObject;
import java.io.Closeable;
import java.util.List;
import java.util.concurrent.CompletableFuture;

interface EventUploader extends Closeable {

  enum Outcome {
    DELIVERED,
    /** Transient failure; the same batch may be sent again. */
    RETRY,
    /** The data plane refused the batch; sending it again will not help. */
    REJECTED
  }

  /** Never completes exceptionally: failures are reported as an {@link Outcome}. */
  CompletableFuture<Outcome> upload(List<JsonObject> batch);
}
