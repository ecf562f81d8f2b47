package com.rudderstack.sdk;

import java.time.Instant;
import java.util.function.Supplier;

interface Clock extends Supplier<Instant> {

  default String isoTimestamp() {
    return get().toString();
  }
}
