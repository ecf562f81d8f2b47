package com.rudderstack.sdk;

import static com.rudderstack.sdk.RudderOptions.BATCH_SIZE;
import static com.rudderstack.sdk.RudderOptions.COMPRESS_REQUEST;
import static com.rudderstack.sdk.RudderOptions.ERROR_HANDLER;
import static com.rudderstack.sdk.RudderOptions.FLUSH_INTERVAL;
import static com.rudderstack.sdk.RudderOptions.FLUSH_TIMEOUT;
import static com.rudderstack.sdk.RudderOptions.MAX_QUEUE_SIZE;
import static com.rudderstack.sdk.RudderOptions.MAX_RETRIES;
import static com.rudderstack.sdk.RudderOptions.REQUEST_TIMEOUT;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;

/** Settings of {@link BatchingDeliveryClient}, read from the pass-through options. */
final class DeliveryOptions {

  static final int DEFAULT_BATCH_SIZE = 100;
  static final int DEFAULT_MAX_QUEUE_SIZE = 10_000;
  static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofSeconds(10);
  static final Duration DEFAULT_FLUSH_TIMEOUT = Duration.ofSeconds(10);
  static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(5);
  static final int DEFAULT_MAX_RETRIES = 10;

  private final int batchSize;
  private final int maxQueueSize;
  private final Duration flushInterval;
  private final Duration flushTimeout;
  private final Duration requestTimeout;
  private final int maxRetries;
  private final boolean compressRequest;
  private final ErrorHandler errorHandler;

  DeliveryOptions(
      int batchSize,
      int maxQueueSize,
      Duration flushInterval,
      Duration flushTimeout,
      Duration requestTimeout,
      int maxRetries,
      boolean compressRequest,
      ErrorHandler errorHandler) {
    if (flushInterval.isZero() || flushInterval.isNegative()) {
      throw new RudderExceptions.ConfigError("flushInterval must be positive");
    }
    this.batchSize = batchSize;
    this.maxQueueSize = maxQueueSize;
    this.flushInterval = flushInterval;
    this.flushTimeout = flushTimeout;
    this.requestTimeout = requestTimeout;
    this.maxRetries = maxRetries;
    this.compressRequest = compressRequest;
    this.errorHandler = errorHandler;
  }

  static DeliveryOptions defaults() {
    return from(Map.of());
  }

  static DeliveryOptions from(Configuration configuration) {
    return from(configuration.getOptions());
  }

  /**
   * @throws RudderExceptions.ConfigError if an option has the wrong type or is out of range
   */
  static DeliveryOptions from(Map<String, Object> options) {
    return new DeliveryOptions(
        positiveInt(options, BATCH_SIZE, DEFAULT_BATCH_SIZE),
        positiveInt(options, MAX_QUEUE_SIZE, DEFAULT_MAX_QUEUE_SIZE),
        duration(options, FLUSH_INTERVAL, DEFAULT_FLUSH_INTERVAL),
        duration(options, FLUSH_TIMEOUT, DEFAULT_FLUSH_TIMEOUT),
        duration(options, REQUEST_TIMEOUT, DEFAULT_REQUEST_TIMEOUT),
        nonNegativeInt(options, MAX_RETRIES, DEFAULT_MAX_RETRIES),
        bool(options, COMPRESS_REQUEST, false),
        errorHandler(options));
  }

  int batchSize() {
    return batchSize;
  }

  int maxQueueSize() {
    return maxQueueSize;
  }

  Duration flushInterval() {
    return flushInterval;
  }

  Duration flushTimeout() {
    return flushTimeout;
  }

  Duration requestTimeout() {
    return requestTimeout;
  }

  int maxRetries() {
    return maxRetries;
  }

  boolean compressRequest() {
    return compressRequest;
  }

  Optional<ErrorHandler> errorHandler() {
    return Optional.ofNullable(errorHandler);
  }

  private static int positiveInt(Map<String, Object> options, String key, int defaultValue) {
    final int value = nonNegativeInt(options, key, defaultValue);
    if (value == 0) {
      throw new RudderExceptions.ConfigError(key + " must be positive");
    }
    return value;
  }

  private static int nonNegativeInt(Map<String, Object> options, String key, int defaultValue) {
    final Object value = options.get(key);
    final int result;
    if (value == null) {
      return defaultValue;
    } else if (value instanceof Number) {
      result = ((Number) value).intValue();
    } else if (value instanceof String) {
      try {
        result = Integer.parseInt(((String) value).trim());
      } catch (NumberFormatException e) {
        throw new RudderExceptions.ConfigError(key + " must be an integer, got: " + value, e);
      }
    } else {
      throw new RudderExceptions.ConfigError(key + " must be an integer, got: " + value);
    }
    if (result < 0) {
      throw new RudderExceptions.ConfigError(key + " must not be negative");
    }
    return result;
  }

  // numbers are milliseconds, strings are either milliseconds or ISO-8601 durations
  private static Duration duration(Map<String, Object> options, String key, Duration defaultValue) {
    final Object value = options.get(key);
    if (value == null) {
      return defaultValue;
    } else if (value instanceof Duration) {
      return (Duration) value;
    } else if (value instanceof Number) {
      return Duration.ofMillis(((Number) value).longValue());
    } else if (value instanceof String) {
      final String text = ((String) value).trim();
      try {
        return text.chars().allMatch(Character::isDigit)
            ? Duration.ofMillis(Long.parseLong(text))
            : Duration.parse(text);
      } catch (NumberFormatException | DateTimeParseException e) {
        throw new RudderExceptions.ConfigError(key + " must be a duration, got: " + value, e);
      }
    }
    throw new RudderExceptions.ConfigError(key + " must be a duration, got: " + value);
  }

  private static boolean bool(Map<String, Object> options, String key, boolean defaultValue) {
    final Object value = options.get(key);
    if (value == null) {
      return defaultValue;
    } else if (value instanceof Boolean) {
      return (Boolean) value;
    } else if (value instanceof String) {
      final String text = ((String) value).trim();
      if ("true".equalsIgnoreCase(text)) return true;
      if ("false".equalsIgnoreCase(text)) return false;
    }
    throw new RudderExceptions.ConfigError(key + " must be a boolean, got: " + value);
  }

  private static ErrorHandler errorHandler(Map<String, Object> options) {
    final Object value = options.get(ERROR_HANDLER);
    if (value == null || value instanceof ErrorHandler) {
      return (ErrorHandler) value;
    }
    throw new RudderExceptions.ConfigError("errorHandler must be an ErrorHandler");
  }
}
