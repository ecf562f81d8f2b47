package com.rudderstack.sdk;

import com.google.common.collect.ImmutableMap;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Raw options handed to {@link Rudder#initialize(String, RudderOptions)}.
 *
 * <p>Only {@code dataPlaneURL} and {@code sslEnabled} are interpreted when the configuration is
 * built. Every other option is passed through untouched to the {@link DeliveryClient}; the typed
 * setters on {@link Builder} are shortcuts for the keys the default delivery client understands.
 */
public final class RudderOptions {

  public static final String DATA_PLANE_URL = "dataPlaneURL";
  public static final String SSL_ENABLED = "sslEnabled";

  public static final String BATCH_SIZE = "batchSize";
  public static final String MAX_QUEUE_SIZE = "maxQueueSize";
  public static final String FLUSH_INTERVAL = "flushInterval";
  public static final String FLUSH_TIMEOUT = "flushTimeout";
  public static final String REQUEST_TIMEOUT = "requestTimeout";
  public static final String MAX_RETRIES = "maxRetries";
  public static final String COMPRESS_REQUEST = "compressRequest";
  public static final String ERROR_HANDLER = "errorHandler";
  public static final String LOGGING_LEVEL = "loggingLevel";

  /**
   * Console logging levels for the SDK's own loggers. Only takes effect when Logback is the SLF4J
   * binding; with any other binding the level is left to the application's logging setup.
   */
  public enum LoggingLevel {
    ALL,
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    OFF
  }

  @Nullable private final String dataPlaneUrl;
  @Nullable private final Boolean sslEnabled;
  private final ImmutableMap<String, Object> passthrough;

  private RudderOptions(
      @Nullable String dataPlaneUrl,
      @Nullable Boolean sslEnabled,
      Map<String, Object> passthrough) {
    this.dataPlaneUrl = dataPlaneUrl;
    this.sslEnabled = sslEnabled;
    this.passthrough = ImmutableMap.copyOf(passthrough);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads options from an untyped map. {@code sslEnabled} may be a {@link Boolean} or one of the
   * strings {@code "true"} / {@code "false"}.
   *
   * @throws RudderExceptions.ConfigError if {@code dataPlaneURL} is not a string or {@code
   *     sslEnabled} has any other form
   */
  public static RudderOptions fromMap(@Nonnull Map<String, ?> options) {
    final Builder builder = builder();
    options.forEach(
        (key, value) -> {
          if (DATA_PLANE_URL.equals(key)) {
            if (value != null && !(value instanceof String)) {
              throw new RudderExceptions.ConfigError("dataPlaneURL must be a string");
            }
            builder.dataPlaneUrl((String) value);
          } else if (SSL_ENABLED.equals(key)) {
            builder.sslEnabled(parseSslEnabled(value));
          } else {
            builder.option(key, value);
          }
        });
    return builder.build();
  }

  private static Boolean parseSslEnabled(Object value) {
    if (value == null || value instanceof Boolean) {
      return (Boolean) value;
    }
    if (value instanceof String) {
      final String text = ((String) value).trim();
      if ("true".equalsIgnoreCase(text)) return true;
      if ("false".equalsIgnoreCase(text)) return false;
    }
    throw new RudderExceptions.ConfigError("sslEnabled must be a boolean, got: " + value);
  }

  public Optional<String> getDataPlaneUrl() {
    return Optional.ofNullable(dataPlaneUrl);
  }

  public Optional<Boolean> getSslEnabled() {
    return Optional.ofNullable(sslEnabled);
  }

  /** Options other than {@code dataPlaneURL} and {@code sslEnabled}, in insertion order. */
  public Map<String, Object> getPassthrough() {
    return passthrough;
  }

  public Optional<LoggingLevel> getLoggingLevel() {
    final Object level = passthrough.get(LOGGING_LEVEL);
    if (level instanceof LoggingLevel) {
      return Optional.of((LoggingLevel) level);
    }
    if (level instanceof String) {
      try {
        return Optional.of(LoggingLevel.valueOf(((String) level).trim().toUpperCase(Locale.ROOT)));
      } catch (IllegalArgumentException e) {
        throw new RudderExceptions.ConfigError("Unknown loggingLevel: " + level, e);
      }
    }
    return Optional.empty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    final RudderOptions that = (RudderOptions) o;
    return Objects.equals(dataPlaneUrl, that.dataPlaneUrl)
        && Objects.equals(sslEnabled, that.sslEnabled)
        && passthrough.equals(that.passthrough);
  }

  @Override
  public int hashCode() {
    return Objects.hash(dataPlaneUrl, sslEnabled, passthrough);
  }

  @Override
  public String toString() {
    return "RudderOptions{"
        + "dataPlaneUrl="
        + dataPlaneUrl
        + ", sslEnabled="
        + sslEnabled
        + ", passthrough="
        + passthrough.keySet()
        + '}';
  }

  public static final class Builder {
    private String dataPlaneUrl;
    private Boolean sslEnabled;
    private final Map<String, Object> passthrough = new LinkedHashMap<>();

    private Builder() {}

    public Builder dataPlaneUrl(@Nullable String dataPlaneUrl) {
      this.dataPlaneUrl = dataPlaneUrl;
      return this;
    }

    /** Whether the data plane must be reached over https. Defaults to {@code true}. */
    public Builder sslEnabled(@Nullable Boolean sslEnabled) {
      this.sslEnabled = sslEnabled;
      return this;
    }

    /** Adds an option the configuration does not interpret. {@code null} removes the key. */
    public Builder option(@Nonnull String key, @Nullable Object value) {
      Objects.requireNonNull(key);
      if (DATA_PLANE_URL.equals(key) || SSL_ENABLED.equals(key)) {
        throw new IllegalArgumentException(key + " has a dedicated setter");
      }
      if (value == null) {
        passthrough.remove(key);
      } else {
        passthrough.put(key, value);
      }
      return this;
    }

    public Builder batchSize(int batchSize) {
      return option(BATCH_SIZE, batchSize);
    }

    public Builder maxQueueSize(int maxQueueSize) {
      return option(MAX_QUEUE_SIZE, maxQueueSize);
    }

    public Builder flushInterval(@Nonnull Duration flushInterval) {
      return option(FLUSH_INTERVAL, flushInterval);
    }

    public Builder flushTimeout(@Nonnull Duration flushTimeout) {
      return option(FLUSH_TIMEOUT, flushTimeout);
    }

    public Builder requestTimeout(@Nonnull Duration requestTimeout) {
      return option(REQUEST_TIMEOUT, requestTimeout);
    }

    public Builder maxRetries(int maxRetries) {
      return option(MAX_RETRIES, maxRetries);
    }

    public Builder compressRequest(boolean compressRequest) {
      return option(COMPRESS_REQUEST, compressRequest);
    }

    public Builder errorHandler(@Nonnull ErrorHandler errorHandler) {
      return option(ERROR_HANDLER, errorHandler);
    }

    public Builder loggingLevel(@Nonnull LoggingLevel loggingLevel) {
      return option(LOGGING_LEVEL, loggingLevel);
    }

    public RudderOptions build() {
      return new RudderOptions(dataPlaneUrl, sslEnabled, passthrough);
    }
  }
}
