package com.rudderstack.sdk;

import com.google.common.annotations.VisibleForTesting;
import java.io.Closeable;
import java.io.IOException;
import java.util.Objects;
import java.util.function.Predicate;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Validates analytics calls and hands them to a {@link DeliveryClient}.
 *
 * <p>Every call first checks that the dispatcher is still open, then applies the rules of its
 * message variant (see {@link MessageValidator}), then delegates and returns the delivery client's
 * answer unchanged. Validation failures are raised as {@link RudderExceptions.ValidationError}
 * before anything is delegated.
 *
 * <pre>{@code
 * EventDispatcher rudder =
 *     EventDispatcher.builder("secret")
 *         .options(RudderOptions.builder().dataPlaneUrl("hosted.rudderlabs.com").build())
 *         .build();
 * rudder.track(Message.track().event("Signed Up").userId("u1").build());
 * }</pre>
 */
public class EventDispatcher implements Closeable {

  private final Configuration configuration;
  @Nullable private volatile DeliveryClient client;

  private EventDispatcher(Configuration configuration, DeliveryClient client) {
    this.configuration = configuration;
    this.client = client;
  }

  public static EventDispatcher create(
      @Nonnull Configuration configuration, @Nonnull DeliveryClientFactory factory) {
    final DeliveryClient client = factory.create(configuration);
    return new EventDispatcher(configuration, Objects.requireNonNull(client));
  }

  public static Builder builder(String secretKey) {
    return new Builder(secretKey);
  }

  @Nonnull
  public Configuration getConfiguration() {
    return configuration;
  }

  public boolean track(@Nonnull Message.Track message) {
    return dispatch(message, client()::track);
  }

  public boolean identify(@Nonnull Message.Identify message) {
    return dispatch(message, client()::identify);
  }

  public boolean group(@Nonnull Message.Group message) {
    return dispatch(message, client()::group);
  }

  public boolean page(@Nonnull Message.Page message) {
    return dispatch(message, client()::page);
  }

  public boolean screen(@Nonnull Message.Screen message) {
    return dispatch(message, client()::screen);
  }

  public boolean alias(@Nonnull Message.Alias message) {
    return dispatch(message, client()::alias);
  }

  public boolean flush() {
    return client().flush();
  }

  private static <M extends Message> boolean dispatch(M message, Predicate<M> delivery) {
    MessageValidator.validate(Objects.requireNonNull(message)).throwIfInvalid();
    return delivery.test(message);
  }

  @VisibleForTesting
  DeliveryClient client() {
    final DeliveryClient current = client;
    if (current == null) {
      throw new RudderExceptions.NotInitializedError("EventDispatcher has been closed");
    }
    return current;
  }

  @Override
  public void close() throws IOException {
    final DeliveryClient current;
    synchronized (this) {
      current = client;
      client = null;
    }
    if (current != null) {
      current.close();
    }
  }

  public static class Builder {
    private final String secretKey;
    private RudderOptions options = RudderOptions.builder().build();
    private DeliveryClientFactory deliveryClientFactory = BatchingDeliveryClient::create;

    private Builder(String secretKey) {
      this.secretKey = secretKey;
    }

    public Builder options(@Nonnull RudderOptions options) {
      this.options = Objects.requireNonNull(options);
      return this;
    }

    public Builder deliveryClientFactory(@Nonnull DeliveryClientFactory deliveryClientFactory) {
      this.deliveryClientFactory = Objects.requireNonNull(deliveryClientFactory);
      return this;
    }

    /**
     * @throws RudderExceptions.ConfigError if the secret key or data plane options are invalid
     */
    public EventDispatcher build() {
      final Configuration configuration = DataPlaneEndpoint.configure(secretKey, options);
      options.getLoggingLevel().ifPresent(LoggingConfigurator::configureLogging);
      return create(configuration, deliveryClientFactory);
    }
  }
}
