package com.rudderstack.sdk;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nonnull;

/**
 * Process-wide entry point for applications that want a single dispatcher without passing an
 * {@link EventDispatcher} around.
 *
 * <p>{@link #initialize(String, RudderOptions)} installs the dispatcher once; a second call fails
 * until {@link #shutdown()} has cleared it. Tracking calls made before initialization raise {@link
 * RudderExceptions.NotInitializedError}.
 */
public final class Rudder {

  private static final AtomicReference<EventDispatcher> INSTANCE = new AtomicReference<>();

  private Rudder() {}

  /**
   * @throws RudderExceptions.ConfigError if the options are invalid or a dispatcher is already
   *     installed
   */
  public static void initialize(String secretKey, @Nonnull RudderOptions options) {
    initialize(secretKey, options, BatchingDeliveryClient::create);
  }

  public static void initialize(
      String secretKey, @Nonnull RudderOptions options, @Nonnull DeliveryClientFactory factory) {
    if (INSTANCE.get() != null) {
      throw alreadyInitialized();
    }
    final EventDispatcher dispatcher =
        EventDispatcher.builder(secretKey).options(options).deliveryClientFactory(factory).build();
    if (!INSTANCE.compareAndSet(null, dispatcher)) {
      final RudderExceptions.ConfigError error = alreadyInitialized();
      try {
        dispatcher.close();
      } catch (IOException e) {
        error.addSuppressed(e);
      }
      throw error;
    }
  }

  public static boolean isInitialized() {
    return INSTANCE.get() != null;
  }

  /** @return whether the track call succeeded */
  public static boolean track(@Nonnull Message.Track message) {
    return checkClient().track(message);
  }

  /** @return whether the identify call succeeded */
  public static boolean identify(@Nonnull Message.Identify message) {
    return checkClient().identify(message);
  }

  /** @return whether the group call succeeded */
  public static boolean group(@Nonnull Message.Group message) {
    return checkClient().group(message);
  }

  /** @return whether the page call succeeded */
  public static boolean page(@Nonnull Message.Page message) {
    return checkClient().page(message);
  }

  /** @return whether the screen call succeeded */
  public static boolean screen(@Nonnull Message.Screen message) {
    return checkClient().screen(message);
  }

  /** @return whether the alias call succeeded */
  public static boolean alias(@Nonnull Message.Alias message) {
    return checkClient().alias(message);
  }

  public static boolean flush() {
    return checkClient().flush();
  }

  /** Closes the installed dispatcher, if any, and allows {@link #initialize} to be called again. */
  public static void shutdown() throws IOException {
    final EventDispatcher dispatcher = INSTANCE.getAndSet(null);
    if (dispatcher != null) {
      dispatcher.close();
    }
  }

  private static EventDispatcher checkClient() {
    final EventDispatcher dispatcher = INSTANCE.get();
    if (dispatcher == null) {
      throw new RudderExceptions.NotInitializedError(
          "Rudder.initialize() must be called before any other tracking method.");
    }
    return dispatcher;
  }

  private static RudderExceptions.ConfigError alreadyInitialized() {
    return new RudderExceptions.ConfigError(
        "Rudder.initialize() has already been called; call Rudder.shutdown() first");
  }
}
