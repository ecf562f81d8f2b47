package com.rudderstack.sdk;

import java.io.Closeable;

/**
 * Sends validated messages to the data plane. Each call reports whether the message was accepted
 * for delivery, not whether it has been delivered yet.
 */
public interface DeliveryClient extends Closeable {
  boolean track(Message.Track message);

  boolean identify(Message.Identify message);

  boolean group(Message.Group message);

  boolean page(Message.Page message);

  boolean screen(Message.Screen message);

  boolean alias(Message.Alias message);

  /** Blocks until everything accepted so far has been sent, or sending has failed. */
  boolean flush();
}
