package com.rudderstack.sdk;

/**
 * Notified by the default delivery client when a batch is dropped. {@code code} is the HTTP status
 * of the last attempt, or {@code -1} when no response was received.
 */
@FunctionalInterface
public interface ErrorHandler {
  void onError(int code, String message);
}
