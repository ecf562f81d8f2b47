package com.rudderstack.sdk;

public class RudderExceptions {

  private RudderExceptions() {}

  /** The secret key or data plane options cannot produce a usable {@link Configuration}. */
  public static class ConfigError extends IllegalArgumentException {
    public ConfigError(String message) {
      super(message);
    }

    public ConfigError(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** A tracking call reached a dispatcher that was never initialized, or was already closed. */
  public static class NotInitializedError extends IllegalStateException {
    public NotInitializedError(String message) {
      super(message);
    }
  }

  /** A message is missing a field its variant requires. */
  public static class ValidationError extends IllegalArgumentException {
    private final ErrorType errorType;

    public ValidationError(ErrorType errorType, String message) {
      super(message);
      this.errorType = errorType;
    }

    public ErrorType getErrorType() {
      return errorType;
    }
  }
}
