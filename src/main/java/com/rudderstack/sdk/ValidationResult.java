package com.rudderstack.sdk;

import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Outcome of checking a {@link Message} against the rules of its variant. Invalid results carry
 * the kind of the violation and a message naming the operation and the missing field.
 */
public final class ValidationResult {

  private static final ValidationResult VALID = new ValidationResult(null, null);

  @Nullable private final ErrorType errorType;
  @Nullable private final String errorMessage;

  private ValidationResult(@Nullable ErrorType errorType, @Nullable String errorMessage) {
    this.errorType = errorType;
    this.errorMessage = errorMessage;
  }

  static ValidationResult valid() {
    return VALID;
  }

  static ValidationResult invalid(ErrorType errorType, String errorMessage) {
    return new ValidationResult(errorType, errorMessage);
  }

  public boolean isValid() {
    return errorType == null;
  }

  public Optional<ErrorType> getErrorType() {
    return Optional.ofNullable(errorType);
  }

  public Optional<String> getErrorMessage() {
    return Optional.ofNullable(errorMessage);
  }

  /**
   * Raises the violation described by this result, if any.
   *
   * @throws RudderExceptions.ValidationError when the result is invalid
   */
  void throwIfInvalid() {
    if (errorType != null) {
      throw new RudderExceptions.ValidationError(errorType, errorMessage);
    }
  }

  @Override
  public String toString() {
    return isValid()
        ? "ValidationResult{valid}"
        : "ValidationResult{" + errorType + ", '" + errorMessage + "'}";
  }
}
