package com.rudderstack.sdk;

import static com.google.common.base.Strings.isNullOrEmpty;

import javax.annotation.Nonnull;

/**
 * Presence checks for each message variant. The variant's own field is checked before the shared
 * identity rule, so a track call missing both its event and its ids reports the event.
 */
public final class MessageValidator {

  private MessageValidator() {}

  @Nonnull
  public static ValidationResult validate(@Nonnull Message message) {
    switch (message.type()) {
      case TRACK:
        if (isNullOrEmpty(((Message.Track) message).event())) {
          return ValidationResult.invalid(ErrorType.MISSING_EVENT, "track() expects an event");
        }
        return validateIdentity(message);
      case GROUP:
        if (isNullOrEmpty(((Message.Group) message).groupId())) {
          return ValidationResult.invalid(ErrorType.MISSING_GROUP_ID, "group() expects groupId");
        }
        return validateIdentity(message);
      case ALIAS:
        return validateAlias((Message.Alias) message);
      case IDENTIFY:
      case PAGE:
      case SCREEN:
        return validateIdentity(message);
      default:
        throw new IllegalArgumentException("Unsupported message type: " + message.type());
    }
  }

  private static ValidationResult validateAlias(Message.Alias alias) {
    if (isNullOrEmpty(alias.userId()) || isNullOrEmpty(alias.previousId())) {
      return ValidationResult.invalid(
          ErrorType.MISSING_ALIAS_IDS, "alias() requires both userId and previousId");
    }
    return ValidationResult.valid();
  }

  private static ValidationResult validateIdentity(Message message) {
    if (isNullOrEmpty(message.userId()) && isNullOrEmpty(message.anonymousId())) {
      return ValidationResult.invalid(
          ErrorType.MISSING_IDENTITY,
          String.format("%s() requires userId or anonymousId", message.type().wireName()));
    }
    return ValidationResult.valid();
  }
}
