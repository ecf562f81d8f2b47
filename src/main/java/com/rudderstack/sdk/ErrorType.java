package com.rudderstack.sdk;

public enum ErrorType {
  MISSING_EVENT,
  MISSING_GROUP_ID,
  MISSING_ALIAS_IDS,
  MISSING_IDENTITY
}
