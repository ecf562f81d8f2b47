package com.rudderstack.sdk;

public enum MessageType {
  TRACK("track"),
  IDENTIFY("identify"),
  GROUP("group"),
  PAGE("page"),
  SCREEN("screen"),
  ALIAS("alias");

  private final String wireName;

  MessageType(String wireName) {
    this.wireName = wireName;
  }

  /** Name of the message type on the wire and in error messages. */
  public String wireName() {
    return wireName;
  }

  @Override
  public String toString() {
    return wireName;
  }
}
