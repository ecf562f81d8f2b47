package com.rudderstack.sdk;

/** Transport scheme used to reach the data plane. */
public enum Protocol {
  HTTP("http"),
  HTTPS("https");

  private final String scheme;

  Protocol(String scheme) {
    this.scheme = scheme;
  }

  public String scheme() {
    return scheme;
  }

  static Protocol forSsl(boolean sslEnabled) {
    return sslEnabled ? HTTPS : HTTP;
  }

  @Override
  public String toString() {
    return scheme;
  }
}
