package com.rudderstack.sdk;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * Validated endpoint configuration produced by {@link DataPlaneEndpoint#configure(String,
 * RudderOptions)}. The data plane URL never carries a scheme; the scheme is held separately in
 * {@link #getProtocol()}.
 */
public final class Configuration {

  private final String secretKey;
  private final String dataPlaneUrl;
  private final Protocol protocol;
  private final Map<String, Object> options;

  Configuration(
      String secretKey, String dataPlaneUrl, Protocol protocol, Map<String, Object> options) {
    this.secretKey = Objects.requireNonNull(secretKey);
    this.dataPlaneUrl = Objects.requireNonNull(dataPlaneUrl);
    this.protocol = Objects.requireNonNull(protocol);
    this.options = Objects.requireNonNull(options);
  }

  @Nonnull
  public String getSecretKey() {
    return secretKey;
  }

  /** Host and optional path of the data plane, e.g. {@code hosted.rudderlabs.com/v1}. */
  @Nonnull
  public String getDataPlaneUrl() {
    return dataPlaneUrl;
  }

  @Nonnull
  public Protocol getProtocol() {
    return protocol;
  }

  @Nonnull
  public String baseUrl() {
    return protocol.scheme() + "://" + dataPlaneUrl;
  }

  /** Options the configuration did not interpret, for the delivery client. */
  @Nonnull
  public Map<String, Object> getOptions() {
    return options;
  }

  public Optional<Object> getOption(String key) {
    return Optional.ofNullable(options.get(key));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    final Configuration that = (Configuration) o;
    return secretKey.equals(that.secretKey)
        && dataPlaneUrl.equals(that.dataPlaneUrl)
        && protocol == that.protocol
        && options.equals(that.options);
  }

  @Override
  public int hashCode() {
    return Objects.hash(secretKey, dataPlaneUrl, protocol, options);
  }

  @Override
  public String toString() {
    return "Configuration{"
        + "dataPlaneUrl="
        + dataPlaneUrl
        + ", protocol="
        + protocol
        + ", options="
        + options.keySet()
        + '}';
  }
}
