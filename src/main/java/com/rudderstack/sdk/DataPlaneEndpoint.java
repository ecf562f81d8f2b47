package com.rudderstack.sdk;

import static com.google.common.base.Strings.isNullOrEmpty;

import com.google.common.annotations.VisibleForTesting;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.regex.Pattern;
import javax.annotation.Nonnull;

/**
 * Turns a secret key and raw options into a {@link Configuration}.
 *
 * <p>A URL without a scheme is assumed to be secure and gets {@code https://} prepended before it
 * is validated. The scheme of the URL must then agree with the {@code sslEnabled} option (absent
 * means {@code true}), so a scheme-less URL combined with {@code sslEnabled=false} is rejected.
 */
public final class DataPlaneEndpoint {

  static final String INVALID_URL = "data plane URL input is invalid";
  static final String INCOMPATIBLE_SSL =
      "data plane URL and SSL options are incompatible with each other";

  private static final Pattern SCHEME_PREFIX = Pattern.compile("^[A-Za-z][A-Za-z0-9+.-]*://");
  private static final Pattern HTTP_SCHEME_PREFIX =
      Pattern.compile("^https?://", Pattern.CASE_INSENSITIVE);

  private DataPlaneEndpoint() {}

  /**
   * Validates and normalizes the data plane endpoint.
   *
   * @throws RudderExceptions.ConfigError if the secret key is empty, the data plane URL is missing
   *     or malformed, or its scheme contradicts {@code sslEnabled}
   */
  @Nonnull
  public static Configuration configure(String secretKey, @Nonnull RudderOptions options) {
    if (isNullOrEmpty(secretKey)) {
      throw new RudderExceptions.ConfigError("Rudder.initialize() requires secret");
    }
    final String rawUrl = options.getDataPlaneUrl().orElse(null);
    if (isNullOrEmpty(rawUrl)) {
      throw new RudderExceptions.ConfigError("Rudder.initialize() requires dataPlaneURL");
    }

    final String url = withDefaultScheme(rawUrl);
    final URI uri = parseAbsolute(url);
    final Protocol protocol = Protocol.forSsl(options.getSslEnabled().orElse(true));
    if (!protocol.scheme().equals(uri.getScheme().toLowerCase(Locale.ROOT))) {
      throw new RudderExceptions.ConfigError(INCOMPATIBLE_SSL);
    }
    return new Configuration(secretKey, stripScheme(url), protocol, options.getPassthrough());
  }

  @VisibleForTesting
  static String withDefaultScheme(String url) {
    return SCHEME_PREFIX.matcher(url).find() ? url : Protocol.HTTPS.scheme() + "://" + url;
  }

  @VisibleForTesting
  static String stripScheme(String url) {
    return HTTP_SCHEME_PREFIX.matcher(url).replaceFirst("");
  }

  private static URI parseAbsolute(String url) {
    final URI uri;
    try {
      uri = new URI(url);
    } catch (URISyntaxException e) {
      throw new RudderExceptions.ConfigError(INVALID_URL, e);
    }
    if (!uri.isAbsolute() || isNullOrEmpty(uri.getHost())) {
      throw new RudderExceptions.ConfigError(INVALID_URL);
    }
    return uri;
  }
}
