package com.rudderstack.sdk;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

final class SdkUtils {

  static final String LIBRARY_NAME = "rudder-sdk-java";

  private SdkUtils() {}

  static String getSdkVersion() {
    try (InputStream stream = SdkUtils.class.getResourceAsStream("/version.properties")) {
      if (stream == null) {
        throw new IOException("version.properties not found on the classpath");
      }
      final Properties prop = new Properties();
      prop.load(stream);
      return prop.getProperty("version");
    } catch (IOException e) {
      throw new RuntimeException("Can't determine version of the SDK", e);
    }
  }

  static String userAgent() {
    return LIBRARY_NAME + "/" + getSdkVersion();
  }
}
