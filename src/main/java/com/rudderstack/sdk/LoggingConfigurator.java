package com.rudderstack.sdk;

import java.lang.reflect.Method;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies {@link RudderOptions.LoggingLevel} to the SDK's loggers.
 *
 * <p>Works through reflection so Logback stays an optional dependency. With any other SLF4J
 * binding the call does nothing and the application's own logging setup decides.
 */
class LoggingConfigurator {

  static final String SDK_LOGGER = "com.rudderstack.sdk";

  private static final Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private static Class<?> logbackLevelClass = null;
  private static Class<?> logbackLoggerClass = null;
  private static Method setLevelMethod = null;
  private static boolean logbackAvailable = false;

  static {
    initializeLogbackSupport();
  }

  static void configureLogging(RudderOptions.LoggingLevel loggingLevel) {
    configureLogger(SDK_LOGGER, loggingLevel);
  }

  static void configureLogger(String loggerName, RudderOptions.LoggingLevel loggingLevel) {
    if (loggerName == null || loggingLevel == null || !logbackAvailable) {
      return;
    }
    try {
      final Logger slf4jLogger = LoggerFactory.getLogger(loggerName);
      if (logbackLoggerClass.isInstance(slf4jLogger)) {
        setLevelMethod.invoke(slf4jLogger, mapToLogbackLevel(loggingLevel));
      }
    } catch (ReflectiveOperationException e) {
      log.debug("Could not set level {} on logger {}", loggingLevel, loggerName, e);
    }
  }

  static boolean isLogbackAvailable() {
    return logbackAvailable;
  }

  private static void initializeLogbackSupport() {
    try {
      logbackLevelClass = Class.forName("ch.qos.logback.classic.Level");
      logbackLoggerClass = Class.forName("ch.qos.logback.classic.Logger");
      setLevelMethod = logbackLoggerClass.getMethod("setLevel", logbackLevelClass);
      logbackAvailable = true;
    } catch (ClassNotFoundException | NoSuchMethodException e) {
      logbackAvailable = false;
    }
  }

  // Logback's Level constants carry the same names as LoggingLevel
  private static Object mapToLogbackLevel(RudderOptions.LoggingLevel loggingLevel)
      throws ReflectiveOperationException {
    return logbackLevelClass.getField(loggingLevel.name()).get(null);
  }
}
