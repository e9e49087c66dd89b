/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.suppierk.eventsourcing.config;

import io.github.suppierk.eventsourcing.sse.CursorPolicy;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tunables of the event sourcing runtime. Pure POJO - no framework dependencies.
 *
 * <p>Values can be read from a {@link Properties} source with the {@code eventsourcing.} prefix,
 * see {@link #fromProperties(Properties)}. Anything absent keeps its default.
 */
public class EventSourcingConfig {
  private static final Logger logger = LoggerFactory.getLogger(EventSourcingConfig.class);

  public static final String DEFAULT_RESOURCE = "eventsourcing.properties";

  static final String NAMESPACE = "eventsourcing.namespace";
  static final String KEEP_ALIVE_SECONDS = "eventsourcing.sse.keep-alive-seconds";
  static final String CURSOR_POLICY = "eventsourcing.sse.cursor-policy";
  static final String MAX_COMMAND_ATTEMPTS = "eventsourcing.command.max-attempts";
  static final String LOCK_STRIPES = "eventsourcing.command.lock-stripes";
  static final String READ_RETRY_ATTEMPTS = "eventsourcing.read-retry.max-attempts";
  static final String READ_RETRY_BACKOFF_MILLIS = "eventsourcing.read-retry.backoff-millis";
  static final String READ_RETRY_MAX_BACKOFF_MILLIS =
      "eventsourcing.read-retry.max-backoff-millis";

  private String namespace = "events";
  private Duration keepAliveInterval = Duration.ofSeconds(15);
  private CursorPolicy cursorPolicy = CursorPolicy.FROM_BEGINNING;
  private int maxCommandAttempts = 3;
  private int lockStripes = 64;
  private int readRetryAttempts = 3;
  private Duration readRetryBackoff = Duration.ofMillis(50);
  private Duration readRetryMaxBackoff = Duration.ofSeconds(1);

  /**
   * @return configuration from {@value #DEFAULT_RESOURCE} on the classpath, or defaults if the
   *     resource does not exist
   */
  public static EventSourcingConfig load() {
    return load(DEFAULT_RESOURCE);
  }

  /**
   * @param resource classpath location of a properties file
   * @return configuration from the resource, or defaults if the resource does not exist
   * @throws UncheckedIOException if the resource exists but cannot be read
   * @throws IllegalArgumentException if a value is invalid
   */
  public static EventSourcingConfig load(String resource) {
    final ClassLoader classLoader = EventSourcingConfig.class.getClassLoader();

    try (InputStream input = classLoader.getResourceAsStream(resource)) {
      if (input == null) {
        logger.debug("No {} on the classpath, using defaults", resource);
        return new EventSourcingConfig();
      }

      final Properties properties = new Properties();
      properties.load(input);
      return fromProperties(properties);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read %s".formatted(resource), e);
    }
  }

  /**
   * @param properties holding {@code eventsourcing.*} keys
   * @return configuration with every present key applied over the defaults
   * @throws IllegalArgumentException if a value is invalid
   */
  public static EventSourcingConfig fromProperties(Properties properties) {
    final EventSourcingConfig config = new EventSourcingConfig();

    final String namespaceValue = properties.getProperty(NAMESPACE);
    if (namespaceValue != null) {
      config.setNamespace(namespaceValue.trim());
    }

    final String cursorPolicyValue = properties.getProperty(CURSOR_POLICY);
    if (cursorPolicyValue != null) {
      try {
        config.setCursorPolicy(
            CursorPolicy.valueOf(
                cursorPolicyValue.trim().toUpperCase(Locale.ROOT).replace('-', '_')));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException(
            "%s must be one of from-beginning, from-now".formatted(CURSOR_POLICY), e);
      }
    }

    final Long keepAlive = longValue(properties, KEEP_ALIVE_SECONDS);
    if (keepAlive != null) {
      config.setKeepAliveInterval(Duration.ofSeconds(keepAlive));
    }

    final Integer attempts = intValue(properties, MAX_COMMAND_ATTEMPTS);
    if (attempts != null) {
      config.setMaxCommandAttempts(attempts);
    }

    final Integer stripes = intValue(properties, LOCK_STRIPES);
    if (stripes != null) {
      config.setLockStripes(stripes);
    }

    final Integer readAttempts = intValue(properties, READ_RETRY_ATTEMPTS);
    if (readAttempts != null) {
      config.setReadRetryAttempts(readAttempts);
    }

    final Long backoff = longValue(properties, READ_RETRY_BACKOFF_MILLIS);
    if (backoff != null) {
      config.setReadRetryBackoff(Duration.ofMillis(backoff));
    }

    final Long maxBackoff = longValue(properties, READ_RETRY_MAX_BACKOFF_MILLIS);
    if (maxBackoff != null) {
      config.setReadRetryMaxBackoff(Duration.ofMillis(maxBackoff));
    }

    return config;
  }

  private static Long longValue(Properties properties, String key) {
    final String value = properties.getProperty(key);

    if (value == null) {
      return null;
    }

    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("%s must be a number".formatted(key), e);
    }
  }

  private static Integer intValue(Properties properties, String key) {
    final Long value = longValue(properties, key);

    if (value == null) {
      return null;
    }

    if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("%s is out of range".formatted(key));
    }

    return value.intValue();
  }

  private static void requirePositive(Duration value, String name) {
    if (value == null || value.isNegative() || value.isZero()) {
      throw new IllegalArgumentException("%s must be positive".formatted(name));
    }
  }

  private static void requirePositive(int value, String name) {
    if (value < 1) {
      throw new IllegalArgumentException("%s must be positive".formatted(name));
    }
  }

  public String getNamespace() {
    return namespace;
  }

  public void setNamespace(String namespace) {
    if (namespace == null || namespace.isBlank() || namespace.contains("/")) {
      throw new IllegalArgumentException("Namespace must be a single non-blank segment");
    }

    this.namespace = namespace;
  }

  public Duration getKeepAliveInterval() {
    return keepAliveInterval;
  }

  public void setKeepAliveInterval(Duration keepAliveInterval) {
    requirePositive(keepAliveInterval, "Keep-alive interval");
    this.keepAliveInterval = keepAliveInterval;
  }

  public CursorPolicy getCursorPolicy() {
    return cursorPolicy;
  }

  public void setCursorPolicy(CursorPolicy cursorPolicy) {
    if (cursorPolicy == null) {
      throw new IllegalArgumentException("Cursor policy cannot be null");
    }

    this.cursorPolicy = cursorPolicy;
  }

  public int getMaxCommandAttempts() {
    return maxCommandAttempts;
  }

  public void setMaxCommandAttempts(int maxCommandAttempts) {
    requirePositive(maxCommandAttempts, "Command attempts");
    this.maxCommandAttempts = maxCommandAttempts;
  }

  public int getLockStripes() {
    return lockStripes;
  }

  public void setLockStripes(int lockStripes) {
    requirePositive(lockStripes, "Lock stripes");
    this.lockStripes = lockStripes;
  }

  public int getReadRetryAttempts() {
    return readRetryAttempts;
  }

  public void setReadRetryAttempts(int readRetryAttempts) {
    requirePositive(readRetryAttempts, "Read retry attempts");
    this.readRetryAttempts = readRetryAttempts;
  }

  public Duration getReadRetryBackoff() {
    return readRetryBackoff;
  }

  public void setReadRetryBackoff(Duration readRetryBackoff) {
    requirePositive(readRetryBackoff, "Read retry backoff");
    this.readRetryBackoff = readRetryBackoff;
  }

  public Duration getReadRetryMaxBackoff() {
    return readRetryMaxBackoff;
  }

  public void setReadRetryMaxBackoff(Duration readRetryMaxBackoff) {
    requirePositive(readRetryMaxBackoff, "Read retry max backoff");
    this.readRetryMaxBackoff = readRetryMaxBackoff;
  }

  @Override
  public String toString() {
    return ("EventSourcingConfig{namespace=%s, keepAlive=%s, cursorPolicy=%s, commandAttempts=%d, "
            + "lockStripes=%d, readRetryAttempts=%d, readRetryBackoff=%s, readRetryMaxBackoff=%s}")
        .formatted(
            namespace,
            keepAliveInterval,
            cursorPolicy,
            maxCommandAttempts,
            lockStripes,
            readRetryAttempts,
            readRetryBackoff,
            readRetryMaxBackoff);
  }
}
