package io.github.themoah.kpiwatch.config;

import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Typed lookups over an environment-like source, falling back to defaults on
 * missing or malformed values.
 */
public final class EnvReader {

  private static final Logger log = LoggerFactory.getLogger(EnvReader.class);

  private final Function<String, String> source;

  public EnvReader(Function<String, String> source) {
    this.source = source;
  }

  public static EnvReader system() {
    return new EnvReader(System::getenv);
  }

  public String getString(String name, String defaultValue) {
    String value = source.apply(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return value.trim();
  }

  public boolean getBoolean(String name, boolean defaultValue) {
    String value = source.apply(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  public int getInt(String name, int defaultValue) {
    String value = source.apply(name);
    if (value != null && !value.isBlank()) {
      try {
        return Integer.parseInt(value.trim());
      } catch (NumberFormatException e) {
        log.warn("Invalid integer for {}: '{}', using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }

  public long getLong(String name, long defaultValue) {
    String value = source.apply(name);
    if (value != null && !value.isBlank()) {
      try {
        return Long.parseLong(value.trim());
      } catch (NumberFormatException e) {
        log.warn("Invalid long for {}: '{}', using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }

  public double getDouble(String name, double defaultValue) {
    String value = source.apply(name);
    if (value != null && !value.isBlank()) {
      try {
        return Double.parseDouble(value.trim());
      } catch (NumberFormatException e) {
        log.warn("Invalid number for {}: '{}', using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }
}
