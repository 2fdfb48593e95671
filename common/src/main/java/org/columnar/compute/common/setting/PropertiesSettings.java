/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.common.setting;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.Map;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * {@link Settings} backed by a classpath properties file. Resolution order for each key is: JVM
 * system property, properties file entry, then the key's default value.
 */
public class PropertiesSettings extends Settings {

  private static final Logger LOG = LogManager.getLogger(PropertiesSettings.class);

  public static final String DEFAULT_RESOURCE = "compute.properties";

  private final Map<Key, Object> values;

  public PropertiesSettings() {
    this(loadResource(DEFAULT_RESOURCE));
  }

  /**
   * Creates settings from explicit properties. System properties still take precedence.
   *
   * @param properties configured values keyed by {@link Key#getKeyValue()}
   */
  public PropertiesSettings(Properties properties) {
    this.values = new EnumMap<>(Key.class);
    for (Key key : Key.values()) {
      String raw = System.getProperty(key.getKeyValue(), properties.getProperty(key.getKeyValue()));
      values.put(key, raw == null ? key.getDefaultValue() : parse(key, raw.trim()));
    }
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> T getSettingValue(Key key) {
    return (T) values.get(key);
  }

  private static Object parse(Key key, String raw) {
    try {
      if (key.getValueType() == Long.class) {
        return Long.parseLong(raw);
      }
      if (key.getValueType() == Integer.class) {
        return Integer.parseInt(raw);
      }
      return raw;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          "Invalid value [" + raw + "] for setting " + key.getKeyValue(), e);
    }
  }

  private static Properties loadResource(String resource) {
    Properties properties = new Properties();
    try (InputStream in = PropertiesSettings.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        LOG.debug("No {} on classpath, using default settings", resource);
        return properties;
      }
      properties.load(in);
      return properties;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + resource, e);
    }
  }
}
