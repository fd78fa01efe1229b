/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.perfinsight.common.config;

import com.linkedin.perfinsight.common.PerfInsightConfigurable;
import com.linkedin.perfinsight.common.utils.Utils;
import com.linkedin.perfinsight.exception.PerfInsightException;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Base class of configurations. It keeps the properties as given, and their values parsed against a
 * {@link ConfigDef}.
 */
public class AbstractConfig {
  private final Logger _log = LoggerFactory.getLogger(getClass());
  private final ConfigDef _definition;
  private final Map<String, ?> _originals;
  private final Map<String, Object> _values;

  /**
   * @param definition Definition to parse the given properties against.
   * @param originals Properties by name.
   * @param doLog {@code true} to log the parsed values at INFO level.
   * @throws ConfigException If a property name is not a string, or a property is invalid.
   */
  public AbstractConfig(ConfigDef definition, Map<?, ?> originals, boolean doLog) {
    _definition = definition;
    _originals = withStringKeys(originals);
    _values = definition.parse(_originals);
    if (doLog) {
      _log.info("{} values: {}", getClass().getSimpleName(), new TreeMap<>(_values));
    }
  }

  public AbstractConfig(ConfigDef definition, Map<?, ?> originals) {
    this(definition, originals, true);
  }

  @SuppressWarnings("unchecked")
  private static Map<String, ?> withStringKeys(Map<?, ?> originals) {
    for (Object key : originals.keySet()) {
      if (!(key instanceof String)) {
        throw new ConfigException(String.valueOf(key), originals.get(key), "Configuration names must be strings.");
      }
    }
    return (Map<String, ?>) originals;
  }

  protected Object get(String key) {
    if (!_values.containsKey(key)) {
      throw new ConfigException(String.format("Unknown configuration '%s'", key));
    }
    return _values.get(key);
  }

  public Integer getInt(String key) {
    return (Integer) get(key);
  }

  public Long getLong(String key) {
    return (Long) get(key);
  }

  public Double getDouble(String key) {
    return (Double) get(key);
  }

  @SuppressWarnings("unchecked")
  public List<String> getList(String key) {
    return (List<String>) get(key);
  }

  public Boolean getBoolean(String key) {
    return (Boolean) get(key);
  }

  public String getString(String key) {
    return (String) get(key);
  }

  public Class<?> getClass(String key) {
    return (Class<?>) get(key);
  }

  /**
   * @return Names of the given properties that this configuration does not define, in sorted order.
   */
  public Set<String> unused() {
    Set<String> unused = new TreeSet<>(_originals.keySet());
    unused.removeAll(_definition.names());
    return Collections.unmodifiableSet(unused);
  }

  /**
   * @return A copy of the properties as given.
   */
  public Map<String, Object> originals() {
    return new HashMap<>(_originals);
  }

  /**
   * Log a warning for each given property that this configuration does not define.
   */
  public void logUnused() {
    unused().forEach(key -> _log.warn("The configuration '{}' was supplied but isn't a known config.", key));
  }

  /**
   * Instantiate the class of the given configuration, and configure it with the original properties if it is
   * {@link PerfInsightConfigurable}.
   *
   * @param key Name of a configuration of type {@link ConfigDef.Type#CLASS}.
   * @param t The type the instance must have.
   * @param <T> The type of the instance.
   * @return The configured instance, or {@code null} if the configuration has no value.
   * @throws PerfInsightException If the class cannot be instantiated or is not of the given type.
   */
  public <T> T getConfiguredInstance(String key, Class<T> t) throws PerfInsightException {
    Class<?> c = getClass(key);
    if (c == null) {
      return null;
    }
    if (!t.isAssignableFrom(c)) {
      throw new PerfInsightException(c.getName() + " configured in " + key + " is not an instance of " + t.getName());
    }
    T instance = t.cast(Utils.newInstance(c));
    if (instance instanceof PerfInsightConfigurable) {
      ((PerfInsightConfigurable) instance).configure(originals());
    }
    return instance;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return _originals.equals(((AbstractConfig) o)._originals);
  }

  @Override
  public int hashCode() {
    return _originals.hashCode();
  }
}
