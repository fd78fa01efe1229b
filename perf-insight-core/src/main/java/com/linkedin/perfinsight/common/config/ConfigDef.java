/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.perfinsight.common.config;

import com.linkedin.perfinsight.common.utils.Utils;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;


/**
 * The set of configurations a component accepts. Each configuration has a name, a {@link Type}, an optional default
 * value, an optional {@link Validator} and documentation. For instance:
 * <pre>
 * ConfigDef definition = new ConfigDef()
 *     .define("trend.slope.epsilon", Type.DOUBLE, 0.5, Range.atLeast(0.0), "Doc.")
 *     .define("metric.classes", Type.LIST, "", "Doc.");
 * Map&lt;String, Object&gt; values = definition.parse(props);
 * </pre>
 * Definitions of separate components can be combined with {@link #withMissingKeysOf(ConfigDef)}. See
 * {@link AbstractConfig} for typed access to the parsed values.
 */
public class ConfigDef {
  /**
   * Marks a configuration that must be set explicitly.
   */
  public static final Object NO_DEFAULT_VALUE = new Object();

  private final Map<String, ConfigKey> _configKeys;

  public ConfigDef() {
    _configKeys = new LinkedHashMap<>();
  }

  /**
   * @param base Definition whose configurations this definition starts with.
   */
  public ConfigDef(ConfigDef base) {
    _configKeys = new LinkedHashMap<>(base._configKeys);
  }

  /**
   * @return The names of the defined configurations, in definition order.
   */
  public Set<String> names() {
    return Collections.unmodifiableSet(_configKeys.keySet());
  }

  /**
   * @param key Configuration to define.
   * @return This definition.
   * @throws ConfigException If a configuration of the same name is already defined.
   */
  public ConfigDef define(ConfigKey key) {
    if (_configKeys.putIfAbsent(key.name(), key) != null) {
      throw new ConfigException("Configuration " + key.name() + " is defined twice.");
    }
    return this;
  }

  public ConfigDef define(String name, Type type, Object defaultValue, Validator validator, String documentation) {
    return define(new ConfigKey(name, type, defaultValue, validator, documentation));
  }

  public ConfigDef define(String name, Type type, Object defaultValue, String documentation) {
    return define(name, type, defaultValue, null, documentation);
  }

  /**
   * Add the configurations of the given definition whose names are not defined here yet.
   *
   * @param other Definition to take configurations from.
   * @return This definition.
   */
  public ConfigDef withMissingKeysOf(ConfigDef other) {
    other._configKeys.values().forEach(key -> _configKeys.putIfAbsent(key.name(), key));
    return this;
  }

  /**
   * Parse and validate the given properties. Values may be given as strings, such as in {@link java.util.Properties},
   * or already as objects of the defined type. Properties that are not defined here are ignored.
   *
   * @param props Properties by configuration name.
   * @return Parsed values by configuration name, with defaults for the configurations that are not set.
   * @throws ConfigException If a value cannot be parsed, fails validation, or a required configuration is missing.
   */
  public Map<String, Object> parse(Map<?, ?> props) {
    Map<String, Object> values = new HashMap<>();
    for (ConfigKey key : _configKeys.values()) {
      Object value;
      if (props.containsKey(key.name())) {
        value = parseType(key.name(), props.get(key.name()), key.type());
      } else if (key.hasDefault()) {
        value = key.defaultValue();
      } else {
        throw new ConfigException("Missing required configuration \"" + key.name() + "\" which has no default value: "
                                  + key.documentation());
      }
      if (key.validator() != null) {
        key.validator().ensureValid(key.name(), value);
      }
      values.put(key.name(), value);
    }
    return values;
  }

  /**
   * @param name Configuration name, used in error messages.
   * @param value Value to parse, either a string or an object of the given type.
   * @param type The type to parse the value into.
   * @return The parsed value, or {@code null} if the given value is {@code null}.
   * @throws ConfigException If the value cannot be parsed into the given type.
   */
  public static Object parseType(String name, Object value, Type type) {
    if (value == null) {
      return null;
    }
    String trimmed = value instanceof String ? ((String) value).trim() : null;
    try {
      switch (type) {
        case BOOLEAN:
          return parseBoolean(name, value, trimmed);
        case STRING:
          if (trimmed == null) {
            throw new ConfigException(name, value, "Expected a string, but found " + value.getClass().getName());
          }
          return trimmed;
        case INT:
          return value instanceof Integer ? value : Integer.valueOf(requireString(name, value, trimmed, "an int"));
        case LONG:
          if (value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
          }
          return Long.valueOf(requireString(name, value, trimmed, "a long"));
        case DOUBLE:
          if (value instanceof Number) {
            return ((Number) value).doubleValue();
          }
          return Double.valueOf(requireString(name, value, trimmed, "a double"));
        case LIST:
          return parseList(name, value, trimmed);
        case CLASS:
          return parseClass(name, value, trimmed);
        default:
          throw new IllegalStateException("Unsupported configuration type " + type);
      }
    } catch (NumberFormatException e) {
      throw new ConfigException(name, value, "Not a number of type " + type);
    }
  }

  private static String requireString(String name, Object value, String trimmed, String expected) {
    if (trimmed == null) {
      throw new ConfigException(name, value, "Expected " + expected + ", but found " + value.getClass().getName());
    }
    return trimmed;
  }

  private static Boolean parseBoolean(String name, Object value, String trimmed) {
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    if ("true".equalsIgnoreCase(trimmed)) {
      return true;
    }
    if ("false".equalsIgnoreCase(trimmed)) {
      return false;
    }
    throw new ConfigException(name, value, "Expected either true or false");
  }

  private static List<?> parseList(String name, Object value, String trimmed) {
    if (value instanceof List) {
      return (List<?>) value;
    }
    if (trimmed == null) {
      throw new ConfigException(name, value, "Expected a comma separated list");
    }
    return trimmed.isEmpty() ? Collections.emptyList() : Arrays.asList(trimmed.split("\\s*,\\s*", -1));
  }

  private static Class<?> parseClass(String name, Object value, String trimmed) {
    if (value instanceof Class) {
      return (Class<?>) value;
    }
    if (trimmed == null) {
      throw new ConfigException(name, value, "Expected a class or a class name");
    }
    try {
      return Class.forName(trimmed, true, Utils.getContextOrPerfInsightClassLoader());
    } catch (ClassNotFoundException e) {
      throw new ConfigException(name, value, "Class " + trimmed + " could not be found");
    }
  }

  public enum Type {
    BOOLEAN, STRING, INT, LONG, DOUBLE, LIST, CLASS
  }

  /**
   * Validates the parsed value of a single configuration.
   */
  public interface Validator {
    /**
     * @param name Configuration name.
     * @param value Parsed value.
     * @throws ConfigException If the value is invalid.
     */
    void ensureValid(String name, Object value);
  }

  /**
   * Numeric bounds, both inclusive.
   */
  public static final class Range implements Validator {
    private final Number _min;
    private final Number _max;

    private Range(Number min, Number max) {
      _min = min;
      _max = max;
    }

    public static Range atLeast(Number min) {
      return new Range(min, null);
    }

    public static Range between(Number min, Number max) {
      return new Range(min, max);
    }

    @Override
    public void ensureValid(String name, Object value) {
      if (!(value instanceof Number)) {
        throw new ConfigException(name, value, "Value must be a number");
      }
      double n = ((Number) value).doubleValue();
      if (n < _min.doubleValue() || (_max != null && n > _max.doubleValue())) {
        throw new ConfigException(name, value, "Value must be in " + this);
      }
    }

    @Override
    public String toString() {
      return "[" + _min + ", " + (_max == null ? "..." : _max) + "]";
    }
  }

  /**
   * Accepts one of the given strings, ignoring case.
   */
  public static final class ValidString implements Validator {
    private final List<String> _validStrings;

    private ValidString(List<String> validStrings) {
      _validStrings = validStrings;
    }

    public static ValidString in(String... validStrings) {
      return new ValidString(Arrays.asList(validStrings));
    }

    @Override
    public void ensureValid(String name, Object value) {
      if (!(value instanceof String) || _validStrings.stream().noneMatch(((String) value)::equalsIgnoreCase)) {
        throw new ConfigException(name, value, "String must be one of " + this);
      }
    }

    @Override
    public String toString() {
      return _validStrings.toString();
    }
  }

  public static class NonEmptyString implements Validator {
    @Override
    public void ensureValid(String name, Object value) {
      if (!(value instanceof String) || ((String) value).isEmpty()) {
        throw new ConfigException(name, value, "String must be non-empty");
      }
    }

    @Override
    public String toString() {
      return "non-empty string";
    }
  }

  /**
   * A single defined configuration. The default value is parsed and validated on construction.
   */
  public static final class ConfigKey {
    private final String _name;
    private final Type _type;
    private final Object _defaultValue;
    private final Validator _validator;
    private final String _documentation;

    public ConfigKey(String name, Type type, Object defaultValue, Validator validator, String documentation) {
      _name = name;
      _type = type;
      _defaultValue = defaultValue == NO_DEFAULT_VALUE ? NO_DEFAULT_VALUE : parseType(name, defaultValue, type);
      _validator = validator;
      _documentation = documentation;
      if (_validator != null && hasDefault()) {
        _validator.ensureValid(name, _defaultValue);
      }
    }

    public boolean hasDefault() {
      return _defaultValue != NO_DEFAULT_VALUE;
    }

    public String name() {
      return _name;
    }

    public Type type() {
      return _type;
    }

    public Object defaultValue() {
      return _defaultValue;
    }

    public Validator validator() {
      return _validator;
    }

    public String documentation() {
      return _documentation;
    }
  }
}
