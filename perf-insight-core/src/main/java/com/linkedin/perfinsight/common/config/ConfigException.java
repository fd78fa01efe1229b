/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.perfinsight.common.config;

/**
 * Thrown on an invalid configuration: a value that cannot be parsed or fails validation, a missing required
 * configuration, or a configuration defined twice.
 */
public class ConfigException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public ConfigException(String message) {
    super(message);
  }

  /**
   * @param name Configuration name.
   * @param value The invalid value.
   * @param reason Why the value is invalid, or {@code null} if unknown.
   */
  public ConfigException(String name, Object value, String reason) {
    super(String.format("Configuration %s has invalid value %s%s", name, value, reason == null ? "." : ": " + reason));
  }
}
