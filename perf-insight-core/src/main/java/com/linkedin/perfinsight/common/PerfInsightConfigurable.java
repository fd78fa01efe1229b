/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.perfinsight.common;

import java.util.Map;


/**
 * Implemented by pluggable classes, such as trend analyzers, that are instantiated by name and then configured with
 * the original properties.
 */
public interface PerfInsightConfigurable {

  /**
   * @param configs Original properties by name.
   */
  void configure(Map<String, ?> configs);
}
