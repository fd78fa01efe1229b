/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight.exception;

/**
 * Base checked exception of perf-insight, such as for a pluggable class that cannot be instantiated.
 */
public class PerfInsightException extends Exception {

  public PerfInsightException(String message, Throwable cause) {
    super(message, cause);
  }

  public PerfInsightException(String message) {
    super(message);
  }
}
