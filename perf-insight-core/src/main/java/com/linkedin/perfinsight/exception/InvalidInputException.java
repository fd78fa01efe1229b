/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.perfinsight.exception;

/**
 * Thrown if a metrics bundle or an alert group is empty, malformed, or inconsistent. The same input always fails the
 * same way.
 */
public class InvalidInputException extends PerfInsightException {
  public InvalidInputException(String message) {
    super(message);
  }
}
