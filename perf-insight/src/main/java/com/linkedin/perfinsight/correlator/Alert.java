/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight.correlator;

import java.util.Objects;

import static com.linkedin.perfinsight.PerfInsightUtils.ensureValidString;
import static com.linkedin.perfinsight.PerfInsightUtils.utcDateFor;
import static com.linkedin.perfinsight.common.utils.Utils.validateNotNull;


/**
 * An immutable alert raised by a producer, such as the trend analyzer or an external monitor.
 */
public final class Alert {
  private final String _id;
  private final String _type;
  private final AlertSeverity _severity;
  private final String _message;
  private final long _timestampMs;

  /**
   * @param id Identifier of the alert.
   * @param type Type of the alert, such as {@code performance}.
   * @param severity Severity of the alert.
   * @param message Human-readable message of the alert.
   * @param timestampMs Time the alert was raised in epoch milliseconds.
   */
  public Alert(String id, String type, AlertSeverity severity, String message, long timestampMs) {
    ensureValidString("Alert id", id);
    ensureValidString("Alert type", type);
    _id = id;
    _type = type;
    _severity = validateNotNull(severity, "Alert severity cannot be null.");
    _message = validateNotNull(message, "Alert message cannot be null.");
    _timestampMs = timestampMs;
  }

  public String id() {
    return _id;
  }

  public String type() {
    return _type;
  }

  public AlertSeverity severity() {
    return _severity;
  }

  public String message() {
    return _message;
  }

  public long timestampMs() {
    return _timestampMs;
  }

  /**
   * @return The key shared by all alerts that may be grouped with this alert.
   */
  public String groupKey() {
    return _type + ":" + _severity;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Alert alert = (Alert) o;
    return _timestampMs == alert._timestampMs
           && _id.equals(alert._id)
           && _type.equals(alert._type)
           && _severity == alert._severity
           && _message.equals(alert._message);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_id, _type, _severity, _message, _timestampMs);
  }

  @Override
  public String toString() {
    return String.format("{%s: %s %s at %s: %s}", _id, _severity, _type, utcDateFor(_timestampMs), _message);
  }
}
