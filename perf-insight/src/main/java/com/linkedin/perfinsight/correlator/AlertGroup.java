/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight.correlator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.linkedin.perfinsight.common.utils.Utils.validateNotNull;


/**
 * An ordered, non-empty sequence of alerts of the same type and severity, in the order they joined the group. The most
 * recently added member is the anchor that later alerts are compared against. Groups are created and extended only by
 * {@link AlertClusterer}.
 */
public final class AlertGroup {
  private final String _groupId;
  private final List<Alert> _alerts;
  private long _firstTimestampMs;
  private long _lastTimestampMs;
  private AlertGroupState _state;

  AlertGroup(Alert firstAlert) {
    validateNotNull(firstAlert, "The first alert of a group cannot be null.");
    _groupId = firstAlert.type() + "-" + firstAlert.severity() + "-" + firstAlert.timestampMs();
    _alerts = new ArrayList<>();
    _alerts.add(firstAlert);
    _firstTimestampMs = firstAlert.timestampMs();
    _lastTimestampMs = firstAlert.timestampMs();
    _state = AlertGroupState.OPEN;
  }

  /**
   * Add the given alert to the group, which makes it the anchor of the group.
   * @param alert Alert to add.
   */
  void add(Alert alert) {
    if (_state != AlertGroupState.OPEN) {
      throw new IllegalStateException(String.format("Alert group %s is closed and cannot accept %s.", _groupId, alert));
    }
    _alerts.add(alert);
    _firstTimestampMs = Math.min(_firstTimestampMs, alert.timestampMs());
    _lastTimestampMs = Math.max(_lastTimestampMs, alert.timestampMs());
  }

  void close() {
    _state = AlertGroupState.CLOSED;
  }

  /**
   * @return Identifier of the group, derived from the type, severity and timestamp of its first member.
   */
  public String groupId() {
    return _groupId;
  }

  public String type() {
    return _alerts.get(0).type();
  }

  public AlertSeverity severity() {
    return _alerts.get(0).severity();
  }

  /**
   * @return The most recently added member.
   */
  public Alert anchor() {
    return _alerts.get(_alerts.size() - 1);
  }

  /**
   * @return A snapshot of the members in the order they joined the group.
   */
  public List<Alert> alerts() {
    return Collections.unmodifiableList(new ArrayList<>(_alerts));
  }

  public int size() {
    return _alerts.size();
  }

  public long firstTimestampMs() {
    return _firstTimestampMs;
  }

  public long lastTimestampMs() {
    return _lastTimestampMs;
  }

  public AlertGroupState state() {
    return _state;
  }

  public boolean isOpen() {
    return _state == AlertGroupState.OPEN;
  }

  @Override
  public String toString() {
    return String.format("{%s (%s): %d alerts}", _groupId, _state, _alerts.size());
  }
}
