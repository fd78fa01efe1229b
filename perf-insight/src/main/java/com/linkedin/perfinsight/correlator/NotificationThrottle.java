/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight.correlator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.perfinsight.common.utils.Utils.validateNotNull;


/**
 * A throttle to allow at most one notification per group key within the notification cooldown.
 */
public class NotificationThrottle {
  private static final Logger LOG = LoggerFactory.getLogger(NotificationThrottle.class);
  private final long _cooldownMs;
  private final Map<String, Long> _lastNotificationTimeByGroupKey;

  public NotificationThrottle(AlertCorrelatorConfig config) {
    this(config.getLong(AlertCorrelatorConfig.ALERT_NOTIFICATION_COOLDOWN_MS_CONFIG),
         config.getInt(AlertCorrelatorConfig.ALERT_NOTIFICATION_MAX_TRACKED_KEYS_CONFIG));
  }

  /**
   * @param cooldownMs Minimum time between two notifications of the same group key.
   * @param maxTrackedKeys Maximum number of group keys to track.
   */
  public NotificationThrottle(long cooldownMs, int maxTrackedKeys) {
    if (cooldownMs < 0 || maxTrackedKeys < 1) {
      throw new IllegalArgumentException(String.format("Invalid notification cooldown %d or max tracked keys %d.",
                                                       cooldownMs, maxTrackedKeys));
    }
    _cooldownMs = cooldownMs;
    _lastNotificationTimeByGroupKey = new LinkedHashMap<>() {
      @Override
      protected boolean removeEldestEntry(Map.Entry<String, Long> eldest) {
        return this.size() > maxTrackedKeys;
      }
    };
  }

  /**
   * Record a notification for the given group key at the given time unless another notification for the same key was
   * recorded within the cooldown.
   *
   * @param groupKey Group key, such as {@link Alert#groupKey()}.
   * @param nowMs The current time in epoch milliseconds.
   * @return {@code true} if the notification is allowed, {@code false} if it should be suppressed.
   */
  public synchronized boolean tryAcquire(String groupKey, long nowMs) {
    validateNotNull(groupKey, "Group key cannot be null.");
    Long lastNotificationTimeMs = _lastNotificationTimeByGroupKey.get(groupKey);
    if (lastNotificationTimeMs != null && nowMs - lastNotificationTimeMs < _cooldownMs) {
      LOG.debug("Suppressed notification for {} within the cooldown of {}ms since {}.", groupKey, _cooldownMs,
                lastNotificationTimeMs);
      return false;
    }
    // Re-insert to track the key as the most recent one.
    _lastNotificationTimeByGroupKey.remove(groupKey);
    _lastNotificationTimeByGroupKey.put(groupKey, nowMs);
    return true;
  }

  /**
   * Package private for unit test.
   * @return Last notification time by group key.
   */
  synchronized Map<String, Long> lastNotificationTimeByGroupKey() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(_lastNotificationTimeByGroupKey));
  }
}
