/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight.correlator;

import com.linkedin.perfinsight.common.config.AbstractConfig;
import com.linkedin.perfinsight.common.config.ConfigDef;
import java.util.Map;

import static com.linkedin.perfinsight.common.config.ConfigDef.Range.atLeast;
import static com.linkedin.perfinsight.common.config.ConfigDef.ValidString.in;


public class AlertCorrelatorConfig extends AbstractConfig {
  /**
   * <code>alert.grouping.window.ms</code>
   */
  public static final String ALERT_GROUPING_WINDOW_MS_CONFIG = "alert.grouping.window.ms";
  public static final long DEFAULT_ALERT_GROUPING_WINDOW_MS = 600000L;
  public static final String ALERT_GROUPING_WINDOW_MS_DOC =
      "The maximum time difference in milliseconds between two alerts of the same type and severity for them to be "
      + "grouped together. A group is closed as idle once its most recent alert is older than this window.";

  /**
   * <code>alert.max.open.groups</code>
   */
  public static final String ALERT_MAX_OPEN_GROUPS_CONFIG = "alert.max.open.groups";
  public static final int DEFAULT_ALERT_MAX_OPEN_GROUPS = 1000;
  public static final String ALERT_MAX_OPEN_GROUPS_DOC =
      "The maximum number of open alert groups. Opening a group beyond this limit closes the open group with the "
      + "oldest most recent alert.";

  /**
   * <code>alert.escalation.min.severity</code>
   */
  public static final String ALERT_ESCALATION_MIN_SEVERITY_CONFIG = "alert.escalation.min.severity";
  public static final String DEFAULT_ALERT_ESCALATION_MIN_SEVERITY = AlertSeverity.CRITICAL.toString();
  public static final String ALERT_ESCALATION_MIN_SEVERITY_DOC =
      "The minimum severity of an alert to be escalated immediately, in addition to being grouped. Supported "
      + "severities: info, warning, error, critical.";

  /**
   * <code>alert.notification.cooldown.ms</code>
   */
  public static final String ALERT_NOTIFICATION_COOLDOWN_MS_CONFIG = "alert.notification.cooldown.ms";
  public static final long DEFAULT_ALERT_NOTIFICATION_COOLDOWN_MS = 300000L;
  public static final String ALERT_NOTIFICATION_COOLDOWN_MS_DOC =
      "The minimum time in milliseconds between two notifications for alert groups of the same type and severity.";

  /**
   * <code>alert.notification.max.tracked.keys</code>
   */
  public static final String ALERT_NOTIFICATION_MAX_TRACKED_KEYS_CONFIG = "alert.notification.max.tracked.keys";
  public static final int DEFAULT_ALERT_NOTIFICATION_MAX_TRACKED_KEYS = 1000;
  public static final String ALERT_NOTIFICATION_MAX_TRACKED_KEYS_DOC =
      "The maximum number of alert group keys whose last notification time is tracked. The earliest tracked key is "
      + "dropped when the limit is exceeded.";

  /**
   * <code>anomaly.alert.type</code>
   */
  public static final String ANOMALY_ALERT_TYPE_CONFIG = "anomaly.alert.type";
  public static final String DEFAULT_ANOMALY_ALERT_TYPE = "performance";
  public static final String ANOMALY_ALERT_TYPE_DOC = "The type of the alerts raised for metric anomalies.";

  private static final ConfigDef CONFIG =
      new ConfigDef().define(ALERT_GROUPING_WINDOW_MS_CONFIG,
                             ConfigDef.Type.LONG,
                             DEFAULT_ALERT_GROUPING_WINDOW_MS,
                             atLeast(0),
                             ALERT_GROUPING_WINDOW_MS_DOC)
                     .define(ALERT_MAX_OPEN_GROUPS_CONFIG,
                             ConfigDef.Type.INT,
                             DEFAULT_ALERT_MAX_OPEN_GROUPS,
                             atLeast(1),
                             ALERT_MAX_OPEN_GROUPS_DOC)
                     .define(ALERT_ESCALATION_MIN_SEVERITY_CONFIG,
                             ConfigDef.Type.STRING,
                             DEFAULT_ALERT_ESCALATION_MIN_SEVERITY,
                             in("info", "warning", "error", "critical"),
                             ALERT_ESCALATION_MIN_SEVERITY_DOC)
                     .define(ALERT_NOTIFICATION_COOLDOWN_MS_CONFIG,
                             ConfigDef.Type.LONG,
                             DEFAULT_ALERT_NOTIFICATION_COOLDOWN_MS,
                             atLeast(0),
                             ALERT_NOTIFICATION_COOLDOWN_MS_DOC)
                     .define(ALERT_NOTIFICATION_MAX_TRACKED_KEYS_CONFIG,
                             ConfigDef.Type.INT,
                             DEFAULT_ALERT_NOTIFICATION_MAX_TRACKED_KEYS,
                             atLeast(1),
                             ALERT_NOTIFICATION_MAX_TRACKED_KEYS_DOC)
                     .define(ANOMALY_ALERT_TYPE_CONFIG,
                             ConfigDef.Type.STRING,
                             DEFAULT_ANOMALY_ALERT_TYPE,
                             new ConfigDef.NonEmptyString(),
                             ANOMALY_ALERT_TYPE_DOC);

  public AlertCorrelatorConfig(Map<?, ?> originals) {
    super(CONFIG, originals);
  }

  /**
   * @return A copy of the definition of the alert correlator configs.
   */
  public static ConfigDef definition() {
    return new ConfigDef(CONFIG);
  }
}
