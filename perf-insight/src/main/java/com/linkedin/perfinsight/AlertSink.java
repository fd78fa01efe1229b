/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight;

import com.linkedin.perfinsight.correlator.Alert;
import com.linkedin.perfinsight.correlator.AlertGroup;


/**
 * The receiver of alert notifications, such as a dashboard or a paging integration.
 */
public interface AlertSink {

  /**
   * Notify the sink about a closed alert group.
   *
   * @param group The closed group.
   * @param summary The summary of the group.
   */
  void onGroupSummary(AlertGroup group, String summary);

  /**
   * Notify the sink about an alert that requires immediate attention. The alert is grouped as well.
   *
   * @param alert The alert to escalate.
   */
  void onEscalation(Alert alert);
}
