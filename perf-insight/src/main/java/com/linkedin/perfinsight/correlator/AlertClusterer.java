/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight.correlator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.perfinsight.PerfInsightUtils.utcDateFor;
import static com.linkedin.perfinsight.common.utils.Utils.validateNotNull;


/**
 * Groups a stream of alerts online. Each offered alert is compared against the most recently added member (the anchor)
 * of each open group, in the order the groups were opened, and joins the first group it should be grouped with. If no
 * open group matches, the alert opens a new group. Membership is never revisited.
 *
 * Open groups are closed by the owner of the clusterer, either when they become idle ({@link #closeIdleGroups(long)}),
 * or all at once ({@link #closeAll()}). If opening a group exceeds the maximum number of open groups, the open group
 * with the oldest anchor is evicted; evicted groups are collected until {@link #drainEvicted()} is called.
 *
 * This class is not thread-safe.
 */
public class AlertClusterer {
  private static final Logger LOG = LoggerFactory.getLogger(AlertClusterer.class);
  private final AlertCorrelator _correlator;
  private final int _maxOpenGroups;
  private final List<AlertGroup> _openGroups;
  private final List<AlertGroup> _evictedGroups;
  private long _latestOfferedTimestampMs;

  /**
   * @param correlator Correlator to decide whether an alert should be grouped with the anchor of a group.
   * @param maxOpenGroups Maximum number of open groups.
   */
  public AlertClusterer(AlertCorrelator correlator, int maxOpenGroups) {
    _correlator = validateNotNull(correlator, "Alert correlator cannot be null.");
    if (maxOpenGroups < 1) {
      throw new IllegalArgumentException("Maximum number of open groups must be positive, but was " + maxOpenGroups);
    }
    _maxOpenGroups = maxOpenGroups;
    _openGroups = new ArrayList<>();
    _evictedGroups = new ArrayList<>();
    _latestOfferedTimestampMs = Long.MIN_VALUE;
  }

  /**
   * Add the given alert to the first open group whose anchor it should be grouped with, or to a new group.
   *
   * @param alert Alert to add.
   * @return The group that the alert was added to.
   */
  public AlertGroup offer(Alert alert) {
    validateNotNull(alert, "Alert to offer cannot be null.");
    if (alert.timestampMs() < _latestOfferedTimestampMs) {
      LOG.warn("Alert {} is out of order, the latest offered alert was raised at {}.", alert,
               utcDateFor(_latestOfferedTimestampMs));
    } else {
      _latestOfferedTimestampMs = alert.timestampMs();
    }

    for (AlertGroup group : _openGroups) {
      if (_correlator.shouldGroup(group.anchor(), alert)) {
        group.add(alert);
        LOG.trace("Added alert {} to group {}.", alert, group);
        return group;
      }
    }

    AlertGroup group = new AlertGroup(alert);
    _openGroups.add(group);
    LOG.debug("Opened alert group {}.", group.groupId());
    if (_openGroups.size() > _maxOpenGroups) {
      evictGroupWithOldestAnchor();
    }
    return group;
  }

  private void evictGroupWithOldestAnchor() {
    AlertGroup groupToEvict = _openGroups.get(0);
    for (AlertGroup group : _openGroups) {
      if (group.anchor().timestampMs() < groupToEvict.anchor().timestampMs()) {
        groupToEvict = group;
      }
    }
    _openGroups.remove(groupToEvict);
    groupToEvict.close();
    _evictedGroups.add(groupToEvict);
    LOG.warn("Evicted alert group {} with {} alerts to keep at most {} open groups.", groupToEvict.groupId(),
             groupToEvict.size(), _maxOpenGroups);
  }

  /**
   * Close the open groups whose anchor is older than the grouping window relative to the given time. No later alert
   * raised at or after the given time could join such groups.
   *
   * @param nowMs The current time in epoch milliseconds.
   * @return Closed groups in the order they were opened.
   */
  public List<AlertGroup> closeIdleGroups(long nowMs) {
    long idleBeforeMs = nowMs - _correlator.groupingWindowMs();
    List<AlertGroup> closedGroups = new ArrayList<>();
    for (Iterator<AlertGroup> iterator = _openGroups.iterator(); iterator.hasNext(); ) {
      AlertGroup group = iterator.next();
      if (group.anchor().timestampMs() < idleBeforeMs) {
        iterator.remove();
        group.close();
        closedGroups.add(group);
        LOG.debug("Closed idle alert group {} with {} alerts.", group.groupId(), group.size());
      }
    }
    return closedGroups;
  }

  /**
   * Close all open groups.
   *
   * @return Closed groups in the order they were opened.
   */
  public List<AlertGroup> closeAll() {
    List<AlertGroup> closedGroups = new ArrayList<>(_openGroups);
    _openGroups.clear();
    closedGroups.forEach(AlertGroup::close);
    LOG.debug("Closed all {} open alert groups.", closedGroups.size());
    return closedGroups;
  }

  /**
   * @return Groups evicted since the last call, in eviction order.
   */
  public List<AlertGroup> drainEvicted() {
    if (_evictedGroups.isEmpty()) {
      return Collections.emptyList();
    }
    List<AlertGroup> evictedGroups = new ArrayList<>(_evictedGroups);
    _evictedGroups.clear();
    return evictedGroups;
  }

  /**
   * @return A snapshot of the open groups in the order they were opened.
   */
  public List<AlertGroup> openGroups() {
    return Collections.unmodifiableList(new ArrayList<>(_openGroups));
  }

  public int numOpenGroups() {
    return _openGroups.size();
  }
}
