/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight.correlator;

import java.util.Collections;
import java.util.List;


/**
 * The state of an {@link AlertGroup}. An open group accepts alerts; a closed group never does again.
 */
public enum AlertGroupState {
  OPEN, CLOSED;

  private static final List<AlertGroupState> CACHED_VALUES = List.of(values());

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<AlertGroupState> cachedValues() {
    return Collections.unmodifiableList(CACHED_VALUES);
  }
}
