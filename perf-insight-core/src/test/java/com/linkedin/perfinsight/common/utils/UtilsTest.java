/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.perfinsight.common.utils;

import com.linkedin.perfinsight.exception.PerfInsightException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertSame;


public class UtilsTest {
  @Rule
  public ExpectedException _expected = ExpectedException.none();

  @Test
  public void testValidateNotNull() {
    String value = "value";
    assertSame(value, Utils.validateNotNull(value, "unused"));
    _expected.expect(IllegalArgumentException.class);
    _expected.expectMessage("Value cannot be null.");
    Utils.validateNotNull(null, () -> "Value cannot be null.");
  }

  @Test
  public void testContextClassLoader() {
    assertNotNull(Utils.getContextOrPerfInsightClassLoader());
  }

  @Test
  public void testNewInstance() throws PerfInsightException {
    assertNotNull(Utils.newInstance(StringBuilder.class));
  }

  @Test
  public void testNewInstanceWithoutNoArgConstructor() throws PerfInsightException {
    _expected.expect(PerfInsightException.class);
    _expected.expectMessage("no-argument constructor");
    Utils.newInstance(Integer.class);
  }
}
