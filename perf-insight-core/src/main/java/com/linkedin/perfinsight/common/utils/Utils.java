/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight.common.utils;

import com.linkedin.perfinsight.exception.PerfInsightException;
import java.util.function.Supplier;


public final class Utils {

  private Utils() {

  }

  /**
   * @param c Class to instantiate through its no-argument constructor.
   * @param <T> The type of the instance.
   * @return A new instance of the given class.
   * @throws PerfInsightException If the class has no accessible no-argument constructor, or its constructor fails.
   */
  public static <T> T newInstance(Class<T> c) throws PerfInsightException {
    validateNotNull(c, "Class to instantiate cannot be null.");
    try {
      return c.getDeclaredConstructor().newInstance();
    } catch (NoSuchMethodException e) {
      throw new PerfInsightException("Could not find a public no-argument constructor for " + c.getName(), e);
    } catch (ReflectiveOperationException | RuntimeException e) {
      throw new PerfInsightException("Could not instantiate class " + c.getName(), e);
    }
  }

  /**
   * @return The context class loader of the current thread, or the class loader of perf-insight if there is none.
   */
  public static ClassLoader getContextOrPerfInsightClassLoader() {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    return cl == null ? Utils.class.getClassLoader() : cl;
  }

  /**
   * @param obj Reference to check.
   * @param errorMsg Message of the exception if the reference is null.
   * @param <T> The type of the reference.
   * @return The given reference.
   * @throws IllegalArgumentException If the given reference is null.
   */
  public static <T> T validateNotNull(T obj, String errorMsg) {
    if (obj == null) {
      throw new IllegalArgumentException(errorMsg);
    }
    return obj;
  }

  /**
   * @param obj Reference to check.
   * @param errorMsgSupplier Supplier of the exception message, called only if the reference is null.
   * @param <T> The type of the reference.
   * @return The given reference.
   * @throws IllegalArgumentException If the given reference is null.
   */
  public static <T> T validateNotNull(T obj, Supplier<String> errorMsgSupplier) {
    if (obj == null) {
      throw new IllegalArgumentException(errorMsgSupplier.get());
    }
    return obj;
  }
}
