/*
 * Copyright (C) 2016 Keith M. Hughes
 * Forked from code (c) Michael S. Klishin, Alex Petrov, 2011-2015.
 * Forked from code from MuleSoft.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not
 * use this file except in compliance with the License. You may obtain a copy of
 * the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations under
 * the License.
 */

package io.smartspaces.scheduling.quartz.clusterstore.internal.block;

import org.quartz.SchedulerConfigException;

import java.util.Locale;

/**
 * Where the blocks on jobs disallowing concurrent execution are kept.
 */
public enum BlockTracking {

  /**
   * In the database when clustered, in memory otherwise.
   */
  AUTO,

  /**
   * In the memory of the instance. Not allowed when clustered.
   */
  MEMORY,

  /**
   * In the database.
   */
  PERSISTENT;

  /**
   * Parse a configured value, ignoring case.
   *
   * @param value
   *          the configured value
   *
   * @return the block tracking
   *
   * @throws SchedulerConfigException
   *           the value names no block tracking
   */
  public static BlockTracking fromConfig(String value) throws SchedulerConfigException {
    if (value == null) {
      return AUTO;
    }

    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new SchedulerConfigException("Unknown block tracking '" + value
          + "', expected one of auto, memory or persistent", e);
    }
  }
}
