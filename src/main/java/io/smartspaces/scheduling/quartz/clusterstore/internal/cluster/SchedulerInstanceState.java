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

package io.smartspaces.scheduling.quartz.clusterstore.internal.cluster;

/**
 * The lifecycle state a scheduler instance reports when it checks in.
 */
public enum SchedulerInstanceState {
  UNKNOWN,
  STARTED,
  PAUSED,
  RESUMED,
  SHUTDOWN;

  /**
   * Parse a stored state, falling back to {@link #UNKNOWN}.
   *
   * @param value
   *          the stored value, can be {@code null}
   *
   * @return the state
   */
  public static SchedulerInstanceState fromString(String value) {
    if (value != null) {
      for (SchedulerInstanceState state : values()) {
        if (state.name().equals(value)) {
          return state;
        }
      }
    }

    return UNKNOWN;
  }
}
