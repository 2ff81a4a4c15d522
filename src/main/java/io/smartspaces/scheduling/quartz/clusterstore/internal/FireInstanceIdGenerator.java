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

package io.smartspaces.scheduling.quartz.clusterstore.internal;

import io.smartspaces.scheduling.quartz.clusterstore.internal.util.Clock;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates the tokens identifying a single firing of a trigger.
 *
 * <p>
 * Tokens start with the instance ID so they are unique across the cluster, and
 * with the start time so they are unique across restarts of the instance.
 */
public class FireInstanceIdGenerator {

  private final String prefix;

  private final AtomicLong counter = new AtomicLong();

  public FireInstanceIdGenerator(String instanceId, Clock clock) {
    this.prefix = instanceId + "-" + clock.millis() + "-";
  }

  public String next() {
    return prefix + String.format("%019d", counter.incrementAndGet());
  }
}
