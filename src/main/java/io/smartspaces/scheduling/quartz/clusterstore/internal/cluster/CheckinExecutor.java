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

import static java.util.concurrent.TimeUnit.MILLISECONDS;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;

public class CheckinExecutor {

  private static final Logger log = LoggerFactory.getLogger(CheckinExecutor.class);

  private final CheckinTask checkinTask;
  private final long checkinIntervalMillis;
  private final String instanceId;

  private final ScheduledExecutorService executor;

  /**
   * The future for the checkin task.
   */
  private Future<?> checkinFuture;

  public CheckinExecutor(ScheduledExecutorService executor, CheckinTask checkinTask,
      long checkinIntervalMillis, String instanceId) {
    this.executor = executor;
    this.checkinTask = checkinTask;
    this.checkinIntervalMillis = checkinIntervalMillis;
    this.instanceId = instanceId;
  }

  /**
   * Start periodic check-ins. The first runs one interval from now, as the
   * instance checks in when it starts.
   */
  public synchronized void start() {
    log.debug("Starting check-in task for scheduler instance: {}", instanceId);
    checkinFuture = executor.scheduleAtFixedRate(checkinTask, checkinIntervalMillis,
        checkinIntervalMillis, MILLISECONDS);
  }

  /**
   * Stop periodic check-ins. A check-in already running is allowed to finish.
   */
  public synchronized void shutdown() {
    log.debug("Stopping CheckinExecutor for scheduler instance: {}", instanceId);
    if (checkinFuture != null) {
      checkinFuture.cancel(false);
      checkinFuture = null;
    }
  }
}
