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
 * The check-in record of one scheduler instance in the cluster.
 */
public class SchedulerInstance {

  private final String instanceId;
  private final long lastCheckinTime;
  private final long checkinInterval;
  private final SchedulerInstanceState state;

  public SchedulerInstance(String instanceId, long lastCheckinTime, long checkinInterval,
      SchedulerInstanceState state) {
    this.instanceId = instanceId;
    this.lastCheckinTime = lastCheckinTime;
    this.checkinInterval = checkinInterval;
    this.state = state;
  }

  /**
   * Has the instance stopped checking in?
   *
   * @param now
   *          the current time
   * @param margin
   *          how long past its interval the instance is given before it is
   *          declared dead
   *
   * @return {@code true} if the instance shut down or missed its check-in
   */
  public boolean isDefunct(long now, long margin) {
    return state == SchedulerInstanceState.SHUTDOWN
        || lastCheckinTime + checkinInterval + margin < now;
  }

  public String getInstanceId() {
    return instanceId;
  }

  public long getLastCheckinTime() {
    return lastCheckinTime;
  }

  public long getCheckinInterval() {
    return checkinInterval;
  }

  public SchedulerInstanceState getState() {
    return state;
  }

  @Override
  public String toString() {
    return "SchedulerInstance [instanceId=" + instanceId + ", lastCheckinTime=" + lastCheckinTime
        + ", checkinInterval=" + checkinInterval + ", state=" + state + "]";
  }
}
