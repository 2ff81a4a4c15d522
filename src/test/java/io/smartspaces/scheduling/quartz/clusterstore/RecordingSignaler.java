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

package io.smartspaces.scheduling.quartz.clusterstore;

import org.quartz.JobKey;
import org.quartz.SchedulerException;
import org.quartz.Trigger;
import org.quartz.spi.SchedulerSignaler;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A signaler which remembers what it was told.
 */
public class RecordingSignaler implements SchedulerSignaler {

  public final List<Trigger> misfired = new CopyOnWriteArrayList<Trigger>();
  public final List<Trigger> finalized = new CopyOnWriteArrayList<Trigger>();
  public final List<JobKey> deletedJobs = new CopyOnWriteArrayList<JobKey>();
  public final List<Long> schedulingChanges = new CopyOnWriteArrayList<Long>();

  @Override
  public void notifyTriggerListenersMisfired(Trigger trigger) {
    misfired.add(trigger);
  }

  @Override
  public void notifySchedulerListenersFinalized(Trigger trigger) {
    finalized.add(trigger);
  }

  @Override
  public void notifySchedulerListenersJobDeleted(JobKey jobKey) {
    deletedJobs.add(jobKey);
  }

  @Override
  public void signalSchedulingChange(long candidateNewNextFireTime) {
    schedulingChanges.add(candidateNewNextFireTime);
  }

  @Override
  public void notifySchedulerListenersError(String string, SchedulerException jpe) {
    // Not needed by the tests.
  }

  public int countMisfired(Trigger trigger) {
    int count = 0;
    for (Trigger misfire : misfired) {
      if (misfire.getKey().equals(trigger.getKey())) {
        count++;
      }
    }

    return count;
  }
}
