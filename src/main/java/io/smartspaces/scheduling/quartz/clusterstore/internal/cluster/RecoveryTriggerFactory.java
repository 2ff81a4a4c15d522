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

import io.smartspaces.scheduling.quartz.clusterstore.internal.util.Clock;

import org.quartz.JobDataMap;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SimpleTrigger;
import org.quartz.TriggerKey;
import org.quartz.impl.triggers.SimpleTriggerImpl;
import org.quartz.spi.OperableTrigger;

import java.util.Date;

/**
 * Creates the one-shot triggers which re-run a job whose firing was lost with
 * a failed instance.
 */
public class RecoveryTriggerFactory {

  /**
   * Prefix of the names of recovery triggers.
   */
  public static final String RECOVERY_TRIGGER_PREFIX = "recover_";

  private final Clock clock;

  public RecoveryTriggerFactory(Clock clock) {
    this.clock = clock;
  }

  /**
   * Create a recovery trigger.
   *
   * <p>
   * The name comes from the lost firing, so recovering the same firing twice
   * gives the same trigger key.
   *
   * @param trigger
   *          the trigger whose firing was lost
   * @param fireInstanceId
   *          the token of the lost firing
   *
   * @return the recovery trigger, due now
   */
  public OperableTrigger from(OperableTrigger trigger, String fireInstanceId) {
    TriggerKey tKey = trigger.getKey();
    JobKey jKey = trigger.getJobKey();

    Date firedAt = trigger.getPreviousFireTime();
    long fireTimestamp = firedAt != null ? firedAt.getTime() : clock.millis();

    SimpleTriggerImpl rcvryTrig = new SimpleTriggerImpl();
    rcvryTrig.setName(RECOVERY_TRIGGER_PREFIX + fireInstanceId);
    rcvryTrig.setGroup(Scheduler.DEFAULT_RECOVERY_GROUP);
    rcvryTrig.setStartTime(clock.now());
    rcvryTrig.setJobName(jKey.getName());
    rcvryTrig.setJobGroup(jKey.getGroup());
    rcvryTrig.setMisfireInstruction(SimpleTrigger.MISFIRE_INSTRUCTION_IGNORE_MISFIRE_POLICY);
    rcvryTrig.setPriority(trigger.getPriority());

    // Cannot reuse JobDataMap, because the original trigger
    // may be persisted after applying misfire.
    JobDataMap jd = new JobDataMap(trigger.getJobDataMap());
    jd.put(Scheduler.FAILED_JOB_ORIGINAL_TRIGGER_NAME, tKey.getName());
    jd.put(Scheduler.FAILED_JOB_ORIGINAL_TRIGGER_GROUP, tKey.getGroup());
    jd.put(Scheduler.FAILED_JOB_ORIGINAL_TRIGGER_FIRETIME_IN_MILLISECONDS,
        String.valueOf(fireTimestamp));
    jd.put(Scheduler.FAILED_JOB_ORIGINAL_TRIGGER_SCHEDULED_FIRETIME_IN_MILLISECONDS,
        String.valueOf(fireTimestamp));
    rcvryTrig.setJobDataMap(jd);

    rcvryTrig.computeFirstFireTime(null);
    return rcvryTrig;
  }
}
