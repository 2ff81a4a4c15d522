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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.quartz.JobBuilder.newJob;
import static org.quartz.SimpleScheduleBuilder.simpleSchedule;
import static org.quartz.TriggerBuilder.newTrigger;

import io.smartspaces.scheduling.quartz.clusterstore.MutableClock;
import io.smartspaces.scheduling.quartz.clusterstore.TestJobs.NoOpJob;

import org.junit.Test;
import org.quartz.JobDetail;
import org.quartz.Scheduler;
import org.quartz.SimpleTrigger;
import org.quartz.spi.OperableTrigger;

import java.util.Date;

public class RecoveryTriggerFactoryTest {

  @Test
  public void testRecoveryTriggerForLostFiring() {
    MutableClock clock = new MutableClock();
    clock.set(50000L);
    RecoveryTriggerFactory factory = new RecoveryTriggerFactory(clock);

    JobDetail job = newJob(NoOpJob.class).withIdentity("job1", "jobGroup").build();
    OperableTrigger trigger = (OperableTrigger) newTrigger().withIdentity("trigger1", "g")
        .forJob(job).startAt(new Date(10000L)).withPriority(8).usingJobData("color", "red")
        .withSchedule(simpleSchedule().withIntervalInSeconds(10).repeatForever()).build();
    trigger.computeFirstFireTime(null);
    trigger.triggered(null);

    OperableTrigger recovery = factory.from(trigger, "node1-42");

    assertEquals("recover_node1-42", recovery.getKey().getName());
    assertEquals(Scheduler.DEFAULT_RECOVERY_GROUP, recovery.getKey().getGroup());
    assertEquals(job.getKey(), recovery.getJobKey());
    assertEquals(8, recovery.getPriority());
    assertEquals(new Date(50000L), recovery.getNextFireTime());
    assertEquals(SimpleTrigger.MISFIRE_INSTRUCTION_IGNORE_MISFIRE_POLICY,
        recovery.getMisfireInstruction());

    assertEquals("red", recovery.getJobDataMap().getString("color"));
    assertEquals("trigger1",
        recovery.getJobDataMap().getString(Scheduler.FAILED_JOB_ORIGINAL_TRIGGER_NAME));
    assertEquals("g",
        recovery.getJobDataMap().getString(Scheduler.FAILED_JOB_ORIGINAL_TRIGGER_GROUP));
    assertEquals("10000", recovery.getJobDataMap()
        .getString(Scheduler.FAILED_JOB_ORIGINAL_TRIGGER_FIRETIME_IN_MILLISECONDS));

    // The original trigger's data is left alone.
    assertFalse(trigger.getJobDataMap().containsKey(Scheduler.FAILED_JOB_ORIGINAL_TRIGGER_NAME));
  }

  @Test
  public void testSameFiringGivesSameKey() {
    RecoveryTriggerFactory factory = new RecoveryTriggerFactory(new MutableClock());
    JobDetail job = newJob(NoOpJob.class).withIdentity("job1", "jobGroup").build();
    OperableTrigger trigger = (OperableTrigger) newTrigger().withIdentity("trigger1", "g")
        .forJob(job).startNow().build();
    trigger.computeFirstFireTime(null);

    assertEquals(factory.from(trigger, "token").getKey(),
        factory.from(trigger, "token").getKey());
  }
}
