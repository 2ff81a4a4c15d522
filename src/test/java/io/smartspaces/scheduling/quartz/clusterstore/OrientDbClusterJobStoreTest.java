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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.quartz.JobBuilder.newJob;
import static org.quartz.SimpleScheduleBuilder.simpleSchedule;
import static org.quartz.TriggerBuilder.newTrigger;

import io.smartspaces.scheduling.quartz.clusterstore.TestJobs.NoOpJob;
import io.smartspaces.scheduling.quartz.clusterstore.TestJobs.StatefulJob;

import org.junit.Before;
import org.junit.Test;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.JobPersistenceException;
import org.quartz.ObjectAlreadyExistsException;
import org.quartz.Trigger;
import org.quartz.Trigger.TriggerState;
import org.quartz.TriggerKey;
import org.quartz.impl.calendar.HolidayCalendar;
import org.quartz.impl.matchers.GroupMatcher;
import org.quartz.spi.OperableTrigger;
import org.quartz.spi.TriggerFiredBundle;

import java.util.Arrays;
import java.util.Collections;
import java.util.Date;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Storage and retrieval of jobs, triggers and calendars on a single instance.
 */
public class OrientDbClusterJobStoreTest extends AbstractJobStoreTest {

  private OrientDbClusterJobStore jobStore;

  @Before
  public void startStore() throws Exception {
    jobStore = startJobStore("single", false);
  }

  @Test
  public void testStoreAndRetrieveJob() throws Exception {
    JobDetail job = newJob(NoOpJob.class).withIdentity("job1", "jobGroup")
        .withDescription("a job").storeDurably().requestRecovery().usingJobData("color", "blue")
        .build();
    jobStore.storeJob(job, false);

    JobDetail stored = jobStore.retrieveJob(job.getKey());
    assertNotNull(stored);
    assertEquals(job.getKey(), stored.getKey());
    assertEquals("a job", stored.getDescription());
    assertEquals(NoOpJob.class, stored.getJobClass());
    assertTrue(stored.isDurable());
    assertTrue(stored.requestsRecovery());
    assertEquals("blue", stored.getJobDataMap().getString("color"));

    assertTrue(jobStore.checkExists(job.getKey()));
    assertFalse(jobStore.checkExists(new JobKey("missing", "jobGroup")));
    assertNull(jobStore.retrieveJob(new JobKey("missing", "jobGroup")));
    assertEquals(1, jobStore.getNumberOfJobs());
  }

  @Test
  public void testStoreJobTwiceWithoutReplace() throws Exception {
    JobDetail job = newJob(NoOpJob.class).withIdentity("job1", "jobGroup").storeDurably().build();
    jobStore.storeJob(job, false);

    try {
      jobStore.storeJob(job, false);
      fail("Storing a job twice must fail");
    } catch (ObjectAlreadyExistsException e) {
      // expected
    }

    JobDetail replacement = newJob(StatefulJob.class).withIdentity("job1", "jobGroup")
        .storeDurably().build();
    jobStore.storeJob(replacement, true);
    assertEquals(StatefulJob.class, jobStore.retrieveJob(job.getKey()).getJobClass());
    assertEquals(1, jobStore.getNumberOfJobs());
  }

  @Test
  public void testStoreAndRetrieveTrigger() throws Exception {
    JobDetail job = newJob(NoOpJob.class).withIdentity("job1", "jobGroup").build();
    long start = now() + TimeUnit.HOURS.toMillis(1);
    OperableTrigger trigger = (OperableTrigger) newTrigger().withIdentity("trigger1", "triggerGroup")
        .forJob(job).startAt(new Date(start)).withPriority(7).usingJobData("size", "large")
        .withSchedule(simpleSchedule().withIntervalInMinutes(5).withRepeatCount(3)).build();
    trigger.computeFirstFireTime(null);

    jobStore.storeJobAndTrigger(job, trigger);

    OperableTrigger stored = jobStore.retrieveTrigger(trigger.getKey());
    assertNotNull(stored);
    assertEquals(trigger.getKey(), stored.getKey());
    assertEquals(job.getKey(), stored.getJobKey());
    assertEquals(7, stored.getPriority());
    assertEquals(new Date(start), stored.getNextFireTime());
    assertEquals("large", stored.getJobDataMap().getString("size"));

    assertTrue(jobStore.checkExists(trigger.getKey()));
    assertEquals(TriggerState.NORMAL, state(jobStore, trigger));
    assertEquals(1, jobStore.getNumberOfTriggers());

    List<OperableTrigger> forJob = jobStore.getTriggersForJob(job.getKey());
    assertEquals(1, forJob.size());
    assertEquals(trigger.getKey(), forJob.get(0).getKey());
  }

  @Test
  public void testStoreTriggerWithoutJob() throws Exception {
    JobDetail job = newJob(NoOpJob.class).withIdentity("job1", "jobGroup").build();
    try {
      jobStore.storeTrigger(buildTrigger("trigger1", "triggerGroup", job, now()), false);
      fail("A trigger needs its job");
    } catch (JobPersistenceException e) {
      // expected
    }

    assertEquals(0, jobStore.getNumberOfTriggers());
  }

  @Test
  public void testStoreJobAndTriggerTwice() throws Exception {
    JobDetail job = newJob(NoOpJob.class).withIdentity("job1", "jobGroup").build();
    OperableTrigger trigger = buildTrigger("trigger1", "triggerGroup", job, now());
    jobStore.storeJobAndTrigger(job, trigger);

    try {
      jobStore.storeTrigger(trigger, false);
      fail("Storing a trigger twice must fail");
    } catch (ObjectAlreadyExistsException e) {
      // expected
    }
  }

  @Test
  public void testUnknownTriggerHasNoState() throws Exception {
    assertEquals(TriggerState.NONE, jobStore.getTriggerState(new TriggerKey("missing")));
    assertNull(jobStore.retrieveTrigger(new TriggerKey("missing")));
  }

  @Test
  public void testRemovingLastTriggerRemovesNonDurableJob() throws Exception {
    JobDetail job = newJob(NoOpJob.class).withIdentity("job1", "jobGroup").build();
    OperableTrigger trigger1 = buildTrigger("trigger1", "triggerGroup", job, now());
    OperableTrigger trigger2 = buildTrigger("trigger2", "triggerGroup", job, now());
    jobStore.storeJobAndTrigger(job, trigger1);
    jobStore.storeTrigger(trigger2, false);

    assertTrue(jobStore.removeTrigger(trigger1.getKey()));
    assertTrue(jobStore.checkExists(job.getKey()));

    assertTrue(jobStore.removeTrigger(trigger2.getKey()));
    assertFalse(jobStore.checkExists(job.getKey()));
    assertEquals(Collections.singletonList(job.getKey()), signaler.deletedJobs);

    assertFalse(jobStore.removeTrigger(trigger2.getKey()));
  }

  @Test
  public void testRemovingLastTriggerKeepsDurableJob() throws Exception {
    JobDetail job = newJob(NoOpJob.class).withIdentity("job1", "jobGroup").storeDurably().build();
    OperableTrigger trigger = buildTrigger("trigger1", "triggerGroup", job, now());
    jobStore.storeJobAndTrigger(job, trigger);

    assertTrue(jobStore.removeTrigger(trigger.getKey()));
    assertTrue(jobStore.checkExists(job.getKey()));
    assertTrue(signaler.deletedJobs.isEmpty());
  }

  @Test
  public void testRemoveJobRemovesItsTriggers() throws Exception {
    JobDetail job = newJob(NoOpJob.class).withIdentity("job1", "jobGroup").build();
    OperableTrigger trigger = buildTrigger("trigger1", "triggerGroup", job, now());
    jobStore.storeJobAndTrigger(job, trigger);

    assertTrue(jobStore.removeJob(job.getKey()));
    assertFalse(jobStore.checkExists(trigger.getKey()));
    assertFalse(jobStore.removeJob(job.getKey()));
  }

  @Test
  public void testStoreJobsAndTriggersStoresNothingOnConflict() throws Exception {
    JobDetail existing = newJob(NoOpJob.class).withIdentity("existing", "jobGroup")
        .storeDurably().build();
    jobStore.storeJob(existing, false);

    JobDetail fresh = newJob(NoOpJob.class).withIdentity("fresh", "jobGroup").build();
    Map<JobDetail, Set<? extends Trigger>> toStore =
        new HashMap<JobDetail, Set<? extends Trigger>>();
    toStore.put(fresh, Collections.singleton(buildTrigger("t1", "triggerGroup", fresh, now())));
    toStore.put(existing,
        Collections.singleton(buildTrigger("t2", "triggerGroup", existing, now())));

    try {
      jobStore.storeJobsAndTriggers(toStore, false);
      fail("An existing job must stop the whole batch");
    } catch (ObjectAlreadyExistsException e) {
      // expected
    }

    assertFalse(jobStore.checkExists(fresh.getKey()));
    assertEquals(0, jobStore.getNumberOfTriggers());

    jobStore.storeJobsAndTriggers(toStore, true);
    assertTrue(jobStore.checkExists(fresh.getKey()));
    assertEquals(2, jobStore.getNumberOfTriggers());
  }

  @Test
  public void testReplaceTrigger() throws Exception {
    JobDetail job = newJob(NoOpJob.class).withIdentity("job1", "jobGroup").build();
    OperableTrigger trigger = buildTrigger("trigger1", "triggerGroup", job, now());
    jobStore.storeJobAndTrigger(job, trigger);

    OperableTrigger replacement = buildTrigger("trigger2", "triggerGroup", job, now() + 1000);
    assertTrue(jobStore.replaceTrigger(trigger.getKey(), replacement));

    assertFalse(jobStore.checkExists(trigger.getKey()));
    assertTrue(jobStore.checkExists(replacement.getKey()));
    // The only trigger was replaced, the job is not removed with it.
    assertTrue(jobStore.checkExists(job.getKey()));

    assertFalse(jobStore.replaceTrigger(trigger.getKey(), replacement));
  }

  @Test
  public void testReplaceTriggerWithOtherJob() throws Exception {
    JobDetail job = newJob(NoOpJob.class).withIdentity("job1", "jobGroup").build();
    JobDetail otherJob =
        newJob(NoOpJob.class).withIdentity("job2", "jobGroup").storeDurably().build();
    OperableTrigger trigger = buildTrigger("trigger1", "triggerGroup", job, now());
    jobStore.storeJobAndTrigger(job, trigger);
    jobStore.storeJob(otherJob, false);

    try {
      jobStore.replaceTrigger(trigger.getKey(),
          buildTrigger("trigger2", "triggerGroup", otherJob, now()));
      fail("A replacement for another job must be refused");
    } catch (JobPersistenceException e) {
      // expected
    }

    assertTrue(jobStore.checkExists(trigger.getKey()));
  }

  @Test
  public void testCalendars() throws Exception {
    HolidayCalendar calendar = new HolidayCalendar();
    calendar.setDescription("holidays");
    jobStore.storeCalendar("holidays", calendar, false, false);

    assertNotNull(jobStore.retrieveCalendar("holidays"));
    assertEquals("holidays", jobStore.retrieveCalendar("holidays").getDescription());
    assertEquals(Collections.singletonList("holidays"), jobStore.getCalendarNames());
    assertEquals(1, jobStore.getNumberOfCalendars());

    try {
      jobStore.storeCalendar("holidays", calendar, false, false);
      fail("Storing a calendar twice must fail");
    } catch (ObjectAlreadyExistsException e) {
      // expected
    }

    JobDetail job = newJob(NoOpJob.class).withIdentity("job1", "jobGroup").build();
    OperableTrigger trigger = (OperableTrigger) newTrigger().withIdentity("trigger1")
        .forJob(job).startAt(new Date(now() + 60000)).modifiedByCalendar("holidays").build();
    trigger.computeFirstFireTime(calendar);
    jobStore.storeJobAndTrigger(job, trigger);

    try {
      jobStore.removeCalendar("holidays");
      fail("A calendar in use must not be removed");
    } catch (JobPersistenceException e) {
      // expected
    }

    jobStore.removeTrigger(trigger.getKey());
    assertTrue(jobStore.removeCalendar("holidays"));
    assertNull(jobStore.retrieveCalendar("holidays"));
    assertFalse(jobStore.removeCalendar("holidays"));
  }

  @Test
  public void testStoreCalendarUpdatesTriggers() throws Exception {
    java.util.Calendar tomorrow = java.util.Calendar.getInstance();
    tomorrow.add(java.util.Calendar.DAY_OF_YEAR, 1);
    tomorrow.set(java.util.Calendar.HOUR_OF_DAY, 12);
    tomorrow.set(java.util.Calendar.MINUTE, 0);
    tomorrow.set(java.util.Calendar.SECOND, 0);
    tomorrow.set(java.util.Calendar.MILLISECOND, 0);

    java.util.Calendar dayAfter = (java.util.Calendar) tomorrow.clone();
    dayAfter.add(java.util.Calendar.DAY_OF_YEAR, 1);
    dayAfter.set(java.util.Calendar.HOUR_OF_DAY, 0);

    jobStore.storeCalendar("holidays", new HolidayCalendar(), false, false);

    JobDetail job = newJob(NoOpJob.class).withIdentity("job1", "jobGroup").build();
    OperableTrigger trigger = (OperableTrigger) newTrigger().withIdentity("trigger1")
        .forJob(job).startAt(tomorrow.getTime()).modifiedByCalendar("holidays")
        .withSchedule(simpleSchedule().withIntervalInHours(1).repeatForever()).build();
    trigger.computeFirstFireTime(null);
    jobStore.storeJobAndTrigger(job, trigger);

    HolidayCalendar excludingTomorrow = new HolidayCalendar();
    excludingTomorrow.addExcludedDate(tomorrow.getTime());
    jobStore.storeCalendar("holidays", excludingTomorrow, true, true);

    Date nextFireTime = jobStore.retrieveTrigger(trigger.getKey()).getNextFireTime();
    assertFalse(nextFireTime.before(dayAfter.getTime()));
  }

  @Test
  public void testGroupsAndKeys() throws Exception {
    JobDetail job1 = newJob(NoOpJob.class).withIdentity("job1", "alpha").build();
    JobDetail job2 = newJob(NoOpJob.class).withIdentity("job2", "beta").build();
    OperableTrigger trigger1 = buildTrigger("trigger1", "red", job1, now());
    OperableTrigger trigger2 = buildTrigger("trigger2", "rose", job2, now());
    jobStore.storeJobAndTrigger(job1, trigger1);
    jobStore.storeJobAndTrigger(job2, trigger2);

    assertEquals(new HashSet<String>(Arrays.asList("alpha", "beta")),
        new HashSet<String>(jobStore.getJobGroupNames()));
    assertEquals(new HashSet<String>(Arrays.asList("red", "rose")),
        new HashSet<String>(jobStore.getTriggerGroupNames()));

    assertEquals(Collections.singleton(job1.getKey()),
        jobStore.getJobKeys(GroupMatcher.jobGroupEquals("alpha")));
    assertEquals(new HashSet<TriggerKey>(Arrays.asList(trigger1.getKey(), trigger2.getKey())),
        jobStore.getTriggerKeys(GroupMatcher.triggerGroupStartsWith("r")));
    assertTrue(jobStore.getTriggerKeys(GroupMatcher.triggerGroupEquals("blue")).isEmpty());
  }

  @Test
  public void testJobDataPersistedAfterExecution() throws Exception {
    JobDetail job = newJob(StatefulJob.class).withIdentity("job1", "jobGroup")
        .usingJobData("count", "1").build();
    OperableTrigger trigger = buildTrigger("trigger1", "triggerGroup", job, now());
    jobStore.storeJobAndTrigger(job, trigger);

    List<TriggerFiredBundle> bundles = acquireAndFire(jobStore, now() + 1000, 1);
    assertEquals(1, bundles.size());

    TriggerFiredBundle bundle = bundles.get(0);
    bundle.getJobDetail().getJobDataMap().put("count", "2");
    complete(jobStore, bundle);

    assertEquals("2", jobStore.retrieveJob(job.getKey()).getJobDataMap().getString("count"));
  }

  @Test
  public void testClearAllSchedulingData() throws Exception {
    JobDetail job = newJob(NoOpJob.class).withIdentity("job1", "jobGroup").build();
    jobStore.storeJobAndTrigger(job, buildTrigger("trigger1", "triggerGroup", job, now()));
    jobStore.storeCalendar("holidays", new HolidayCalendar(), false, false);
    jobStore.pauseTriggers(GroupMatcher.triggerGroupEquals("other"));

    jobStore.clearAllSchedulingData();

    assertEquals(0, jobStore.getNumberOfJobs());
    assertEquals(0, jobStore.getNumberOfTriggers());
    assertEquals(0, jobStore.getNumberOfCalendars());
    assertTrue(jobStore.getPausedTriggerGroups().isEmpty());
  }

  @Test
  public void testDataSurvivesRestart() throws Exception {
    JobDetail job = newJob(NoOpJob.class).withIdentity("job1", "jobGroup").build();
    OperableTrigger trigger =
        buildTrigger("trigger1", "triggerGroup", job, now() + TimeUnit.HOURS.toMillis(1));
    jobStore.storeJobAndTrigger(job, trigger);
    jobStore.shutdown();

    OrientDbClusterJobStore restarted = startJobStore("single", false);
    assertTrue(restarted.checkExists(job.getKey()));
    assertEquals(TriggerState.NORMAL, state(restarted, trigger));
  }
}
