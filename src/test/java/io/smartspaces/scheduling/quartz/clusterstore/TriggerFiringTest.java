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
import static org.quartz.JobBuilder.newJob;
import static org.quartz.TriggerBuilder.newTrigger;

import io.smartspaces.scheduling.quartz.clusterstore.TestJobs.NoOpJob;
import io.smartspaces.scheduling.quartz.clusterstore.TestJobs.NonConcurrentJob;

import org.junit.Before;
import org.junit.Test;
import org.quartz.JobDetail;
import org.quartz.Trigger.CompletedExecutionInstruction;
import org.quartz.Trigger.TriggerState;
import org.quartz.spi.OperableTrigger;
import org.quartz.spi.TriggerFiredBundle;
import org.quartz.spi.TriggerFiredResult;

import java.util.Collections;
import java.util.Date;
import java.util.List;

/**
 * Acquiring, firing and completing triggers on a single instance.
 */
public class TriggerFiringTest extends AbstractJobStoreTest {

  private static final long ONE_HOUR = 60 * 60 * 1000L;

  private OrientDbClusterJobStore jobStore;

  private JobDetail job;

  @Before
  public void startStore() throws Exception {
    jobStore = startJobStore("single", false);
    job = newJob(NoOpJob.class).withIdentity("job1", "jobGroup").build();
  }

  @Test
  public void testAcquireInFireTimeThenPriorityOrder() throws Exception {
    long base = now() + 60000;
    OperableTrigger late = buildTrigger("late", "g", job, base + 2000);
    late.setPriority(10);
    OperableTrigger lowPriority = buildTrigger("low", "g", job, base + 1000);
    lowPriority.setPriority(1);
    OperableTrigger highPriority = buildTrigger("high", "g", job, base + 1000);
    highPriority.setPriority(9);

    jobStore.storeJobAndTrigger(job, late);
    jobStore.storeTrigger(lowPriority, false);
    jobStore.storeTrigger(highPriority, false);

    List<OperableTrigger> acquired = jobStore.acquireNextTriggers(base + 5000, 10, 0L);

    assertEquals(3, acquired.size());
    assertEquals(highPriority.getKey(), acquired.get(0).getKey());
    assertEquals(lowPriority.getKey(), acquired.get(1).getKey());
    assertEquals(late.getKey(), acquired.get(2).getKey());
    for (OperableTrigger trigger : acquired) {
      assertNotNull(trigger.getFireInstanceId());
    }
  }

  @Test
  public void testAcquireHonorsTimeAndCount() throws Exception {
    long base = now() + 60000;
    jobStore.storeJobAndTrigger(job, buildTrigger("first", "g", job, base));
    jobStore.storeTrigger(buildTrigger("second", "g", job, base + 100), false);
    jobStore.storeTrigger(buildTrigger("later", "g", job, base + 60000), false);

    assertTrue(jobStore.acquireNextTriggers(base - 1000, 10, 0L).isEmpty());
    assertEquals(1, jobStore.acquireNextTriggers(base, 1, 0L).size());
    // The time window widens the search.
    assertEquals(2, jobStore.acquireNextTriggers(base, 10, 60000L).size());
  }

  @Test
  public void testAcquiredTriggerIsNotAcquiredAgain() throws Exception {
    OperableTrigger trigger = buildTrigger("trigger1", "g", job, now());
    jobStore.storeJobAndTrigger(job, trigger);

    assertEquals(1, jobStore.acquireNextTriggers(now() + 1000, 1, 0L).size());
    assertTrue(jobStore.acquireNextTriggers(now() + 1000, 1, 0L).isEmpty());
    assertEquals(TriggerState.NORMAL, state(jobStore, trigger));
  }

  @Test
  public void testReleasedTriggerCanBeAcquiredAgain() throws Exception {
    jobStore.storeJobAndTrigger(job, buildTrigger("trigger1", "g", job, now()));

    OperableTrigger first = jobStore.acquireNextTriggers(now() + 1000, 1, 0L).get(0);
    jobStore.releaseAcquiredTrigger(first);

    List<OperableTrigger> again = jobStore.acquireNextTriggers(now() + 1000, 1, 0L);
    assertEquals(1, again.size());
    assertFalse(first.getFireInstanceId().equals(again.get(0).getFireInstanceId()));
  }

  @Test
  public void testFireAndCompleteOneShotTrigger() throws Exception {
    OperableTrigger trigger = buildTrigger("trigger1", "g", job, now());
    jobStore.storeJobAndTrigger(job, trigger);

    List<TriggerFiredBundle> bundles = acquireAndFire(jobStore, now() + 1000, 1);
    assertEquals(1, bundles.size());

    TriggerFiredBundle bundle = bundles.get(0);
    assertEquals(job.getKey(), bundle.getJobDetail().getKey());
    assertEquals(trigger.getKey(), bundle.getTrigger().getKey());
    assertFalse(bundle.isRecovering());
    assertNull(bundle.getNextFireTime());
    assertEquals(TriggerState.NORMAL, state(jobStore, trigger));

    complete(jobStore, bundle);
    assertEquals(TriggerState.COMPLETE, state(jobStore, trigger));
    assertTrue(acquireAndFire(jobStore, now() + 1000, 1).isEmpty());
  }

  @Test
  public void testFireRepeatingTrigger() throws Exception {
    long start = now();
    OperableTrigger trigger = buildRepeatingTrigger("trigger1", "g", job, start, 60000L);
    jobStore.storeJobAndTrigger(job, trigger);

    TriggerFiredBundle bundle = acquireAndFire(jobStore, now() + 1000, 1).get(0);
    assertEquals(new Date(start + 60000L), bundle.getNextFireTime());

    complete(jobStore, bundle);
    assertEquals(TriggerState.NORMAL, state(jobStore, trigger));
    assertEquals(new Date(start + 60000L),
        jobStore.retrieveTrigger(trigger.getKey()).getNextFireTime());
    assertEquals(new Date(start), jobStore.retrieveTrigger(trigger.getKey()).getPreviousFireTime());
  }

  @Test
  public void testDeleteTriggerInstruction() throws Exception {
    OperableTrigger trigger = buildTrigger("trigger1", "g", job, now());
    jobStore.storeJobAndTrigger(job, trigger);

    TriggerFiredBundle bundle = acquireAndFire(jobStore, now() + 1000, 1).get(0);
    jobStore.triggeredJobComplete(bundle.getTrigger(), bundle.getJobDetail(),
        CompletedExecutionInstruction.DELETE_TRIGGER);

    assertFalse(jobStore.checkExists(trigger.getKey()));
    assertFalse(jobStore.checkExists(job.getKey()));
    assertEquals(Collections.singletonList(job.getKey()), signaler.deletedJobs);
  }

  @Test
  public void testStaleTokenIsNotFired() throws Exception {
    jobStore.storeJobAndTrigger(job, buildTrigger("trigger1", "g", job, now()));

    OperableTrigger stale = jobStore.acquireNextTriggers(now() + 1000, 1, 0L).get(0);
    jobStore.releaseAcquiredTrigger(stale);
    OperableTrigger current = jobStore.acquireNextTriggers(now() + 1000, 1, 0L).get(0);

    List<TriggerFiredResult> staleResults =
        jobStore.triggersFired(Collections.singletonList(stale));
    assertEquals(1, staleResults.size());
    assertNull(staleResults.get(0).getTriggerFiredBundle());
    assertNull(staleResults.get(0).getException());

    List<TriggerFiredResult> currentResults =
        jobStore.triggersFired(Collections.singletonList(current));
    assertNotNull(currentResults.get(0).getTriggerFiredBundle());
  }

  @Test
  public void testFiringTwiceWithOneTokenFiresOnce() throws Exception {
    JobDetail nonConcurrent = newJob(NonConcurrentJob.class).withIdentity("job2", "jobGroup")
        .storeDurably().build();
    OperableTrigger repeating =
        buildRepeatingTrigger("repeating", "g", nonConcurrent, now() - 1000, ONE_HOUR);
    OperableTrigger other = buildTrigger("other", "g", nonConcurrent, now() + ONE_HOUR);
    jobStore.storeJobAndTrigger(nonConcurrent, repeating);
    jobStore.storeTrigger(other, false);

    List<OperableTrigger> acquired = jobStore.acquireNextTriggers(now() + 1000, 1, 0L);
    TriggerFiredBundle bundle =
        jobStore.triggersFired(acquired).get(0).getTriggerFiredBundle();
    assertNotNull(bundle);
    Date nextFireTime = jobStore.retrieveTrigger(repeating.getKey()).getNextFireTime();

    List<TriggerFiredResult> again = jobStore.triggersFired(acquired);
    assertNull(again.get(0).getTriggerFiredBundle());
    assertNull(again.get(0).getException());
    assertEquals(nextFireTime, jobStore.retrieveTrigger(repeating.getKey()).getNextFireTime());
    assertEquals(TriggerState.BLOCKED, state(jobStore, other));
  }

  @Test
  public void testCompletingTwiceWithOneTokenCompletesOnce() throws Exception {
    JobDetail nonConcurrent = newJob(NonConcurrentJob.class).withIdentity("job2", "jobGroup")
        .storeDurably().build();
    OperableTrigger repeating =
        buildRepeatingTrigger("repeating", "g", nonConcurrent, now() - 2000, ONE_HOUR);
    OperableTrigger other =
        buildRepeatingTrigger("other", "g", nonConcurrent, now() - 1000, ONE_HOUR);
    jobStore.storeJobAndTrigger(nonConcurrent, repeating);
    jobStore.storeTrigger(other, false);

    TriggerFiredBundle first = acquireAndFire(jobStore, now() + 1000, 1).get(0);
    assertEquals(repeating.getKey(), first.getTrigger().getKey());
    complete(jobStore, first);
    assertEquals(TriggerState.NORMAL, state(jobStore, other));

    TriggerFiredBundle second = acquireAndFire(jobStore, now() + 1000, 1).get(0);
    assertEquals(other.getKey(), second.getTrigger().getKey());
    assertEquals(TriggerState.BLOCKED, state(jobStore, repeating));

    // A repeated completion of the first firing leaves the second one's block alone.
    complete(jobStore, first);
    assertEquals(TriggerState.BLOCKED, state(jobStore, repeating));

    complete(jobStore, second);
    assertEquals(TriggerState.NORMAL, state(jobStore, repeating));
  }

  @Test
  public void testCompletionOfReplacedTriggerIsIgnored() throws Exception {
    OperableTrigger trigger = buildTrigger("trigger1", "g", job, now());
    jobStore.storeJobAndTrigger(job, trigger);
    TriggerFiredBundle bundle = acquireAndFire(jobStore, now() + 1000, 1).get(0);

    jobStore.storeTrigger(buildTrigger("trigger1", "g", job, now() + 60000), true);
    jobStore.triggeredJobComplete(bundle.getTrigger(), bundle.getJobDetail(),
        CompletedExecutionInstruction.SET_TRIGGER_ERROR);

    assertEquals(TriggerState.NORMAL, state(jobStore, trigger));
  }

  @Test
  public void testMissingCalendarIsNotFired() throws Exception {
    OperableTrigger trigger = (OperableTrigger) newTrigger().withIdentity("trigger1", "g")
        .forJob(job).startAt(new Date(now())).modifiedByCalendar("missing").build();
    trigger.computeFirstFireTime(null);
    jobStore.storeJobAndTrigger(job, trigger);

    List<OperableTrigger> acquired = jobStore.acquireNextTriggers(now() + 1000, 1, 0L);
    assertEquals(1, acquired.size());

    List<TriggerFiredResult> results = jobStore.triggersFired(acquired);
    assertNull(results.get(0).getTriggerFiredBundle());

    jobStore.releaseAcquiredTrigger(acquired.get(0));
    assertEquals(TriggerState.NORMAL, state(jobStore, trigger));
  }

  @Test
  public void testSetAllJobTriggersError() throws Exception {
    OperableTrigger fired = buildTrigger("fired", "g", job, now());
    OperableTrigger other = buildTrigger("other", "g", job, now() + 60000);
    jobStore.storeJobAndTrigger(job, fired);
    jobStore.storeTrigger(other, false);

    TriggerFiredBundle bundle = acquireAndFire(jobStore, now() + 1000, 1).get(0);
    jobStore.triggeredJobComplete(bundle.getTrigger(), bundle.getJobDetail(),
        CompletedExecutionInstruction.SET_ALL_JOB_TRIGGERS_ERROR);

    assertEquals(TriggerState.ERROR, state(jobStore, fired));
    assertEquals(TriggerState.ERROR, state(jobStore, other));
    assertTrue(jobStore.acquireNextTriggers(now() + 120000, 10, 0L).isEmpty());

    jobStore.resetTriggerFromErrorState(other.getKey());
    assertEquals(TriggerState.NORMAL, state(jobStore, other));
  }

  @Test
  public void testSetTriggerComplete() throws Exception {
    OperableTrigger trigger = buildRepeatingTrigger("trigger1", "g", job, now(), 60000L);
    jobStore.storeJobAndTrigger(job, trigger);

    TriggerFiredBundle bundle = acquireAndFire(jobStore, now() + 1000, 1).get(0);
    jobStore.triggeredJobComplete(bundle.getTrigger(), bundle.getJobDetail(),
        CompletedExecutionInstruction.SET_TRIGGER_COMPLETE);

    assertEquals(TriggerState.COMPLETE, state(jobStore, trigger));
  }
}
