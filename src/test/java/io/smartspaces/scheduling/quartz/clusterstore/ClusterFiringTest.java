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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.quartz.JobBuilder.newJob;

import io.smartspaces.scheduling.quartz.clusterstore.TestJobs.NoOpJob;
import io.smartspaces.scheduling.quartz.clusterstore.TestJobs.NonConcurrentJob;

import org.junit.Test;
import org.quartz.JobDetail;
import org.quartz.Trigger.TriggerState;
import org.quartz.TriggerKey;
import org.quartz.impl.matchers.GroupMatcher;
import org.quartz.spi.OperableTrigger;
import org.quartz.spi.TriggerFiredBundle;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BrokenBarrierException;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Several instances sharing one database, each trigger firing on exactly one
 * of them.
 */
public class ClusterFiringTest extends AbstractJobStoreTest {

  private static final int TRIGGER_COUNT = 20;

  private static final int RACING_INSTANCES = 4;

  @Test
  public void testEachTriggerFiresOnOneInstance() throws Exception {
    final OrientDbClusterJobStore nodeA = startJobStore("nodeA", true);
    final OrientDbClusterJobStore nodeB = startJobStore("nodeB", true);

    JobDetail job = newJob(NoOpJob.class).withIdentity("job1", "jobGroup").build();
    nodeA.storeJobAndTrigger(job, buildTrigger("trigger0", "g", job, now()));
    for (int i = 1; i < TRIGGER_COUNT; i++) {
      nodeA.storeTrigger(buildTrigger("trigger" + i, "g", job, now()), false);
    }

    final CountDownLatch start = new CountDownLatch(1);
    ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      List<Future<List<TriggerKey>>> results = new ArrayList<Future<List<TriggerKey>>>();
      for (final OrientDbClusterJobStore store : new OrientDbClusterJobStore[] { nodeA, nodeB }) {
        results.add(executor.submit(new Callable<List<TriggerKey>>() {
          @Override
          public List<TriggerKey> call() throws Exception {
            start.await();
            List<TriggerKey> fired = new ArrayList<TriggerKey>();
            List<TriggerFiredBundle> bundles;
            do {
              bundles = acquireAndFire(store, now() + 1000, 3);
              for (TriggerFiredBundle bundle : bundles) {
                fired.add(bundle.getTrigger().getKey());
              }
            } while (!bundles.isEmpty());

            return fired;
          }
        }));
      }
      start.countDown();

      List<TriggerKey> allFired = new ArrayList<TriggerKey>();
      for (Future<List<TriggerKey>> result : results) {
        allFired.addAll(result.get(60, TimeUnit.SECONDS));
      }

      assertEquals(TRIGGER_COUNT, allFired.size());
      assertEquals(TRIGGER_COUNT, new HashSet<TriggerKey>(allFired).size());
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  public void testInstancesRacingForOneTrigger() throws Exception {
    final CyclicBarrier acquiring = new CyclicBarrier(RACING_INSTANCES);
    ExecutionStepObserver waitForAll = new ExecutionStepObserver() {
      @Override
      public void stepReached(ExecutionStep step, String instanceId, TriggerKey triggerKey) {
        if (step != ExecutionStep.ACQUIRING) {
          return;
        }

        try {
          acquiring.await(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException("Interrupted waiting for the other instances", e);
        } catch (BrokenBarrierException | TimeoutException e) {
          throw new IllegalStateException("The other instances did not reach acquisition", e);
        }
      }
    };

    List<OrientDbClusterJobStore> nodes = new ArrayList<OrientDbClusterJobStore>();
    for (int i = 0; i < RACING_INSTANCES; i++) {
      OrientDbClusterJobStore node = newJobStore("node" + i, true);
      node.setExecutionStepObserver(waitForAll);
      nodes.add(startJobStore(node));
    }

    JobDetail job = newJob(NoOpJob.class).withIdentity("job1", "jobGroup").build();
    nodes.get(0).storeJobAndTrigger(job, buildTrigger("trigger1", "g", job, now()));

    ExecutorService executor = Executors.newFixedThreadPool(RACING_INSTANCES);
    try {
      List<Future<List<OperableTrigger>>> results =
          new ArrayList<Future<List<OperableTrigger>>>();
      for (final OrientDbClusterJobStore node : nodes) {
        results.add(executor.submit(new Callable<List<OperableTrigger>>() {
          @Override
          public List<OperableTrigger> call() throws Exception {
            return node.acquireNextTriggers(now() + 1000, 1, 0L);
          }
        }));
      }

      int acquired = 0;
      for (Future<List<OperableTrigger>> result : results) {
        acquired += result.get(60, TimeUnit.SECONDS).size();
      }

      assertEquals(1, acquired);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  public void testNonConcurrentJobBlocksAcrossInstances() throws Exception {
    OrientDbClusterJobStore nodeA = startJobStore("nodeA", true);
    OrientDbClusterJobStore nodeB = startJobStore("nodeB", true);

    JobDetail job = newJob(NonConcurrentJob.class).withIdentity("job1", "jobGroup").build();
    OperableTrigger first = buildTrigger("first", "g", job, now());
    OperableTrigger second = buildTrigger("second", "g", job, now());
    nodeA.storeJobAndTrigger(job, first);
    nodeA.storeTrigger(second, false);

    List<TriggerFiredBundle> firedOnA = acquireAndFire(nodeA, now() + 1000, 10);
    // Only one trigger of a non-concurrent job is taken per batch.
    assertEquals(1, firedOnA.size());
    TriggerFiredBundle running = firedOnA.get(0);
    OperableTrigger waiting =
        running.getTrigger().getKey().equals(first.getKey()) ? second : first;

    assertTrue(acquireAndFire(nodeB, now() + 1000, 10).isEmpty());
    assertEquals(TriggerState.BLOCKED, state(nodeB, waiting));

    complete(nodeA, running);
    assertEquals(TriggerState.NORMAL, state(nodeB, waiting));

    List<TriggerFiredBundle> firedOnB = acquireAndFire(nodeB, now() + 1000, 10);
    assertEquals(1, firedOnB.size());
    assertEquals(waiting.getKey(), firedOnB.get(0).getTrigger().getKey());
  }

  @Test
  public void testLateCompletionKeepsBlockOfLaterFiring() throws Exception {
    OrientDbClusterJobStore nodeA = startJobStore("nodeA", true);
    OrientDbClusterJobStore nodeB = startJobStore("nodeB", true);

    JobDetail job = newJob(NonConcurrentJob.class).withIdentity("job1", "jobGroup")
        .storeDurably().build();
    OperableTrigger t1 = buildTrigger("t1", "g", job, now() - 3000);
    OperableTrigger t2 = buildTrigger("t2", "g", job, now() - 2000);
    OperableTrigger t3 = buildTrigger("t3", "g", job, now() - 1000);
    nodeA.storeJobAndTrigger(job, t1);
    nodeA.storeTrigger(t2, false);
    nodeA.storeTrigger(t3, false);

    List<TriggerFiredBundle> firstFiring = acquireAndFire(nodeA, now() + 1000, 1);
    assertEquals(1, firstFiring.size());
    assertEquals(t1.getKey(), firstFiring.get(0).getTrigger().getKey());
    complete(nodeA, firstFiring.get(0));

    List<TriggerFiredBundle> secondFiring = acquireAndFire(nodeA, now() + 1000, 1);
    assertEquals(1, secondFiring.size());
    assertEquals(t2.getKey(), secondFiring.get(0).getTrigger().getKey());

    // The first firing reports its completion a second time.
    complete(nodeA, firstFiring.get(0));

    assertEquals(TriggerState.BLOCKED, state(nodeB, t3));
    assertTrue(acquireAndFire(nodeB, now() + 1000, 10).isEmpty());

    complete(nodeA, secondFiring.get(0));
    List<TriggerFiredBundle> thirdFiring = acquireAndFire(nodeB, now() + 1000, 10);
    assertEquals(1, thirdFiring.size());
    assertEquals(t3.getKey(), thirdFiring.get(0).getTrigger().getKey());
  }

  @Test
  public void testHolderCompletingWhileTriggerIsBlockedReleasesIt() throws Exception {
    final OrientDbClusterJobStore nodeA = startJobStore("nodeA", true);
    final ExecutorService completer = Executors.newSingleThreadExecutor();
    final List<TriggerFiredBundle> running = new ArrayList<TriggerFiredBundle>();

    // Completes the running firing on nodeA just as nodeB finds the job blocked.
    OrientDbClusterJobStore nodeB = newJobStore("nodeB", true);
    nodeB.setExecutionStepObserver(new ExecutionStepObserver() {
      @Override
      public void stepReached(ExecutionStep step, String instanceId, TriggerKey triggerKey) {
        if (step != ExecutionStep.BLOCKING) {
          return;
        }

        try {
          completer.submit(new Runnable() {
            @Override
            public void run() {
              complete(nodeA, running.get(0));
            }
          }).get(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException("Interrupted completing the running job", e);
        } catch (ExecutionException | TimeoutException e) {
          throw new IllegalStateException("Could not complete the running job", e);
        }
      }
    });
    startJobStore(nodeB);

    try {
      JobDetail job = newJob(NonConcurrentJob.class).withIdentity("job1", "jobGroup")
          .storeDurably().build();
      OperableTrigger first = buildTrigger("first", "g", job, now() - 2000);
      OperableTrigger second = buildTrigger("second", "g", job, now() - 1000);
      nodeA.storeJobAndTrigger(job, first);
      nodeA.storeTrigger(second, false);

      List<OperableTrigger> acquiredOnA = nodeA.acquireNextTriggers(now() + 1000, 1, 0L);
      List<OperableTrigger> acquiredOnB = nodeB.acquireNextTriggers(now() + 1000, 1, 0L);
      assertEquals(first.getKey(), acquiredOnA.get(0).getKey());
      assertEquals(second.getKey(), acquiredOnB.get(0).getKey());

      running.add(nodeA.triggersFired(acquiredOnA).get(0).getTriggerFiredBundle());
      assertNull(nodeB.triggersFired(acquiredOnB).get(0).getTriggerFiredBundle());

      assertEquals(TriggerState.NORMAL, state(nodeB, second));
      List<TriggerFiredBundle> firedOnB = acquireAndFire(nodeB, now() + 1000, 10);
      assertEquals(1, firedOnB.size());
      assertEquals(second.getKey(), firedOnB.get(0).getTrigger().getKey());
    } finally {
      completer.shutdownNow();
    }
  }

  @Test
  public void testPausedGroupSeenByOtherInstance() throws Exception {
    OrientDbClusterJobStore nodeA = startJobStore("nodeA", true);
    OrientDbClusterJobStore nodeB = startJobStore("nodeB", true);

    JobDetail job = newJob(NoOpJob.class).withIdentity("job1", "jobGroup").build();
    nodeA.storeJobAndTrigger(job, buildTrigger("trigger1", "g", job, now()));

    nodeA.pauseTriggers(GroupMatcher.triggerGroupEquals("g"));
    assertTrue(nodeB.acquireNextTriggers(now() + 1000, 10, 0L).isEmpty());

    nodeA.resumeTriggers(GroupMatcher.triggerGroupEquals("g"));
    assertEquals(1, nodeB.acquireNextTriggers(now() + 1000, 10, 0L).size());
  }

  @Test
  public void testInstancesShareTheDatabase() throws Exception {
    OrientDbClusterJobStore nodeA = startJobStore("nodeA", true);
    OrientDbClusterJobStore nodeB = startJobStore("nodeB", true);

    JobDetail job = newJob(NoOpJob.class).withIdentity("job1", "jobGroup").build();
    nodeA.storeJobAndTrigger(job, buildTrigger("trigger1", "g", job, now()));

    Set<TriggerKey> keys = nodeB.getTriggerKeys(GroupMatcher.triggerGroupEquals("g"));
    assertEquals(1, keys.size());
    assertTrue(nodeB.removeJob(job.getKey()));
    assertEquals(0, nodeA.getNumberOfJobs());
  }
}
