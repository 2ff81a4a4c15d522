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
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.quartz.JobBuilder.newJob;

import io.smartspaces.scheduling.quartz.clusterstore.TestJobs.NoOpJob;

import org.junit.Test;
import org.quartz.JobDetail;
import org.quartz.SchedulerConfigException;
import org.quartz.Trigger.TriggerState;
import org.quartz.spi.OperableTrigger;

import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Validation of the store's configuration and separation of stores sharing a
 * database.
 */
public class ConfigurationTest extends AbstractJobStoreTest {

  @Test(expected = SchedulerConfigException.class)
  public void testDatabaseNameRequired() throws Exception {
    OrientDbClusterJobStore store = newJobStore("node1", false);
    store.setDbName(null);
    startJobStore(store);
  }

  @Test(expected = SchedulerConfigException.class)
  public void testLocationRequired() throws Exception {
    OrientDbClusterJobStore store = newJobStore("node1", false);
    store.setOrientDb(null);
    startJobStore(store);
  }

  @Test(expected = SchedulerConfigException.class)
  public void testInstanceIdRequired() throws Exception {
    startJobStore(newJobStore(null, false));
  }

  @Test(expected = SchedulerConfigException.class)
  public void testCollectionPrefixValidated() throws Exception {
    OrientDbClusterJobStore store = newJobStore("node1", false);
    store.setCollectionPrefix("quartz-jobs;");
    startJobStore(store);
  }

  @Test(expected = SchedulerConfigException.class)
  public void testMemoryBlocksRefusedWhenClustered() throws Exception {
    OrientDbClusterJobStore store = newJobStore("node1", true);
    store.setBlockTracking("memory");
    startJobStore(store);
  }

  @Test(expected = SchedulerConfigException.class)
  public void testUnknownBlockTracking() throws Exception {
    OrientDbClusterJobStore store = newJobStore("node1", false);
    store.setBlockTracking("sometimes");
    startJobStore(store);
  }

  @Test(expected = SchedulerConfigException.class)
  public void testCheckinIntervalMustBePositiveWhenClustered() throws Exception {
    OrientDbClusterJobStore store = newJobStore("node1", true);
    store.setClusterCheckinInterval(0L);
    startJobStore(store);
  }

  @Test
  public void testPersistentBlocksWithoutClustering() throws Exception {
    OrientDbClusterJobStore store = newJobStore("node1", false);
    store.setBlockTracking("PERSISTENT");
    startJobStore(store);

    assertFalse(store.isClustered());
    assertTrue(store.supportsPersistence());
  }

  @Test
  public void testCollectionPrefixesSeparateStores() throws Exception {
    OrientDbClusterJobStore first = newJobStore("node1", false);
    first.setCollectionPrefix("first");
    startJobStore(first);
    OrientDbClusterJobStore second = newJobStore("node2", false);
    second.setCollectionPrefix("second");
    startJobStore(second);

    JobDetail job = newJob(NoOpJob.class).withIdentity("job1", "jobGroup").build();
    OperableTrigger trigger = buildTrigger("trigger1", "g", job, now());
    first.storeJobAndTrigger(job, trigger);

    assertEquals(1, first.getNumberOfJobs());
    assertEquals(0, second.getNumberOfJobs());
    assertEquals(TriggerState.NONE, state(second, trigger));
  }

  @Test
  public void testSchedulerNamesSeparateStores() throws Exception {
    OrientDbClusterJobStore first = startJobStore("node1", false);
    OrientDbClusterJobStore second = newJobStore("node2", false);
    second.setInstanceName("otherScheduler");
    startJobStore(second);

    JobDetail job = newJob(NoOpJob.class).withIdentity("job1", "jobGroup").build();
    first.storeJobAndTrigger(job, buildTrigger("trigger1", "g", job, now()));

    assertTrue(second.getJobGroupNames().isEmpty());
    assertTrue(second.acquireNextTriggers(now() + 1000, 10, 0L).isEmpty());
    assertEquals(1, first.acquireNextTriggers(now() + 1000, 10, 0L).size());
  }

  @Test
  public void testCollectionPrefixGetsUnderscore() throws Exception {
    OrientDbClusterJobStore store = newJobStore("node1", false);
    store.setCollectionPrefix("quartz");

    assertEquals("quartz_", store.getCollectionPrefix());
  }

  @Test
  public void testSuppliedExecutorThreadKeepsItsName() throws Exception {
    ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor();
    try {
      String poolThreadName = executor.submit(new Callable<String>() {
        @Override
        public String call() {
          return Thread.currentThread().getName();
        }
      }).get(5, TimeUnit.SECONDS);

      OrientDbClusterJobStore store = newJobStore("node1", false);
      store.setExecutorService(executor);
      startJobStore(store);
      store.schedulerStarted();
      store.shutdown();

      assertFalse(executor.isShutdown());
      String nameAfterScan = executor.submit(new Callable<String>() {
        @Override
        public String call() {
          return Thread.currentThread().getName();
        }
      }).get(5, TimeUnit.SECONDS);

      assertNotEquals("Quartz-Misfire", nameAfterScan);
      assertEquals(poolThreadName, nameAfterScan);
    } finally {
      executor.shutdownNow();
    }
  }
}
