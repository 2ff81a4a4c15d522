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


package io.smartspaces.scheduling.quartz.clusterstore.internal.dao;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import io.smartspaces.scheduling.quartz.clusterstore.internal.cluster.SchedulerInstance;
import io.smartspaces.scheduling.quartz.clusterstore.internal.cluster.SchedulerInstanceState;
import io.smartspaces.scheduling.quartz.clusterstore.internal.db.AbstractDatabaseTest;
import io.smartspaces.scheduling.quartz.clusterstore.internal.db.OrientDbConnector.TransactionMethod;

import org.junit.Before;
import org.junit.Test;
import org.quartz.JobPersistenceException;

import java.util.List;

/**
 * Check-in records of scheduler instances.
 */
public class StandardSchedulerDaoTest extends AbstractDatabaseTest {

  private StandardSchedulerDao schedulerDao;

  @Before
  public void setUpDao() {
    schedulerDao = new StandardSchedulerDao(connector, schema, queryHelper, SCHEDULER_NAME);
  }

  @Test
  public void testCheckInCreatesThenUpdates() throws Exception {
    inSession(new TransactionMethod<Void>() {
      @Override
      public Void doInTransaction() throws JobPersistenceException {
        schedulerDao.checkIn("node1", 1000L, 500L, SchedulerInstanceState.STARTED);
        schedulerDao.checkIn("node1", 2000L, 500L, SchedulerInstanceState.STARTED);

        SchedulerInstance instance = schedulerDao.findInstance("node1");
        assertEquals(2000L, instance.getLastCheckinTime());
        assertEquals(500L, instance.getCheckinInterval());
        assertEquals(SchedulerInstanceState.STARTED, instance.getState());
        assertNull(schedulerDao.findInstance("node2"));
        return null;
      }
    });
  }

  @Test
  public void testInstancesInCheckinOrder() throws Exception {
    inSession(new TransactionMethod<Void>() {
      @Override
      public Void doInTransaction() throws JobPersistenceException {
        schedulerDao.checkIn("late", 3000L, 500L, SchedulerInstanceState.STARTED);
        schedulerDao.checkIn("early", 1000L, 500L, SchedulerInstanceState.STARTED);

        List<SchedulerInstance> instances = schedulerDao.getAllByCheckinTime();
        assertEquals(2, instances.size());
        assertEquals("early", instances.get(0).getInstanceId());
        assertEquals("late", instances.get(1).getInstanceId());
        return null;
      }
    });
  }

  @Test
  public void testSetState() throws Exception {
    inSession(new TransactionMethod<Void>() {
      @Override
      public Void doInTransaction() throws JobPersistenceException {
        assertFalse(schedulerDao.setState("node1", SchedulerInstanceState.PAUSED));

        schedulerDao.checkIn("node1", 1000L, 500L, SchedulerInstanceState.STARTED);
        assertTrue(schedulerDao.setState("node1", SchedulerInstanceState.PAUSED));
        assertEquals(SchedulerInstanceState.PAUSED, schedulerDao.findInstance("node1").getState());
        return null;
      }
    });
  }

  @Test
  public void testRemoveOnlyIfNotCheckedInAgain() throws Exception {
    inSession(new TransactionMethod<Void>() {
      @Override
      public Void doInTransaction() throws JobPersistenceException {
        schedulerDao.checkIn("node1", 1000L, 500L, SchedulerInstanceState.STARTED);
        schedulerDao.checkIn("node1", 2000L, 500L, SchedulerInstanceState.STARTED);

        assertFalse(schedulerDao.remove("node1", 1000L));
        assertTrue(schedulerDao.remove("node1", 2000L));
        assertNull(schedulerDao.findInstance("node1"));
        assertFalse(schedulerDao.remove("node1", 2000L));
        return null;
      }
    });
  }
}
