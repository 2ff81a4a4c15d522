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

import io.smartspaces.scheduling.quartz.clusterstore.internal.dao.StandardSchedulerDao;
import io.smartspaces.scheduling.quartz.clusterstore.internal.db.OrientDbConnector;
import io.smartspaces.scheduling.quartz.clusterstore.internal.db.OrientDbConnector.TransactionMethod;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.Clock;

import org.quartz.JobPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The periodic check-in of a scheduler instance. After checking in, the work of
 * instances which stopped checking in is recovered.
 */
public class CheckinTask implements Runnable {

  private static final Logger log = LoggerFactory.getLogger(CheckinTask.class);

  private final OrientDbConnector connector;
  private final StandardSchedulerDao schedulerDao;
  private final TriggerRecoverer recoverer;
  private final String instanceId;
  private final long checkinInterval;
  private final Clock clock;

  /**
   * The state reported with each check-in.
   */
  private volatile SchedulerInstanceState state = SchedulerInstanceState.STARTED;

  public CheckinTask(OrientDbConnector connector, StandardSchedulerDao schedulerDao,
      TriggerRecoverer recoverer, String instanceId, long checkinInterval, Clock clock) {
    this.connector = connector;
    this.schedulerDao = schedulerDao;
    this.recoverer = recoverer;
    this.instanceId = instanceId;
    this.checkinInterval = checkinInterval;
    this.clock = clock;
  }

  @Override
  public void run() {
    try {
      connector.doWithoutTransaction(new TransactionMethod<Void>() {
        @Override
        public Void doInTransaction() throws JobPersistenceException {
          checkIn();
          recoverer.recoverFailedInstances();
          return null;
        }
      });
    } catch (JobPersistenceException | RuntimeException e) {
      // Thrown out of a scheduled task, this would stop all further check-ins.
      log.error("Check-in of scheduler instance {} failed", instanceId, e);
    }
  }

  /**
   * Check in right away. A database session must be bound.
   *
   * @throws JobPersistenceException
   *           the check-in could not be saved
   */
  public void checkIn() throws JobPersistenceException {
    schedulerDao.checkIn(instanceId, clock.millis(), checkinInterval, state);
  }

  /**
   * Change the state of the instance and record it right away.
   *
   * @param state
   *          the new state
   *
   * @throws JobPersistenceException
   *           the state could not be saved
   */
  public void setState(final SchedulerInstanceState state) throws JobPersistenceException {
    this.state = state;
    connector.doWithoutTransaction(new TransactionMethod<Void>() {
      @Override
      public Void doInTransaction() throws JobPersistenceException {
        checkIn();
        return null;
      }
    });
  }

  public SchedulerInstanceState getState() {
    return state;
  }
}
