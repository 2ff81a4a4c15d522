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

import io.smartspaces.scheduling.quartz.clusterstore.internal.Constants;
import io.smartspaces.scheduling.quartz.clusterstore.internal.JobConverter;
import io.smartspaces.scheduling.quartz.clusterstore.internal.TriggerAndJobPersister;
import io.smartspaces.scheduling.quartz.clusterstore.internal.TriggerStateManager;
import io.smartspaces.scheduling.quartz.clusterstore.internal.block.BlockRepository;
import io.smartspaces.scheduling.quartz.clusterstore.internal.dao.StandardJobDao;
import io.smartspaces.scheduling.quartz.clusterstore.internal.dao.StandardSchedulerDao;
import io.smartspaces.scheduling.quartz.clusterstore.internal.dao.StandardTriggerDao;
import io.smartspaces.scheduling.quartz.clusterstore.internal.db.OrientDbConnector;
import io.smartspaces.scheduling.quartz.clusterstore.internal.trigger.MisfireHandler;
import io.smartspaces.scheduling.quartz.clusterstore.internal.trigger.TriggerConverter;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.Clock;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.Keys;

import com.orientechnologies.orient.core.exception.OConcurrentModificationException;
import com.orientechnologies.orient.core.exception.ORecordNotFoundException;
import com.orientechnologies.orient.core.record.impl.ODocument;
import org.quartz.JobPersistenceException;
import org.quartz.TriggerKey;
import org.quartz.spi.OperableTrigger;
import org.quartz.spi.SchedulerSignaler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Recovers the work of scheduler instances which died.
 *
 * <p>
 * Triggers an instance had acquired or was executing are given back, and the
 * job blocks it held are released. A job which requests recovery gets a
 * one-shot trigger re-running the lost firing.
 *
 * <p>
 * Must be called with a database session bound and no transaction running.
 */
public class TriggerRecoverer {

  private static final Logger LOG = LoggerFactory.getLogger(TriggerRecoverer.class);

  private final OrientDbConnector connector;
  private final StandardTriggerDao triggerDao;
  private final StandardJobDao jobDao;
  private final StandardSchedulerDao schedulerDao;
  private final TriggerStateManager stateManager;
  private final BlockRepository blockRepository;
  private final MisfireHandler misfireHandler;
  private final TriggerAndJobPersister persister;
  private final RecoveryTriggerFactory recoveryTriggerFactory;
  private final TriggerConverter triggerConverter;
  private final SchedulerSignaler signaler;
  private final String instanceId;

  /**
   * How long past its check-in interval an instance is given before it is
   * considered dead, in milliseconds.
   */
  private final long checkinMargin;

  private final Clock clock;

  public TriggerRecoverer(OrientDbConnector connector, StandardTriggerDao triggerDao,
      StandardJobDao jobDao, StandardSchedulerDao schedulerDao, TriggerStateManager stateManager,
      BlockRepository blockRepository, MisfireHandler misfireHandler,
      TriggerAndJobPersister persister, RecoveryTriggerFactory recoveryTriggerFactory,
      TriggerConverter triggerConverter, SchedulerSignaler signaler, String instanceId,
      long checkinMargin, Clock clock) {
    this.connector = connector;
    this.triggerDao = triggerDao;
    this.jobDao = jobDao;
    this.schedulerDao = schedulerDao;
    this.stateManager = stateManager;
    this.blockRepository = blockRepository;
    this.misfireHandler = misfireHandler;
    this.persister = persister;
    this.recoveryTriggerFactory = recoveryTriggerFactory;
    this.triggerConverter = triggerConverter;
    this.signaler = signaler;
    this.instanceId = instanceId;
    this.checkinMargin = checkinMargin;
    this.clock = clock;
  }

  /**
   * Recover when the store starts.
   *
   * <p>
   * Anything recorded under this instance's ID belongs to a previous run of it
   * and is recovered too.
   *
   * @param clustered
   *          {@code true} if other instances may share the database
   *
   * @throws JobPersistenceException
   *           recovery failed
   */
  public void recoverOnStartup(boolean clustered) throws JobPersistenceException {
    LOG.info("Recovering scheduler data on startup of instance {}", instanceId);

    Set<String> liveInstanceIds;
    List<SchedulerInstance> defunctInstances = new ArrayList<SchedulerInstance>();
    if (clustered) {
      liveInstanceIds = new HashSet<String>();
      long now = clock.millis();
      for (SchedulerInstance instance : schedulerDao.getAllByCheckinTime()) {
        if (instance.getInstanceId().equals(instanceId)) {
          continue;
        }

        if (instance.isDefunct(now, checkinMargin)) {
          defunctInstances.add(instance);
        } else {
          liveInstanceIds.add(instance.getInstanceId());
        }
      }
    } else {
      // Nobody else uses the data, so nothing of the previous run is still alive.
      liveInstanceIds = Collections.emptySet();
      blockRepository.releaseAll();
      stateManager.unblockAll();
    }

    int recovered = recoverOrphanedTriggers(liveInstanceIds);
    releaseAbandonedBlocks(liveInstanceIds);

    int removed = 0;
    for (ODocument trigger : triggerDao.findByState(Constants.STATE_COMPLETE)) {
      try {
        persister.removeTrigger(trigger);
        removed++;
      } catch (OConcurrentModificationException | ORecordNotFoundException e) {
        LOG.debug("Complete trigger {} was removed by another instance",
            Keys.toTriggerKey(trigger));
      }
    }
    LOG.info("Removed {} 'complete' triggers.", removed);

    misfireHandler.recoverAllMisfires();

    removeCheckins(defunctInstances);

    if (recovered > 0) {
      signaler.signalSchedulingChange(0L);
    }
  }

  /**
   * Recover the work of instances which stopped checking in.
   *
   * @throws JobPersistenceException
   *           recovery failed
   */
  public void recoverFailedInstances() throws JobPersistenceException {
    Set<String> liveInstanceIds = new HashSet<String>();
    liveInstanceIds.add(instanceId);

    List<SchedulerInstance> defunctInstances = new ArrayList<SchedulerInstance>();
    long now = clock.millis();
    for (SchedulerInstance instance : schedulerDao.getAllByCheckinTime()) {
      if (instance.getInstanceId().equals(instanceId)) {
        continue;
      }

      if (instance.isDefunct(now, checkinMargin)) {
        LOG.info("Scheduler instance {} has failed, recovering its work", instance);
        defunctInstances.add(instance);
      } else {
        liveInstanceIds.add(instance.getInstanceId());
      }
    }

    // Owners without any check-in record count as dead too.
    int recovered = recoverOrphanedTriggers(liveInstanceIds);
    int released = releaseAbandonedBlocks(liveInstanceIds);

    removeCheckins(defunctInstances);

    if (recovered > 0 || released > 0) {
      LOG.info("Recovered {} triggers and {} job blocks of failed instances", recovered,
          released);
      signaler.signalSchedulingChange(0L);
    }
  }

  private int recoverOrphanedTriggers(Set<String> liveInstanceIds)
      throws JobPersistenceException {
    int recovered = 0;
    for (String state : new String[] { Constants.STATE_ACQUIRED, Constants.STATE_EXECUTING }) {
      for (ODocument triggerDoc : triggerDao.findByState(state)) {
        String owner = triggerDoc.field(Constants.TRIGGER_INSTANCE_ID);
        if (owner != null && liveInstanceIds.contains(owner)) {
          continue;
        }

        if (recoverTrigger(triggerDoc, state)) {
          recovered++;
        }
      }
    }

    return recovered;
  }

  private boolean recoverTrigger(ODocument triggerDoc, String state)
      throws JobPersistenceException {
    TriggerKey triggerKey = Keys.toTriggerKey(triggerDoc);
    String fireInstanceId = triggerDoc.field(Constants.TRIGGER_FIRE_INSTANCE_ID);

    OperableTrigger recoveryTrigger = null;
    if (Constants.STATE_EXECUTING.equals(state)) {
      recoveryTrigger = createRecoveryTrigger(triggerDoc, fireInstanceId);
    }

    if (triggerDoc.field(Constants.TRIGGER_NEXT_FIRE_TIME) == null) {
      triggerDoc.field(Constants.TRIGGER_STATE, Constants.STATE_COMPLETE);
    } else {
      triggerDoc.field(Constants.TRIGGER_STATE, stateManager.restingState(triggerDoc));
    }
    TriggerStateManager.clearFiring(triggerDoc);

    if (!connector.saveIfCurrent(triggerDoc)) {
      LOG.debug("Trigger {} was recovered by another instance", triggerKey);
      return false;
    }

    LOG.info("Recovered {} trigger {} of firing {}", state, triggerKey, fireInstanceId);

    if (recoveryTrigger != null) {
      if (persister.storeRecoveryTrigger(recoveryTrigger)) {
        LOG.info("Scheduled recovery trigger {} for job {}", recoveryTrigger.getKey(),
            recoveryTrigger.getJobKey());
      } else {
        LOG.debug("Recovery trigger {} already exists", recoveryTrigger.getKey());
      }
    }

    return true;
  }

  /**
   * Create the trigger re-running a lost firing, if its job asks for it.
   *
   * @return the recovery trigger, or {@code null} if none is wanted
   */
  private OperableTrigger createRecoveryTrigger(ODocument triggerDoc, String fireInstanceId) {
    ODocument jobDoc = jobDao.findById((String) triggerDoc.field(Constants.TRIGGER_JOB_ID));
    if (jobDoc == null || !JobConverter.isRequestsRecovery(jobDoc) || fireInstanceId == null) {
      return null;
    }

    try {
      return recoveryTriggerFactory.from(triggerConverter.toTrigger(triggerDoc), fireInstanceId);
    } catch (JobPersistenceException e) {
      LOG.error("Could not read trigger {}, its job will not be recovered",
          Keys.toTriggerKey(triggerDoc), e);
      return null;
    }
  }

  private int releaseAbandonedBlocks(Set<String> liveInstanceIds)
      throws JobPersistenceException {
    Set<String> released = blockRepository.releaseAbandoned(liveInstanceIds);
    for (String jobId : released) {
      stateManager.unblockTriggersOfJob(jobId);
    }

    return released.size();
  }

  private void removeCheckins(List<SchedulerInstance> defunctInstances) {
    for (SchedulerInstance instance : defunctInstances) {
      if (schedulerDao.remove(instance.getInstanceId(), instance.getLastCheckinTime())) {
        LOG.info("Removed check-in of failed scheduler instance {}", instance.getInstanceId());
      }
    }
  }
}
