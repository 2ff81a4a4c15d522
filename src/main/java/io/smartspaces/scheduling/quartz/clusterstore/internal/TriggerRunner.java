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

package io.smartspaces.scheduling.quartz.clusterstore.internal;

import io.smartspaces.scheduling.quartz.clusterstore.ExecutionStep;
import io.smartspaces.scheduling.quartz.clusterstore.ExecutionStepObserver;
import io.smartspaces.scheduling.quartz.clusterstore.StoreUnavailableException;
import io.smartspaces.scheduling.quartz.clusterstore.internal.block.BlockRepository;
import io.smartspaces.scheduling.quartz.clusterstore.internal.dao.StandardCalendarDao;
import io.smartspaces.scheduling.quartz.clusterstore.internal.dao.StandardJobDao;
import io.smartspaces.scheduling.quartz.clusterstore.internal.dao.StandardTriggerDao;
import io.smartspaces.scheduling.quartz.clusterstore.internal.db.OrientDbConnector;
import io.smartspaces.scheduling.quartz.clusterstore.internal.trigger.MisfireHandler;
import io.smartspaces.scheduling.quartz.clusterstore.internal.trigger.MisfireHandler.MisfireOutcome;
import io.smartspaces.scheduling.quartz.clusterstore.internal.trigger.TriggerConverter;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.Clock;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.Keys;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.QueryHelper.DocumentUpdate;

import com.orientechnologies.orient.core.record.impl.ODocument;
import org.quartz.Calendar;
import org.quartz.JobDetail;
import org.quartz.JobPersistenceException;
import org.quartz.Scheduler;
import org.quartz.TriggerKey;
import org.quartz.spi.OperableTrigger;
import org.quartz.spi.TriggerFiredBundle;
import org.quartz.spi.TriggerFiredResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Date;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The manager for acquiring and firing triggers.
 *
 * <p>
 * Every change of a trigger's state is a save of its document that fails if
 * another instance changed the document first. The instance whose save
 * succeeds owns the trigger.
 */
public class TriggerRunner {

  private static final Logger LOG = LoggerFactory.getLogger(TriggerRunner.class);

  /**
   * How many more candidates are read than asked for, to make up for the ones
   * skipped or lost to other instances.
   */
  private static final int CANDIDATE_OVERFETCH = 10;

  private static final Comparator<OperableTrigger> NEXT_FIRE_TIME_COMPARATOR =
      new Comparator<OperableTrigger>() {
        @Override
        public int compare(OperableTrigger o1, OperableTrigger o2) {
          int comp = o1.getNextFireTime().compareTo(o2.getNextFireTime());
          if (comp != 0) {
            return comp;
          }

          return Integer.compare(o2.getPriority(), o1.getPriority());
        }
      };

  private final OrientDbConnector connector;
  private final StandardTriggerDao triggerDao;
  private final StandardJobDao jobDao;
  private final StandardCalendarDao calendarDao;
  private final JobConverter jobConverter;
  private final TriggerConverter triggerConverter;
  private final MisfireHandler misfireHandler;
  private final TriggerStateManager stateManager;
  private final BlockRepository blockRepository;
  private final FireInstanceIdGenerator fireInstanceIdGenerator;
  private final ExecutionStepObserver observer;
  private final String instanceId;
  private final Clock clock;

  public TriggerRunner(OrientDbConnector connector, StandardTriggerDao triggerDao,
      StandardJobDao jobDao, StandardCalendarDao calendarDao, JobConverter jobConverter,
      TriggerConverter triggerConverter, MisfireHandler misfireHandler,
      TriggerStateManager stateManager, BlockRepository blockRepository,
      FireInstanceIdGenerator fireInstanceIdGenerator, ExecutionStepObserver observer,
      String instanceId, Clock clock) {
    this.connector = connector;
    this.triggerDao = triggerDao;
    this.jobDao = jobDao;
    this.calendarDao = calendarDao;
    this.jobConverter = jobConverter;
    this.triggerConverter = triggerConverter;
    this.misfireHandler = misfireHandler;
    this.stateManager = stateManager;
    this.blockRepository = blockRepository;
    this.fireInstanceIdGenerator = fireInstanceIdGenerator;
    this.observer = observer;
    this.instanceId = instanceId;
    this.clock = clock;
  }

  /**
   * Acquire triggers which are due to fire.
   *
   * @param noLaterThan
   *          the time triggers must be due by, in epoch milliseconds
   * @param maxCount
   *          the most triggers to acquire
   * @param timeWindow
   *          extra time added to {@code noLaterThan}
   *
   * @return the acquired triggers, in fire order, each carrying its fire
   *         instance token
   *
   * @throws JobPersistenceException
   *           the triggers could not be read
   */
  public List<OperableTrigger> acquireNext(long noLaterThan, int maxCount, long timeWindow)
      throws JobPersistenceException {
    long latestFireTime = noLaterThan + timeWindow;

    LOG.debug("Finding up to {} triggers which have time less than {}", maxCount,
        new Date(latestFireTime));

    List<OperableTrigger> triggers = acquireNextTriggers(latestFireTime, maxCount);

    // The misfire correction can change fire times, so sort again.
    Collections.sort(triggers, NEXT_FIRE_TIME_COMPARATOR);

    return triggers;
  }

  private List<OperableTrigger> acquireNextTriggers(long latestFireTime, int maxCount)
      throws JobPersistenceException {
    List<OperableTrigger> triggers = new ArrayList<OperableTrigger>();
    if (maxCount <= 0) {
      return triggers;
    }

    Set<String> pausedTriggerGroups = stateManager.getPausedTriggerGroupMarkers();
    Set<String> pausedJobGroups = stateManager.getPausedJobGroups();
    boolean allPaused = pausedTriggerGroups.contains(Constants.ALL_GROUPS_PAUSED);

    Set<String> acquiredJobIdsForNoConcurrentExec = new HashSet<String>();

    for (ODocument triggerDoc : triggerDao.findEligibleToRun(Constants.STATE_WAITING,
        latestFireTime, maxCount + CANDIDATE_OVERFETCH)) {
      if (maxCount <= triggers.size()) {
        break;
      }

      if (Thread.currentThread().isInterrupted()) {
        LOG.debug("Interrupted while acquiring triggers, returning {} acquired so far",
            triggers.size());
        break;
      }

      TriggerKey triggerKey = Keys.toTriggerKey(triggerDoc);
      if (allPaused || pausedTriggerGroups.contains(triggerKey.getGroup())
          || pausedJobGroups.contains(triggerDoc.field(Constants.TRIGGER_JOB_GROUP))) {
        LOG.debug("Skipping trigger {} as its group is paused", triggerKey);
        continue;
      }

      String jobId = triggerDoc.field(Constants.TRIGGER_JOB_ID);
      ODocument jobDoc = jobDao.findById(jobId);
      if (jobDoc == null) {
        LOG.error("The job of trigger {} no longer exists, setting trigger to error state",
            triggerKey);
        setErrorState(triggerDoc);
        continue;
      }

      OperableTrigger trigger;
      try {
        trigger = triggerConverter.toTrigger(triggerDoc);
      } catch (JobPersistenceException e) {
        LOG.error("Could not read trigger {}, setting trigger to error state", triggerKey, e);
        setErrorState(triggerDoc);
        continue;
      }

      // If can't run more than once, make sure only ends up in list once
      boolean nonConcurrent = JobConverter.isConcurrentExecutionDisallowed(jobDoc);
      if (nonConcurrent) {
        if (acquiredJobIdsForNoConcurrentExec.contains(jobId)) {
          continue;
        }

        if (blockRepository.isBlocked(jobId)) {
          moveToBlocked(triggerDoc, jobId);
          continue;
        }
      }

      if (notAcquirableAfterMisfire(triggerDoc, trigger, latestFireTime)) {
        continue;
      }

      observer.stepReached(ExecutionStep.ACQUIRING, instanceId, triggerKey);

      String fireInstanceId = fireInstanceIdGenerator.next();
      triggerDoc.field(Constants.TRIGGER_STATE, Constants.STATE_ACQUIRED);
      triggerDoc.field(Constants.TRIGGER_FIRE_INSTANCE_ID, fireInstanceId);
      triggerDoc.field(Constants.TRIGGER_INSTANCE_ID, instanceId);
      if (!connector.saveIfCurrent(triggerDoc)) {
        LOG.debug("Trigger {} was acquired by another instance", triggerKey);
        continue;
      }

      LOG.debug("Acquired trigger {} with fire instance {}", triggerKey, fireInstanceId);
      trigger.setFireInstanceId(fireInstanceId);
      if (nonConcurrent) {
        acquiredJobIdsForNoConcurrentExec.add(jobId);
      }
      triggers.add(trigger);
    }

    return triggers;
  }

  /**
   * Move a waiting trigger of a running job to blocked. The block may vanish
   * while doing so, in which case the trigger goes back to waiting.
   */
  private void moveToBlocked(ODocument triggerDoc, String jobId) throws JobPersistenceException {
    triggerDoc.field(Constants.TRIGGER_STATE, Constants.STATE_BLOCKED);
    if (!connector.saveIfCurrent(triggerDoc)) {
      return;
    }

    if (!blockRepository.isBlocked(jobId)) {
      LOG.debug("Block on job {} was released while blocking trigger {}", jobId,
          triggerDoc.field(Constants.DOCUMENT_ID));
      triggerDoc.field(Constants.TRIGGER_STATE, Constants.STATE_WAITING);
      connector.saveIfCurrent(triggerDoc);
    }
  }

  private boolean notAcquirableAfterMisfire(ODocument triggerDoc, OperableTrigger trigger,
      long latestFireTime) throws JobPersistenceException {
    MisfireOutcome outcome =
        misfireHandler.correctMisfire(triggerDoc, trigger, Constants.STATE_WAITING);
    if (outcome == MisfireOutcome.LOST) {
      return true;
    } else if (outcome == MisfireOutcome.NOT_MISFIRED) {
      return false;
    }

    LOG.debug("Misfire trigger {}.", trigger.getKey());
    if (trigger.getNextFireTime() == null) {
      return true;
    }

    // The trigger has misfired and was rescheduled, its fire time may be too
    // far in the future.
    if (trigger.getNextFireTime().getTime() > latestFireTime) {
      LOG.debug("Skipping trigger {} as it misfired and was scheduled for {}.", trigger.getKey(),
          trigger.getNextFireTime());
      return true;
    }

    return false;
  }

  private void setErrorState(ODocument triggerDoc) {
    triggerDoc.field(Constants.TRIGGER_STATE, Constants.STATE_ERROR);
    TriggerStateManager.clearFiring(triggerDoc);
    connector.saveIfCurrent(triggerDoc);
  }

  /**
   * Give back a trigger which was acquired but will not be fired.
   *
   * @param trigger
   *          the trigger, carrying the token it was acquired with
   *
   * @throws JobPersistenceException
   *           the trigger could not be updated
   */
  public void releaseAcquiredTrigger(OperableTrigger trigger) throws JobPersistenceException {
    observer.stepReached(ExecutionStep.RELEASING, instanceId, trigger.getKey());

    final String fireInstanceId = trigger.getFireInstanceId();
    boolean released = triggerDao.update(triggerDao.getTriggerId(trigger.getKey()),
        new DocumentUpdate() {
          @Override
          public boolean apply(ODocument document) throws JobPersistenceException {
            if (!isOwnedBy(document, Constants.STATE_ACQUIRED, fireInstanceId)) {
              return false;
            }

            document.field(Constants.TRIGGER_STATE, stateManager.restingState(document));
            TriggerStateManager.clearFiring(document);
            return true;
          }
        });

    LOG.debug("Release of acquired trigger {}: {}", trigger.getKey(), released);
  }

  /**
   * Fire acquired triggers.
   *
   * @param triggers
   *          the triggers
   *
   * @return one result for each trigger, in the same order
   *
   * @throws StoreUnavailableException
   *           the database could not be reached
   */
  public List<TriggerFiredResult> triggersFired(List<OperableTrigger> triggers)
      throws StoreUnavailableException {
    List<TriggerFiredResult> results = new ArrayList<TriggerFiredResult>(triggers.size());

    for (OperableTrigger trigger : triggers) {
      LOG.debug("Fired trigger {}", trigger.getKey());
      observer.stepReached(ExecutionStep.FIRING, instanceId, trigger.getKey());

      TriggerFiredResult result;
      try {
        result = new TriggerFiredResult(createTriggerFiredBundle(trigger));
      } catch (StoreUnavailableException e) {
        throw e;
      } catch (JobPersistenceException | RuntimeException e) {
        LOG.error("Could not fire trigger {}", trigger.getKey(), e);
        result = new TriggerFiredResult(e);
      }

      results.add(result);
    }

    return results;
  }

  private TriggerFiredBundle createTriggerFiredBundle(OperableTrigger trigger)
      throws JobPersistenceException {
    TriggerKey triggerKey = trigger.getKey();
    String triggerId = triggerDao.getTriggerId(triggerKey);
    ODocument triggerDoc = triggerDao.findById(triggerId);
    if (triggerDoc == null
        || !isOwnedBy(triggerDoc, Constants.STATE_ACQUIRED, trigger.getFireInstanceId())) {
      LOG.debug("Trigger {} is no longer acquired by this firing", triggerKey);
      return null;
    }

    String jobId = triggerDoc.field(Constants.TRIGGER_JOB_ID);
    ODocument jobDoc = jobDao.findById(jobId);
    if (jobDoc == null) {
      setErrorState(triggerDoc);
      throw new JobPersistenceException(
          "The job (" + trigger.getJobKey() + ") of trigger " + triggerKey + " does not exist");
    }

    JobDetail job;
    OperableTrigger stored;
    try {
      job = jobConverter.toJobDetail(jobDoc);
      stored = triggerConverter.toTrigger(triggerDoc);
    } catch (JobPersistenceException e) {
      LOG.error("Error retrieving job, setting trigger state to error", e);
      setErrorState(triggerDoc);
      throw e;
    }

    Calendar cal = null;
    String calName = triggerDoc.field(Constants.TRIGGER_CALENDAR_NAME);
    if (calName != null) {
      cal = calendarDao.retrieveCalendar(calName);
      if (cal == null) {
        LOG.warn("Calendar {} of trigger {} does not exist", calName, triggerKey);
        return null;
      }
    }

    boolean nonConcurrent = job.isConcurrentExectionDisallowed();
    String fireInstanceId = trigger.getFireInstanceId();
    if (nonConcurrent && !blockRepository.block(jobId, fireInstanceId)) {
      LOG.debug("Job {} is already running, blocking trigger {}", job.getKey(), triggerKey);
      observer.stepReached(ExecutionStep.BLOCKING, instanceId, triggerKey);
      TriggerStateManager.clearFiring(triggerDoc);
      moveToBlocked(triggerDoc, jobId);
      return null;
    }

    Date prevFireTime = stored.getPreviousFireTime();

    // This updates the next fire time for the trigger.
    stored.triggered(cal);
    trigger.triggered(cal);

    triggerConverter.updateFireTimes(stored, triggerDoc);
    triggerDoc.field(Constants.TRIGGER_STATE, Constants.STATE_EXECUTING);
    if (!connector.saveIfCurrent(triggerDoc)) {
      LOG.debug("Trigger {} was changed by another writer before firing", triggerKey);
      if (nonConcurrent) {
        blockRepository.release(jobId, fireInstanceId);
      }
      return null;
    }

    if (nonConcurrent) {
      stateManager.blockTriggersOfJob(jobId, triggerId);
    }

    job.getJobDataMap().clearDirtyFlag();

    return new TriggerFiredBundle(job, trigger, cal, isRecovering(trigger), clock.now(),
        trigger.getPreviousFireTime(), prevFireTime, trigger.getNextFireTime());
  }

  /**
   * Is a trigger document in a state and carrying a fire instance token?
   */
  static boolean isOwnedBy(ODocument triggerDoc, String state, String fireInstanceId) {
    return fireInstanceId != null
        && state.equals(triggerDoc.field(Constants.TRIGGER_STATE))
        && fireInstanceId.equals(triggerDoc.field(Constants.TRIGGER_FIRE_INSTANCE_ID));
  }

  private boolean isRecovering(OperableTrigger trigger) {
    return Scheduler.DEFAULT_RECOVERY_GROUP.equals(trigger.getKey().getGroup());
  }
}
