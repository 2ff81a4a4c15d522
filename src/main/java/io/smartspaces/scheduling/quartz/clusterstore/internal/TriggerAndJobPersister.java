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

import io.smartspaces.scheduling.quartz.clusterstore.internal.block.BlockRepository;
import io.smartspaces.scheduling.quartz.clusterstore.internal.dao.StandardCalendarDao;
import io.smartspaces.scheduling.quartz.clusterstore.internal.dao.StandardJobDao;
import io.smartspaces.scheduling.quartz.clusterstore.internal.dao.StandardPausedJobGroupsDao;
import io.smartspaces.scheduling.quartz.clusterstore.internal.dao.StandardPausedTriggerGroupsDao;
import io.smartspaces.scheduling.quartz.clusterstore.internal.dao.StandardTriggerDao;
import io.smartspaces.scheduling.quartz.clusterstore.internal.db.OrientDbConnector;
import io.smartspaces.scheduling.quartz.clusterstore.internal.trigger.TriggerConverter;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.Keys;

import com.orientechnologies.orient.core.record.impl.ODocument;
import org.quartz.Calendar;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.JobPersistenceException;
import org.quartz.ObjectAlreadyExistsException;
import org.quartz.Trigger;
import org.quartz.TriggerKey;
import org.quartz.spi.OperableTrigger;
import org.quartz.spi.SchedulerSignaler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stores and removes jobs, triggers and calendars.
 *
 * <p>
 * Most methods are meant to be called inside a transaction.
 */
public class TriggerAndJobPersister {

  private static final Logger LOG = LoggerFactory.getLogger(TriggerAndJobPersister.class);

  private final OrientDbConnector connector;
  private final StandardTriggerDao triggerDao;
  private final StandardJobDao jobDao;
  private final StandardCalendarDao calendarDao;
  private final StandardPausedTriggerGroupsDao pausedTriggerGroupsDao;
  private final StandardPausedJobGroupsDao pausedJobGroupsDao;
  private final BlockRepository blockRepository;
  private final TriggerStateManager stateManager;
  private final TriggerConverter triggerConverter;
  private final SchedulerSignaler signaler;
  private final String schedulerName;
  private final long misfireThreshold;

  public TriggerAndJobPersister(OrientDbConnector connector, StandardTriggerDao triggerDao,
      StandardJobDao jobDao, StandardCalendarDao calendarDao,
      StandardPausedTriggerGroupsDao pausedTriggerGroupsDao,
      StandardPausedJobGroupsDao pausedJobGroupsDao, BlockRepository blockRepository,
      TriggerStateManager stateManager, TriggerConverter triggerConverter,
      SchedulerSignaler signaler, String schedulerName, long misfireThreshold) {
    this.connector = connector;
    this.triggerDao = triggerDao;
    this.jobDao = jobDao;
    this.calendarDao = calendarDao;
    this.pausedTriggerGroupsDao = pausedTriggerGroupsDao;
    this.pausedJobGroupsDao = pausedJobGroupsDao;
    this.blockRepository = blockRepository;
    this.stateManager = stateManager;
    this.triggerConverter = triggerConverter;
    this.signaler = signaler;
    this.schedulerName = schedulerName;
    this.misfireThreshold = misfireThreshold;
  }

  public void storeJob(JobDetail newJob, boolean replaceExisting) throws JobPersistenceException {
    jobDao.storeJob(newJob, replaceExisting);
  }

  public void storeJobAndTrigger(JobDetail newJob, OperableTrigger newTrigger)
      throws JobPersistenceException {
    jobDao.storeJob(newJob, false);
    storeTriggerForJob(newTrigger, jobDao.getJobId(newJob.getKey()), false);
  }

  /**
   * Store several jobs with their triggers. Nothing is stored if any of them
   * exists and is not to be replaced.
   *
   * @param triggersAndJobs
   *          the jobs with their triggers
   * @param replace
   *          {@code true} if existing jobs and triggers are replaced
   *
   * @throws ObjectAlreadyExistsException
   *           a job or trigger exists and is not to be replaced
   * @throws JobPersistenceException
   *           something could not be stored
   */
  public void storeJobsAndTriggers(Map<JobDetail, Set<? extends Trigger>> triggersAndJobs,
      boolean replace) throws JobPersistenceException {
    if (!replace) {
      for (Map.Entry<JobDetail, Set<? extends Trigger>> entry : triggersAndJobs.entrySet()) {
        if (jobDao.exists(entry.getKey().getKey())) {
          throw new ObjectAlreadyExistsException(entry.getKey());
        }
        for (Trigger trigger : entry.getValue()) {
          if (triggerDao.exists(trigger.getKey())) {
            throw new ObjectAlreadyExistsException(trigger);
          }
        }
      }
    }

    for (Map.Entry<JobDetail, Set<? extends Trigger>> entry : triggersAndJobs.entrySet()) {
      jobDao.storeJob(entry.getKey(), true);
      String jobId = jobDao.getJobId(entry.getKey().getKey());
      for (Trigger trigger : entry.getValue()) {
        storeTriggerForJob((OperableTrigger) trigger, jobId, true);
      }
    }
  }

  /**
   * Store a trigger. It starts paused if its group or its job's group is
   * paused, and blocked if its job is running and disallows concurrent
   * execution.
   *
   * @param newTrigger
   *          the trigger
   * @param replaceExisting
   *          {@code true} if an existing trigger with the same key is replaced
   *
   * @throws ObjectAlreadyExistsException
   *           the trigger exists and is not to be replaced
   * @throws JobPersistenceException
   *           the trigger's job does not exist or the trigger could not be
   *           stored
   */
  public void storeTrigger(OperableTrigger newTrigger, boolean replaceExisting)
      throws JobPersistenceException {
    JobKey jobKey = newTrigger.getJobKey();
    if (jobKey == null) {
      throw new JobPersistenceException(
          "Trigger must be associated with a job. Please specify a JobKey.");
    }

    String jobId = jobDao.getJobId(jobKey);
    if (jobDao.findById(jobId) == null) {
      throw new JobPersistenceException(
          "The job (" + jobKey + ") referenced by the trigger does not exist.");
    }

    storeTriggerForJob(newTrigger, jobId, replaceExisting);
  }

  private void storeTriggerForJob(OperableTrigger newTrigger, String jobId,
      boolean replaceExisting) throws JobPersistenceException {
    String triggerId = triggerDao.getTriggerId(newTrigger.getKey());
    ODocument trigger = triggerDao.findById(triggerId);
    if (trigger != null) {
      if (!replaceExisting) {
        throw new ObjectAlreadyExistsException(newTrigger);
      }
    } else {
      trigger = triggerDao.newTriggerDocument();
    }

    triggerConverter.toDocument(newTrigger, triggerId, schedulerName, jobId, trigger);
    trigger.field(Constants.TRIGGER_STATE, stateManager.restingState(trigger));
    TriggerStateManager.clearFiring(trigger);

    triggerDao.save(trigger);
  }

  /**
   * Store a trigger recovering a failed firing, unless it has already been
   * stored.
   *
   * @param recoveryTrigger
   *          the recovery trigger
   *
   * @return {@code true} if the trigger was stored
   *
   * @throws JobPersistenceException
   *           the trigger could not be stored
   */
  public boolean storeRecoveryTrigger(OperableTrigger recoveryTrigger)
      throws JobPersistenceException {
    ODocument trigger = triggerDao.newTriggerDocument();
    triggerConverter.toDocument(recoveryTrigger,
        triggerDao.getTriggerId(recoveryTrigger.getKey()), schedulerName,
        jobDao.getJobId(recoveryTrigger.getJobKey()), trigger);
    trigger.field(Constants.TRIGGER_STATE, stateManager.restingState(trigger));

    return connector.insertIfAbsent(trigger);
  }

  public boolean removeTrigger(TriggerKey triggerKey) {
    ODocument trigger = triggerDao.findTrigger(triggerKey);
    if (trigger == null) {
      return false;
    }

    removeTrigger(trigger);
    return true;
  }

  /**
   * Remove a trigger. If it was the last trigger of a job which is not
   * durable, the job is removed too.
   *
   * @param trigger
   *          the trigger document
   */
  public void removeTrigger(ODocument trigger) {
    String triggerId = trigger.field(Constants.DOCUMENT_ID);
    String jobId = trigger.field(Constants.TRIGGER_JOB_ID);

    triggerDao.remove(trigger);

    ODocument job = jobDao.findById(jobId);
    if (job != null && !JobConverter.isDurable(job)
        && !triggerDao.hasOtherTriggers(jobId, triggerId)) {
      JobKey jobKey = Keys.toJobKey(job);
      LOG.debug("Removing job {} as its last trigger was removed", jobKey);
      jobDao.remove(job);
      signaler.notifySchedulerListenersJobDeleted(jobKey);
    }
  }

  public boolean removeTriggers(List<TriggerKey> triggerKeys) {
    boolean allFound = true;
    for (TriggerKey key : triggerKeys) {
      allFound = removeTrigger(key) && allFound;
    }

    return allFound;
  }

  /**
   * Replace a trigger with a new one for the same job.
   *
   * @param triggerKey
   *          key of the trigger being replaced
   * @param newTrigger
   *          the new trigger
   *
   * @return {@code true} if the old trigger existed
   *
   * @throws JobPersistenceException
   *           the new trigger is for a different job or could not be stored
   */
  public boolean replaceTrigger(TriggerKey triggerKey, OperableTrigger newTrigger)
      throws JobPersistenceException {
    ODocument oldTrigger = triggerDao.findTrigger(triggerKey);
    if (oldTrigger == null) {
      return false;
    }

    String jobId = oldTrigger.field(Constants.TRIGGER_JOB_ID);
    if (newTrigger.getJobKey() == null
        || !jobId.equals(jobDao.getJobId(newTrigger.getJobKey()))) {
      throw new JobPersistenceException(
          "New trigger is not related to the same job as the old trigger.");
    }

    if (triggerKey.equals(newTrigger.getKey())) {
      storeTrigger(newTrigger, true);
    } else {
      // Not removeTrigger(), which would take a non-durable job with it.
      triggerDao.remove(oldTrigger);
      storeTrigger(newTrigger, false);
    }

    return true;
  }

  public boolean removeJob(JobKey jobKey) {
    ODocument job = jobDao.getJob(jobKey);
    if (job == null) {
      return false;
    }

    for (ODocument trigger : triggerDao.findByJobId((String) job.field(Constants.DOCUMENT_ID))) {
      triggerDao.remove(trigger);
    }
    jobDao.remove(job);

    return true;
  }

  public boolean removeJobs(List<JobKey> jobKeys) {
    boolean allFound = true;
    for (JobKey key : jobKeys) {
      allFound = removeJob(key) && allFound;
    }

    return allFound;
  }

  /**
   * Store a calendar, optionally recomputing the fire times of the triggers
   * using it.
   *
   * @param name
   *          name of the calendar
   * @param calendar
   *          the calendar
   * @param replaceExisting
   *          {@code true} if an existing calendar is replaced
   * @param updateTriggers
   *          {@code true} if triggers using the calendar are updated
   *
   * @throws JobPersistenceException
   *           the calendar or the triggers could not be stored
   */
  public void storeCalendar(String name, Calendar calendar, boolean replaceExisting,
      boolean updateTriggers) throws JobPersistenceException {
    calendarDao.store(name, calendar, replaceExisting);

    if (updateTriggers) {
      for (ODocument triggerDoc : triggerDao.findByCalendar(name)) {
        OperableTrigger trigger = triggerConverter.toTrigger(triggerDoc);
        trigger.updateWithNewCalendar(calendar, misfireThreshold);
        triggerConverter.updateFireTimes(trigger, triggerDoc);
        triggerDao.save(triggerDoc);
      }
    }
  }

  public boolean removeCalendar(String name) throws JobPersistenceException {
    if (triggerDao.hasCalendarReferences(name)) {
      throw new JobPersistenceException("Calender cannot be removed if it referenced by a trigger!");
    }

    return calendarDao.remove(name);
  }

  public void clearAllSchedulingData() throws JobPersistenceException {
    triggerDao.removeAll();
    jobDao.removeAll();
    calendarDao.removeAll();
    pausedTriggerGroupsDao.removeAll();
    pausedJobGroupsDao.removeAll();
    blockRepository.releaseAll();
  }
}
