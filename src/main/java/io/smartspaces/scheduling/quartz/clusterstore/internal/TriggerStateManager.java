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
import io.smartspaces.scheduling.quartz.clusterstore.internal.dao.StandardJobDao;
import io.smartspaces.scheduling.quartz.clusterstore.internal.dao.StandardPausedJobGroupsDao;
import io.smartspaces.scheduling.quartz.clusterstore.internal.dao.StandardPausedTriggerGroupsDao;
import io.smartspaces.scheduling.quartz.clusterstore.internal.dao.StandardTriggerDao;
import io.smartspaces.scheduling.quartz.clusterstore.internal.trigger.MisfireHandler;
import io.smartspaces.scheduling.quartz.clusterstore.internal.trigger.TriggerConverter;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.QueryHelper.DocumentUpdate;

import com.orientechnologies.orient.core.record.impl.ODocument;
import org.quartz.JobKey;
import org.quartz.JobPersistenceException;
import org.quartz.Trigger.TriggerState;
import org.quartz.TriggerKey;
import org.quartz.impl.matchers.GroupMatcher;
import org.quartz.spi.OperableTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Moves triggers between states for pausing, resuming and blocking.
 *
 * <p>
 * Every change is made on a single trigger document, re-reading it if another
 * writer changed it in between.
 */
public class TriggerStateManager {

  private static final Logger LOG = LoggerFactory.getLogger(TriggerStateManager.class);

  private final StandardTriggerDao triggerDao;
  private final StandardJobDao jobDao;
  private final StandardPausedTriggerGroupsDao pausedTriggerGroupsDao;
  private final StandardPausedJobGroupsDao pausedJobGroupsDao;
  private final BlockRepository blockRepository;
  private final MisfireHandler misfireHandler;
  private final TriggerConverter triggerConverter;

  public TriggerStateManager(StandardTriggerDao triggerDao, StandardJobDao jobDao,
      StandardPausedTriggerGroupsDao pausedTriggerGroupsDao,
      StandardPausedJobGroupsDao pausedJobGroupsDao, BlockRepository blockRepository,
      MisfireHandler misfireHandler, TriggerConverter triggerConverter) {
    this.triggerDao = triggerDao;
    this.jobDao = jobDao;
    this.pausedTriggerGroupsDao = pausedTriggerGroupsDao;
    this.pausedJobGroupsDao = pausedJobGroupsDao;
    this.blockRepository = blockRepository;
    this.misfireHandler = misfireHandler;
    this.triggerConverter = triggerConverter;
  }

  /**
   * Get the state a trigger rests in when nobody is firing it.
   *
   * @param triggerDoc
   *          the trigger document
   *
   * @return one of waiting, blocked, paused or pausedBlocked
   *
   * @throws JobPersistenceException
   *           the blocks could not be read
   */
  public String restingState(ODocument triggerDoc) throws JobPersistenceException {
    boolean paused = isPaused((String) triggerDoc.field(Constants.KEY_GROUP),
        (String) triggerDoc.field(Constants.TRIGGER_JOB_GROUP));
    boolean blocked = blockRepository.isBlocked((String) triggerDoc.field(Constants.TRIGGER_JOB_ID));

    if (paused) {
      return blocked ? Constants.STATE_PAUSED_BLOCKED : Constants.STATE_PAUSED;
    } else {
      return blocked ? Constants.STATE_BLOCKED : Constants.STATE_WAITING;
    }
  }

  /**
   * Is a trigger in a paused group?
   *
   * @param triggerGroup
   *          the group of the trigger
   * @param jobGroup
   *          the group of the trigger's job
   *
   * @return {@code true} if either group is paused, or all groups are
   */
  public boolean isPaused(String triggerGroup, String jobGroup) {
    return pausedTriggerGroupsDao.isPaused(triggerGroup)
        || pausedTriggerGroupsDao.isPaused(Constants.ALL_GROUPS_PAUSED)
        || pausedJobGroupsDao.isPaused(jobGroup);
  }

  /**
   * Get the trigger groups which are paused, including the marker for all
   * groups.
   */
  public Set<String> getPausedTriggerGroupMarkers() {
    return pausedTriggerGroupsDao.getPausedGroups();
  }

  public Set<String> getPausedJobGroups() {
    return pausedJobGroupsDao.getPausedGroups();
  }

  public Set<String> getPausedTriggerGroups() {
    Set<String> groups = new HashSet<String>(pausedTriggerGroupsDao.getPausedGroups());
    groups.remove(Constants.ALL_GROUPS_PAUSED);
    return groups;
  }

  public boolean isTriggerGroupPaused(String group) {
    return pausedTriggerGroupsDao.isPaused(group);
  }

  public boolean isJobGroupPaused(String group) {
    return pausedJobGroupsDao.isPaused(group);
  }

  public TriggerState getTriggerState(TriggerKey triggerKey) {
    String state = triggerDao.getState(triggerKey);
    if (state == null) {
      return TriggerState.NONE;
    }

    switch (state) {
      case Constants.STATE_WAITING:
      case Constants.STATE_ACQUIRED:
      case Constants.STATE_EXECUTING:
        return TriggerState.NORMAL;
      case Constants.STATE_BLOCKED:
        return TriggerState.BLOCKED;
      case Constants.STATE_PAUSED:
      case Constants.STATE_PAUSED_BLOCKED:
        return TriggerState.PAUSED;
      case Constants.STATE_COMPLETE:
        return TriggerState.COMPLETE;
      case Constants.STATE_ERROR:
        return TriggerState.ERROR;
      default:
        LOG.warn("Trigger {} has unknown state {}", triggerKey, state);
        return TriggerState.NONE;
    }
  }

  public void pauseTrigger(TriggerKey triggerKey) throws JobPersistenceException {
    pauseTriggerById(triggerDao.getTriggerId(triggerKey));
  }

  /**
   * Pause all triggers in the groups a matcher selects. Triggers added to the
   * groups later start paused.
   *
   * @param matcher
   *          the matcher for the groups
   *
   * @return the groups paused
   *
   * @throws JobPersistenceException
   *           the triggers could not be paused
   */
  public Collection<String> pauseTriggers(GroupMatcher<TriggerKey> matcher)
      throws JobPersistenceException {
    Set<String> groups = triggerDao.groupsOfMatching(matcher);
    pausedTriggerGroupsDao.pauseGroups(groups);

    for (String group : groups) {
      pauseTriggerDocuments(triggerDao.findByGroup(group));
    }

    return groups;
  }

  public void pauseJob(JobKey jobKey) throws JobPersistenceException {
    pauseTriggerDocuments(triggerDao.findByJobId(jobDao.getJobId(jobKey)));
  }

  public Collection<String> pauseJobs(GroupMatcher<JobKey> matcher)
      throws JobPersistenceException {
    Set<String> groups = jobDao.groupsOfMatching(matcher);
    pausedJobGroupsDao.pauseGroups(groups);

    for (String group : groups) {
      for (ODocument job : jobDao.findByGroup(group)) {
        pauseTriggerDocuments(
            triggerDao.findByJobId((String) job.field(Constants.DOCUMENT_ID)));
      }
    }

    return groups;
  }

  public void pauseAll() throws JobPersistenceException {
    List<String> groups = triggerDao.getGroupNames();
    List<String> markers = new ArrayList<String>(groups);
    markers.add(Constants.ALL_GROUPS_PAUSED);
    pausedTriggerGroupsDao.pauseGroups(markers);

    for (String group : groups) {
      pauseTriggerDocuments(triggerDao.findByGroup(group));
    }
  }

  /**
   * Resume a trigger. Any misfire is corrected right away.
   *
   * @param triggerKey
   *          key of the trigger
   *
   * @throws JobPersistenceException
   *           the trigger could not be resumed
   */
  public void resumeTrigger(TriggerKey triggerKey) throws JobPersistenceException {
    resumeTriggerById(triggerDao.getTriggerId(triggerKey));
  }

  public Collection<String> resumeTriggers(GroupMatcher<TriggerKey> matcher)
      throws JobPersistenceException {
    Set<String> groups = triggerDao.groupsOfMatching(matcher);
    pausedTriggerGroupsDao.unpauseGroups(groups);

    for (String group : groups) {
      resumeTriggerDocuments(triggerDao.findByGroup(group));
    }

    return groups;
  }

  public void resumeJob(JobKey jobKey) throws JobPersistenceException {
    resumeTriggerDocuments(triggerDao.findByJobId(jobDao.getJobId(jobKey)));
  }

  public Collection<String> resumeJobs(GroupMatcher<JobKey> matcher)
      throws JobPersistenceException {
    Set<String> groups = jobDao.groupsOfMatching(matcher);
    pausedJobGroupsDao.unpauseGroups(groups);

    for (String group : groups) {
      for (ODocument job : jobDao.findByGroup(group)) {
        resumeTriggerDocuments(
            triggerDao.findByJobId((String) job.field(Constants.DOCUMENT_ID)));
      }
    }

    return groups;
  }

  public void resumeAll() throws JobPersistenceException {
    pausedTriggerGroupsDao.removeAll();
    pausedJobGroupsDao.removeAll();

    for (String group : triggerDao.getGroupNames()) {
      resumeTriggerDocuments(triggerDao.findByGroup(group));
    }
  }

  /**
   * Take a trigger out of the error state.
   *
   * @param triggerKey
   *          key of the trigger
   *
   * @throws JobPersistenceException
   *           the trigger could not be updated
   */
  public void resetTriggerFromErrorState(TriggerKey triggerKey) throws JobPersistenceException {
    boolean reset = triggerDao.update(triggerDao.getTriggerId(triggerKey), new DocumentUpdate() {
      @Override
      public boolean apply(ODocument trigger) throws JobPersistenceException {
        if (!Constants.STATE_ERROR.equals(trigger.field(Constants.TRIGGER_STATE))) {
          return false;
        }

        trigger.field(Constants.TRIGGER_STATE, restingState(trigger));
        return true;
      }
    });

    LOG.debug("Reset of trigger {} from error state: {}", triggerKey, reset);
  }

  /**
   * Block the other triggers of a job which has started running.
   *
   * @param jobId
   *          document ID of the job
   * @param excludeTriggerId
   *          document ID of the trigger which is firing
   *
   * @throws JobPersistenceException
   *           the triggers could not be updated
   */
  public void blockTriggersOfJob(String jobId, String excludeTriggerId)
      throws JobPersistenceException {
    for (ODocument trigger : triggerDao.findByJobId(jobId)) {
      String triggerId = trigger.field(Constants.DOCUMENT_ID);
      if (!triggerId.equals(excludeTriggerId)) {
        triggerDao.update(triggerId, new DocumentUpdate() {
          @Override
          public boolean apply(ODocument document) {
            return changeState(document, Constants.STATE_WAITING, Constants.STATE_BLOCKED)
                || changeState(document, Constants.STATE_PAUSED, Constants.STATE_PAUSED_BLOCKED);
          }
        });
      }
    }
  }

  /**
   * Unblock the triggers of a job unless the job has been blocked again.
   *
   * @param jobId
   *          document ID of the job
   *
   * @throws JobPersistenceException
   *           the triggers could not be updated
   */
  public void unblockTriggersOfJob(String jobId) throws JobPersistenceException {
    if (blockRepository.isBlocked(jobId)) {
      LOG.debug("Job {} was blocked again, its triggers stay blocked", jobId);
      return;
    }

    unblockTriggerDocuments(triggerDao.findByJobId(jobId));
  }

  /**
   * Unblock every blocked trigger. Only safe when no job can be running.
   *
   * @throws JobPersistenceException
   *           the triggers could not be updated
   */
  public void unblockAll() throws JobPersistenceException {
    unblockTriggerDocuments(triggerDao.findByState(Constants.STATE_BLOCKED));
    unblockTriggerDocuments(triggerDao.findByState(Constants.STATE_PAUSED_BLOCKED));
  }

  private void unblockTriggerDocuments(List<ODocument> triggers) throws JobPersistenceException {
    for (ODocument trigger : triggers) {
      triggerDao.update((String) trigger.field(Constants.DOCUMENT_ID), new DocumentUpdate() {
        @Override
        public boolean apply(ODocument document) {
          return changeState(document, Constants.STATE_BLOCKED, Constants.STATE_WAITING)
              || changeState(document, Constants.STATE_PAUSED_BLOCKED, Constants.STATE_PAUSED);
        }
      });
    }
  }

  private void pauseTriggerDocuments(List<ODocument> triggers) throws JobPersistenceException {
    for (ODocument trigger : triggers) {
      pauseTriggerById((String) trigger.field(Constants.DOCUMENT_ID));
    }
  }

  private void pauseTriggerById(String triggerId) throws JobPersistenceException {
    triggerDao.update(triggerId, new DocumentUpdate() {
      @Override
      public boolean apply(ODocument trigger) {
        String state = trigger.field(Constants.TRIGGER_STATE);
        if (Constants.STATE_WAITING.equals(state) || Constants.STATE_ACQUIRED.equals(state)) {
          trigger.field(Constants.TRIGGER_STATE, Constants.STATE_PAUSED);
          clearFiring(trigger);
          return true;
        } else if (Constants.STATE_EXECUTING.equals(state)) {
          // The token stays so completion of the running job leaves it paused.
          trigger.field(Constants.TRIGGER_STATE, Constants.STATE_PAUSED);
          return true;
        } else {
          return changeState(trigger, Constants.STATE_BLOCKED, Constants.STATE_PAUSED_BLOCKED);
        }
      }
    });
  }

  private void resumeTriggerDocuments(List<ODocument> triggers) throws JobPersistenceException {
    for (ODocument trigger : triggers) {
      resumeTriggerById((String) trigger.field(Constants.DOCUMENT_ID));
    }
  }

  private void resumeTriggerById(String triggerId) throws JobPersistenceException {
    boolean resumed = triggerDao.update(triggerId, new DocumentUpdate() {
      @Override
      public boolean apply(ODocument trigger) throws JobPersistenceException {
        String state = trigger.field(Constants.TRIGGER_STATE);
        if (!Constants.STATE_PAUSED.equals(state)
            && !Constants.STATE_PAUSED_BLOCKED.equals(state)) {
          return false;
        }

        if (trigger.field(Constants.TRIGGER_NEXT_FIRE_TIME) == null) {
          trigger.field(Constants.TRIGGER_STATE, Constants.STATE_COMPLETE);
        } else if (blockRepository.isBlocked((String) trigger.field(Constants.TRIGGER_JOB_ID))) {
          trigger.field(Constants.TRIGGER_STATE, Constants.STATE_BLOCKED);
        } else {
          trigger.field(Constants.TRIGGER_STATE, Constants.STATE_WAITING);
        }
        clearFiring(trigger);
        return true;
      }
    });

    if (resumed) {
      correctMisfireOnResume(triggerId);
    }
  }

  private void correctMisfireOnResume(String triggerId) throws JobPersistenceException {
    ODocument triggerDoc = triggerDao.findById(triggerId);
    if (triggerDoc == null) {
      return;
    }

    String state = triggerDoc.field(Constants.TRIGGER_STATE);
    if (Constants.STATE_WAITING.equals(state) || Constants.STATE_BLOCKED.equals(state)) {
      OperableTrigger trigger = triggerConverter.toTrigger(triggerDoc);
      MisfireHandler.MisfireOutcome outcome =
          misfireHandler.correctMisfire(triggerDoc, trigger, null);
      LOG.debug("Misfire check on resume of {}: {}", trigger.getKey(), outcome);
    }
  }

  private static boolean changeState(ODocument trigger, String from, String to) {
    if (from.equals(trigger.field(Constants.TRIGGER_STATE))) {
      trigger.field(Constants.TRIGGER_STATE, to);
      return true;
    }

    return false;
  }

  /**
   * Clear the fields recording who is firing a trigger.
   *
   * @param trigger
   *          the trigger document
   */
  public static void clearFiring(ODocument trigger) {
    trigger.field(Constants.TRIGGER_FIRE_INSTANCE_ID, (Object) null);
    trigger.field(Constants.TRIGGER_INSTANCE_ID, (Object) null);
  }
}
