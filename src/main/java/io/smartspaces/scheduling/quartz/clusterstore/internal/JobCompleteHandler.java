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
import io.smartspaces.scheduling.quartz.clusterstore.internal.block.BlockRepository;
import io.smartspaces.scheduling.quartz.clusterstore.internal.dao.StandardJobDao;
import io.smartspaces.scheduling.quartz.clusterstore.internal.dao.StandardTriggerDao;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.QueryHelper.DocumentUpdate;

import com.orientechnologies.orient.core.record.impl.ODocument;
import org.quartz.JobDetail;
import org.quartz.JobPersistenceException;
import org.quartz.Trigger.CompletedExecutionInstruction;
import org.quartz.spi.OperableTrigger;
import org.quartz.spi.SchedulerSignaler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records the completion of a fired trigger's job.
 *
 * <p>
 * A completion only changes the trigger if the trigger still carries the fire
 * instance token it was fired with. A trigger replaced or recovered while its
 * job ran is left alone.
 */
public class JobCompleteHandler {

  private static final Logger LOG = LoggerFactory.getLogger(JobCompleteHandler.class);

  private final StandardTriggerDao triggerDao;
  private final StandardJobDao jobDao;
  private final TriggerAndJobPersister persister;
  private final TriggerStateManager stateManager;
  private final BlockRepository blockRepository;
  private final SchedulerSignaler signaler;
  private final ExecutionStepObserver observer;
  private final String instanceId;

  public JobCompleteHandler(StandardTriggerDao triggerDao, StandardJobDao jobDao,
      TriggerAndJobPersister persister, TriggerStateManager stateManager,
      BlockRepository blockRepository, SchedulerSignaler signaler,
      ExecutionStepObserver observer, String instanceId) {
    this.triggerDao = triggerDao;
    this.jobDao = jobDao;
    this.persister = persister;
    this.stateManager = stateManager;
    this.blockRepository = blockRepository;
    this.signaler = signaler;
    this.observer = observer;
    this.instanceId = instanceId;
  }

  public void jobComplete(OperableTrigger trigger, JobDetail job,
      CompletedExecutionInstruction executionInstruction) throws JobPersistenceException {
    LOG.debug("Trigger completed {}", trigger.getKey());
    observer.stepReached(ExecutionStep.COMPLETING, instanceId, trigger.getKey());

    try {
      if (job.isPersistJobDataAfterExecution() && job.getJobDataMap().isDirty()) {
        LOG.debug("Job data map dirty, will store {}", job.getKey());
        jobDao.storeJobData(job.getKey(), job.getJobDataMap());
      }

      if (job.isConcurrentExectionDisallowed()) {
        String jobId = jobDao.getJobId(job.getKey());
        if (blockRepository.release(jobId, trigger.getFireInstanceId())) {
          stateManager.unblockTriggersOfJob(jobId);
          signaler.signalSchedulingChange(0L);
        } else {
          LOG.debug("Block of job {} not held by fire instance {}", job.getKey(),
              trigger.getFireInstanceId());
        }
      }

      processCompletedTrigger(trigger, executionInstruction);
    } finally {
      observer.stepReached(ExecutionStep.COMPLETED, instanceId, trigger.getKey());
    }
  }

  private void processCompletedTrigger(OperableTrigger trigger,
      CompletedExecutionInstruction executionInstruction) throws JobPersistenceException {
    String triggerId = triggerDao.getTriggerId(trigger.getKey());
    ODocument triggerDoc = triggerDao.findById(triggerId);
    if (triggerDoc == null || !isSameFiring(triggerDoc, trigger.getFireInstanceId())) {
      // Deleted, replaced or recovered during execution.
      LOG.debug("Trigger {} was changed during execution, completion not applied",
          trigger.getKey());
      return;
    }

    if (executionInstruction == null) {
      executionInstruction = CompletedExecutionInstruction.NOOP;
    }

    switch (executionInstruction) {
      case DELETE_TRIGGER:
        if (trigger.getNextFireTime() == null
            && triggerDoc.field(Constants.TRIGGER_NEXT_FIRE_TIME) != null) {
          // Rescheduled during execution, which cancels the need to delete.
          completeNormally(triggerId, trigger.getFireInstanceId());
        } else {
          persister.removeTrigger(triggerDoc);
          signaler.signalSchedulingChange(0L);
        }
        break;
      case SET_TRIGGER_COMPLETE:
        setFinalState(triggerId, trigger.getFireInstanceId(), Constants.STATE_COMPLETE);
        signaler.signalSchedulingChange(0L);
        break;
      case SET_TRIGGER_ERROR:
        LOG.info("Trigger {} set to error state.", trigger.getKey());
        setFinalState(triggerId, trigger.getFireInstanceId(), Constants.STATE_ERROR);
        signaler.signalSchedulingChange(0L);
        break;
      case SET_ALL_JOB_TRIGGERS_COMPLETE:
        setStateOfJobTriggers((String) triggerDoc.field(Constants.TRIGGER_JOB_ID),
            Constants.STATE_COMPLETE);
        signaler.signalSchedulingChange(0L);
        break;
      case SET_ALL_JOB_TRIGGERS_ERROR:
        LOG.info("All triggers of job {} set to error state.", trigger.getJobKey());
        setStateOfJobTriggers((String) triggerDoc.field(Constants.TRIGGER_JOB_ID),
            Constants.STATE_ERROR);
        signaler.signalSchedulingChange(0L);
        break;
      default:
        completeNormally(triggerId, trigger.getFireInstanceId());
        break;
    }
  }

  private void completeNormally(String triggerId, final String fireInstanceId)
      throws JobPersistenceException {
    triggerDao.update(triggerId, new DocumentUpdate() {
      @Override
      public boolean apply(ODocument document) throws JobPersistenceException {
        if (!isSameFiring(document, fireInstanceId)) {
          return false;
        }

        // A trigger paused while executing stays paused.
        String state = document.field(Constants.TRIGGER_STATE);
        if (!Constants.STATE_PAUSED.equals(state)) {
          if (document.field(Constants.TRIGGER_NEXT_FIRE_TIME) == null) {
            document.field(Constants.TRIGGER_STATE, Constants.STATE_COMPLETE);
          } else {
            document.field(Constants.TRIGGER_STATE, stateManager.restingState(document));
          }
        }
        TriggerStateManager.clearFiring(document);
        return true;
      }
    });
  }

  private void setFinalState(String triggerId, final String fireInstanceId, final String state)
      throws JobPersistenceException {
    triggerDao.update(triggerId, new DocumentUpdate() {
      @Override
      public boolean apply(ODocument document) {
        if (!isSameFiring(document, fireInstanceId)) {
          return false;
        }

        document.field(Constants.TRIGGER_STATE, state);
        TriggerStateManager.clearFiring(document);
        return true;
      }
    });
  }

  private void setStateOfJobTriggers(String jobId, final String state)
      throws JobPersistenceException {
    for (ODocument trigger : triggerDao.findByJobId(jobId)) {
      triggerDao.update((String) trigger.field(Constants.DOCUMENT_ID), new DocumentUpdate() {
        @Override
        public boolean apply(ODocument document) {
          document.field(Constants.TRIGGER_STATE, state);
          TriggerStateManager.clearFiring(document);
          return true;
        }
      });
    }
  }

  private static boolean isSameFiring(ODocument triggerDoc, String fireInstanceId) {
    return fireInstanceId != null
        && fireInstanceId.equals(triggerDoc.field(Constants.TRIGGER_FIRE_INSTANCE_ID));
  }
}
