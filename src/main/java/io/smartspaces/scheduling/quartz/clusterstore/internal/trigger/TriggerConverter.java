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

package io.smartspaces.scheduling.quartz.clusterstore.internal.trigger;

import io.smartspaces.scheduling.quartz.clusterstore.internal.Constants;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.ODocumentHelper;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.SerialUtils;

import com.orientechnologies.orient.core.record.impl.ODocument;
import org.quartz.JobDataMap;
import org.quartz.JobPersistenceException;
import org.quartz.spi.ClassLoadHelper;
import org.quartz.spi.OperableTrigger;

/**
 * Converts between Quartz triggers and OrientDB documents.
 *
 * <p>
 * The trigger itself is kept as an opaque serialized payload tagged with its
 * class name. The fields used for querying are copied out next to it and the
 * copied fire times win over the ones in the payload when reading back.
 */
public class TriggerConverter {

  private final ClassLoadHelper loadHelper;

  public TriggerConverter(ClassLoadHelper loadHelper) {
    this.loadHelper = loadHelper;
  }

  /**
   * Copy a trigger into a document. The state and firing fields are left
   * alone.
   *
   * @param newTrigger
   *          the trigger
   * @param documentId
   *          the ID of the trigger document
   * @param schedulerName
   *          the scheduler owning the trigger
   * @param jobId
   *          the document ID of the trigger's job
   * @param trigger
   *          the document to write into
   *
   * @throws JobPersistenceException
   *           the trigger could not be serialized
   */
  public void toDocument(OperableTrigger newTrigger, String documentId, String schedulerName,
      String jobId, ODocument trigger) throws JobPersistenceException {
    trigger.field(Constants.DOCUMENT_ID, documentId);
    trigger.field(Constants.SCHEDULER_NAME, schedulerName);
    trigger.field(Constants.KEY_NAME, newTrigger.getKey().getName());
    trigger.field(Constants.KEY_GROUP, newTrigger.getKey().getGroup());
    trigger.field(Constants.TRIGGER_JOB_ID, jobId);
    trigger.field(Constants.TRIGGER_JOB_NAME, newTrigger.getJobKey().getName());
    trigger.field(Constants.TRIGGER_JOB_GROUP, newTrigger.getJobKey().getGroup());
    trigger.field(Constants.TRIGGER_CALENDAR_NAME, newTrigger.getCalendarName());
    trigger.field(Constants.TRIGGER_DESCRIPTION, newTrigger.getDescription());
    trigger.field(Constants.TRIGGER_PRIORITY, newTrigger.getPriority());
    trigger.field(Constants.TRIGGER_MISFIRE_INSTRUCTION, newTrigger.getMisfireInstruction());
    trigger.field(Constants.TRIGGER_CLASS, newTrigger.getClass().getName());
    trigger.field(Constants.TRIGGER_JOB_DATA, SerialUtils.serialize(newTrigger.getJobDataMap()));

    updateFireTimes(newTrigger, trigger);
  }

  /**
   * Copy the times and the payload of a trigger into its document after the
   * trigger has computed new fire times.
   *
   * @param source
   *          the trigger
   * @param trigger
   *          the trigger's document
   *
   * @throws JobPersistenceException
   *           the trigger could not be serialized
   */
  public void updateFireTimes(OperableTrigger source, ODocument trigger)
      throws JobPersistenceException {
    ODocumentHelper.setDateField(trigger, Constants.TRIGGER_NEXT_FIRE_TIME,
        source.getNextFireTime());
    ODocumentHelper.setDateField(trigger, Constants.TRIGGER_PREVIOUS_FIRE_TIME,
        source.getPreviousFireTime());
    ODocumentHelper.setDateField(trigger, Constants.TRIGGER_START_TIME, source.getStartTime());
    ODocumentHelper.setDateField(trigger, Constants.TRIGGER_END_TIME, source.getEndTime());

    OperableTrigger payload = (OperableTrigger) source.clone();
    payload.setJobDataMap(new JobDataMap());
    payload.setFireInstanceId(null);
    trigger.field(Constants.TRIGGER_DATA, SerialUtils.serialize(payload));
  }

  /**
   * Restore a trigger from its document.
   *
   * @param triggerDoc
   *          the trigger document
   *
   * @return the trigger
   *
   * @throws JobPersistenceException
   *           the payload could not be read
   */
  public OperableTrigger toTrigger(ODocument triggerDoc) throws JobPersistenceException {
    byte[] payload = triggerDoc.field(Constants.TRIGGER_DATA);
    OperableTrigger trigger =
        SerialUtils.deserialize(payload, OperableTrigger.class, loadHelper.getClassLoader());

    JobDataMap jobData = new JobDataMap(SerialUtils.deserializeJobData(
        (String) triggerDoc.field(Constants.TRIGGER_JOB_DATA), loadHelper.getClassLoader()));
    jobData.clearDirtyFlag();
    trigger.setJobDataMap(jobData);

    trigger.setNextFireTime(
        ODocumentHelper.getDateField(triggerDoc, Constants.TRIGGER_NEXT_FIRE_TIME));
    trigger.setPreviousFireTime(
        ODocumentHelper.getDateField(triggerDoc, Constants.TRIGGER_PREVIOUS_FIRE_TIME));
    trigger.setFireInstanceId((String) triggerDoc.field(Constants.TRIGGER_FIRE_INSTANCE_ID));

    return trigger;
  }
}
