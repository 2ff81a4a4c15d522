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

package io.smartspaces.scheduling.quartz.clusterstore.internal.db;

import io.smartspaces.scheduling.quartz.clusterstore.internal.Constants;

import com.orientechnologies.orient.core.db.ODatabaseSession;
import com.orientechnologies.orient.core.metadata.schema.OClass;
import com.orientechnologies.orient.core.metadata.schema.OSchema;
import com.orientechnologies.orient.core.metadata.schema.OType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The classes, properties and indexes the store keeps in OrientDB.
 *
 * <p>
 * All class names carry the collection prefix so several stores can share one
 * database.
 *
 * @author Keith M. Hughes
 */
public class OrientDbSchema {

  private static final Logger LOG = LoggerFactory.getLogger(OrientDbSchema.class);

  /**
   * The prefix for all class names.
   */
  private final String collectionPrefix;

  public OrientDbSchema(String collectionPrefix) {
    this.collectionPrefix = collectionPrefix;
  }

  public String getJobClass() {
    return collectionPrefix + Constants.CLASS_JOB;
  }

  public String getTriggerClass() {
    return collectionPrefix + Constants.CLASS_TRIGGER;
  }

  public String getCalendarClass() {
    return collectionPrefix + Constants.CLASS_CALENDAR;
  }

  public String getBlockedJobClass() {
    return collectionPrefix + Constants.CLASS_BLOCKED_JOB;
  }

  public String getPausedTriggerGroupClass() {
    return collectionPrefix + Constants.CLASS_PAUSED_TRIGGER_GROUP;
  }

  public String getPausedJobGroupClass() {
    return collectionPrefix + Constants.CLASS_PAUSED_JOB_GROUP;
  }

  public String getSchedulerClass() {
    return collectionPrefix + Constants.CLASS_SCHEDULER;
  }

  /**
   * Create any class or index that does not exist yet.
   *
   * <p>
   * Must be called outside of a transaction.
   *
   * @param db
   *          the database session
   */
  public void createIfAbsent(ODatabaseSession db) {
    OSchema schema = db.getMetadata().getSchema();

    OClass jobClass = getOrCreateClass(schema, getJobClass());
    if (jobClass != null) {
      jobClass.createProperty(Constants.KEY_NAME, OType.STRING).setNotNull(true);
      jobClass.createProperty(Constants.KEY_GROUP, OType.STRING).setNotNull(true);
      jobClass.createProperty(Constants.JOB_DESCRIPTION, OType.STRING);
      jobClass.createProperty(Constants.JOB_CLASS, OType.STRING);
      jobClass.createProperty(Constants.JOB_DATA, OType.STRING);
      jobClass.createProperty(Constants.JOB_DURABILITY, OType.BOOLEAN);
      jobClass.createProperty(Constants.JOB_REQUESTS_RECOVERY, OType.BOOLEAN);
      jobClass.createProperty(Constants.JOB_CONCURRENT_EXECUTION_DISALLOWED, OType.BOOLEAN);
      jobClass.createProperty(Constants.JOB_PERSIST_DATA_AFTER_EXECUTION, OType.BOOLEAN);

      jobClass.createIndex(indexName(jobClass, "group"), OClass.INDEX_TYPE.NOTUNIQUE,
          Constants.SCHEDULER_NAME, Constants.KEY_GROUP);
    }

    OClass triggerClass = getOrCreateClass(schema, getTriggerClass());
    if (triggerClass != null) {
      triggerClass.createProperty(Constants.KEY_NAME, OType.STRING).setNotNull(true);
      triggerClass.createProperty(Constants.KEY_GROUP, OType.STRING).setNotNull(true);
      triggerClass.createProperty(Constants.TRIGGER_JOB_ID, OType.STRING).setNotNull(true);
      triggerClass.createProperty(Constants.TRIGGER_JOB_NAME, OType.STRING);
      triggerClass.createProperty(Constants.TRIGGER_JOB_GROUP, OType.STRING);
      triggerClass.createProperty(Constants.TRIGGER_CALENDAR_NAME, OType.STRING);
      triggerClass.createProperty(Constants.TRIGGER_DESCRIPTION, OType.STRING);
      triggerClass.createProperty(Constants.TRIGGER_STATE, OType.STRING);
      triggerClass.createProperty(Constants.TRIGGER_PRIORITY, OType.INTEGER);
      triggerClass.createProperty(Constants.TRIGGER_MISFIRE_INSTRUCTION, OType.INTEGER);
      triggerClass.createProperty(Constants.TRIGGER_NEXT_FIRE_TIME, OType.LONG);
      triggerClass.createProperty(Constants.TRIGGER_PREVIOUS_FIRE_TIME, OType.LONG);
      triggerClass.createProperty(Constants.TRIGGER_START_TIME, OType.LONG);
      triggerClass.createProperty(Constants.TRIGGER_END_TIME, OType.LONG);
      triggerClass.createProperty(Constants.TRIGGER_FIRE_INSTANCE_ID, OType.STRING);
      triggerClass.createProperty(Constants.TRIGGER_INSTANCE_ID, OType.STRING);
      triggerClass.createProperty(Constants.TRIGGER_CLASS, OType.STRING);
      triggerClass.createProperty(Constants.TRIGGER_DATA, OType.BINARY);
      triggerClass.createProperty(Constants.TRIGGER_JOB_DATA, OType.STRING);

      triggerClass.createIndex(indexName(triggerClass, "due"), OClass.INDEX_TYPE.NOTUNIQUE,
          Constants.SCHEDULER_NAME, Constants.TRIGGER_STATE, Constants.TRIGGER_NEXT_FIRE_TIME);
      triggerClass.createIndex(indexName(triggerClass, "job"), OClass.INDEX_TYPE.NOTUNIQUE,
          Constants.TRIGGER_JOB_ID);
      triggerClass.createIndex(indexName(triggerClass, "group"), OClass.INDEX_TYPE.NOTUNIQUE,
          Constants.SCHEDULER_NAME, Constants.KEY_GROUP);
      triggerClass.createIndex(indexName(triggerClass, "calendar"), OClass.INDEX_TYPE.NOTUNIQUE,
          Constants.SCHEDULER_NAME, Constants.TRIGGER_CALENDAR_NAME);
    }

    OClass calendarClass = getOrCreateClass(schema, getCalendarClass());
    if (calendarClass != null) {
      calendarClass.createProperty(Constants.CALENDAR_NAME, OType.STRING).setNotNull(true);
      calendarClass.createProperty(Constants.CALENDAR_CLASS, OType.STRING);
      calendarClass.createProperty(Constants.CALENDAR_SERIALIZED_OBJECT, OType.BINARY);
    }

    OClass blockedJobClass = getOrCreateClass(schema, getBlockedJobClass());
    if (blockedJobClass != null) {
      blockedJobClass.createProperty(Constants.BLOCKED_JOB_ID, OType.STRING).setNotNull(true);
      blockedJobClass.createProperty(Constants.BLOCKED_INSTANCE_ID, OType.STRING);
      blockedJobClass.createProperty(Constants.BLOCKED_FIRE_INSTANCE_ID, OType.STRING);
      blockedJobClass.createProperty(Constants.BLOCKED_TIME, OType.LONG);

      blockedJobClass.createIndex(indexName(blockedJobClass, "holder"),
          OClass.INDEX_TYPE.NOTUNIQUE, Constants.SCHEDULER_NAME, Constants.BLOCKED_INSTANCE_ID);
    }

    OClass pausedTriggerGroupClass = getOrCreateClass(schema, getPausedTriggerGroupClass());
    if (pausedTriggerGroupClass != null) {
      pausedTriggerGroupClass.createProperty(Constants.KEY_GROUP, OType.STRING);
    }

    OClass pausedJobGroupClass = getOrCreateClass(schema, getPausedJobGroupClass());
    if (pausedJobGroupClass != null) {
      pausedJobGroupClass.createProperty(Constants.KEY_GROUP, OType.STRING);
    }

    OClass schedulerClass = getOrCreateClass(schema, getSchedulerClass());
    if (schedulerClass != null) {
      schedulerClass.createProperty(Constants.SCHEDULER_INSTANCE_ID_FIELD, OType.STRING)
          .setNotNull(true);
      schedulerClass.createProperty(Constants.SCHEDULER_LAST_CHECKIN_TIME_FIELD, OType.LONG);
      schedulerClass.createProperty(Constants.SCHEDULER_CHECKIN_INTERVAL_FIELD, OType.LONG);
      schedulerClass.createProperty(Constants.SCHEDULER_STATE_FIELD, OType.STRING);
    }
  }

  /**
   * Create a class with the properties every store class has.
   *
   * @return the new class, or {@code null} if the class already existed
   */
  private OClass getOrCreateClass(OSchema schema, String className) {
    if (schema.existsClass(className)) {
      return null;
    }

    LOG.info("Creating OrientDB class {}", className);
    OClass clazz = schema.createClass(className);
    clazz.createProperty(Constants.DOCUMENT_ID, OType.STRING).setNotNull(true);
    clazz.createProperty(Constants.SCHEDULER_NAME, OType.STRING).setNotNull(true);
    clazz.createIndex(indexName(clazz, "id"), OClass.INDEX_TYPE.UNIQUE, Constants.DOCUMENT_ID);

    return clazz;
  }

  private String indexName(OClass clazz, String suffix) {
    return clazz.getName() + "." + suffix;
  }
}
