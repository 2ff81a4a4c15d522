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

import io.smartspaces.scheduling.quartz.clusterstore.internal.Constants;
import io.smartspaces.scheduling.quartz.clusterstore.internal.db.OrientDbConnector;
import io.smartspaces.scheduling.quartz.clusterstore.internal.db.OrientDbSchema;
import io.smartspaces.scheduling.quartz.clusterstore.internal.trigger.TriggerConverter;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.Keys;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.QueryHelper;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.QueryHelper.DocumentUpdate;

import com.orientechnologies.orient.core.record.impl.ODocument;
import org.quartz.JobPersistenceException;
import org.quartz.TriggerKey;
import org.quartz.impl.matchers.GroupMatcher;
import org.quartz.impl.matchers.StringMatcher.StringOperatorName;
import org.quartz.spi.OperableTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The DAO for triggers.
 */
public class StandardTriggerDao {

  private static final Logger LOG = LoggerFactory.getLogger(StandardTriggerDao.class);

  private final OrientDbConnector connector;

  private final OrientDbSchema schema;

  private final QueryHelper queryHelper;

  private final TriggerConverter triggerConverter;

  /**
   * The name of the scheduler the triggers belong to.
   */
  private final String schedulerName;

  public StandardTriggerDao(OrientDbConnector connector, OrientDbSchema schema,
      QueryHelper queryHelper, TriggerConverter triggerConverter, String schedulerName) {
    this.connector = connector;
    this.schema = schema;
    this.queryHelper = queryHelper;
    this.triggerConverter = triggerConverter;
    this.schedulerName = schedulerName;
  }

  public String getTriggerId(TriggerKey triggerKey) {
    return Keys.triggerId(schedulerName, triggerKey);
  }

  /**
   * Find a trigger by its trigger key.
   *
   * @param triggerKey
   *          the trigger key
   *
   * @return the trigger for the key, or {@code null} if no such trigger
   */
  public ODocument findTrigger(TriggerKey triggerKey) {
    return findById(getTriggerId(triggerKey));
  }

  public ODocument findById(String triggerId) {
    return queryHelper.findById(schema.getTriggerClass(), triggerId);
  }

  public boolean exists(TriggerKey triggerKey) {
    return findTrigger(triggerKey) != null;
  }

  public OperableTrigger getTrigger(TriggerKey triggerKey) throws JobPersistenceException {
    ODocument doc = findTrigger(triggerKey);
    if (doc != null) {
      return triggerConverter.toTrigger(doc);
    } else {
      return null;
    }
  }

  /**
   * Get the state of a trigger.
   *
   * @param triggerKey
   *          key of the trigger
   *
   * @return the state, or {@code null} if there is no such trigger
   */
  public String getState(TriggerKey triggerKey) {
    ODocument doc = findTrigger(triggerKey);
    if (doc != null) {
      return doc.field(Constants.TRIGGER_STATE);
    } else {
      return null;
    }
  }

  /**
   * Find triggers in a state whose next fire time is no later than a given
   * time, in the order they should fire.
   *
   * @param state
   *          the state of the triggers
   * @param noLaterThan
   *          the latest next fire time, in epoch milliseconds
   * @param limit
   *          the most triggers to return
   *
   * @return the triggers
   */
  public List<ODocument> findEligibleToRun(String state, long noLaterThan, int limit) {
    List<ODocument> result = queryHelper.query("select from " + schema.getTriggerClass()
        + " where " + Constants.SCHEDULER_NAME + " = ? and " + Constants.TRIGGER_STATE
        + " = ? and " + Constants.TRIGGER_NEXT_FIRE_TIME + " <= ? order by "
        + Constants.TRIGGER_NEXT_FIRE_TIME + " asc, " + Constants.TRIGGER_PRIORITY
        + " desc limit " + limit, schedulerName, state, noLaterThan);

    LOG.debug("Found {} triggers which are eligible to be run.", result.size());

    return result;
  }

  /**
   * Find triggers in a state whose next fire time is before a given time.
   *
   * @param state
   *          the state of the triggers
   * @param misfireTime
   *          the time the triggers fire before, in epoch milliseconds
   * @param limit
   *          the most triggers to return, or a negative number for all
   *
   * @return the triggers, earliest first
   */
  public List<ODocument> findMisfired(String state, long misfireTime, int limit) {
    String sql = "select from " + schema.getTriggerClass() + " where "
        + Constants.SCHEDULER_NAME + " = ? and " + Constants.TRIGGER_STATE + " = ? and "
        + Constants.TRIGGER_NEXT_FIRE_TIME + " < ? order by " + Constants.TRIGGER_NEXT_FIRE_TIME
        + " asc, " + Constants.TRIGGER_PRIORITY + " desc";
    if (limit >= 0) {
      sql += " limit " + limit;
    }

    return queryHelper.query(sql, schedulerName, state, misfireTime);
  }

  public List<ODocument> findByState(String state) {
    return queryHelper.query("select from " + schema.getTriggerClass() + " where "
        + Constants.SCHEDULER_NAME + " = ? and " + Constants.TRIGGER_STATE + " = ?",
        schedulerName, state);
  }

  public List<ODocument> findByJobId(String jobId) {
    return queryHelper.query("select from " + schema.getTriggerClass() + " where "
        + Constants.TRIGGER_JOB_ID + " = ?", jobId);
  }

  public List<ODocument> findByGroup(String group) {
    return queryHelper.query("select from " + schema.getTriggerClass() + " where "
        + Constants.SCHEDULER_NAME + " = ? and " + Constants.KEY_GROUP + " = ?", schedulerName,
        group);
  }

  public List<ODocument> findByCalendar(String calendarName) {
    return queryHelper.query("select from " + schema.getTriggerClass() + " where "
        + Constants.SCHEDULER_NAME + " = ? and " + Constants.TRIGGER_CALENDAR_NAME + " = ?",
        schedulerName, calendarName);
  }

  public boolean hasCalendarReferences(String calendarName) {
    return queryHelper.count("select count(*) as count from " + schema.getTriggerClass()
        + " where " + Constants.SCHEDULER_NAME + " = ? and " + Constants.TRIGGER_CALENDAR_NAME
        + " = ?", schedulerName, calendarName) > 0;
  }

  /**
   * Does a job have triggers other than a given one?
   *
   * @param jobId
   *          the document ID of the job
   * @param triggerId
   *          the document ID of the trigger to leave out
   *
   * @return {@code true} if there are other triggers for the job
   */
  public boolean hasOtherTriggers(String jobId, String triggerId) {
    return queryHelper.count("select count(*) as count from " + schema.getTriggerClass()
        + " where " + Constants.TRIGGER_JOB_ID + " = ? and " + Constants.DOCUMENT_ID + " <> ?",
        jobId, triggerId) > 0;
  }

  public List<OperableTrigger> getTriggersForJob(String jobId) throws JobPersistenceException {
    List<OperableTrigger> triggers = new ArrayList<OperableTrigger>();
    for (ODocument item : findByJobId(jobId)) {
      triggers.add(triggerConverter.toTrigger(item));
    }

    return triggers;
  }

  public int getCount() {
    return (int) queryHelper.count("select count(*) as count from " + schema.getTriggerClass()
        + " where " + Constants.SCHEDULER_NAME + " = ?", schedulerName);
  }

  public List<String> getGroupNames() {
    return queryHelper.queryStrings("select distinct " + Constants.KEY_GROUP + " from "
        + schema.getTriggerClass() + " where " + Constants.SCHEDULER_NAME + " = ?",
        Constants.KEY_GROUP, schedulerName);
  }

  /**
   * Get the groups a matcher selects.
   *
   * <p>
   * An equality matcher selects its group whether or not any trigger is in it.
   *
   * @param matcher
   *          the matcher
   *
   * @return the groups
   */
  public Set<String> groupsOfMatching(GroupMatcher<TriggerKey> matcher) {
    if (matcher.getCompareWithOperator() == StringOperatorName.EQUALS) {
      return Collections.singleton(matcher.getCompareToValue());
    }

    return QueryHelper.matchingGroups(getGroupNames(), matcher);
  }

  public Set<TriggerKey> getTriggerKeys(GroupMatcher<TriggerKey> matcher) {
    Set<TriggerKey> keys = new HashSet<TriggerKey>();
    for (String group : groupsOfMatching(matcher)) {
      for (ODocument doc : findByGroup(group)) {
        keys.add(Keys.toTriggerKey(doc));
      }
    }

    return keys;
  }

  public ODocument newTriggerDocument() {
    return new ODocument(schema.getTriggerClass());
  }

  /**
   * Save a trigger document as part of a transaction.
   *
   * @param trigger
   *          the trigger document
   */
  public void save(ODocument trigger) {
    connector.getConnection().save(trigger);
  }

  /**
   * Update a trigger, re-reading it if another writer changed it.
   *
   * @param triggerId
   *          the document ID of the trigger
   * @param update
   *          the update
   *
   * @return {@code true} if the trigger was changed
   *
   * @throws JobPersistenceException
   *           the update kept colliding with other writers
   */
  public boolean update(String triggerId, DocumentUpdate update) throws JobPersistenceException {
    return queryHelper.updateWithRetry(schema.getTriggerClass(), triggerId, update);
  }

  public void remove(ODocument trigger) {
    connector.getConnection().delete(trigger);
  }

  public void removeAll() {
    for (ODocument trigger : queryHelper.query("select from " + schema.getTriggerClass()
        + " where " + Constants.SCHEDULER_NAME + " = ?", schedulerName)) {
      remove(trigger);
    }
  }
}
