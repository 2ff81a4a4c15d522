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
import io.smartspaces.scheduling.quartz.clusterstore.internal.cluster.SchedulerInstance;
import io.smartspaces.scheduling.quartz.clusterstore.internal.cluster.SchedulerInstanceState;
import io.smartspaces.scheduling.quartz.clusterstore.internal.db.OrientDbConnector;
import io.smartspaces.scheduling.quartz.clusterstore.internal.db.OrientDbSchema;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.Keys;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.QueryHelper;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.QueryHelper.DocumentUpdate;

import com.orientechnologies.orient.core.record.impl.ODocument;
import org.quartz.JobPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

public class StandardSchedulerDao {

  private static final Logger log = LoggerFactory.getLogger(StandardSchedulerDao.class);

  private final OrientDbConnector connector;

  private final OrientDbSchema schema;

  private final QueryHelper queryHelper;

  private final String schedulerName;

  public StandardSchedulerDao(OrientDbConnector connector, OrientDbSchema schema,
      QueryHelper queryHelper, String schedulerName) {
    this.connector = connector;
    this.schema = schema;
    this.queryHelper = queryHelper;
    this.schedulerName = schedulerName;
  }

  /**
   * Checks-in in cluster to inform other nodes that its alive.
   *
   * @param instanceId
   *          ID of the instance checking in
   * @param lastCheckinTime
   *          the time of the check-in
   * @param checkinInterval
   *          how often the instance checks in
   * @param state
   *          the lifecycle state of the instance
   *
   * @throws JobPersistenceException
   *           the check-in could not be saved
   */
  public void checkIn(final String instanceId, final long lastCheckinTime,
      final long checkinInterval, final SchedulerInstanceState state)
      throws JobPersistenceException {
    log.debug("Saving node data: name='{}', id='{}', checkin time={}, interval={}", schedulerName,
        instanceId, lastCheckinTime, checkinInterval);

    DocumentUpdate update = new DocumentUpdate() {
      @Override
      public boolean apply(ODocument scheduler) {
        scheduler.field(Constants.SCHEDULER_LAST_CHECKIN_TIME_FIELD, lastCheckinTime);
        scheduler.field(Constants.SCHEDULER_CHECKIN_INTERVAL_FIELD, checkinInterval);
        scheduler.field(Constants.SCHEDULER_STATE_FIELD, state.name());
        return true;
      }
    };

    String documentId = Keys.schedulerId(schedulerName, instanceId);
    if (queryHelper.updateWithRetry(schema.getSchedulerClass(), documentId, update)) {
      return;
    }

    ODocument scheduler = new ODocument(schema.getSchedulerClass());
    scheduler.field(Constants.DOCUMENT_ID, documentId);
    scheduler.field(Constants.SCHEDULER_NAME, schedulerName);
    scheduler.field(Constants.SCHEDULER_INSTANCE_ID_FIELD, instanceId);
    update.apply(scheduler);
    if (!connector.insertIfAbsent(scheduler)) {
      queryHelper.updateWithRetry(schema.getSchedulerClass(), documentId, update);
    }
  }

  /**
   * Change the lifecycle state recorded for an instance.
   *
   * @param instanceId
   *          ID of the instance
   * @param state
   *          the new state
   *
   * @return {@code true} if the instance has a record
   *
   * @throws JobPersistenceException
   *           the state could not be saved
   */
  public boolean setState(String instanceId, final SchedulerInstanceState state)
      throws JobPersistenceException {
    return queryHelper.updateWithRetry(schema.getSchedulerClass(),
        Keys.schedulerId(schedulerName, instanceId), new DocumentUpdate() {
          @Override
          public boolean apply(ODocument scheduler) {
            scheduler.field(Constants.SCHEDULER_STATE_FIELD, state.name());
            return true;
          }
        });
  }

  /**
   * @return Scheduler or null when not found
   */
  public SchedulerInstance findInstance(String instanceId) {
    log.debug("Finding scheduler instance: {}", instanceId);
    ODocument doc =
        queryHelper.findById(schema.getSchedulerClass(), Keys.schedulerId(schedulerName, instanceId));
    if (doc != null) {
      return toSchedulerInstance(doc);
    }

    log.debug("Scheduler instance '{}' not found.", instanceId);
    return null;
  }

  /**
   * Return all scheduler instances in ascending order by last check-in time.
   *
   * @return scheduler instances ordered by last check-in time
   */
  public List<SchedulerInstance> getAllByCheckinTime() {
    List<SchedulerInstance> schedulers = new ArrayList<SchedulerInstance>();
    for (ODocument doc : queryHelper.query("select from " + schema.getSchedulerClass()
        + " where " + Constants.SCHEDULER_NAME + " = ? order by "
        + Constants.SCHEDULER_LAST_CHECKIN_TIME_FIELD + " asc", schedulerName)) {
      schedulers.add(toSchedulerInstance(doc));
    }

    return schedulers;
  }

  /**
   * Remove selected scheduler instance entry from database.
   *
   * <p>
   * If the last check-in time is different, then it is not removed, for it
   * might have gotten back to live.
   *
   * @param instanceId
   *          instance id
   * @param lastCheckinTime
   *          last time scheduler has checked in
   *
   * @return when removed successfully
   */
  public boolean remove(String instanceId, long lastCheckinTime) {
    log.debug("Removing scheduler: {},{},{}", schedulerName, instanceId, lastCheckinTime);

    ODocument doc =
        queryHelper.findById(schema.getSchedulerClass(), Keys.schedulerId(schedulerName, instanceId));
    if (doc == null) {
      return false;
    }

    SchedulerInstance instance = toSchedulerInstance(doc);
    if (instance.getLastCheckinTime() != lastCheckinTime) {
      log.debug("Scheduler {} checked in again, not removed", instanceId);
      return false;
    }

    return connector.deleteIfCurrent(doc);
  }

  private SchedulerInstance toSchedulerInstance(ODocument doc) {
    Number lastCheckinTime = doc.field(Constants.SCHEDULER_LAST_CHECKIN_TIME_FIELD);
    Number checkinInterval = doc.field(Constants.SCHEDULER_CHECKIN_INTERVAL_FIELD);
    return new SchedulerInstance((String) doc.field(Constants.SCHEDULER_INSTANCE_ID_FIELD),
        lastCheckinTime != null ? lastCheckinTime.longValue() : 0L,
        checkinInterval != null ? checkinInterval.longValue() : 0L,
        SchedulerInstanceState.fromString((String) doc.field(Constants.SCHEDULER_STATE_FIELD)));
  }
}
