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
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.Keys;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.QueryHelper;

import com.orientechnologies.orient.core.record.impl.ODocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * The DAO for jobs which are blocked because they are running somewhere in the
 * cluster and do not allow concurrent execution.
 */
public class StandardBlockedJobDao {

  private static final Logger LOG = LoggerFactory.getLogger(StandardBlockedJobDao.class);

  private final OrientDbConnector connector;

  private final OrientDbSchema schema;

  private final QueryHelper queryHelper;

  private final String schedulerName;

  public StandardBlockedJobDao(OrientDbConnector connector, OrientDbSchema schema,
      QueryHelper queryHelper, String schedulerName) {
    this.connector = connector;
    this.schema = schema;
    this.queryHelper = queryHelper;
    this.schedulerName = schedulerName;
  }

  /**
   * Record a job as blocked.
   *
   * @param jobId
   *          the document ID of the job
   * @param instanceId
   *          the instance holding the block
   * @param fireInstanceId
   *          the fire instance token of the firing holding the block
   * @param blockedTime
   *          when the block was taken
   *
   * @return {@code true} if the block was created, {@code false} if the job
   *         was already blocked
   */
  public boolean insert(String jobId, String instanceId, String fireInstanceId,
      long blockedTime) {
    ODocument blocked = new ODocument(schema.getBlockedJobClass());
    blocked.field(Constants.DOCUMENT_ID, Keys.blockedJobId(schedulerName, jobId));
    blocked.field(Constants.SCHEDULER_NAME, schedulerName);
    blocked.field(Constants.BLOCKED_JOB_ID, jobId);
    blocked.field(Constants.BLOCKED_INSTANCE_ID, instanceId);
    blocked.field(Constants.BLOCKED_FIRE_INSTANCE_ID, fireInstanceId);
    blocked.field(Constants.BLOCKED_TIME, blockedTime);

    boolean inserted = connector.insertIfAbsent(blocked);
    LOG.debug("Block of job {} by {}: {}", jobId, instanceId, inserted ? "taken" : "already held");
    return inserted;
  }

  /**
   * Remove the block on a job if a field of the block has a given value.
   *
   * @param jobId
   *          the document ID of the job
   * @param holderField
   *          the field naming the holder, either the instance or the fire
   *          instance token
   * @param holder
   *          the holder the block must have
   *
   * @return {@code true} if this call removed the block
   */
  public boolean removeIfHeldBy(String jobId, String holderField, String holder) {
    ODocument blocked = findByJobId(jobId);
    if (blocked == null) {
      return false;
    }

    if (holder == null || !holder.equals(blocked.field(holderField))) {
      LOG.debug("Block of job {} is not held by {}, left in place", jobId, holder);
      return false;
    }

    return connector.deleteIfCurrent(blocked);
  }

  public boolean exists(String jobId) {
    return findByJobId(jobId) != null;
  }

  public Set<String> getBlockedJobIds() {
    return new HashSet<String>(queryHelper.queryStrings("select " + Constants.BLOCKED_JOB_ID
        + " from " + schema.getBlockedJobClass() + " where " + Constants.SCHEDULER_NAME + " = ?",
        Constants.BLOCKED_JOB_ID, schedulerName));
  }

  /**
   * Get the instance holding each block.
   *
   * @return map of job document ID to the ID of the instance holding its block
   */
  public Map<String, String> getBlockHolders() {
    Map<String, String> holders = new HashMap<String, String>();
    for (ODocument blocked : queryHelper.query("select from " + schema.getBlockedJobClass()
        + " where " + Constants.SCHEDULER_NAME + " = ?", schedulerName)) {
      holders.put((String) blocked.field(Constants.BLOCKED_JOB_ID),
          (String) blocked.field(Constants.BLOCKED_INSTANCE_ID));
    }

    return holders;
  }

  public void removeAll() {
    for (ODocument blocked : queryHelper.query("select from " + schema.getBlockedJobClass()
        + " where " + Constants.SCHEDULER_NAME + " = ?", schedulerName)) {
      connector.deleteIfCurrent(blocked);
    }
  }

  private ODocument findByJobId(String jobId) {
    return queryHelper.findById(schema.getBlockedJobClass(),
        Keys.blockedJobId(schedulerName, jobId));
  }
}
