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
import io.smartspaces.scheduling.quartz.clusterstore.internal.JobConverter;
import io.smartspaces.scheduling.quartz.clusterstore.internal.db.OrientDbConnector;
import io.smartspaces.scheduling.quartz.clusterstore.internal.db.OrientDbSchema;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.Keys;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.QueryHelper;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.QueryHelper.DocumentUpdate;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.SerialUtils;

import com.orientechnologies.orient.core.record.impl.ODocument;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.JobPersistenceException;
import org.quartz.ObjectAlreadyExistsException;
import org.quartz.impl.matchers.GroupMatcher;
import org.quartz.impl.matchers.StringMatcher.StringOperatorName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The DAO for jobs.
 */
public class StandardJobDao {

  private static final Logger LOG = LoggerFactory.getLogger(StandardJobDao.class);

  private final OrientDbConnector connector;

  private final OrientDbSchema schema;

  private final QueryHelper queryHelper;

  private final JobConverter jobConverter;

  /**
   * The name of the scheduler the jobs belong to.
   */
  private final String schedulerName;

  public StandardJobDao(OrientDbConnector connector, OrientDbSchema schema,
      QueryHelper queryHelper, JobConverter jobConverter, String schedulerName) {
    this.connector = connector;
    this.schema = schema;
    this.queryHelper = queryHelper;
    this.jobConverter = jobConverter;
    this.schedulerName = schedulerName;
  }

  public String getJobId(JobKey jobKey) {
    return Keys.jobId(schedulerName, jobKey);
  }

  public ODocument getJob(JobKey jobKey) {
    return findById(getJobId(jobKey));
  }

  public ODocument findById(String jobId) {
    return queryHelper.findById(schema.getJobClass(), jobId);
  }

  public boolean exists(JobKey jobKey) {
    return getJob(jobKey) != null;
  }

  public JobDetail retrieveJob(JobKey jobKey) throws JobPersistenceException {
    ODocument doc = getJob(jobKey);
    if (doc == null) {
      return null;
    }

    return jobConverter.toJobDetail(doc);
  }

  /**
   * Store a job.
   *
   * @param newJob
   *          the job to store
   * @param replaceExisting
   *          {@code true} if an existing job with the same key is replaced
   *
   * @return the stored document
   *
   * @throws ObjectAlreadyExistsException
   *           the job exists and is not to be replaced
   * @throws JobPersistenceException
   *           the job could not be converted
   */
  public ODocument storeJob(JobDetail newJob, boolean replaceExisting)
      throws JobPersistenceException {
    String jobId = getJobId(newJob.getKey());
    ODocument job = findById(jobId);
    if (job != null) {
      if (!replaceExisting) {
        throw new ObjectAlreadyExistsException(newJob);
      }
    } else {
      job = new ODocument(schema.getJobClass());
    }

    jobConverter.toDocument(newJob, jobId, schedulerName, job);

    return connector.getConnection().save(job);
  }

  /**
   * Replace the stored data map of a job.
   *
   * @param jobKey
   *          key of the job
   * @param jobDataMap
   *          the new data
   *
   * @return {@code true} if the job exists and was updated
   *
   * @throws JobPersistenceException
   *           the data could not be stored
   */
  public boolean storeJobData(JobKey jobKey, JobDataMap jobDataMap)
      throws JobPersistenceException {
    final String jobData = SerialUtils.serialize(jobDataMap);

    boolean updated = queryHelper.updateWithRetry(schema.getJobClass(), getJobId(jobKey),
        new DocumentUpdate() {
          @Override
          public boolean apply(ODocument document) {
            document.field(Constants.JOB_DATA, jobData);
            return true;
          }
        });
    if (!updated) {
      LOG.debug("Job {} is gone, its data was not stored", jobKey);
    }

    return updated;
  }

  public boolean remove(JobKey jobKey) {
    ODocument job = getJob(jobKey);
    if (job == null) {
      return false;
    }

    remove(job);
    return true;
  }

  public void remove(ODocument job) {
    connector.getConnection().delete(job);
  }

  public int getCount() {
    return (int) queryHelper.count("select count(*) as count from " + schema.getJobClass()
        + " where " + Constants.SCHEDULER_NAME + " = ?", schedulerName);
  }

  public List<String> getGroupNames() {
    return queryHelper.queryStrings("select distinct " + Constants.KEY_GROUP + " from "
        + schema.getJobClass() + " where " + Constants.SCHEDULER_NAME + " = ?",
        Constants.KEY_GROUP, schedulerName);
  }

  /**
   * Get the groups a matcher selects.
   *
   * <p>
   * An equality matcher selects its group whether or not any job is in it.
   *
   * @param matcher
   *          the matcher
   *
   * @return the groups
   */
  public Set<String> groupsOfMatching(GroupMatcher<JobKey> matcher) {
    if (matcher.getCompareWithOperator() == StringOperatorName.EQUALS) {
      return Collections.singleton(matcher.getCompareToValue());
    }

    return QueryHelper.matchingGroups(getGroupNames(), matcher);
  }

  public List<ODocument> findByGroup(String group) {
    return queryHelper.query("select from " + schema.getJobClass() + " where "
        + Constants.SCHEDULER_NAME + " = ? and " + Constants.KEY_GROUP + " = ?", schedulerName,
        group);
  }

  public Set<JobKey> getJobKeys(GroupMatcher<JobKey> matcher) {
    Set<JobKey> keys = new HashSet<JobKey>();
    for (String group : groupsOfMatching(matcher)) {
      for (ODocument doc : findByGroup(group)) {
        keys.add(Keys.toJobKey(doc));
      }
    }

    return keys;
  }

  public void removeAll() {
    for (ODocument job : queryHelper.query("select from " + schema.getJobClass() + " where "
        + Constants.SCHEDULER_NAME + " = ?", schedulerName)) {
      remove(job);
    }
  }
}
