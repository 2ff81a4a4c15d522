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

import io.smartspaces.scheduling.quartz.clusterstore.internal.util.ODocumentHelper;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.SerialUtils;

import com.orientechnologies.orient.core.record.impl.ODocument;
import org.quartz.Job;
import org.quartz.JobBuilder;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.JobPersistenceException;
import org.quartz.spi.ClassLoadHelper;

/**
 * A converter between Quartz job descriptions and and OrientDB records.
 */
public class JobConverter {

  private ClassLoadHelper loadHelper;

  public JobConverter(ClassLoadHelper loadHelper) {
    this.loadHelper = loadHelper;
  }

  /**
   * Copy a job into a document.
   *
   * @param newJob
   *          the job
   * @param documentId
   *          the ID of the job document
   * @param schedulerName
   *          the name of the scheduler owning the job
   * @param job
   *          the document to write into
   *
   * @throws JobPersistenceException
   *           the job data could not be serialized
   */
  public void toDocument(JobDetail newJob, String documentId, String schedulerName, ODocument job)
      throws JobPersistenceException {
    JobKey key = newJob.getKey();

    job.field(Constants.DOCUMENT_ID, documentId);
    job.field(Constants.SCHEDULER_NAME, schedulerName);
    job.field(Constants.KEY_NAME, key.getName());
    job.field(Constants.KEY_GROUP, key.getGroup());
    job.field(Constants.JOB_DESCRIPTION, newJob.getDescription());
    job.field(Constants.JOB_CLASS, newJob.getJobClass().getName());
    job.field(Constants.JOB_DURABILITY, newJob.isDurable());
    job.field(Constants.JOB_REQUESTS_RECOVERY, newJob.requestsRecovery());
    job.field(Constants.JOB_CONCURRENT_EXECUTION_DISALLOWED,
        newJob.isConcurrentExectionDisallowed());
    job.field(Constants.JOB_PERSIST_DATA_AFTER_EXECUTION, newJob.isPersistJobDataAfterExecution());
    job.field(Constants.JOB_DATA, SerialUtils.serialize(newJob.getJobDataMap()));
  }

  public JobDetail toJobDetail(ODocument doc) throws JobPersistenceException {
    String jobClassName = doc.field(Constants.JOB_CLASS);
    Class<? extends Job> jobClass;
    try {
      jobClass = loadHelper.getClassLoader().loadClass(jobClassName).asSubclass(Job.class);
    } catch (ClassNotFoundException | ClassCastException e) {
      throw new JobPersistenceException("Could not load job class " + jobClassName, e);
    }

    JobDataMap jobData = new JobDataMap(SerialUtils.deserializeJobData(
        (String) doc.field(Constants.JOB_DATA), loadHelper.getClassLoader()));
    jobData.clearDirtyFlag();

    return JobBuilder.newJob(jobClass)
        .withIdentity((String) doc.field(Constants.KEY_NAME),
            (String) doc.field(Constants.KEY_GROUP))
        .withDescription((String) doc.field(Constants.JOB_DESCRIPTION))
        .storeDurably(ODocumentHelper.getBooleanField(doc, Constants.JOB_DURABILITY, false))
        .requestRecovery(
            ODocumentHelper.getBooleanField(doc, Constants.JOB_REQUESTS_RECOVERY, false))
        .usingJobData(jobData).build();
  }

  /**
   * Does the job stored in a document disallow concurrent execution?
   *
   * @param doc
   *          the job document
   *
   * @return {@code true} if only one execution may run at a time
   */
  public static boolean isConcurrentExecutionDisallowed(ODocument doc) {
    return ODocumentHelper.getBooleanField(doc, Constants.JOB_CONCURRENT_EXECUTION_DISALLOWED,
        false);
  }

  /**
   * Does the job stored in a document want to be recovered?
   *
   * @param doc
   *          the job document
   *
   * @return {@code true} if the job requests recovery
   */
  public static boolean isRequestsRecovery(ODocument doc) {
    return ODocumentHelper.getBooleanField(doc, Constants.JOB_REQUESTS_RECOVERY, false);
  }

  /**
   * Is the job stored in a document durable?
   *
   * @param doc
   *          the job document
   *
   * @return {@code true} if the job survives having no triggers
   */
  public static boolean isDurable(ODocument doc) {
    return ODocumentHelper.getBooleanField(doc, Constants.JOB_DURABILITY, false);
  }
}
