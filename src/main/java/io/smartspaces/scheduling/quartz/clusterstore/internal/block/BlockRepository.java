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

package io.smartspaces.scheduling.quartz.clusterstore.internal.block;

import org.quartz.JobPersistenceException;

import java.util.Set;

/**
 * Tracks which jobs that disallow concurrent execution are currently running.
 *
 * <p>
 * A job is blocked from the moment one of its triggers fires until the firing
 * completes. Jobs are identified by their document IDs.
 *
 * @author Keith M. Hughes
 */
public interface BlockRepository {

  /**
   * Block a job for one firing of one of its triggers.
   *
   * @param jobId
   *          the document ID of the job
   * @param fireInstanceId
   *          the fire instance token of the firing taking the block
   *
   * @return {@code true} if the job was newly blocked, {@code false} if it was
   *         already blocked
   *
   * @throws JobPersistenceException
   *           the block could not be recorded
   */
  boolean block(String jobId, String fireInstanceId) throws JobPersistenceException;

  /**
   * Release the block on a job if it is held by a given firing. A no-op if the
   * job is not blocked or another firing holds the block.
   *
   * @param jobId
   *          the document ID of the job
   * @param fireInstanceId
   *          the fire instance token of the firing that took the block
   *
   * @return {@code true} if this call released the block
   *
   * @throws JobPersistenceException
   *           the block could not be removed
   */
  boolean release(String jobId, String fireInstanceId) throws JobPersistenceException;

  boolean isBlocked(String jobId) throws JobPersistenceException;

  Set<String> getBlockedJobs() throws JobPersistenceException;

  /**
   * Release every block.
   *
   * @throws JobPersistenceException
   *           the blocks could not be removed
   */
  void releaseAll() throws JobPersistenceException;

  /**
   * Release the blocks held by instances which are no longer alive.
   *
   * @param liveInstanceIds
   *          IDs of the instances still alive
   *
   * @return the document IDs of the jobs whose blocks were released
   *
   * @throws JobPersistenceException
   *           the blocks could not be removed
   */
  Set<String> releaseAbandoned(Set<String> liveInstanceIds) throws JobPersistenceException;
}
