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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * A block repository kept in memory. Only usable when the store is not
 * clustered, since other instances cannot see the blocks.
 */
public class MemoryBlockRepository implements BlockRepository {

  private static final Logger LOG = LoggerFactory.getLogger(MemoryBlockRepository.class);

  /**
   * The ID of the instance holding all blocks.
   */
  private final String instanceId;

  /**
   * The fire instance token holding the block of each blocked job.
   */
  private final Map<String, String> blockedJobs =
      Collections.synchronizedMap(new HashMap<String, String>());

  public MemoryBlockRepository(String instanceId) {
    this.instanceId = instanceId;
  }

  @Override
  public boolean block(String jobId, String fireInstanceId) {
    return blockedJobs.putIfAbsent(jobId, fireInstanceId) == null;
  }

  @Override
  public boolean release(String jobId, String fireInstanceId) {
    return blockedJobs.remove(jobId, fireInstanceId);
  }

  @Override
  public boolean isBlocked(String jobId) {
    return blockedJobs.containsKey(jobId);
  }

  @Override
  public Set<String> getBlockedJobs() {
    synchronized (blockedJobs) {
      return new HashSet<String>(blockedJobs.keySet());
    }
  }

  @Override
  public void releaseAll() {
    blockedJobs.clear();
  }

  @Override
  public Set<String> releaseAbandoned(Set<String> liveInstanceIds) {
    if (liveInstanceIds.contains(instanceId)) {
      return Collections.emptySet();
    }

    Set<String> released;
    synchronized (blockedJobs) {
      released = new HashSet<String>(blockedJobs.keySet());
      blockedJobs.clear();
    }

    LOG.debug("Released {} blocks held by {}", released.size(), instanceId);
    return released;
  }
}
