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

import io.smartspaces.scheduling.quartz.clusterstore.internal.Constants;
import io.smartspaces.scheduling.quartz.clusterstore.internal.dao.StandardBlockedJobDao;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * A block repository kept in the database, so all instances in a cluster see
 * the same blocks.
 *
 * <p>
 * Taking a block is an insert guarded by a unique index, so only one instance
 * can succeed.
 */
public class PersistentBlockRepository implements BlockRepository {

  private static final Logger LOG = LoggerFactory.getLogger(PersistentBlockRepository.class);

  private final StandardBlockedJobDao blockedJobDao;

  /**
   * The ID of this instance, recorded as the holder of the blocks it takes.
   */
  private final String instanceId;

  private final Clock clock;

  public PersistentBlockRepository(StandardBlockedJobDao blockedJobDao, String instanceId,
      Clock clock) {
    this.blockedJobDao = blockedJobDao;
    this.instanceId = instanceId;
    this.clock = clock;
  }

  @Override
  public boolean block(String jobId, String fireInstanceId) {
    return blockedJobDao.insert(jobId, instanceId, fireInstanceId, clock.millis());
  }

  @Override
  public boolean release(String jobId, String fireInstanceId) {
    return blockedJobDao.removeIfHeldBy(jobId, Constants.BLOCKED_FIRE_INSTANCE_ID,
        fireInstanceId);
  }

  @Override
  public boolean isBlocked(String jobId) {
    return blockedJobDao.exists(jobId);
  }

  @Override
  public Set<String> getBlockedJobs() {
    return blockedJobDao.getBlockedJobIds();
  }

  @Override
  public void releaseAll() {
    blockedJobDao.removeAll();
  }

  @Override
  public Set<String> releaseAbandoned(Set<String> liveInstanceIds) {
    Set<String> released = new HashSet<String>();
    for (Map.Entry<String, String> holder : blockedJobDao.getBlockHolders().entrySet()) {
      if (!liveInstanceIds.contains(holder.getValue())) {
        LOG.info("Releasing block on job {} held by dead instance {}", holder.getKey(),
            holder.getValue());
        if (blockedJobDao.removeIfHeldBy(holder.getKey(), Constants.BLOCKED_INSTANCE_ID,
            holder.getValue())) {
          released.add(holder.getKey());
        }
      }
    }

    return released;
  }
}
