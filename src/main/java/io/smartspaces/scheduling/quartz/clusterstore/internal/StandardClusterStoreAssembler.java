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

import io.smartspaces.scheduling.quartz.clusterstore.OrientDbClusterJobStore;
import io.smartspaces.scheduling.quartz.clusterstore.internal.block.BlockRepository;
import io.smartspaces.scheduling.quartz.clusterstore.internal.block.BlockTracking;
import io.smartspaces.scheduling.quartz.clusterstore.internal.block.MemoryBlockRepository;
import io.smartspaces.scheduling.quartz.clusterstore.internal.block.PersistentBlockRepository;
import io.smartspaces.scheduling.quartz.clusterstore.internal.cluster.CheckinExecutor;
import io.smartspaces.scheduling.quartz.clusterstore.internal.cluster.CheckinTask;
import io.smartspaces.scheduling.quartz.clusterstore.internal.cluster.RecoveryTriggerFactory;
import io.smartspaces.scheduling.quartz.clusterstore.internal.cluster.TriggerRecoverer;
import io.smartspaces.scheduling.quartz.clusterstore.internal.dao.StandardBlockedJobDao;
import io.smartspaces.scheduling.quartz.clusterstore.internal.dao.StandardCalendarDao;
import io.smartspaces.scheduling.quartz.clusterstore.internal.dao.StandardJobDao;
import io.smartspaces.scheduling.quartz.clusterstore.internal.dao.StandardPausedJobGroupsDao;
import io.smartspaces.scheduling.quartz.clusterstore.internal.dao.StandardPausedTriggerGroupsDao;
import io.smartspaces.scheduling.quartz.clusterstore.internal.dao.StandardSchedulerDao;
import io.smartspaces.scheduling.quartz.clusterstore.internal.dao.StandardTriggerDao;
import io.smartspaces.scheduling.quartz.clusterstore.internal.db.OrientDbSchema;
import io.smartspaces.scheduling.quartz.clusterstore.internal.db.StandardOrientDbConnector;
import io.smartspaces.scheduling.quartz.clusterstore.internal.trigger.MisfireHandler;
import io.smartspaces.scheduling.quartz.clusterstore.internal.trigger.StandardMisfireHandler;
import io.smartspaces.scheduling.quartz.clusterstore.internal.trigger.TriggerConverter;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.Clock;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.QueryHelper;

import org.quartz.SchedulerConfigException;
import org.quartz.spi.ClassLoadHelper;
import org.quartz.spi.SchedulerSignaler;

/**
 * This class creates the database connection, does initial database schema
 * building, and wires together the parts of the job store.
 */
public class StandardClusterStoreAssembler {

  private StandardOrientDbConnector orientDbConnector;
  private OrientDbSchema schema;
  private QueryHelper queryHelper;

  private JobConverter jobConverter;
  private TriggerConverter triggerConverter;

  private StandardJobDao jobDao;
  private StandardTriggerDao triggerDao;
  private StandardCalendarDao calendarDao;
  private StandardPausedJobGroupsDao pausedJobGroupsDao;
  private StandardPausedTriggerGroupsDao pausedTriggerGroupsDao;
  private StandardSchedulerDao schedulerDao;

  private BlockRepository blockRepository;
  private MisfireHandler misfireHandler;
  private TriggerStateManager triggerStateManager;
  private TriggerAndJobPersister persister;
  private TriggerRunner triggerRunner;
  private JobCompleteHandler jobCompleteHandler;

  private TriggerRecoverer triggerRecoverer;
  private CheckinTask checkinTask;
  private CheckinExecutor checkinExecutor;

  /**
   * The clock to use.
   */
  private Clock clock;

  public void build(OrientDbClusterJobStore jobStore, ClassLoadHelper loadHelper,
      SchedulerSignaler signaler) throws SchedulerConfigException {
    this.clock = jobStore.getClock();

    String schedulerName = jobStore.getSchedulerName();
    String instanceId = jobStore.getInstanceId();

    // Checked before connecting so a bad configuration leaves nothing behind.
    BlockTracking blockTracking = resolveBlockTracking(jobStore);

    schema = new OrientDbSchema(jobStore.getCollectionPrefix());
    orientDbConnector = createOrientDbConnector(jobStore);
    queryHelper = new QueryHelper(orientDbConnector);

    jobConverter = new JobConverter(loadHelper);
    triggerConverter = new TriggerConverter(loadHelper);

    jobDao = new StandardJobDao(orientDbConnector, schema, queryHelper, jobConverter,
        schedulerName);
    triggerDao = new StandardTriggerDao(orientDbConnector, schema, queryHelper,
        triggerConverter, schedulerName);
    calendarDao = new StandardCalendarDao(orientDbConnector, schema, queryHelper, loadHelper,
        schedulerName);
    pausedJobGroupsDao = new StandardPausedJobGroupsDao(orientDbConnector, schema, queryHelper,
        schedulerName);
    pausedTriggerGroupsDao = new StandardPausedTriggerGroupsDao(orientDbConnector, schema,
        queryHelper, schedulerName);
    schedulerDao = new StandardSchedulerDao(orientDbConnector, schema, queryHelper,
        schedulerName);

    blockRepository = createBlockRepository(blockTracking, schedulerName, instanceId);

    misfireHandler = new StandardMisfireHandler(orientDbConnector, triggerDao, calendarDao,
        triggerConverter, jobStore.getMisfireThreshold(), jobStore.getDbRetryInterval(), clock,
        signaler);

    triggerStateManager = new TriggerStateManager(triggerDao, jobDao, pausedTriggerGroupsDao,
        pausedJobGroupsDao, blockRepository, misfireHandler, triggerConverter);

    persister = new TriggerAndJobPersister(orientDbConnector, triggerDao, jobDao, calendarDao,
        pausedTriggerGroupsDao, pausedJobGroupsDao, blockRepository, triggerStateManager,
        triggerConverter, signaler, schedulerName, jobStore.getMisfireThreshold());

    triggerRunner = new TriggerRunner(orientDbConnector, triggerDao, jobDao, calendarDao,
        jobConverter, triggerConverter, misfireHandler, triggerStateManager, blockRepository,
        new FireInstanceIdGenerator(instanceId, clock), jobStore.getExecutionStepObserver(),
        instanceId, clock);

    jobCompleteHandler = new JobCompleteHandler(triggerDao, jobDao, persister,
        triggerStateManager, blockRepository, signaler, jobStore.getExecutionStepObserver(),
        instanceId);

    triggerRecoverer = new TriggerRecoverer(orientDbConnector, triggerDao, jobDao, schedulerDao,
        triggerStateManager, blockRepository, misfireHandler, persister,
        new RecoveryTriggerFactory(clock), triggerConverter, signaler, instanceId,
        jobStore.getClusterCheckinMargin(), clock);

    checkinTask = new CheckinTask(orientDbConnector, schedulerDao, triggerRecoverer, instanceId,
        jobStore.getClusterCheckinInterval(), clock);
    checkinExecutor = new CheckinExecutor(jobStore.getExecutorService(), checkinTask,
        jobStore.getClusterCheckinInterval(), instanceId);
  }

  private BlockTracking resolveBlockTracking(OrientDbClusterJobStore jobStore)
      throws SchedulerConfigException {
    BlockTracking blockTracking = BlockTracking.fromConfig(jobStore.getBlockTracking());
    if (blockTracking == BlockTracking.AUTO) {
      return jobStore.isClustered() ? BlockTracking.PERSISTENT : BlockTracking.MEMORY;
    }

    if (blockTracking == BlockTracking.MEMORY && jobStore.isClustered()) {
      throw new SchedulerConfigException(
          "Memory block tracking cannot be used by a clustered job store, use persistent");
    }

    return blockTracking;
  }

  private BlockRepository createBlockRepository(BlockTracking blockTracking,
      String schedulerName, String instanceId) {
    if (blockTracking == BlockTracking.PERSISTENT) {
      return new PersistentBlockRepository(
          new StandardBlockedJobDao(orientDbConnector, schema, queryHelper, schedulerName),
          instanceId, clock);
    } else {
      return new MemoryBlockRepository(instanceId);
    }
  }

  private StandardOrientDbConnector createOrientDbConnector(OrientDbClusterJobStore jobStore)
      throws SchedulerConfigException {
    StandardOrientDbConnector.OrientDbConnectorBuilder builder =
        StandardOrientDbConnector.builder();
    if (jobStore.getOrientDb() != null) {
      builder.withOrientDb(jobStore.getOrientDb());
    } else {
      builder.withUri(jobStore.getOrientDbUri());
    }

    return builder.withCredentials(jobStore.getUsername(), jobStore.getPassword())
        .withServerCredentials(jobStore.getServerUsername(), jobStore.getServerPassword())
        .withDatabaseName(jobStore.getDbName()).withDatabaseType(jobStore.getDatabaseType())
        .withSchema(schema).build();
  }

  public StandardOrientDbConnector getOrientDbConnector() {
    return orientDbConnector;
  }

  public JobCompleteHandler getJobCompleteHandler() {
    return jobCompleteHandler;
  }

  public TriggerStateManager getTriggerStateManager() {
    return triggerStateManager;
  }

  public TriggerRunner getTriggerRunner() {
    return triggerRunner;
  }

  public TriggerAndJobPersister getPersister() {
    return persister;
  }

  public TriggerRecoverer getTriggerRecoverer() {
    return triggerRecoverer;
  }

  public CheckinTask getCheckinTask() {
    return checkinTask;
  }

  public CheckinExecutor getCheckinExecutor() {
    return checkinExecutor;
  }

  public MisfireHandler getMisfireHandler() {
    return misfireHandler;
  }

  public BlockRepository getBlockRepository() {
    return blockRepository;
  }

  public StandardCalendarDao getCalendarDao() {
    return calendarDao;
  }

  public StandardJobDao getJobDao() {
    return jobDao;
  }

  public StandardSchedulerDao getSchedulerDao() {
    return schedulerDao;
  }

  public StandardTriggerDao getTriggerDao() {
    return triggerDao;
  }
}
