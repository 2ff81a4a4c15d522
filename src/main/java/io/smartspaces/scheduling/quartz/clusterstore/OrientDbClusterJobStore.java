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

package io.smartspaces.scheduling.quartz.clusterstore;

import io.smartspaces.scheduling.quartz.clusterstore.internal.StandardClusterStoreAssembler;
import io.smartspaces.scheduling.quartz.clusterstore.internal.cluster.CheckinExecutor;
import io.smartspaces.scheduling.quartz.clusterstore.internal.cluster.SchedulerInstanceState;
import io.smartspaces.scheduling.quartz.clusterstore.internal.db.OrientDbConnector;
import io.smartspaces.scheduling.quartz.clusterstore.internal.db.OrientDbConnector.TransactionMethod;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.Clock;

import com.orientechnologies.orient.core.db.OrientDB;
import org.quartz.Calendar;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.JobPersistenceException;
import org.quartz.SchedulerConfigException;
import org.quartz.SchedulerException;
import org.quartz.Trigger;
import org.quartz.Trigger.CompletedExecutionInstruction;
import org.quartz.Trigger.TriggerState;
import org.quartz.TriggerKey;
import org.quartz.impl.matchers.GroupMatcher;
import org.quartz.spi.ClassLoadHelper;
import org.quartz.spi.JobStore;
import org.quartz.spi.OperableTrigger;
import org.quartz.spi.SchedulerSignaler;
import org.quartz.spi.TriggerFiredResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;

/**
 * The Quartz Job Store that uses OrientDB, safe for several scheduler
 * instances sharing one database.
 *
 * <p>
 * Every trigger firing happens exactly once across the cluster. An instance
 * claims a trigger by saving it with a fire instance token, and a save only
 * succeeds if nobody changed the trigger since it was read.
 */
public class OrientDbClusterJobStore implements JobStore {

  private static final Logger LOG = LoggerFactory.getLogger(OrientDbClusterJobStore.class);

  /**
   * Characters allowed in a collection prefix.
   */
  private static final Pattern COLLECTION_PREFIX = Pattern.compile("[A-Za-z0-9_]*");

  /**
   * The number of threads in the executor created when none is given.
   */
  private static final int DEFAULT_EXECUTOR_THREADS = 4;

  private String collectionPrefix = "quartz_";
  private String dbName;
  private String schedulerName;
  private String instanceId;
  private String orientDbUri;
  private String username = "quartz";
  private String password = "quartz";
  private String serverUsername = "root";
  private String serverPassword = "root";
  private String databaseType = "plocal";

  /**
   * An OrientDB context shared with others, used instead of the URI.
   */
  private OrientDB orientDb;

  private boolean clustered = false;
  private long clusterCheckinInterval = 7500L;
  private long clusterCheckinMargin = 7500L;
  private String blockTracking = "auto";

  /**
   * The threshold for detecting misfires.
   */
  private long misfireThreshold = 60000;

  /**
   * The internal in milliseconds for retrying
   */
  private long dbRetryInterval = 15000L; // 15 secs

  /**
   * The clock to use for timing events.
   */
  private Clock clock = Clock.SYSTEM_CLOCK;

  private ExecutionStepObserver executionStepObserver = ExecutionStepObserver.NONE;

  /**
   * The executor service to use for threads.
   */
  private ScheduledExecutorService executorService;

  /**
   * {@code true} if the executor service was created by the store and must be
   * shut down with it.
   */
  private boolean ownsExecutorService;

  /**
   * The assembler for the job store.
   */
  private StandardClusterStoreAssembler assembler = new StandardClusterStoreAssembler();

  /**
   * The future for controlling the misfire handler.
   */
  private Future<?> misfireFuture;

  /**
   * Set once the store has been shut down.
   */
  private final AtomicBoolean shutDown = new AtomicBoolean();

  /**
   * Construct a job store.
   */
  public OrientDbClusterJobStore() {
  }

  /**
   * Construct a job store.
   *
   * @param orientdbUri
   *          the URI for the OrientDB database
   * @param username
   *          the user name for the database
   * @param password
   *          the password for the database
   */
  public OrientDbClusterJobStore(String orientdbUri, String username, String password) {
    this.orientDbUri = orientdbUri;
    this.username = username;
    this.password = password;
  }

  @Override
  public void initialize(ClassLoadHelper loadHelper, SchedulerSignaler schedulerSignaler)
      throws SchedulerConfigException {
    LOG.debug("Initializing job store for scheduler {}, instance {}", schedulerName,
        instanceId);

    validateConfiguration();

    if (executorService == null) {
      executorService = Executors.newScheduledThreadPool(DEFAULT_EXECUTOR_THREADS);
      ownsExecutorService = true;
    }

    try {
      assembler.build(this, loadHelper, schedulerSignaler);
    } catch (SchedulerConfigException e) {
      if (ownsExecutorService) {
        executorService.shutdownNow();
      }
      throw e;
    }

    try {
      assembler.getOrientDbConnector().doWithoutTransaction(new TransactionMethod<Void>() {
        @Override
        public Void doInTransaction() throws JobPersistenceException {
          completeInitialize();

          return null;
        }
      });
    } catch (JobPersistenceException e) {
      shutdown();
      throw new SchedulerConfigException("Cannot recover scheduler data", e);
    }

    if (clustered) {
      assembler.getCheckinExecutor().start();
    }
  }

  private void validateConfiguration() throws SchedulerConfigException {
    if (schedulerName == null || instanceId == null) {
      throw new SchedulerConfigException(
          "The scheduler name and instance ID must be set before initializing");
    }
    if (orientDb == null && orientDbUri == null) {
      throw new SchedulerConfigException("An OrientDB URI must be specified.");
    }
    if (dbName == null) {
      throw new SchedulerConfigException("An OrientDB database name must be specified.");
    }
    if (!COLLECTION_PREFIX.matcher(collectionPrefix).matches()) {
      throw new SchedulerConfigException("Invalid collection prefix " + collectionPrefix
          + ", only letters, digits and underscores are allowed");
    }
    if (clustered && clusterCheckinInterval <= 0) {
      throw new SchedulerConfigException("The cluster check-in interval must be positive");
    }
  }

  private void completeInitialize() throws JobPersistenceException {
    if (clustered) {
      // Announce the instance before recovering, so others see it alive.
      assembler.getCheckinTask().checkIn();
    }

    assembler.getTriggerRecoverer().recoverOnStartup(clustered);
  }

  @Override
  public void schedulerStarted() throws SchedulerException {
    LOG.debug("scheduler started");

    misfireFuture = executorService.submit(new Runnable() {
      @Override
      public void run() {
        Thread thread = Thread.currentThread();
        String poolThreadName = thread.getName();
        thread.setName("Quartz-Misfire");
        try {
          assembler.getMisfireHandler().scanForMisfires();
        } finally {
          thread.setName(poolThreadName);
        }
      }
    });

    if (clustered) {
      assembler.getCheckinTask().setState(SchedulerInstanceState.STARTED);
    }
  }

  @Override
  public void schedulerPaused() {
    LOG.debug("scheduler paused");
    changeInstanceState(SchedulerInstanceState.PAUSED);
  }

  @Override
  public void schedulerResumed() {
    LOG.debug("scheduler resumed");
    changeInstanceState(SchedulerInstanceState.RESUMED);
  }

  private void changeInstanceState(SchedulerInstanceState state) {
    if (!clustered) {
      return;
    }

    try {
      assembler.getCheckinTask().setState(state);
    } catch (JobPersistenceException e) {
      // The next periodic check-in records the state.
      LOG.warn("Could not record state {} of instance {}", state, instanceId, e);
    }
  }

  @Override
  public void shutdown() {
    if (!shutDown.compareAndSet(false, true)) {
      return;
    }

    LOG.debug("scheduler shutting down");

    CheckinExecutor checkinExecutor = assembler.getCheckinExecutor();
    if (checkinExecutor != null) {
      checkinExecutor.shutdown();
      changeInstanceState(SchedulerInstanceState.SHUTDOWN);
    }

    if (assembler.getMisfireHandler() != null) {
      assembler.getMisfireHandler().shutdownScanForMisfires();
    }
    if (misfireFuture != null) {
      misfireFuture.cancel(true);
      misfireFuture = null;
    }

    if (ownsExecutorService) {
      executorService.shutdownNow();
    }

    OrientDbConnector orientDbConnector = assembler.getOrientDbConnector();
    if (orientDbConnector != null) {
      orientDbConnector.shutdown();
    }
  }

  @Override
  public boolean supportsPersistence() {
    return true;
  }

  @Override
  public long getEstimatedTimeToReleaseAndAcquireTrigger() {
    // this will vary...
    return 200;
  }

  @Override
  public boolean isClustered() {
    return clustered;
  }

  /**
   * How long Quartz waits before acquiring again after a failure.
   *
   * @param failureCount
   *          the number of failures in a row
   *
   * @return the delay in milliseconds
   */
  public long getAcquireRetryDelay(int failureCount) {
    return dbRetryInterval;
  }

  @Override
  public void storeJob(final JobDetail newJob, final boolean replaceExisting)
      throws JobPersistenceException {
    LOG.debug("Adding job {} with replace={}", newJob, replaceExisting);
    assembler.getOrientDbConnector().doInTransaction(new TransactionMethod<Void>() {
      @Override
      public Void doInTransaction() throws JobPersistenceException {
        assembler.getPersister().storeJob(newJob, replaceExisting);

        return null;
      }
    });
  }

  @Override
  public void storeJobAndTrigger(final JobDetail newJob, final OperableTrigger newTrigger)
      throws JobPersistenceException {
    LOG.debug("Adding job {}  and trigger {}", newJob, newTrigger);
    assembler.getOrientDbConnector().doInTransaction(new TransactionMethod<Void>() {
      @Override
      public Void doInTransaction() throws JobPersistenceException {
        assembler.getPersister().storeJobAndTrigger(newJob, newTrigger);

        return null;
      }
    });
  }

  @Override
  public void storeJobsAndTriggers(final Map<JobDetail, Set<? extends Trigger>> triggersAndJobs,
      final boolean replace) throws JobPersistenceException {
    LOG.debug("Adding {} jobs with their triggers, replace={}", triggersAndJobs.size(), replace);
    assembler.getOrientDbConnector().doInTransaction(new TransactionMethod<Void>() {
      @Override
      public Void doInTransaction() throws JobPersistenceException {
        assembler.getPersister().storeJobsAndTriggers(triggersAndJobs, replace);

        return null;
      }
    });
  }

  @Override
  public boolean removeJob(final JobKey jobKey) throws JobPersistenceException {
    LOG.debug("Removing job {}", jobKey);
    return assembler.getOrientDbConnector().doInTransaction(new TransactionMethod<Boolean>() {
      @Override
      public Boolean doInTransaction() throws JobPersistenceException {
        return assembler.getPersister().removeJob(jobKey);
      }
    }).booleanValue();
  }

  @Override
  public boolean removeJobs(final List<JobKey> jobKeys) throws JobPersistenceException {
    LOG.debug("Removing jobs {}", jobKeys);
    return assembler.getOrientDbConnector().doInTransaction(new TransactionMethod<Boolean>() {
      @Override
      public Boolean doInTransaction() throws JobPersistenceException {
        return assembler.getPersister().removeJobs(jobKeys);
      }
    }).booleanValue();
  }

  @Override
  public JobDetail retrieveJob(final JobKey jobKey) throws JobPersistenceException {
    LOG.debug("Retrieve job {}", jobKey);
    return assembler.getOrientDbConnector()
        .doWithoutTransaction(new TransactionMethod<JobDetail>() {
          @Override
          public JobDetail doInTransaction() throws JobPersistenceException {
            return assembler.getJobDao().retrieveJob(jobKey);
          }
        });
  }

  @Override
  public void storeTrigger(final OperableTrigger newTrigger, final boolean replaceExisting)
      throws JobPersistenceException {
    LOG.debug("Store trigger {} with replace={}", newTrigger, replaceExisting);
    assembler.getOrientDbConnector().doInTransaction(new TransactionMethod<Void>() {
      @Override
      public Void doInTransaction() throws JobPersistenceException {
        assembler.getPersister().storeTrigger(newTrigger, replaceExisting);

        return null;
      }
    });
  }

  @Override
  public boolean removeTrigger(final TriggerKey triggerKey) throws JobPersistenceException {
    LOG.debug("Removing trigger {}", triggerKey);
    return assembler.getOrientDbConnector().doInTransaction(new TransactionMethod<Boolean>() {
      @Override
      public Boolean doInTransaction() throws JobPersistenceException {
        return assembler.getPersister().removeTrigger(triggerKey);
      }
    }).booleanValue();
  }

  @Override
  public boolean removeTriggers(final List<TriggerKey> triggerKeys)
      throws JobPersistenceException {
    LOG.debug("Removing triggers {}", triggerKeys);
    return assembler.getOrientDbConnector().doInTransaction(new TransactionMethod<Boolean>() {
      @Override
      public Boolean doInTransaction() throws JobPersistenceException {
        return assembler.getPersister().removeTriggers(triggerKeys);
      }
    }).booleanValue();
  }

  @Override
  public boolean replaceTrigger(final TriggerKey triggerKey, final OperableTrigger newTrigger)
      throws JobPersistenceException {
    LOG.debug("Replacing trigger {} with {}", triggerKey, newTrigger);
    return assembler.getOrientDbConnector().doInTransaction(new TransactionMethod<Boolean>() {
      @Override
      public Boolean doInTransaction() throws JobPersistenceException {
        return assembler.getPersister().replaceTrigger(triggerKey, newTrigger);
      }
    }).booleanValue();
  }

  @Override
  public OperableTrigger retrieveTrigger(final TriggerKey triggerKey)
      throws JobPersistenceException {
    LOG.debug("Retrieving trigger {}", triggerKey);
    return assembler.getOrientDbConnector()
        .doWithoutTransaction(new TransactionMethod<OperableTrigger>() {
          @Override
          public OperableTrigger doInTransaction() throws JobPersistenceException {
            return assembler.getTriggerDao().getTrigger(triggerKey);
          }
        });
  }

  @Override
  public boolean checkExists(final JobKey jobKey) throws JobPersistenceException {
    LOG.debug("Checking existence of job {}", jobKey);
    return assembler.getOrientDbConnector()
        .doWithoutTransaction(new TransactionMethod<Boolean>() {
          @Override
          public Boolean doInTransaction() throws JobPersistenceException {
            return assembler.getJobDao().exists(jobKey);
          }
        }).booleanValue();
  }

  @Override
  public boolean checkExists(final TriggerKey triggerKey) throws JobPersistenceException {
    LOG.debug("Checking existence of trigger {}", triggerKey);
    return assembler.getOrientDbConnector()
        .doWithoutTransaction(new TransactionMethod<Boolean>() {
          @Override
          public Boolean doInTransaction() throws JobPersistenceException {
            return assembler.getTriggerDao().exists(triggerKey);
          }
        }).booleanValue();
  }

  @Override
  public void clearAllSchedulingData() throws JobPersistenceException {
    LOG.debug("Clearing all scheduling data");
    assembler.getOrientDbConnector().doWithoutTransaction(new TransactionMethod<Void>() {
      @Override
      public Void doInTransaction() throws JobPersistenceException {
        assembler.getPersister().clearAllSchedulingData();

        return null;
      }
    });
  }

  @Override
  public void storeCalendar(final String name, final Calendar calendar,
      final boolean replaceExisting, final boolean updateTriggers)
      throws JobPersistenceException {
    LOG.debug("Storing calendar {} with replace={}, update triggers={}", name, replaceExisting,
        updateTriggers);
    assembler.getOrientDbConnector().doInTransaction(new TransactionMethod<Void>() {
      @Override
      public Void doInTransaction() throws JobPersistenceException {
        assembler.getPersister().storeCalendar(name, calendar, replaceExisting, updateTriggers);

        return null;
      }
    });
  }

  @Override
  public boolean removeCalendar(final String calName) throws JobPersistenceException {
    LOG.debug("Removing calendar {}", calName);
    return assembler.getOrientDbConnector().doInTransaction(new TransactionMethod<Boolean>() {
      @Override
      public Boolean doInTransaction() throws JobPersistenceException {
        return assembler.getPersister().removeCalendar(calName);
      }
    }).booleanValue();
  }

  @Override
  public Calendar retrieveCalendar(final String calName) throws JobPersistenceException {
    LOG.debug("Retrieving calendar {}", calName);
    return assembler.getOrientDbConnector()
        .doWithoutTransaction(new TransactionMethod<Calendar>() {
          @Override
          public Calendar doInTransaction() throws JobPersistenceException {
            return assembler.getCalendarDao().retrieveCalendar(calName);
          }
        });
  }

  @Override
  public int getNumberOfJobs() throws JobPersistenceException {
    LOG.debug("Getting number of jobs");
    return assembler.getOrientDbConnector()
        .doWithoutTransaction(new TransactionMethod<Integer>() {
          @Override
          public Integer doInTransaction() throws JobPersistenceException {
            return assembler.getJobDao().getCount();
          }
        }).intValue();
  }

  @Override
  public int getNumberOfTriggers() throws JobPersistenceException {
    LOG.debug("Getting number of triggers");
    return assembler.getOrientDbConnector()
        .doWithoutTransaction(new TransactionMethod<Integer>() {
          @Override
          public Integer doInTransaction() throws JobPersistenceException {
            return assembler.getTriggerDao().getCount();
          }
        }).intValue();
  }

  @Override
  public int getNumberOfCalendars() throws JobPersistenceException {
    LOG.debug("Getting number of calendars");
    return assembler.getOrientDbConnector()
        .doWithoutTransaction(new TransactionMethod<Integer>() {
          @Override
          public Integer doInTransaction() throws JobPersistenceException {
            return assembler.getCalendarDao().getCount();
          }
        }).intValue();
  }

  @Override
  public Set<JobKey> getJobKeys(final GroupMatcher<JobKey> matcher)
      throws JobPersistenceException {
    LOG.debug("Getting job keys matching {}", matcher);
    return assembler.getOrientDbConnector()
        .doWithoutTransaction(new TransactionMethod<Set<JobKey>>() {
          @Override
          public Set<JobKey> doInTransaction() throws JobPersistenceException {
            return assembler.getJobDao().getJobKeys(matcher);
          }
        });
  }

  @Override
  public Set<TriggerKey> getTriggerKeys(final GroupMatcher<TriggerKey> matcher)
      throws JobPersistenceException {
    LOG.debug("Getting trigger keys matching {}", matcher);
    return assembler.getOrientDbConnector()
        .doWithoutTransaction(new TransactionMethod<Set<TriggerKey>>() {
          @Override
          public Set<TriggerKey> doInTransaction() throws JobPersistenceException {
            return assembler.getTriggerDao().getTriggerKeys(matcher);
          }
        });
  }

  @Override
  public List<String> getJobGroupNames() throws JobPersistenceException {
    LOG.debug("Getting job group names");
    return assembler.getOrientDbConnector()
        .doWithoutTransaction(new TransactionMethod<List<String>>() {
          @Override
          public List<String> doInTransaction() throws JobPersistenceException {
            return assembler.getJobDao().getGroupNames();
          }
        });
  }

  @Override
  public List<String> getTriggerGroupNames() throws JobPersistenceException {
    LOG.debug("Getting trigger group names");
    return assembler.getOrientDbConnector()
        .doWithoutTransaction(new TransactionMethod<List<String>>() {
          @Override
          public List<String> doInTransaction() throws JobPersistenceException {
            return assembler.getTriggerDao().getGroupNames();
          }
        });
  }

  @Override
  public List<String> getCalendarNames() throws JobPersistenceException {
    LOG.debug("Getting calendar names");
    return assembler.getOrientDbConnector()
        .doWithoutTransaction(new TransactionMethod<List<String>>() {
          @Override
          public List<String> doInTransaction() throws JobPersistenceException {
            return assembler.getCalendarDao().getNames();
          }
        });
  }

  @Override
  public List<OperableTrigger> getTriggersForJob(final JobKey jobKey)
      throws JobPersistenceException {
    LOG.debug("Getting triggers for job {}", jobKey);
    return assembler.getOrientDbConnector()
        .doWithoutTransaction(new TransactionMethod<List<OperableTrigger>>() {
          @Override
          public List<OperableTrigger> doInTransaction() throws JobPersistenceException {
            return assembler.getTriggerDao()
                .getTriggersForJob(assembler.getJobDao().getJobId(jobKey));
          }
        });
  }

  @Override
  public TriggerState getTriggerState(final TriggerKey triggerKey)
      throws JobPersistenceException {
    LOG.debug("Getting trigger state {}", triggerKey);
    return assembler.getOrientDbConnector()
        .doWithoutTransaction(new TransactionMethod<TriggerState>() {
          @Override
          public TriggerState doInTransaction() throws JobPersistenceException {
            return assembler.getTriggerStateManager().getTriggerState(triggerKey);
          }
        });
  }

  /**
   * Take a trigger out of the error state, back to the state it would be in
   * without the error.
   *
   * @param triggerKey
   *          key of the trigger
   *
   * @throws JobPersistenceException
   *           the trigger could not be updated
   */
  public void resetTriggerFromErrorState(final TriggerKey triggerKey)
      throws JobPersistenceException {
    LOG.debug("Resetting trigger {} from error state", triggerKey);
    assembler.getOrientDbConnector().doWithoutTransaction(new TransactionMethod<Void>() {
      @Override
      public Void doInTransaction() throws JobPersistenceException {
        assembler.getTriggerStateManager().resetTriggerFromErrorState(triggerKey);

        return null;
      }
    });
  }

  @Override
  public void pauseTrigger(final TriggerKey triggerKey) throws JobPersistenceException {
    LOG.debug("Pausing trigger {}", triggerKey);
    assembler.getOrientDbConnector().doWithoutTransaction(new TransactionMethod<Void>() {
      @Override
      public Void doInTransaction() throws JobPersistenceException {
        assembler.getTriggerStateManager().pauseTrigger(triggerKey);

        return null;
      }
    });
  }

  @Override
  public Collection<String> pauseTriggers(final GroupMatcher<TriggerKey> matcher)
      throws JobPersistenceException {
    LOG.debug("Pausing triggers {}", matcher);
    return assembler.getOrientDbConnector()
        .doWithoutTransaction(new TransactionMethod<Collection<String>>() {
          @Override
          public Collection<String> doInTransaction() throws JobPersistenceException {
            return assembler.getTriggerStateManager().pauseTriggers(matcher);
          }
        });
  }

  @Override
  public void pauseJob(final JobKey jobKey) throws JobPersistenceException {
    LOG.debug("Pausing job {}", jobKey);
    assembler.getOrientDbConnector().doWithoutTransaction(new TransactionMethod<Void>() {
      @Override
      public Void doInTransaction() throws JobPersistenceException {
        assembler.getTriggerStateManager().pauseJob(jobKey);

        return null;
      }
    });
  }

  @Override
  public Collection<String> pauseJobs(final GroupMatcher<JobKey> groupMatcher)
      throws JobPersistenceException {
    LOG.debug("Pausing jobs {}", groupMatcher);
    return assembler.getOrientDbConnector()
        .doWithoutTransaction(new TransactionMethod<Collection<String>>() {
          @Override
          public Collection<String> doInTransaction() throws JobPersistenceException {
            return assembler.getTriggerStateManager().pauseJobs(groupMatcher);
          }
        });
  }

  @Override
  public void resumeTrigger(final TriggerKey triggerKey) throws JobPersistenceException {
    LOG.debug("Resuming trigger {}", triggerKey);
    assembler.getOrientDbConnector().doWithoutTransaction(new TransactionMethod<Void>() {
      @Override
      public Void doInTransaction() throws JobPersistenceException {
        assembler.getTriggerStateManager().resumeTrigger(triggerKey);

        return null;
      }
    });
  }

  @Override
  public Collection<String> resumeTriggers(final GroupMatcher<TriggerKey> matcher)
      throws JobPersistenceException {
    LOG.debug("Resuming triggers {}", matcher);
    return assembler.getOrientDbConnector()
        .doWithoutTransaction(new TransactionMethod<Collection<String>>() {
          @Override
          public Collection<String> doInTransaction() throws JobPersistenceException {
            return assembler.getTriggerStateManager().resumeTriggers(matcher);
          }
        });
  }

  @Override
  public Set<String> getPausedTriggerGroups() throws JobPersistenceException {
    LOG.debug("Getting paused trigger groups");
    return assembler.getOrientDbConnector()
        .doWithoutTransaction(new TransactionMethod<Set<String>>() {
          @Override
          public Set<String> doInTransaction() throws JobPersistenceException {
            return assembler.getTriggerStateManager().getPausedTriggerGroups();
          }
        });
  }

  /**
   * Is a trigger group paused?
   *
   * @param group
   *          the trigger group
   *
   * @return {@code true} if the group is paused
   *
   * @throws JobPersistenceException
   *           the paused groups could not be read
   */
  public boolean isTriggerGroupPaused(final String group) throws JobPersistenceException {
    return assembler.getOrientDbConnector()
        .doWithoutTransaction(new TransactionMethod<Boolean>() {
          @Override
          public Boolean doInTransaction() throws JobPersistenceException {
            return assembler.getTriggerStateManager().isTriggerGroupPaused(group);
          }
        }).booleanValue();
  }

  public boolean isJobGroupPaused(final String group) throws JobPersistenceException {
    return assembler.getOrientDbConnector()
        .doWithoutTransaction(new TransactionMethod<Boolean>() {
          @Override
          public Boolean doInTransaction() throws JobPersistenceException {
            return assembler.getTriggerStateManager().isJobGroupPaused(group);
          }
        }).booleanValue();
  }

  @Override
  public void resumeJob(final JobKey jobKey) throws JobPersistenceException {
    LOG.debug("Resuming job {}", jobKey);
    assembler.getOrientDbConnector().doWithoutTransaction(new TransactionMethod<Void>() {
      @Override
      public Void doInTransaction() throws JobPersistenceException {
        assembler.getTriggerStateManager().resumeJob(jobKey);

        return null;
      }
    });
  }

  @Override
  public Collection<String> resumeJobs(final GroupMatcher<JobKey> groupMatcher)
      throws JobPersistenceException {
    LOG.debug("Resuming jobs {}", groupMatcher);
    return assembler.getOrientDbConnector()
        .doWithoutTransaction(new TransactionMethod<Collection<String>>() {
          @Override
          public Collection<String> doInTransaction() throws JobPersistenceException {
            return assembler.getTriggerStateManager().resumeJobs(groupMatcher);
          }
        });
  }

  @Override
  public void pauseAll() throws JobPersistenceException {
    LOG.debug("Pausing all");
    assembler.getOrientDbConnector().doWithoutTransaction(new TransactionMethod<Void>() {
      @Override
      public Void doInTransaction() throws JobPersistenceException {
        assembler.getTriggerStateManager().pauseAll();

        return null;
      }
    });
  }

  @Override
  public void resumeAll() throws JobPersistenceException {
    LOG.debug("Resuming all");
    assembler.getOrientDbConnector().doWithoutTransaction(new TransactionMethod<Void>() {
      @Override
      public Void doInTransaction() throws JobPersistenceException {
        assembler.getTriggerStateManager().resumeAll();

        return null;
      }
    });
  }

  @Override
  public List<OperableTrigger> acquireNextTriggers(final long noLaterThan, final int maxCount,
      final long timeWindow) throws JobPersistenceException {
    LOG.debug("Acquiring up to {} triggers no later than {} with window {}", maxCount,
        noLaterThan, timeWindow);
    return assembler.getOrientDbConnector()
        .doWithoutTransaction(new TransactionMethod<List<OperableTrigger>>() {
          @Override
          public List<OperableTrigger> doInTransaction() throws JobPersistenceException {
            return assembler.getTriggerRunner().acquireNext(noLaterThan, maxCount, timeWindow);
          }
        });
  }

  @Override
  public void releaseAcquiredTrigger(final OperableTrigger trigger) {
    LOG.debug("Releasing acquired trigger {}", trigger);
    try {
      assembler.getOrientDbConnector().doWithoutTransaction(new TransactionMethod<Void>() {
        @Override
        public Void doInTransaction() throws JobPersistenceException {
          assembler.getTriggerRunner().releaseAcquiredTrigger(trigger);

          return null;
        }
      });
    } catch (JobPersistenceException e) {
      // Recovery gives the trigger back if its owner dies holding it.
      LOG.error("Could not release acquired trigger {}", trigger.getKey(), e);
    }
  }

  @Override
  public List<TriggerFiredResult> triggersFired(final List<OperableTrigger> triggers)
      throws JobPersistenceException {
    LOG.debug("Triggers fired {}", triggers);
    return assembler.getOrientDbConnector()
        .doWithoutTransaction(new TransactionMethod<List<TriggerFiredResult>>() {
          @Override
          public List<TriggerFiredResult> doInTransaction() throws JobPersistenceException {
            return assembler.getTriggerRunner().triggersFired(triggers);
          }
        });
  }

  @Override
  public void triggeredJobComplete(final OperableTrigger trigger, final JobDetail job,
      final CompletedExecutionInstruction triggerInstCode) {
    LOG.debug("Triggered job complete {} for job {} with instruction {}", trigger, job,
        triggerInstCode);
    try {
      assembler.getOrientDbConnector().doWithoutTransaction(new TransactionMethod<Void>() {
        @Override
        public Void doInTransaction() throws JobPersistenceException {
          assembler.getJobCompleteHandler().jobComplete(trigger, job, triggerInstCode);

          return null;
        }
      });
    } catch (JobPersistenceException e) {
      LOG.error("Could not record completion of trigger {} for job {}", trigger.getKey(),
          job.getKey(), e);
    }
  }

  @Override
  public void setInstanceId(String instanceId) {
    this.instanceId = instanceId;
  }

  @Override
  public void setInstanceName(String schedName) {
    // Used as part of cluster node identifier:
    schedulerName = schedName;
  }

  public String getInstanceId() {
    return instanceId;
  }

  @Override
  public void setThreadPoolSize(int poolSize) {
    // No-op
  }

  public String getSchedulerName() {
    return schedulerName;
  }

  public String getDbName() {
    return dbName;
  }

  public void setDbName(String dbName) {
    this.dbName = dbName;
  }

  /**
   * Set the prefix of the collection names.
   *
   * <p>
   * An underscore is appended to the prefix, so a prefix of {@code jobs}
   * gives collections named {@code jobs_Trigger} and so on. The default,
   * {@code quartz_}, corresponds to setting {@code quartz}.
   *
   * @param prefix
   *          the prefix, without the trailing underscore
   */
  public void setCollectionPrefix(String prefix) {
    collectionPrefix = prefix + "_";
  }

  public String getCollectionPrefix() {
    return collectionPrefix;
  }

  public void setOrientDbUri(final String orientdbUri) {
    this.orientDbUri = orientdbUri;
  }

  public String getOrientDbUri() {
    return orientDbUri;
  }

  public void setOrientDb(OrientDB orientDb) {
    this.orientDb = orientDb;
  }

  public OrientDB getOrientDb() {
    return orientDb;
  }

  public void setUsername(String username) {
    this.username = username;
  }

  public String getUsername() {
    return username;
  }

  public void setPassword(String password) {
    this.password = password;
  }

  public String getPassword() {
    return password;
  }

  public void setServerUsername(String serverUsername) {
    this.serverUsername = serverUsername;
  }

  public String getServerUsername() {
    return serverUsername;
  }

  public void setServerPassword(String serverPassword) {
    this.serverPassword = serverPassword;
  }

  public String getServerPassword() {
    return serverPassword;
  }

  public void setDatabaseType(String databaseType) {
    this.databaseType = databaseType;
  }

  public String getDatabaseType() {
    return databaseType;
  }

  public void setClustered(boolean clustered) {
    this.clustered = clustered;
  }

  public void setClusterCheckinInterval(long clusterCheckinInterval) {
    this.clusterCheckinInterval = clusterCheckinInterval;
  }

  public long getClusterCheckinInterval() {
    return clusterCheckinInterval;
  }

  public void setClusterCheckinMargin(long clusterCheckinMargin) {
    this.clusterCheckinMargin = clusterCheckinMargin;
  }

  public long getClusterCheckinMargin() {
    return clusterCheckinMargin;
  }

  public void setBlockTracking(String blockTracking) {
    this.blockTracking = blockTracking;
  }

  public String getBlockTracking() {
    return blockTracking;
  }

  public void setMisfireThreshold(long misfireThreshold) {
    this.misfireThreshold = misfireThreshold;
  }

  public long getMisfireThreshold() {
    return misfireThreshold;
  }

  public Clock getClock() {
    return clock;
  }

  public void setClock(Clock clock) {
    this.clock = clock;
  }

  public long getDbRetryInterval() {
    return dbRetryInterval;
  }

  public void setDbRetryInterval(long dbRetryInterval) {
    this.dbRetryInterval = dbRetryInterval;
  }

  public ExecutionStepObserver getExecutionStepObserver() {
    return executionStepObserver;
  }

  public void setExecutionStepObserver(ExecutionStepObserver executionStepObserver) {
    this.executionStepObserver = executionStepObserver;
  }

  public ScheduledExecutorService getExecutorService() {
    return executorService;
  }

  public void setExecutorService(ScheduledExecutorService executorService) {
    this.executorService = executorService;
  }
}
