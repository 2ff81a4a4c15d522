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

package io.smartspaces.scheduling.quartz.clusterstore.internal.trigger;

import io.smartspaces.scheduling.quartz.clusterstore.internal.Constants;
import io.smartspaces.scheduling.quartz.clusterstore.internal.dao.StandardCalendarDao;
import io.smartspaces.scheduling.quartz.clusterstore.internal.dao.StandardTriggerDao;
import io.smartspaces.scheduling.quartz.clusterstore.internal.db.OrientDbConnector;
import io.smartspaces.scheduling.quartz.clusterstore.internal.db.OrientDbConnector.TransactionMethod;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.Clock;

import com.orientechnologies.orient.core.record.impl.ODocument;
import org.quartz.Calendar;
import org.quartz.JobPersistenceException;
import org.quartz.Trigger;
import org.quartz.spi.OperableTrigger;
import org.quartz.spi.SchedulerSignaler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Date;
import java.util.List;

/**
 * Handle misfires.
 */
public class StandardMisfireHandler implements MisfireHandler {

  /**
   * The time in milliseconds to sleep between misfire scans.
   */
  private static final long TIME_TO_SLEEP_BETWEEN_SCANS = 50L;

  /**
   * The maximum number of misfires to correct in a single scan.
   */
  private static final int MAX_TO_RECOVER_AT_A_TIME = 20;

  /**
   * The logger for this class.
   */
  private static final Logger LOG = LoggerFactory.getLogger(StandardMisfireHandler.class);

  /**
   * The database connector.
   */
  private final OrientDbConnector orientDbConnector;

  /**
   * The DAO for triggers.
   */
  private final StandardTriggerDao triggerDao;

  /**
   * The DAO for calendars.
   */
  private final StandardCalendarDao calendarDao;

  private final TriggerConverter triggerConverter;

  /**
   * The threshold for misfires, in milliseconds.
   */
  private final long misfireThreshold;

  /**
   * The time between database retries, in milliseconds.
   */
  private final long dbRetryInterval;

  /**
   * The clock to use for time.
   */
  private final Clock clock;

  /**
   * The signaler for the scheduler.
   */
  private final SchedulerSignaler schedulerSignaler;

  /**
   * {@code true} if the misfire scan should be shut down.
   */
  private volatile boolean shutdownMisfireScan = false;

  /**
   * The number of failures in a row during misfire scans.
   */
  private int numMisfireScanFails = 0;

  public StandardMisfireHandler(OrientDbConnector orientDbConnector,
      StandardTriggerDao triggerDao, StandardCalendarDao calendarDao,
      TriggerConverter triggerConverter, long misfireThreshold, long dbRetryInterval, Clock clock,
      SchedulerSignaler schedulerSignaler) {
    this.orientDbConnector = orientDbConnector;
    this.triggerDao = triggerDao;
    this.calendarDao = calendarDao;
    this.triggerConverter = triggerConverter;
    this.misfireThreshold = misfireThreshold;
    this.dbRetryInterval = dbRetryInterval;
    this.clock = clock;
    this.schedulerSignaler = schedulerSignaler;
  }

  @Override
  public boolean applyMisfire(OperableTrigger trigger) throws JobPersistenceException {
    Date fireTime = trigger.getNextFireTime();
    if (misfireIsNotApplicable(trigger, fireTime)) {
      return false;
    }

    trigger.updateAfterMisfire(calendarDao.retrieveCalendar(trigger.getCalendarName()));

    return trigger.getNextFireTime() == null || !fireTime.equals(trigger.getNextFireTime());
  }

  @Override
  public MisfireOutcome correctMisfire(ODocument triggerDoc, OperableTrigger trigger,
      String stateIfNotComplete) throws JobPersistenceException {
    OperableTrigger original = (OperableTrigger) trigger.clone();
    if (!applyMisfire(trigger)) {
      return MisfireOutcome.NOT_MISFIRED;
    }

    triggerConverter.updateFireTimes(trigger, triggerDoc);
    if (trigger.getNextFireTime() == null) {
      triggerDoc.field(Constants.TRIGGER_STATE, Constants.STATE_COMPLETE);
    } else if (stateIfNotComplete != null) {
      triggerDoc.field(Constants.TRIGGER_STATE, stateIfNotComplete);
    }

    if (!orientDbConnector.saveIfCurrent(triggerDoc)) {
      LOG.debug("Misfire of {} was handled by another writer", trigger.getKey());
      return MisfireOutcome.LOST;
    }

    schedulerSignaler.notifyTriggerListenersMisfired(original);
    if (trigger.getNextFireTime() == null) {
      schedulerSignaler.notifySchedulerListenersFinalized(trigger);
    }

    return MisfireOutcome.CORRECTED;
  }

  @Override
  public long getMisfireTime() {
    long misfireTime = clock.millis();
    if (misfireThreshold > 0) {
      misfireTime -= misfireThreshold;
    }

    return misfireTime;
  }

  @Override
  public void scanForMisfires() {
    while (!shutdownMisfireScan) {
      long sTime = clock.millis();

      RecoverMisfiredJobsResult recoverMisfiredJobsResult = scanAndProcessMisfires();

      if (recoverMisfiredJobsResult.getProcessedMisfiredTriggerCount() > 0) {
        schedulerSignaler.signalSchedulingChange(recoverMisfiredJobsResult.getEarliestNewTime());
      }

      if (!shutdownMisfireScan) {
        // At least a short pause to help balance threads
        long timeToSleep = TIME_TO_SLEEP_BETWEEN_SCANS;
        if (!recoverMisfiredJobsResult.hasMoreMisfiredTriggers()) {
          timeToSleep = misfireThreshold - (clock.millis() - sTime);
          if (timeToSleep <= 0) {
            timeToSleep = TIME_TO_SLEEP_BETWEEN_SCANS;
          }

          if (numMisfireScanFails > 0) {
            timeToSleep = Math.max(dbRetryInterval, timeToSleep);
          }
        }

        try {
          Thread.sleep(timeToSleep);
        } catch (InterruptedException e) {
          LOG.debug("Misfire scan interrupted, stopping");
          Thread.currentThread().interrupt();
          return;
        }
      }
    }
  }

  @Override
  public void shutdownScanForMisfires() {
    shutdownMisfireScan = true;
  }

  @Override
  public void recoverAllMisfires() throws JobPersistenceException {
    RecoverMisfiredJobsResult result = recoverMisfiredJobs(true);
    if (result.getProcessedMisfiredTriggerCount() > 0) {
      schedulerSignaler.signalSchedulingChange(result.getEarliestNewTime());
    }
  }

  /**
   * Scan and process any misfires.
   *
   * @return the result of the processing
   */
  private RecoverMisfiredJobsResult scanAndProcessMisfires() {
    try {
      LOG.debug("MisfireHandler: scanning for misfires...");

      RecoverMisfiredJobsResult res = orientDbConnector
          .doWithoutTransaction(new TransactionMethod<RecoverMisfiredJobsResult>() {
            @Override
            public RecoverMisfiredJobsResult doInTransaction() throws JobPersistenceException {
              return recoverMisfiredJobs(false);
            }
          });
      numMisfireScanFails = 0;
      return res;
    } catch (JobPersistenceException | RuntimeException e) {
      if (numMisfireScanFails % 4 == 0) {
        LOG.error("MisfireHandler: Error handling misfires: " + e.getMessage(), e);
      }
      numMisfireScanFails++;
    }
    return RecoverMisfiredJobsResult.NO_OP;
  }

  private RecoverMisfiredJobsResult recoverMisfiredJobs(boolean recovering)
      throws JobPersistenceException {
    // If recovering, we want to handle all of the misfired triggers right away.
    int limit = recovering ? -1 : MAX_TO_RECOVER_AT_A_TIME + 1;

    List<ODocument> misfiredTriggers =
        triggerDao.findMisfired(Constants.STATE_WAITING, getMisfireTime(), limit);

    boolean hasMoreMisfiredTriggers = false;
    if (!recovering && misfiredTriggers.size() > MAX_TO_RECOVER_AT_A_TIME) {
      hasMoreMisfiredTriggers = true;
      misfiredTriggers = misfiredTriggers.subList(0, MAX_TO_RECOVER_AT_A_TIME);
    }

    if (hasMoreMisfiredTriggers) {
      LOG.info("Handling the first " + misfiredTriggers.size()
          + " triggers that missed their scheduled fire-time.  "
          + "More misfired triggers remain to be processed.");
    } else if (misfiredTriggers.size() > 0) {
      LOG.info("Handling " + misfiredTriggers.size()
          + " trigger(s) that missed their scheduled fire-time.");
    } else {
      LOG.debug("Found 0 triggers that missed their scheduled fire-time.");
      return RecoverMisfiredJobsResult.NO_OP;
    }

    int processed = 0;
    long earliestNewTime = Long.MAX_VALUE;
    for (ODocument triggerDoc : misfiredTriggers) {
      OperableTrigger trigger;
      try {
        trigger = triggerConverter.toTrigger(triggerDoc);
      } catch (JobPersistenceException e) {
        LOG.error("Could not read misfired trigger {}, skipping it",
            triggerDoc.field(Constants.DOCUMENT_ID), e);
        continue;
      }

      if (correctMisfire(triggerDoc, trigger, Constants.STATE_WAITING)
          == MisfireOutcome.CORRECTED) {
        processed++;
        if (trigger.getNextFireTime() != null
            && trigger.getNextFireTime().getTime() < earliestNewTime) {
          earliestNewTime = trigger.getNextFireTime().getTime();
        }
      }
    }

    return new RecoverMisfiredJobsResult(hasMoreMisfiredTriggers, processed, earliestNewTime);
  }

  private boolean misfireIsNotApplicable(OperableTrigger trigger, Date fireTime) {
    return fireTime == null || isNotMisfired(fireTime)
        || trigger.getMisfireInstruction() == Trigger.MISFIRE_INSTRUCTION_IGNORE_MISFIRE_POLICY;
  }

  private boolean isNotMisfired(Date fireTime) {
    return getMisfireTime() < fireTime.getTime();
  }

  private static class RecoverMisfiredJobsResult {
    /**
     * A result that means there is nothing to be handled.
     */
    public static final RecoverMisfiredJobsResult NO_OP =
        new RecoverMisfiredJobsResult(false, 0, Long.MAX_VALUE);

    private final boolean hasMoreMisfiredTriggers;
    private final int processedMisfiredTriggerCount;
    private final long earliestNewTime;

    public RecoverMisfiredJobsResult(boolean hasMoreMisfiredTriggers,
        int processedMisfiredTriggerCount, long earliestNewTime) {
      this.hasMoreMisfiredTriggers = hasMoreMisfiredTriggers;
      this.processedMisfiredTriggerCount = processedMisfiredTriggerCount;
      this.earliestNewTime = earliestNewTime;
    }

    public boolean hasMoreMisfiredTriggers() {
      return hasMoreMisfiredTriggers;
    }

    public int getProcessedMisfiredTriggerCount() {
      return processedMisfiredTriggerCount;
    }

    public long getEarliestNewTime() {
      return earliestNewTime;
    }

    @Override
    public String toString() {
      return "RecoverMisfiredJobsResult [hasMoreMisfiredTriggers=" + hasMoreMisfiredTriggers
          + ", processedMisfiredTriggerCount=" + processedMisfiredTriggerCount
          + ", earliestNewTime=" + earliestNewTime + "]";
    }
  }
}
