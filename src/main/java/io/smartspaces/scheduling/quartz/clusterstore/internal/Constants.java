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

/**
 * Names of the database classes and fields, and the trigger states.
 *
 * @author Keith M. Hughes
 */
public final class Constants {

  /**
   * Class name suffix for jobs.
   */
  public static final String CLASS_JOB = "Job";

  /**
   * Class name suffix for triggers.
   */
  public static final String CLASS_TRIGGER = "Trigger";

  /**
   * Class name suffix for calendars.
   */
  public static final String CLASS_CALENDAR = "Calendar";

  /**
   * Class name suffix for blocked jobs.
   */
  public static final String CLASS_BLOCKED_JOB = "BlockedJob";

  /**
   * Class name suffix for paused trigger groups.
   */
  public static final String CLASS_PAUSED_TRIGGER_GROUP = "PausedTriggerGroup";

  /**
   * Class name suffix for paused job groups.
   */
  public static final String CLASS_PAUSED_JOB_GROUP = "PausedJobGroup";

  /**
   * Class name suffix for scheduler check-ins.
   */
  public static final String CLASS_SCHEDULER = "Scheduler";

  public static final String DOCUMENT_ID = "documentId";
  public static final String SCHEDULER_NAME = "schedulerName";

  public static final String KEY_NAME = "keyName";
  public static final String KEY_GROUP = "keyGroup";

  public static final String JOB_DESCRIPTION = "jobDescription";
  public static final String JOB_CLASS = "jobClass";
  public static final String JOB_DATA = "jobData";
  public static final String JOB_DURABILITY = "durability";
  public static final String JOB_REQUESTS_RECOVERY = "requestsRecovery";
  public static final String JOB_CONCURRENT_EXECUTION_DISALLOWED = "concurrentExecutionDisallowed";
  public static final String JOB_PERSIST_DATA_AFTER_EXECUTION = "persistJobDataAfterExecution";

  public static final String TRIGGER_JOB_ID = "jobId";
  public static final String TRIGGER_JOB_NAME = "jobName";
  public static final String TRIGGER_JOB_GROUP = "jobGroup";
  public static final String TRIGGER_CALENDAR_NAME = "calendarName";
  public static final String TRIGGER_DESCRIPTION = "description";
  public static final String TRIGGER_STATE = "state";
  public static final String TRIGGER_PRIORITY = "priority";
  public static final String TRIGGER_MISFIRE_INSTRUCTION = "misfireInstruction";
  public static final String TRIGGER_NEXT_FIRE_TIME = "nextFireTime";
  public static final String TRIGGER_PREVIOUS_FIRE_TIME = "previousFireTime";
  public static final String TRIGGER_START_TIME = "startTime";
  public static final String TRIGGER_END_TIME = "endTime";
  public static final String TRIGGER_FIRE_INSTANCE_ID = "fireInstanceId";
  public static final String TRIGGER_INSTANCE_ID = "instanceId";
  public static final String TRIGGER_CLASS = "triggerClass";
  public static final String TRIGGER_DATA = "triggerData";
  public static final String TRIGGER_JOB_DATA = "jobData";

  public static final String CALENDAR_NAME = "name";
  public static final String CALENDAR_CLASS = "calendarClass";
  public static final String CALENDAR_SERIALIZED_OBJECT = "calendarData";

  public static final String BLOCKED_JOB_ID = "jobId";
  public static final String BLOCKED_INSTANCE_ID = "instanceId";
  public static final String BLOCKED_FIRE_INSTANCE_ID = "fireInstanceId";
  public static final String BLOCKED_TIME = "blockedTime";

  public static final String SCHEDULER_INSTANCE_ID_FIELD = "instanceId";
  public static final String SCHEDULER_LAST_CHECKIN_TIME_FIELD = "lastCheckinTime";
  public static final String SCHEDULER_CHECKIN_INTERVAL_FIELD = "checkinInterval";
  public static final String SCHEDULER_STATE_FIELD = "instanceState";

  /**
   * The trigger can be fired when due.
   */
  public static final String STATE_WAITING = "waiting";

  /**
   * A node has claimed the trigger and will fire it.
   */
  public static final String STATE_ACQUIRED = "acquired";

  /**
   * The trigger's job is running.
   */
  public static final String STATE_EXECUTING = "executing";

  /**
   * The trigger's job does not allow concurrent execution and is running.
   */
  public static final String STATE_BLOCKED = "blocked";

  /**
   * Both paused and blocked.
   */
  public static final String STATE_PAUSED_BLOCKED = "pausedBlocked";

  public static final String STATE_PAUSED = "paused";
  public static final String STATE_COMPLETE = "complete";
  public static final String STATE_ERROR = "error";

  /**
   * Group name marking that all groups have been paused.
   */
  public static final String ALL_GROUPS_PAUSED = "_$_ALL_GROUPS_PAUSED_$_";

  private Constants() {
  }
}
