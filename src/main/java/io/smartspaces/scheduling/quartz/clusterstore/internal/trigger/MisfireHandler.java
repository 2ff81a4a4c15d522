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

import com.orientechnologies.orient.core.record.impl.ODocument;
import org.quartz.JobPersistenceException;
import org.quartz.spi.OperableTrigger;

/**
 * Detects and corrects triggers which missed their fire time.
 *
 * @author Keith M. Hughes
 */
public interface MisfireHandler {

  /**
   * The result of trying to correct a misfire.
   */
  enum MisfireOutcome {

    /**
     * The trigger had not misfired, or correcting it changed nothing.
     */
    NOT_MISFIRED,

    /**
     * The trigger was corrected and saved.
     */
    CORRECTED,

    /**
     * Another writer changed the trigger first, nothing was saved.
     */
    LOST
  }

  /**
   * Apply the misfire policy to a trigger without saving it or notifying
   * anyone.
   *
   * @param trigger
   *          the trigger
   *
   * @return {@code true} if the trigger's fire times changed
   *
   * @throws JobPersistenceException
   *           the trigger's calendar could not be read
   */
  boolean applyMisfire(OperableTrigger trigger) throws JobPersistenceException;

  /**
   * Correct a misfired trigger and save its document if nobody else changed it
   * first. Listeners are only told about misfires that were saved.
   *
   * @param triggerDoc
   *          the trigger's document, as read
   * @param trigger
   *          the trigger read from the document, updated in place
   * @param stateIfNotComplete
   *          the state to give the trigger if it can still fire, or
   *          {@code null} to keep its state
   *
   * @return what happened
   *
   * @throws JobPersistenceException
   *           the trigger could not be corrected
   */
  MisfireOutcome correctMisfire(ODocument triggerDoc, OperableTrigger trigger,
      String stateIfNotComplete) throws JobPersistenceException;

  /**
   * Get the time before which a fire time counts as misfired.
   *
   * @return the time, in epoch milliseconds
   */
  long getMisfireTime();

  /**
   * Scan for misfires until shut down. Meant to run in its own thread.
   */
  void scanForMisfires();

  void shutdownScanForMisfires();

  /**
   * Correct every misfired trigger in one pass.
   *
   * @throws JobPersistenceException
   *           the misfires could not be read
   */
  void recoverAllMisfires() throws JobPersistenceException;
}
