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

/**
 * The steps of a trigger's firing that are reported to an
 * {@link ExecutionStepObserver}.
 *
 * @author Keith M. Hughes
 */
public enum ExecutionStep {

  /**
   * A candidate trigger is about to be claimed by the node.
   */
  ACQUIRING,

  /**
   * An acquired trigger is about to be fired.
   */
  FIRING,

  /**
   * A trigger being fired found its job already running and is about to be
   * blocked.
   */
  BLOCKING,

  /**
   * An acquired trigger is being handed back without firing.
   */
  RELEASING,

  /**
   * The job for a fired trigger has finished and completion is starting.
   */
  COMPLETING,

  /**
   * Completion of a fired trigger has been recorded.
   */
  COMPLETED
}
