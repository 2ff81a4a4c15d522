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

import org.quartz.TriggerKey;

/**
 * An observer of the firing steps a node takes for its triggers.
 *
 * <p>
 * Observers are informed synchronously on the thread doing the work. They
 * cannot change what the store does, but they can delay it, which is what makes
 * them useful for lining up several nodes at the same point.
 *
 * @author Keith M. Hughes
 */
public interface ExecutionStepObserver {

  /**
   * An observer which does nothing.
   */
  ExecutionStepObserver NONE = new ExecutionStepObserver() {
    @Override
    public void stepReached(ExecutionStep step, String instanceId, TriggerKey triggerKey) {
      // Nothing to observe.
    }
  };

  /**
   * A step has been reached.
   *
   * @param step
   *          the step reached
   * @param instanceId
   *          ID of the scheduler instance taking the step
   * @param triggerKey
   *          the key of the trigger the step is for
   */
  void stepReached(ExecutionStep step, String instanceId, TriggerKey triggerKey);
}
