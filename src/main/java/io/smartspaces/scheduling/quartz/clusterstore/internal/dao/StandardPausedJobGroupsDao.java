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

package io.smartspaces.scheduling.quartz.clusterstore.internal.dao;

import io.smartspaces.scheduling.quartz.clusterstore.internal.db.OrientDbConnector;
import io.smartspaces.scheduling.quartz.clusterstore.internal.db.OrientDbSchema;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.Keys;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.QueryHelper;

public class StandardPausedJobGroupsDao extends PausedGroupsDao {

  public StandardPausedJobGroupsDao(OrientDbConnector connector, OrientDbSchema schema,
      QueryHelper queryHelper, String schedulerName) {
    super(connector, queryHelper, schema.getPausedJobGroupClass(), schedulerName);
  }

  @Override
  protected String markerId(String group) {
    return Keys.pausedJobGroupId(schedulerName, group);
  }
}
