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

import io.smartspaces.scheduling.quartz.clusterstore.internal.Constants;
import io.smartspaces.scheduling.quartz.clusterstore.internal.db.OrientDbConnector;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.QueryHelper;

import com.orientechnologies.orient.core.record.impl.ODocument;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Markers recording which groups are paused.
 *
 * <p>
 * A group is paused if its marker exists. Adding and removing markers is safe
 * to race with other nodes.
 */
public abstract class PausedGroupsDao {

  private final OrientDbConnector connector;

  private final QueryHelper queryHelper;

  private final String className;

  protected final String schedulerName;

  protected PausedGroupsDao(OrientDbConnector connector, QueryHelper queryHelper,
      String className, String schedulerName) {
    this.connector = connector;
    this.queryHelper = queryHelper;
    this.className = className;
    this.schedulerName = schedulerName;
  }

  /**
   * Get the ID of the marker for a group.
   *
   * @param group
   *          the group
   *
   * @return the marker ID
   */
  protected abstract String markerId(String group);

  /**
   * Get all paused groups, including any marker for all groups being paused.
   *
   * @return the groups
   */
  public Set<String> getPausedGroups() {
    return new HashSet<String>(queryHelper.queryStrings("select " + Constants.KEY_GROUP
        + " from " + className + " where " + Constants.SCHEDULER_NAME + " = ?",
        Constants.KEY_GROUP, schedulerName));
  }

  public boolean isPaused(String group) {
    return queryHelper.findById(className, markerId(group)) != null;
  }

  public void pauseGroups(Collection<String> groups) {
    if (groups == null) {
      throw new IllegalArgumentException("groups cannot be null!");
    }

    for (String group : groups) {
      ODocument marker = new ODocument(className);
      marker.field(Constants.DOCUMENT_ID, markerId(group));
      marker.field(Constants.SCHEDULER_NAME, schedulerName);
      marker.field(Constants.KEY_GROUP, group);
      connector.insertIfAbsent(marker);
    }
  }

  public void unpauseGroups(Collection<String> groups) {
    for (String group : groups) {
      ODocument marker = queryHelper.findById(className, markerId(group));
      if (marker != null) {
        connector.deleteIfCurrent(marker);
      }
    }
  }

  public void removeAll() {
    for (ODocument marker : queryHelper.query("select from " + className + " where "
        + Constants.SCHEDULER_NAME + " = ?", schedulerName)) {
      connector.getConnection().delete(marker);
    }
  }
}
