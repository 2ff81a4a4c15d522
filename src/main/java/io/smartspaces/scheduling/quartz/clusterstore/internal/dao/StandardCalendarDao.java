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
import io.smartspaces.scheduling.quartz.clusterstore.internal.db.OrientDbSchema;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.Keys;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.QueryHelper;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.SerialUtils;

import com.orientechnologies.orient.core.record.impl.ODocument;
import org.quartz.Calendar;
import org.quartz.JobPersistenceException;
import org.quartz.ObjectAlreadyExistsException;
import org.quartz.spi.ClassLoadHelper;

import java.util.List;

public class StandardCalendarDao {

  private final OrientDbConnector connector;

  private final OrientDbSchema schema;

  private final QueryHelper queryHelper;

  private final ClassLoadHelper loadHelper;

  private final String schedulerName;

  public StandardCalendarDao(OrientDbConnector connector, OrientDbSchema schema,
      QueryHelper queryHelper, ClassLoadHelper loadHelper, String schedulerName) {
    this.connector = connector;
    this.schema = schema;
    this.queryHelper = queryHelper;
    this.loadHelper = loadHelper;
    this.schedulerName = schedulerName;
  }

  public int getCount() {
    return (int) queryHelper.count("select count(*) as count from " + schema.getCalendarClass()
        + " where " + Constants.SCHEDULER_NAME + " = ?", schedulerName);
  }

  public List<String> getNames() {
    return queryHelper.queryStrings("select " + Constants.CALENDAR_NAME + " from "
        + schema.getCalendarClass() + " where " + Constants.SCHEDULER_NAME + " = ?",
        Constants.CALENDAR_NAME, schedulerName);
  }

  public boolean exists(String calName) {
    return find(calName) != null;
  }

  public boolean remove(String calName) {
    ODocument calendar = find(calName);
    if (calendar != null) {
      connector.getConnection().delete(calendar);
      return true;
    }

    return false;
  }

  public Calendar retrieveCalendar(String calName) throws JobPersistenceException {
    if (calName != null) {
      ODocument calendar = find(calName);
      if (calendar != null) {
        byte[] serializedCalendar = calendar.field(Constants.CALENDAR_SERIALIZED_OBJECT);
        return SerialUtils.deserialize(serializedCalendar, Calendar.class,
            loadHelper.getClassLoader());
      }
    }
    return null;
  }

  /**
   * Store a calendar.
   *
   * @param name
   *          name of the calendar
   * @param calendar
   *          the calendar
   * @param replaceExisting
   *          {@code true} if an existing calendar of the same name is replaced
   *
   * @throws ObjectAlreadyExistsException
   *           the calendar exists and is not to be replaced
   * @throws JobPersistenceException
   *           the calendar could not be serialized
   */
  public void store(String name, Calendar calendar, boolean replaceExisting)
      throws JobPersistenceException {
    ODocument doc = find(name);
    if (doc != null) {
      if (!replaceExisting) {
        throw new ObjectAlreadyExistsException(
            "Calendar with name '" + name + "' already exists.");
      }
    } else {
      doc = new ODocument(schema.getCalendarClass());
    }

    doc.field(Constants.DOCUMENT_ID, Keys.calendarId(schedulerName, name));
    doc.field(Constants.SCHEDULER_NAME, schedulerName);
    doc.field(Constants.CALENDAR_NAME, name);
    doc.field(Constants.CALENDAR_CLASS, calendar.getClass().getName());
    doc.field(Constants.CALENDAR_SERIALIZED_OBJECT, SerialUtils.serialize(calendar));

    connector.getConnection().save(doc);
  }

  public void removeAll() {
    for (ODocument calendar : queryHelper.query("select from " + schema.getCalendarClass()
        + " where " + Constants.SCHEDULER_NAME + " = ?", schedulerName)) {
      connector.getConnection().delete(calendar);
    }
  }

  private ODocument find(String name) {
    return queryHelper.findById(schema.getCalendarClass(), Keys.calendarId(schedulerName, name));
  }
}
