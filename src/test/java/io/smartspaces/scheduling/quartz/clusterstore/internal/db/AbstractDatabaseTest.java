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


package io.smartspaces.scheduling.quartz.clusterstore.internal.db;

import io.smartspaces.scheduling.quartz.clusterstore.internal.db.OrientDbConnector.TransactionMethod;
import io.smartspaces.scheduling.quartz.clusterstore.internal.util.QueryHelper;

import com.orientechnologies.orient.core.db.OrientDB;
import com.orientechnologies.orient.core.db.OrientDBConfig;
import org.junit.After;
import org.junit.AfterClass;
import org.junit.Before;
import org.junit.BeforeClass;
import org.quartz.JobPersistenceException;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Base for tests working directly against a fresh in-memory database.
 */
public abstract class AbstractDatabaseTest {

  protected static final String SCHEDULER_NAME = "testScheduler";

  private static final AtomicInteger DATABASE_COUNTER = new AtomicInteger();

  private static OrientDB orientDb;

  protected String dbName;

  protected OrientDbSchema schema;

  protected StandardOrientDbConnector connector;

  protected QueryHelper queryHelper;

  @BeforeClass
  public static void setUpOrientDb() {
    orientDb = new OrientDB("embedded:./target/orientdb-internal", OrientDBConfig.defaultConfig());
  }

  @AfterClass
  public static void tearDownOrientDb() {
    orientDb.close();
  }

  @Before
  public void setUpConnector() throws Exception {
    dbName = getClass().getSimpleName() + "_" + DATABASE_COUNTER.incrementAndGet();
    schema = new OrientDbSchema("quartz_");
    connector = StandardOrientDbConnector.builder().withOrientDb(orientDb)
        .withCredentials("quartz", "quartz").withDatabaseName(dbName)
        .withDatabaseType("memory").withSchema(schema).build();
    queryHelper = new QueryHelper(connector);
  }

  @After
  public void tearDownConnector() {
    connector.shutdown();
    if (orientDb.exists(dbName)) {
      orientDb.drop(dbName);
    }
  }

  protected <T> T inSession(TransactionMethod<T> method) throws JobPersistenceException {
    return connector.doWithoutTransaction(method);
  }
}
