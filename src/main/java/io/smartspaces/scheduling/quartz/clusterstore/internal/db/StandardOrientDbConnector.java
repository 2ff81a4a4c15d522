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

import io.smartspaces.scheduling.quartz.clusterstore.StoreUnavailableException;

import com.orientechnologies.common.concur.ONeedRetryException;
import com.orientechnologies.common.exception.OException;
import com.orientechnologies.orient.core.db.ODatabaseDocumentInternal;
import com.orientechnologies.orient.core.db.ODatabasePool;
import com.orientechnologies.orient.core.db.ODatabaseSession;
import com.orientechnologies.orient.core.db.OrientDB;
import com.orientechnologies.orient.core.db.OrientDBConfig;
import com.orientechnologies.orient.core.exception.OConcurrentModificationException;
import com.orientechnologies.orient.core.exception.ORecordNotFoundException;
import com.orientechnologies.orient.core.record.impl.ODocument;
import com.orientechnologies.orient.core.sql.executor.OResultSet;
import com.orientechnologies.orient.core.storage.ORecordDuplicatedException;
import org.quartz.JobPersistenceException;
import org.quartz.SchedulerConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;

/**
 * The responsibility of this class is create an OrientDB connection with given
 * parameters and to run work against it.
 */
public class StandardOrientDbConnector implements OrientDbConnector {

  private static final Logger LOG = LoggerFactory.getLogger(StandardOrientDbConnector.class);

  /**
   * The number of times a transaction is attempted when it collides with
   * another writer.
   */
  public static final int MAX_TRANSACTION_ATTEMPTS = 3;

  public static OrientDbConnectorBuilder builder() {
    return new OrientDbConnectorBuilder();
  }

  /**
   * The OrientDB context.
   */
  private OrientDB orientDb;

  /**
   * {@code true} if the context was created by this connector and must be
   * closed with it.
   */
  private boolean ownsOrientDb;

  /**
   * The pool of database connections.
   */
  private ODatabasePool pool;

  /**
   * The session bound to the current thread, if any.
   */
  private final ThreadLocal<ODatabaseSession> boundSession = new ThreadLocal<ODatabaseSession>();

  /**
   * Construct a new connector.
   *
   * <p>
   * The builder must be used.
   */
  private StandardOrientDbConnector() {
    // use the builder
  }

  @Override
  public void shutdown() {
    LOG.debug("Shutting down OrientDB connector");
    pool.close();
    if (ownsOrientDb) {
      orientDb.close();
    }
  }

  @Override
  public ODatabaseSession getConnection() {
    ODatabaseSession db = boundSession.get();
    if (db == null) {
      throw new IllegalStateException("No OrientDB session is bound to the current thread");
    }

    return db;
  }

  @Override
  public <T> T doInTransaction(TransactionMethod<T> method) throws JobPersistenceException {
    return doInSession(true, method);
  }

  @Override
  public <T> T doWithoutTransaction(TransactionMethod<T> method) throws JobPersistenceException {
    return doInSession(false, method);
  }

  @Override
  public boolean saveIfCurrent(ODocument document) {
    try {
      getConnection().save(document);
      return true;
    } catch (OConcurrentModificationException e) {
      LOG.debug("Document {} was changed by another writer", document.getIdentity());
      return false;
    } catch (ORecordNotFoundException e) {
      LOG.debug("Document {} was deleted by another writer", document.getIdentity());
      return false;
    }
  }

  @Override
  public boolean insertIfAbsent(ODocument document) {
    try {
      getConnection().save(document);
      return true;
    } catch (ORecordDuplicatedException e) {
      LOG.debug("Document already exists: {}", e.getMessage());
      return false;
    }
  }

  @Override
  public boolean deleteIfCurrent(ODocument document) {
    try {
      getConnection().delete(document);
      return true;
    } catch (OConcurrentModificationException e) {
      LOG.debug("Document {} was changed by another writer, not deleted", document.getIdentity());
      return false;
    } catch (ORecordNotFoundException e) {
      LOG.debug("Document {} was already deleted", document.getIdentity());
      return false;
    }
  }

  @Override
  public void clearLocalCache() {
    ((ODatabaseDocumentInternal) getConnection()).getLocalCache().clear();
  }

  /**
   * Run a method with a session bound to the thread.
   *
   * @param transactional
   *          {@code true} if the method should run in a transaction
   * @param method
   *          the method to run
   *
   * @return the result of the method
   *
   * @throws JobPersistenceException
   *           something bad happened
   */
  private <T> T doInSession(boolean transactional, TransactionMethod<T> method)
      throws JobPersistenceException {
    ODatabaseSession current = boundSession.get();
    if (current != null) {
      current.activateOnCurrentThread();
      return method.doInTransaction();
    }

    int attempt = 1;
    while (true) {
      ODatabaseSession db = acquireSession();
      boundSession.set(db);
      try {
        if (transactional) {
          db.begin();
        }

        T result = method.doInTransaction();

        if (transactional) {
          db.commit();
        }

        return result;
      } catch (ONeedRetryException e) {
        rollback(db, transactional);

        if (!transactional || attempt >= MAX_TRANSACTION_ATTEMPTS) {
          throw new JobPersistenceException(
              "Documents were changed by another writer, gave up after " + attempt + " attempts",
              e);
        }

        LOG.debug("Transaction collided with another writer, attempt {}", attempt);
        attempt++;
      } catch (ORecordDuplicatedException e) {
        rollback(db, transactional);

        throw new JobPersistenceException("Duplicate record: " + e.getMessage(), e);
      } catch (JobPersistenceException e) {
        rollback(db, transactional);

        throw e;
      } catch (OException e) {
        rollback(db, transactional);

        throw new StoreUnavailableException("OrientDB operation failed", e);
      } catch (RuntimeException e) {
        rollback(db, transactional);

        throw new JobPersistenceException("Database operation failed", e);
      } finally {
        boundSession.remove();
        db.close();
      }
    }
  }

  /**
   * Get a session from the pool.
   *
   * @return the session
   *
   * @throws StoreUnavailableException
   *           the pool could not supply a session
   */
  private ODatabaseSession acquireSession() throws StoreUnavailableException {
    try {
      ODatabaseSession db = pool.acquire();
      ((ODatabaseDocumentInternal) db).getLocalCache().clear();
      return db;
    } catch (OException e) {
      throw new StoreUnavailableException("Could not get an OrientDB session", e);
    }
  }

  private void rollback(ODatabaseSession db, boolean transactional) {
    if (!transactional) {
      return;
    }

    try {
      if (db.getTransaction().isActive()) {
        db.rollback();
      }
    } catch (OException e) {
      LOG.warn("Could not roll back transaction", e);
    }
  }

  public static class OrientDbConnectorBuilder {

    /**
     * Allowed characters for names placed into database commands.
     */
    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9_\\-]+");

    private StandardOrientDbConnector connector = new StandardOrientDbConnector();

    private OrientDB orientDb;
    private String orientdbUri;
    private String username;
    private String password;
    private String serverUsername;
    private String serverPassword;
    private String dbName;
    private String databaseType = "plocal";
    private OrientDbSchema schema;

    public StandardOrientDbConnector build() throws SchedulerConfigException {
      if (dbName == null || !SAFE_NAME.matcher(dbName).matches()) {
        throw new SchedulerConfigException("An OrientDB database name must be specified, got "
            + dbName);
      }
      if (username == null || !SAFE_NAME.matcher(username).matches()) {
        throw new SchedulerConfigException("Invalid OrientDB user name " + username);
      }
      if (password == null || password.indexOf('\'') >= 0) {
        throw new SchedulerConfigException("Invalid OrientDB password");
      }
      if (schema == null) {
        throw new SchedulerConfigException("No schema given for the OrientDB database");
      }

      connect();
      return connector;
    }

    /**
     * Use an existing OrientDB context rather than creating one from the URI.
     */
    public OrientDbConnectorBuilder withOrientDb(OrientDB orientDb) {
      this.orientDb = orientDb;
      return this;
    }

    public OrientDbConnectorBuilder withUri(String orientdbUri) {
      this.orientdbUri = orientdbUri;
      return this;
    }

    public OrientDbConnectorBuilder withCredentials(String username, String password) {
      this.username = username;
      this.password = password;
      return this;
    }

    public OrientDbConnectorBuilder withServerCredentials(String serverUsername,
        String serverPassword) {
      this.serverUsername = serverUsername;
      this.serverPassword = serverPassword;
      return this;
    }

    public OrientDbConnectorBuilder withDatabaseName(String dbName) {
      this.dbName = dbName;
      return this;
    }

    public OrientDbConnectorBuilder withDatabaseType(String databaseType) {
      this.databaseType = databaseType;
      return this;
    }

    public OrientDbConnectorBuilder withSchema(OrientDbSchema schema) {
      this.schema = schema;
      return this;
    }

    private void connect() throws SchedulerConfigException {
      if (orientDb != null) {
        if (orientdbUri != null) {
          throw new SchedulerConfigException(
              "Configure either a OrientDB instance or an OrientDB URI, not both.");
        }
        connector.orientDb = orientDb;
        connector.ownsOrientDb = false;
      } else {
        connector.orientDb = connectToOrientDb();
        connector.ownsOrientDb = true;
      }

      try {
        checkDataBaseExists();

        connector.pool = new ODatabasePool(connector.orientDb, dbName, username, password);

        ODatabaseSession db = connector.pool.acquire();
        try {
          schema.createIfAbsent(db);
        } finally {
          db.close();
        }
      } catch (OException e) {
        if (connector.ownsOrientDb) {
          connector.orientDb.close();
        }
        throw new SchedulerConfigException("OrientDB driver thrown an exception", e);
      }
    }

    private OrientDB connectToOrientDb() throws SchedulerConfigException {
      if (orientdbUri == null) {
        throw new SchedulerConfigException("An OrientDB URI must be specified.");
      }

      try {
        if (orientdbUri.startsWith("remote:")) {
          return new OrientDB(orientdbUri, serverUsername, serverPassword,
              OrientDBConfig.defaultConfig());
        } else {
          return new OrientDB(orientdbUri, OrientDBConfig.defaultConfig());
        }
      } catch (OException | IllegalArgumentException e) {
        throw new SchedulerConfigException("Could not connect to OrientDB at " + orientdbUri, e);
      }
    }

    /**
     * Create the database if necessary.
     */
    private void checkDataBaseExists() throws SchedulerConfigException {
      if (!SAFE_NAME.matcher(databaseType).matches()) {
        throw new SchedulerConfigException("Invalid OrientDB database type " + databaseType);
      }

      OrientDB context = connector.orientDb;
      if (context.exists(dbName)) {
        return;
      }

      LOG.info("Creating OrientDB database {} of type {}", dbName, databaseType);
      try {
        OResultSet result = context.execute("create database " + dbName + " " + databaseType
            + " users (" + username + " identified by '" + password + "' role admin)");
        result.close();
      } catch (OException e) {
        // Another node sharing the context may have created it first.
        if (!context.exists(dbName)) {
          throw e;
        }
      }
    }
  }
}
