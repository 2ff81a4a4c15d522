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

import com.orientechnologies.orient.core.db.ODatabaseSession;
import com.orientechnologies.orient.core.record.impl.ODocument;
import org.quartz.JobPersistenceException;

/**
 * The connector to the OrientDB database.
 *
 * <p>
 * Work is done inside a {@link TransactionMethod}. The connector binds a
 * database session to the calling thread for the duration of the method. A
 * method started while a session is already bound joins that session.
 *
 * @author Keith M. HUghes
 */
public interface OrientDbConnector {

  void shutdown();

  /**
   * Get the connection bound to the current thread.
   *
   * @return the connection
   *
   * @throws IllegalStateException
   *           there is no connection bound to the thread
   */
  ODatabaseSession getConnection();

  /**
   * Do a method in a transaction.
   *
   * <p>
   * If the transaction fails to commit because another node changed one of its
   * documents, the method is run again, a small number of times.
   *
   * @param method
   *          the method to run in the transaction
   *
   * @return the result of the method
   *
   * @throws JobPersistenceException
   *           something bad happened
   */
  <T> T doInTransaction(TransactionMethod<T> method) throws JobPersistenceException;

  /**
   * Do a method without a transaction. Every save is applied on its own.
   *
   * @param method
   *          the method to run
   *
   * @return the result of the method
   *
   * @throws JobPersistenceException
   *           something bad happened
   */
  <T> T doWithoutTransaction(TransactionMethod<T> method) throws JobPersistenceException;

  /**
   * Save a document if nobody has changed it since it was read.
   *
   * <p>
   * Only meaningful outside of a transaction.
   *
   * @param document
   *          the document to save
   *
   * @return {@code true} if the document was saved, {@code false} if another
   *         writer got there first
   */
  boolean saveIfCurrent(ODocument document);

  /**
   * Insert a new document unless one with the same ID already exists.
   *
   * @param document
   *          the new document
   *
   * @return {@code true} if the document was inserted
   */
  boolean insertIfAbsent(ODocument document);

  /**
   * Delete a document if nobody has changed it since it was read.
   *
   * @param document
   *          the document to delete
   *
   * @return {@code true} if the document was deleted
   */
  boolean deleteIfCurrent(ODocument document);

  /**
   * Forget any records cached by the current session so the next read comes
   * from storage.
   */
  void clearLocalCache();

  public interface TransactionMethod<T> {
    T doInTransaction() throws JobPersistenceException;
  }
}
