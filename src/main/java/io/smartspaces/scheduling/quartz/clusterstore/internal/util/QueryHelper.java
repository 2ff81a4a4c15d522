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

package io.smartspaces.scheduling.quartz.clusterstore.internal.util;

import io.smartspaces.scheduling.quartz.clusterstore.internal.Constants;
import io.smartspaces.scheduling.quartz.clusterstore.internal.db.OrientDbConnector;

import com.orientechnologies.orient.core.record.impl.ODocument;
import com.orientechnologies.orient.core.sql.executor.OResult;
import com.orientechnologies.orient.core.sql.executor.OResultSet;
import org.quartz.JobPersistenceException;
import org.quartz.impl.matchers.GroupMatcher;
import org.quartz.impl.matchers.StringMatcher.StringOperatorName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Helpers for querying and updating documents.
 *
 * <p>
 * All arguments are passed as query parameters.
 */
public class QueryHelper {

  private static final Logger LOG = LoggerFactory.getLogger(QueryHelper.class);

  /**
   * How many times a document is re-read and updated before giving up.
   */
  public static final int MAX_UPDATE_ATTEMPTS = 3;

  private final OrientDbConnector connector;

  public QueryHelper(OrientDbConnector connector) {
    this.connector = connector;
  }

  /**
   * Run a query returning whole documents.
   *
   * @param sql
   *          the query
   * @param args
   *          the positional arguments
   *
   * @return the documents found
   */
  public List<ODocument> query(String sql, Object... args) {
    List<ODocument> documents = new ArrayList<ODocument>();
    try (OResultSet results = connector.getConnection().query(sql, args)) {
      while (results.hasNext()) {
        OResult result = results.next();
        if (result.isElement()) {
          documents.add((ODocument) result.getElement().get());
        }
      }
    }

    return documents;
  }

  /**
   * Run a query expected to return at most one document.
   *
   * @return the document, or {@code null} if none
   */
  public ODocument queryOne(String sql, Object... args) {
    List<ODocument> documents = query(sql, args);
    if (!documents.isEmpty()) {
      return documents.get(0);
    } else {
      return null;
    }
  }

  /**
   * Find a document by its ID.
   *
   * @param className
   *          the class the document is in
   * @param documentId
   *          the document ID
   *
   * @return the document, or {@code null} if there is none
   */
  public ODocument findById(String className, String documentId) {
    return queryOne("select from " + className + " where " + Constants.DOCUMENT_ID + " = ?",
        documentId);
  }

  /**
   * Run a query projecting a single string field.
   *
   * @param sql
   *          the query
   * @param field
   *          the name of the projected field
   * @param args
   *          the positional arguments
   *
   * @return the non-null values found
   */
  public List<String> queryStrings(String sql, String field, Object... args) {
    List<String> values = new ArrayList<String>();
    try (OResultSet results = connector.getConnection().query(sql, args)) {
      while (results.hasNext()) {
        Object value = results.next().getProperty(field);
        if (value != null) {
          values.add(value.toString());
        }
      }
    }

    return values;
  }

  /**
   * Run a query of the form {@code select count(*) as count from ...}.
   *
   * @return the count
   */
  public long count(String sql, Object... args) {
    try (OResultSet results = connector.getConnection().query(sql, args)) {
      if (results.hasNext()) {
        Number count = results.next().getProperty("count");
        if (count != null) {
          return count.longValue();
        }
      }
    }

    return 0;
  }

  /**
   * Read a document and apply an update to it, trying again if another writer
   * changed the document in between.
   *
   * @param className
   *          the class the document is in
   * @param documentId
   *          the ID of the document
   * @param update
   *          the update to apply
   *
   * @return {@code true} if the document was changed, {@code false} if it is
   *         gone or the update did not apply
   *
   * @throws JobPersistenceException
   *           the document kept changing underneath the update
   */
  public boolean updateWithRetry(String className, String documentId, DocumentUpdate update)
      throws JobPersistenceException {
    for (int attempt = 1; attempt <= MAX_UPDATE_ATTEMPTS; attempt++) {
      if (attempt > 1) {
        connector.clearLocalCache();
      }

      ODocument document = findById(className, documentId);
      if (document == null || !update.apply(document)) {
        return false;
      }

      if (connector.saveIfCurrent(document)) {
        return true;
      }

      LOG.debug("Update of {} collided with another writer, attempt {}", documentId, attempt);
    }

    throw new JobPersistenceException("Could not update " + documentId + " after "
        + MAX_UPDATE_ATTEMPTS + " attempts, it keeps being changed by another writer");
  }

  /**
   * Find the groups among the given ones that a matcher accepts.
   *
   * @param groups
   *          the candidate groups
   * @param matcher
   *          the matcher
   *
   * @return the matching groups
   */
  public static Set<String> matchingGroups(Collection<String> groups, GroupMatcher<?> matcher) {
    StringOperatorName operator = matcher.getCompareWithOperator();
    String compareTo = matcher.getCompareToValue();

    Set<String> matching = new TreeSet<String>();
    for (String group : groups) {
      if (operator.evaluate(group, compareTo)) {
        matching.add(group);
      }
    }

    return matching;
  }

  /**
   * An update applied to a freshly read document.
   */
  public interface DocumentUpdate {

    /**
     * Change the document.
     *
     * @param document
     *          the document as currently stored
     *
     * @return {@code true} if the document was changed and should be saved
     *
     * @throws JobPersistenceException
     *           the update could not be computed
     */
    boolean apply(ODocument document) throws JobPersistenceException;
  }
}
