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

import org.apache.commons.codec.binary.Base64;
import org.quartz.JobDataMap;
import org.quartz.JobPersistenceException;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.NotSerializableException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.ObjectStreamClass;
import java.util.Collections;
import java.util.Map;

/**
 * Useful methods for serializing items.
 */
public class SerialUtils {

  private static final String SERIALIZE_MESSAGE_FORMAT =
      "Unable to serialize JobDataMap for insertion into "
          + "database because the value of property '%s' " + "is not serializable: %s";

  /**
   * Serialize an object with Java serialization.
   *
   * @param object
   *          the object to serialize
   *
   * @return the serialized bytes
   *
   * @throws JobPersistenceException
   *           the object could not be serialized
   */
  public static byte[] serialize(Object object) throws JobPersistenceException {
    ByteArrayOutputStream byteStream = new ByteArrayOutputStream();
    try {
      ObjectOutputStream objectStream = new ObjectOutputStream(byteStream);
      objectStream.writeObject(object);
      objectStream.close();
      return byteStream.toByteArray();
    } catch (IOException e) {
      throw new JobPersistenceException(
          "Could not serialize " + object.getClass().getName() + ".", e);
    }
  }

  /**
   * Deserialize an object, resolving classes through the given class loader.
   *
   * @param serialized
   *          the serialized bytes
   * @param clazz
   *          the type expected
   * @param classLoader
   *          the class loader for resolving classes
   *
   * @return the deserialized object
   *
   * @throws JobPersistenceException
   *           the bytes could not be turned into an object of the desired type
   */
  public static <T> T deserialize(byte[] serialized, Class<T> clazz, ClassLoader classLoader)
      throws JobPersistenceException {
    if (serialized == null) {
      throw new JobPersistenceException("No serialized " + clazz.getName() + " found");
    }

    try {
      ObjectInputStream objectStream =
          new ClassLoaderObjectInputStream(new ByteArrayInputStream(serialized), classLoader);
      Object deserialized = objectStream.readObject();
      objectStream.close();
      if (clazz.isInstance(deserialized)) {
        return clazz.cast(deserialized);
      }

      throw new JobPersistenceException(
          "Deserialized object is not of the desired type " + clazz.getName());
    } catch (IOException | ClassNotFoundException e) {
      throw new JobPersistenceException("Could not deserialize " + clazz.getName(), e);
    }
  }

  /**
   * Serialize a job data map into a Base64 string.
   *
   * @param jobDataMap
   *          the map to serialize
   *
   * @return the encoded map
   *
   * @throws JobPersistenceException
   *           one of the values could not be serialized
   */
  public static String serialize(JobDataMap jobDataMap) throws JobPersistenceException {
    try {
      byte[] bytes = stringMapToBytes(jobDataMap.getWrappedMap());
      return Base64.encodeBase64String(bytes);
    } catch (NotSerializableException e) {
      String key = getKeyOfNonSerializableStringMapEntry(jobDataMap.getWrappedMap());
      throw new JobPersistenceException(String.format(SERIALIZE_MESSAGE_FORMAT, key, e.getMessage()),
          e);
    } catch (IOException e) {
      throw new JobPersistenceException("Could not serialize JobDataMap", e);
    }
  }

  /**
   * Read back a map written by {@link #serialize(JobDataMap)}.
   *
   * @param clob
   *          the encoded map, can be {@code null}
   * @param classLoader
   *          the class loader for resolving the values' classes
   *
   * @return the map contents
   *
   * @throws JobPersistenceException
   *           the map could not be read
   */
  public static Map<String, ?> deserializeJobData(String clob, ClassLoader classLoader)
      throws JobPersistenceException {
    if (clob == null || clob.isEmpty()) {
      return Collections.emptyMap();
    }

    try {
      byte[] bytes = Base64.decodeBase64(clob);
      return stringMapFromBytes(bytes, classLoader);
    } catch (IOException | ClassNotFoundException e) {
      throw new JobPersistenceException("Could not deserialize JobDataMap", e);
    }
  }

  private static byte[] stringMapToBytes(Object object) throws IOException {
    ByteArrayOutputStream baos = new ByteArrayOutputStream();
    ObjectOutputStream out = new ObjectOutputStream(baos);
    out.writeObject(object);
    out.flush();
    return baos.toByteArray();
  }

  private static Map<String, ?> stringMapFromBytes(byte[] bytes, ClassLoader classLoader)
      throws IOException, ClassNotFoundException {
    ObjectInputStream ois =
        new ClassLoaderObjectInputStream(new ByteArrayInputStream(bytes), classLoader);
    @SuppressWarnings("unchecked")
    Map<String, ?> map = (Map<String, ?>) ois.readObject();
    ois.close();
    return map;
  }

  private static String getKeyOfNonSerializableStringMapEntry(Map<String, ?> data) {
    for (Map.Entry<String, ?> entry : data.entrySet()) {
      ByteArrayOutputStream baos = new ByteArrayOutputStream();
      try {
        ObjectOutputStream out = new ObjectOutputStream(baos);
        out.writeObject(entry.getValue());
        out.flush();
      } catch (IOException e) {
        return entry.getKey();
      }
    }
    return null;
  }

  /**
   * An object stream that resolves classes through a specific class loader.
   */
  private static class ClassLoaderObjectInputStream extends ObjectInputStream {

    private final ClassLoader classLoader;

    ClassLoaderObjectInputStream(InputStream in, ClassLoader classLoader) throws IOException {
      super(in);
      this.classLoader = classLoader;
    }

    @Override
    protected Class<?> resolveClass(ObjectStreamClass desc)
        throws IOException, ClassNotFoundException {
      if (classLoader != null) {
        try {
          return Class.forName(desc.getName(), false, classLoader);
        } catch (ClassNotFoundException e) {
          // Primitive and JDK types are resolved by the default lookup.
          return super.resolveClass(desc);
        }
      }
      return super.resolveClass(desc);
    }
  }
}
