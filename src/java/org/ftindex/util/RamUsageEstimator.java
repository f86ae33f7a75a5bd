package org.ftindex.util;

/**
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;

/**
 * Best guess estimates of the heap used by objects and arrays.
 * The numbers are approximations; they are only used to decide
 * whether a cache is worth its memory and to report sizes.
 */
public final class RamUsageEstimator {

  private RamUsageEstimator() {} // no instance

  public final static int NUM_BYTES_BOOLEAN = 1;
  public final static int NUM_BYTES_BYTE = 1;
  public final static int NUM_BYTES_CHAR = 2;
  public final static int NUM_BYTES_SHORT = 2;
  public final static int NUM_BYTES_INT = 4;
  public final static int NUM_BYTES_FLOAT = 4;
  public final static int NUM_BYTES_LONG = 8;
  public final static int NUM_BYTES_DOUBLE = 8;

  /** Size of an object reference, assuming compressed oops on 64 bit JVMs. */
  public final static int NUM_BYTES_OBJECT_REF = 4;

  public final static int NUM_BYTES_OBJECT_HEADER = Constants.JRE_IS_64BIT ? 12 : 8;

  public final static int NUM_BYTES_ARRAY_HEADER = NUM_BYTES_OBJECT_HEADER + NUM_BYTES_INT;

  public final static int NUM_BYTES_OBJECT_ALIGNMENT = 8;

  /** Aligns an object size to be the next multiple of {@link #NUM_BYTES_OBJECT_ALIGNMENT}. */
  public static long alignObjectSize(long size) {
    size += (long) NUM_BYTES_OBJECT_ALIGNMENT - 1L;
    return size - (size % NUM_BYTES_OBJECT_ALIGNMENT);
  }

  public static long sizeOf(byte[] arr) {
    return alignObjectSize((long) NUM_BYTES_ARRAY_HEADER + arr.length);
  }

  public static long sizeOf(char[] arr) {
    return alignObjectSize((long) NUM_BYTES_ARRAY_HEADER + (long) NUM_BYTES_CHAR * arr.length);
  }

  public static long sizeOf(int[] arr) {
    return alignObjectSize((long) NUM_BYTES_ARRAY_HEADER + (long) NUM_BYTES_INT * arr.length);
  }

  /** Size of an object array of the given length, not counting the referenced objects. */
  public static long shallowSizeOfArray(int length) {
    return alignObjectSize((long) NUM_BYTES_ARRAY_HEADER + (long) NUM_BYTES_OBJECT_REF * length);
  }

  /**
   * Returns the shallow instance size in bytes an instance of the given class would occupy:
   * the header plus every non-static field declared by the class and its super classes.
   */
  public static long shallowSizeOfInstance(Class<?> clazz) {
    long size = NUM_BYTES_OBJECT_HEADER;
    for (Class<?> c = clazz; c != null; c = c.getSuperclass()) {
      for (Field f : c.getDeclaredFields()) {
        if (!Modifier.isStatic(f.getModifiers())) {
          size += primitiveSize(f.getType());
        }
      }
    }
    return alignObjectSize(size);
  }

  private static int primitiveSize(Class<?> type) {
    if (type == boolean.class || type == byte.class) {
      return NUM_BYTES_BYTE;
    } else if (type == char.class || type == short.class) {
      return NUM_BYTES_CHAR;
    } else if (type == int.class || type == float.class) {
      return NUM_BYTES_INT;
    } else if (type == long.class || type == double.class) {
      return NUM_BYTES_LONG;
    } else {
      return NUM_BYTES_OBJECT_REF;
    }
  }
}
