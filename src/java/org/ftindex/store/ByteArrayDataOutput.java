package org.ftindex.store;

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

import org.ftindex.util.ArrayUtil;
import org.ftindex.util.BytesRef;

/**
 * DataOutput backed by a byte array.  The array grows as
 * needed; use {@link #getBytes} and {@link #getPosition}
 * to get at what was written.
 */
public class ByteArrayDataOutput extends DataOutput {
  private byte[] bytes;

  private int pos;

  public ByteArrayDataOutput(int initialSize) {
    bytes = new byte[initialSize];
  }

  public ByteArrayDataOutput() {
    reset(BytesRef.EMPTY_BYTES);
  }

  public void reset(byte[] bytes) {
    this.bytes = bytes;
    pos = 0;
  }

  public int getPosition() {
    return pos;
  }

  public byte[] getBytes() {
    return bytes;
  }

  /** Returns a copy of the bytes written so far. */
  public byte[] toByteArray() {
    return ArrayUtil.copyOfSubArray(bytes, 0, pos);
  }

  @Override
  public void writeByte(byte b) {
    if (pos == bytes.length) {
      bytes = ArrayUtil.grow(bytes, pos + 1);
    }
    bytes[pos++] = b;
  }

  @Override
  public void writeBytes(byte[] b, int offset, int length) {
    bytes = ArrayUtil.grow(bytes, pos + length);
    System.arraycopy(b, offset, bytes, pos, length);
    pos += length;
  }
}
