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

import org.ftindex.util.BytesRef;

/** DataInput over a slice of a byte[]. Reading past the
 *  limit throws {@link CorruptDataException}. */
public final class ByteArrayDataInput extends DataInput {

  private byte[] bytes;

  private int pos;
  private int limit;

  public ByteArrayDataInput(byte[] bytes) {
    reset(bytes);
  }

  public ByteArrayDataInput(byte[] bytes, int offset, int len) {
    reset(bytes, offset, len);
  }

  public ByteArrayDataInput() {
    reset(BytesRef.EMPTY_BYTES);
  }

  public void reset(byte[] bytes) {
    reset(bytes, 0, bytes.length);
  }

  public void reset(byte[] bytes, int offset, int len) {
    this.bytes = bytes;
    pos = offset;
    limit = offset + len;
  }

  public int getPosition() {
    return pos;
  }

  public void setPosition(int pos) {
    this.pos = pos;
  }

  public boolean eof() {
    return pos == limit;
  }

  @Override
  public void skipBytes(long count) throws CorruptDataException {
    if (count < 0 || pos + count > limit) {
      throw new CorruptDataException("cannot skip " + count + " bytes: pos=" + pos + " limit=" + limit);
    }
    pos += (int) count;
  }

  @Override
  public byte readByte() throws CorruptDataException {
    checkBounds(1);
    return bytes[pos++];
  }

  @Override
  public void readBytes(byte[] b, int offset, int len) throws CorruptDataException {
    checkBounds(len);
    System.arraycopy(bytes, pos, b, offset, len);
    pos += len;
  }

  private void checkBounds(int len) throws CorruptDataException {
    if (pos + len > limit) {
      throw new CorruptDataException("read past EOF: pos=" + pos + " len=" + len + " limit=" + limit);
    }
  }
}
