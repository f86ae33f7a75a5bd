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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.util.Random;

import org.ftindex.util.FTIndexTestCase;
import org.ftindex.util._TestUtil;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestDataInputOutput extends FTIndexTestCase {

  @Test
  public void testRandomValues() throws Exception {
    Random random = newRandom();
    final int count = 1000*RANDOM_MULTIPLIER;
    final int[] vInts = new int[count];
    final long[] vLongs = new long[count];
    final String[] strings = new String[count];
    final ByteArrayDataOutput out = new ByteArrayDataOutput(16);
    for(int i=0;i<count;i++) {
      vInts[i] = random.nextInt(Integer.MAX_VALUE);
      vLongs[i] = random.nextLong() & Long.MAX_VALUE;
      strings[i] = _TestUtil.randomUnicodeString(random, 10);
      out.writeVInt(vInts[i]);
      out.writeVLong(vLongs[i]);
      out.writeString(strings[i]);
      out.writeShort((short) vInts[i]);
      out.writeLong(vLongs[i]);
    }

    final ByteArrayDataInput in = new ByteArrayDataInput(out.getBytes(), 0, out.getPosition());
    for(int i=0;i<count;i++) {
      assertEquals(vInts[i], in.readVInt());
      assertEquals(vLongs[i], in.readVLong());
      assertEquals(strings[i], in.readString());
      assertEquals((short) vInts[i], in.readShort());
      assertEquals(vLongs[i], in.readLong());
    }
    assertTrue(in.eof());
  }

  @Test
  public void testVIntLengths() throws Exception {
    final ByteArrayDataOutput out = new ByteArrayDataOutput(16);
    out.writeVInt(127);
    assertEquals(1, out.getPosition());
    out.writeVInt(128);
    assertEquals(3, out.getPosition());
    out.writeVLong(Long.MAX_VALUE);
    assertEquals(12, out.getPosition());
  }

  @Test
  public void testNegativeVLong() throws Exception {
    try {
      new ByteArrayDataOutput().writeVLong(-1);
      fail("did not hit exception");
    } catch (IllegalArgumentException iae) {
      // expected
    }
  }

  @Test
  public void testInvalidVInt() throws Exception {
    final byte[] bytes = new byte[] {(byte) 0xff, (byte) 0xff, (byte) 0xff, (byte) 0xff, (byte) 0x7f};
    try {
      new ByteArrayDataInput(bytes).readVInt();
      fail("did not hit exception");
    } catch (CorruptDataException cde) {
      // expected
    }
  }

  @Test
  public void testInvalidVLong() throws Exception {
    final byte[] bytes = new byte[9];
    for(int i=0;i<bytes.length;i++) {
      bytes[i] = (byte) 0xff;
    }
    try {
      new ByteArrayDataInput(bytes).readVLong();
      fail("did not hit exception");
    } catch (CorruptDataException cde) {
      // expected
    }
  }

  @Test
  public void testReadPastEnd() throws Exception {
    final ByteArrayDataInput in = new ByteArrayDataInput(new byte[] {1, 2, 3}, 1, 1);
    assertEquals(2, in.readByte());
    try {
      in.readByte();
      fail("did not hit exception");
    } catch (CorruptDataException cde) {
      // expected
    }
    try {
      in.skipBytes(1);
      fail("did not hit exception");
    } catch (CorruptDataException cde) {
      // expected
    }
  }

  @Test
  public void testStreams() throws Exception {
    final ByteArrayOutputStream bos = new ByteArrayOutputStream();
    final OutputStreamDataOutput out = new OutputStreamDataOutput(bos);
    out.writeVInt(300);
    out.writeString("foo");
    out.writeBytes(new byte[] {1, 2, 3, 4, 5}, 5);
    out.close();

    final InputStreamDataInput in = new InputStreamDataInput(new ByteArrayInputStream(bos.toByteArray()));
    assertEquals(300, in.readVInt());
    assertEquals("foo", in.readString());
    in.skipBytes(3);
    assertEquals(4, in.readByte());
    assertEquals(5, in.readByte());
    try {
      in.readByte();
      fail("did not hit exception");
    } catch (EOFException eofe) {
      // expected
    }
    in.close();
  }
}
