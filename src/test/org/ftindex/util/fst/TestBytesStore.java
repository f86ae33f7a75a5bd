package org.ftindex.util.fst;

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

import java.util.Random;

import org.ftindex.store.ByteArrayDataInput;
import org.ftindex.store.ByteArrayDataOutput;
import org.ftindex.store.CorruptDataException;
import org.ftindex.util.FTIndexTestCase;
import org.ftindex.util._TestUtil;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class TestBytesStore extends FTIndexTestCase {

  @Test
  public void testRandom() throws Exception {
    final Random random = newRandom();
    final int iters = 10*RANDOM_MULTIPLIER;
    for(int iter=0;iter<iters;iter++) {
      final int numBytes = _TestUtil.nextInt(random, 1, 100000);
      final byte[] expected = new byte[numBytes];
      final int blockBits = _TestUtil.nextInt(random, 8, 15);
      final BytesStore bytes = new BytesStore(blockBits);
      if (VERBOSE) {
        System.out.println("TEST: iter=" + iter + " numBytes=" + numBytes + " blockBits=" + blockBits);
      }

      int pos = 0;
      while(pos < numBytes) {
        int op = random.nextInt(6);
        switch(op) {

        case 0:
          {
            // write random byte
            byte b = (byte) random.nextInt(256);
            expected[pos++] = b;
            bytes.writeByte(b);
          }
          break;

        case 1:
          {
            // write random byte[]
            int len = random.nextInt(Math.min(numBytes - pos, 100));
            byte[] temp = new byte[len];
            random.nextBytes(temp);
            System.arraycopy(temp, 0, expected, pos, temp.length);
            bytes.writeBytes(temp, 0, temp.length);
            pos += len;
          }
          break;

        case 2:
          {
            // reverse bytes
            if (pos > 1) {
              int len = _TestUtil.nextInt(random, 2, Math.min(100, pos));
              int start;
              if (len == pos) {
                start = 0;
              } else {
                start = random.nextInt(pos - len);
              }
              int end = start + len - 1;
              bytes.reverse(start, end);
              while(start <= end) {
                byte b = expected[end];
                expected[end] = expected[start];
                expected[start] = b;
                start++;
                end--;
              }
            }
          }
          break;

        case 3:
          {
            // abs write random byte[]
            if (pos > 2) {
              int randomPos = random.nextInt(pos-1);
              int len = _TestUtil.nextInt(random, 1, Math.min(pos - randomPos - 1, 100));
              byte[] temp = new byte[len];
              random.nextBytes(temp);
              System.arraycopy(temp, 0, expected, randomPos, temp.length);
              bytes.writeBytes(randomPos, temp, 0, temp.length);
            }
          }
          break;

        case 4:
          {
            // copyBytes
            if (pos > 1) {
              int src = random.nextInt(pos-1);
              int dest = _TestUtil.nextInt(random, src+1, pos-1);
              int len = _TestUtil.nextInt(random, 1, Math.min(300, pos - dest));
              System.arraycopy(expected, src, expected, dest, len);
              bytes.copyBytes(src, dest, len);
            }
          }
          break;

        case 5:
          {
            // skip
            int len = random.nextInt(Math.min(100, numBytes - pos));
            pos += len;
            bytes.skipBytes(len);
          }
          break;
        }

        assertEquals(pos, bytes.getPosition());
      }

      bytes.finish();
      verify(random, bytes, expected, numBytes);

      // round trip through a DataOutput and the loading constructor
      final ByteArrayDataOutput out = new ByteArrayDataOutput(numBytes);
      bytes.writeTo(out);
      assertEquals(numBytes, out.getPosition());
      final int maxBlockSize = 1 << _TestUtil.nextInt(random, 8, 15);
      final BytesStore loaded = new BytesStore(new ByteArrayDataInput(out.getBytes(), 0, numBytes), numBytes, maxBlockSize);
      assertEquals(numBytes, loaded.getPosition());
      verify(random, loaded, expected, numBytes);
    }
  }

  private void verify(Random random, BytesStore bytes, byte[] expected, int totalLength) throws Exception {
    assertEquals(totalLength, bytes.getPosition());
    if (totalLength == 0) {
      return;
    }

    // sequential reads, from the end to the start
    final FST.BytesReader r = bytes.getReverseReader(random.nextBoolean());
    r.setPosition(totalLength-1);
    for(int i=totalLength-1;i>=0;i--) {
      assertEquals("pos=" + i, expected[i], r.readByte());
    }

    // random seeks, with skips in both directions
    final int numOps = _TestUtil.nextInt(random, 100, 200);
    for(int op=0;op<numOps;op++) {
      int pos = random.nextInt(totalLength);
      r.setPosition(pos);
      assertEquals(pos, r.getPosition());
      final int len = _TestUtil.nextInt(random, 1, Math.min(pos+1, 50));
      for(int i=0;i<len;i++) {
        assertEquals(expected[pos-i], r.readByte());
      }
      if (pos >= len) {
        // skipping backwards puts us back where we started
        r.skipBytes(-len);
        assertEquals(pos, r.getPosition());
        assertEquals(expected[pos], r.readByte());
      }
    }
  }

  @Test
  public void testReadBeforeStart() throws Exception {
    for(boolean allowSingle : new boolean[] {true, false}) {
      final BytesStore bytes = new BytesStore(8);
      bytes.writeBytes(new byte[] {1, 2, 3}, 0, 3);
      bytes.finish();
      final FST.BytesReader r = bytes.getReverseReader(allowSingle);
      r.setPosition(1);
      assertEquals(2, r.readByte());
      assertEquals(1, r.readByte());
      try {
        r.readByte();
        fail("did not hit exception");
      } catch (CorruptDataException cde) {
        // expected
      }
    }
  }

  @Test
  public void testInvalidBlockBits() {
    try {
      new BytesStore(31);
      fail("did not hit exception");
    } catch (IllegalArgumentException iae) {
      // expected
    }
  }
}
