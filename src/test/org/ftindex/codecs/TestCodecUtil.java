package org.ftindex.codecs;

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

import org.ftindex.store.ByteArrayDataInput;
import org.ftindex.store.ByteArrayDataOutput;
import org.ftindex.store.CorruptDataException;
import org.ftindex.util.FTIndexTestCase;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class TestCodecUtil extends FTIndexTestCase {

  private static byte[] header(String codec, int version) throws Exception {
    final ByteArrayDataOutput out = new ByteArrayDataOutput(32);
    CodecUtil.writeHeader(out, codec, version);
    assertEquals(CodecUtil.headerLength(codec), out.getPosition());
    return out.toByteArray();
  }

  @Test
  public void testHeader() throws Exception {
    final byte[] bytes = header("FST", 6);
    assertEquals(6, CodecUtil.checkHeader(new ByteArrayDataInput(bytes), "FST", 6, 6));
    assertEquals(6, CodecUtil.checkHeader(new ByteArrayDataInput(bytes), "FST", 3, 7));
  }

  @Test
  public void testWrongCodec() throws Exception {
    try {
      CodecUtil.checkHeader(new ByteArrayDataInput(header("FSA", 6)), "FST", 6, 6);
      fail("did not hit exception");
    } catch (CorruptDataException cde) {
      // expected
    }
  }

  @Test
  public void testWrongVersion() throws Exception {
    for(int version : new int[] {5, 7}) {
      try {
        CodecUtil.checkHeader(new ByteArrayDataInput(header("FST", version)), "FST", 6, 6);
        fail("did not hit exception");
      } catch (CorruptDataException cde) {
        // expected
      }
    }
  }

  @Test
  public void testBadMagic() throws Exception {
    final byte[] bytes = header("FST", 6);
    bytes[0] ^= 0x11;
    try {
      CodecUtil.checkHeader(new ByteArrayDataInput(bytes), "FST", 6, 6);
      fail("did not hit exception");
    } catch (CorruptDataException cde) {
      // expected
    }
  }

  @Test
  public void testNonAsciiCodec() throws Exception {
    try {
      header("F\u00e9T", 6);
      fail("did not hit exception");
    } catch (IllegalArgumentException iae) {
      // expected
    }
  }
}
