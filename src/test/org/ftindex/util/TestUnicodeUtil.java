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

import java.util.Random;

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class TestUnicodeUtil extends FTIndexTestCase {

  @Test
  public void testUTF8RoundTrip() throws Exception {
    Random random = newRandom();
    final BytesRef utf8 = new BytesRef(10);
    for(int iter=0;iter<1000*RANDOM_MULTIPLIER;iter++) {
      final String s = _TestUtil.randomUnicodeString(random, 20);
      UnicodeUtil.UTF16toUTF8(s, 0, s.length(), utf8);
      final byte[] expected = s.getBytes("UTF-8");
      assertEquals(expected.length, utf8.length);
      for(int i=0;i<expected.length;i++) {
        assertEquals(expected[i], utf8.bytes[utf8.offset + i]);
      }
      assertEquals(s, utf8.utf8ToString());
    }
  }

  @Test
  public void testUnpairedSurrogate() {
    final BytesRef utf8 = new BytesRef();
    UnicodeUtil.UTF16toUTF8("a\ud800", 0, 2, utf8);
    assertEquals(4, utf8.length);
    assertEquals("a\ufffd", utf8.utf8ToString());
  }

  @Test
  public void testBytesRefOrder() {
    // bytes compare as unsigned
    final BytesRef a = new BytesRef(new byte[] {(byte) 0x7f});
    final BytesRef b = new BytesRef(new byte[] {(byte) 0x80});
    assertTrue(a.compareTo(b) < 0);
    assertTrue(new BytesRef("ab").compareTo(new BytesRef("abc")) < 0);
    assertEquals(0, new BytesRef("abc").compareTo(new BytesRef("abc")));
  }

  @Test
  public void testCharsRef() {
    final CharsRef chars = new CharsRef("foobar");
    assertEquals(6, chars.length());
    assertEquals('b', chars.charAt(3));
    assertEquals("oba", chars.subSequence(2, 5).toString());
    final CharsRef copy = CharsRef.deepCopyOf(chars);
    assertEquals(chars, copy);
    assertArrayEquals(new char[] {'f', 'o', 'o', 'b', 'a', 'r'},
                      ArrayUtil.copyOfSubArray(copy.chars, copy.offset, copy.offset + copy.length));
  }
}
