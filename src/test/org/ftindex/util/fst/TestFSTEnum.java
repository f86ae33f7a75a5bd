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

import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

import org.ftindex.util.BytesRef;
import org.ftindex.util.FTIndexTestCase;
import org.ftindex.util.IntsRef;
import org.ftindex.util._TestUtil;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;

public class TestFSTEnum extends FTIndexTestCase {

  private static FST<Long> build(TreeMap<BytesRef,Long> pairs) throws Exception {
    final Builder<Long> builder = new Builder<Long>(FST.INPUT_TYPE.BYTE1, PositiveIntOutputs.getSingleton());
    final IntsRef scratch = new IntsRef();
    for(Map.Entry<BytesRef,Long> pair : pairs.entrySet()) {
      builder.add(Util.toIntsRef(pair.getKey(), scratch), pair.getValue());
    }
    return builder.finish();
  }

  private static void assertEntry(Map.Entry<BytesRef,Long> expected, BytesRefFSTEnum.InputOutput<Long> actual) {
    if (expected == null) {
      assertNull(actual);
    } else {
      assertNotNull("expected " + expected.getKey().utf8ToString(), actual);
      assertEquals(expected.getKey(), actual.input);
      assertEquals(expected.getValue(), actual.output);
    }
  }

  @Test
  public void testSeeks() throws Exception {
    final TreeMap<BytesRef,Long> pairs = new TreeMap<BytesRef,Long>();
    pairs.put(new BytesRef("cat"), 1L);
    pairs.put(new BytesRef("cats"), 2L);
    pairs.put(new BytesRef("dog"), 3L);
    pairs.put(new BytesRef("dogs"), 0L);
    final FST<Long> fst = build(pairs);
    final BytesRefFSTEnum<Long> fstEnum = new BytesRefFSTEnum<Long>(fst);

    assertNull(fstEnum.current());

    BytesRefFSTEnum.InputOutput<Long> result = fstEnum.seekCeil(new BytesRef("ca"));
    assertEquals("cat", result.input.utf8ToString());
    assertEquals(Long.valueOf(1), result.output);

    result = fstEnum.seekCeil(new BytesRef("catz"));
    assertEquals("dog", result.input.utf8ToString());
    assertEquals(Long.valueOf(3), fstEnum.current().output);

    result = fstEnum.next();
    assertEquals("dogs", result.input.utf8ToString());
    assertEquals(Long.valueOf(0), result.output);
    assertNull(fstEnum.next());
    assertNull(fstEnum.next());

    assertNull(fstEnum.seekCeil(new BytesRef("e")));
    assertNull(fstEnum.seekCeil(new BytesRef("dogsa")));

    result = fstEnum.seekCeil(new BytesRef(""));
    assertEquals("cat", result.input.utf8ToString());

    result = fstEnum.seekExact(new BytesRef("cats"));
    assertEquals("cats", result.input.utf8ToString());
    assertEquals(Long.valueOf(2), result.output);
    assertEquals("dog", fstEnum.next().input.utf8ToString());

    assertNull(fstEnum.seekExact(new BytesRef("do")));
    assertNull(fstEnum.current());
    // a failed exact seek starts over from the first input
    assertEquals("cat", fstEnum.next().input.utf8ToString());
  }

  @Test
  public void testRandomSeeks() throws Exception {
    final Random random = newRandom();
    for(int iter=0;iter<5*RANDOM_MULTIPLIER;iter++) {
      final TreeMap<BytesRef,Long> pairs = new TreeMap<BytesRef,Long>();
      final int numInputs = _TestUtil.nextInt(random, 1, 300);
      for(int i=0;i<numInputs;i++) {
        pairs.put(new BytesRef(_TestUtil.randomSimpleString(random, 8)), Long.valueOf(random.nextInt(50)));
      }
      final FST<Long> fst = build(pairs);
      final BytesRefFSTEnum<Long> fstEnum = new BytesRefFSTEnum<Long>(fst);

      for(int i=0;i<200;i++) {
        final BytesRef target = new BytesRef(_TestUtil.randomSimpleString(random, 9));
        if (random.nextBoolean()) {
          assertEntry(pairs.ceilingEntry(target), fstEnum.seekCeil(target));
        } else {
          final Long output = pairs.get(target);
          final BytesRefFSTEnum.InputOutput<Long> result = fstEnum.seekExact(target);
          if (output == null) {
            assertNull(result);
            continue;
          }
          assertEntry(pairs.ceilingEntry(target), result);
        }

        // keep walking from the seek position
        BytesRef expected = fstEnum.current() == null ? null : BytesRef.deepCopyOf(fstEnum.current().input);
        final int steps = random.nextInt(5);
        for(int step=0;step<steps && expected != null;step++) {
          final Map.Entry<BytesRef,Long> next = pairs.higherEntry(expected);
          assertEntry(next, fstEnum.next());
          expected = next == null ? null : next.getKey();
        }
      }
    }
  }

  @Test
  public void testIntsRefEnum() throws Exception {
    final Random random = newRandom();
    final TreeMap<IntsRef,Long> pairs = new TreeMap<IntsRef,Long>();
    while(pairs.size() < 200) {
      final IntsRef input = new IntsRef(_TestUtil.nextInt(random, 1, 6));
      for(int i=0;i<input.ints.length;i++) {
        input.ints[i] = _TestUtil.nextInt(random, 1000, 1010);
      }
      input.length = input.ints.length;
      pairs.put(input, Long.valueOf(random.nextInt(10)));
    }
    final Builder<Long> builder = new Builder<Long>(FST.INPUT_TYPE.BYTE2, PositiveIntOutputs.getSingleton());
    for(Map.Entry<IntsRef,Long> pair : pairs.entrySet()) {
      builder.add(pair.getKey(), pair.getValue());
    }
    final FST<Long> fst = builder.finish();

    final IntsRefFSTEnum<Long> fstEnum = new IntsRefFSTEnum<Long>(fst);
    for(Map.Entry<IntsRef,Long> pair : pairs.entrySet()) {
      final IntsRefFSTEnum.InputOutput<Long> result = fstEnum.next();
      assertEquals(pair.getKey(), result.input);
      assertEquals(pair.getValue(), result.output);
    }
    assertNull(fstEnum.next());

    for(Map.Entry<IntsRef,Long> pair : pairs.entrySet()) {
      final IntsRefFSTEnum.InputOutput<Long> result = fstEnum.seekExact(pair.getKey());
      assertNotNull(result);
      assertEquals(pair.getValue(), result.output);
    }

    // below the smallest label
    final IntsRefFSTEnum.InputOutput<Long> first = fstEnum.seekCeil(new IntsRef(new int[] {5}, 0, 1));
    assertEquals(pairs.firstKey(), first.input);
    // past the largest label
    assertNull(fstEnum.seekCeil(new IntsRef(new int[] {2000}, 0, 1)));
  }
}
