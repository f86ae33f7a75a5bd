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

import org.ftindex.store.ByteArrayDataInput;
import org.ftindex.store.ByteArrayDataOutput;
import org.ftindex.store.CorruptDataException;
import org.ftindex.util.BytesRef;
import org.ftindex.util.CharsRef;
import org.ftindex.util.FTIndexTestCase;
import org.ftindex.util.IntsRef;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestOutputs extends FTIndexTestCase {

  @Test
  public void testPositiveIntAlgebra() throws Exception {
    final PositiveIntOutputs outputs = PositiveIntOutputs.getSingleton();
    final Long noOutput = outputs.getNoOutput();

    assertEquals(Long.valueOf(3), outputs.common(3L, 7L));
    assertSame(noOutput, outputs.common(noOutput, 7L));
    assertEquals(Long.valueOf(4), outputs.subtract(7L, 3L));
    assertSame(noOutput, outputs.subtract(7L, 7L));
    assertEquals(Long.valueOf(7), outputs.subtract(7L, noOutput));
    assertEquals(Long.valueOf(10), outputs.add(3L, 7L));
    assertEquals(Long.valueOf(3), outputs.add(3L, noOutput));

    final Long x = 42L;
    final Long y = 17L;
    assertEquals(x, outputs.add(outputs.common(x, y), outputs.subtract(x, outputs.common(x, y))));
  }

  @Test
  public void testPositiveIntMergeDefaultsToUnsupported() throws Exception {
    try {
      PositiveIntOutputs.getSingleton().merge(1L, 2L);
      fail("did not hit exception");
    } catch (UnsupportedOperationException uoe) {
      // expected
    }
  }

  @Test
  public void testByteSequenceAlgebra() throws Exception {
    final ByteSequenceOutputs outputs = ByteSequenceOutputs.getSingleton();
    final BytesRef noOutput = outputs.getNoOutput();

    final BytesRef abc = new BytesRef("abc");
    final BytesRef abd = new BytesRef("abd");
    final BytesRef xyz = new BytesRef("xyz");

    assertEquals(new BytesRef("ab"), outputs.common(abc, abd));
    assertSame(noOutput, outputs.common(abc, xyz));
    assertSame(abc, outputs.common(abc, new BytesRef("abcdef")));
    assertEquals(new BytesRef("c"), outputs.subtract(abc, new BytesRef("ab")));
    assertSame(noOutput, outputs.subtract(abc, abc));
    assertEquals(new BytesRef("abcxyz"), outputs.add(abc, xyz));
    assertSame(abc, outputs.add(abc, noOutput));
    assertSame(abc, outputs.add(noOutput, abc));
  }

  @Test
  public void testIntSequenceAlgebra() throws Exception {
    final IntSequenceOutputs outputs = IntSequenceOutputs.getSingleton();
    final IntsRef noOutput = outputs.getNoOutput();

    final IntsRef a = new IntsRef(new int[] {1, 2, 3}, 0, 3);
    final IntsRef b = new IntsRef(new int[] {1, 2, 4}, 0, 3);

    final IntsRef common = outputs.common(a, b);
    assertEquals(new IntsRef(new int[] {1, 2}, 0, 2), common);
    assertEquals(new IntsRef(new int[] {3}, 0, 1), outputs.subtract(a, common));
    assertEquals(a, outputs.add(common, outputs.subtract(a, common)));
    assertSame(noOutput, outputs.common(a, new IntsRef(new int[] {7}, 0, 1)));
  }

  @Test
  public void testCharSequenceAlgebra() throws Exception {
    final CharSequenceOutputs outputs = CharSequenceOutputs.getSingleton();
    final CharsRef noOutput = outputs.getNoOutput();

    final CharsRef running = new CharsRef("running");
    final CharsRef runner = new CharsRef("runner");

    final CharsRef common = outputs.common(running, runner);
    assertEquals("runn", common.toString());
    assertEquals("ing", outputs.subtract(running, common).toString());
    assertEquals("running", outputs.add(common, outputs.subtract(running, common)).toString());
    assertSame(noOutput, outputs.subtract(running, running));
  }

  @Test
  public void testNoOutputs() throws Exception {
    final NoOutputs outputs = NoOutputs.getSingleton();
    final Object noOutput = outputs.getNoOutput();
    assertSame(noOutput, outputs.common(noOutput, noOutput));
    assertSame(noOutput, outputs.add(noOutput, noOutput));
    assertSame(noOutput, outputs.merge(noOutput, noOutput));

    final ByteArrayDataOutput out = new ByteArrayDataOutput(4);
    outputs.write(noOutput, out);
    assertEquals(0, out.getPosition());
    assertSame(noOutput, outputs.read(new ByteArrayDataInput(new byte[0])));
  }

  @Test
  public void testSerialization() throws Exception {
    final ByteArrayDataOutput out = new ByteArrayDataOutput(64);
    PositiveIntOutputs.getSingleton().write(Long.valueOf(1L << 40), out);
    PositiveIntOutputs.getSingleton().write(PositiveIntOutputs.getSingleton().getNoOutput(), out);
    ByteSequenceOutputs.getSingleton().write(new BytesRef("skip me"), out);
    ByteSequenceOutputs.getSingleton().writeFinalOutput(new BytesRef("final"), out);
    IntSequenceOutputs.getSingleton().write(new IntsRef(new int[] {5, 0x10FFFF, 0}, 0, 3), out);
    CharSequenceOutputs.getSingleton().write(new CharsRef("\u00e9t\u00e9"), out);

    final ByteArrayDataInput in = new ByteArrayDataInput(out.toByteArray());
    assertEquals(Long.valueOf(1L << 40), PositiveIntOutputs.getSingleton().read(in));
    // zero decodes to the shared no-output instance
    assertSame(PositiveIntOutputs.getSingleton().getNoOutput(), PositiveIntOutputs.getSingleton().read(in));
    ByteSequenceOutputs.getSingleton().skipOutput(in);
    assertEquals(new BytesRef("final"), ByteSequenceOutputs.getSingleton().readFinalOutput(in));
    assertEquals(new IntsRef(new int[] {5, 0x10FFFF, 0}, 0, 3), IntSequenceOutputs.getSingleton().read(in));
    assertEquals("\u00e9t\u00e9", CharSequenceOutputs.getSingleton().read(in).toString());
    assertTrue(in.eof());
  }

  @Test
  public void testNegativeLengthIsCorrupt() throws Exception {
    final ByteArrayDataOutput out = new ByteArrayDataOutput(8);
    out.writeVInt(-1);
    final byte[] bytes = out.toByteArray();
    assertEquals(5, bytes.length);

    final Outputs<?>[] all = new Outputs<?>[] {ByteSequenceOutputs.getSingleton(),
                                               IntSequenceOutputs.getSingleton(),
                                               CharSequenceOutputs.getSingleton()};
    for(Outputs<?> outputs : all) {
      try {
        outputs.read(new ByteArrayDataInput(bytes));
        fail(outputs + ": read accepted a negative length");
      } catch (CorruptDataException cde) {
        // expected
      }
      try {
        outputs.skipOutput(new ByteArrayDataInput(bytes));
        fail(outputs + ": skipOutput accepted a negative length");
      } catch (CorruptDataException cde) {
        // expected
      }
    }

    // the same length read backwards, as inside an FST
    final byte[] reversed = new byte[bytes.length];
    for(int i=0;i<bytes.length;i++) {
      reversed[bytes.length-1-i] = bytes[i];
    }
    final ReverseBytesReader in = new ReverseBytesReader(reversed);
    in.setPosition(reversed.length-1);
    try {
      ByteSequenceOutputs.getSingleton().skipOutput(in);
      fail("skipOutput accepted a negative length");
    } catch (CorruptDataException cde) {
      // expected
    }
  }

  @Test
  public void testCharOutOfRangeIsCorrupt() throws Exception {
    final ByteArrayDataOutput out = new ByteArrayDataOutput(8);
    out.writeVInt(1);
    out.writeVInt(Character.MAX_VALUE + 1);
    try {
      CharSequenceOutputs.getSingleton().read(new ByteArrayDataInput(out.toByteArray()));
      fail("read truncated a value above 0xFFFF");
    } catch (CorruptDataException cde) {
      // expected
    }
  }
}
