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

import java.io.IOException;

import org.ftindex.util.ArrayUtil;
import org.ftindex.util.RamUsageEstimator;

/** Can next() and seek through the terms in an FST.
 *
 * <p>The enum keeps a stack of arcs, one per label of the
 * current input plus the final (END_LABEL) arc; arcs[0] is
 * the virtual arc into the start node and output[i] is the
 * output accumulated down to arcs[i].</p>
 */
abstract class FSTEnum<T> {
  protected final FST<T> fst;

  @SuppressWarnings({"rawtypes","unchecked"}) protected FST.Arc<T>[] arcs = new FST.Arc[10];
  // outputs are cumulative
  @SuppressWarnings({"rawtypes","unchecked"}) protected T[] output = (T[]) new Object[10];

  protected final T NO_OUTPUT;
  protected final FST.BytesReader fstReader;

  protected int upto;

  // true once next() walked past the last input
  private boolean ended;

  protected FSTEnum(FST<T> fst) {
    this.fst = fst;
    fstReader = fst.getBytesReader();
    NO_OUTPUT = fst.outputs.getNoOutput();
    fst.getFirstArc(getArc(0));
    output[0] = NO_OUTPUT;
  }

  /** Label of the seek target at the current depth, or
   *  {@link FST#END_LABEL} once the target is consumed. */
  protected abstract int getTargetLabel();

  protected abstract void setCurrentLabel(int label);
  protected abstract void grow();

  protected void doNext() throws IOException {
    if (ended) {
      return;
    }
    if (upto == 0) {
      upto = 1;
      fst.readFirstTargetArc(getArc(0), getArc(1), fstReader);
    } else {
      // pop
      while (arcs[upto].isLast()) {
        upto--;
        if (upto == 0) {
          ended = true;
          return;
        }
      }
      fst.readNextArc(arcs[upto], fstReader);
    }

    pushFirst();
  }

  /** Seeks to smallest term that's &gt;= target. */
  protected void doSeekCeil() throws IOException {
    ended = false;
    upto = 0;

    while (true) {
      final FST.Arc<T> follow = arcs[upto];
      incr();
      final FST.Arc<T> arc = getArc(upto);
      final int targetLabel = getTargetLabel();

      if (targetLabel == FST.END_LABEL) {
        // target is consumed: either it is accepted here, or the
        // first input below this node is the ceiling
        fst.readFirstTargetArc(follow, arc, fstReader);
        pushFirst();
        return;
      }

      if (FST.targetHasArcs(follow)) {
        // the END_LABEL arc, if any, sorts before the target
        fst.readFirstRealTargetArc(follow.target, arc, fstReader);
        while (arc.label < targetLabel && !arc.isLast()) {
          fst.readNextRealArc(arc, fstReader);
        }
        if (arc.label == targetLabel) {
          output[upto] = fst.outputs.add(output[upto-1], arc.output);
          setCurrentLabel(targetLabel);
          continue;
        } else if (arc.label > targetLabel) {
          pushFirst();
          return;
        }
      }

      // every input below this node is smaller than the target:
      // back up to the deepest arc that has a next sibling
      upto--;
      while (upto > 0) {
        if (!arcs[upto].isLast()) {
          fst.readNextArc(arcs[upto], fstReader);
          pushFirst();
          return;
        }
        upto--;
      }
      ended = true;
      return;
    }
  }

  /** Seeks to exactly target term. */
  protected boolean doSeekExact() throws IOException {
    ended = false;
    upto = 0;

    while (true) {
      final FST.Arc<T> follow = arcs[upto];
      incr();
      final FST.Arc<T> arc = getArc(upto);
      final int targetLabel = getTargetLabel();
      if (fst.findTargetArc(targetLabel, follow, arc, fstReader) == null) {
        upto = 0;
        return false;
      }
      output[upto] = fst.outputs.add(output[upto-1], arc.output);
      if (targetLabel == FST.END_LABEL) {
        return true;
      }
      setCurrentLabel(targetLabel);
    }
  }

  private void incr() {
    upto++;
    grow();
    if (arcs.length <= upto) {
      @SuppressWarnings({"rawtypes","unchecked"}) final FST.Arc<T>[] newArcs =
        new FST.Arc[ArrayUtil.oversize(1+upto, RamUsageEstimator.NUM_BYTES_OBJECT_REF)];
      System.arraycopy(arcs, 0, newArcs, 0, arcs.length);
      arcs = newArcs;
    }
    if (output.length <= upto) {
      @SuppressWarnings({"rawtypes","unchecked"}) final T[] newOutput =
        (T[]) new Object[ArrayUtil.oversize(1+upto, RamUsageEstimator.NUM_BYTES_OBJECT_REF)];
      System.arraycopy(output, 0, newOutput, 0, output.length);
      output = newOutput;
    }
  }

  // Appends current arc, and then recurses from its target,
  // appending first arc all the way to the final node
  private void pushFirst() throws IOException {

    FST.Arc<T> arc = arcs[upto];
    assert arc != null;

    while (true) {
      output[upto] = fst.outputs.add(output[upto-1], arc.output);
      if (arc.label == FST.END_LABEL) {
        // Final node
        break;
      }
      setCurrentLabel(arc.label);
      incr();

      final FST.Arc<T> nextArc = getArc(upto);
      fst.readFirstTargetArc(arc, nextArc, fstReader);
      arc = nextArc;
    }
  }

  private FST.Arc<T> getArc(int idx) {
    if (arcs[idx] == null) {
      arcs[idx] = new FST.Arc<T>();
    }
    return arcs[idx];
  }

  /** True if the enum is positioned on an input. */
  protected boolean isPositioned() {
    return upto != 0 && !ended;
  }
}
