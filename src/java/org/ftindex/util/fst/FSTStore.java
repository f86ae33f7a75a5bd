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

import org.ftindex.store.DataInput;
import org.ftindex.store.DataOutput;

/**
 * Holds the bytes of a loaded FST and hands out readers over them.
 */
public interface FSTStore {

  /** Reads <code>numBytes</code> of FST body from the input. */
  void init(DataInput in, long numBytes) throws IOException;

  /** Number of FST body bytes held. */
  long size();

  long ramBytesUsed();

  FST.BytesReader getReverseBytesReader();

  /** Writes the byte count followed by the FST body. */
  void writeTo(DataOutput out) throws IOException;
}
