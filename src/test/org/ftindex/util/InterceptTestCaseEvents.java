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

import org.junit.rules.TestWatchman;
import org.junit.runners.model.FrameworkMethod;

/** Hooks test start and failure events into {@link FTIndexTestCase}. */
@SuppressWarnings("deprecation")
public final class InterceptTestCaseEvents extends TestWatchman {
  private final FTIndexTestCase testCase;

  public InterceptTestCaseEvents(FTIndexTestCase testCase) {
    this.testCase = testCase;
  }

  @Override
  public void failed(Throwable e, FrameworkMethod method) {
    testCase.reportAdditionalFailureInfo();
    super.failed(e, method);
  }

  @Override
  public void starting(FrameworkMethod method) {
    testCase.setName(method.getName());
    super.starting(method);
  }
}
