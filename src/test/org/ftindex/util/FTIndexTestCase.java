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

import java.io.File;
import java.util.Random;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;

/**
 * Base class for all tests.
 *
 * <p>Tests that need randomness call {@link #newRandom()} once;
 * the seed is printed when the test fails and can be replayed
 * with the <code>tests.seed</code> system property.</p>
 */
public abstract class FTIndexTestCase {

  /** True if and only if tests are run in verbose mode. If this flag is false
   * tests are not expected to print any messages. */
  public static final boolean VERBOSE = Boolean.getBoolean("tests.verbose");

  /** Scales the number of iterations of randomized tests. */
  public static final int RANDOM_MULTIPLIER = Integer.parseInt(System.getProperty("tests.multiplier", "1"));

  /** Create indexes in this directory, optimally use a subdir, named after the test */
  public static final File TEMP_DIR;
  static {
    String s = System.getProperty("tempDir", System.getProperty("java.io.tmpdir"));
    if (s == null) {
      throw new RuntimeException("To run tests, you need to define system property 'tempDir' or 'java.io.tmpdir'.");
    }
    TEMP_DIR = new File(s);
    TEMP_DIR.mkdirs();
  }

  // This is how we get control when errors occur.
  // Think of this as start/end/success/failed
  // events.
  @Rule
  public InterceptTestCaseEvents intercept = new InterceptTestCaseEvents(this);

  @Before
  public void setUp() throws Exception {
    seed = null;
  }

  @After
  public void tearDown() throws Exception {
  }

  /**
   * Returns a {@link Random} instance for generating random numbers during the test.
   * The random seed is logged during test execution and printed to System.out on any failure
   * for reproducing the test using {@link #newRandom(long)} with the recorded seed.
   */
  public Random newRandom() {
    if (seed != null) {
      throw new IllegalStateException("please call FTIndexTestCase.newRandom only once per test");
    }
    final String fixedSeed = System.getProperty("tests.seed");
    if (fixedSeed != null && fixedSeed.length() > 0) {
      return newRandom(Long.parseLong(fixedSeed));
    }
    return newRandom(seedRnd.nextLong());
  }

  /**
   * Returns a {@link Random} instance for generating random numbers during the test.
   * If an error occurs in the test that is not reproducible, you can use this method to
   * initialize the number generator with the seed that was printed out during the failing test.
   */
  public Random newRandom(long seed) {
    if (this.seed != null) {
      throw new IllegalStateException("please call FTIndexTestCase.newRandom only once per test");
    }
    this.seed = Long.valueOf(seed);
    return new Random(seed);
  }

  public String getName() {
    return this.name;
  }

  void setName(String name) {
    this.name = name;
  }

  // We get here from InterceptTestCaseEvents on the 'failed' event....
  public void reportAdditionalFailureInfo() {
    if (seed != null) {
      System.out.println("NOTE: random seed of testcase '" + getName() + "' was: " + seed);
    }
  }

  // recorded seed
  protected Long seed = null;

  // static members
  private static final Random seedRnd = new Random();

  private String name = "";
}
