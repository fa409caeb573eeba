/*
 * Copyright Myrrix Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.dotmath.common.random;

import java.util.Map;
import java.util.WeakHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Hands out random number generators, used to fill random matrices. Allows resetting all
 * generators to a known seed so that tests over random matrices are repeatable. In test mode
 * the n-th generator handed out after {@link #useTestSeed()} is always seeded the same way,
 * so successive generators produce distinct but reproducible streams.
 */
public final class RandomManager {

  private static final long TEST_SEED = 1234567890L;

  private static final Map<RandomGenerator,Boolean> INSTANCES = new WeakHashMap<RandomGenerator,Boolean>();
  private static final AtomicLong TEST_SEED_OFFSET = new AtomicLong();
  private static volatile boolean useTestSeed = false;

  private RandomManager() {
  }

  /**
   * @return a new {@link MersenneTwister}, deterministically seeded if {@link #useTestSeed()} was called
   */
  public static RandomGenerator getRandom() {
    if (useTestSeed) {
      return new MersenneTwister(TEST_SEED + TEST_SEED_OFFSET.getAndIncrement());
    }
    RandomGenerator random = new MersenneTwister();
    synchronized (INSTANCES) {
      INSTANCES.put(random, Boolean.TRUE);
    }
    return random;
  }

  /**
   * Switches to deterministic generators, and re-seeds every generator handed out so far.
   */
  public static void useTestSeed() {
    useTestSeed = true;
    TEST_SEED_OFFSET.set(0L);
    synchronized (INSTANCES) {
      for (RandomGenerator random : INSTANCES.keySet()) {
        random.setSeed(TEST_SEED);
      }
      INSTANCES.clear();
    }
  }

}
