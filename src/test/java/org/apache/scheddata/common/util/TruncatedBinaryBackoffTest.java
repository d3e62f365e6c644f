/**
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.scheddata.common.util;

import java.time.Duration;
import java.util.Random;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TruncatedBinaryBackoffTest {
  private static final Duration ONE_MS = Duration.ofMillis(1);

  @Test(expected = NullPointerException.class)
  public void testNullInitialBackoffRejected() {
    new TruncatedBinaryBackoff(null, Duration.ofSeconds(1));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroInitialBackoffRejected() {
    new TruncatedBinaryBackoff(Duration.ZERO, Duration.ofSeconds(1));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeInitialBackoffRejected() {
    new TruncatedBinaryBackoff(Duration.ofSeconds(-1), Duration.ofSeconds(1));
  }

  @Test(expected = NullPointerException.class)
  public void testNullMaximumBackoffRejected() {
    new TruncatedBinaryBackoff(Duration.ofSeconds(1), null);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMaximumBackoffLessThanInitialBackoffRejected() {
    new TruncatedBinaryBackoff(Duration.ofSeconds(2), Duration.ofSeconds(1));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeLastBackoffRejected() {
    new TruncatedBinaryBackoff(ONE_MS, Duration.ofMillis(12)).calculateBackoffMs(-1L);
  }

  @Test
  public void testCalculateBackoffMs() {
    TruncatedBinaryBackoff backoff = new TruncatedBinaryBackoff(ONE_MS, Duration.ofMillis(12));

    long calculateBackoffMs0 = backoff.calculateBackoffMs(0);
    assertTrue(1 <= calculateBackoffMs0 && calculateBackoffMs0 <= 2);

    long calculateBackoffMs1 = backoff.calculateBackoffMs(1);
    assertTrue(1 <= calculateBackoffMs1 && calculateBackoffMs1 <= 2);

    long calculateBackoffMs2 = backoff.calculateBackoffMs(2);
    assertTrue(2 <= calculateBackoffMs2 && calculateBackoffMs2 <= 4);

    long calculateBackoffMs4 = backoff.calculateBackoffMs(4);
    assertTrue(4 <= calculateBackoffMs4 && calculateBackoffMs4 <= 8);

    long calculateBackoffMs8 = backoff.calculateBackoffMs(8);
    assertTrue(8 <= calculateBackoffMs8 && calculateBackoffMs8 <= 12);

    assertEquals(12, backoff.calculateBackoffMs(16));
  }

  @Test
  public void testCalculateBackoffMsWithoutJitter() {
    Random noJitter = new Random() {
      @Override
      public double nextDouble() {
        return 0.0;
      }
    };
    TruncatedBinaryBackoff backoff =
        new TruncatedBinaryBackoff(Duration.ofMillis(100), Duration.ofMillis(250), false, noJitter);

    assertEquals(100, backoff.calculateBackoffMs(0));
    assertEquals(200, backoff.calculateBackoffMs(200));
    assertEquals(250, backoff.calculateBackoffMs(300));
  }

  @Test
  public void testShouldContinue() {
    TruncatedBinaryBackoff backoff = new TruncatedBinaryBackoff(ONE_MS, Duration.ofMillis(6), true);

    assertTrue(backoff.shouldContinue(0));
    assertTrue(backoff.shouldContinue(1));
    assertTrue(backoff.shouldContinue(2));
    assertTrue(backoff.shouldContinue(4));
    assertFalse(backoff.shouldContinue(6));
    assertFalse(backoff.shouldContinue(8));
  }

  @Test
  public void testAlwaysContinuesWithoutStopAtMax() {
    TruncatedBinaryBackoff backoff = new TruncatedBinaryBackoff(ONE_MS, Duration.ofMillis(6));

    assertTrue(backoff.shouldContinue(6));
    assertTrue(backoff.shouldContinue(600));
  }
}
