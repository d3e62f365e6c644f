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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

/**
 * A BackoffStrategy that implements truncated binary exponential backoff with jitter.
 */
public class TruncatedBinaryBackoff implements BackoffStrategy {
  private final long initialBackoffMs;
  private final long maxBackoffIntervalMs;
  private final boolean stopAtMax;
  private final Random random;

  /**
   * Creates a new TruncatedBinaryBackoff that will start by backing off for {@code initialBackoff}
   * and then backoff of up to twice as long each time it is called until reaching
   * {@code maxBackoff}.
   *
   * @param initialBackoff the initial amount of time to backoff
   * @param maxBackoff the maximum amount of time to backoff
   * @param stopAtMax whether shouldContinue() returns false when the max is reached
   */
  public TruncatedBinaryBackoff(Duration initialBackoff, Duration maxBackoff, boolean stopAtMax) {
    this(initialBackoff, maxBackoff, stopAtMax, new Random());
  }

  /**
   * Same as {@link #TruncatedBinaryBackoff(Duration, Duration, boolean)}, but shouldContinue()
   * always returns true.
   */
  public TruncatedBinaryBackoff(Duration initialBackoff, Duration maxBackoff) {
    this(initialBackoff, maxBackoff, false);
  }

  @VisibleForTesting
  TruncatedBinaryBackoff(
      Duration initialBackoff,
      Duration maxBackoff,
      boolean stopAtMax,
      Random random) {

    Preconditions.checkNotNull(initialBackoff);
    Preconditions.checkNotNull(maxBackoff);
    Preconditions.checkNotNull(random);
    Preconditions.checkArgument(initialBackoff.toMillis() > 0);
    Preconditions.checkArgument(maxBackoff.compareTo(initialBackoff) >= 0);
    this.initialBackoffMs = initialBackoff.toMillis();
    this.maxBackoffIntervalMs = maxBackoff.toMillis();
    this.stopAtMax = stopAtMax;
    this.random = random;
  }

  @Override
  public long calculateBackoffMs(long lastBackoffMs) {
    Preconditions.checkArgument(lastBackoffMs >= 0);
    long halfBackoff = (lastBackoffMs == 0) ? initialBackoffMs : lastBackoffMs;

    return Math.min(
        maxBackoffIntervalMs,
        halfBackoff + Math.round(random.nextDouble() * halfBackoff));
  }

  @Override
  public boolean shouldContinue(long lastBackoffMs) {
    Preconditions.checkArgument(lastBackoffMs >= 0);
    boolean stop = stopAtMax && (lastBackoffMs >= maxBackoffIntervalMs);

    return !stop;
  }
}
