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
package org.apache.scheddata.common.util.testing;

import java.time.Duration;
import java.time.Instant;

import org.apache.scheddata.common.util.Clock;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A clock for use in testing with a configurable value for {@link #nowInstant()}. Waiting
 * advances the clock instead of sleeping.
 */
public class FakeClock implements Clock {
  private Instant now;

  public FakeClock(Instant now) {
    this.now = now;
  }

  public FakeClock() {
    this(Instant.EPOCH);
  }

  /**
   * Sets what {@link #nowInstant()} will return until this method is called again with a new
   * value.
   */
  public void setNow(Instant now) {
    this.now = now;
  }

  /**
   * Advances the current time by {@code period}.
   */
  public void advance(Duration period) {
    checkArgument(!period.isNegative());
    now = now.plus(period);
  }

  @Override
  public Instant nowInstant() {
    return now;
  }

  @Override
  public void waitFor(long millis) {
    advance(Duration.ofMillis(millis));
  }
}
