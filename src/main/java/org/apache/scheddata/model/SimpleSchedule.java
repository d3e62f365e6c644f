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
package org.apache.scheddata.model;

import java.time.Duration;
import java.util.Objects;

import com.google.common.base.MoreObjects;

import org.quartz.SimpleTrigger;

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Fires a fixed number of times at a fixed interval.
 */
public final class SimpleSchedule implements TriggerSchedule {
  public static final int REPEAT_INDEFINITELY = SimpleTrigger.REPEAT_INDEFINITELY;

  private final int repeatCount;
  private final Duration repeatInterval;

  public SimpleSchedule(int repeatCount, Duration repeatInterval) {
    checkArgument(repeatCount >= REPEAT_INDEFINITELY, "Invalid repeat count %s", repeatCount);
    this.repeatCount = repeatCount;
    this.repeatInterval = requireNonNull(repeatInterval);
  }

  @Override
  public Kind getKind() {
    return Kind.SIMPLE;
  }

  /**
   * Number of repeats after the first firing, or {@link #REPEAT_INDEFINITELY}.
   */
  public int getRepeatCount() {
    return repeatCount;
  }

  public Duration getRepeatInterval() {
    return repeatInterval;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof SimpleSchedule)) {
      return false;
    }

    SimpleSchedule other = (SimpleSchedule) o;
    return repeatCount == other.repeatCount && repeatInterval.equals(other.repeatInterval);
  }

  @Override
  public int hashCode() {
    return Objects.hash(repeatCount, repeatInterval);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("repeatCount", repeatCount)
        .add("repeatInterval", repeatInterval)
        .toString();
  }
}
