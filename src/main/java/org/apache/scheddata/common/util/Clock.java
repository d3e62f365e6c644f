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

import java.time.Instant;

/**
 * An abstraction of the system clock, used for trigger start times that are left unspecified and
 * for waiting between trigger add attempts.
 */
public interface Clock {
  /**
   * A clock that returns the actual time reported by the system.
   */
  Clock SYSTEM_CLOCK = new Clock() {
    @Override public Instant nowInstant() {
      return Instant.now();
    }
    @Override public void waitFor(long millis) throws InterruptedException {
      Thread.sleep(millis);
    }
  };

  /**
   * Returns the current time.
   *
   * @return the Instant representing the current time.
   * @see Instant#now()
   */
  Instant nowInstant();

  /**
   * Waits for the given amount of time to pass on this clock before returning.
   *
   * @param millis the amount of time to wait in milliseconds
   * @throws InterruptedException if this wait was interrupted
   */
  void waitFor(long millis) throws InterruptedException;
}
