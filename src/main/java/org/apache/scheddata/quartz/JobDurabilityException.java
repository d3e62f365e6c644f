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
package org.apache.scheddata.quartz;

import org.apache.scheddata.model.Key;
import org.quartz.SchedulerException;

import static java.util.Objects.requireNonNull;

/**
 * Thrown when applying a job definition would leave a non-durable job without any trigger.
 */
public class JobDurabilityException extends SchedulerException {
  private final Key key;

  JobDurabilityException(Key key, String message) {
    super(message);
    this.key = requireNonNull(key);
  }

  public Key getKey() {
    return key;
  }
}
