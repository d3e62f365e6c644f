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
import org.quartz.ObjectAlreadyExistsException;

import static java.util.Objects.requireNonNull;

/**
 * Thrown when a declared job or trigger already exists in the scheduler and the processing
 * directives neither allow replacing it nor ignoring it.
 */
public class DuplicateDefinitionException extends ObjectAlreadyExistsException {
  private final Key key;

  private DuplicateDefinitionException(String kind, Key key) {
    super("Unable to store " + kind + " : '" + key
        + "', because one already exists with this identification.");
    this.key = requireNonNull(key);
  }

  static DuplicateDefinitionException forJob(Key key) {
    return new DuplicateDefinitionException("Job", key);
  }

  static DuplicateDefinitionException forTrigger(Key key) {
    return new DuplicateDefinitionException("Trigger", key);
  }

  /**
   * Key of the job or trigger that already exists.
   */
  public Key getKey() {
    return key;
  }
}
