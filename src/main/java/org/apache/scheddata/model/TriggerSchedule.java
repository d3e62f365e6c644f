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

/**
 * The kind-specific part of a trigger definition.
 */
public interface TriggerSchedule {

  /**
   * Shapes a trigger may take in a scheduling data document.
   */
  enum Kind {
    SIMPLE,
    CRON
  }

  Kind getKind();
}
