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
package org.apache.scheddata.xml;

/**
 * Thrown when a scheduling data document is malformed or declares values that cannot be used.
 */
public class SchedulingDataException extends Exception {
  public SchedulingDataException(String message) {
    super(message);
  }

  public SchedulingDataException(String message, Throwable cause) {
    super(message, cause);
  }
}
