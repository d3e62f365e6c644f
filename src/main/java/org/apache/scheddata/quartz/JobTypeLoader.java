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

import org.quartz.Job;

/**
 * Resolves the job type named in a scheduling data document.
 */
public interface JobTypeLoader {

  /**
   * Loads a job class by name.
   *
   * @param typeName Name of the job type.
   * @return The job class.
   * @throws JobTypeLoadException If the name does not resolve to a {@link Job} implementation.
   */
  Class<? extends Job> loadJobType(String typeName) throws JobTypeLoadException;
}
