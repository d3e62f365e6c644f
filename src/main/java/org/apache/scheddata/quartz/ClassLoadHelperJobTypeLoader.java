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

import javax.inject.Inject;

import org.quartz.Job;
import org.quartz.spi.ClassLoadHelper;

import static java.util.Objects.requireNonNull;

/**
 * Loads job types through a Quartz {@link ClassLoadHelper}.
 */
public class ClassLoadHelperJobTypeLoader implements JobTypeLoader {
  private final ClassLoadHelper classLoadHelper;

  @Inject
  public ClassLoadHelperJobTypeLoader(ClassLoadHelper classLoadHelper) {
    this.classLoadHelper = requireNonNull(classLoadHelper);
  }

  @Override
  public Class<? extends Job> loadJobType(String typeName) throws JobTypeLoadException {
    if (typeName == null) {
      throw new JobTypeLoadException("No job type specified.");
    }

    Class<?> type;
    try {
      type = classLoadHelper.loadClass(typeName);
    } catch (ClassNotFoundException e) {
      throw new JobTypeLoadException("Unable to load job type " + typeName, e);
    }

    if (!Job.class.isAssignableFrom(type)) {
      throw new JobTypeLoadException(
          "Job type " + typeName + " does not implement " + Job.class.getName());
    }
    return type.asSubclass(Job.class);
  }
}
