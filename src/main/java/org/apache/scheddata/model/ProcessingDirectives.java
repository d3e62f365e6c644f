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

import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * Policy for definitions whose key already exists in the scheduler.
 *
 * <p>When {@code overwriteExistingData} is set, existing jobs and triggers are replaced. Otherwise
 * they are left alone if {@code ignoreDuplicates} is set, and rejected if it is not.
 */
public final class ProcessingDirectives {
  public static final ProcessingDirectives DEFAULT = new ProcessingDirectives(true, false);

  private final boolean overwriteExistingData;
  private final boolean ignoreDuplicates;

  public ProcessingDirectives(boolean overwriteExistingData, boolean ignoreDuplicates) {
    this.overwriteExistingData = overwriteExistingData;
    this.ignoreDuplicates = ignoreDuplicates;
  }

  public boolean isOverwriteExistingData() {
    return overwriteExistingData;
  }

  public boolean isIgnoreDuplicates() {
    return ignoreDuplicates;
  }

  public ProcessingDirectives withOverwriteExistingData(boolean overwrite) {
    return new ProcessingDirectives(overwrite, ignoreDuplicates);
  }

  public ProcessingDirectives withIgnoreDuplicates(boolean ignore) {
    return new ProcessingDirectives(overwriteExistingData, ignore);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ProcessingDirectives)) {
      return false;
    }

    ProcessingDirectives other = (ProcessingDirectives) o;
    return overwriteExistingData == other.overwriteExistingData
        && ignoreDuplicates == other.ignoreDuplicates;
  }

  @Override
  public int hashCode() {
    return Objects.hash(overwriteExistingData, ignoreDuplicates);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("overwriteExistingData", overwriteExistingData)
        .add("ignoreDuplicates", ignoreDuplicates)
        .toString();
  }
}
