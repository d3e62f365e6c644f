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

import java.util.Set;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;

/**
 * Job and trigger groups that pre-processing commands must never delete from.
 */
public final class NeverDeleteGroups {
  public static final NeverDeleteGroups NONE = new NeverDeleteGroups(
      ImmutableSet.of(),
      ImmutableSet.of());

  private final ImmutableSet<String> jobGroups;
  private final ImmutableSet<String> triggerGroups;

  public NeverDeleteGroups(Set<String> jobGroups, Set<String> triggerGroups) {
    this.jobGroups = ImmutableSet.copyOf(jobGroups);
    this.triggerGroups = ImmutableSet.copyOf(triggerGroups);
  }

  public boolean isProtectedJobGroup(String group) {
    return jobGroups.contains(group);
  }

  public boolean isProtectedTriggerGroup(String group) {
    return triggerGroups.contains(group);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("jobGroups", jobGroups)
        .add("triggerGroups", triggerGroups)
        .toString();
  }
}
