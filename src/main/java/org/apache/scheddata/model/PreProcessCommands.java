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

import java.util.List;
import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * Deletions to carry out against the scheduler before any job or trigger is added.
 */
public final class PreProcessCommands {
  /**
   * Group name that stands for every group known to the scheduler.
   */
  public static final String ALL_GROUPS = "*";

  public static final PreProcessCommands EMPTY = builder().build();

  private final ImmutableList<String> jobGroupsToDelete;
  private final ImmutableList<String> triggerGroupsToDelete;
  private final ImmutableList<Key> jobsToDelete;
  private final ImmutableList<Key> triggersToDelete;

  private PreProcessCommands(Builder builder) {
    this.jobGroupsToDelete = builder.jobGroupsToDelete.build();
    this.triggerGroupsToDelete = builder.triggerGroupsToDelete.build();
    this.jobsToDelete = builder.jobsToDelete.build();
    this.triggersToDelete = builder.triggersToDelete.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<String> getJobGroupsToDelete() {
    return jobGroupsToDelete;
  }

  public List<String> getTriggerGroupsToDelete() {
    return triggerGroupsToDelete;
  }

  public List<Key> getJobsToDelete() {
    return jobsToDelete;
  }

  public List<Key> getTriggersToDelete() {
    return triggersToDelete;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof PreProcessCommands)) {
      return false;
    }

    PreProcessCommands other = (PreProcessCommands) o;
    return jobGroupsToDelete.equals(other.jobGroupsToDelete)
        && triggerGroupsToDelete.equals(other.triggerGroupsToDelete)
        && jobsToDelete.equals(other.jobsToDelete)
        && triggersToDelete.equals(other.triggersToDelete);
  }

  @Override
  public int hashCode() {
    return Objects.hash(jobGroupsToDelete, triggerGroupsToDelete, jobsToDelete, triggersToDelete);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("jobGroupsToDelete", jobGroupsToDelete)
        .add("triggerGroupsToDelete", triggerGroupsToDelete)
        .add("jobsToDelete", jobsToDelete)
        .add("triggersToDelete", triggersToDelete)
        .toString();
  }

  public static final class Builder {
    private final ImmutableList.Builder<String> jobGroupsToDelete = ImmutableList.builder();
    private final ImmutableList.Builder<String> triggerGroupsToDelete = ImmutableList.builder();
    private final ImmutableList.Builder<Key> jobsToDelete = ImmutableList.builder();
    private final ImmutableList.Builder<Key> triggersToDelete = ImmutableList.builder();

    private Builder() {
      // Use PreProcessCommands.builder().
    }

    public Builder deleteJobsInGroup(String group) {
      jobGroupsToDelete.add(group);
      return this;
    }

    public Builder deleteTriggersInGroup(String group) {
      triggerGroupsToDelete.add(group);
      return this;
    }

    public Builder deleteJob(Key key) {
      jobsToDelete.add(key);
      return this;
    }

    public Builder deleteTrigger(Key key) {
      triggersToDelete.add(key);
      return this;
    }

    public PreProcessCommands build() {
      return new PreProcessCommands(this);
    }
  }
}
