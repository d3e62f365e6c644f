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

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import org.quartz.Job;

import static java.util.Objects.requireNonNull;

/**
 * A job declared in a scheduling data document.
 */
public final class JobDefinition {
  private final Key key;
  @Nullable
  private final String description;
  private final Class<? extends Job> jobType;
  private final boolean volatility;
  private final boolean durable;
  private final boolean requestsRecovery;
  private final ImmutableList<DataEntry> dataEntries;

  private JobDefinition(Builder builder) {
    this.key = requireNonNull(builder.key);
    this.description = builder.description;
    this.jobType = requireNonNull(builder.jobType);
    this.volatility = builder.volatility;
    this.durable = builder.durable;
    this.requestsRecovery = builder.requestsRecovery;
    this.dataEntries = builder.dataEntries.build();
  }

  public static Builder builder(Key key, Class<? extends Job> jobType) {
    return new Builder(key, jobType);
  }

  public Key getKey() {
    return key;
  }

  @Nullable
  public String getDescription() {
    return description;
  }

  public Class<? extends Job> getJobType() {
    return jobType;
  }

  /**
   * Whether the job need not survive a scheduler restart. Quartz 2 stores have no such notion, so
   * this is informational only.
   */
  public boolean isVolatile() {
    return volatility;
  }

  public boolean isDurable() {
    return durable;
  }

  public boolean requestsRecovery() {
    return requestsRecovery;
  }

  public List<DataEntry> getDataEntries() {
    return dataEntries;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof JobDefinition)) {
      return false;
    }

    JobDefinition other = (JobDefinition) o;
    return key.equals(other.key)
        && Objects.equals(description, other.description)
        && jobType.equals(other.jobType)
        && volatility == other.volatility
        && durable == other.durable
        && requestsRecovery == other.requestsRecovery
        && dataEntries.equals(other.dataEntries);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        key,
        description,
        jobType,
        volatility,
        durable,
        requestsRecovery,
        dataEntries);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("key", key)
        .add("description", description)
        .add("jobType", jobType.getName())
        .add("volatile", volatility)
        .add("durable", durable)
        .add("requestsRecovery", requestsRecovery)
        .add("dataEntries", dataEntries)
        .toString();
  }

  public static final class Builder {
    private final Key key;
    private final Class<? extends Job> jobType;
    private String description;
    private boolean volatility;
    private boolean durable;
    private boolean requestsRecovery;
    private final ImmutableList.Builder<DataEntry> dataEntries = ImmutableList.builder();

    private Builder(Key key, Class<? extends Job> jobType) {
      this.key = requireNonNull(key);
      this.jobType = requireNonNull(jobType);
    }

    public Builder setDescription(@Nullable String description) {
      this.description = description;
      return this;
    }

    public Builder setVolatile(boolean volatility) {
      this.volatility = volatility;
      return this;
    }

    public Builder setDurable(boolean durable) {
      this.durable = durable;
      return this;
    }

    public Builder setRequestsRecovery(boolean requestsRecovery) {
      this.requestsRecovery = requestsRecovery;
      return this;
    }

    public Builder addDataEntry(String key, @Nullable String value) {
      dataEntries.add(new DataEntry(key, value));
      return this;
    }

    public JobDefinition build() {
      return new JobDefinition(this);
    }
  }
}
