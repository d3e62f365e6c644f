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

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A trigger declared in a scheduling data document, bound by key to the job it fires.
 */
public final class TriggerDefinition {
  private final Key key;
  @Nullable
  private final String description;
  private final Key jobKey;
  @Nullable
  private final String calendarName;
  private final boolean volatility;
  private final Instant startTime;
  @Nullable
  private final Instant endTime;
  @Nullable
  private final Integer misfireInstruction;
  private final ImmutableList<DataEntry> dataEntries;
  private final TriggerSchedule schedule;

  private TriggerDefinition(Builder builder) {
    this.key = requireNonNull(builder.key);
    this.jobKey = requireNonNull(builder.jobKey);
    this.schedule = requireNonNull(builder.schedule);
    this.startTime = requireNonNull(builder.startTime);
    this.description = builder.description;
    this.calendarName = builder.calendarName;
    this.volatility = builder.volatility;
    this.endTime = builder.endTime;
    this.misfireInstruction = builder.misfireInstruction;
    this.dataEntries = builder.dataEntries.build();
    if (endTime != null) {
      checkArgument(!endTime.isBefore(startTime),
          "End time %s of trigger %s is before its start time %s", endTime, key, startTime);
    }
  }

  public static Builder builder(Key key, Key jobKey, TriggerSchedule schedule) {
    return new Builder(key, jobKey, schedule);
  }

  public Key getKey() {
    return key;
  }

  @Nullable
  public String getDescription() {
    return description;
  }

  public Key getJobKey() {
    return jobKey;
  }

  @Nullable
  public String getCalendarName() {
    return calendarName;
  }

  public boolean isVolatile() {
    return volatility;
  }

  public Instant getStartTime() {
    return startTime;
  }

  public Optional<Instant> getEndTime() {
    return Optional.ofNullable(endTime);
  }

  /**
   * Misfire instruction code, or empty for the Quartz smart policy.
   */
  public Optional<Integer> getMisfireInstruction() {
    return Optional.ofNullable(misfireInstruction);
  }

  public List<DataEntry> getDataEntries() {
    return dataEntries;
  }

  public TriggerSchedule getSchedule() {
    return schedule;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof TriggerDefinition)) {
      return false;
    }

    TriggerDefinition other = (TriggerDefinition) o;
    return key.equals(other.key)
        && Objects.equals(description, other.description)
        && jobKey.equals(other.jobKey)
        && Objects.equals(calendarName, other.calendarName)
        && volatility == other.volatility
        && startTime.equals(other.startTime)
        && Objects.equals(endTime, other.endTime)
        && Objects.equals(misfireInstruction, other.misfireInstruction)
        && dataEntries.equals(other.dataEntries)
        && schedule.equals(other.schedule);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        key,
        description,
        jobKey,
        calendarName,
        volatility,
        startTime,
        endTime,
        misfireInstruction,
        dataEntries,
        schedule);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("key", key)
        .add("jobKey", jobKey)
        .add("description", description)
        .add("calendarName", calendarName)
        .add("volatile", volatility)
        .add("startTime", startTime)
        .add("endTime", endTime)
        .add("misfireInstruction", misfireInstruction)
        .add("dataEntries", dataEntries)
        .add("schedule", schedule)
        .toString();
  }

  public static final class Builder {
    private final Key key;
    private final Key jobKey;
    private final TriggerSchedule schedule;
    private String description;
    private String calendarName;
    private boolean volatility;
    private Instant startTime;
    private Instant endTime;
    private Integer misfireInstruction;
    private final ImmutableList.Builder<DataEntry> dataEntries = ImmutableList.builder();

    private Builder(Key key, Key jobKey, TriggerSchedule schedule) {
      this.key = requireNonNull(key);
      this.jobKey = requireNonNull(jobKey);
      this.schedule = requireNonNull(schedule);
    }

    public Builder setDescription(@Nullable String description) {
      this.description = description;
      return this;
    }

    public Builder setCalendarName(@Nullable String calendarName) {
      this.calendarName = calendarName;
      return this;
    }

    public Builder setVolatile(boolean volatility) {
      this.volatility = volatility;
      return this;
    }

    public Builder setStartTime(Instant startTime) {
      this.startTime = requireNonNull(startTime);
      return this;
    }

    public Builder setEndTime(@Nullable Instant endTime) {
      this.endTime = endTime;
      return this;
    }

    public Builder setMisfireInstruction(@Nullable Integer misfireInstruction) {
      this.misfireInstruction = misfireInstruction;
      return this;
    }

    public Builder addDataEntry(String key, @Nullable String value) {
      dataEntries.add(new DataEntry(key, value));
      return this;
    }

    public TriggerDefinition build() {
      return new TriggerDefinition(this);
    }
  }
}
