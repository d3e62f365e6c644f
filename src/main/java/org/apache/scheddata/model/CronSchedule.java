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
import java.util.Optional;
import java.util.TimeZone;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;

import static java.util.Objects.requireNonNull;

/**
 * Fires according to a cron expression. The expression is passed to Quartz untouched.
 */
public final class CronSchedule implements TriggerSchedule {
  private final String cronExpression;
  @Nullable
  private final TimeZone timeZone;

  public CronSchedule(String cronExpression, @Nullable TimeZone timeZone) {
    this.cronExpression = requireNonNull(cronExpression);
    this.timeZone = timeZone;
  }

  @Override
  public Kind getKind() {
    return Kind.CRON;
  }

  public String getCronExpression() {
    return cronExpression;
  }

  /**
   * Time zone the expression is evaluated in. When absent the scheduler's default applies.
   */
  public Optional<TimeZone> getTimeZone() {
    return Optional.ofNullable(timeZone);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof CronSchedule)) {
      return false;
    }

    CronSchedule other = (CronSchedule) o;
    return cronExpression.equals(other.cronExpression)
        && Objects.equals(timeZone, other.timeZone);
  }

  @Override
  public int hashCode() {
    return Objects.hash(cronExpression, timeZone);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("cronExpression", cronExpression)
        .add("timeZone", timeZone == null ? null : timeZone.getID())
        .toString();
  }
}
