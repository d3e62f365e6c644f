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

import static java.util.Objects.requireNonNull;

/**
 * Everything loaded from a single scheduling data document. A fresh instance is produced for
 * every document processed; nothing carries over between documents.
 */
public final class SchedulingData {
  public static final SchedulingData EMPTY = new SchedulingData(
      PreProcessCommands.EMPTY,
      ProcessingDirectives.DEFAULT,
      ImmutableList.of(),
      ImmutableList.of(),
      ImmutableList.of());

  private final PreProcessCommands commands;
  private final ProcessingDirectives directives;
  private final ImmutableList<JobDefinition> jobs;
  private final ImmutableList<TriggerDefinition> triggers;
  private final ImmutableList<SchemaViolation> violations;

  public SchedulingData(
      PreProcessCommands commands,
      ProcessingDirectives directives,
      List<JobDefinition> jobs,
      List<TriggerDefinition> triggers,
      List<SchemaViolation> violations) {

    this.commands = requireNonNull(commands);
    this.directives = requireNonNull(directives);
    this.jobs = ImmutableList.copyOf(jobs);
    this.triggers = ImmutableList.copyOf(triggers);
    this.violations = ImmutableList.copyOf(violations);
  }

  public PreProcessCommands getCommands() {
    return commands;
  }

  public ProcessingDirectives getDirectives() {
    return directives;
  }

  /**
   * Job definitions in document order.
   */
  public List<JobDefinition> getJobs() {
    return jobs;
  }

  /**
   * Trigger definitions in document order.
   */
  public List<TriggerDefinition> getTriggers() {
    return triggers;
  }

  /**
   * Schema violations found while loading the document. Empty when validation is disabled.
   */
  public List<SchemaViolation> getViolations() {
    return violations;
  }

  public SchedulingData withDirectives(ProcessingDirectives newDirectives) {
    return new SchedulingData(commands, newDirectives, jobs, triggers, violations);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof SchedulingData)) {
      return false;
    }

    SchedulingData other = (SchedulingData) o;
    return commands.equals(other.commands)
        && directives.equals(other.directives)
        && jobs.equals(other.jobs)
        && triggers.equals(other.triggers)
        && violations.equals(other.violations);
  }

  @Override
  public int hashCode() {
    return Objects.hash(commands, directives, jobs, triggers, violations);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("commands", commands)
        .add("directives", directives)
        .add("jobs", jobs)
        .add("triggers", triggers)
        .add("violations", violations)
        .toString();
  }
}
