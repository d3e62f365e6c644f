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

import java.lang.annotation.Retention;
import java.lang.annotation.Target;
import java.util.List;
import java.util.Set;

import javax.inject.Inject;
import javax.inject.Qualifier;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Multimaps;
import com.google.common.collect.Sets;

import org.apache.scheddata.common.util.BackoffStrategy;
import org.apache.scheddata.common.util.Clock;
import org.apache.scheddata.model.JobDefinition;
import org.apache.scheddata.model.Key;
import org.apache.scheddata.model.ProcessingDirectives;
import org.apache.scheddata.model.TriggerDefinition;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;
import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Brings a scheduler in line with a batch of job and trigger definitions.
 *
 * <p>Jobs are applied in batch order, each followed by the triggers that target it in batch
 * order. Triggers whose job is not part of the batch, or whose job was left alone because it
 * already existed, are applied last against whatever job the scheduler holds. Work done before a
 * failure stays in the scheduler.
 */
public class ScheduleReconciler {
  private static final Logger LOG = LoggerFactory.getLogger(ScheduleReconciler.class);

  /**
   * Binding annotation for the number of times a trigger add is attempted before giving up.
   */
  @VisibleForTesting
  @Qualifier
  @Target({ FIELD, PARAMETER, METHOD }) @Retention(RUNTIME)
  public @interface MaxTriggerAddAttempts { }

  private final BackoffStrategy backoff;
  private final Clock clock;
  private final int maxTriggerAddAttempts;

  @Inject
  public ScheduleReconciler(
      BackoffStrategy backoff,
      Clock clock,
      @MaxTriggerAddAttempts int maxTriggerAddAttempts) {

    checkArgument(maxTriggerAddAttempts > 0);
    this.backoff = requireNonNull(backoff);
    this.clock = requireNonNull(clock);
    this.maxTriggerAddAttempts = maxTriggerAddAttempts;
  }

  /**
   * Applies jobs and triggers to a scheduler.
   *
   * @param jobs Job definitions, in the order to apply them.
   * @param triggers Trigger definitions, in the order to apply them.
   * @param directives Policy for definitions that already exist in the scheduler.
   * @param scheduler Scheduler to store into.
   * @throws DuplicateDefinitionException If a job or trigger exists and may neither be replaced
   *     nor ignored.
   * @throws JobDurabilityException If a non-durable job would be stored without triggers.
   * @throws SchedulerException If the scheduler fails an operation.
   */
  public void reconcile(
      List<JobDefinition> jobs,
      List<TriggerDefinition> triggers,
      ProcessingDirectives directives,
      Scheduler scheduler) throws SchedulerException {

    requireNonNull(jobs);
    requireNonNull(triggers);
    requireNonNull(directives);
    requireNonNull(scheduler);

    LOG.info("Adding {} jobs, {} triggers.", jobs.size(), triggers.size());

    ImmutableListMultimap<Key, TriggerDefinition> triggersByJob =
        Multimaps.index(triggers, TriggerDefinition::getJobKey);
    Set<TriggerDefinition> consumed = Sets.newIdentityHashSet();
    TriggerApplier applier =
        new TriggerApplier(scheduler, directives, backoff, clock, maxTriggerAddAttempts);

    for (JobDefinition job : jobs) {
      Key key = job.getKey();
      JobKey jobKey = Quartz.jobKey(key);
      JobDetail existing = scheduler.getJobDetail(jobKey);

      if (existing != null && !directives.isOverwriteExistingData()) {
        if (directives.isIgnoreDuplicates()) {
          LOG.info("Not overwriting existing job: {}", key);
          continue;
        }
        throw DuplicateDefinitionException.forJob(key);
      }

      List<TriggerDefinition> jobTriggers = triggersByJob.get(key);
      checkDurability(job, existing, jobTriggers.isEmpty(), scheduler);

      JobDetail detail = Quartz.jobDetail(job);
      JobDetail pendingJob;
      if (existing != null || job.isDurable()) {
        LOG.debug("{} job: {}", existing == null ? "Adding" : "Replacing", key);
        scheduler.addJob(detail, true, true);
        pendingJob = null;
      } else {
        pendingJob = detail;
      }

      for (TriggerDefinition trigger : jobTriggers) {
        if (consumed.add(trigger) && applier.apply(trigger, pendingJob)) {
          pendingJob = null;
        }
      }

      if (pendingJob != null) {
        LOG.warn("Job {} was not stored since all of its triggers already existed.", key);
      }
    }

    for (TriggerDefinition trigger : triggers) {
      if (consumed.add(trigger)) {
        applier.apply(trigger, null);
      }
    }
  }

  private static void checkDurability(
      JobDefinition job,
      JobDetail existing,
      boolean noTriggers,
      Scheduler scheduler) throws SchedulerException {

    if (job.isDurable() || !noTriggers) {
      return;
    }

    if (existing == null) {
      throw new JobDurabilityException(
          job.getKey(),
          "A new job defined without any triggers must be durable: " + job.getKey());
    }

    if (existing.isDurable() && scheduler.getTriggersOfJob(existing.getKey()).isEmpty()) {
      throw new JobDurabilityException(
          job.getKey(),
          "Can't change existing durable job without triggers to non-durable: " + job.getKey());
    }
  }
}
