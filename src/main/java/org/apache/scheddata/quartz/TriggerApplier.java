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

import javax.annotation.Nullable;

import org.apache.scheddata.common.util.BackoffStrategy;
import org.apache.scheddata.common.util.Clock;
import org.apache.scheddata.model.Key;
import org.apache.scheddata.model.ProcessingDirectives;
import org.apache.scheddata.model.TriggerDefinition;
import org.quartz.JobDetail;
import org.quartz.ObjectAlreadyExistsException;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.Trigger;
import org.quartz.TriggerKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Stores a single trigger, replacing or keeping an existing trigger with the same key as the
 * processing directives say.
 *
 * <p>Another scheduler instance sharing the job store may add the same trigger between the
 * existence check and the add. Quartz reports that as {@link ObjectAlreadyExistsException}; the
 * add is then retried from the existence check, which now finds the trigger and replaces it.
 * Likewise a trigger removed between the check and its replacement is added again. Adds and
 * replacements share one attempt cap, and retries back off.
 */
class TriggerApplier {
  private static final Logger LOG = LoggerFactory.getLogger(TriggerApplier.class);

  enum State {
    CHECK_EXISTING,
    ADD_NEW,
    RESCHEDULE,
    DONE
  }

  private final Scheduler scheduler;
  private final ProcessingDirectives directives;
  private final BackoffStrategy backoff;
  private final Clock clock;
  private final int maxAddAttempts;

  TriggerApplier(
      Scheduler scheduler,
      ProcessingDirectives directives,
      BackoffStrategy backoff,
      Clock clock,
      int maxAddAttempts) {

    checkArgument(maxAddAttempts > 0);
    this.scheduler = requireNonNull(scheduler);
    this.directives = requireNonNull(directives);
    this.backoff = requireNonNull(backoff);
    this.clock = requireNonNull(clock);
    this.maxAddAttempts = maxAddAttempts;
  }

  /**
   * Applies a trigger definition.
   *
   * @param definition Trigger to store.
   * @param jobToAdd Job to store together with the trigger, or null if the job is already stored.
   * @return Whether {@code jobToAdd} was stored.
   * @throws SchedulerException If the trigger exists and may not be replaced, if the scheduler
   *     rejects the trigger, or if adding keeps colliding with concurrent adds.
   */
  boolean apply(TriggerDefinition definition, @Nullable JobDetail jobToAdd)
      throws SchedulerException {

    Key key = definition.getKey();
    TriggerKey triggerKey = Quartz.triggerKey(key);
    Trigger trigger = Quartz.trigger(definition);

    JobDetail pendingJob = jobToAdd;
    boolean jobStored = false;
    Trigger existing = null;
    int attempts = 0;
    long lastBackoffMs = 0;

    State state = State.CHECK_EXISTING;
    while (state != State.DONE) {
      switch (state) {
        case CHECK_EXISTING:
          existing = scheduler.getTrigger(triggerKey);
          if (existing == null) {
            state = State.ADD_NEW;
          } else if (directives.isOverwriteExistingData()) {
            state = State.RESCHEDULE;
          } else if (directives.isIgnoreDuplicates()) {
            LOG.info("Not overwriting existing trigger: {}", key);
            state = State.DONE;
          } else {
            throw DuplicateDefinitionException.forTrigger(key);
          }
          break;

        case RESCHEDULE:
          if (!existing.getJobKey().equals(trigger.getJobKey())) {
            LOG.warn("Possibly duplicately named ({}) triggers in scheduling data!", key);
          }
          LOG.debug("Rescheduling job: {} with updated trigger: {}", definition.getJobKey(), key);
          attempts++;
          if (scheduler.rescheduleJob(triggerKey, trigger) == null) {
            checkCanRetry(key, attempts, lastBackoffMs, null);
            LOG.debug("Trigger: {} was removed before it could be replaced, adding it instead.",
                key);
            lastBackoffMs = backOff(lastBackoffMs, key);
            state = State.CHECK_EXISTING;
          } else {
            state = State.DONE;
          }
          break;

        case ADD_NEW:
          attempts++;
          LOG.debug("Scheduling job: {} with trigger: {}", definition.getJobKey(), key);
          try {
            if (pendingJob == null) {
              scheduler.scheduleJob(trigger);
            } else {
              scheduler.scheduleJob(pendingJob, trigger);
              pendingJob = null;
              jobStored = true;
            }
            state = State.DONE;
          } catch (ObjectAlreadyExistsException e) {
            checkCanRetry(key, attempts, lastBackoffMs, e);
            LOG.debug("Adding trigger: {} for job: {} failed because the trigger already existed. "
                + "This is likely due to a race condition between multiple instances in the "
                + "cluster. Will try to reschedule instead.", key, definition.getJobKey());

            if (pendingJob != null && scheduler.checkExists(pendingJob.getKey())) {
              // The job itself won the race; store our version and add the trigger on its own.
              scheduler.addJob(pendingJob, true, true);
              pendingJob = null;
              jobStored = true;
            }

            lastBackoffMs = backOff(lastBackoffMs, key);
            state = State.CHECK_EXISTING;
          }
          break;

        default:
          throw new IllegalStateException("Unexpected state " + state);
      }
    }

    return jobStored;
  }

  private void checkCanRetry(
      Key key,
      int attempts,
      long lastBackoffMs,
      @Nullable Exception cause) throws SchedulerException {

    if (attempts >= maxAddAttempts || !backoff.shouldContinue(lastBackoffMs)) {
      throw new SchedulerException(
          "Gave up applying trigger " + key + " after " + attempts + " attempts.", cause);
    }
  }

  private long backOff(long lastBackoffMs, Key key) throws SchedulerException {
    long backoffMs = backoff.calculateBackoffMs(lastBackoffMs);
    try {
      clock.waitFor(backoffMs);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SchedulerException("Interrupted while retrying trigger " + key, e);
    }
    return backoffMs;
  }
}
