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

import java.text.ParseException;
import java.util.Date;
import java.util.List;

import org.apache.scheddata.model.CronSchedule;
import org.apache.scheddata.model.DataEntry;
import org.apache.scheddata.model.JobDefinition;
import org.apache.scheddata.model.Key;
import org.apache.scheddata.model.SimpleSchedule;
import org.apache.scheddata.model.TriggerDefinition;
import org.quartz.CronScheduleBuilder;
import org.quartz.CronTrigger;
import org.quartz.JobBuilder;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.ScheduleBuilder;
import org.quartz.SchedulerException;
import org.quartz.SimpleScheduleBuilder;
import org.quartz.SimpleTrigger;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.quartz.TriggerKey;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Utilities for converting scheduling data definitions to Quartz datatypes.
 */
public final class Quartz {
  private Quartz() {
    // Utility class.
  }

  public static JobKey jobKey(Key key) {
    return JobKey.jobKey(key.getName(), key.getGroup());
  }

  public static TriggerKey triggerKey(Key key) {
    return TriggerKey.triggerKey(key.getName(), key.getGroup());
  }

  /**
   * Convert a Quartz job or trigger key to a scheduling data key.
   */
  public static Key key(org.quartz.utils.Key<?> key) {
    return Key.of(key.getName(), key.getGroup());
  }

  /**
   * Builds a job data map from entries. Later entries replace earlier ones with the same key.
   */
  static JobDataMap jobDataMap(List<DataEntry> entries) {
    JobDataMap map = new JobDataMap();
    for (DataEntry entry : entries) {
      map.put(entry.getKey(), entry.getValue());
    }
    return map;
  }

  public static JobDetail jobDetail(JobDefinition job) {
    checkNotNull(job);

    return JobBuilder.newJob(job.getJobType())
        .withIdentity(jobKey(job.getKey()))
        .withDescription(job.getDescription())
        .storeDurably(job.isDurable())
        .requestRecovery(job.requestsRecovery())
        .usingJobData(jobDataMap(job.getDataEntries()))
        .build();
  }

  /**
   * Converts a trigger definition.
   *
   * @param trigger Definition to convert.
   * @return The equivalent Quartz trigger.
   * @throws SchedulerException If the definition holds an invalid cron expression.
   */
  public static Trigger trigger(TriggerDefinition trigger) throws SchedulerException {
    checkNotNull(trigger);

    return TriggerBuilder.newTrigger()
        .withIdentity(triggerKey(trigger.getKey()))
        .forJob(jobKey(trigger.getJobKey()))
        .withDescription(trigger.getDescription())
        .modifiedByCalendar(trigger.getCalendarName())
        .startAt(Date.from(trigger.getStartTime()))
        .endAt(trigger.getEndTime().map(Date::from).orElse(null))
        .usingJobData(jobDataMap(trigger.getDataEntries()))
        .withSchedule(scheduleBuilder(trigger))
        .build();
  }

  private static ScheduleBuilder<? extends Trigger> scheduleBuilder(TriggerDefinition trigger)
      throws SchedulerException {

    int misfireInstruction =
        trigger.getMisfireInstruction().orElse(Trigger.MISFIRE_INSTRUCTION_SMART_POLICY);
    switch (trigger.getSchedule().getKind()) {
      case SIMPLE:
        return simpleSchedule((SimpleSchedule) trigger.getSchedule(), misfireInstruction);
      case CRON:
        return cronSchedule(trigger.getKey(), (CronSchedule) trigger.getSchedule(),
            misfireInstruction);
      default:
        throw new IllegalArgumentException("Unhandled schedule " + trigger.getSchedule());
    }
  }

  private static SimpleScheduleBuilder simpleSchedule(SimpleSchedule schedule, int misfire) {
    SimpleScheduleBuilder builder = SimpleScheduleBuilder.simpleSchedule()
        .withIntervalInMilliseconds(schedule.getRepeatInterval().toMillis());
    if (schedule.getRepeatCount() == SimpleSchedule.REPEAT_INDEFINITELY) {
      builder.repeatForever();
    } else {
      builder.withRepeatCount(schedule.getRepeatCount());
    }

    switch (misfire) {
      case Trigger.MISFIRE_INSTRUCTION_SMART_POLICY:
        return builder;
      case Trigger.MISFIRE_INSTRUCTION_IGNORE_MISFIRE_POLICY:
        return builder.withMisfireHandlingInstructionIgnoreMisfires();
      case SimpleTrigger.MISFIRE_INSTRUCTION_FIRE_NOW:
        return builder.withMisfireHandlingInstructionFireNow();
      case SimpleTrigger.MISFIRE_INSTRUCTION_RESCHEDULE_NOW_WITH_EXISTING_REPEAT_COUNT:
        return builder.withMisfireHandlingInstructionNowWithExistingCount();
      case SimpleTrigger.MISFIRE_INSTRUCTION_RESCHEDULE_NOW_WITH_REMAINING_REPEAT_COUNT:
        return builder.withMisfireHandlingInstructionNowWithRemainingCount();
      case SimpleTrigger.MISFIRE_INSTRUCTION_RESCHEDULE_NEXT_WITH_REMAINING_COUNT:
        return builder.withMisfireHandlingInstructionNextWithRemainingCount();
      case SimpleTrigger.MISFIRE_INSTRUCTION_RESCHEDULE_NEXT_WITH_EXISTING_COUNT:
        return builder.withMisfireHandlingInstructionNextWithExistingCount();
      default:
        throw new IllegalArgumentException("Invalid simple trigger misfire instruction " + misfire);
    }
  }

  private static CronScheduleBuilder cronSchedule(Key key, CronSchedule schedule, int misfire)
      throws SchedulerException {

    CronScheduleBuilder builder;
    try {
      builder = CronScheduleBuilder.cronScheduleNonvalidatedExpression(
          schedule.getCronExpression());
    } catch (ParseException e) {
      throw new SchedulerException(
          "Invalid cron expression '" + schedule.getCronExpression() + "' for trigger " + key, e);
    }
    if (schedule.getTimeZone().isPresent()) {
      builder.inTimeZone(schedule.getTimeZone().get());
    }

    switch (misfire) {
      case Trigger.MISFIRE_INSTRUCTION_SMART_POLICY:
        return builder;
      case Trigger.MISFIRE_INSTRUCTION_IGNORE_MISFIRE_POLICY:
        return builder.withMisfireHandlingInstructionIgnoreMisfires();
      case CronTrigger.MISFIRE_INSTRUCTION_FIRE_ONCE_NOW:
        return builder.withMisfireHandlingInstructionFireAndProceed();
      case CronTrigger.MISFIRE_INSTRUCTION_DO_NOTHING:
        return builder.withMisfireHandlingInstructionDoNothing();
      default:
        throw new IllegalArgumentException("Invalid cron trigger misfire instruction " + misfire);
    }
  }
}
