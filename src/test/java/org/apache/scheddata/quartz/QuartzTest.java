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

import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.TimeZone;

import com.google.common.collect.ImmutableList;

import org.apache.scheddata.NoOpJob;
import org.apache.scheddata.model.CronSchedule;
import org.apache.scheddata.model.DataEntry;
import org.apache.scheddata.model.JobDefinition;
import org.apache.scheddata.model.Key;
import org.apache.scheddata.model.SimpleSchedule;
import org.apache.scheddata.model.TriggerDefinition;
import org.junit.Test;
import org.quartz.CronTrigger;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.SchedulerException;
import org.quartz.SimpleTrigger;
import org.quartz.Trigger;
import org.quartz.TriggerKey;

import static org.apache.scheddata.quartz.QuartzTestUtil.JOB_KEY;
import static org.apache.scheddata.quartz.QuartzTestUtil.START;
import static org.apache.scheddata.quartz.QuartzTestUtil.TRIGGER_KEY;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class QuartzTest {
  @Test
  public void testKeys() {
    assertEquals(JobKey.jobKey("reportJob", "group1"), Quartz.jobKey(JOB_KEY));
    assertEquals(TriggerKey.triggerKey("reportTrigger", "group1"), Quartz.triggerKey(TRIGGER_KEY));
    assertEquals(JOB_KEY, Quartz.key(Quartz.jobKey(JOB_KEY)));
    assertEquals(
        Key.of("reportJob", null),
        Quartz.key(JobKey.jobKey("reportJob", Key.DEFAULT_GROUP)));
  }

  @Test
  public void testLastDataEntryWins() {
    JobDataMap map = Quartz.jobDataMap(ImmutableList.of(
        new DataEntry("a", "1"),
        new DataEntry("b", null),
        new DataEntry("a", "2")));

    assertEquals("2", map.getString("a"));
    assertTrue(map.containsKey("b"));
    assertNull(map.get("b"));
  }

  @Test
  public void testJobDetail() {
    JobDefinition definition = JobDefinition.builder(JOB_KEY, NoOpJob.class)
        .setDescription("Nightly report")
        .setDurable(true)
        .setRequestsRecovery(true)
        .addDataEntry("owner", "reports")
        .build();

    JobDetail detail = Quartz.jobDetail(definition);

    assertEquals(Quartz.jobKey(JOB_KEY), detail.getKey());
    assertEquals("Nightly report", detail.getDescription());
    assertEquals(NoOpJob.class, detail.getJobClass());
    assertTrue(detail.isDurable());
    assertTrue(detail.requestsRecovery());
    assertEquals("reports", detail.getJobDataMap().getString("owner"));
  }

  @Test
  public void testSimpleTrigger() throws Exception {
    Instant end = START.plus(Duration.ofDays(1));
    TriggerDefinition definition = TriggerDefinition.builder(
            TRIGGER_KEY,
            JOB_KEY,
            new SimpleSchedule(3, Duration.ofMinutes(1)))
        .setCalendarName("holidays")
        .setStartTime(START)
        .setEndTime(end)
        .setMisfireInstruction(SimpleTrigger.MISFIRE_INSTRUCTION_FIRE_NOW)
        .addDataEntry("format", "pdf")
        .build();

    SimpleTrigger trigger = (SimpleTrigger) Quartz.trigger(definition);

    assertEquals(Quartz.triggerKey(TRIGGER_KEY), trigger.getKey());
    assertEquals(Quartz.jobKey(JOB_KEY), trigger.getJobKey());
    assertEquals("holidays", trigger.getCalendarName());
    assertEquals(Date.from(START), trigger.getStartTime());
    assertEquals(Date.from(end), trigger.getEndTime());
    assertEquals(3, trigger.getRepeatCount());
    assertEquals(60000L, trigger.getRepeatInterval());
    assertEquals(SimpleTrigger.MISFIRE_INSTRUCTION_FIRE_NOW, trigger.getMisfireInstruction());
    assertEquals("pdf", trigger.getJobDataMap().getString("format"));
  }

  @Test
  public void testSimpleTriggerRepeatingForever() throws Exception {
    SimpleTrigger trigger = (SimpleTrigger) Quartz.trigger(TriggerDefinition.builder(
            TRIGGER_KEY,
            JOB_KEY,
            new SimpleSchedule(SimpleSchedule.REPEAT_INDEFINITELY, Duration.ofSeconds(5)))
        .setStartTime(START)
        .build());

    assertEquals(SimpleTrigger.REPEAT_INDEFINITELY, trigger.getRepeatCount());
    assertEquals(Trigger.MISFIRE_INSTRUCTION_SMART_POLICY, trigger.getMisfireInstruction());
    assertNull(trigger.getEndTime());
  }

  @Test
  public void testCronTrigger() throws Exception {
    CronTrigger trigger = (CronTrigger) Quartz.trigger(TriggerDefinition.builder(
            TRIGGER_KEY,
            JOB_KEY,
            new CronSchedule("0 0 12 * * ?", TimeZone.getTimeZone("America/Los_Angeles")))
        .setStartTime(START)
        .setMisfireInstruction(CronTrigger.MISFIRE_INSTRUCTION_DO_NOTHING)
        .build());

    assertEquals("0 0 12 * * ?", trigger.getCronExpression());
    assertEquals("America/Los_Angeles", trigger.getTimeZone().getID());
    assertEquals(CronTrigger.MISFIRE_INSTRUCTION_DO_NOTHING, trigger.getMisfireInstruction());
  }

  @Test
  public void testCronTriggerWithoutTimeZone() throws Exception {
    CronTrigger trigger = (CronTrigger) Quartz.trigger(TriggerDefinition.builder(
            TRIGGER_KEY,
            JOB_KEY,
            new CronSchedule("0 0 12 * * ?", null))
        .setStartTime(START)
        .build());

    assertEquals(TimeZone.getDefault().getID(), trigger.getTimeZone().getID());
  }

  @Test(expected = SchedulerException.class)
  public void testInvalidCronExpression() throws Exception {
    Quartz.trigger(TriggerDefinition.builder(
            TRIGGER_KEY,
            JOB_KEY,
            new CronSchedule("not a cron expression", null))
        .setStartTime(START)
        .build());
  }
}
