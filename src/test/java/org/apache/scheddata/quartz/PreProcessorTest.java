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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.apache.scheddata.common.testing.easymock.EasyMockTest;
import org.apache.scheddata.model.Key;
import org.apache.scheddata.model.PreProcessCommands;
import org.junit.Before;
import org.junit.Test;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.TriggerKey;
import org.quartz.impl.matchers.GroupMatcher;

import static org.easymock.EasyMock.expect;

public class PreProcessorTest extends EasyMockTest {
  private static final NeverDeleteGroups PROTECTED = new NeverDeleteGroups(
      ImmutableSet.of("system"),
      ImmutableSet.of("system-triggers"));

  private Scheduler scheduler;
  private PreProcessor preProcessor;

  @Before
  public void setUp() {
    scheduler = createMock(Scheduler.class);
    preProcessor = new PreProcessor();
  }

  @Test
  public void testNoCommands() throws Exception {
    control.replay();

    preProcessor.execute(PreProcessCommands.EMPTY, PROTECTED, scheduler);
  }

  @Test
  public void testDeletesAllJobGroupsExceptProtected() throws Exception {
    JobKey report = JobKey.jobKey("report", "group1");
    JobKey audit = JobKey.jobKey("audit", "group2");
    expect(scheduler.getJobGroupNames()).andReturn(ImmutableList.of("group1", "system", "group2"));
    expect(scheduler.getJobKeys(GroupMatcher.jobGroupEquals("group1")))
        .andReturn(ImmutableSet.of(report));
    expect(scheduler.deleteJob(report)).andReturn(true);
    expect(scheduler.getJobKeys(GroupMatcher.jobGroupEquals("group2")))
        .andReturn(ImmutableSet.of(audit));
    expect(scheduler.deleteJob(audit)).andReturn(true);

    control.replay();

    preProcessor.execute(
        PreProcessCommands.builder().deleteJobsInGroup(PreProcessCommands.ALL_GROUPS).build(),
        PROTECTED,
        scheduler);
  }

  @Test
  public void testDeletesAllTriggerGroupsExceptProtected() throws Exception {
    TriggerKey nightly = TriggerKey.triggerKey("nightly", "group1");
    expect(scheduler.getTriggerGroupNames())
        .andReturn(ImmutableList.of("system-triggers", "group1"));
    expect(scheduler.getTriggerKeys(GroupMatcher.triggerGroupEquals("group1")))
        .andReturn(ImmutableSet.of(nightly));
    expect(scheduler.unscheduleJob(nightly)).andReturn(true);

    control.replay();

    preProcessor.execute(
        PreProcessCommands.builder().deleteTriggersInGroup(PreProcessCommands.ALL_GROUPS).build(),
        PROTECTED,
        scheduler);
  }

  @Test
  public void testCommandsRunInFixedOrder() throws Exception {
    expect(scheduler.getJobKeys(GroupMatcher.jobGroupEquals("group1")))
        .andReturn(ImmutableSet.of());
    expect(scheduler.getTriggerKeys(GroupMatcher.triggerGroupEquals("group2")))
        .andReturn(ImmutableSet.of());
    expect(scheduler.deleteJob(JobKey.jobKey("report", Key.DEFAULT_GROUP))).andReturn(false);
    expect(scheduler.unscheduleJob(TriggerKey.triggerKey("nightly", "group3"))).andReturn(true);

    control.replay();

    PreProcessCommands commands = PreProcessCommands.builder()
        .deleteTrigger(Key.of("nightly", "group3"))
        .deleteJob(Key.of("report", null))
        .deleteTriggersInGroup("group2")
        .deleteJobsInGroup("group1")
        .build();
    preProcessor.execute(commands, PROTECTED, scheduler);
  }

  @Test
  public void testProtectedGroupsNeverDeleted() throws Exception {
    control.replay();

    PreProcessCommands commands = PreProcessCommands.builder()
        .deleteJobsInGroup("system")
        .deleteTriggersInGroup("system-triggers")
        .deleteJob(Key.of("report", "system"))
        .deleteTrigger(Key.of("nightly", "system-triggers"))
        .build();
    preProcessor.execute(commands, PROTECTED, scheduler);
  }

  @Test
  public void testJobGroupProtectionDoesNotCoverTriggers() throws Exception {
    TriggerKey nightly = TriggerKey.triggerKey("nightly", "system");
    expect(scheduler.getTriggerKeys(GroupMatcher.triggerGroupEquals("system")))
        .andReturn(ImmutableSet.of(nightly));
    expect(scheduler.unscheduleJob(nightly)).andReturn(true);

    control.replay();

    preProcessor.execute(
        PreProcessCommands.builder().deleteTriggersInGroup("system").build(),
        PROTECTED,
        scheduler);
  }
}
