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

import java.util.List;

import com.google.common.collect.ImmutableList;

import org.apache.scheddata.model.Key;
import org.apache.scheddata.model.PreProcessCommands;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.TriggerKey;
import org.quartz.impl.matchers.GroupMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Carries out the delete commands of a scheduling data document.
 *
 * <p>Commands run in a fixed order: whole job groups, whole trigger groups, single jobs, single
 * triggers. Deleting something that is already gone is not an error, so a job removed with its
 * group may be named again by a later single job delete.
 */
public class PreProcessor {
  private static final Logger LOG = LoggerFactory.getLogger(PreProcessor.class);

  /**
   * Executes pre-processing commands.
   *
   * @param commands Commands to execute.
   * @param neverDelete Groups exempt from deletion.
   * @param scheduler Scheduler to delete from.
   * @throws SchedulerException If the scheduler fails a lookup or deletion.
   */
  public void execute(
      PreProcessCommands commands,
      NeverDeleteGroups neverDelete,
      Scheduler scheduler) throws SchedulerException {

    requireNonNull(commands);
    requireNonNull(neverDelete);
    requireNonNull(scheduler);

    for (String group : commands.getJobGroupsToDelete()) {
      List<String> groups;
      if (PreProcessCommands.ALL_GROUPS.equals(group)) {
        LOG.info("Deleting all jobs in ALL groups.");
        groups = scheduler.getJobGroupNames();
      } else {
        groups = ImmutableList.of(group);
      }

      for (String groupName : groups) {
        if (neverDelete.isProtectedJobGroup(groupName)) {
          LOG.debug("Not deleting jobs in protected group {}", groupName);
          continue;
        }
        LOG.info("Deleting all jobs in group: {}", groupName);
        for (JobKey jobKey : scheduler.getJobKeys(GroupMatcher.jobGroupEquals(groupName))) {
          scheduler.deleteJob(jobKey);
        }
      }
    }

    for (String group : commands.getTriggerGroupsToDelete()) {
      List<String> groups;
      if (PreProcessCommands.ALL_GROUPS.equals(group)) {
        LOG.info("Deleting all triggers in ALL groups.");
        groups = scheduler.getTriggerGroupNames();
      } else {
        groups = ImmutableList.of(group);
      }

      for (String groupName : groups) {
        if (neverDelete.isProtectedTriggerGroup(groupName)) {
          LOG.debug("Not deleting triggers in protected group {}", groupName);
          continue;
        }
        LOG.info("Deleting all triggers in group: {}", groupName);
        for (TriggerKey triggerKey
            : scheduler.getTriggerKeys(GroupMatcher.triggerGroupEquals(groupName))) {
          scheduler.unscheduleJob(triggerKey);
        }
      }
    }

    for (Key key : commands.getJobsToDelete()) {
      if (!neverDelete.isProtectedJobGroup(key.getGroup())) {
        LOG.info("Deleting job: {}", key);
        scheduler.deleteJob(Quartz.jobKey(key));
      }
    }

    for (Key key : commands.getTriggersToDelete()) {
      if (!neverDelete.isProtectedTriggerGroup(key.getGroup())) {
        LOG.info("Deleting trigger: {}", key);
        scheduler.unscheduleJob(Quartz.triggerKey(key));
      }
    }
  }
}
