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

import java.util.Optional;

import com.google.common.collect.ImmutableMap;

import org.quartz.CronTrigger;
import org.quartz.SimpleTrigger;
import org.quartz.Trigger;

import static java.util.Objects.requireNonNull;

/**
 * Symbolic misfire instruction names, as spelled by the Quartz constants, and the codes they stand
 * for. Names are scoped to a trigger kind since the codes overlap between kinds.
 */
public final class MisfireInstructions {
  private static final ImmutableMap<String, Integer> COMMON = ImmutableMap.of(
      "MISFIRE_INSTRUCTION_SMART_POLICY", Trigger.MISFIRE_INSTRUCTION_SMART_POLICY,
      "MISFIRE_INSTRUCTION_IGNORE_MISFIRE_POLICY",
      Trigger.MISFIRE_INSTRUCTION_IGNORE_MISFIRE_POLICY);

  private static final ImmutableMap<String, Integer> SIMPLE =
      ImmutableMap.<String, Integer>builder()
      .putAll(COMMON)
      .put("MISFIRE_INSTRUCTION_FIRE_NOW", SimpleTrigger.MISFIRE_INSTRUCTION_FIRE_NOW)
      .put("MISFIRE_INSTRUCTION_RESCHEDULE_NOW_WITH_EXISTING_REPEAT_COUNT",
          SimpleTrigger.MISFIRE_INSTRUCTION_RESCHEDULE_NOW_WITH_EXISTING_REPEAT_COUNT)
      .put("MISFIRE_INSTRUCTION_RESCHEDULE_NOW_WITH_REMAINING_REPEAT_COUNT",
          SimpleTrigger.MISFIRE_INSTRUCTION_RESCHEDULE_NOW_WITH_REMAINING_REPEAT_COUNT)
      .put("MISFIRE_INSTRUCTION_RESCHEDULE_NEXT_WITH_REMAINING_COUNT",
          SimpleTrigger.MISFIRE_INSTRUCTION_RESCHEDULE_NEXT_WITH_REMAINING_COUNT)
      .put("MISFIRE_INSTRUCTION_RESCHEDULE_NEXT_WITH_EXISTING_COUNT",
          SimpleTrigger.MISFIRE_INSTRUCTION_RESCHEDULE_NEXT_WITH_EXISTING_COUNT)
      .build();

  private static final ImmutableMap<String, Integer> CRON =
      ImmutableMap.<String, Integer>builder()
      .putAll(COMMON)
      .put("MISFIRE_INSTRUCTION_FIRE_ONCE_NOW", CronTrigger.MISFIRE_INSTRUCTION_FIRE_ONCE_NOW)
      .put("MISFIRE_INSTRUCTION_DO_NOTHING", CronTrigger.MISFIRE_INSTRUCTION_DO_NOTHING)
      .build();

  private MisfireInstructions() {
    // Utility class.
  }

  /**
   * Resolves a symbolic misfire instruction for a trigger kind.
   *
   * @param kind Kind of trigger the instruction applies to.
   * @param name Symbolic instruction name.
   * @return The instruction code, or empty if {@code name} is not valid for {@code kind}.
   */
  public static Optional<Integer> resolve(TriggerSchedule.Kind kind, String name) {
    requireNonNull(kind);
    requireNonNull(name);

    switch (kind) {
      case SIMPLE:
        return Optional.ofNullable(SIMPLE.get(name));
      case CRON:
        return Optional.ofNullable(CRON.get(name));
      default:
        throw new IllegalArgumentException("Unhandled trigger kind " + kind);
    }
  }
}
