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

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class TriggerDefinitionTest {
  private static final Instant START = Instant.parse("2030-01-01T00:00:00Z");
  private static final Key KEY = Key.of("reportTrigger", "group1");
  private static final Key JOB_KEY = Key.of("reportJob", "group1");

  private static TriggerDefinition.Builder builder() {
    return TriggerDefinition.builder(KEY, JOB_KEY, new SimpleSchedule(0, Duration.ZERO));
  }

  @Test
  public void testDefaults() {
    TriggerDefinition trigger = builder().setStartTime(START).build();

    assertEquals(Optional.empty(), trigger.getEndTime());
    assertEquals(Optional.empty(), trigger.getMisfireInstruction());
    assertTrue(trigger.getDataEntries().isEmpty());
    assertEquals(JOB_KEY, trigger.getJobKey());
  }

  @Test
  public void testDataEntriesKeepOrderAndDuplicates() {
    TriggerDefinition trigger = builder()
        .setStartTime(START)
        .addDataEntry("a", "1")
        .addDataEntry("a", "2")
        .build();

    assertEquals(2, trigger.getDataEntries().size());
    assertEquals("2", trigger.getDataEntries().get(1).getValue());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEndBeforeStartRejected() {
    builder().setStartTime(START).setEndTime(START.minusSeconds(1)).build();
  }

  @Test(expected = NullPointerException.class)
  public void testStartTimeRequired() {
    builder().build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRepeatCountBelowIndefiniteRejected() {
    new SimpleSchedule(-2, Duration.ZERO);
  }
}
