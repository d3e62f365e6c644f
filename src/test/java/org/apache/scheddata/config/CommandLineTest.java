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
package org.apache.scheddata.config;

import java.lang.reflect.Field;
import java.util.List;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.google.common.base.Joiner;
import com.google.common.base.Predicates;
import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;

import org.apache.scheddata.SchedulingDataProcessor;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class CommandLineTest {

  @Test
  public void testDefaults() {
    CliOptions options = CommandLine.parseOptions();

    assertEquals(SchedulingDataProcessor.DEFAULT_FILE_NAME, options.main.schedulingDataFile);
    assertEquals(null, options.main.quartzProperties);
    assertEquals(true, options.processor.overwriteExistingData);
    assertEquals(false, options.processor.ignoreDuplicates);
    assertEquals(ImmutableList.of(), options.processor.neverDeleteJobGroups);
    assertEquals(10, options.processor.triggerAddMaxAttempts);
  }

  @Test
  public void testParseAllOptions() {
    CliOptions expected = new CliOptions();
    expected.main.schedulingDataFile = "jobs.xml";
    expected.main.quartzProperties = "quartz.properties";
    expected.main.failOnValidationErrors = false;
    expected.processor.overwriteExistingData = false;
    expected.processor.ignoreDuplicates = true;
    expected.processor.neverDeleteJobGroups = ImmutableList.of("system", "reports");
    expected.processor.neverDeleteTriggerGroups = ImmutableList.of("system");
    expected.processor.validate = false;
    expected.processor.triggerAddMaxAttempts = 3;
    expected.processor.triggerAddInitialBackoffMs = 10;
    expected.processor.triggerAddMaxBackoffMs = 20;

    assertAllNonDefaultParameters(expected);

    CliOptions parsed = CommandLine.parseOptions(
        "-scheduling_data_file=jobs.xml",
        "-quartz_properties=quartz.properties",
        "-fail_on_validation_errors=false",
        "-overwrite_existing_data=false",
        "-ignore_duplicates=true",
        "-never_delete_job_groups=system,reports",
        "-never_delete_trigger_groups=system",
        "-scheduling_data_validate=false",
        "-trigger_add_max_attempts=3",
        "-trigger_add_initial_backoff_ms=10",
        "-trigger_add_max_backoff_ms=20"
    );
    assertEqualOptions(expected, parsed);
  }

  @Test(expected = ParameterException.class)
  public void testRejectsNonPositiveAttempts() {
    CommandLine.parseOptions("-trigger_add_max_attempts=0");
  }

  @Test(expected = ParameterException.class)
  public void testRejectsNonPositiveBackoff() {
    CommandLine.parseOptions("-trigger_add_initial_backoff_ms=-1");
  }

  @Test(expected = ParameterException.class)
  public void testRejectsUnknownOption() {
    CommandLine.parseOptions("-no_such_option=1");
  }

  private static void assertEqualOptions(CliOptions expected, CliOptions actual) {
    List<Object> actualObjects = actual.getOptionsObjects();
    for (Object expectedOptionContainer : expected.getOptionsObjects()) {
      Iterable<Field> paramFields = FluentIterable
          .from(expectedOptionContainer.getClass().getDeclaredFields())
          .filter(f -> f.getAnnotation(Parameter.class) != null);
      Object actualOptionContainer = FluentIterable.from(actualObjects)
          .firstMatch(Predicates.instanceOf(expectedOptionContainer.getClass()))
          .get();
      for (Field field : paramFields) {
        Parameter declaration = field.getAnnotation(Parameter.class);
        try {
          assertEquals(String.format("Value for %s does not match", declaration.names()[0]),
              field.get(expectedOptionContainer),
              field.get(actualOptionContainer));
        } catch (IllegalAccessException e) {
          throw new RuntimeException(e);
        }
      }
    }
  }

  private static void assertAllNonDefaultParameters(CliOptions testCase) {
    // Every option must be set to a non-default value, so that each one is known to parse.
    List<Object> defaultContainers = new CliOptions().getOptionsObjects();

    List<String> errors = Lists.newArrayList();

    for (Object testCaseContainer : testCase.getOptionsObjects()) {
      Iterable<Field> paramFields = FluentIterable
          .from(testCaseContainer.getClass().getDeclaredFields())
          .filter(f -> f.getAnnotation(Parameter.class) != null);
      Object defaultObject = FluentIterable.from(defaultContainers)
          .firstMatch(Predicates.instanceOf(testCaseContainer.getClass()))
          .get();
      for (Field field : paramFields) {
        Parameter declaration = field.getAnnotation(Parameter.class);
        try {
          String desc =
              String.format("for field %s (option %s)", field.getName(), declaration.names()[0]);
          Object testCaseOptionValue = field.get(testCaseContainer);
          if (testCaseOptionValue == null) {
            errors.add(String.format("Test case value may not be null %s", desc));
            continue;
          }
          if (testCaseOptionValue instanceof Iterable
              && Iterables.isEmpty((Iterable<?>) testCaseOptionValue)) {
            errors.add(String.format("Test case value may not be empty %s", desc));
            continue;
          }
          if (testCaseOptionValue.equals(field.get(defaultObject))) {
            errors.add(String.format("Test case may not use default option value %s", desc));
          }
        } catch (IllegalAccessException e) {
          throw new RuntimeException(e);
        }
      }
    }

    if (!errors.isEmpty()) {
      fail("Test case is incomplete:\n  " + Joiner.on("\n  ").join(errors));
    }
  }
}
