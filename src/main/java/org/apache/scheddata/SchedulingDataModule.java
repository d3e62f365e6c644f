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
package org.apache.scheddata;

import java.time.Duration;
import java.util.List;

import javax.inject.Singleton;
import javax.xml.validation.Schema;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.google.common.collect.ImmutableList;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.TypeLiteral;

import org.apache.scheddata.common.util.BackoffStrategy;
import org.apache.scheddata.common.util.Clock;
import org.apache.scheddata.common.util.TruncatedBinaryBackoff;
import org.apache.scheddata.config.validators.PositiveNumber;
import org.apache.scheddata.model.ProcessingDirectives;
import org.apache.scheddata.quartz.ClassLoadHelperJobTypeLoader;
import org.apache.scheddata.quartz.JobTypeLoader;
import org.apache.scheddata.quartz.PreProcessor;
import org.apache.scheddata.quartz.ScheduleReconciler;
import org.apache.scheddata.quartz.ScheduleReconciler.MaxTriggerAddAttempts;
import org.apache.scheddata.xml.SchedulingDataExtractor;
import org.apache.scheddata.xml.SchedulingDataParser;
import org.apache.scheddata.xml.SchemaValidator;
import org.quartz.simpl.CascadingClassLoadHelper;
import org.quartz.spi.ClassLoadHelper;

/**
 * Binds a {@link SchedulingDataProcessor} configured from command line options.
 */
public class SchedulingDataModule extends AbstractModule {

  @Parameters(separators = "=")
  public static class Options {
    @Parameter(names = "-overwrite_existing_data",
        description = "Replace jobs and triggers that already exist in the scheduler, unless "
            + "the scheduling data file says otherwise.",
        arity = 1)
    public boolean overwriteExistingData = true;

    @Parameter(names = "-ignore_duplicates",
        description = "Leave existing jobs and triggers alone instead of failing when they may "
            + "not be replaced, unless the scheduling data file says otherwise.",
        arity = 1)
    public boolean ignoreDuplicates = false;

    @Parameter(names = "-never_delete_job_groups",
        description = "Comma separated job groups that pre-processing commands never delete.")
    public List<String> neverDeleteJobGroups = ImmutableList.of();

    @Parameter(names = "-never_delete_trigger_groups",
        description = "Comma separated trigger groups that pre-processing commands never delete.")
    public List<String> neverDeleteTriggerGroups = ImmutableList.of();

    @Parameter(names = "-scheduling_data_validate",
        description = "Validate scheduling data files against the bundled schema.",
        arity = 1)
    public boolean validate = true;

    @Parameter(names = "-trigger_add_max_attempts",
        validateValueWith = PositiveNumber.class,
        description = "Maximum number of attempts to add a trigger that keeps colliding with "
            + "triggers added concurrently by other scheduler instances.")
    public int triggerAddMaxAttempts = 10;

    @Parameter(names = "-trigger_add_initial_backoff_ms",
        validateValueWith = PositiveNumber.class,
        description = "Initial backoff delay between trigger add attempts, in milliseconds.")
    public long triggerAddInitialBackoffMs = 100;

    @Parameter(names = "-trigger_add_max_backoff_ms",
        validateValueWith = PositiveNumber.class,
        description = "Max backoff delay between trigger add attempts, in milliseconds.")
    public long triggerAddMaxBackoffMs = 5000;
  }

  private final Options options;

  public SchedulingDataModule(Options options) {
    this.options = options;
  }

  @Override
  protected void configure() {
    bind(Clock.class).toInstance(Clock.SYSTEM_CLOCK);
    bind(JobTypeLoader.class).to(ClassLoadHelperJobTypeLoader.class);
    bind(BackoffStrategy.class).toInstance(new TruncatedBinaryBackoff(
        Duration.ofMillis(options.triggerAddInitialBackoffMs),
        Duration.ofMillis(options.triggerAddMaxBackoffMs)));
    bind(new TypeLiteral<Integer>() { })
        .annotatedWith(MaxTriggerAddAttempts.class)
        .toInstance(options.triggerAddMaxAttempts);

    bind(SchemaValidator.class).in(Singleton.class);
    bind(SchedulingDataParser.class).in(Singleton.class);
    bind(SchedulingDataExtractor.class).in(Singleton.class);
    bind(PreProcessor.class).in(Singleton.class);
    bind(ScheduleReconciler.class).in(Singleton.class);
  }

  @Provides
  @Singleton
  Schema provideSchema() {
    return SchemaValidator.loadBundledSchema();
  }

  @Provides
  @Singleton
  ClassLoadHelper provideClassLoadHelper() {
    ClassLoadHelper classLoadHelper = new CascadingClassLoadHelper();
    classLoadHelper.initialize();
    return classLoadHelper;
  }

  @Provides
  SchedulingDataProcessor provideProcessor(
      SchemaValidator validator,
      SchedulingDataParser parser,
      SchedulingDataExtractor extractor,
      PreProcessor preProcessor,
      ScheduleReconciler reconciler) {

    SchedulingDataProcessor processor =
        new SchedulingDataProcessor(validator, parser, extractor, preProcessor, reconciler);
    processor.setDefaultDirectives(
        new ProcessingDirectives(options.overwriteExistingData, options.ignoreDuplicates));
    processor.setValidating(options.validate);
    for (String group : options.neverDeleteJobGroups) {
      processor.addJobGroupToNeverDelete(group);
    }
    for (String group : options.neverDeleteTriggerGroups) {
      processor.addTriggerGroupToNeverDelete(group);
    }
    return processor;
  }
}
