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

import java.io.IOException;

import javax.inject.Inject;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Guice;
import com.google.inject.Injector;

import org.apache.scheddata.config.CliOptions;
import org.apache.scheddata.config.CommandLine;
import org.apache.scheddata.quartz.JobTypeLoadException;
import org.apache.scheddata.xml.SchedulingDataException;
import org.apache.scheddata.xml.ValidationException;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Applies a scheduling data file to a Quartz scheduler and exits.
 */
public class SchedulingDataMain {
  private static final Logger LOG = LoggerFactory.getLogger(SchedulingDataMain.class);

  @Parameters(separators = "=")
  public static class Options {
    @Parameter(names = "-scheduling_data_file",
        description = "Scheduling data file to apply, looked up on the file system first and "
            + "then on the classpath.")
    public String schedulingDataFile = SchedulingDataProcessor.DEFAULT_FILE_NAME;

    @Parameter(names = "-quartz_properties",
        description = "Quartz properties file describing the scheduler to apply the file to. "
            + "An in-memory scheduler is used when absent.")
    public String quartzProperties;

    @Parameter(names = "-fail_on_validation_errors",
        description = "Refuse to apply a file that does not conform to the schema.",
        arity = 1)
    public boolean failOnValidationErrors = true;
  }

  private final SchedulingDataProcessor processor;
  private final Scheduler scheduler;

  @Inject
  SchedulingDataMain(SchedulingDataProcessor processor, Scheduler scheduler) {
    this.processor = requireNonNull(processor);
    this.scheduler = requireNonNull(scheduler);
  }

  @VisibleForTesting
  void run(Options options) throws IOException, SchedulingDataException, JobTypeLoadException,
      ValidationException, SchedulerException {

    processor.processFile(options.schedulingDataFile);
    if (options.failOnValidationErrors) {
      processor.checkValidation();
    }
    processor.executePreProcessCommands(scheduler);
    processor.scheduleJobs(scheduler);
    LOG.info("Applied {} to scheduler {}.",
        options.schedulingDataFile,
        scheduler.getSchedulerName());
  }

  /**
   * Applies the configured file.
   *
   * @param options Parsed command line options.
   * @return Whether the file was applied.
   */
  @VisibleForTesting
  static boolean applyConfiguredFile(CliOptions options) {
    Injector injector = Guice.createInjector(
        new SchedulingDataModule(options.processor),
        new QuartzSchedulerModule(options.main.quartzProperties));

    Scheduler scheduler = injector.getInstance(Scheduler.class);
    boolean applied = false;
    try {
      injector.getInstance(SchedulingDataMain.class).run(options.main);
      applied = true;
    } catch (ValidationException e) {
      LOG.error("{} is not valid scheduling data:", options.main.schedulingDataFile);
      e.getViolations().forEach(violation -> LOG.error("  {}", violation));
    } catch (IOException | SchedulingDataException | JobTypeLoadException e) {
      LOG.error("Failed to load " + options.main.schedulingDataFile, e);
    } catch (SchedulerException e) {
      LOG.error("Failed to apply " + options.main.schedulingDataFile, e);
    } finally {
      try {
        scheduler.shutdown();
      } catch (SchedulerException e) {
        LOG.error("Failed to shut down scheduler", e);
        applied = false;
      }
    }
    return applied;
  }

  public static void main(String... args) {
    CliOptions options;
    try {
      options = CommandLine.parseOptions(args);
    } catch (ParameterException e) {
      LOG.error(e.getMessage());
      CommandLine.prepareParser(new CliOptions()).usage();
      System.exit(1);
      return;
    }

    System.exit(applyConfiguredFile(options) ? 0 : 1);
  }
}
