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
package org.apache.scheddata.xml;

import java.text.ParseException;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.TimeZone;

import javax.annotation.Nullable;
import javax.inject.Inject;
import javax.xml.datatype.DatatypeConfigurationException;
import javax.xml.datatype.DatatypeFactory;

import com.google.common.collect.ImmutableList;

import org.apache.scheddata.common.util.Clock;
import org.apache.scheddata.model.CronSchedule;
import org.apache.scheddata.model.JobDefinition;
import org.apache.scheddata.model.Key;
import org.apache.scheddata.model.MisfireInstructions;
import org.apache.scheddata.model.PreProcessCommands;
import org.apache.scheddata.model.ProcessingDirectives;
import org.apache.scheddata.model.SchedulingData;
import org.apache.scheddata.model.SchemaViolation;
import org.apache.scheddata.model.SimpleSchedule;
import org.apache.scheddata.model.TriggerDefinition;
import org.apache.scheddata.model.TriggerSchedule;
import org.apache.scheddata.quartz.JobTypeLoadException;
import org.apache.scheddata.quartz.JobTypeLoader;
import org.quartz.CronExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import static java.util.Objects.requireNonNull;

import static org.apache.scheddata.xml.Elements.bool;
import static org.apache.scheddata.xml.Elements.child;
import static org.apache.scheddata.xml.Elements.children;
import static org.apache.scheddata.xml.Elements.localName;
import static org.apache.scheddata.xml.Elements.text;
import static org.apache.scheddata.xml.Elements.trimToNull;

/**
 * Walks a parsed scheduling data document and builds the in-memory model from it.
 *
 * <p>Extraction happens in document section order: pre-processing commands, then directives,
 * then jobs, then triggers. Jobs and triggers keep the order they are declared in.
 */
public class SchedulingDataExtractor {
  private static final Logger LOG = LoggerFactory.getLogger(SchedulingDataExtractor.class);

  static final String ROOT = "job-scheduling-data";

  /**
   * Token accepted for {@code repeat-count} to repeat forever.
   */
  public static final String REPEAT_INDEFINITELY = "REPEAT_INDEFINITELY";

  private final JobTypeLoader jobTypeLoader;
  private final Clock clock;
  private final DatatypeFactory datatypeFactory;

  @Inject
  public SchedulingDataExtractor(JobTypeLoader jobTypeLoader, Clock clock) {
    this.jobTypeLoader = requireNonNull(jobTypeLoader);
    this.clock = requireNonNull(clock);
    try {
      this.datatypeFactory = DatatypeFactory.newInstance();
    } catch (DatatypeConfigurationException e) {
      throw new IllegalStateException(e);
    }
  }

  /**
   * Extracts the scheduling data held in a document.
   *
   * @param document Parsed document.
   * @param defaults Directives in effect when the document does not declare any.
   * @param violations Schema violations already found in the document, carried into the result.
   * @return The loaded data.
   * @throws SchedulingDataException If the document declares unusable values.
   * @throws JobTypeLoadException If a job type cannot be loaded.
   */
  public SchedulingData extract(
      Document document,
      ProcessingDirectives defaults,
      List<SchemaViolation> violations) throws SchedulingDataException, JobTypeLoadException {

    Element root = document == null ? null : document.getDocumentElement();
    if (root == null || !ROOT.equals(localName(root))) {
      throw new SchedulingDataException("Job definition data from XML was null after parsing.");
    }

    PreProcessCommands commands = extractCommands(root);
    ProcessingDirectives directives = extractDirectives(root, defaults);

    List<Element> schedules = children(root, "schedule");
    if (schedules.size() > 1) {
      LOG.warn("Found {} schedule sections, only the first is used.", schedules.size());
    }
    Element schedule = schedules.isEmpty() ? null : schedules.get(0);

    List<JobDefinition> jobs = extractJobs(schedule);
    List<TriggerDefinition> triggers = extractTriggers(schedule);

    return new SchedulingData(commands, directives, jobs, triggers, violations);
  }

  private PreProcessCommands extractCommands(Element root) throws SchedulingDataException {
    PreProcessCommands.Builder commands = PreProcessCommands.builder();
    for (Element command : children(root, "pre-processing-commands")) {
      for (Element group : children(command, "delete-jobs-in-group")) {
        String name = trimToNull(group.getTextContent());
        if (name != null) {
          commands.deleteJobsInGroup(name);
        }
      }
      for (Element group : children(command, "delete-triggers-in-group")) {
        String name = trimToNull(group.getTextContent());
        if (name != null) {
          commands.deleteTriggersInGroup(name);
        }
      }
      for (Element job : children(command, "delete-job")) {
        commands.deleteJob(deleteCommandKey(job));
      }
      for (Element trigger : children(command, "delete-trigger")) {
        commands.deleteTrigger(deleteCommandKey(trigger));
      }
    }

    PreProcessCommands built = commands.build();
    LOG.debug("Found {} delete job group commands.", built.getJobGroupsToDelete().size());
    LOG.debug("Found {} delete trigger group commands.", built.getTriggerGroupsToDelete().size());
    LOG.debug("Found {} delete job commands.", built.getJobsToDelete().size());
    LOG.debug("Found {} delete trigger commands.", built.getTriggersToDelete().size());
    return built;
  }

  private static Key deleteCommandKey(Element command) throws SchedulingDataException {
    String name = text(command, "name");
    if (name == null) {
      throw new SchedulingDataException(
          "Encountered a '" + localName(command) + "' command without a name specified.");
    }
    return Key.of(name, text(command, "group"));
  }

  private static ProcessingDirectives extractDirectives(
      Element root,
      ProcessingDirectives defaults) throws SchedulingDataException {

    List<Element> declaredBlocks = children(root, "processing-directives");
    if (declaredBlocks.size() > 1) {
      LOG.warn("Found {} processing directives sections, only the first is used.",
          declaredBlocks.size());
    }
    Element directives = declaredBlocks.isEmpty() ? null : declaredBlocks.get(0);
    if (directives == null) {
      LOG.debug("No processing directives specified, defaulting to {}", defaults);
      return defaults;
    }

    ProcessingDirectives declared = new ProcessingDirectives(
        bool(directives, "overwrite-existing-data", defaults.isOverwriteExistingData()),
        bool(directives, "ignore-duplicates", defaults.isIgnoreDuplicates()));
    LOG.debug("Directives specified as {}", declared);
    return declared;
  }

  private List<JobDefinition> extractJobs(@Nullable Element schedule)
      throws SchedulingDataException, JobTypeLoadException {

    List<Element> jobElements = schedule == null ? ImmutableList.of() : children(schedule, "job");
    LOG.debug("Found {} job definitions.", jobElements.size());

    ImmutableList.Builder<JobDefinition> jobs = ImmutableList.builder();
    for (Element jobElement : jobElements) {
      JobDefinition job = extractJob(jobElement);
      LOG.debug("Parsed job definition: {}", job);
      jobs.add(job);
    }
    return jobs.build();
  }

  private JobDefinition extractJob(Element element)
      throws SchedulingDataException, JobTypeLoadException {

    String name = text(element, "name");
    if (name == null) {
      throw new SchedulingDataException("Encountered a job without a name specified.");
    }

    JobDefinition.Builder job = JobDefinition.builder(
            Key.of(name, text(element, "group")),
            jobTypeLoader.loadJobType(text(element, "job-type")))
        .setDescription(text(element, "description"))
        .setVolatile(bool(element, "volatility", false))
        .setDurable(bool(element, "durability", false))
        .setRequestsRecovery(bool(element, "recover", false));

    for (Element entry : dataMapEntries(element)) {
      job.addDataEntry(dataEntryKey(entry), text(entry, "value"));
    }
    return job.build();
  }

  private List<TriggerDefinition> extractTriggers(@Nullable Element schedule)
      throws SchedulingDataException {

    List<Element> triggerElements =
        schedule == null ? ImmutableList.of() : children(schedule, "trigger");
    LOG.debug("Found {} trigger definitions.", triggerElements.size());

    ImmutableList.Builder<TriggerDefinition> triggers = ImmutableList.builder();
    for (Element triggerElement : triggerElements) {
      TriggerDefinition trigger = extractTrigger(triggerElement);
      LOG.debug("Parsed trigger definition: {}", trigger);
      triggers.add(trigger);
    }
    return triggers.build();
  }

  private TriggerDefinition extractTrigger(Element triggerElement)
      throws SchedulingDataException {

    Element shape;
    TriggerSchedule schedule;
    Element simple = child(triggerElement, "simple");
    Element cron = child(triggerElement, "cron");
    if (simple != null) {
      shape = simple;
      schedule = new SimpleSchedule(
          parseRepeatCount(text(simple, "repeat-count")),
          parseRepeatInterval(text(simple, "repeat-interval")));
    } else if (cron != null) {
      shape = cron;
      String cronExpression = text(cron, "cron-expression");
      if (cronExpression == null) {
        throw new SchedulingDataException("Encountered a cron trigger without a cron expression.");
      }
      try {
        CronExpression.validateExpression(cronExpression);
      } catch (ParseException e) {
        throw new SchedulingDataException(
            "Invalid cron expression '" + cronExpression + "': " + e.getMessage(), e);
      }
      schedule = new CronSchedule(cronExpression, parseTimeZone(text(cron, "time-zone")));
    } else {
      throw new SchedulingDataException("Unknown trigger type in XML configuration.");
    }

    String name = text(shape, "name");
    if (name == null) {
      throw new SchedulingDataException("Encountered a trigger without a name specified.");
    }
    Key key = Key.of(name, text(shape, "group"));

    String jobName = text(shape, "job-name");
    if (jobName == null) {
      throw new SchedulingDataException("Trigger " + key + " does not name the job it fires.");
    }

    String startTime = text(shape, "start-time");
    TriggerDefinition.Builder trigger = TriggerDefinition.builder(
            key,
            Key.of(jobName, text(shape, "job-group")),
            schedule)
        .setDescription(text(shape, "description"))
        .setCalendarName(text(shape, "calendar-name"))
        .setVolatile(bool(shape, "volatility", true))
        .setStartTime(startTime == null ? clock.nowInstant() : parseDateTime(startTime))
        .setEndTime(parseOptionalDateTime(text(shape, "end-time")));

    String misfireInstruction = text(shape, "misfire-instruction");
    if (misfireInstruction != null) {
      trigger.setMisfireInstruction(
          MisfireInstructions.resolve(schedule.getKind(), misfireInstruction)
              .orElseThrow(() -> new SchedulingDataException(
                  "Unknown misfire instruction " + misfireInstruction + " for "
                      + schedule.getKind() + " trigger " + key)));
    }

    for (Element entry : dataMapEntries(shape)) {
      trigger.addDataEntry(dataEntryKey(entry), text(entry, "value"));
    }

    try {
      return trigger.build();
    } catch (IllegalArgumentException e) {
      throw new SchedulingDataException(e.getMessage(), e);
    }
  }

  private static List<Element> dataMapEntries(Element parent) {
    Element dataMap = child(parent, "job-data-map");
    return dataMap == null ? ImmutableList.of() : children(dataMap, "entry");
  }

  private static String dataEntryKey(Element entry) throws SchedulingDataException {
    String key = text(entry, "key");
    if (key == null) {
      throw new SchedulingDataException("Encountered a job data map entry without a key.");
    }
    return key;
  }

  static int parseRepeatCount(@Nullable String repeatCount) throws SchedulingDataException {
    if (repeatCount == null) {
      return 0;
    }
    if (REPEAT_INDEFINITELY.equals(repeatCount)) {
      return SimpleSchedule.REPEAT_INDEFINITELY;
    }

    int value;
    try {
      value = Integer.parseInt(repeatCount, 10);
    } catch (NumberFormatException e) {
      throw new SchedulingDataException("Invalid repeat count " + repeatCount, e);
    }
    if (value < SimpleSchedule.REPEAT_INDEFINITELY) {
      throw new SchedulingDataException("Invalid repeat count " + repeatCount);
    }
    return value;
  }

  static Duration parseRepeatInterval(@Nullable String repeatInterval)
      throws SchedulingDataException {

    if (repeatInterval == null) {
      return Duration.ZERO;
    }

    long millis;
    try {
      millis = Long.parseLong(repeatInterval, 10);
    } catch (NumberFormatException e) {
      throw new SchedulingDataException("Invalid repeat interval " + repeatInterval, e);
    }
    if (millis < 0) {
      throw new SchedulingDataException("Negative repeat interval " + repeatInterval);
    }
    return Duration.ofMillis(millis);
  }

  @Nullable
  static TimeZone parseTimeZone(@Nullable String timeZone) throws SchedulingDataException {
    if (timeZone == null) {
      return null;
    }

    try {
      return TimeZone.getTimeZone(ZoneId.of(timeZone, ZoneId.SHORT_IDS));
    } catch (DateTimeException e) {
      throw new SchedulingDataException("Unknown time zone " + timeZone, e);
    }
  }

  @Nullable
  private Instant parseOptionalDateTime(@Nullable String value) throws SchedulingDataException {
    return value == null ? null : parseDateTime(value);
  }

  private Instant parseDateTime(String value) throws SchedulingDataException {
    try {
      return datatypeFactory.newXMLGregorianCalendar(value).toGregorianCalendar().toInstant();
    } catch (IllegalArgumentException e) {
      throw new SchedulingDataException("Invalid date-time " + value, e);
    }
  }
}
