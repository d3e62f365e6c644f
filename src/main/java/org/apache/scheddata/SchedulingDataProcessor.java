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

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URL;
import java.util.List;
import java.util.Set;

import javax.inject.Inject;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.common.io.CharStreams;
import com.google.common.io.Files;
import com.google.common.io.Resources;

import org.apache.scheddata.model.ProcessingDirectives;
import org.apache.scheddata.model.SchedulingData;
import org.apache.scheddata.model.SchemaViolation;
import org.apache.scheddata.quartz.JobTypeLoadException;
import org.apache.scheddata.quartz.NeverDeleteGroups;
import org.apache.scheddata.quartz.PreProcessor;
import org.apache.scheddata.quartz.ScheduleReconciler;
import org.apache.scheddata.xml.SchedulingDataException;
import org.apache.scheddata.xml.SchedulingDataExtractor;
import org.apache.scheddata.xml.SchedulingDataParser;
import org.apache.scheddata.xml.SchemaValidator;
import org.apache.scheddata.xml.ValidationException;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Loads scheduling data documents and applies them to a scheduler.
 *
 * <p>Each {@code process} call replaces the data loaded by the previous one and starts from the
 * default processing directives; never-delete groups are kept across calls. Instances are not
 * thread-safe.
 */
public class SchedulingDataProcessor {
  private static final Logger LOG = LoggerFactory.getLogger(SchedulingDataProcessor.class);

  public static final String DEFAULT_FILE_NAME = "quartz_jobs.xml";

  private final SchemaValidator validator;
  private final SchedulingDataParser parser;
  private final SchedulingDataExtractor extractor;
  private final PreProcessor preProcessor;
  private final ScheduleReconciler reconciler;

  private final Set<String> jobGroupsToNeverDelete = Sets.newLinkedHashSet();
  private final Set<String> triggerGroupsToNeverDelete = Sets.newLinkedHashSet();
  private ProcessingDirectives defaultDirectives = ProcessingDirectives.DEFAULT;
  private boolean validating = true;

  private List<SchemaViolation> violations = ImmutableList.of();
  private SchedulingData loaded = SchedulingData.EMPTY;

  @Inject
  public SchedulingDataProcessor(
      SchemaValidator validator,
      SchedulingDataParser parser,
      SchedulingDataExtractor extractor,
      PreProcessor preProcessor,
      ScheduleReconciler reconciler) {

    this.validator = requireNonNull(validator);
    this.parser = requireNonNull(parser);
    this.extractor = requireNonNull(extractor);
    this.preProcessor = requireNonNull(preProcessor);
    this.reconciler = requireNonNull(reconciler);
  }

  /**
   * Processes {@value #DEFAULT_FILE_NAME}.
   *
   * @return The loaded data.
   * @throws IOException If the file cannot be read.
   * @throws SchedulingDataException If the document is malformed or declares unusable values.
   * @throws JobTypeLoadException If a job type cannot be loaded.
   */
  public SchedulingData processFile()
      throws IOException, SchedulingDataException, JobTypeLoadException {

    return processFile(DEFAULT_FILE_NAME);
  }

  /**
   * Processes a document read from the file system or, when no such file exists, from the
   * classpath.
   *
   * @param fileName File or classpath resource name.
   * @return The loaded data.
   * @throws IOException If the document cannot be read.
   * @throws SchedulingDataException If the document is malformed or declares unusable values.
   * @throws JobTypeLoadException If a job type cannot be loaded.
   */
  public SchedulingData processFile(String fileName)
      throws IOException, SchedulingDataException, JobTypeLoadException {

    requireNonNull(fileName);
    LOG.info("Parsing XML file: {} validating: {}", fileName, validating);

    File file = new File(fileName);
    String xml;
    if (file.isFile()) {
      xml = Files.asCharSource(file, UTF_8).read();
    } else {
      URL resource = Thread.currentThread().getContextClassLoader().getResource(fileName);
      if (resource == null) {
        throw new FileNotFoundException("No scheduling data file or resource: " + fileName);
      }
      xml = Resources.asCharSource(resource, UTF_8).read();
    }
    return processInternal(xml);
  }

  /**
   * Processes a document read from a stream. The stream is not closed.
   *
   * @param stream Document bytes, UTF-8 encoded.
   * @param systemId Name of the document's source, for logging.
   * @return The loaded data.
   * @throws IOException If the stream cannot be read.
   * @throws SchedulingDataException If the document is malformed or declares unusable values.
   * @throws JobTypeLoadException If a job type cannot be loaded.
   */
  public SchedulingData processStream(InputStream stream, String systemId)
      throws IOException, SchedulingDataException, JobTypeLoadException {

    requireNonNull(stream);
    LOG.info("Parsing XML from stream with systemId: {} validating: {}", systemId, validating);

    Reader reader = new InputStreamReader(stream, UTF_8);
    return processInternal(CharStreams.toString(reader));
  }

  /**
   * Processes a document.
   *
   * @param xml Document text.
   * @return The loaded data.
   * @throws SchedulingDataException If the document is malformed or declares unusable values.
   * @throws JobTypeLoadException If a job type cannot be loaded.
   */
  public SchedulingData process(String xml) throws SchedulingDataException, JobTypeLoadException {
    requireNonNull(xml);
    return processInternal(xml);
  }

  private SchedulingData processInternal(String xml)
      throws SchedulingDataException, JobTypeLoadException {

    loaded = SchedulingData.EMPTY;
    violations = validating ? validator.validate(xml) : ImmutableList.of();
    if (!violations.isEmpty()) {
      LOG.warn("Scheduling data has {} schema violations.", violations.size());
    }

    loaded = extractor.extract(parser.parse(xml), defaultDirectives, violations);
    LOG.debug("Loaded {} jobs and {} triggers.",
        loaded.getJobs().size(),
        loaded.getTriggers().size());
    return loaded;
  }

  /**
   * Processes {@value #DEFAULT_FILE_NAME} and applies it to a scheduler.
   *
   * @param scheduler Scheduler to apply the document to.
   * @see #processFileAndScheduleJobs(String, Scheduler)
   */
  public void processFileAndScheduleJobs(Scheduler scheduler)
      throws IOException, SchedulingDataException, JobTypeLoadException, SchedulerException {

    processFileAndScheduleJobs(DEFAULT_FILE_NAME, scheduler);
  }

  /**
   * Processes a document file, runs its pre-processing commands and schedules its jobs.
   *
   * @param fileName File or classpath resource name.
   * @param scheduler Scheduler to apply the document to.
   * @throws IOException If the document cannot be read.
   * @throws SchedulingDataException If the document is malformed or declares unusable values.
   * @throws JobTypeLoadException If a job type cannot be loaded.
   * @throws SchedulerException If applying the document fails.
   */
  public void processFileAndScheduleJobs(String fileName, Scheduler scheduler)
      throws IOException, SchedulingDataException, JobTypeLoadException, SchedulerException {

    requireNonNull(scheduler);
    processFile(fileName);
    executePreProcessCommands(scheduler);
    scheduleJobs(scheduler);
  }

  /**
   * Processes a document, runs its pre-processing commands and schedules its jobs.
   *
   * @param xml Document text.
   * @param scheduler Scheduler to apply the document to.
   * @throws SchedulingDataException If the document is malformed or declares unusable values.
   * @throws JobTypeLoadException If a job type cannot be loaded.
   * @throws SchedulerException If applying the document fails.
   */
  public void processAndScheduleJobs(String xml, Scheduler scheduler)
      throws SchedulingDataException, JobTypeLoadException, SchedulerException {

    requireNonNull(scheduler);
    process(xml);
    executePreProcessCommands(scheduler);
    scheduleJobs(scheduler);
  }

  /**
   * Runs the delete commands of the loaded document.
   *
   * @param scheduler Scheduler to delete from.
   * @throws SchedulerException If a deletion fails.
   */
  public void executePreProcessCommands(Scheduler scheduler) throws SchedulerException {
    preProcessor.execute(
        loaded.getCommands(),
        new NeverDeleteGroups(jobGroupsToNeverDelete, triggerGroupsToNeverDelete),
        scheduler);
  }

  /**
   * Stores the jobs and triggers of the loaded document.
   *
   * @param scheduler Scheduler to store into.
   * @throws SchedulerException If storing fails.
   */
  public void scheduleJobs(Scheduler scheduler) throws SchedulerException {
    reconciler.reconcile(
        loaded.getJobs(),
        loaded.getTriggers(),
        loaded.getDirectives(),
        scheduler);
  }

  /**
   * Fails if the last processed document had schema violations.
   *
   * @throws ValidationException If any violation was found.
   */
  public void checkValidation() throws ValidationException {
    if (!violations.isEmpty()) {
      throw new ValidationException(violations);
    }
  }

  public List<SchemaViolation> getValidationViolations() {
    return violations;
  }

  public SchedulingData getLoadedData() {
    return loaded;
  }

  /**
   * Overrides whether the loaded document replaces existing jobs and triggers. The next
   * {@code process} call resets this to the default directives.
   */
  public void setOverwriteExistingData(boolean overwrite) {
    loaded = loaded.withDirectives(loaded.getDirectives().withOverwriteExistingData(overwrite));
  }

  /**
   * Overrides whether the loaded document leaves existing jobs and triggers alone when it may not
   * replace them. The next {@code process} call resets this to the default directives.
   */
  public void setIgnoreDuplicates(boolean ignore) {
    loaded = loaded.withDirectives(loaded.getDirectives().withIgnoreDuplicates(ignore));
  }

  public ProcessingDirectives getDefaultDirectives() {
    return defaultDirectives;
  }

  /**
   * Sets the directives used for documents that do not declare their own.
   */
  public void setDefaultDirectives(ProcessingDirectives directives) {
    this.defaultDirectives = requireNonNull(directives);
  }

  public boolean isValidating() {
    return validating;
  }

  public void setValidating(boolean validating) {
    this.validating = validating;
  }

  public void addJobGroupToNeverDelete(String group) {
    jobGroupsToNeverDelete.add(requireNonNull(group));
  }

  public boolean removeJobGroupToNeverDelete(String group) {
    return jobGroupsToNeverDelete.remove(group);
  }

  public Set<String> getJobGroupsToNeverDelete() {
    return ImmutableSet.copyOf(jobGroupsToNeverDelete);
  }

  public void addTriggerGroupToNeverDelete(String group) {
    triggerGroupsToNeverDelete.add(requireNonNull(group));
  }

  public boolean removeTriggerGroupToNeverDelete(String group) {
    return triggerGroupsToNeverDelete.remove(group);
  }

  public Set<String> getTriggerGroupsToNeverDelete() {
    return ImmutableSet.copyOf(triggerGroupsToNeverDelete);
  }
}
