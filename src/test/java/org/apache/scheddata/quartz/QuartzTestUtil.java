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
import java.util.Properties;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.scheddata.NoOpJob;
import org.apache.scheddata.model.JobDefinition;
import org.apache.scheddata.model.Key;
import org.apache.scheddata.model.SimpleSchedule;
import org.apache.scheddata.model.TriggerDefinition;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.impl.StdSchedulerFactory;
import org.quartz.simpl.RAMJobStore;
import org.quartz.simpl.SimpleThreadPool;

import static org.quartz.impl.StdSchedulerFactory.PROP_JOB_STORE_CLASS;
import static org.quartz.impl.StdSchedulerFactory.PROP_SCHED_INSTANCE_ID;
import static org.quartz.impl.StdSchedulerFactory.PROP_SCHED_NAME;
import static org.quartz.impl.StdSchedulerFactory.PROP_THREAD_POOL_CLASS;
import static org.quartz.impl.StdSchedulerFactory.PROP_THREAD_POOL_PREFIX;

/**
 * Job and trigger definitions and schedulers for tests.
 */
public final class QuartzTestUtil {
  public static final Instant START = Instant.parse("2030-01-01T00:00:00Z");

  public static final Key JOB_KEY = Key.of("reportJob", "group1");
  public static final Key TRIGGER_KEY = Key.of("reportTrigger", "group1");

  private static final AtomicLong ID_GENERATOR = new AtomicLong();

  private QuartzTestUtil() {
    // Utility class.
  }

  public static JobDefinition job(Key key, boolean durable) {
    return JobDefinition.builder(key, NoOpJob.class)
        .setDurable(durable)
        .addDataEntry("owner", "reports")
        .build();
  }

  public static TriggerDefinition trigger(Key key, Key jobKey) {
    return trigger(key, jobKey, 3);
  }

  public static TriggerDefinition trigger(Key key, Key jobKey, int repeatCount) {
    return TriggerDefinition.builder(
            key,
            jobKey,
            new SimpleSchedule(repeatCount, Duration.ofMinutes(1)))
        .setStartTime(START)
        .build();
  }

  /**
   * Creates a scheduler that keeps its data in memory. The scheduler is not started.
   */
  public static Scheduler newRamScheduler() throws SchedulerException {
    Properties props = new Properties();
    String name = "scheddata-test-" + ID_GENERATOR.incrementAndGet();
    props.setProperty(PROP_SCHED_NAME, name);
    props.setProperty(PROP_SCHED_INSTANCE_ID, name);
    props.setProperty(PROP_JOB_STORE_CLASS, RAMJobStore.class.getCanonicalName());
    props.setProperty(PROP_THREAD_POOL_CLASS, SimpleThreadPool.class.getCanonicalName());
    props.setProperty(PROP_THREAD_POOL_PREFIX + ".threadCount", "1");
    props.setProperty(PROP_THREAD_POOL_PREFIX + ".makeThreadsDaemons", Boolean.TRUE.toString());
    return new StdSchedulerFactory(props).getScheduler();
  }
}
