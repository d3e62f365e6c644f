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

import com.beust.jcommander.JCommander;

import org.apache.scheddata.SchedulingDataMain;

/**
 * Parses command line options and populates {@link CliOptions}.
 */
public final class CommandLine {

  private CommandLine() {
    // Utility class.
  }

  /**
   * Creates a parser bound to the option objects of {@code options}.
   *
   * @param options Options to populate.
   * @return A parser for the command line.
   */
  public static JCommander prepareParser(CliOptions options) {
    JCommander.Builder builder = JCommander.newBuilder()
        .programName(SchedulingDataMain.class.getName());
    for (Object optionsObject : options.getOptionsObjects()) {
      builder.addObject(optionsObject);
    }
    return builder.build();
  }

  /**
   * Applies arg values to a new options object.
   *
   * @param args Command line arguments.
   * @return The populated options.
   * @throws com.beust.jcommander.ParameterException If the arguments are invalid.
   */
  public static CliOptions parseOptions(String... args) {
    CliOptions options = new CliOptions();
    prepareParser(options).parse(args);
    return options;
  }
}
