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

import java.util.List;

import com.google.common.collect.ImmutableList;

import org.apache.scheddata.SchedulingDataMain;
import org.apache.scheddata.SchedulingDataModule;

/**
 * All command line options, grouped by the component that consumes them.
 */
public class CliOptions {
  public final SchedulingDataMain.Options main = new SchedulingDataMain.Options();
  public final SchedulingDataModule.Options processor = new SchedulingDataModule.Options();

  List<Object> getOptionsObjects() {
    return ImmutableList.of(main, processor);
  }
}
