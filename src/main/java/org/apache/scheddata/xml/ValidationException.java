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

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import org.apache.scheddata.model.SchemaViolation;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Reports every schema violation found in a scheduling data document.
 */
public class ValidationException extends Exception {
  private final ImmutableList<SchemaViolation> violations;

  public ValidationException(List<SchemaViolation> violations) {
    super(formatMessage(violations));
    checkArgument(!violations.isEmpty());
    this.violations = ImmutableList.copyOf(violations);
  }

  public List<SchemaViolation> getViolations() {
    return violations;
  }

  private static String formatMessage(List<SchemaViolation> violations) {
    return "Encountered " + violations.size() + " validation exceptions:\n"
        + Joiner.on('\n').join(violations);
  }
}
