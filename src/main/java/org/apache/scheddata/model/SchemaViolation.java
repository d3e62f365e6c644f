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

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * A problem reported while validating a document against the scheduling data schema.
 */
public final class SchemaViolation {
  public enum Severity {
    WARNING,
    ERROR,
    FATAL
  }

  private final Severity severity;
  private final int lineNumber;
  private final int columnNumber;
  private final String message;

  public SchemaViolation(Severity severity, int lineNumber, int columnNumber, String message) {
    this.severity = requireNonNull(severity);
    this.lineNumber = lineNumber;
    this.columnNumber = columnNumber;
    this.message = requireNonNull(message);
  }

  public Severity getSeverity() {
    return severity;
  }

  public int getLineNumber() {
    return lineNumber;
  }

  public int getColumnNumber() {
    return columnNumber;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof SchemaViolation)) {
      return false;
    }

    SchemaViolation other = (SchemaViolation) o;
    return severity == other.severity
        && lineNumber == other.lineNumber
        && columnNumber == other.columnNumber
        && message.equals(other.message);
  }

  @Override
  public int hashCode() {
    return Objects.hash(severity, lineNumber, columnNumber, message);
  }

  @Override
  public String toString() {
    return String.format("%s at %d:%d: %s", severity, lineNumber, columnNumber, message);
  }
}
