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

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;

import static java.util.Objects.requireNonNull;

/**
 * A single job data map entry. Values may be absent.
 */
public final class DataEntry {
  private final String key;
  @Nullable
  private final String value;

  public DataEntry(String key, @Nullable String value) {
    this.key = requireNonNull(key);
    this.value = value;
  }

  public String getKey() {
    return key;
  }

  @Nullable
  public String getValue() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof DataEntry)) {
      return false;
    }

    DataEntry other = (DataEntry) o;
    return key.equals(other.key) && Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(key, value);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("key", key)
        .add("value", value)
        .toString();
  }
}
