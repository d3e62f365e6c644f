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

import com.google.common.base.Strings;

import static java.util.Objects.requireNonNull;

/**
 * Identity of a job or trigger within the scheduler namespace.
 */
public final class Key {
  /**
   * Group assigned to keys declared without one. Matches Quartz's default group.
   */
  public static final String DEFAULT_GROUP = org.quartz.utils.Key.DEFAULT_GROUP;

  private final String name;
  private final String group;

  private Key(String name, String group) {
    this.name = requireNonNull(name);
    this.group = requireNonNull(group);
  }

  /**
   * Creates a key, substituting {@link #DEFAULT_GROUP} when {@code group} is null or empty.
   *
   * @param name Key name.
   * @param group Key group, possibly null.
   * @return A new key.
   */
  public static Key of(String name, @Nullable String group) {
    return new Key(name, Strings.isNullOrEmpty(group) ? DEFAULT_GROUP : group);
  }

  public String getName() {
    return name;
  }

  public String getGroup() {
    return group;
  }

  /**
   * Fully qualified form of this key, {@code group.name}.
   */
  public String canonicalString() {
    return group + "." + name;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Key)) {
      return false;
    }

    Key other = (Key) o;
    return name.equals(other.name) && group.equals(other.group);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, group);
  }

  @Override
  public String toString() {
    return canonicalString();
  }
}
