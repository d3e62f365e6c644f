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

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

public class KeyTest {
  @Test
  public void testDefaultGroup() {
    assertEquals("DEFAULT", Key.of("report", null).getGroup());
    assertEquals("DEFAULT", Key.of("report", "").getGroup());
    assertEquals(Key.of("report", null), Key.of("report", Key.DEFAULT_GROUP));
  }

  @Test
  public void testEquality() {
    assertEquals(Key.of("report", "group1"), Key.of("report", "group1"));
    assertEquals(Key.of("report", "group1").hashCode(), Key.of("report", "group1").hashCode());
    assertNotEquals(Key.of("report", "group1"), Key.of("report", "group2"));
    assertNotEquals(Key.of("report", "group1"), Key.of("audit", "group1"));
  }

  @Test
  public void testSeparatorDoesNotCollide() {
    // Both render as "a.b.c", but are distinct keys.
    assertEquals(Key.of("c", "a.b").canonicalString(), Key.of("b.c", "a").canonicalString());
    assertNotEquals(Key.of("c", "a.b"), Key.of("b.c", "a"));
  }

  @Test
  public void testCanonicalString() {
    assertEquals("group1.report", Key.of("report", "group1").canonicalString());
    assertEquals("group1.report", Key.of("report", "group1").toString());
  }

  @Test(expected = NullPointerException.class)
  public void testNameRequired() {
    Key.of(null, "group1");
  }
}
