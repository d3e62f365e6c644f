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

import javax.annotation.Nullable;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import org.w3c.dom.Element;
import org.w3c.dom.Node;

/**
 * DOM navigation helpers. Elements are matched by local name so that documents without the
 * scheduling data namespace can still be read.
 */
final class Elements {
  private Elements() {
    // Utility class.
  }

  static String localName(Node node) {
    return node.getLocalName() == null ? node.getNodeName() : node.getLocalName();
  }

  /**
   * Finds the direct children of {@code parent} with the given local name, in document order.
   */
  static List<Element> children(Element parent, String name) {
    ImmutableList.Builder<Element> children = ImmutableList.builder();
    for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
      if (node.getNodeType() == Node.ELEMENT_NODE && name.equals(localName(node))) {
        children.add((Element) node);
      }
    }
    return children.build();
  }

  @Nullable
  static Element child(Element parent, String name) {
    List<Element> children = children(parent, name);
    return children.isEmpty() ? null : children.get(0);
  }

  /**
   * Returns the trimmed text of the first child named {@code name}, or null if there is no such
   * child or it holds only whitespace.
   */
  @Nullable
  static String text(Element parent, String name) {
    Element child = child(parent, name);
    return child == null ? null : trimToNull(child.getTextContent());
  }

  @Nullable
  static String trimToNull(@Nullable String value) {
    return value == null ? null : Strings.emptyToNull(value.trim());
  }

  /**
   * Reads an {@code xs:boolean} child.
   *
   * @throws SchedulingDataException If the child is present but not a boolean.
   */
  static boolean bool(Element parent, String name, boolean defaultValue)
      throws SchedulingDataException {

    String value = text(parent, name);
    if (value == null) {
      return defaultValue;
    }

    switch (value) {
      case "true":
      case "1":
        return true;
      case "false":
      case "0":
        return false;
      default:
        throw new SchedulingDataException(
            "Invalid boolean '" + value + "' for " + name + " in " + localName(parent));
    }
  }
}
