// Copyright 2026 The Pyjure Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.pyjure.java.desugar;

import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;
import net.pyjure.java.syntax.Node;

/**
 * Functions building core suites. A result of null stands for the empty suite, which the builders
 * elide; nested suites are flattened, so a suite built here never directly contains another.
 */
public final class Suites {

  private Suites() {}

  /**
   * Returns the suite made of {@code head} followed by the statements of {@code tail}, located at
   * {@code origin}. If either side is absent or an empty suite, returns the other.
   */
  @Nullable
  public static Node consSuite(Node origin, @Nullable Node head, @Nullable Node tail) {
    if (isEmpty(head)) {
      return tail;
    }
    if (isEmpty(tail)) {
      return head;
    }
    List<Node> statements = new ArrayList<>();
    addStatements(statements, head);
    addStatements(statements, tail);
    return Node.create(Node.Tag.SUITE, origin.location(), null, statements);
  }

  /**
   * Returns the suite of the given statements, or null if there are none. Null elements are
   * skipped.
   */
  @Nullable
  public static Node makeSuite(Node origin, List<Node> statements) {
    Node suite = null;
    for (int i = statements.size() - 1; i >= 0; i--) {
      suite = consSuite(origin, statements.get(i), suite);
    }
    return suite;
  }

  /**
   * Returns {@code rest} preceded by the definition. Mutually recursive definitions are kept
   * together: if {@code rest} starts with a {@code defn} group, the definition joins it, otherwise
   * it starts a new group.
   */
  public static Node makeDefn(Node origin, Node definition, @Nullable Node rest) {
    if (rest != null && rest.is(Node.Tag.DEFN)) {
      return prepend(definition, rest);
    }
    if (rest != null
        && rest.is(Node.Tag.SUITE)
        && rest.size() > 0
        && rest.child(0).is(Node.Tag.DEFN)) {
      List<Node> statements = new ArrayList<>(rest.children());
      statements.set(0, prepend(definition, rest.child(0)));
      return rest.withChildren(statements);
    }
    Node group = Node.of(Node.Tag.DEFN, origin.location(), definition);
    return consSuite(origin, group, rest);
  }

  private static Node prepend(Node definition, Node defn) {
    List<Node> definitions = new ArrayList<>();
    definitions.add(definition);
    definitions.addAll(defn.children());
    return defn.withChildren(definitions);
  }

  private static boolean isEmpty(@Nullable Node node) {
    return node == null || (node.is(Node.Tag.SUITE) && node.size() == 0);
  }

  private static void addStatements(List<Node> statements, Node node) {
    if (node.is(Node.Tag.SUITE)) {
      for (Node child : node.children()) {
        addStatements(statements, child);
      }
    } else {
      statements.add(node);
    }
  }
}
