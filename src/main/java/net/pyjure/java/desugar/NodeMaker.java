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
import java.util.Arrays;
import java.util.List;
import javax.annotation.Nullable;
import net.pyjure.java.syntax.Location;
import net.pyjure.java.syntax.Node;

/**
 * A NodeMaker builds the nodes of an expansion, all at the location of the node they are derived
 * from.
 */
final class NodeMaker {

  private final Location loc;

  private NodeMaker(Location loc) {
    this.loc = loc;
  }

  /** Returns a maker of nodes located at {@code origin}. */
  static NodeMaker at(Node origin) {
    return new NodeMaker(origin.location());
  }

  static NodeMaker at(Location loc) {
    return new NodeMaker(loc);
  }

  Location location() {
    return loc;
  }

  Node make(Node.Tag tag, Node... children) {
    return Node.of(tag, loc, children);
  }

  Node make(Node.Tag tag, List<Node> children) {
    return Node.create(tag, loc, null, children);
  }

  Node id(String name) {
    return Node.id(loc, name);
  }

  /** Returns {@code (builtin "name" args...)}. */
  Node builtin(String name, Node... args) {
    return Node.withValue(Node.Tag.BUILTIN, loc, name, args);
  }

  Node builtin(String name, List<Node> args) {
    return Node.create(Node.Tag.BUILTIN, loc, name, args);
  }

  Node bind(Node target, Node value) {
    return make(Node.Tag.BIND, target, value);
  }

  Node assign(Node target, Node value) {
    return make(Node.Tag.ASSIGN, value, target);
  }

  Node suite(Node... statements) {
    return suite(Arrays.asList(statements));
  }

  /** Returns a surface suite of the non-null statements. */
  Node suite(List<Node> statements) {
    List<Node> present = new ArrayList<>(statements.size());
    for (Node statement : statements) {
      if (statement != null) {
        present.add(statement);
      }
    }
    return make(Node.Tag.SUITE, present);
  }

  Node ifNode(Node test, Node then, @Nullable Node otherwise) {
    return make(Node.Tag.IF, test, then, otherwise);
  }

  /** Returns a call of {@code callee} with the given positional arguments. */
  Node call(Node callee, Node... args) {
    return make(Node.Tag.CALL, callee, make(Node.Tag.ARGS, args));
  }

  /** Returns the method call {@code obj.method(args...)}. */
  Node methodCall(Node obj, String method, Node... args) {
    return call(make(Node.Tag.ATTRIBUTE, obj, id(method)), args);
  }

  /** Returns a constant of a literal without value, such as {@code None}. */
  Node constant(Node.Tag literal) {
    return make(Node.Tag.CONSTANT, make(literal));
  }

  Node none() {
    return constant(Node.Tag.NONE);
  }

  Node integer(long value) {
    return make(Node.Tag.CONSTANT, Node.withValue(Node.Tag.INTEGER, loc, Long.toString(value)));
  }

  Node string(String value) {
    return make(Node.Tag.CONSTANT, Node.withValue(Node.Tag.STRING, loc, value));
  }

  /** Returns the test {@code (builtin "truth" x)}. */
  Node truth(Node x) {
    return builtin(Builtins.TRUTH, x);
  }
}
