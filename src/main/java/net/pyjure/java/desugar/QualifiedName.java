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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;
import net.pyjure.java.syntax.Location;
import net.pyjure.java.syntax.Node;

/**
 * A QualifiedName is a dotted name such as {@code a.b.c}: a non-empty sequence of non-empty
 * identifiers. Macros are looked up by qualified name.
 */
public final class QualifiedName {

  private final ImmutableList<String> parts;

  private QualifiedName(ImmutableList<String> parts) {
    Preconditions.checkArgument(!parts.isEmpty(), "empty qualified name");
    for (String part : parts) {
      Preconditions.checkArgument(!part.isEmpty(), "empty identifier in qualified name %s", parts);
    }
    this.parts = parts;
  }

  /** Returns the qualified name made of the given identifiers. */
  public static QualifiedName of(String first, String... rest) {
    return new QualifiedName(ImmutableList.<String>builder().add(first).add(rest).build());
  }

  /** Returns the qualified name made of the given identifiers, which must not be empty. */
  public static QualifiedName of(Iterable<String> parts) {
    return new QualifiedName(ImmutableList.copyOf(parts));
  }

  /**
   * Returns the qualified name denoted by an expression, or null if the expression is not a name.
   * An identifier {@code a} denotes {@code a}; an attribute access {@code x.b} denotes the name of
   * {@code x} followed by {@code b}.
   */
  @Nullable
  public static QualifiedName namify(Node expr) {
    switch (expr.tag()) {
      case ID:
        return of(expr.value());
      case ATTRIBUTE:
        QualifiedName prefix = namify(expr.child(0));
        Node id = expr.child(1);
        if (prefix == null || !id.is(Node.Tag.ID)) {
          return null;
        }
        return new QualifiedName(
            ImmutableList.<String>builder().addAll(prefix.parts).add(id.value()).build());
      default:
        return null;
    }
  }

  /**
   * Returns the expression denoting this name: an identifier, or a chain of attribute accesses on
   * one. It is the inverse of {@link #namify}.
   */
  public Node unnamify(Location loc) {
    Node expr = Node.id(loc, parts.get(0));
    for (String part : parts.subList(1, parts.size())) {
      expr = Node.of(Node.Tag.ATTRIBUTE, loc, expr, Node.id(loc, part));
    }
    return expr;
  }

  /** Returns the first identifier. */
  public String head() {
    return parts.get(0);
  }

  /** Returns the identifiers after the first. */
  public ImmutableList<String> path() {
    return parts.subList(1, parts.size());
  }

  public ImmutableList<String> parts() {
    return parts;
  }

  @Override
  public boolean equals(Object that) {
    return that instanceof QualifiedName other && parts.equals(other.parts);
  }

  @Override
  public int hashCode() {
    return parts.hashCode();
  }

  @Override
  public String toString() {
    return Joiner.on('.').join(parts);
  }
}
