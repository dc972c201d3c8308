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

package net.pyjure.java.syntax;

import javax.annotation.Nullable;

/**
 * A pretty-printer for trees, in the notation read by {@link NodeReader}: {@code (tag "value"?
 * child...)}, with {@code _} for an absent optional child.
 *
 * <p>In indented mode, a node whose single-line form does not fit in the margin is broken with one
 * child per line.
 */
public final class NodePrinter {

  private static final int MARGIN = 100;
  private static final String INDENT = "  ";

  private final StringBuilder buf;
  private final boolean indented;

  public NodePrinter(StringBuilder buf, boolean indented) {
    this.buf = buf;
    this.indented = indented;
  }

  /** Returns the single-line form of the node. */
  public static String print(@Nullable Node node) {
    StringBuilder buf = new StringBuilder();
    new NodePrinter(buf, false).printNode(node);
    return buf.toString();
  }

  /** Returns the indented, multi-line form of the node. */
  public static String prettyPrint(@Nullable Node node) {
    StringBuilder buf = new StringBuilder();
    new NodePrinter(buf, true).printNode(node);
    return buf.toString();
  }

  /** Appends the node to the buffer. */
  public void printNode(@Nullable Node node) {
    printNode(node, 0);
  }

  private void printNode(@Nullable Node node, int depth) {
    if (node == null) {
      buf.append('_');
      return;
    }
    int start = buf.length();
    printFlat(node);
    if (!indented || node.size() == 0 || buf.length() - start + depth * INDENT.length() <= MARGIN) {
      return;
    }

    // Too wide: start over, one child per line.
    buf.setLength(start);
    printHead(node);
    for (Node child : node.children()) {
      buf.append('\n');
      for (int i = 0; i <= depth; i++) {
        buf.append(INDENT);
      }
      printNode(child, depth + 1);
    }
    buf.append(')');
  }

  private void printFlat(Node node) {
    printHead(node);
    for (Node child : node.children()) {
      buf.append(' ');
      if (child == null) {
        buf.append('_');
      } else {
        printFlat(child);
      }
    }
    buf.append(')');
  }

  private void printHead(Node node) {
    buf.append('(').append(node.tag().getName());
    if (node.value() != null) {
      buf.append(' ');
      appendQuoted(node.value());
    }
  }

  private void appendQuoted(String s) {
    buf.append('"');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '"', '\\' -> buf.append('\\').append(c);
        case '\n' -> buf.append("\\n");
        case '\t' -> buf.append("\\t");
        default -> buf.append(c);
      }
    }
    buf.append('"');
  }
}
