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

import java.util.List;
import javax.annotation.Nullable;

/**
 * A visitor for visiting the nodes of a tree in lexical order (not evaluation order!).
 *
 * <p>Typical usage is for a subclass to override {@link #visit} and switch on the tags relevant to
 * its business logic, calling {@code super.visit(node)} (or {@link #visitAll} on selected children)
 * to continue the traversal below the node.
 */
public class NodeVisitor {

  /** Visits the children of the node. Absent optional children are skipped. */
  public void visit(Node node) {
    visitAll(node.children());
  }

  /** Visits each non-null node of the list, in order. */
  public final void visitAll(List<Node> nodes) {
    for (Node node : nodes) {
      visitOptional(node);
    }
  }

  /** Visits the node if it is present. */
  public final void visitOptional(@Nullable Node node) {
    if (node != null) {
      visit(node);
    }
  }
}
