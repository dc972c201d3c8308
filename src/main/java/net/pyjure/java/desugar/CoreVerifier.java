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

import javax.annotation.Nullable;
import net.pyjure.java.syntax.Node;
import net.pyjure.java.syntax.NodeVisitor;

/**
 * Checks that a tree uses only the core vocabulary: core tags everywhere, and literals only as the
 * child of a {@code constant}.
 */
final class CoreVerifier extends NodeVisitor {

  @Nullable private Node offender;

  private CoreVerifier() {}

  /**
   * Checks the tree.
   *
   * @throws IllegalStateException if it contains a node outside the core vocabulary
   */
  static void verify(Node root) {
    Node offender = findNonCore(root);
    if (offender != null) {
      throw new IllegalStateException(
          String.format(
              "desugared tree contains non-core node %s at %s", offender, offender.location()));
    }
  }

  /** Returns the first node of the tree, in lexical order, that is not core, or null. */
  @Nullable
  static Node findNonCore(Node root) {
    CoreVerifier verifier = new CoreVerifier();
    verifier.visit(root);
    return verifier.offender;
  }

  @Override
  public void visit(Node node) {
    if (offender != null) {
      return;
    }
    if (node.is(Node.Tag.CONSTANT)) {
      if (!node.child(0).tag().isLiteral()) {
        offender = node.child(0);
      }
      return;
    }
    if (!node.tag().isCore()) {
      offender = node;
      return;
    }
    super.visit(node);
  }
}
