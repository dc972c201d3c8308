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
import net.pyjure.java.syntax.SyntaxError;

/**
 * Rejects a program that uses a name of the form reserved for fresh identifiers, which would be
 * captured by the names the desugarer generates.
 */
final class FreshNameChecker extends NodeVisitor {

  @Nullable private Node offender;

  private FreshNameChecker() {}

  /**
   * Checks the identifiers and parameter names of the tree.
   *
   * @throws SyntaxError.Exception if one of them contains {@link Environment#FRESH_NAME_MARKER}
   */
  static void check(Node program) throws SyntaxError.Exception {
    FreshNameChecker checker = new FreshNameChecker();
    checker.visit(program);
    if (checker.offender != null) {
      throw new SyntaxError.Exception(
          SyntaxError.of(
              checker.offender,
              "name '%s' is reserved for generated identifiers",
              "name",
              checker.offender.value()));
    }
  }

  @Override
  public void visit(Node node) {
    if (offender != null) {
      return;
    }
    switch (node.tag()) {
      case ID:
      case PARAM:
      case STAR_PARAM:
      case STARSTAR_PARAM:
        if (isReserved(node.value())) {
          offender = node;
          return;
        }
        break;
      default:
        break;
    }
    super.visit(node);
  }

  private static boolean isReserved(@Nullable String name) {
    return name != null && name.indexOf(Environment.FRESH_NAME_MARKER) >= 0;
  }
}
