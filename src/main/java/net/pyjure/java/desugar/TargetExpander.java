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
import net.pyjure.java.syntax.Node;
import net.pyjure.java.syntax.SyntaxError;

/**
 * Expands assignments to a target into core bindings and builtin calls.
 *
 * <p>An identifier target becomes a {@code bind}, an attribute target a call of {@code setattr}, a
 * subscript target a call of {@code setitem}. A list or tuple target binds the value to a fresh
 * variable, checks its length and assigns its items to the elements; one element may be starred,
 * receiving the items between those of the elements before and after it:
 *
 * <pre>
 * a, *b, c = v
 * </pre>
 *
 * becomes, with {@code r} and {@code nr} fresh,
 *
 * <pre>
 * (suite (bind r v)
 *        (builtin "check-length-ge" r 2)
 *        (bind nr (builtin "length" r))
 *        (bind a (builtin "subscript" r 0))
 *        (bind b (builtin "subscript" r (builtin "slice" 1 (builtin "sub" nr 1) 1)))
 *        (bind c (builtin "subscript" r (builtin "sub" nr 1))))
 * </pre>
 *
 * The result is a tree still to be desugared: the value and the subexpressions of the target are
 * left as they are.
 */
final class TargetExpander {

  private TargetExpander() {}

  /**
   * Returns an expansion yielding the assignment of {@code value} to {@code target}.
   *
   * @param augmented whether the assignment is an augmented one such as {@code x += 1}, to which
   *     list and tuple targets are not allowed
   */
  static Expansion<Node> expand(Node target, Node value, boolean augmented) {
    NodeMaker m = NodeMaker.at(target);
    switch (target.tag()) {
      case ID:
        return Expansion.unit(m.bind(target, value));
      case ATTRIBUTE:
        Node attr = target.child(1);
        if (!attr.is(Node.Tag.ID)) {
          return invalid(target);
        }
        return Expansion.unit(
            m.builtin(Builtins.SETATTR, target.child(0), m.string(attr.value()), value));
      case SUBSCRIPT:
        return Expansion.unit(
            m.builtin(Builtins.SETITEM, target.child(0), target.child(1), value));
      case LIST:
      case TUPLE:
        if (augmented) {
          return Expansion.fail(
              SyntaxError.of(
                  target,
                  "%s not allowed as target of augmented assignment",
                  "target",
                  target.tag().getName()));
        }
        return destructure(target, value);
      case STARRED:
        return Expansion.fail(
            SyntaxError.of(
                target,
                "starred assignment target must be in a list or tuple",
                "target",
                target.tag().getName()));
      default:
        return invalid(target);
    }
  }

  private static Expansion<Node> invalid(Node target) {
    return Expansion.fail(
        SyntaxError.of(target, "cannot assign to %s", "target", target.tag().getName()));
  }

  private static Expansion<Node> destructure(Node target, Node value) {
    List<Node> elements = target.children();
    int starIndex = -1;
    for (int i = 0; i < elements.size(); i++) {
      if (elements.get(i).is(Node.Tag.STARRED)) {
        if (starIndex >= 0) {
          return Expansion.fail(
              SyntaxError.of(
                  elements.get(i),
                  "multiple starred expressions in assignment to %s",
                  "target",
                  target.tag().getName()));
        }
        starIndex = i;
      }
    }
    NodeMaker m = NodeMaker.at(target);
    int star = starIndex;
    return Expansion.let(
        let -> {
          Node r = let.bind(Environment.gensym(m.location(), "r"));
          List<Node> statements = new ArrayList<>();
          statements.add(m.bind(r, value));
          if (star < 0) {
            statements.add(m.builtin(Builtins.CHECK_LENGTH_EQ, r, m.integer(elements.size())));
            for (int i = 0; i < elements.size(); i++) {
              Node item = m.builtin(Builtins.SUBSCRIPT, r, m.integer(i));
              statements.add(let.bind(expand(elements.get(i), item, false)));
            }
            return m.suite(statements);
          }

          Node nr = let.bind(Environment.gensym(m.location(), "nr"));
          List<Node> head = elements.subList(0, star);
          Node starred = elements.get(star).child(0);
          List<Node> tail = elements.subList(star + 1, elements.size());
          int nhead = head.size();
          int ntail = tail.size();
          statements.add(m.builtin(Builtins.CHECK_LENGTH_GE, r, m.integer(nhead + ntail)));
          statements.add(m.bind(nr, m.builtin(Builtins.LENGTH, r)));
          for (int i = 0; i < nhead; i++) {
            Node item = m.builtin(Builtins.SUBSCRIPT, r, m.integer(i));
            statements.add(let.bind(expand(head.get(i), item, false)));
          }
          Node middle =
              m.builtin(
                  Builtins.SLICE,
                  m.integer(nhead),
                  m.builtin(Builtins.SUB, nr, m.integer(ntail)),
                  m.integer(1));
          statements.add(
              let.bind(expand(starred, m.builtin(Builtins.SUBSCRIPT, r, middle), false)));
          for (int i = 0; i < ntail; i++) {
            Node index = m.builtin(Builtins.SUB, nr, m.integer(ntail - i));
            statements.add(
                let.bind(expand(tail.get(i), m.builtin(Builtins.SUBSCRIPT, r, index), false)));
          }
          return m.suite(statements);
        });
  }
}
