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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;
import net.pyjure.java.syntax.Location;
import net.pyjure.java.syntax.Node;
import net.pyjure.java.syntax.SyntaxError;

/**
 * Expansions of the surface control-flow constructs into the core conditionals, loops and handler
 * forms. Each yields a tree still to be desugared, in which the subexpressions of the construct
 * appear unchanged and fresh variables hold values that must be evaluated only once.
 */
final class ControlFlow {

  private ControlFlow() {}

  /**
   * Expands a comparison chain {@code a < b < c} into nested conditionals, evaluating each operand
   * at most once and stopping at the first comparison that fails.
   */
  static Expansion<Node> compare(Node x) {
    return compareChain(x, x.child(0), x.tail());
  }

  private static Expansion<Node> compareChain(Node x, Node left, List<Node> comparisons) {
    NodeMaker m = NodeMaker.at(x);
    if (comparisons.isEmpty()) {
      return Expansion.unit(m.constant(Node.Tag.TRUE));
    }
    Node comparison = comparisons.get(0);
    if (!comparison.is(Node.Tag.COMPARISON)) {
      return Expansion.fail(
          SyntaxError.of(
              comparison, "expected comparison, got %s", "comparison", comparison.tag().getName()));
    }
    List<Node> more = comparisons.subList(1, comparisons.size());
    Node arg = comparison.child(0);
    return Expansion.let(
        let -> {
          Node right = arg;
          Node init = null;
          if (!more.isEmpty()) {
            right = let.bind(Environment.gensym(arg.location(), "g"));
            init = m.bind(right, arg);
          }
          Location span = Location.merge(left.location(), comparison.location());
          Node test = NodeMaker.at(span).builtin(comparison.value(), left, right);
          Node rest = let.bind(compareChain(x, right, more));
          return m.suite(init, m.ifNode(test, rest, m.constant(Node.Tag.FALSE)));
        });
  }

  /**
   * Expands {@code and} and {@code or}. Every operand but the last is bound to a fresh variable and
   * tested; {@code and} yields the first false operand, {@code or} the first true one, and both
   * otherwise yield the last operand.
   */
  static Expansion<Node> boolOp(Node x) {
    boolean and = x.value().equals("and");
    if (!and && !x.value().equals("or")) {
      return Expansion.fail(
          SyntaxError.of(x, "unknown boolean operator '%s'", "operator", x.value()));
    }
    if (x.size() == 0) {
      return Expansion.unit(NodeMaker.at(x).constant(and ? Node.Tag.TRUE : Node.Tag.FALSE));
    }
    return boolChain(x, and, x.children());
  }

  private static Expansion<Node> boolChain(Node x, boolean and, List<Node> operands) {
    Node first = operands.get(0);
    if (operands.size() == 1) {
      return Expansion.unit(first);
    }
    NodeMaker m = NodeMaker.at(x);
    return Expansion.let(
        let -> {
          Node g = let.bind(Environment.gensym(first.location(), "g"));
          Node rest = let.bind(boolChain(x, and, operands.subList(1, operands.size())));
          return m.suite(
              m.bind(g, first), m.ifNode(m.truth(g), and ? rest : g, and ? g : rest));
        });
  }

  /**
   * Expands {@code cond} into nested conditionals testing the truth of each clause in turn; the
   * default is the {@code else} branch, or {@code None}.
   */
  static Node cond(Node x) throws SyntaxError.Exception {
    NodeMaker m = NodeMaker.at(x);
    Node result = x.child(0) != null ? x.child(0) : m.none();
    for (Node clause : Lists.reverse(x.tail())) {
      if (!clause.is(Node.Tag.CLAUSE)) {
        throw new SyntaxError.Exception(
            SyntaxError.of(
                clause, "expected cond clause, got %s", "clause", clause.tag().getName()));
      }
      result = NodeMaker.at(clause).ifNode(m.truth(clause.child(0)), clause.child(1), result);
    }
    return result;
  }

  /**
   * Expands a {@code for} loop into a {@code while} loop over the generator protocol:
   *
   * <pre>
   * (suite (bind gen iterable)
   *        (while (builtin "gen-next?" gen)
   *               (suite target = (builtin "gen-first" gen)
   *                      (bind gen (builtin "gen-rest" gen))
   *                      body
   *                      (continue))
   *               else))
   * </pre>
   */
  static Expansion<Node> forLoop(Node x) {
    NodeMaker m = NodeMaker.at(x);
    Node target = x.child(0);
    Node iterable = x.child(1);
    Node body = x.child(2);
    Node orelse = x.child(3);
    return Environment.gensym(x.location(), "gen")
        .map(
            gen ->
                m.suite(
                    m.bind(gen, iterable),
                    m.make(
                        Node.Tag.WHILE,
                        m.builtin(Builtins.GEN_NEXT_P, gen),
                        m.suite(
                            m.assign(target, m.builtin(Builtins.GEN_FIRST, gen)),
                            m.bind(gen, m.builtin(Builtins.GEN_REST, gen)),
                            body,
                            m.make(Node.Tag.CONTINUE)),
                        orelse)));
  }

  /**
   * Expands a {@code with} statement. Items nest, the first outermost. An item whose context
   * expression names a with-macro is expanded by the macro, given the rest of the statement;
   * otherwise it follows the context manager protocol:
   *
   * <pre>
   * mgr = context
   * t = v = tb = None
   * target = mgr.__enter__()
   * try:
   *   rest of the statement
   * except:
   *   t, v, tb = exc-info()
   * finally:
   *   r = mgr.__exit__(t, v, tb)
   *   e = v
   *   del t, v, tb
   *   if e is not None and not r: raise e
   * </pre>
   */
  static Expansion<Node> with(Node x) {
    List<Node> items = x.tail();
    Node body = x.child(0);
    if (items.isEmpty()) {
      return Expansion.unit(body);
    }
    Node item = items.get(0);
    if (!item.is(Node.Tag.WITH_ITEM)) {
      return Expansion.fail(
          SyntaxError.of(item, "expected with item, got %s", "item", item.tag().getName()));
    }
    Node context = item.child(0);
    Node target = item.child(1);
    List<Node> simplerChildren = new ArrayList<>();
    simplerChildren.add(body);
    simplerChildren.addAll(items.subList(1, items.size()));
    Node simpler = x.withChildren(simplerChildren);
    return MacroResolver.withMacro(context)
        .bind(
            macro -> {
              if (macro != null) {
                return ((Macro.With) macro)
                    .expand(MacroResolver.macroArgs(context), target, simpler);
              }
              return contextManager(item, context, target, simpler);
            });
  }

  private static Expansion<Node> contextManager(
      Node item, Node context, @Nullable Node target, Node simpler) {
    NodeMaker m = NodeMaker.at(item);
    return Expansion.let(
        let -> {
          Node mgr = let.bind(Environment.gensym(m.location(), "mgr"));
          Node type = let.bind(Environment.gensym(m.location(), "exception-type"));
          Node value = let.bind(Environment.gensym(m.location(), "exception"));
          Node traceback = let.bind(Environment.gensym(m.location(), "traceback"));
          Node result = let.bind(Environment.gensym(m.location(), "exit"));
          Node pending = let.bind(Environment.gensym(m.location(), "pending"));

          Node enter = m.methodCall(mgr, "__enter__");
          Node handler =
              m.make(
                  Node.Tag.EXCEPT,
                  null,
                  null,
                  m.assign(
                      m.make(Node.Tag.TUPLE, type, value, traceback),
                      m.builtin(Builtins.EXC_INFO)));
          Node reraise =
              m.ifNode(
                  m.builtin(Builtins.IS_NOT, pending, m.none()),
                  m.ifNode(
                      m.builtin(Builtins.NOT, result), m.make(Node.Tag.RAISE, pending, null), null),
                  null);
          Node cleanup =
              m.suite(
                  m.bind(result, m.methodCall(mgr, "__exit__", type, value, traceback)),
                  m.bind(pending, value),
                  m.make(Node.Tag.DEL, type, value, traceback),
                  reraise);
          return m.suite(
              m.bind(mgr, context),
              m.bind(type, m.none()),
              m.bind(value, m.none()),
              m.bind(traceback, m.none()),
              target != null ? m.assign(target, enter) : enter,
              m.make(Node.Tag.TRY, simpler, null, cleanup, handler));
        });
  }

  /**
   * Expands a {@code try} statement into {@code handler-bind} and {@code unwind-protect}.
   *
   * <p>The handler binds the exception to a fresh carrier variable and dispatches on {@code
   * isinstance} tests of the except clauses in order. Each clause body runs under an {@code
   * unwind-protect} that unbinds the clause target and the carrier. A final clause without a type
   * catches everything; without one, the exception is raised again. An {@code else} clause runs
   * when the body completes without an exception, outside the handler; a {@code finally} clause
   * protects the whole.
   */
  static Expansion<Node> tryStatement(Node x) {
    Node body = x.child(0);
    Node orelse = x.child(1);
    Node fin = x.child(2);
    List<Node> excepts = x.tail();
    NodeMaker m = NodeMaker.at(x);

    for (int i = 0; i < excepts.size(); i++) {
      Node clause = excepts.get(i);
      if (!clause.is(Node.Tag.EXCEPT)) {
        return Expansion.fail(
            SyntaxError.of(
                clause, "expected except clause, got %s", "clause", clause.tag().getName()));
      }
      if (clause.child(0) == null && i < excepts.size() - 1) {
        return Expansion.fail(
            SyntaxError.of(
                excepts.get(i + 1),
                "expression-less except clause must be in last position",
                ImmutableMap.of()));
      }
    }
    if (excepts.isEmpty() && orelse != null) {
      return Expansion.fail(
          SyntaxError.of(
              orelse, "else clause of try requires an except clause", ImmutableMap.of()));
    }

    Expansion<Node> handled;
    if (excepts.isEmpty()) {
      handled = Expansion.unit(body);
    } else if (orelse == null) {
      handled = Environment.gensym(x.location(), "ex").map(ex -> handlerBind(m, ex, body, excepts));
    } else {
      handled =
          Expansion.let(
              let -> {
                Node ex = let.bind(Environment.gensym(x.location(), "ex"));
                Node ok = let.bind(Environment.gensym(orelse.location(), "ok"));
                Node guarded = m.suite(body, m.bind(ok, m.constant(Node.Tag.TRUE)));
                return m.suite(
                    m.bind(ok, m.constant(Node.Tag.FALSE)),
                    handlerBind(m, ex, guarded, excepts),
                    NodeMaker.at(orelse).ifNode(ok, orelse, null));
              });
    }
    if (fin == null) {
      return handled;
    }
    return handled.map(h -> m.make(Node.Tag.UNWIND_PROTECT, h, fin));
  }

  private static Node handlerBind(NodeMaker m, Node ex, Node body, List<Node> excepts) {
    Node last = excepts.get(excepts.size() - 1);
    List<Node> guarded = excepts;
    Node fallthrough;
    if (last.child(0) == null) {
      guarded = excepts.subList(0, excepts.size() - 1);
      fallthrough = protect(last, ex);
    } else {
      fallthrough = m.make(Node.Tag.RAISE, ex, null);
    }
    List<Node> condChildren = new ArrayList<>();
    condChildren.add(fallthrough);
    for (Node clause : guarded) {
      NodeMaker c = NodeMaker.at(clause);
      condChildren.add(
          c.make(
              Node.Tag.CLAUSE,
              c.builtin(Builtins.ISINSTANCE, ex, clause.child(0)),
              protect(clause, ex)));
    }
    return m.make(Node.Tag.HANDLER_BIND, ex, body, m.make(Node.Tag.COND, condChildren));
  }

  /** Returns the body of an except clause, binding its target to the exception while it runs. */
  private static Node protect(Node clause, Node ex) {
    NodeMaker c = NodeMaker.at(clause);
    Node target = clause.child(1);
    Node body = clause.child(2);
    if (target == null) {
      return c.make(Node.Tag.UNWIND_PROTECT, body, c.make(Node.Tag.UNBIND, ex));
    }
    return c.make(
        Node.Tag.UNWIND_PROTECT,
        c.suite(c.bind(target, ex), body),
        c.suite(c.make(Node.Tag.UNBIND, target), c.make(Node.Tag.UNBIND, ex)));
  }

  /**
   * Expands a comprehension into a builtin named after it, applied to a generator function whose
   * body nests the clauses, the first outermost, around a {@code yield} of the element. A dict
   * comprehension yields key and value as a tuple.
   */
  static Node comprehension(Node x) throws SyntaxError.Exception {
    NodeMaker m = NodeMaker.at(x);
    List<Node> clauses = x.tail();
    Node element =
        x.is(Node.Tag.DICT_COMP)
            ? m.make(Node.Tag.TUPLE, x.child(0), x.child(1))
            : x.child(0);
    Node statement = m.make(Node.Tag.YIELD, element);
    for (Node clause : Lists.reverse(clauses)) {
      NodeMaker c = NodeMaker.at(clause);
      switch (clause.tag()) {
        case COMP_FOR ->
            statement =
                c.make(Node.Tag.FOR, clause.child(0), clause.child(1), statement, null);
        case COMP_IF -> statement = c.make(Node.Tag.IF_EXPR, clause.child(0), statement, null);
        default ->
            throw new SyntaxError.Exception(
                SyntaxError.of(
                    clause,
                    "not a valid clause of %s: %s",
                    ImmutableMap.of("comprehension", x.tag().getName(), "clause", clause)));
      }
    }
    Node generator = m.make(Node.Tag.FUNCTION, m.make(Node.Tag.PARAMS), null, statement);
    return m.builtin(x.tag().getName(), generator);
  }

  /** Expands a lambda into the definition of a fresh function followed by a reference to it. */
  static Expansion<Node> lambda(Node x) {
    NodeMaker m = NodeMaker.at(x);
    return Environment.gensym(x.location(), "fn")
        .map(
            fn ->
                m.suite(
                    m.make(
                        Node.Tag.DEF,
                        fn,
                        x.child(0),
                        null,
                        m.make(Node.Tag.RETURN, x.child(1))),
                    fn));
  }
}
