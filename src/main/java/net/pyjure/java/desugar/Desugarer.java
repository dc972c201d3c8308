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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.flogger.GoogleLogger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.UnaryOperator;
import javax.annotation.Nullable;
import net.pyjure.java.syntax.Node;
import net.pyjure.java.syntax.Requirements;
import net.pyjure.java.syntax.SyntaxError;

/**
 * The Desugarer translates a tree in the surface vocabulary into the core vocabulary (see {@link
 * Node.Tag#isCore}), expanding macros along the way.
 *
 * <p>Each construct is reduced by a rule that either rebuilds the node from its desugared children
 * or rewrites it into simpler constructs, which are then desugared in turn. The rules are {@link
 * Expansion}s, so the {@link Environment} (macro bindings, pending suite statements, the gensym
 * counter and the requirements of the current function) flows through them in the textual order of
 * the tree.
 *
 * <p>Statements of a suite are desugared one at a time, the others remaining pending in the
 * environment, where a macro expanding one statement may see and change the statements that follow
 * it. A function definition consumes the pending statements, so that consecutive definitions form a
 * single {@code defn} group.
 */
public final class Desugarer {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private Desugarer() {}

  /** Desugars a program with no macros and the default options. */
  public static Node desugar(Node program) throws SyntaxError.Exception {
    return desugar(program, CompileTimeScope.EMPTY, DesugarOptions.DEFAULT);
  }

  /**
   * Desugars a program in which the macros of {@code base} are visible.
   *
   * @throws SyntaxError.Exception if the program is malformed, uses a name reserved for fresh
   *     identifiers, or uses an unimplemented construct that {@code options} reject
   */
  public static Node desugar(Node program, CompileTimeScope base, DesugarOptions options)
      throws SyntaxError.Exception {
    logger.atFine().log("desugaring %s at %s", program.tag(), program.location());
    FreshNameChecker.check(program);
    Expansion.Step<Node> step = expand(program).run(Environment.initial(base, options));
    Preconditions.checkState(
        step.env().suiteDepth() == 0, "unbalanced suite stack: %s", step.env().suiteDepth());
    Node result = step.value();
    if (result == null) {
      result = NodeMaker.at(program).none();
    }
    if (options.verifyCoreOutput()) {
      CoreVerifier.verify(result);
    }
    logger.atFine().log(
        "desugared %s, %d fresh names", program.location(), step.env().gensymCounter());
    return result;
  }

  /**
   * Returns an expansion desugaring {@code x}, or yielding null if it is absent. A node other than
   * a suite is desugared as a suite of its own, so that a definition in it cannot consume the
   * statements of an enclosing suite.
   */
  static Expansion<Node> expand(@Nullable Node x) {
    if (x == null) {
      return Expansion.unit(null);
    }
    if (x.is(Node.Tag.SUITE)) {
      return expandForm(x);
    }
    return Expansion.update(env -> env.pushSuite(ImmutableList.of()))
        .then(expandForm(x))
        .bind(result -> Expansion.update(Environment::popSuite).map(unused -> result));
  }

  /** Desugars each of the nodes, some of which may be absent, in order. */
  static Expansion<List<Node>> expandAll(List<Node> nodes) {
    return Expansion.traverse(nodes, Desugarer::expand);
  }

  /**
   * Desugars the statements of a suite, pushing them on the suite stack while they are processed.
   * Yields null if they desugar to nothing.
   */
  static Expansion<Node> expandSuite(Node origin, List<Node> statements) {
    Expansion<Node> loop =
        Expansion.let(
            let -> {
              List<Node> results = new ArrayList<>();
              while (!let.env().pendingStatements().isEmpty()) {
                List<Node> pending = let.env().pendingStatements();
                Node first = pending.get(0);
                List<Node> rest = pending.subList(1, pending.size());
                let.bind(Expansion.update(env -> env.withPendingStatements(rest)));
                results.add(let.bind(expandForm(first)));
              }
              return Suites.makeSuite(origin, results);
            });
    return Expansion.update(env -> env.pushSuite(statements))
        .then(loop)
        .bind(result -> Expansion.update(Environment::popSuite).map(unused -> result));
  }

  /** Desugars {@code x} as a statement of the innermost suite being desugared. */
  private static Expansion<Node> expandForm(Node x) {
    return env -> dispatch(x).run(env);
  }

  private static Expansion<Node> dispatch(Node x) throws SyntaxError.Exception {
    NodeMaker m = NodeMaker.at(x);
    switch (x.tag()) {
      case MODULE:
        return expandSuite(x, x.children()).map(s -> x.withChildren(statementsOf(s)));
      case EXPRESSION:
      case INTERACTIVE:
        return expand(x.child(0));
      case SUITE:
        if (x.size() == 0) {
          return Expansion.unit(m.none());
        }
        return expandSuite(x, x.children()).map(s -> s != null ? s : m.none());

      case ID:
        return MacroResolver.referenceMacro(x)
            .bind(
                macro ->
                    macro == null
                        ? Expansion.<Node>unit(x)
                        : ((Macro.Reference) macro).expand(x).bind(Desugarer::expandForm));
      case CALL:
        return MacroResolver.callMacro(x.child(0))
            .bind(
                macro ->
                    macro == null
                        ? expandChildren(x)
                        : ((Macro.Call) macro).expand(x).bind(Desugarer::expandForm));

      case ARGS:
      case KEYARG:
      case STAR_ARG:
      case STARSTAR_ARG:
      case PARAMS:
      case PARAM:
      case STAR_PARAM:
      case STARSTAR_PARAM:
      case DEFN:
      case BUILTIN:
      case IF:
      case WHILE:
      case RAISE:
      case UNWIND_PROTECT:
        return expandChildren(x);
      case HANDLER_BIND:
        return expandHandlerBind(x);
      case BIND:
        return expandBind(x);
      case YIELD:
      case YIELD_FROM:
        return Expansion.update(env -> env.withRequirements(env.requirements().withGenerator()))
            .then(expandChildren(x));

      case CONSTANT:
      case UNBIND:
      case CONTINUE:
      case BREAK:
        return Expansion.unit(x);
      case GLOBAL:
      case NONLOCAL:
        if (x.size() <= 1) {
          return Expansion.unit(x);
        }
        List<Node> declarations = new ArrayList<>();
        for (Node name : x.children()) {
          declarations.add(m.make(x.tag(), name));
        }
        return expandForm(m.suite(declarations));
      case IMPORT:
      case FROM:
      case AS_NAME:
      case DOTTED_NAME:
        return passThrough(x);

      case FUNCTION:
        return expandFunction(x);
      case DEFINITION:
        return expandDefinition(x);
      case DEF:
        return x.tail().isEmpty() ? expandDef(x) : expandDecorated(x);
      case CLASS:
        return x.tail().isEmpty() ? expandClass(x) : expandDecorated(x);
      case LAMBDA:
        return ControlFlow.lambda(x).bind(Desugarer::expandForm);

      case INTEGER:
      case FLOAT:
      case STRING:
      case BYTES:
      case IMAGINARY:
      case TRUE:
      case FALSE:
      case NONE:
      case ELLIPSIS:
      case ZERO_UPLE:
      case EMPTY_LIST:
      case EMPTY_DICT:
        return Expansion.unit(m.make(Node.Tag.CONSTANT, x));
      case PASS:
        return Expansion.unit(m.none());

      case DEL:
        return expandDel(x);
      case ASSIGN:
        return expandAssign(x);
      case AUGASSIGN:
        {
          Node target = x.child(0);
          Node value = m.builtin(x.value(), target, x.child(1));
          return TargetExpander.expand(target, value, true).bind(Desugarer::expandForm);
        }

      case ATTRIBUTE:
        {
          Node attr = x.child(1);
          if (!attr.is(Node.Tag.ID)) {
            throw new SyntaxError.Exception(
                SyntaxError.of(
                    attr, "attribute name must be an identifier, got %s", "name", attr.tag()));
          }
          return expandForm(
              m.builtin(Builtins.ATTRIBUTE, x.child(0), NodeMaker.at(attr).string(attr.value())));
        }
      case SLICE:
        {
          List<Node> parts = new ArrayList<>();
          for (Node part : x.children()) {
            parts.add(part != null ? part : m.none());
          }
          return expandForm(m.builtin(x.tag().getName(), parts));
        }
      case SUBSCRIPT:
      case LIST:
      case TUPLE:
      case SET:
      case DICT:
      case RETURN:
      case ASSERT:
        return expandForm(m.builtin(x.tag().getName(), presentChildren(x)));
      case BINOP:
      case UNARYOP:
        return expandForm(m.builtin(x.value(), x.children()));
      case BOOLOP:
        return ControlFlow.boolOp(x).bind(Desugarer::expandForm);
      case COMPARE:
        return ControlFlow.compare(x).bind(Desugarer::expandForm);
      case IF_EXPR:
        {
          Node orelse = x.child(2) != null ? x.child(2) : m.none();
          return expandForm(m.ifNode(m.truth(x.child(0)), x.child(1), orelse));
        }
      case COND:
        return expandForm(ControlFlow.cond(x));
      case FOR:
        return ControlFlow.forLoop(x).bind(Desugarer::expandForm);
      case WITH:
        return ControlFlow.with(x).bind(Desugarer::expandForm);
      case TRY:
        return ControlFlow.tryStatement(x).bind(Desugarer::expandForm);
      case LIST_COMP:
      case SET_COMP:
      case GENERATOR:
      case DICT_COMP:
        return expandForm(ControlFlow.comprehension(x));

      case DECORATOR:
      case STARRED:
      case COMPARISON:
      case CLAUSE:
      case WITH_ITEM:
      case EXCEPT:
      case COMP_FOR:
      case COMP_IF:
        throw new SyntaxError.Exception(
            SyntaxError.of(x, "%s is not allowed here", "construct", x.tag().getName()));
    }
    throw new IllegalStateException("unhandled tag: " + x.tag());
  }

  /** Rebuilds {@code x} from its desugared children. */
  private static Expansion<Node> expandChildren(Node x) {
    return expandAll(x.children()).map(x::withChildren);
  }

  private static Expansion<Node> expandHandlerBind(Node x) {
    Node carrier = x.child(0);
    if (!carrier.is(Node.Tag.ID)) {
      return Expansion.fail(
          SyntaxError.of(carrier, "handler variable must be an identifier", ImmutableMap.of()));
    }
    return expandAll(x.children().subList(1, 3))
        .map(rest -> x.withChildren(Arrays.asList(carrier, rest.get(0), rest.get(1))));
  }

  private static Expansion<Node> expandBind(Node x) {
    Node target = x.child(0);
    if (!target.is(Node.Tag.ID)) {
      return Expansion.fail(
          SyntaxError.of(target, "cannot bind to %s", "target", target.tag().getName()));
    }
    return expand(x.child(1)).map(value -> x.withChildren(Arrays.asList(target, value)));
  }

  private static Expansion<Node> passThrough(Node x) {
    return env -> {
      if (env.options().failOnUnimplemented()) {
        throw new SyntaxError.Exception(
            SyntaxError.notYetImplemented(x, x.tag().getName() + " statement"));
      }
      logger.atFine().log("passing %s through unchanged at %s", x.tag(), x.location());
      return new Expansion.Step<>(x, env);
    };
  }

  private static Expansion<Node> expandDel(Node x) {
    NodeMaker m = NodeMaker.at(x);
    if (x.size() == 0) {
      return Expansion.fail(SyntaxError.of(x, "del without target", ImmutableMap.of()));
    }
    if (x.size() > 1) {
      List<Node> dels = new ArrayList<>();
      for (Node target : x.children()) {
        dels.add(NodeMaker.at(target).make(Node.Tag.DEL, target));
      }
      return expandForm(m.suite(dels));
    }
    Node target = x.child(0);
    switch (target.tag()) {
      case ID:
        return Expansion.unit(m.make(Node.Tag.UNBIND, target));
      case SUBSCRIPT:
        return expandForm(m.builtin(Builtins.DELITEM, target.child(0), target.child(1)));
      default:
        return Expansion.fail(
            SyntaxError.of(target, "cannot delete %s", "target", target.tag().getName()));
    }
  }

  private static Expansion<Node> expandAssign(Node x) {
    List<Node> targets = x.tail();
    Node value = x.child(0);
    if (targets.isEmpty()) {
      return Expansion.fail(SyntaxError.of(x, "assignment without target", ImmutableMap.of()));
    }
    if (targets.size() == 1) {
      return TargetExpander.expand(targets.get(0), value, false).bind(Desugarer::expandForm);
    }
    NodeMaker m = NodeMaker.at(x);
    return Expansion.let(
        let -> {
          Node g = let.bind(Environment.gensym(value.location(), "g"));
          List<Node> statements = new ArrayList<>();
          statements.add(m.bind(g, value));
          for (Node target : Lists.reverse(targets)) {
            statements.add(let.bind(TargetExpander.expand(target, g, false)));
          }
          return let.bind(expandForm(m.suite(statements)));
        });
  }

  /**
   * Returns an expansion desugaring a function or class body in a new function scope in which the
   * parameters are bound lexically, with fresh requirements. The node built from the desugared body
   * carries the requirements observed in it; the environment that follows has the scope and
   * requirements of the enclosing function again.
   */
  private static Expansion<Node> withinFunction(
      List<String> parameters, Node body, UnaryOperator<Node> build) {
    return Expansion.let(
        let -> {
          Environment outer = let.env();
          CompileTimeScope scope = outer.scope().enterFunction();
          for (String name : parameters) {
            scope = scope.bind(name, CompileTimeBinding.lexical());
          }
          CompileTimeScope inner = scope;
          let.bind(
              Expansion.update(env -> env.withScope(inner).withRequirements(Requirements.NONE)));
          Node desugared = let.bind(expand(body));
          Requirements requirements = let.env().requirements();
          let.bind(
              Expansion.update(
                  env -> env.withScope(outer.scope()).withRequirements(outer.requirements())));
          return build.apply(desugared).withRequirements(requirements);
        });
  }

  private static List<String> parameterNames(Node params) {
    List<String> names = new ArrayList<>();
    for (Node param : params.children()) {
      if (param.value() != null) {
        names.add(param.value());
      }
    }
    return names;
  }

  private static Expansion<Node> expandFunction(Node x) {
    Node params = x.child(0);
    return Expansion.let(
        let -> {
          Node desugaredParams = let.bind(expand(params));
          Node returnType = let.bind(expand(x.child(1)));
          return let.bind(
              withinFunction(
                  parameterNames(params),
                  x.child(2),
                  body -> x.withChildren(Arrays.asList(desugaredParams, returnType, body))));
        });
  }

  private static Expansion<Node> expandDefinition(Node x) {
    Node params = x.child(1);
    return Expansion.let(
        let -> {
          Node desugaredParams = let.bind(expand(params));
          Node returnType = let.bind(expand(x.child(2)));
          return let.bind(
              withinFunction(
                  parameterNames(params),
                  x.child(3),
                  body ->
                      x.withChildren(
                          Arrays.asList(x.child(0), desugaredParams, returnType, body))));
        });
  }

  /**
   * Desugars an undecorated {@code def}. The statements pending after it in the current suite are
   * desugared first, so that the definition can join a {@code defn} group they start with.
   */
  private static Expansion<Node> expandDef(Node x) {
    NodeMaker m = NodeMaker.at(x);
    Node name = x.child(0);
    Node params = x.child(1);
    if (!name.is(Node.Tag.ID)) {
      return Expansion.fail(
          SyntaxError.of(name, "function name must be an identifier", ImmutableMap.of()));
    }
    return Expansion.let(
        let -> {
          Node desugaredParams = let.bind(expand(params));
          Node returnType = let.bind(expand(x.child(2)));
          Node body = m.suite(x.child(3), m.none());
          Node definition =
              let.bind(
                  withinFunction(
                      parameterNames(params),
                      body,
                      b -> m.make(Node.Tag.DEFINITION, name, desugaredParams, returnType, b)));
          ImmutableList<Node> rest = let.env().pendingStatements();
          let.bind(Expansion.update(env -> env.withPendingStatements(ImmutableList.of())));
          Node desugaredRest = let.bind(expandSuite(x, rest));
          return Suites.makeDefn(x, definition, desugaredRest);
        });
  }

  private static Expansion<Node> expandClass(Node x) {
    NodeMaker m = NodeMaker.at(x);
    Node name = x.child(0);
    if (!name.is(Node.Tag.ID)) {
      return Expansion.fail(
          SyntaxError.of(name, "class name must be an identifier", ImmutableMap.of()));
    }
    return expand(x.child(1))
        .bind(
            args ->
                withinFunction(
                    ImmutableList.of(),
                    x.child(2),
                    body -> m.make(Node.Tag.CLASS, name, args, body)));
  }

  /**
   * Removes the first decorator of a definition. A decorator macro expands the definition without
   * it; any other decorator {@code d} turns the definition into {@code simpler; name = d(name)}.
   * Since the remaining decorators are expanded within {@code simpler}, the decorator nearest the
   * definition applies first.
   */
  private static Expansion<Node> expandDecorated(Node x) {
    Node name = x.child(0);
    int fixed = x.tag().fixedSlots();
    Node decorator = x.child(fixed);
    if (!decorator.is(Node.Tag.DECORATOR)) {
      return Expansion.fail(
          SyntaxError.of(
              decorator, "expected decorator, got %s", "decorator", decorator.tag().getName()));
    }
    List<Node> simplerChildren = new ArrayList<>(x.children());
    simplerChildren.remove(fixed);
    Node simpler = x.withChildren(simplerChildren);
    Node expr = decorator.child(0);
    Node args = decorator.child(1);
    return MacroResolver.decoratorMacro(expr)
        .bind(
            macro -> {
              if (macro != null) {
                return ((Macro.Decorator) macro).expand(args, simpler).bind(Desugarer::expandForm);
              }
              NodeMaker m = NodeMaker.at(decorator);
              QualifiedName qualified = QualifiedName.namify(expr);
              Node function = qualified != null ? qualified.unnamify(expr.location()) : expr;
              if (args != null) {
                function = m.make(Node.Tag.CALL, function, args);
              }
              return expandForm(m.suite(simpler, m.bind(name, m.call(function, name))));
            });
  }

  private static List<Node> statementsOf(@Nullable Node suite) {
    if (suite == null) {
      return ImmutableList.of();
    }
    return suite.is(Node.Tag.SUITE) ? suite.children() : ImmutableList.of(suite);
  }

  private static List<Node> presentChildren(Node x) {
    List<Node> present = new ArrayList<>();
    for (Node child : x.children()) {
      if (child != null) {
        present.add(child);
      }
    }
    return present;
  }
}
