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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.pyjure.java.syntax.Node;

/**
 * A toy evaluator of the core vocabulary, used to check that desugared programs behave as their
 * source would. It has a single flat variable namespace and no user-defined functions.
 *
 * <p>Values are {@link Long}s, {@link Boolean}s, strings, lists (for both Python lists and
 * tuples), {@link #NONE}, objects represented as maps from attribute name to value, and {@link
 * Function}s. An exception is a string {@code "Type: message"}; the type is the string {@code
 * "Type"}. The builtin {@code record} appends its argument to {@link #trace}.
 */
final class CoreEvaluator {

  static final Object NONE =
      new Object() {
        @Override
        public String toString() {
          return "None";
        }
      };

  /** A callable value. */
  interface Function {
    Object call(List<Object> args) throws Raise;
  }

  /** An exception raised by the evaluated program. */
  static final class Raise extends Exception {
    final Object value;

    Raise(Object value) {
      super(String.valueOf(value));
      this.value = value;
    }
  }

  private static final class LoopSignal extends RuntimeException {
    final boolean isBreak;

    LoopSignal(boolean isBreak) {
      super(null, null, false, false);
      this.isBreak = isBreak;
    }
  }

  private final Map<String, Object> variables = new HashMap<>();
  private final List<Object> trace = new ArrayList<>();
  private final Deque<Object> handling = new ArrayDeque<>();

  CoreEvaluator define(String name, Object value) {
    variables.put(name, value);
    return this;
  }

  Map<String, Object> variables() {
    return variables;
  }

  List<Object> trace() {
    return trace;
  }

  Object get(String name) {
    Preconditions.checkState(variables.containsKey(name), "unbound variable %s", name);
    return variables.get(name);
  }

  Object eval(Node node) throws Raise {
    switch (node.tag()) {
      case MODULE:
      case SUITE:
        {
          Object result = NONE;
          for (Node statement : node.children()) {
            result = eval(statement);
          }
          return result;
        }
      case CONSTANT:
        return literal(node.child(0));
      case ID:
        return get(node.value());
      case BIND:
        variables.put(node.child(0).value(), eval(node.child(1)));
        return NONE;
      case UNBIND:
        get(node.child(0).value());
        variables.remove(node.child(0).value());
        return NONE;
      case IF:
        if (truthy(eval(node.child(0)))) {
          return eval(node.child(1));
        }
        return node.child(2) != null ? eval(node.child(2)) : NONE;
      case WHILE:
        while (truthy(eval(node.child(0)))) {
          try {
            eval(node.child(1));
          } catch (LoopSignal signal) {
            if (signal.isBreak) {
              return NONE;
            }
          }
        }
        if (node.child(2) != null) {
          eval(node.child(2));
        }
        return NONE;
      case CONTINUE:
        throw new LoopSignal(false);
      case BREAK:
        throw new LoopSignal(true);
      case RAISE:
        throw new Raise(eval(node.child(0)));
      case HANDLER_BIND:
        try {
          return eval(node.child(1));
        } catch (Raise raise) {
          variables.put(node.child(0).value(), raise.value);
          handling.push(raise.value);
          try {
            return eval(node.child(2));
          } finally {
            handling.pop();
          }
        }
      case UNWIND_PROTECT:
        {
          Object result;
          try {
            result = eval(node.child(0));
          } catch (Raise | RuntimeException ex) {
            eval(node.child(1));
            throw ex;
          }
          eval(node.child(1));
          return result;
        }
      case CALL:
        {
          Object callee = eval(node.child(0));
          Preconditions.checkState(callee instanceof Function, "not callable: %s", callee);
          return ((Function) callee).call(evalAll(node.child(1).children()));
        }
      case BUILTIN:
        return builtin(node.value(), evalAll(node.children()));
      default:
        throw new IllegalArgumentException("cannot evaluate " + node.tag());
    }
  }

  private List<Object> evalAll(List<Node> nodes) throws Raise {
    List<Object> values = new ArrayList<>();
    for (Node node : nodes) {
      values.add(eval(node));
    }
    return values;
  }

  private static Object literal(Node literal) {
    switch (literal.tag()) {
      case INTEGER:
        return Long.parseLong(literal.value());
      case STRING:
        return literal.value();
      case TRUE:
        return true;
      case FALSE:
        return false;
      case NONE:
        return NONE;
      default:
        throw new IllegalArgumentException("unsupported literal " + literal.tag());
    }
  }

  static boolean truthy(Object x) {
    if (x instanceof Boolean b) {
      return b;
    }
    if (x instanceof Long n) {
      return n != 0;
    }
    if (x instanceof String s) {
      return !s.isEmpty();
    }
    if (x instanceof List<?> list) {
      return !list.isEmpty();
    }
    return x != NONE;
  }

  private Object builtin(String name, List<Object> args) throws Raise {
    switch (name) {
      case "record":
        trace.add(args.get(0));
        return args.get(0);
      case "truth":
        return truthy(args.get(0));
      case "not":
        return !truthy(args.get(0));
      case "is":
        return args.get(0) == args.get(1);
      case "is not":
        return args.get(0) != args.get(1);
      case "<":
        return number(args.get(0)) < number(args.get(1));
      case ">":
        return number(args.get(0)) > number(args.get(1));
      case "==":
        return args.get(0).equals(args.get(1));
      case "+":
        return number(args.get(0)) + number(args.get(1));
      case "sub":
        return number(args.get(0)) - number(args.get(1));
      case "list":
      case "tuple":
        return new ArrayList<>(args);
      case "length":
        return (long) list(args.get(0)).size();
      case "slice":
        return new long[] {number(args.get(0)), number(args.get(1)), number(args.get(2))};
      case "subscript":
        {
          List<?> list = list(args.get(0));
          if (args.get(1) instanceof long[] slice) {
            Preconditions.checkArgument(slice[2] == 1, "unsupported slice step");
            return new ArrayList<>(list.subList((int) slice[0], (int) slice[1]));
          }
          return list.get((int) number(args.get(1)));
        }
      case "check-length-eq":
        if (list(args.get(0)).size() != number(args.get(1))) {
          throw new Raise("ValueError: wrong number of values to unpack");
        }
        return NONE;
      case "check-length-ge":
        if (list(args.get(0)).size() < number(args.get(1))) {
          throw new Raise("ValueError: not enough values to unpack");
        }
        return NONE;
      case "gen-next?":
        return !list(args.get(0)).isEmpty();
      case "gen-first":
        return list(args.get(0)).get(0);
      case "gen-rest":
        {
          List<?> list = list(args.get(0));
          return new ArrayList<>(list.subList(1, list.size()));
        }
      case "attribute":
        {
          Preconditions.checkState(args.get(0) instanceof Map, "not an object: %s", args.get(0));
          Map<?, ?> object = (Map<?, ?>) args.get(0);
          Preconditions.checkState(object.containsKey(args.get(1)), "no attribute %s", args.get(1));
          return object.get(args.get(1));
        }
      case "isinstance":
        return String.valueOf(args.get(0)).startsWith(args.get(1) + ":");
      case "exc-info":
        {
          Preconditions.checkState(!handling.isEmpty(), "no exception is being handled");
          Object ex = handling.peek();
          String type = String.valueOf(ex).split(":", -1)[0];
          return new ArrayList<>(ImmutableList.of(type, ex, NONE));
        }
      default:
        throw new IllegalArgumentException("unknown builtin " + name);
    }
  }

  private static long number(Object x) {
    Preconditions.checkState(x instanceof Long, "not a number: %s", x);
    return (Long) x;
  }

  private static List<?> list(Object x) {
    Preconditions.checkState(x instanceof List, "not a list: %s", x);
    return (List<?>) x;
  }
}
