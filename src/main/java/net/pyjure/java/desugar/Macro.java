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
import net.pyjure.java.syntax.SyntaxError;

/**
 * A Macro is a compile-time function bound to a name in a {@link CompileTimeScope}, expanding the
 * forms that mention that name in one syntactic position, its {@link MacroKind}.
 *
 * <p>An expander returns an {@link Expansion} rather than a tree, so it may read and update the
 * environment: register further bindings, edit the statements pending in the current suite, or
 * allocate fresh identifiers. The tree it yields is desugared in turn, so an expansion may use
 * surface syntax and other macros.
 */
public abstract class Macro {

  private final String name;

  private Macro(String name) {
    this.name = name;
  }

  /** Returns the position in which the macro is recognized. */
  public abstract MacroKind kind();

  /** Returns the name of the macro, for diagnostics. */
  public String getName() {
    return name;
  }

  @Override
  public String toString() {
    return "<macro " + name + " " + kind() + ">";
  }

  /** Expands a node in which the macro occurs as a whole. */
  @FunctionalInterface
  public interface NodeExpander {
    Expansion<Node> expand(Node node) throws SyntaxError.Exception;
  }

  /**
   * Expands a node from which the macro was removed: {@code args} are the arguments the macro was
   * applied to (a {@code args} node, or null if it was not called) and {@code simpler} is the
   * construct without the macro.
   */
  @FunctionalInterface
  public interface ArgsExpander {
    Expansion<Node> expand(@Nullable Node args, Node simpler) throws SyntaxError.Exception;
  }

  /**
   * Expands a {@code with} statement from which the macro item was removed: {@code args} are the
   * arguments the context expression applied the macro to (or null if it was not called), {@code
   * target} is the {@code as} target of the item, or null, and {@code simpler} is the statement
   * without the item.
   */
  @FunctionalInterface
  public interface WithExpander {
    Expansion<Node> expand(@Nullable Node args, @Nullable Node target, Node simpler)
        throws SyntaxError.Exception;
  }

  /** Returns a macro expanding identifiers {@code m}. The expander receives the identifier. */
  public static Macro reference(String name, NodeExpander expander) {
    return new Reference(name, expander);
  }

  /** Returns a macro expanding calls {@code m(...)}. The expander receives the whole call. */
  public static Macro call(String name, NodeExpander expander) {
    return new Call(name, expander);
  }

  /**
   * Returns a macro expanding decorators. The expander receives the decorator arguments and the
   * decorated definition without this decorator.
   */
  public static Macro decorator(String name, ArgsExpander expander) {
    return new Decorator(name, expander);
  }

  /**
   * Returns a macro expanding {@code with} statements. The expander receives the arguments of the
   * context expression, the target of the item and the {@code with} statement without this item.
   */
  public static Macro with(String name, WithExpander expander) {
    return new With(name, expander);
  }

  /** A macro in identifier position. */
  public static final class Reference extends Macro {
    private final NodeExpander expander;

    private Reference(String name, NodeExpander expander) {
      super(name);
      this.expander = expander;
    }

    @Override
    public MacroKind kind() {
      return MacroKind.REFERENCED;
    }

    public Expansion<Node> expand(Node id) throws SyntaxError.Exception {
      return expander.expand(id);
    }
  }

  /** A macro in callee position. */
  public static final class Call extends Macro {
    private final NodeExpander expander;

    private Call(String name, NodeExpander expander) {
      super(name);
      this.expander = expander;
    }

    @Override
    public MacroKind kind() {
      return MacroKind.CALL_REFERENCED;
    }

    public Expansion<Node> expand(Node call) throws SyntaxError.Exception {
      return expander.expand(call);
    }
  }

  /** A macro in decorator position. */
  public static final class Decorator extends Macro {
    private final ArgsExpander expander;

    private Decorator(String name, ArgsExpander expander) {
      super(name);
      this.expander = expander;
    }

    @Override
    public MacroKind kind() {
      return MacroKind.DECORATOR_REFERENCED;
    }

    public Expansion<Node> expand(@Nullable Node args, Node definition)
        throws SyntaxError.Exception {
      return expander.expand(args, definition);
    }
  }

  /** A macro in {@code with} position. */
  public static final class With extends Macro {
    private final WithExpander expander;

    private With(String name, WithExpander expander) {
      super(name);
      this.expander = expander;
    }

    @Override
    public MacroKind kind() {
      return MacroKind.WITH_REFERENCED;
    }

    public Expansion<Node> expand(@Nullable Node args, @Nullable Node target, Node body)
        throws SyntaxError.Exception {
      return expander.expand(args, target, body);
    }
  }
}
