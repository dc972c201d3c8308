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

/**
 * The MacroResolver finds the macro, if any, that a name denotes in a given syntactic position.
 *
 * <p>Resolution looks up the first identifier of a qualified name through the scope chain of the
 * environment, then descends through module bindings for the remaining identifiers. The lookup of
 * the first identifier is a compile-time effect: finding a parameter of an enclosing function
 * records it among the free names of the current {@link net.pyjure.java.syntax.Requirements}.
 */
public final class MacroResolver {

  private MacroResolver() {}

  /**
   * Returns an expansion yielding the macro of the given kind that {@code name} denotes, or null if
   * it denotes none.
   */
  public static Expansion<Macro> resolve(MacroKind kind, QualifiedName name) {
    return Expansion.let(
        let -> {
          CompileTimeBinding binding = let.bind(compileTimeEffect(name.head()));
          for (String part : name.path()) {
            CompileTimeScope module = binding == null ? null : binding.getModule();
            if (module == null) {
              return null;
            }
            binding = module.getLocal(part);
          }
          if (binding == null) {
            return null;
          }
          Macro macro = binding.getMacro();
          return macro != null && macro.kind() == kind ? macro : null;
        });
  }

  /**
   * Returns an expansion that looks {@code name} up in the current scope chain, yielding its
   * binding or null. A parameter found outside the current function is recorded as a free name.
   */
  static Expansion<CompileTimeBinding> compileTimeEffect(String name) {
    return env -> {
      CompileTimeScope.Lookup lookup = env.scope().lookup(name);
      if (lookup == null) {
        return new Expansion.Step<>(null, env);
      }
      CompileTimeBinding binding = lookup.binding();
      if (binding.has(CompileTimeBinding.Flag.LEXICAL) && lookup.crossedFunctionBoundary()) {
        env = env.withRequirements(env.requirements().withFreeName(name));
      }
      return new Expansion.Step<>(binding, env);
    };
  }

  /** Returns the macro an identifier expression denotes, or null. */
  public static Expansion<Macro> referenceMacro(Node id) {
    return resolve(MacroKind.REFERENCED, QualifiedName.of(id.value()));
  }

  /** Returns the call macro that the callee of a call denotes, or null. */
  public static Expansion<Macro> callMacro(Node callee) {
    return resolveExpr(MacroKind.CALL_REFERENCED, callee);
  }

  /** Returns the decorator macro that a decorator expression denotes, or null. */
  public static Expansion<Macro> decoratorMacro(Node decorator) {
    return resolveExpr(MacroKind.DECORATOR_REFERENCED, decorator);
  }

  /**
   * Returns the with-macro that the context expression of a {@code with} item denotes, or null. For
   * a call expression, the callee names the macro and the arguments are those of the macro (see
   * {@link #macroArgs}).
   */
  public static Expansion<Macro> withMacro(Node context) {
    return resolveExpr(
        MacroKind.WITH_REFERENCED, context.is(Node.Tag.CALL) ? context.child(0) : context);
  }

  /** Returns the arguments a decorator or context expression applies its macro to, or null. */
  @Nullable
  public static Node macroArgs(Node expr) {
    return expr.is(Node.Tag.CALL) ? expr.child(1) : null;
  }

  private static Expansion<Macro> resolveExpr(MacroKind kind, Node expr) {
    QualifiedName name = QualifiedName.namify(expr);
    return name == null ? Expansion.unit(null) : resolve(kind, name);
  }
}
