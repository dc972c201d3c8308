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
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import javax.annotation.Nullable;

/**
 * A CompileTimeBinding is what a name means at desugaring time: a set of flags and, depending on
 * them, a value.
 *
 * <ul>
 *   <li>A MACRO binding holds a {@link Macro}.
 *   <li>A CONSTANT binding whose value is a {@link CompileTimeScope} names a module: qualified
 *       lookups of {@code m.x} descend into it.
 *   <li>A LEXICAL binding marks a function parameter. It carries no value; it hides any macro of
 *       the same name in enclosing scopes.
 * </ul>
 */
public final class CompileTimeBinding {

  /** Flags of a binding. */
  public enum Flag {
    MACRO,
    CONSTANT,
    LEXICAL
  }

  private static final CompileTimeBinding LEXICAL =
      new CompileTimeBinding(ImmutableSet.of(Flag.LEXICAL), null);

  private final ImmutableSet<Flag> flags;
  @Nullable private final Object value; // Macro, CompileTimeScope, or null

  private CompileTimeBinding(ImmutableSet<Flag> flags, @Nullable Object value) {
    this.flags = flags;
    this.value = value;
  }

  /** Returns a binding to a macro. */
  public static CompileTimeBinding macro(Macro macro) {
    return new CompileTimeBinding(ImmutableSet.of(Flag.MACRO), Preconditions.checkNotNull(macro));
  }

  /** Returns a constant binding to a module scope, into which qualified lookups descend. */
  public static CompileTimeBinding module(CompileTimeScope scope) {
    return new CompileTimeBinding(
        ImmutableSet.of(Flag.CONSTANT), Preconditions.checkNotNull(scope));
  }

  /** Returns the binding of a function parameter. */
  public static CompileTimeBinding lexical() {
    return LEXICAL;
  }

  /** Returns a binding with the given flags and value. */
  public static CompileTimeBinding create(Iterable<Flag> flags, @Nullable Object value) {
    ImmutableSet<Flag> set = Sets.immutableEnumSet(flags);
    Preconditions.checkArgument(
        !set.contains(Flag.MACRO) || value instanceof Macro, "MACRO binding requires a macro");
    Preconditions.checkArgument(
        value == null || value instanceof Macro || value instanceof CompileTimeScope,
        "unexpected binding value: %s",
        value);
    return new CompileTimeBinding(set, value);
  }

  public ImmutableSet<Flag> getFlags() {
    return flags;
  }

  public boolean has(Flag flag) {
    return flags.contains(flag);
  }

  /** Returns the macro of a MACRO binding, or null. */
  @Nullable
  public Macro getMacro() {
    return has(Flag.MACRO) ? (Macro) value : null;
  }

  /** Returns the scope of a CONSTANT binding that names a module, or null. */
  @Nullable
  public CompileTimeScope getModule() {
    return has(Flag.CONSTANT) && value instanceof CompileTimeScope scope ? scope : null;
  }

  @Override
  public String toString() {
    return flags + (value == null ? "" : " " + value);
  }
}
