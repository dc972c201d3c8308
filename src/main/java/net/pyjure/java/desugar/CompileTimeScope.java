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
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * A CompileTimeScope maps names to their {@link CompileTimeBinding}s, within a chain of enclosing
 * scopes. Scopes are immutable: {@link #bind} returns a new scope, leaving this one unchanged, as
 * it may still be shared, for instance as the parent of other scopes.
 *
 * <p>A scope created by {@link #enterFunction} marks a function boundary. Lookups report whether
 * they crossed one, which is how references to parameters of an enclosing function are detected.
 */
public final class CompileTimeScope {

  /** The scope with no bindings and no parent. */
  public static final CompileTimeScope EMPTY =
      new CompileTimeScope(ImmutableMap.of(), null, false);

  private final ImmutableMap<String, CompileTimeBinding> bindings;
  @Nullable private final CompileTimeScope parent;
  private final boolean functionBoundary;

  private CompileTimeScope(
      ImmutableMap<String, CompileTimeBinding> bindings,
      @Nullable CompileTimeScope parent,
      boolean functionBoundary) {
    this.bindings = bindings;
    this.parent = parent;
    this.functionBoundary = functionBoundary;
  }

  /** Returns a scope like this one in which {@code name} is bound to {@code binding}. */
  public CompileTimeScope bind(String name, CompileTimeBinding binding) {
    Preconditions.checkNotNull(binding);
    Map<String, CompileTimeBinding> copy = new LinkedHashMap<>(bindings);
    copy.put(name, binding);
    return new CompileTimeScope(ImmutableMap.copyOf(copy), parent, functionBoundary);
  }

  /** Returns a new, empty scope for the body of a function defined in this scope. */
  public CompileTimeScope enterFunction() {
    return new CompileTimeScope(ImmutableMap.of(), this, true);
  }

  /** Returns the enclosing scope, or null for an outermost scope. */
  @Nullable
  public CompileTimeScope getParent() {
    return parent;
  }

  public boolean isFunctionBoundary() {
    return functionBoundary;
  }

  /** Returns the binding of {@code name} in this scope itself, ignoring enclosing scopes. */
  @Nullable
  public CompileTimeBinding getLocal(String name) {
    return bindings.get(name);
  }

  /** Returns the binding of {@code name} in the innermost scope that has one, or null. */
  @Nullable
  public Lookup lookup(String name) {
    boolean crossed = false;
    for (CompileTimeScope s = this; s != null; s = s.parent) {
      CompileTimeBinding b = s.bindings.get(name);
      if (b != null) {
        return new Lookup(b, crossed);
      }
      crossed |= s.functionBoundary;
    }
    return null;
  }

  /** The result of a successful {@link #lookup}. */
  public static final class Lookup {
    private final CompileTimeBinding binding;
    private final boolean crossedFunctionBoundary;

    private Lookup(CompileTimeBinding binding, boolean crossedFunctionBoundary) {
      this.binding = binding;
      this.crossedFunctionBoundary = crossedFunctionBoundary;
    }

    public CompileTimeBinding binding() {
      return binding;
    }

    /** Reports whether the binding was found outside the function enclosing the lookup. */
    public boolean crossedFunctionBoundary() {
      return crossedFunctionBoundary;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /** A builder of outermost scopes, as supplied to the desugarer as its base scope. */
  public static final class Builder {
    private final Map<String, CompileTimeBinding> bindings = new LinkedHashMap<>();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder bind(String name, CompileTimeBinding binding) {
      bindings.put(name, Preconditions.checkNotNull(binding));
      return this;
    }

    /** Binds the macro under its own name. */
    @CanIgnoreReturnValue
    public Builder addMacro(Macro macro) {
      return bind(macro.getName(), CompileTimeBinding.macro(macro));
    }

    /** Binds {@code name} to a module whose bindings are {@code module}. */
    @CanIgnoreReturnValue
    public Builder addModule(String name, CompileTimeScope module) {
      return bind(name, CompileTimeBinding.module(module));
    }

    public CompileTimeScope build() {
      return new CompileTimeScope(ImmutableMap.copyOf(bindings), null, false);
    }
  }
}
