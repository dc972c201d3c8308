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
import java.util.List;
import net.pyjure.java.syntax.Location;
import net.pyjure.java.syntax.Node;
import net.pyjure.java.syntax.Requirements;

/**
 * An Environment is the compile-time state threaded through a run of the desugarer by {@link
 * Expansion}s. It is immutable; each operation returns the environment that follows.
 *
 * <p>It consists of
 *
 * <ul>
 *   <li>the current {@link CompileTimeScope}, holding macro bindings;
 *   <li>the suite stack: for each suite being desugared, innermost first, the statements of that
 *       suite that are still to be desugared;
 *   <li>the counter from which fresh identifiers are generated;
 *   <li>the {@link Requirements} of the function body being desugared;
 *   <li>the {@link DesugarOptions} of the run.
 * </ul>
 */
public final class Environment {

  /** Separates the prefix of a fresh identifier from its number. */
  static final char FRESH_NAME_MARKER = '-';

  private final CompileTimeScope scope;
  private final ImmutableList<ImmutableList<Node>> suites; // innermost first
  private final int gensymCounter;
  private final Requirements requirements;
  private final DesugarOptions options;

  private Environment(
      CompileTimeScope scope,
      ImmutableList<ImmutableList<Node>> suites,
      int gensymCounter,
      Requirements requirements,
      DesugarOptions options) {
    this.scope = scope;
    this.suites = suites;
    this.gensymCounter = gensymCounter;
    this.requirements = requirements;
    this.options = options;
  }

  /** Returns the environment in which a run starts. */
  public static Environment initial(CompileTimeScope base, DesugarOptions options) {
    return new Environment(
        Preconditions.checkNotNull(base),
        ImmutableList.of(),
        0,
        Requirements.NONE,
        Preconditions.checkNotNull(options));
  }

  public CompileTimeScope scope() {
    return scope;
  }

  public Environment withScope(CompileTimeScope scope) {
    return new Environment(scope, suites, gensymCounter, requirements, options);
  }

  /** Returns this environment with {@code name} bound in the current scope. */
  public Environment bindInScope(String name, CompileTimeBinding binding) {
    return withScope(scope.bind(name, binding));
  }

  public Requirements requirements() {
    return requirements;
  }

  public Environment withRequirements(Requirements requirements) {
    return new Environment(
        scope, suites, gensymCounter, Preconditions.checkNotNull(requirements), options);
  }

  public DesugarOptions options() {
    return options;
  }

  /** Returns the number of suites being desugared. */
  public int suiteDepth() {
    return suites.size();
  }

  /** Enters a suite whose statements are {@code statements}. */
  public Environment pushSuite(List<Node> statements) {
    return new Environment(
        scope,
        ImmutableList.<ImmutableList<Node>>builder()
            .add(ImmutableList.copyOf(statements))
            .addAll(suites)
            .build(),
        gensymCounter,
        requirements,
        options);
  }

  /**
   * Leaves the innermost suite.
   *
   * @throws IllegalStateException if no suite is being desugared
   */
  public Environment popSuite() {
    Preconditions.checkState(!suites.isEmpty(), "suite stack underflow");
    return new Environment(
        scope, suites.subList(1, suites.size()), gensymCounter, requirements, options);
  }

  /**
   * Returns the statements of the innermost suite that are still to be desugared.
   *
   * @throws IllegalStateException if no suite is being desugared
   */
  public ImmutableList<Node> pendingStatements() {
    Preconditions.checkState(!suites.isEmpty(), "no suite is being desugared");
    return suites.get(0);
  }

  /** Replaces the statements still to be desugared in the innermost suite. */
  public Environment withPendingStatements(List<Node> statements) {
    Preconditions.checkState(!suites.isEmpty(), "no suite is being desugared");
    return new Environment(
        scope,
        ImmutableList.<ImmutableList<Node>>builder()
            .add(ImmutableList.copyOf(statements))
            .addAll(suites.subList(1, suites.size()))
            .build(),
        gensymCounter,
        requirements,
        options);
  }

  /** Returns the value the next fresh identifier will be numbered with. */
  public int gensymCounter() {
    return gensymCounter;
  }

  /**
   * Returns an expansion yielding a fresh identifier {@code prefix-N} located at {@code loc}. The
   * desugarer rejects source names containing {@link #FRESH_NAME_MARKER}, so fresh identifiers
   * never capture them.
   */
  public static Expansion<Node> gensym(Location loc, String prefix) {
    return env ->
        new Expansion.Step<>(
            Node.id(loc, prefix + FRESH_NAME_MARKER + env.gensymCounter),
            new Environment(
                env.scope, env.suites, env.gensymCounter + 1, env.requirements, env.options));
  }
}
