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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;
import javax.annotation.Nullable;
import net.pyjure.java.syntax.SyntaxError;

/**
 * An Expansion is a step of compile-time computation: a function from the current {@link
 * Environment} to a result paired with the environment that follows it.
 *
 * <p>Expansions are composed with {@link #bind}, {@link #map}, {@link #sequence} and {@link #let},
 * which run their parts strictly left to right, each part seeing the environment left by the
 * previous one. This fixes the order of every compile-time side effect (macro registration, suite
 * stack changes, gensym allocation) to the textual order of the tree. Exactly one environment is
 * live at a time: an expansion must not run a part against an environment it has already passed on.
 *
 * @param <T> the type of the result; results may be null (an empty suite desugars to nothing)
 */
@FunctionalInterface
public interface Expansion<T> {

  /** Runs this expansion in {@code env}. */
  Step<T> run(Environment env) throws SyntaxError.Exception;

  /** A Step is the outcome of running an expansion: its result and the following environment. */
  final class Step<T> {
    @Nullable private final T value;
    private final Environment env;

    public Step(@Nullable T value, Environment env) {
      this.value = value;
      this.env = Preconditions.checkNotNull(env);
    }

    @Nullable
    public T value() {
      return value;
    }

    public Environment env() {
      return env;
    }
  }

  /** Continuation builds the expansion that follows from the result of a previous one. */
  @FunctionalInterface
  interface Continuation<T, U> {
    Expansion<U> apply(@Nullable T value) throws SyntaxError.Exception;
  }

  /** Function is a pure transformation of a result. */
  @FunctionalInterface
  interface Function<T, U> {
    @Nullable
    U apply(@Nullable T value) throws SyntaxError.Exception;
  }

  /** Body computes the result of a {@link #let} form. */
  @FunctionalInterface
  interface Body<T> {
    @Nullable
    T apply(Let let) throws SyntaxError.Exception;
  }

  /**
   * A Let threads the environment through the sub-expansions run by the body of a {@link #let}
   * form. It must not escape the body.
   */
  final class Let {
    private Environment env;

    private Let(Environment env) {
      this.env = env;
    }

    /** Runs the expansion in the current environment and returns its result. */
    @Nullable
    public <V> V bind(Expansion<V> expansion) throws SyntaxError.Exception {
      Step<V> step = expansion.run(env);
      env = step.env();
      return step.value();
    }

    /** Returns the current environment, for reading. */
    public Environment env() {
      return env;
    }
  }

  /** Returns an expansion that yields {@code value} and leaves the environment untouched. */
  static <T> Expansion<T> unit(@Nullable T value) {
    return env -> new Step<>(value, env);
  }

  /** Returns an expansion that yields the current environment. */
  static Expansion<Environment> environment() {
    return env -> new Step<>(env, env);
  }

  /** Returns an expansion that replaces the environment by {@code f(env)}. */
  static Expansion<Void> update(UnaryOperator<Environment> f) {
    return env -> new Step<>(null, f.apply(env));
  }

  /** Returns an expansion that fails with the given error. */
  static <T> Expansion<T> fail(SyntaxError error) {
    return env -> {
      throw new SyntaxError.Exception(error);
    };
  }

  /**
   * Runs this expansion, feeds its result to {@code f}, and runs the expansion {@code f} returns in
   * the environment this one left.
   */
  default <U> Expansion<U> bind(Continuation<? super T, U> f) {
    return env -> {
      Step<T> first = run(env);
      return f.apply(first.value()).run(first.env());
    };
  }

  /** Runs this expansion and transforms its result. */
  default <U> Expansion<U> map(Function<? super T, ? extends U> f) {
    return env -> {
      Step<T> step = run(env);
      return new Step<>(f.apply(step.value()), step.env());
    };
  }

  /** Runs this expansion, discards its result, then runs {@code next}. */
  default <U> Expansion<U> then(Expansion<U> next) {
    return env -> next.run(run(env).env());
  }

  /**
   * Returns an expansion running each of {@code expansions} in order and yielding the list of their
   * results. The list may contain nulls.
   */
  static <T> Expansion<List<T>> sequence(List<? extends Expansion<? extends T>> expansions) {
    return env -> {
      List<T> results = new ArrayList<>(expansions.size());
      for (Expansion<? extends T> e : expansions) {
        Step<? extends T> step = e.run(env);
        results.add(step.value());
        env = step.env();
      }
      return new Step<>(Collections.unmodifiableList(results), env);
    };
  }

  /**
   * Returns an expansion applying {@code f} to each element of {@code items} in order, running the
   * resulting expansions left to right, and yielding the list of results.
   */
  static <A, T> Expansion<List<T>> traverse(
      List<? extends A> items, Continuation<? super A, T> f) {
    return env -> {
      List<T> results = new ArrayList<>(items.size());
      for (A item : items) {
        Step<T> step = f.apply(item).run(env);
        results.add(step.value());
        env = step.env();
      }
      return new Step<>(Collections.unmodifiableList(results), env);
    };
  }

  /**
   * Returns the "let-multiple-bindings" form: an expansion whose body runs any number of possibly
   * dependent sub-expansions through {@link Let#bind}, in the order the body calls them, and then
   * builds the result.
   */
  static <T> Expansion<T> let(Body<T> body) {
    return env -> {
      Let let = new Let(env);
      T value = body.apply(let);
      return new Step<>(value, let.env);
    };
  }
}
