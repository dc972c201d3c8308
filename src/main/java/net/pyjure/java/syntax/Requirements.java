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

package net.pyjure.java.syntax;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableSortedSet;

/**
 * Requirements records what a function or class body demands of the later compilation stages, as
 * observed while desugaring it: whether it yields (making the enclosing function a generator), and
 * which parameters of enclosing functions it refers to.
 *
 * <p>Requirements are attached to {@code function}, {@code definition} and {@code class} nodes as
 * metadata and, like locations, do not take part in structural equality.
 */
@AutoValue
public abstract class Requirements {

  /** The requirements of a body that neither yields nor refers to enclosing parameters. */
  public static final Requirements NONE = create(false, ImmutableSortedSet.of());

  /** Reports whether a {@code yield} or {@code yield from} occurred directly in the body. */
  public abstract boolean isGenerator();

  /** Returns the parameters of enclosing functions that are referenced from the body. */
  public abstract ImmutableSortedSet<String> getFreeNames();

  static Requirements create(boolean generator, ImmutableSortedSet<String> freeNames) {
    return new AutoValue_Requirements(generator, freeNames);
  }

  /** Returns these requirements, marked as those of a generator. */
  public Requirements withGenerator() {
    return isGenerator() ? this : create(true, getFreeNames());
  }

  /** Returns these requirements, extended with a reference to the free variable {@code name}. */
  public Requirements withFreeName(String name) {
    if (getFreeNames().contains(name)) {
      return this;
    }
    return create(
        isGenerator(),
        ImmutableSortedSet.<String>naturalOrder().addAll(getFreeNames()).add(name).build());
  }
}
