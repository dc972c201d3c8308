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

/**
 * Names of the builtin operators that desugared code calls through {@code (builtin "name" ...)}.
 * The runtime library provides them; the desugarer only needs their names.
 *
 * <p>Besides these, surface constructs that map one to one onto an operator become a builtin named
 * after their tag ({@code return}, {@code list}, {@code subscript}...) or after their operator
 * ({@code +}, {@code <}...).
 */
public final class Builtins {

  private Builtins() {}

  /** Converts a value to a boolean, as the test of a conditional does. */
  public static final String TRUTH = "truth";

  public static final String NOT = "not";
  public static final String IS_NOT = "is not";

  // Attribute and item access.
  public static final String ATTRIBUTE = "attribute";
  public static final String SETATTR = "setattr";
  public static final String SUBSCRIPT = "subscript";
  public static final String SETITEM = "setitem";
  public static final String DELITEM = "delitem";
  public static final String SLICE = "slice";

  // Destructuring.
  public static final String LENGTH = "length";
  public static final String SUB = "sub";
  public static final String CHECK_LENGTH_EQ = "check-length-eq";
  public static final String CHECK_LENGTH_GE = "check-length-ge";

  // Iteration protocol of for loops.
  public static final String GEN_NEXT_P = "gen-next?";
  public static final String GEN_FIRST = "gen-first";
  public static final String GEN_REST = "gen-rest";

  // Exceptions.
  public static final String ISINSTANCE = "isinstance";
  public static final String EXC_INFO = "exc-info";
}
