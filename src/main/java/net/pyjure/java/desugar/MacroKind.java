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

/** The syntactic position in which a macro is recognized. */
public enum MacroKind {
  /** A plain identifier reference, {@code m}. */
  REFERENCED,
  /** The callee of a call, {@code m(...)}. */
  CALL_REFERENCED,
  /** A decorator, {@code @m} or {@code @m(...)}. */
  DECORATOR_REFERENCED,
  /** The context expression of a {@code with} item, {@code with m:} or {@code with m(...):}. */
  WITH_REFERENCED
}
