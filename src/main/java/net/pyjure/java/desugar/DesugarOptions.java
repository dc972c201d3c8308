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

import com.google.auto.value.AutoValue;

/**
 * DesugarOptions is a set of options that affect a single run of the desugarer. They select the
 * dialect of the surface language the desugarer accepts, and what it checks about its own output,
 * analogous to the command-line options of a typical compiler.
 *
 * <p>The {@link #DEFAULT} options represent the desired behavior for new uses of the desugarer.
 */
@AutoValue
public abstract class DesugarOptions {

  /** The default options. New clients should use these defaults. */
  public static final DesugarOptions DEFAULT = builder().build();

  /**
   * Reject constructs that are recognized but not implemented by the later stages, currently
   * {@code import} and {@code from}, instead of passing them through unchanged.
   */
  public abstract boolean failOnUnimplemented();

  /**
   * After desugaring, check that the result uses only the core vocabulary. A violation is a bug of
   * the desugarer (or of a macro) and is reported as an {@link IllegalStateException}.
   */
  public abstract boolean verifyCoreOutput();

  public static Builder builder() {
    // These are the DEFAULT values.
    return new AutoValue_DesugarOptions.Builder()
        .failOnUnimplemented(false)
        .verifyCoreOutput(true);
  }

  public abstract Builder toBuilder();

  /** Builder for DesugarOptions. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder failOnUnimplemented(boolean value);

    public abstract Builder verifyCoreOutput(boolean value);

    public abstract DesugarOptions build();
  }
}
