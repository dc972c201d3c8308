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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableSet;
import net.pyjure.java.syntax.Node;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link CompileTimeScope} and {@link CompileTimeBinding}. */
@RunWith(JUnit4.class)
public final class CompileTimeScopeTest {

  private static final Macro MACRO = Macro.reference("m", Expansion::unit);

  @Test
  public void testBindReturnsNewScope() throws Exception {
    CompileTimeScope scope = CompileTimeScope.EMPTY.bind("x", CompileTimeBinding.lexical());
    assertThat(scope.getLocal("x")).isSameInstanceAs(CompileTimeBinding.lexical());
    assertThat(CompileTimeScope.EMPTY.getLocal("x")).isNull();
    assertThat(CompileTimeScope.EMPTY.lookup("x")).isNull();
  }

  @Test
  public void testLookupReportsFunctionBoundaries() throws Exception {
    CompileTimeScope outer = CompileTimeScope.builder().addMacro(MACRO).build();
    CompileTimeScope function = outer.enterFunction().bind("p", CompileTimeBinding.lexical());
    CompileTimeScope nested = function.enterFunction();

    assertThat(function.getParent()).isSameInstanceAs(outer);
    assertThat(function.isFunctionBoundary()).isTrue();
    assertThat(outer.isFunctionBoundary()).isFalse();

    CompileTimeScope.Lookup local = function.lookup("p");
    assertThat(local.binding().has(CompileTimeBinding.Flag.LEXICAL)).isTrue();
    assertThat(local.crossedFunctionBoundary()).isFalse();

    CompileTimeScope.Lookup free = nested.lookup("p");
    assertThat(free.binding()).isSameInstanceAs(local.binding());
    assertThat(free.crossedFunctionBoundary()).isTrue();

    assertThat(nested.lookup("m").binding().getMacro()).isSameInstanceAs(MACRO);
    assertThat(nested.lookup("q")).isNull();
  }

  @Test
  public void testInnerBindingShadowsOuter() throws Exception {
    CompileTimeScope outer = CompileTimeScope.builder().addMacro(MACRO).build();
    CompileTimeScope inner = outer.enterFunction().bind("m", CompileTimeBinding.lexical());
    assertThat(inner.lookup("m").binding().getMacro()).isNull();
    assertThat(outer.lookup("m").binding().getMacro()).isSameInstanceAs(MACRO);
  }

  @Test
  public void testModuleBinding() throws Exception {
    CompileTimeScope module = CompileTimeScope.builder().addMacro(MACRO).build();
    CompileTimeScope scope = CompileTimeScope.builder().addModule("mod", module).build();
    CompileTimeBinding binding = scope.getLocal("mod");
    assertThat(binding.getFlags()).containsExactly(CompileTimeBinding.Flag.CONSTANT);
    assertThat(binding.getModule()).isSameInstanceAs(module);
    assertThat(binding.getMacro()).isNull();
    assertThat(CompileTimeBinding.lexical().getModule()).isNull();
  }

  @Test
  public void testCreateChecksValue() throws Exception {
    CompileTimeBinding binding =
        CompileTimeBinding.create(
            ImmutableSet.of(CompileTimeBinding.Flag.MACRO, CompileTimeBinding.Flag.CONSTANT),
            MACRO);
    assertThat(binding.getMacro()).isSameInstanceAs(MACRO);
    assertThat(binding.getModule()).isNull();

    assertThrows(
        IllegalArgumentException.class,
        () -> CompileTimeBinding.create(ImmutableSet.of(CompileTimeBinding.Flag.MACRO), null));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            CompileTimeBinding.create(
                ImmutableSet.of(CompileTimeBinding.Flag.CONSTANT), Node.Tag.ID));
  }
}
