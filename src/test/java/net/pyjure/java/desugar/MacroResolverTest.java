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

import net.pyjure.java.syntax.Node;
import net.pyjure.java.syntax.NodeReader;
import net.pyjure.java.syntax.Requirements;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link MacroResolver}. */
@RunWith(JUnit4.class)
public final class MacroResolverTest {

  private static final Macro REF = Macro.reference("ref", Expansion::unit);
  private static final Macro CALL = Macro.call("call", Expansion::unit);
  private static final Macro WITH =
      Macro.with("with", (args, target, body) -> Expansion.unit(body));

  private final CompileTimeScope base =
      CompileTimeScope.builder()
          .addMacro(REF)
          .addMacro(CALL)
          .addMacro(WITH)
          .addModule(
              "outer",
              CompileTimeScope.builder()
                  .addModule("inner", CompileTimeScope.builder().addMacro(CALL).build())
                  .build())
          .build();

  private Environment env() {
    return Environment.initial(base, DesugarOptions.DEFAULT);
  }

  private Macro resolve(MacroKind kind, String first, String... rest) throws Exception {
    return MacroResolver.resolve(kind, QualifiedName.of(first, rest)).run(env()).value();
  }

  @Test
  public void testResolvesByKind() throws Exception {
    assertThat(resolve(MacroKind.REFERENCED, "ref")).isSameInstanceAs(REF);
    assertThat(resolve(MacroKind.CALL_REFERENCED, "ref")).isNull();
    assertThat(resolve(MacroKind.CALL_REFERENCED, "call")).isSameInstanceAs(CALL);
    assertThat(resolve(MacroKind.REFERENCED, "unknown")).isNull();
  }

  @Test
  public void testResolvesThroughModules() throws Exception {
    assertThat(resolve(MacroKind.CALL_REFERENCED, "outer", "inner", "call"))
        .isSameInstanceAs(CALL);
    assertThat(resolve(MacroKind.CALL_REFERENCED, "outer", "call")).isNull();
    assertThat(resolve(MacroKind.CALL_REFERENCED, "call", "call")).isNull();
    assertThat(resolve(MacroKind.CALL_REFERENCED, "outer", "missing", "call")).isNull();
  }

  @Test
  public void testExpressionPositions() throws Exception {
    Node callee =
        NodeReader.readLines(
            "(attribute (attribute (id \"outer\") (id \"inner\")) (id \"call\"))");
    assertThat(MacroResolver.callMacro(callee).run(env()).value()).isSameInstanceAs(CALL);
    Node notAName = NodeReader.readLines("(call (id \"call\") (args))");
    assertThat(MacroResolver.callMacro(notAName).run(env()).value()).isNull();

    Node context = NodeReader.readLines("(call (id \"with\") (args (id \"x\")))");
    assertThat(MacroResolver.withMacro(context).run(env()).value()).isSameInstanceAs(WITH);
    assertThat(MacroResolver.macroArgs(context))
        .isEqualTo(NodeReader.readLines("(args (id \"x\"))"));
    assertThat(MacroResolver.macroArgs(NodeReader.readLines("(id \"with\")"))).isNull();
  }

  @Test
  public void testLookupAcrossFunctionRecordsFreeName() throws Exception {
    CompileTimeScope function = base.enterFunction().bind("p", CompileTimeBinding.lexical());
    Environment inFunction = env().withScope(function);
    Environment nested = env().withScope(function.enterFunction());

    Requirements local =
        MacroResolver.compileTimeEffect("p").run(inFunction).env().requirements();
    assertThat(local.getFreeNames()).isEmpty();

    Expansion.Step<CompileTimeBinding> step = MacroResolver.compileTimeEffect("p").run(nested);
    assertThat(step.value()).isSameInstanceAs(CompileTimeBinding.lexical());
    assertThat(step.env().requirements().getFreeNames()).containsExactly("p");

    // Macros are not variables of the enclosing function.
    Requirements macro =
        MacroResolver.compileTimeEffect("ref").run(nested).env().requirements();
    assertThat(macro.getFreeNames()).isEmpty();
  }
}
