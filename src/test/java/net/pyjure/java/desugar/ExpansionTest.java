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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import net.pyjure.java.syntax.Location;
import net.pyjure.java.syntax.Node;
import net.pyjure.java.syntax.SyntaxError;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link Expansion} composition. */
@RunWith(JUnit4.class)
public final class ExpansionTest {

  private static final Location LOC = Location.fromFileLineColumn("test", 1, 1);

  private final Environment env =
      Environment.initial(CompileTimeScope.EMPTY, DesugarOptions.DEFAULT);

  private static Expansion<String> fresh(String prefix) {
    return Environment.gensym(LOC, prefix).map(Node::value);
  }

  // Asserts that two expansions yield equal results and leave the same gensym counter.
  private void assertEquivalent(Expansion<?> x, Expansion<?> y) throws Exception {
    Expansion.Step<?> a = x.run(env);
    Expansion.Step<?> b = y.run(env);
    assertThat(a.value()).isEqualTo(b.value());
    assertThat(a.env().gensymCounter()).isEqualTo(b.env().gensymCounter());
  }

  @Test
  public void testLeftIdentity() throws Exception {
    assertEquivalent(Expansion.unit("p").bind(ExpansionTest::fresh), fresh("p"));
  }

  @Test
  public void testRightIdentity() throws Exception {
    assertEquivalent(fresh("p").<String>bind(Expansion::unit), fresh("p"));
  }

  @Test
  public void testAssociativity() throws Exception {
    Expansion.Continuation<String, String> f = ExpansionTest::fresh;
    Expansion.Continuation<String, String> g = s -> fresh(s + "/");
    assertEquivalent(
        fresh("p").bind(f).bind(g), //
        fresh("p").bind(s -> f.apply(s).bind(g)));
    assertThat(fresh("p").bind(f).bind(g).run(env).value()).isEqualTo("p-0-1/-2");
  }

  @Test
  public void testSequenceRunsLeftToRight() throws Exception {
    Expansion.Step<List<String>> step =
        Expansion.<String>sequence(ImmutableList.of(fresh("a"), fresh("b"), fresh("c"))).run(env);
    assertThat(step.value()).containsExactly("a-0", "b-1", "c-2").inOrder();
    assertThat(step.env().gensymCounter()).isEqualTo(3);
  }

  @Test
  public void testTraverse() throws Exception {
    Expansion.Step<List<String>> step =
        Expansion.traverse(ImmutableList.of("x", "y"), ExpansionTest::fresh).run(env);
    assertThat(step.value()).containsExactly("x-0", "y-1").inOrder();
  }

  @Test
  public void testLetBindsInOrder() throws Exception {
    Expansion<String> e =
        Expansion.let(
            let -> {
              String a = let.bind(fresh("a"));
              String b = let.bind(fresh(a));
              return a + " " + b;
            });
    Expansion.Step<String> step = e.run(env);
    assertThat(step.value()).isEqualTo("a-0 a-0-1");
    assertThat(step.env().gensymCounter()).isEqualTo(2);
  }

  @Test
  public void testRunDoesNotChangeItsEnvironment() throws Exception {
    fresh("a").then(fresh("b")).run(env);
    assertThat(env.gensymCounter()).isEqualTo(0);
  }

  @Test
  public void testUpdateAndEnvironment() throws Exception {
    Expansion<Integer> depth =
        Expansion.update(e -> e.pushSuite(ImmutableList.of()))
            .then(Expansion.environment())
            .map(Environment::suiteDepth);
    assertThat(depth.run(env).value()).isEqualTo(1);
  }

  @Test
  public void testFailStopsTheComposition() throws Exception {
    Node node = Node.id(LOC, "x");
    List<String> ran = new ArrayList<>();
    Expansion<String> e =
        Expansion.<String>fail(SyntaxError.of(node, "boom", ImmutableMap.of()))
            .bind(
                s -> {
                  ran.add(s);
                  return fresh("b");
                });
    SyntaxError.Exception ex = assertThrows(SyntaxError.Exception.class, () -> e.run(env));
    assertThat(ex.error().message()).isEqualTo("boom");
    assertThat(ex.error().node()).isSameInstanceAs(node);
    assertThat(ran).isEmpty();
  }
}
