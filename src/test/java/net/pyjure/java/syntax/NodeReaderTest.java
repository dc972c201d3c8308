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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link NodeReader}. */
@RunWith(JUnit4.class)
public final class NodeReaderTest {

  // Asserts that reading the input fails with the given "file:line:col: message" error.
  private static void assertReadError(String expected, String... lines) {
    SyntaxError.Exception ex =
        assertThrows(SyntaxError.Exception.class, () -> NodeReader.readLines(lines));
    assertThat(ex.error().toString()).isEqualTo(expected);
  }

  @Test
  public void testReadNestedTree() throws Exception {
    Node node =
        NodeReader.readLines("(call (id \"f\") (args (integer \"1\") (keyarg \"k\" (id \"v\"))))");
    assertThat(node.tag()).isEqualTo(Node.Tag.CALL);
    assertThat(node.child(0).value()).isEqualTo("f");
    Node args = node.child(1);
    assertThat(args.size()).isEqualTo(2);
    assertThat(args.child(0).value()).isEqualTo("1");
    assertThat(args.child(1).tag()).isEqualTo(Node.Tag.KEYARG);
    assertThat(args.child(1).value()).isEqualTo("k");
    assertThat(args.child(1).child(0).value()).isEqualTo("v");
  }

  @Test
  public void testLocationsSpanParentheses() throws Exception {
    Node suite =
        NodeReader.readLines(
            "(suite", //
            "  (pass)",
            "  (id \"x\"))");
    assertThat(suite.location().file()).isEqualTo("<input>");
    assertThat(suite.location().line()).isEqualTo(1);
    assertThat(suite.location().column()).isEqualTo(1);
    assertThat(suite.location().endLine()).isEqualTo(3);
    assertThat(suite.location().endColumn()).isEqualTo(11);

    Location pass = suite.child(0).location();
    assertThat(pass.toString()).isEqualTo("<input>:2:3");
    assertThat(pass.endColumn()).isEqualTo(8);

    Location id = suite.child(1).location();
    assertThat(id.toString()).isEqualTo("<input>:3:3");
    assertThat(id.endLine()).isEqualTo(3);
    assertThat(id.endColumn()).isEqualTo(10);
  }

  @Test
  public void testAbsentOptionalChild() throws Exception {
    Node node = NodeReader.readLines("(if (id \"c\") (pass) _)");
    assertThat(node.size()).isEqualTo(3);
    assertThat(node.child(1).tag()).isEqualTo(Node.Tag.PASS);
    assertThat(node.child(2)).isNull();
  }

  @Test
  public void testCommentsAndWhitespace() throws Exception {
    Node node =
        NodeReader.readLines(
            "; a program", //
            "\t(pass) ; trailing",
            "");
    assertThat(node.tag()).isEqualTo(Node.Tag.PASS);
    assertThat(node.location().toString()).isEqualTo("<input>:2:2");
  }

  @Test
  public void testStringEscapes() throws Exception {
    Node node = NodeReader.readLines("(string \"a\\\"b\\\\c\\nd\\te\")");
    assertThat(node.value()).isEqualTo("a\"b\\c\nd\te");
  }

  @Test
  public void testTagNamesUseHyphens() throws Exception {
    Node node = NodeReader.readLines("(handler-bind (id \"ex\") (pass) (raise (id \"ex\") _))");
    assertThat(node.tag()).isEqualTo(Node.Tag.HANDLER_BIND);
    assertThat(node.child(2).tag()).isEqualTo(Node.Tag.RAISE);
  }

  @Test
  public void testReadFromFileName() throws Exception {
    Node node = NodeReader.read("(pass)", "foo.tree");
    assertThat(node.location().toString()).isEqualTo("foo.tree:1:1");
  }

  @Test
  public void testErrors() throws Exception {
    assertReadError("<input>:1:1: unknown tag 'frob'", "(frob)");
    assertReadError("<input>:1:7: tag 'pass' takes no value", "(pass \"x\")");
    assertReadError("<input>:1:1: id requires a value", "(id)");
    assertReadError("<input>:1:1: bind expects 2 children, got 1", "(bind (id \"x\"))");
    assertReadError("<input>:1:1: bind: child 0 may not be absent", "(bind _ (id \"x\"))");
    assertReadError("<input>:1:8: unexpected input after tree: '('", "(pass) (pass)");
    assertReadError("<input>:1:9: unclosed string literal", "(string \"abc");
    assertReadError("<input>:1:6: expected child of 'pass' or ')', got end of input", "(pass");
    assertReadError("<input>:1:1: expected '(', got 'p'", "pass");
    assertReadError("<input>:1:12: invalid escape sequence: \\q", "(string \"a\\q\")");
  }
}
