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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Joiner;
import com.google.errorprone.annotations.FormatMethod;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * A reader for trees written in the notation produced by {@link NodePrinter}.
 *
 * <pre>
 * node  = '(' TAG [STRING] child* ')'
 * child = node | '_'
 * </pre>
 *
 * A {@code ;} starts a comment that runs to the end of the line. Each node is given the location
 * spanning from its opening to its closing parenthesis.
 */
public final class NodeReader {

  private final String file;
  private final char[] buffer;
  private int pos;
  private int line = 1;
  private int column = 1;

  private NodeReader(String content, String file) {
    this.file = file;
    this.buffer = content.toCharArray();
  }

  /**
   * Reads a single tree from {@code content}, attributing locations to {@code file}.
   *
   * @throws SyntaxError.Exception if the content is not exactly one well-formed tree
   */
  public static Node read(String content, String file) throws SyntaxError.Exception {
    NodeReader reader = new NodeReader(content, file);
    reader.skipSpace();
    Node node = reader.readNode();
    reader.skipSpace();
    if (reader.pos < reader.buffer.length) {
      throw reader.error("unexpected input after tree: '%s'", reader.buffer[reader.pos]);
    }
    return node;
  }

  /** Reads a tree given line by line, as is convenient in tests. */
  public static Node readLines(String... lines) throws SyntaxError.Exception {
    return read(Joiner.on("\n").join(lines), "<input>");
  }

  /** Reads a single tree from a UTF-8 file. */
  public static Node readFile(Path path) throws IOException, SyntaxError.Exception {
    return read(new String(Files.readAllBytes(path), UTF_8), path.toString());
  }

  private Node readNode() throws SyntaxError.Exception {
    if (peek() != '(') {
      throw error("expected '(', got %s", describe());
    }
    int startLine = line;
    int startColumn = column;
    advance();
    skipSpace();

    String tagName = readSymbol();
    Node.Tag tag = Node.Tag.fromName(tagName);
    if (tag == null) {
      throw errorAt(startLine, startColumn, "unknown tag '%s'", tagName);
    }
    skipSpace();

    String value = null;
    if (peek() == '"') {
      if (tag.valueKind() == Node.ValueKind.NONE) {
        throw error("tag '%s' takes no value", tag);
      }
      value = readString();
      skipSpace();
    }

    List<Node> children = new ArrayList<>();
    while (peek() != ')') {
      if (peek() == '_') {
        advance();
        children.add(null);
      } else if (peek() == '(') {
        children.add(readNode());
      } else {
        throw error("expected child of '%s' or ')', got %s", tag, describe());
      }
      skipSpace();
    }
    int endLine = line;
    int endColumn = column;
    advance();

    Location loc = Location.span(file, startLine, startColumn, endLine, endColumn);
    try {
      return Node.create(tag, loc, value, children);
    } catch (IllegalArgumentException ex) {
      throw new SyntaxError.Exception(SyntaxError.at(loc, "%s", ex.getMessage()));
    }
  }

  private String readSymbol() throws SyntaxError.Exception {
    int start = pos;
    while (pos < buffer.length && isSymbolChar(buffer[pos])) {
      advance();
    }
    if (start == pos) {
      throw error("expected tag, got %s", describe());
    }
    return new String(buffer, start, pos - start);
  }

  private static boolean isSymbolChar(char c) {
    return ('a' <= c && c <= 'z') || ('A' <= c && c <= 'Z') || ('0' <= c && c <= '9') || c == '-';
  }

  private String readString() throws SyntaxError.Exception {
    int startLine = line;
    int startColumn = column;
    advance(); // opening quote
    StringBuilder value = new StringBuilder();
    while (true) {
      if (pos >= buffer.length) {
        throw errorAt(startLine, startColumn, "unclosed string literal");
      }
      char c = buffer[pos];
      advance();
      if (c == '"') {
        return value.toString();
      }
      if (c != '\\') {
        value.append(c);
        continue;
      }
      if (pos >= buffer.length) {
        throw errorAt(startLine, startColumn, "unclosed string literal");
      }
      char escaped = buffer[pos];
      switch (escaped) {
        case '"', '\\' -> value.append(escaped);
        case 'n' -> value.append('\n');
        case 't' -> value.append('\t');
        default -> throw error("invalid escape sequence: \\%s", escaped);
      }
      advance();
    }
  }

  private void skipSpace() {
    while (pos < buffer.length) {
      char c = buffer[pos];
      if (c == ';') {
        while (pos < buffer.length && buffer[pos] != '\n') {
          advance();
        }
      } else if (c == ' ' || c == '\t' || c == '\n' || c == '\r') {
        advance();
      } else {
        return;
      }
    }
  }

  private char peek() {
    return pos < buffer.length ? buffer[pos] : '\0';
  }

  private void advance() {
    if (buffer[pos] == '\n') {
      line++;
      column = 1;
    } else {
      column++;
    }
    pos++;
  }

  private String describe() {
    return pos < buffer.length ? "'" + buffer[pos] + "'" : "end of input";
  }

  @FormatMethod
  private SyntaxError.Exception error(String format, Object... args) {
    return errorAt(line, column, format, args);
  }

  @FormatMethod
  private SyntaxError.Exception errorAt(int line, int column, String format, Object... args) {
    return new SyntaxError.Exception(
        SyntaxError.at(Location.fromFileLineColumn(file, line, column), format, args));
  }
}
