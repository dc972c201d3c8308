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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.FormatMethod;
import java.util.List;
import javax.annotation.Nullable;

/**
 * A SyntaxError describes a tree that cannot be desugared: a shape the desugarer does not
 * recognize, or a construct used outside its valid position. It records the offending node and its
 * location, a message template, and the structured parameters the template was formatted with.
 *
 * <p>SyntaxErrors are not exceptions; they are thrown wrapped in a {@link SyntaxError.Exception}.
 */
public final class SyntaxError {

  /** Kind discriminates genuine errors from constructs that are deliberately not supported yet. */
  public enum Kind {
    SYNTAX,
    NOT_YET_IMPLEMENTED
  }

  private final Kind kind;
  private final Location location;
  @Nullable private final Node node;
  private final String template;
  private final ImmutableMap<String, Object> parameters;
  private final String message;

  private SyntaxError(
      Kind kind,
      Location location,
      @Nullable Node node,
      String template,
      ImmutableMap<String, Object> parameters) {
    this.kind = kind;
    this.location = Preconditions.checkNotNull(location);
    this.node = node;
    this.template = template;
    this.parameters = parameters;
    this.message = String.format(template, parameters.values().toArray());
  }

  /**
   * Returns a syntax error about {@code node}. The template is formatted with the values of {@code
   * parameters}, in iteration order.
   */
  public static SyntaxError of(
      Node node, String template, ImmutableMap<String, Object> parameters) {
    return new SyntaxError(Kind.SYNTAX, node.location(), node, template, parameters);
  }

  /** Returns a syntax error about {@code node} with a single parameter. */
  public static SyntaxError of(Node node, String template, String name, Object value) {
    return of(node, template, ImmutableMap.of(name, value));
  }

  /** Returns an error reporting that {@code node} uses a construct that is not implemented. */
  public static SyntaxError notYetImplemented(Node node, String what) {
    return new SyntaxError(
        Kind.NOT_YET_IMPLEMENTED,
        node.location(),
        node,
        "%s is not yet implemented",
        ImmutableMap.of("construct", what));
  }

  /** Returns an error at a location that has no node, such as a malformed token of input. */
  @FormatMethod
  public static SyntaxError at(Location location, String format, Object... args) {
    return new SyntaxError(
        Kind.SYNTAX, location, null, "%s", ImmutableMap.of("message", String.format(format, args)));
  }

  public Kind kind() {
    return kind;
  }

  /** Returns the location of the error. */
  public Location location() {
    return location;
  }

  /** Returns the offending node, or null if the error was not reported against a node. */
  @Nullable
  public Node node() {
    return node;
  }

  /** Returns the unformatted message template. */
  public String template() {
    return template;
  }

  /** Returns the structured parameters of the message, in template order. */
  public ImmutableMap<String, Object> parameters() {
    return parameters;
  }

  /** Returns a description of the error. */
  public String message() {
    return message;
  }

  /** Returns a string of the form {@code "foo.py:1:2: message"}. */
  @Override
  public String toString() {
    return location + ": " + message;
  }

  /**
   * A SyntaxError.Exception is an exception holding one or more syntax errors. Desugaring stops at
   * the first error, so exceptions thrown by the desugarer hold exactly one.
   */
  public static final class Exception extends java.lang.Exception {

    private final ImmutableList<SyntaxError> errors;

    /** Constructs an exception from a non-empty list of errors. */
    public Exception(List<SyntaxError> errors) {
      super(errors.get(0).toString());
      this.errors = ImmutableList.copyOf(errors);
    }

    /** Constructs an exception from a single error. */
    public Exception(SyntaxError error) {
      this(ImmutableList.of(error));
    }

    /** Returns an immutable non-empty list of errors. */
    public ImmutableList<SyntaxError> errors() {
      return errors;
    }

    /** Returns the first error. */
    public SyntaxError error() {
      return errors.get(0);
    }

    @Override
    public String getMessage() {
      return errors.size() == 1 ? errors.get(0).toString() : Joiner.on("\n").join(errors);
    }
  }
}
