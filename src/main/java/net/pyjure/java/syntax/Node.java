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

import com.google.common.base.Ascii;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * A Node is an immutable tagged tuple {@code (tag, value?, child...)}: the common currency of the
 * reader, the desugarer and the later compilation stages.
 *
 * <p>Each {@link Tag} fixes the layout of its children: a number of fixed slots, each either
 * required or optional (an absent optional slot holds null), optionally followed by a variadic tail
 * of non-null children. Tags that name something (identifiers, literals, operators, builtins) also
 * carry a string value.
 *
 * <p>The source {@link Location} and the {@link Requirements} of a node are attached out of band:
 * {@link #equals} compares tag, value and children only.
 */
public final class Node {

  /** Whether, and how, a tag carries a string value. */
  public enum ValueKind {
    NONE,
    REQUIRED,
    OPTIONAL
  }

  /**
   * Tag of a node. Core tags form the closed vocabulary produced by the desugarer; literal tags may
   * appear in its output only directly beneath {@code constant}; all others are surface syntax.
   *
   * <p>The slot layout string has one character per fixed slot: {@code !} for a required child,
   * {@code ?} for an optional one.
   */
  public enum Tag {
    // ==== Core vocabulary ====
    MODULE("", true, ValueKind.NONE, Category.CORE),
    SUITE("", true, ValueKind.NONE, Category.CORE),
    ID("", false, ValueKind.REQUIRED, Category.CORE),
    CALL("!!", false, ValueKind.NONE, Category.CORE), // callee, args
    ARGS("", true, ValueKind.NONE, Category.CORE), // positional, keyarg, star-arg, starstar-arg
    KEYARG("!", false, ValueKind.REQUIRED, Category.CORE),
    STAR_ARG("!", false, ValueKind.NONE, Category.CORE),
    STARSTAR_ARG("!", false, ValueKind.NONE, Category.CORE),
    FUNCTION("!?!", false, ValueKind.NONE, Category.CORE), // params, return type, body
    PARAMS("", true, ValueKind.NONE, Category.CORE),
    PARAM("??", false, ValueKind.REQUIRED, Category.CORE), // type, default
    STAR_PARAM("?", false, ValueKind.OPTIONAL, Category.CORE), // type; no name for a bare *
    STARSTAR_PARAM("?", false, ValueKind.REQUIRED, Category.CORE), // type
    DEFN("", true, ValueKind.NONE, Category.CORE), // definition...
    DEFINITION("!!?!", false, ValueKind.NONE, Category.CORE), // name, params, return type, body
    CLASS("!!!", true, ValueKind.NONE, Category.CORE), // name, args, body, decorator...
    BIND("!!", false, ValueKind.NONE, Category.CORE), // target id, value
    UNBIND("!", false, ValueKind.NONE, Category.CORE),
    GLOBAL("", true, ValueKind.NONE, Category.CORE),
    NONLOCAL("", true, ValueKind.NONE, Category.CORE),
    IMPORT("", true, ValueKind.NONE, Category.CORE), // as-name...
    FROM("?", true, ValueKind.REQUIRED, Category.CORE), // value: leading dots; module, as-name...
    AS_NAME("!?", false, ValueKind.NONE, Category.CORE), // dotted name, alias
    DOTTED_NAME("", true, ValueKind.NONE, Category.CORE),
    BUILTIN("", true, ValueKind.REQUIRED, Category.CORE),
    CONSTANT("!", false, ValueKind.NONE, Category.CORE),
    IF("!!?", false, ValueKind.NONE, Category.CORE),
    RAISE("??", false, ValueKind.NONE, Category.CORE), // exception, cause
    HANDLER_BIND("!!!", false, ValueKind.NONE, Category.CORE), // carrier id, body, handler
    UNWIND_PROTECT("!!", false, ValueKind.NONE, Category.CORE), // body, cleanup
    WHILE("!!?", false, ValueKind.NONE, Category.CORE),
    CONTINUE("", false, ValueKind.NONE, Category.CORE),
    BREAK("", false, ValueKind.NONE, Category.CORE),
    YIELD("?", false, ValueKind.NONE, Category.CORE),
    YIELD_FROM("!", false, ValueKind.NONE, Category.CORE),

    // ==== Literals ====
    INTEGER("", false, ValueKind.REQUIRED, Category.LITERAL),
    FLOAT("", false, ValueKind.REQUIRED, Category.LITERAL),
    STRING("", false, ValueKind.REQUIRED, Category.LITERAL),
    BYTES("", false, ValueKind.REQUIRED, Category.LITERAL),
    IMAGINARY("", false, ValueKind.REQUIRED, Category.LITERAL),
    TRUE("", false, ValueKind.NONE, Category.LITERAL),
    FALSE("", false, ValueKind.NONE, Category.LITERAL),
    NONE("", false, ValueKind.NONE, Category.LITERAL),
    ELLIPSIS("", false, ValueKind.NONE, Category.LITERAL),
    ZERO_UPLE("", false, ValueKind.NONE, Category.LITERAL),
    EMPTY_LIST("", false, ValueKind.NONE, Category.LITERAL),
    EMPTY_DICT("", false, ValueKind.NONE, Category.LITERAL),

    // ==== Surface syntax ====
    EXPRESSION("!", false, ValueKind.NONE, Category.SURFACE),
    INTERACTIVE("!", false, ValueKind.NONE, Category.SURFACE),
    DEF("!!?!", true, ValueKind.NONE, Category.SURFACE), // name, params, type, body, decorator...
    DECORATOR("!?", false, ValueKind.NONE, Category.SURFACE), // expression, args
    LAMBDA("!!", false, ValueKind.NONE, Category.SURFACE), // params, body
    PASS("", false, ValueKind.NONE, Category.SURFACE),
    DEL("", true, ValueKind.NONE, Category.SURFACE),
    ASSIGN("!", true, ValueKind.NONE, Category.SURFACE), // value, target...
    AUGASSIGN("!!", false, ValueKind.REQUIRED, Category.SURFACE), // target, argument
    ATTRIBUTE("!!", false, ValueKind.NONE, Category.SURFACE), // object, id
    SUBSCRIPT("!!", false, ValueKind.NONE, Category.SURFACE),
    SLICE("???", false, ValueKind.NONE, Category.SURFACE),
    STARRED("!", false, ValueKind.NONE, Category.SURFACE),
    LIST("", true, ValueKind.NONE, Category.SURFACE),
    TUPLE("", true, ValueKind.NONE, Category.SURFACE),
    SET("", true, ValueKind.NONE, Category.SURFACE),
    DICT("", true, ValueKind.NONE, Category.SURFACE), // key, value, key, value...
    BINOP("!!", false, ValueKind.REQUIRED, Category.SURFACE),
    UNARYOP("!", false, ValueKind.REQUIRED, Category.SURFACE),
    BOOLOP("", true, ValueKind.REQUIRED, Category.SURFACE), // value: "and" or "or"
    COMPARE("!", true, ValueKind.NONE, Category.SURFACE), // left, comparison...
    COMPARISON("!", false, ValueKind.REQUIRED, Category.SURFACE), // value: operator
    IF_EXPR("!!?", false, ValueKind.NONE, Category.SURFACE),
    COND("?", true, ValueKind.NONE, Category.SURFACE), // else, clause...
    CLAUSE("!!", false, ValueKind.NONE, Category.SURFACE), // test, body
    FOR("!!!?", false, ValueKind.NONE, Category.SURFACE), // target, iterable, body, else
    WITH("!", true, ValueKind.NONE, Category.SURFACE), // body, with-item...
    WITH_ITEM("!?", false, ValueKind.NONE, Category.SURFACE), // context manager, target
    TRY("!??", true, ValueKind.NONE, Category.SURFACE), // body, else, finally, except...
    EXCEPT("??!", false, ValueKind.NONE, Category.SURFACE), // type, target, body
    RETURN("?", false, ValueKind.NONE, Category.SURFACE),
    ASSERT("!?", false, ValueKind.NONE, Category.SURFACE),
    LIST_COMP("!", true, ValueKind.NONE, Category.SURFACE), // element, clause...
    SET_COMP("!", true, ValueKind.NONE, Category.SURFACE),
    GENERATOR("!", true, ValueKind.NONE, Category.SURFACE),
    DICT_COMP("!!", true, ValueKind.NONE, Category.SURFACE), // key, value, clause...
    COMP_FOR("!!", false, ValueKind.NONE, Category.SURFACE), // target, iterable
    COMP_IF("!", false, ValueKind.NONE, Category.SURFACE);

    private enum Category {
      CORE,
      LITERAL,
      SURFACE
    }

    private static final ImmutableMap<String, Tag> BY_NAME;

    static {
      ImmutableMap.Builder<String, Tag> byName = ImmutableMap.builder();
      for (Tag tag : values()) {
        byName.put(tag.getName(), tag);
      }
      BY_NAME = byName.buildOrThrow();
    }

    private final String slots;
    private final boolean variadic;
    private final ValueKind valueKind;
    private final Category category;
    private final String name;

    Tag(String slots, boolean variadic, ValueKind valueKind, Category category) {
      this.slots = slots;
      this.variadic = variadic;
      this.valueKind = valueKind;
      this.category = category;
      this.name = Ascii.toLowerCase(name()).replace('_', '-');
    }

    /** Returns the printed name of the tag, such as {@code "handler-bind"}. */
    public String getName() {
      return name;
    }

    /** Returns the tag with the given printed name, or null if there is none. */
    @Nullable
    public static Tag fromName(String name) {
      return BY_NAME.get(name);
    }

    /** Returns the number of fixed child slots. */
    public int fixedSlots() {
      return slots.length();
    }

    /** Reports whether fixed slot {@code i} may be absent (null). */
    public boolean isOptionalSlot(int i) {
      return slots.charAt(i) == '?';
    }

    /** Reports whether a variadic tail follows the fixed slots. */
    public boolean isVariadic() {
      return variadic;
    }

    public ValueKind valueKind() {
      return valueKind;
    }

    /** Reports whether this tag belongs to the core vocabulary produced by the desugarer. */
    public boolean isCore() {
      return category == Category.CORE;
    }

    /** Reports whether this tag is a literal, which is core only beneath {@code constant}. */
    public boolean isLiteral() {
      return category == Category.LITERAL;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  private final Tag tag;
  @Nullable private final String value;
  private final List<Node> children; // unmodifiable; absent optional slots are null
  private final Location location;
  @Nullable private final Requirements requirements;

  private Node(
      Tag tag,
      @Nullable String value,
      List<Node> children,
      Location location,
      @Nullable Requirements requirements) {
    this.tag = tag;
    this.value = value;
    this.children = children;
    this.location = location;
    this.requirements = requirements;
  }

  /**
   * Creates a node, checking that the value and the children agree with the layout of the tag.
   *
   * @throws IllegalArgumentException if they do not
   */
  public static Node create(
      Tag tag, Location location, @Nullable String value, List<Node> children) {
    Preconditions.checkNotNull(tag);
    Preconditions.checkNotNull(location);
    switch (tag.valueKind()) {
      case NONE -> Preconditions.checkArgument(value == null, "%s takes no value", tag);
      case REQUIRED -> Preconditions.checkArgument(value != null, "%s requires a value", tag);
      case OPTIONAL -> {}
    }
    int n = children.size();
    int fixed = tag.fixedSlots();
    Preconditions.checkArgument(
        tag.isVariadic() ? n >= fixed : n == fixed,
        "%s expects %s%s children, got %s",
        tag,
        tag.isVariadic() ? "at least " : "",
        fixed,
        n);
    for (int i = 0; i < n; i++) {
      if (children.get(i) == null) {
        Preconditions.checkArgument(
            i < fixed && tag.isOptionalSlot(i), "%s: child %s may not be absent", tag, i);
      }
    }
    return new Node(
        tag, value, Collections.unmodifiableList(new ArrayList<>(children)), location, null);
  }

  /** Creates a node without a value. Absent optional children are passed as null. */
  public static Node of(Tag tag, Location location, Node... children) {
    return create(tag, location, null, Arrays.asList(children));
  }

  /** Creates a node with a value. Absent optional children are passed as null. */
  public static Node withValue(Tag tag, Location location, String value, Node... children) {
    return create(tag, location, value, Arrays.asList(children));
  }

  /** Creates an identifier node. */
  public static Node id(Location location, String name) {
    return create(Tag.ID, location, name, List.of());
  }

  public Tag tag() {
    return tag;
  }

  /** Reports whether this node has the given tag. */
  public boolean is(Tag tag) {
    return this.tag == tag;
  }

  /** Returns the string value of the node (name, literal text, operator), or null. */
  @Nullable
  public String value() {
    return value;
  }

  /** Returns the children of the node. Absent optional slots are null. */
  public List<Node> children() {
    return children;
  }

  /** Returns the i-th child, or null if that optional slot is absent. */
  @Nullable
  public Node child(int i) {
    return children.get(i);
  }

  /** Returns the number of children, including absent optional slots. */
  public int size() {
    return children.size();
  }

  /** Returns the variadic tail of the node: the children after the fixed slots. */
  public List<Node> tail() {
    return children.subList(tag.fixedSlots(), children.size());
  }

  public Location location() {
    return location;
  }

  /** Returns the requirements attached by the desugarer, or null if none were attached. */
  @Nullable
  public Requirements requirements() {
    return requirements;
  }

  /** Returns a copy of this node at a different location. */
  public Node withLocation(Location location) {
    return new Node(tag, value, children, Preconditions.checkNotNull(location), requirements);
  }

  /** Returns a copy of this node carrying the given requirements. */
  public Node withRequirements(Requirements requirements) {
    return new Node(tag, value, children, location, Preconditions.checkNotNull(requirements));
  }

  /** Returns a node with the same tag, value, location and requirements but other children. */
  public Node withChildren(List<Node> children) {
    Node n = create(tag, location, value, children);
    return requirements == null ? n : n.withRequirements(requirements);
  }

  @Override
  public boolean equals(Object that) {
    if (this == that) {
      return true;
    }
    if (!(that instanceof Node other)) {
      return false;
    }
    return tag == other.tag
        && Objects.equals(value, other.value)
        && children.equals(other.children);
  }

  @Override
  public int hashCode() {
    return Objects.hash(tag, value, children);
  }

  /** Returns the node in the notation read by {@link NodeReader}, on a single line. */
  @Override
  public String toString() {
    return NodePrinter.print(this);
  }
}
