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

import com.google.common.base.Preconditions;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * A Location denotes a span of a source file: the position of its first character and the position
 * just after its last one. Lines and columns are 1-based; zero means unknown.
 *
 * <p>Locations are attached to {@link Node}s out of band: they never take part in structural
 * equality of trees.
 */
public final class Location implements Comparable<Location> {

  /** The location of nodes that were not derived from any source text. */
  public static final Location BUILTIN = new Location("<builtin>", 0, 0, 0, 0);

  private final String file;
  private final int line;
  private final int column;
  private final int endLine;
  private final int endColumn;

  private Location(String file, int line, int column, int endLine, int endColumn) {
    this.file = Preconditions.checkNotNull(file);
    this.line = line;
    this.column = column;
    this.endLine = endLine;
    this.endColumn = endColumn;
  }

  /** Returns a location that covers a single point of the file. */
  public static Location fromFileLineColumn(String file, int line, int column) {
    return new Location(file, line, column, line, column);
  }

  /** Returns a location spanning from (line, column) to (endLine, endColumn). */
  public static Location span(String file, int line, int column, int endLine, int endColumn) {
    Preconditions.checkArgument(
        endLine > line || (endLine == line && endColumn >= column),
        "span ends before it starts: %s:%s:%s-%s:%s",
        file,
        line,
        column,
        endLine,
        endColumn);
    return new Location(file, line, column, endLine, endColumn);
  }

  /** Returns the name of the file containing this location. */
  public String file() {
    return file;
  }

  /** Returns the line number of the start of the span, or zero if unknown. */
  public int line() {
    return line;
  }

  /** Returns the column number of the start of the span, or zero if unknown. */
  public int column() {
    return column;
  }

  public int endLine() {
    return endLine;
  }

  public int endColumn() {
    return endColumn;
  }

  /**
   * Returns the smallest span covering both locations. If the two locations belong to different
   * files, or one of them is null, the other one (or the first one) is returned unchanged.
   */
  public static Location merge(@Nullable Location x, @Nullable Location y) {
    if (x == null || x == BUILTIN) {
      return y == null ? BUILTIN : y;
    }
    if (y == null || y == BUILTIN || !x.file.equals(y.file)) {
      return x;
    }
    Location start = x.compareTo(y) <= 0 ? x : y;
    boolean xEndsLater =
        x.endLine > y.endLine || (x.endLine == y.endLine && x.endColumn >= y.endColumn);
    Location end = xEndsLater ? x : y;
    return new Location(x.file, start.line, start.column, end.endLine, end.endColumn);
  }

  @Override
  public int compareTo(Location that) {
    int cmp = this.file.compareTo(that.file);
    if (cmp != 0) {
      return cmp;
    }
    cmp = Integer.compare(this.line, that.line);
    if (cmp != 0) {
      return cmp;
    }
    return Integer.compare(this.column, that.column);
  }

  /** Returns the start of the span in the form "file:line:column". */
  @Override
  public String toString() {
    StringBuilder buf = new StringBuilder(file);
    if (line != 0) {
      buf.append(':').append(line);
      if (column != 0) {
        buf.append(':').append(column);
      }
    }
    return buf.toString();
  }

  @Override
  public boolean equals(Object that) {
    if (this == that) {
      return true;
    }
    if (!(that instanceof Location other)) {
      return false;
    }
    return file.equals(other.file)
        && line == other.line
        && column == other.column
        && endLine == other.endLine
        && endColumn == other.endColumn;
  }

  @Override
  public int hashCode() {
    return Objects.hash(file, line, column, endLine, endColumn);
  }
}
