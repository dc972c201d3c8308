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

package net.pyjure.java.cmd;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.flogger.GoogleLogger;
import com.google.common.io.CharStreams;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import net.pyjure.java.desugar.CompileTimeScope;
import net.pyjure.java.desugar.DesugarOptions;
import net.pyjure.java.desugar.Desugarer;
import net.pyjure.java.syntax.Node;
import net.pyjure.java.syntax.NodePrinter;
import net.pyjure.java.syntax.NodeReader;
import net.pyjure.java.syntax.SyntaxError;

/**
 * Main is a standalone driver for the desugarer. It reads a surface tree in the notation of {@link
 * NodeReader}, from a file, from the command line or from standard input, and prints the desugared
 * tree, or the errors that prevented desugaring it.
 *
 * <pre>
 * usage: desugar [-strict-imports] [-indent] [-c tree | file]
 * </pre>
 */
public final class Main {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final String USAGE = "usage: desugar [-strict-imports] [-indent] [-c tree | file]";

  private Main() {}

  /** Runs the driver and returns its exit status. */
  static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
    String file = null;
    String cmd = null;
    boolean indent = false;
    DesugarOptions.Builder options = DesugarOptions.builder();

    // parse flags
    int i;
    for (i = 0; i < args.length; i++) {
      if (!args[i].startsWith("-")) {
        break;
      }
      if (args[i].equals("--")) {
        i++;
        break;
      }
      if (args[i].equals("-c")) {
        if (i + 1 == args.length) {
          err.println("-c <tree> flag needs an argument");
          return 2;
        }
        cmd = args[++i];
      } else if (args[i].equals("-strict-imports")) {
        options.failOnUnimplemented(true);
      } else if (args[i].equals("-indent")) {
        indent = true;
      } else {
        err.println("unknown flag: " + args[i]);
        err.println(USAGE);
        return 2;
      }
    }
    // positional arguments
    if (i < args.length) {
      if (i + 1 < args.length) {
        err.println("too many positional arguments");
        return 2;
      }
      file = args[i];
    }
    if (file != null && cmd != null) {
      err.println(USAGE);
      return 2;
    }

    Node program;
    try {
      if (cmd != null) {
        program = NodeReader.read(cmd, "<command-line>");
      } else if (file != null) {
        Path path = Paths.get(file);
        program = NodeReader.readFile(path);
      } else {
        String content = CharStreams.toString(new InputStreamReader(in, UTF_8));
        program = NodeReader.read(content, "<stdin>");
      }
    } catch (IOException ex) {
      err.format("Error reading %s: %s\n", file != null ? file : "<stdin>", ex);
      return 1;
    } catch (SyntaxError.Exception ex) {
      printErrors(ex, err);
      return 1;
    }

    try {
      Node result = Desugarer.desugar(program, CompileTimeScope.EMPTY, options.build());
      out.println(indent ? NodePrinter.prettyPrint(result) : NodePrinter.print(result));
      return 0;
    } catch (SyntaxError.Exception ex) {
      logger.atFine().withCause(ex).log("desugaring %s failed", program.location().file());
      printErrors(ex, err);
      return 1;
    }
  }

  private static void printErrors(SyntaxError.Exception ex, PrintStream err) {
    for (SyntaxError error : ex.errors()) {
      err.println(error);
    }
  }

  public static void main(String[] args) {
    System.exit(run(args, System.in, System.out, System.err));
  }
}
