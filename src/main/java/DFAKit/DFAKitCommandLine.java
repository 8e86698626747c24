package DFAKit;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import DFAKit.Model.ProductOperation;
import DFAKit.Serialization.DOTFormat;
import DFAKit.Serialization.JSONFormat;

public class DFAKitCommandLine {
  private static final List<String> UNARY_COMMANDS = List.of("minimize", "trim");
  private static final List<String> BINARY_COMMANDS = List.of("intersection", "union", "difference");

  public static void main(String[] args) {
    String jsonFilename = null;
    String dotFilename = null;
    List<String> positional = new ArrayList<>(3);

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        // must happen before the first logger is created
        System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
      } else if ("--writeJSON".equalsIgnoreCase(arg) || "--writeDOT".equalsIgnoreCase(arg)) {
        if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
          System.err.println("Missing value for " + arg);
          printUsageAndExit();
        }
        if ("--writeJSON".equalsIgnoreCase(arg)) {
          jsonFilename = args[++i];
        } else {
          dotFilename = args[++i];
        }
      } else if (arg.startsWith("-") && arg.length() > 1) {
        printUsageAndExit();
      } else {
        positional.add(arg);
      }
    }

    if (positional.size() != expectedArguments(positional.isEmpty() ? "" : positional.get(0))) {
      printUsageAndExit();
    }

    String command = positional.get(0).toLowerCase();
    final Dfa first = readJSONFile(positional.get(1));
    System.out.println("Input DFA size: " + first.size());
    System.out.println("Alphabet: " + new ArrayList<>(first.getAlphabet()));

    if ("run".equals(command)) {
      String input = positional.get(2);
      System.out.println("run(\"" + input + "\"): " + (first.run(input) ? "accepted" : "rejected"));
      return;
    }

    List<Dfa> operands = new ArrayList<>(2);
    operands.add(first);
    if (positional.size() > 2) {
      Dfa second = readJSONFile(positional.get(2));
      System.out.println("Second DFA size: " + second.size());
      operands.add(second);
    }

    if ("equivalent".equals(command)) {
      boolean equivalent = operands.get(0).isEquivalentTo(operands.get(1));
      System.out.println("Equivalent: " + equivalent);
      return;
    }

    long before = System.currentTimeMillis();
    Dfa result = allCommands(command, operands);
    long after = System.currentTimeMillis();
    System.out.println(command + " DFA size: " + result.size());
    System.out.println(command + " duration: " + ((after - before) / 1000f) + "s");

    if (jsonFilename != null) {
      writeJSONFile(jsonFilename, result);
    }
    if (dotFilename != null) {
      writeDOTFile(dotFilename, result);
    }
  }

  private static int expectedArguments(String command) {
    String c = command.toLowerCase();
    if (UNARY_COMMANDS.contains(c)) {
      return 2;
    }
    if (BINARY_COMMANDS.contains(c) || "equivalent".equals(c) || "run".equals(c)) {
      return 3;
    }
    return -1;
  }

  private static void printUsageAndExit() {
    System.out.println(
        "DFAKit [--debug] [--writeJSON <JSON output file>] [--writeDOT <DOT output file>] <command> <JSON input file> [<JSON input file> | <input>]");
    System.out.println("[--debug] : Additional debug/progress output");
    System.out.println("[--writeJSON <JSON output file>] : Write resulting DFA to specified file");
    System.out.println("[--writeDOT <DOT output file>] : Write resulting DFA as a GraphViz diagram");
    System.out.println();
    System.out.println("<command> : one of the choices below:");
    System.out.println("  minimize A: Partition-refinement minimization.");
    System.out.println("  trim A: Remove states unreachable from the start state.");
    System.out.println("  intersection A B: Product automaton accepting where both accept.");
    System.out.println("  union A B: Product automaton accepting where either accepts.");
    System.out.println("  difference A B: Product automaton accepting where A accepts and B does not.");
    System.out.println("  equivalent A B: Compare canonical forms of A and B.");
    System.out.println("  run A <input>: Run A on the input string.");
    System.out.println();
    System.out.println("<JSON input file> : automaton with starting_state, states, alphabet and transition_table.");
    System.exit(0);
  }

  /**
   * Choose operation to run.
   * @param command - command passed in from command-line
   * @param operands - one automaton for unary commands, two for binary ones
   * @return - resulting DFA
   */
  static Dfa allCommands(String command, List<Dfa> operands) {
    System.out.println();
    System.out.println("Invoking command:" + command);
    return switch (command.toLowerCase()) {
      case "minimize" -> DFAMinimizer.minimize(operands.get(0));
      case "trim" -> DFATrim.trim(operands.get(0));
      case "intersection" -> DFAProduct.product(operands.get(0), operands.get(1), ProductOperation.INTERSECTION);
      case "union" -> DFAProduct.product(operands.get(0), operands.get(1), ProductOperation.UNION);
      case "difference" -> DFAProduct.product(operands.get(0), operands.get(1), ProductOperation.DIFFERENCE);
      default -> throw new IllegalStateException("Unexpected command choice: " + command);
    };
  }

  static Dfa readJSONFile(String filePath) {
    try {
      return JSONFormat.read(Path.of(filePath));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private static void writeJSONFile(String filename, Dfa dfa) {
    System.out.println("Writing to file: " + filename);
    try {
      JSONFormat.write(dfa, Path.of(filename));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private static void writeDOTFile(String filename, Dfa dfa) {
    System.out.println("Writing to file: " + filename);
    try {
      DOTFormat.write(dfa, Path.of(filename));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
