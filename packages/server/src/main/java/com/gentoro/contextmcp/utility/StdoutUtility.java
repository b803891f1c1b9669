package com.gentoro.contextmcp.utility;

import com.gentoro.contextmcp.exception.ExceptionUtil;
import java.io.PrintStream;

/**
 * Console output for the command line modes. ANSI colors are dropped when {@code NO_COLOR} is set
 * or when stdout is not a terminal, so redirected output stays clean.
 */
public class StdoutUtility {
  private static final String GREEN = "\u001B[32m";
  private static final String RED = "\u001B[31m";
  private static final String RESET = "\u001B[0m";

  private static final boolean COLORS =
      System.getenv("NO_COLOR") == null && System.console() != null;

  private StdoutUtility() {}

  public static void printSuccessLine(String message) {
    printSuccessLine(System.out, COLORS, message);
  }

  public static void printNewLine(String message) {
    System.out.println(message);
  }

  public static void printError(String message, Throwable cause) {
    printError(System.err, COLORS, message, cause);
  }

  static void printSuccessLine(PrintStream out, boolean colors, String message) {
    for (String line : message.split("\n")) {
      out.println(paint(colors, GREEN, "OK  " + line));
    }
  }

  static void printError(PrintStream out, boolean colors, String message, Throwable cause) {
    out.println(paint(colors, RED, "ERR " + message));
    if (cause == null) return;
    Throwable root = ExceptionUtil.rootCause(cause);
    if (root != cause) {
      out.println(paint(colors, RED, "    caused by " + root));
    }
    out.println(paint(colors, RED, "    at " + ExceptionUtil.formatCompactStackTrace(cause, 5)));
  }

  private static String paint(boolean colors, String color, String text) {
    return colors ? color + text + RESET : text;
  }
}
