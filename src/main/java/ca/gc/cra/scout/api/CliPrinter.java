package ca.gc.cra.scout.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Console output for usage text, dry-run plans, listings and session summaries.
 *
 * <p>Writes through the stdout file descriptor so command output stays separate from log output,
 * which Logback sends to stderr.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints a formatted line.
   *
   * @param format {@link String#format(String, Object...)} pattern, without trailing newline
   * @param args format arguments
   */
  public static void printf(String format, Object... args) {
    writer().println(String.format(format, args));
  }

  /**
   * Prints text that already contains line breaks, without adding a blank line at the end.
   *
   * @param block text block
   */
  public static void printBlock(String block) {
    if (block == null || block.isEmpty()) {
      return;
    }
    PrintWriter writer = writer();
    writer.print(block.endsWith("\n") ? block : block + "\n");
    writer.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    return override != null ? override : STDOUT;
  }
}
