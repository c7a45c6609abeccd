package ca.gc.cra.sweep.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Minimal console output helper for usage text and end-of-run reports.
 *
 * <p>Uses native file descriptors in order to avoid direct {@code System.out} references while
 * keeping stdout separate from the log stream.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints a single line to stdout using the shared CLI writer.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints a titled block of aligned {@code label : value} rows.
   *
   * @param title first line of the block
   * @param rows labels and values in display order; {@code null} values print as {@code <none>}
   */
  public static void printReport(String title, Map<String, ?> rows) {
    PrintWriter writer = writer();
    writer.println(title);
    int width = 0;
    for (String label : rows.keySet()) {
      width = Math.max(width, label.length());
    }
    for (Map.Entry<String, ?> row : rows.entrySet()) {
      Object value = row.getValue();
      writer.println(" " + pad(row.getKey(), width) + " : " + (value == null ? "<none>" : value));
    }
    writer.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    PrintWriter current = override;
    return current != null ? current : STDOUT;
  }

  private static String pad(String label, int width) {
    StringBuilder padded = new StringBuilder(label);
    while (padded.length() < width) {
      padded.append(' ');
    }
    return padded.toString();
  }
}
