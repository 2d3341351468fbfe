package ca.gc.cra.proxylog.infrastructure.report;

import ca.gc.cra.proxylog.application.command.Report;
import ca.gc.cra.proxylog.application.command.ReportValue;
import ca.gc.cra.proxylog.application.pipeline.AnalysisResult;
import ca.gc.cra.proxylog.application.port.ReportRenderer;
import ca.gc.cra.proxylog.domain.log.LogRecord;
import ca.gc.cra.proxylog.domain.scan.ScanDiagnostics;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.math.BigDecimal;
import java.util.Map;

/**
 * Renders reports as plain text for terminals.
 *
 * <p>Each report starts with its command name; counts are printed as key/count columns, scalars on
 * one line, flagged records as their raw log lines.</p>
 *
 * @since 0.1.0
 */
public final class TextReportRenderer implements ReportRenderer {
  private static final String INDENT = "  ";

  @Override
  public void render(AnalysisResult result, Writer out) throws IOException {
    PrintWriter writer = new PrintWriter(out);
    ScanDiagnostics d = result.diagnostics();
    writer.println("log     : " + result.logFile());
    writer.println("window  : " + result.window());
    writer.println("lines   : " + d.linesRead() + " read, " + d.valid() + " valid, "
        + d.malformedCount() + " malformed, " + d.filteredOut() + " filtered out"
        + (d.stoppedEarly() ? ", " + d.unscannedLines() + " unscanned" : ""));
    for (Report report : result.reports()) {
      writer.println();
      writer.println(report.command());
      renderValue(writer, report.value());
    }
    writer.flush();
    if (writer.checkError()) {
      throw new IOException("failed to write text report");
    }
  }

  private static void renderValue(PrintWriter writer, ReportValue value) {
    switch (value.kind()) {
      case SCALAR -> writer.println(INDENT + formatScalar(value.scalar()));
      case COUNTS -> renderCounts(writer, value.counts());
      case RECORDS -> {
        if (value.records().isEmpty()) {
          writer.println(INDENT + "(none)");
        }
        for (LogRecord record : value.records()) {
          writer.println(INDENT + record.rawLine());
        }
      }
    }
  }

  private static void renderCounts(PrintWriter writer, Map<String, Long> counts) {
    if (counts.isEmpty()) {
      writer.println(INDENT + "(none)");
      return;
    }
    int keyWidth = 0;
    for (String key : counts.keySet()) {
      keyWidth = Math.max(keyWidth, key.length());
    }
    for (Map.Entry<String, Long> entry : counts.entrySet()) {
      writer.println(INDENT + pad(entry.getKey(), keyWidth) + "  " + entry.getValue());
    }
  }

  static String formatScalar(Number scalar) {
    return scalar instanceof BigDecimal decimal ? decimal.toPlainString() : scalar.toString();
  }

  private static String pad(String value, int width) {
    StringBuilder sb = new StringBuilder(width);
    sb.append(value);
    while (sb.length() < width) {
      sb.append(' ');
    }
    return sb.toString();
  }
}
