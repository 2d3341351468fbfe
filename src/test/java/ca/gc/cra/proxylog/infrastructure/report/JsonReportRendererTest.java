package ca.gc.cra.proxylog.infrastructure.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.proxylog.application.pipeline.AnalysisResult;
import ca.gc.cra.proxylog.domain.window.TimeWindow;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class JsonReportRendererTest {

  /** Flattens scalar fields to {@code path=value} strings, e.g. {@code reports.command=counter}. */
  private static List<String> flatten(String json) throws IOException {
    List<String> fields = new ArrayList<>();
    List<String> path = new ArrayList<>();
    String field = null;
    try (JsonParser parser = new JsonFactory().createParser(json)) {
      JsonToken token;
      while ((token = parser.nextToken()) != null) {
        switch (token) {
          case FIELD_NAME -> field = parser.currentName();
          case START_OBJECT, START_ARRAY -> {
            path.add(field == null ? "" : field);
            field = null;
          }
          case END_OBJECT, END_ARRAY -> path.remove(path.size() - 1);
          default -> {
            String prefix = path.stream().filter(p -> !p.isEmpty()).collect(Collectors.joining("."));
            String name = field == null ? "[]" : field;
            fields.add((prefix.isEmpty() ? "" : prefix + ".") + name + "="
                + (token == JsonToken.VALUE_NULL ? "null" : parser.getText()));
            field = null;
          }
        }
      }
    }
    return fields;
  }

  private static String render() throws IOException {
    StringWriter out = new StringWriter();
    new JsonReportRenderer().render(ReportFixtures.result(true), out);
    return out.toString();
  }

  @Test
  void writesHeaderAndDiagnostics() throws IOException {
    List<String> fields = flatten(render());

    assertTrue(fields.contains("logFile=/var/log/haproxy.log"), fields::toString);
    assertTrue(fields.contains("window.start=2013-12-11T00:00"));
    assertTrue(fields.contains("window.end=2013-12-11T01:00"));
    assertTrue(fields.contains("diagnostics.linesRead=7"));
    assertTrue(fields.contains("diagnostics.malformed=2"));
    assertTrue(fields.contains("diagnostics.unscannedLines=4"));
  }

  @Test
  void writesEveryReportKind() throws IOException {
    List<String> fields = flatten(render());

    assertTrue(fields.contains("reports.value=3"), fields::toString);
    assertTrue(fields.contains("reports.value=1500.00"));
    assertTrue(fields.contains("reports.value.200=2"));
    assertTrue(fields.contains("reports.value.503=1"));
    assertTrue(fields.contains("reports.value.path=/export"));
    assertTrue(fields.contains("reports.value.totalTimeMs=1502"));
    assertTrue(fields.contains("reports.value.status=null"));
    assertEquals(5, fields.stream().filter(f -> f.startsWith("reports.kind=")).count());
  }

  @Test
  void keepsCountOrder() throws IOException {
    List<String> fields = flatten(render());

    assertTrue(fields.indexOf("reports.value.200=2") < fields.indexOf("reports.value.503=1"));
  }

  @Test
  void unboundedWindowWritesNulls() throws IOException {
    AnalysisResult base = ReportFixtures.result(false);
    StringWriter out = new StringWriter();
    new JsonReportRenderer().render(
        new AnalysisResult(base.logFile(), TimeWindow.unbounded(), List.of(), base.diagnostics()), out);

    List<String> fields = flatten(out.toString());
    assertTrue(fields.contains("window.start=null"));
    assertTrue(fields.contains("window.end=null"));
  }

  @Test
  void leavesTargetOpen() throws IOException {
    TrackingWriter out = new TrackingWriter();

    new JsonReportRenderer().render(ReportFixtures.result(false), out);

    assertFalse(out.closed);
    assertNull(out.failure);
    assertTrue(out.buffer.toString().endsWith(System.lineSeparator()));
  }

  private static final class TrackingWriter extends Writer {
    private final StringBuilder buffer = new StringBuilder();
    private boolean closed;
    private IOException failure;

    @Override
    public void write(char[] cbuf, int off, int len) throws IOException {
      if (closed) {
        failure = new IOException("write after close");
        throw failure;
      }
      buffer.append(cbuf, off, len);
    }

    @Override
    public void flush() {}

    @Override
    public void close() {
      closed = true;
    }
  }
}
