package ca.gc.cra.proxylog.infrastructure.report;

import ca.gc.cra.proxylog.application.command.Report;
import ca.gc.cra.proxylog.application.command.ReportValue;
import ca.gc.cra.proxylog.application.pipeline.AnalysisResult;
import ca.gc.cra.proxylog.application.port.ReportRenderer;
import ca.gc.cra.proxylog.domain.log.HttpRequest;
import ca.gc.cra.proxylog.domain.log.LogRecord;
import ca.gc.cra.proxylog.domain.scan.ScanDiagnostics;
import ca.gc.cra.proxylog.domain.window.TimeWindow;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.util.Map;

/**
 * Renders an analysis as one JSON document with Jackson's streaming generator.
 *
 * <p>Layout: {@code logFile}, {@code window}, {@code diagnostics} and a {@code reports} array whose
 * entries carry {@code command}, {@code kind} and {@code value}. Count maps keep report order;
 * flagged records are written as objects with their main fields and the raw line.</p>
 *
 * @since 0.1.0
 */
public final class JsonReportRenderer implements ReportRenderer {
  private final JsonFactory jsonFactory = new JsonFactory();

  @Override
  public void render(AnalysisResult result, Writer out) throws IOException {
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      gen.useDefaultPrettyPrinter();
      gen.writeStartObject();
      gen.writeStringField("logFile", result.logFile().toString());
      writeWindow(gen, result.window());
      writeDiagnostics(gen, result.diagnostics());
      gen.writeArrayFieldStart("reports");
      for (Report report : result.reports()) {
        gen.writeStartObject();
        gen.writeStringField("command", report.command());
        gen.writeStringField("kind", report.value().kind().name());
        gen.writeFieldName("value");
        writeValue(gen, report.value());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
    out.write(System.lineSeparator());
    out.flush();
  }

  private static void writeWindow(JsonGenerator gen, TimeWindow window) throws IOException {
    gen.writeObjectFieldStart("window");
    if (window.start().isPresent()) {
      gen.writeStringField("start", window.start().get().toString());
    } else {
      gen.writeNullField("start");
    }
    if (window.end().isPresent()) {
      gen.writeStringField("end", window.end().get().toString());
    } else {
      gen.writeNullField("end");
    }
    gen.writeEndObject();
  }

  private static void writeDiagnostics(JsonGenerator gen, ScanDiagnostics d) throws IOException {
    gen.writeObjectFieldStart("diagnostics");
    gen.writeNumberField("linesRead", d.linesRead());
    gen.writeNumberField("valid", d.valid());
    gen.writeNumberField("malformed", d.malformedCount());
    gen.writeNumberField("malformedStructural", d.malformedStructural());
    gen.writeNumberField("malformedValue", d.malformedValue());
    gen.writeNumberField("filteredOut", d.filteredOut());
    gen.writeNumberField("unscannedLines", d.unscannedLines());
    gen.writeEndObject();
  }

  private static void writeValue(JsonGenerator gen, ReportValue value) throws IOException {
    switch (value.kind()) {
      case SCALAR -> {
        Number scalar = value.scalar();
        if (scalar instanceof BigDecimal decimal) {
          gen.writeNumber(decimal);
        } else {
          gen.writeNumber(scalar.longValue());
        }
      }
      case COUNTS -> {
        gen.writeStartObject();
        for (Map.Entry<String, Long> entry : value.counts().entrySet()) {
          gen.writeNumberField(entry.getKey(), entry.getValue());
        }
        gen.writeEndObject();
      }
      case RECORDS -> {
        gen.writeStartArray();
        for (LogRecord record : value.records()) {
          writeRecord(gen, record);
        }
        gen.writeEndArray();
      }
    }
  }

  private static void writeRecord(JsonGenerator gen, LogRecord record) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("timestamp", record.timestamp().toString());
    gen.writeStringField("clientIp", record.clientIp());
    gen.writeStringField("frontend", record.frontend());
    gen.writeStringField("backend", record.backend());
    gen.writeStringField("server", record.server());
    if (record.statusCode().isPresent()) {
      gen.writeNumberField("status", record.statusCode().getAsInt());
    } else {
      gen.writeNullField("status");
    }
    if (record.timers().total().isPresent()) {
      gen.writeNumberField("totalTimeMs", record.timers().total().getAsLong());
    } else {
      gen.writeNullField("totalTimeMs");
    }
    if (record.httpRequest().isPresent()) {
      HttpRequest request = record.httpRequest().get();
      gen.writeStringField("method", request.method());
      gen.writeStringField("path", request.path());
    }
    gen.writeStringField("rawLine", record.rawLine());
    gen.writeEndObject();
  }
}
