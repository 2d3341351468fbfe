package ca.gc.cra.proxylog.application.port;

import ca.gc.cra.proxylog.application.pipeline.AnalysisResult;
import java.io.IOException;
import java.io.Writer;

/**
 * Writes an {@link AnalysisResult} for a human or a downstream tool.
 *
 * @since 0.1.0
 */
public interface ReportRenderer {
  /**
   * Renders every report plus the scan diagnostics.
   *
   * @param result analysis outcome
   * @param out destination; not closed by the renderer
   * @throws IOException if writing fails
   */
  void render(AnalysisResult result, Writer out) throws IOException;
}
