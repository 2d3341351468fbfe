package ca.gc.cra.proxylog.application.command.builtin;

import ca.gc.cra.proxylog.application.command.Aggregator;
import ca.gc.cra.proxylog.application.command.ReportValue;
import ca.gc.cra.proxylog.domain.log.LogRecord;
import ca.gc.cra.proxylog.domain.scan.ScanDiagnostics;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Counts records per category key.
 *
 * <p>Records without a key (no request line, no status) are skipped. The result is ordered either
 * by count descending with ties broken by key, or by key alone; a limit keeps only the first
 * entries of that order.</p>
 */
final class KeyCounter implements Aggregator {
  enum Order {
    BY_COUNT,
    BY_KEY
  }

  private static final Comparator<Map.Entry<String, Long>> BY_COUNT_DESC =
      Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey());

  private final Function<LogRecord, Optional<String>> key;
  private final Order order;
  private final int limit;
  private final Map<String, Long> counts = new HashMap<>();

  KeyCounter(Function<LogRecord, Optional<String>> key, Order order) {
    this(key, order, Integer.MAX_VALUE);
  }

  KeyCounter(Function<LogRecord, Optional<String>> key, Order order, int limit) {
    this.key = Objects.requireNonNull(key, "key");
    this.order = Objects.requireNonNull(order, "order");
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be >= 1");
    }
    this.limit = limit;
  }

  @Override
  public void accept(LogRecord record) {
    key.apply(record).ifPresent(k -> counts.merge(k, 1L, Long::sum));
  }

  @Override
  public ReportValue result(ScanDiagnostics diagnostics) {
    List<Map.Entry<String, Long>> entries = new ArrayList<>(counts.entrySet());
    entries.sort(order == Order.BY_COUNT ? BY_COUNT_DESC : Map.Entry.comparingByKey());
    Map<String, Long> ordered = new LinkedHashMap<>();
    for (Map.Entry<String, Long> entry : entries) {
      if (ordered.size() == limit) {
        break;
      }
      ordered.put(entry.getKey(), entry.getValue());
    }
    return ReportValue.counts(ordered);
  }
}
