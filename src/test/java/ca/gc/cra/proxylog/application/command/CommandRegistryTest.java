package ca.gc.cra.proxylog.application.command;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.proxylog.domain.log.LogRecord;
import ca.gc.cra.proxylog.domain.scan.ScanDiagnostics;
import ca.gc.cra.proxylog.testing.LogLines;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class CommandRegistryTest {

  @Test
  void requireKnownRejectsEmptyAndUnknownNames() {
    CommandRegistry registry = new CommandRegistry().register("count", "", CountingAggregator::new);

    IllegalArgumentException empty = assertThrows(IllegalArgumentException.class,
        () -> registry.requireKnown(List.of()));
    IllegalArgumentException unknown = assertThrows(IllegalArgumentException.class,
        () -> registry.requireKnown(List.of("count", "bogus")));

    assertEquals("at least one command is required", empty.getMessage());
    assertEquals("unknown command: bogus", unknown.getMessage());
  }

  @Test
  void duplicateRegistrationIsRejected() {
    CommandRegistry registry = new CommandRegistry().register("count", "", CountingAggregator::new);

    assertThrows(IllegalArgumentException.class, () -> registry.register("count", "", CountingAggregator::new));
  }

  @Test
  void aggregatorDeclaringNoPassesIsRejected() {
    CommandRegistry registry = new CommandRegistry().register("broken", "", () -> new CountingAggregator() {
      @Override
      public int passes() {
        return 0;
      }
    });

    assertThrows(IllegalStateException.class, () -> registry.create("broken"));
  }

  @Test
  void runFeedsEveryPassAndEachRecord() {
    List<Integer> passesSeen = new ArrayList<>();
    CommandRegistry registry = new CommandRegistry().register("twice", "", () -> new CountingAggregator() {
      @Override
      public int passes() {
        return 2;
      }

      @Override
      public void startPass(int pass) {
        passesSeen.add(pass);
      }
    });
    List<LogRecord> records = List.of(LogLines.line().record(), LogLines.line().record());

    ReportValue value = registry.run("twice", records, ScanDiagnostics.empty());

    assertEquals(List.of(0, 1), passesSeen);
    assertEquals(4L, value.scalar());
  }

  @Test
  void namesKeepRegistrationOrder() {
    CommandRegistry registry = new CommandRegistry()
        .register("b", "second letter", CountingAggregator::new)
        .register("a", "first letter", CountingAggregator::new);

    assertEquals(List.of("b", "a"), List.copyOf(registry.names()));
    assertEquals("first letter", registry.descriptions().get("a"));
  }

  private static class CountingAggregator implements Aggregator {
    private long seen;

    @Override
    public void accept(LogRecord record) {
      seen++;
    }

    @Override
    public ReportValue result(ScanDiagnostics diagnostics) {
      return ReportValue.scalar(seen);
    }
  }
}
