package ca.gc.cra.proxylog.application.command;

import ca.gc.cra.proxylog.domain.log.LogRecord;
import ca.gc.cra.proxylog.domain.scan.ScanDiagnostics;
import ca.gc.cra.proxylog.validation.Strings;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Name-to-factory table of report commands.
 * <p><strong>Why:</strong> The engine resolves commands by name and drives them through the
 * {@link Aggregator} contract, so adding a report never touches the engine.</p>
 * <p><strong>Thread-safety:</strong> Register during startup on one thread; lookups afterwards are
 * read-only.</p>
 *
 * @since 0.1.0
 */
public final class CommandRegistry {
  private final Map<String, Entry> entries = new LinkedHashMap<>();

  /**
   * Registers a report command.
   *
   * @param name unique command name
   * @param description one-line description shown by {@code --list-commands}
   * @param factory factory creating a fresh aggregator per invocation
   * @return this registry for chaining
   * @throws IllegalArgumentException if {@code name} is already registered or malformed
   */
  public CommandRegistry register(String name, String description, AggregatorFactory factory) {
    String key = Strings.requireIdentifier("command name", name);
    Objects.requireNonNull(factory, "factory");
    if (entries.containsKey(key)) {
      throw new IllegalArgumentException("command already registered: " + key);
    }
    entries.put(key, new Entry(description == null ? "" : description, factory));
    return this;
  }

  public boolean contains(String name) {
    return name != null && entries.containsKey(name);
  }

  /**
   * Checks every name before any work starts.
   *
   * @param names requested command names
   * @throws IllegalArgumentException naming the first unknown command, or when {@code names} is empty
   */
  public void requireKnown(List<String> names) {
    Objects.requireNonNull(names, "names");
    if (names.isEmpty()) {
      throw new IllegalArgumentException("at least one command is required");
    }
    for (String name : names) {
      if (!contains(name)) {
        throw new IllegalArgumentException("unknown command: " + name);
      }
    }
  }

  /**
   * Creates a fresh aggregator for {@code name}.
   *
   * @param name registered command name
   * @return new aggregator
   * @throws IllegalArgumentException if the name is unknown
   */
  public Aggregator create(String name) {
    Entry entry = entries.get(name);
    if (entry == null) {
      throw new IllegalArgumentException("unknown command: " + name);
    }
    Aggregator aggregator = Objects.requireNonNull(entry.factory().create(), "aggregator for " + name);
    if (aggregator.passes() < 1) {
      throw new IllegalStateException("command " + name + " declares " + aggregator.passes() + " passes");
    }
    return aggregator;
  }

  /**
   * Runs one command over a re-iterable record sequence.
   *
   * <p>Each declared pass iterates {@code records} again, so the sequence must yield the same
   * records every time it is iterated.</p>
   *
   * @param name registered command name
   * @param records valid records in file order
   * @param diagnostics counters of the traversal that produced {@code records}
   * @return computed value
   */
  public ReportValue run(String name, Iterable<LogRecord> records, ScanDiagnostics diagnostics) {
    Objects.requireNonNull(records, "records");
    Objects.requireNonNull(diagnostics, "diagnostics");
    Aggregator aggregator = create(name);
    for (int pass = 0; pass < aggregator.passes(); pass++) {
      aggregator.startPass(pass);
      for (LogRecord record : records) {
        aggregator.accept(record);
      }
    }
    return aggregator.result(diagnostics);
  }

  public Set<String> names() {
    return Collections.unmodifiableSet(entries.keySet());
  }

  /**
   * Returns names with their descriptions in registration order.
   *
   * @return unmodifiable name to description map
   */
  public Map<String, String> descriptions() {
    Map<String, String> result = new LinkedHashMap<>();
    entries.forEach((name, entry) -> result.put(name, entry.description()));
    return Collections.unmodifiableMap(result);
  }

  private record Entry(String description, AggregatorFactory factory) {}
}
