package ca.gc.cra.proxylog.application.filter;

import ca.gc.cra.proxylog.validation.Strings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Name-to-factory table of the filters an analysis may activate.
 * <p><strong>Why:</strong> New filter kinds are added by registering a factory; the chain and the
 * engine never change.</p>
 * <p><strong>Role:</strong> Built once at startup by the composition root and passed to the use
 * case; there is no global registry.</p>
 * <p><strong>Thread-safety:</strong> Register during startup on one thread; lookups afterwards are
 * read-only.</p>
 *
 * @since 0.1.0
 */
public final class FilterRegistry {
  private final Map<String, Entry> entries = new LinkedHashMap<>();

  /**
   * Registers a filter kind.
   *
   * @param name unique filter name
   * @param description one-line description shown by {@code --list-filters}
   * @param factory factory validating the parameter and building the filter
   * @return this registry for chaining
   * @throws IllegalArgumentException if {@code name} is already registered or malformed
   */
  public FilterRegistry register(String name, String description, FilterFactory factory) {
    String key = Strings.requireIdentifier("filter name", name);
    Objects.requireNonNull(factory, "factory");
    if (entries.containsKey(key)) {
      throw new IllegalArgumentException("filter already registered: " + key);
    }
    entries.put(key, new Entry(description == null ? "" : description, factory));
    return this;
  }

  public boolean contains(String name) {
    return name != null && entries.containsKey(name);
  }

  /**
   * Activates one filter.
   *
   * @param name registered name
   * @param argument parameter text
   * @return validated filter
   * @throws IllegalArgumentException if the name is unknown or the parameter is invalid
   */
  public Filter activate(String name, String argument) {
    Entry entry = entries.get(name);
    if (entry == null) {
      throw new IllegalArgumentException("unknown filter: " + name);
    }
    try {
      return entry.factory().create(argument == null ? "" : argument);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(
          "invalid parameter for filter " + name + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Activates a filter, applying negation when requested.
   *
   * @param activation parsed activation
   * @return validated filter
   */
  public Filter activate(FilterActivation activation) {
    Objects.requireNonNull(activation, "activation");
    Filter filter = activate(activation.name(), activation.argument());
    return activation.negated() ? filter.negate() : filter;
  }

  /**
   * Activates every requested filter into a chain; the first invalid activation aborts.
   *
   * @param activations activations in request order
   * @return chain AND-ing all filters
   */
  public FilterChain chain(List<FilterActivation> activations) {
    Objects.requireNonNull(activations, "activations");
    List<Filter> filters = new ArrayList<>(activations.size());
    for (FilterActivation activation : activations) {
      filters.add(activate(activation));
    }
    return FilterChain.of(filters);
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

  private record Entry(String description, FilterFactory factory) {}
}
