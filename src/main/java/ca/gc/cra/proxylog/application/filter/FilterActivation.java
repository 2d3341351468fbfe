package ca.gc.cra.proxylog.application.filter;

import ca.gc.cra.proxylog.validation.Strings;
import java.util.ArrayList;
import java.util.List;

/**
 * Request to activate one registered filter with a parameter.
 *
 * <p>Textual form is {@code name} or {@code name:argument}; a leading {@code '!'} negates the filter
 * ({@code !ip:10.0.0.5}).</p>
 *
 * @param name registered filter name
 * @param argument parameter text, empty when none
 * @param negated whether the filter's result is inverted
 * @since 0.1.0
 */
public record FilterActivation(String name, String argument, boolean negated) {
  static final String NEGATION_PREFIX = "!";

  public FilterActivation {
    name = Strings.requireIdentifier("filter name", name);
    argument = argument == null ? "" : argument.trim();
  }

  /**
   * Activation without negation.
   *
   * @param name filter name
   * @param argument parameter text
   * @return activation
   */
  public static FilterActivation of(String name, String argument) {
    return new FilterActivation(name, argument, false);
  }

  /**
   * Parses {@code [!]name[:argument]}.
   *
   * @param text activation text
   * @return parsed activation
   * @throws IllegalArgumentException when the name part is blank or malformed
   */
  public static FilterActivation parse(String text) {
    String trimmed = Strings.requireNonBlank("filter", text);
    boolean negated = trimmed.startsWith(NEGATION_PREFIX);
    if (negated) {
      trimmed = trimmed.substring(NEGATION_PREFIX.length()).trim();
    }
    int idx = trimmed.indexOf(':');
    if (idx < 0) {
      return new FilterActivation(trimmed, "", negated);
    }
    return new FilterActivation(trimmed.substring(0, idx), trimmed.substring(idx + 1), negated);
  }

  /**
   * Parses a comma-separated list of activations; blank input yields an empty list.
   *
   * <p>Arguments cannot contain commas; IPv6 literals and CIDR blocks do not need them.</p>
   *
   * @param csv activations separated by commas
   * @return activations in input order
   */
  public static List<FilterActivation> parseList(String csv) {
    if (csv == null || csv.isBlank()) {
      return List.of();
    }
    List<FilterActivation> result = new ArrayList<>();
    for (String token : csv.split(",")) {
      if (!token.isBlank()) {
        result.add(parse(token));
      }
    }
    return List.copyOf(result);
  }

  @Override
  public String toString() {
    String base = argument.isEmpty() ? name : name + ':' + argument;
    return negated ? NEGATION_PREFIX + base : base;
  }
}
