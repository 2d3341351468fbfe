package ca.gc.cra.proxylog.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line arguments split into {@code --flags} and {@code key=value} pairs.
 *
 * <p>{@code -h}/{@code help} normalize to {@code --help} and {@code -v}/{@code --debug} to
 * {@code --verbose}; other flags are kept lower-cased so each command can check the ones it knows
 * with {@link #unknownFlags(Set)}.</p>
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");
  private static final String HELP = "--help";
  private static final String VERBOSE = "--verbose";

  private final List<String> keyValueArgs;
  private final Set<String> flags;

  private CliInput(List<String> keyValueArgs, Set<String> flags) {
    this.keyValueArgs = List.copyOf(keyValueArgs);
    this.flags = Collections.unmodifiableSet(new LinkedHashSet<>(flags));
  }

  /**
   * Parses raw arguments.
   *
   * @param args raw CLI arguments (may be {@code null}); blank entries are dropped
   * @return parsed arguments
   */
  public static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    for (String raw : args == null ? new String[0] : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        flags.add(HELP);
      } else if (VERBOSE_FLAGS.contains(lower)) {
        flags.add(VERBOSE);
      } else if (arg.startsWith("-") && arg.indexOf('=') < 0) {
        flags.add(lower);
      } else {
        kv.add(arg);
      }
    }
    return new CliInput(kv, flags);
  }

  /**
   * Returns the {@code key=value} style arguments (and a leading sub-command, if any).
   *
   * @return copy of the non-flag arguments in order
   */
  public String[] keyValueArgs() {
    return keyValueArgs.toArray(String[]::new);
  }

  public boolean help() {
    return flags.contains(HELP);
  }

  public boolean verbose() {
    return flags.contains(VERBOSE);
  }

  /**
   * Checks whether a flag such as {@code --dry-run} was given.
   *
   * @param flag flag to query (case-insensitive)
   * @return {@code true} if present
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Lists flags outside {@code known}; help and verbose are always known.
   *
   * @param known flags the caller understands
   * @return unknown flags in the order given
   */
  public List<String> unknownFlags(Set<String> known) {
    List<String> unknown = new ArrayList<>();
    for (String flag : flags) {
      if (!flag.equals(HELP) && !flag.equals(VERBOSE) && !known.contains(flag)) {
        unknown.add(flag);
      }
    }
    return unknown;
  }

  /**
   * Returns a copy of the input without its first non-flag argument (the sub-command).
   *
   * @return remaining arguments with flags preserved
   */
  CliInput dropFirst() {
    return new CliInput(keyValueArgs.subList(Math.min(1, keyValueArgs.size()), keyValueArgs.size()), flags);
  }

  @Override
  public String toString() {
    return "CliInput" + keyValueArgs + flags;
  }
}
