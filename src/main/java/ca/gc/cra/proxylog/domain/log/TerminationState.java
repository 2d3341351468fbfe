package ca.gc.cra.proxylog.domain.log;

import java.util.Objects;

/**
 * Session termination code logged by HAProxy (two characters for TCP logs, four for HTTP logs).
 *
 * <p>The first character names who ended the session ({@code C} client, {@code S} server,
 * {@code P} proxy, {@code -} normal completion, ...). The second names the session phase at that
 * moment ({@code R} request, {@code Q} queue, {@code C} connect, {@code H} headers, {@code D} data,
 * {@code L} last data, {@code T} tarpit, {@code -} none).</p>
 *
 * @param code raw code, two to four characters
 * @since 0.1.0
 */
public record TerminationState(String code) {

  public TerminationState {
    Objects.requireNonNull(code, "code");
    if (code.length() < 2 || code.length() > 4) {
      throw new IllegalArgumentException("termination state must have 2 to 4 characters: " + code);
    }
  }

  /**
   * Returns the character describing who terminated the session.
   *
   * @return session cause character
   */
  public char cause() {
    return code.charAt(0);
  }

  /**
   * Returns the character describing the session phase at termination.
   *
   * @return session phase character
   */
  public char phase() {
    return code.charAt(1);
  }

  /**
   * Indicates the session ended without an abnormal event.
   *
   * @return {@code true} when both leading characters are {@code '-'}
   */
  public boolean normal() {
    return cause() == '-' && phase() == '-';
  }
}
