package ca.gc.cra.proxylog.validation;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * IP literal and CIDR validation utilities for PROXYLOG filters.
 *
 * <p>Only literals are accepted: nothing here triggers a DNS lookup.</p>
 */
public final class Net {

  // IPv4 dotted-quad shape (fast pre-check); we still range-check octets.
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");
  // IPv6 shape pre-check; the JDK parses the literal without resolving it.
  private static final Pattern IPV6_PATTERN = Pattern.compile("\\A[0-9A-Fa-f:.]+\\z");

  private Net() {
    // Utility
  }

  /**
   * Parses an IPv4 or IPv6 literal.
   *
   * @param value candidate literal; IPv6 may be wrapped in {@code [ ]}
   * @return parsed address, or empty when {@code value} is not a literal
   */
  public static Optional<InetAddress> parseIpLiteral(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String host = value.trim();
    if (host.startsWith("[") && host.endsWith("]")) {
      host = host.substring(1, host.length() - 1);
    }
    if (IPV4_PATTERN.matcher(host).matches()) {
      return ipv4(host);
    }
    if (host.indexOf(':') >= 0 && IPV6_PATTERN.matcher(host).matches()) {
      return ipv6(host);
    }
    return Optional.empty();
  }

  /**
   * Requires an IPv4 or IPv6 literal.
   *
   * @param name parameter name for diagnostics
   * @param value candidate literal
   * @return parsed address
   * @throws IllegalArgumentException if {@code value} is not a literal
   */
  public static InetAddress requireIpLiteral(String name, String value) {
    String sanitized = Strings.requireNonBlank(name, value);
    return parseIpLiteral(sanitized).orElseThrow(() ->
        new IllegalArgumentException(name + " must be an IPv4 or IPv6 address (was '" + sanitized + "')"));
  }

  /**
   * Parses {@code address/prefix} CIDR notation. A bare address is a single-host block.
   *
   * @param name parameter name for diagnostics
   * @param value candidate block, e.g. {@code 10.0.0.0/8}
   * @return parsed block
   * @throws IllegalArgumentException if the address or prefix length is invalid
   */
  public static Cidr parseCidr(String name, String value) {
    String sanitized = Strings.requireNonBlank(name, value);
    int slash = sanitized.indexOf('/');
    String addressPart = slash < 0 ? sanitized : sanitized.substring(0, slash);
    InetAddress address = requireIpLiteral(name, addressPart);
    int bits = address.getAddress().length * 8;
    int prefix = bits;
    if (slash >= 0) {
      prefix = (int) Numbers.parseInRange(name + " prefix length", sanitized.substring(slash + 1), 0, bits);
    }
    return new Cidr(address.getAddress(), prefix);
  }

  private static Optional<InetAddress> ipv4(String host) {
    byte[] octets = new byte[4];
    String[] parts = host.split("\\.");
    for (int i = 0; i < 4; i++) {
      int octet = Integer.parseInt(parts[i]);
      if (octet > 255) {
        return Optional.empty();
      }
      octets[i] = (byte) octet;
    }
    try {
      return Optional.of(InetAddress.getByAddress(octets));
    } catch (UnknownHostException ex) {
      return Optional.empty();
    }
  }

  private static Optional<InetAddress> ipv6(String host) {
    try {
      InetAddress address = InetAddress.getByName(host);
      if (address instanceof Inet6Address || address instanceof Inet4Address) {
        return Optional.of(address);
      }
      return Optional.empty();
    } catch (UnknownHostException ex) {
      return Optional.empty();
    }
  }

  /**
   * Network block in CIDR form.
   *
   * @param network address bytes (4 for IPv4, 16 for IPv6)
   * @param prefixLength number of leading bits that must match
   */
  public record Cidr(byte[] network, int prefixLength) {

    public Cidr {
      Objects.requireNonNull(network, "network");
      network = network.clone();
      Numbers.requireRange("prefixLength", prefixLength, 0, network.length * 8L);
    }

    @Override
    public byte[] network() {
      return network.clone();
    }

    /**
     * Tests membership; IPv4 and IPv6 blocks never contain each other's addresses.
     *
     * @param address candidate address
     * @return {@code true} when the leading {@code prefixLength} bits match
     */
    public boolean contains(InetAddress address) {
      byte[] candidate = address.getAddress();
      if (candidate.length != network.length) {
        return false;
      }
      int fullBytes = prefixLength / 8;
      for (int i = 0; i < fullBytes; i++) {
        if (candidate[i] != network[i]) {
          return false;
        }
      }
      int remainder = prefixLength % 8;
      if (remainder == 0) {
        return true;
      }
      int mask = (0xFF << (8 - remainder)) & 0xFF;
      return (candidate[fullBytes] & mask) == (network[fullBytes] & mask);
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Cidr that
          && prefixLength == that.prefixLength
          && Arrays.equals(network, that.network);
    }

    @Override
    public int hashCode() {
      return 31 * Arrays.hashCode(network) + prefixLength;
    }

    @Override
    public String toString() {
      try {
        return InetAddress.getByAddress(network).getHostAddress() + '/' + prefixLength;
      } catch (UnknownHostException ex) {
        return Arrays.toString(network) + '/' + prefixLength;
      }
    }
  }
}
