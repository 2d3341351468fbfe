package ca.gc.cra.proxylog.application.filter.builtin;

import ca.gc.cra.proxylog.application.filter.Filter;
import ca.gc.cra.proxylog.domain.log.LogRecord;
import ca.gc.cra.proxylog.validation.Net;
import java.net.InetAddress;
import java.util.Optional;

/**
 * Selects records from one client address ({@code ip:10.0.0.5}, {@code ip:2001:db8::1}).
 */
final class IpFilter implements Filter {
  private final String literal;
  private final InetAddress address;

  IpFilter(String argument) {
    this.address = Net.requireIpLiteral("ip", argument);
    this.literal = argument.trim();
  }

  @Override
  public String name() {
    return "ip";
  }

  @Override
  public boolean matches(LogRecord record) {
    if (literal.equals(record.clientIp())) {
      return true;
    }
    Optional<InetAddress> client = Net.parseIpLiteral(record.clientIp());
    return client.isPresent() && client.get().equals(address);
  }
}
