package ca.gc.cra.proxylog.application.filter.builtin;

import ca.gc.cra.proxylog.application.filter.Filter;
import ca.gc.cra.proxylog.domain.log.LogRecord;
import ca.gc.cra.proxylog.validation.Net;

/**
 * Selects records whose client address lies in a CIDR block ({@code ip_range:10.0.0.0/8}).
 */
final class IpRangeFilter implements Filter {
  private final Net.Cidr block;

  IpRangeFilter(String argument) {
    this.block = Net.parseCidr("ip_range", argument);
  }

  @Override
  public String name() {
    return "ip_range";
  }

  @Override
  public boolean matches(LogRecord record) {
    return Net.parseIpLiteral(record.clientIp()).map(block::contains).orElse(false);
  }
}
