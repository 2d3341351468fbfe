package ca.gc.cra.proxylog.application.filter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class FilterActivationTest {

  @Test
  void parsesNameAndArgument() {
    FilterActivation activation = FilterActivation.parse("ip:10.0.0.5");

    assertEquals("ip", activation.name());
    assertEquals("10.0.0.5", activation.argument());
    assertFalse(activation.negated());
  }

  @Test
  void argumentKeepsLaterColons() {
    FilterActivation activation = FilterActivation.parse("ip:2001:db8::1");

    assertEquals("ip", activation.name());
    assertEquals("2001:db8::1", activation.argument());
  }

  @Test
  void bangPrefixNegates() {
    FilterActivation activation = FilterActivation.parse("!status_code_family:5");

    assertTrue(activation.negated());
    assertEquals("status_code_family", activation.name());
    assertEquals("!status_code_family:5", activation.toString());
  }

  @Test
  void nameWithoutArgument() {
    FilterActivation activation = FilterActivation.parse("ssl");

    assertEquals("", activation.argument());
    assertEquals("ssl", activation.toString());
  }

  @Test
  void parseListSkipsEmptyTokens() {
    List<FilterActivation> activations = FilterActivation.parseList("ip:10.0.0.5, ,status_code:200,");

    assertEquals(List.of(FilterActivation.of("ip", "10.0.0.5"), FilterActivation.of("status_code", "200")),
        activations);
    assertTrue(FilterActivation.parseList("  ").isEmpty());
    assertTrue(FilterActivation.parseList(null).isEmpty());
  }

  @Test
  void rejectsMalformedNames() {
    assertThrows(IllegalArgumentException.class, () -> FilterActivation.parse(":10.0.0.5"));
    assertThrows(IllegalArgumentException.class, () -> FilterActivation.parse("!"));
    assertThrows(IllegalArgumentException.class, () -> FilterActivation.parse("bad name:1"));
  }
}
