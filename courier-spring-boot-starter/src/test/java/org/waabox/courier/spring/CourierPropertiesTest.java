package org.waabox.courier.spring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link CourierProperties}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class CourierPropertiesTest {

  @Test
  void whenValidating_givenValidAccount_shouldReportNothing() {
    final CourierProperties properties = new CourierProperties();
    properties.getAccounts().put("main",
        account("bot_abc", "https://api.example.com/trpc"));

    assertTrue(properties.validate().isEmpty());
  }

  @Test
  void whenValidating_givenBadTokenAndUrl_shouldReportBoth() {
    final CourierProperties properties = new CourierProperties();
    properties.getAccounts().put("main", account("abc", "ftp://x"));

    final List<String> problems = properties.validate();

    assertEquals(2, problems.size());
    assertTrue(problems.get(0).contains("courier.accounts.main.token"));
    assertTrue(problems.get(1).contains("courier.accounts.main.api-url"));
  }

  @Test
  void whenValidating_givenDisabledOrIncompleteAccount_shouldSkipIt() {
    final CourierProperties properties = new CourierProperties();
    final CourierProperties.Account disabled = account("abc", "ftp://x");
    disabled.setEnabled(false);
    properties.getAccounts().put("off", disabled);
    properties.getAccounts().put("bare", account(null, null));

    assertTrue(properties.validate().isEmpty());
  }

  @Test
  void whenCreating_shouldUseTheDocumentedDefaults() {
    final CourierProperties properties = new CourierProperties();

    assertEquals(10, properties.getFallback().getCycles());
    assertEquals(1.8, properties.getBackoff().getFactor());
    assertEquals(Duration.ofMinutes(5),
        properties.getPush().getPingInterval());
  }

  private static CourierProperties.Account account(final String token,
      final String apiUrl) {
    final CourierProperties.Account account = new CourierProperties.Account();
    account.setToken(token);
    account.setApiUrl(apiUrl);
    return account;
  }
}
