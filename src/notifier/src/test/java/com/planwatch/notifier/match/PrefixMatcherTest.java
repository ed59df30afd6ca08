package com.planwatch.notifier.match;

import static org.assertj.core.api.Assertions.assertThat;

import com.planwatch.notifier.event.FlightEvent;
import com.planwatch.notifier.tenant.TenantConfig;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PrefixMatcherTest {
  private final PrefixMatcher matcher = new PrefixMatcher();

  @Test
  void firstQualifyingPrefixWinsAndTenantMatchesOnce() {
    Map<Long, TenantConfig> tenants = Map.of(1L, tenant(1L, "DAL", "D"));

    List<TenantMatch> matches = matcher.match(FlightEvent.ofCallsign("DAL123"), tenants);

    assertThat(matches).hasSize(1);
    assertThat(matches.get(0).guildId()).isEqualTo(1L);
    assertThat(matches.get(0).matchedPrefix()).isEqualTo("DAL");
  }

  @Test
  void configuredOrderDecidesWhichPrefixIsReported() {
    Map<Long, TenantConfig> tenants = Map.of(1L, tenant(1L, "D", "DAL"));

    assertThat(matcher.match(FlightEvent.ofCallsign("DAL123"), tenants))
        .extracting(TenantMatch::matchedPrefix)
        .containsExactly("D");
  }

  @Test
  void matchingIsCaseInsensitive() {
    Map<Long, TenantConfig> tenants = Map.of(1L, tenant(1L, "ual"));

    assertThat(matcher.match(FlightEvent.ofCallsign("Ual456"), tenants)).hasSize(1);
  }

  @Test
  void fansOutAcrossTenantsInSnapshotOrder() {
    Map<Long, TenantConfig> tenants = new LinkedHashMap<>();
    tenants.put(10L, tenant(10L, "UAL"));
    tenants.put(20L, tenant(20L, "DAL"));
    tenants.put(30L, tenant(30L, "U"));
    tenants.put(40L, tenant(40L));

    List<TenantMatch> matches = matcher.match(FlightEvent.ofCallsign("UAL456"), tenants);

    assertThat(matches).extracting(TenantMatch::guildId).containsExactly(10L, 30L);
  }

  @Test
  void tenantWithoutPrefixesNeverMatches() {
    assertThat(matcher.match(FlightEvent.ofCallsign("DAL123"), Map.of(1L, tenant(1L)))).isEmpty();
    assertThat(matcher.match(FlightEvent.ofCallsign("DAL123"), Map.of())).isEmpty();
  }

  private static TenantConfig tenant(long guildId, String... prefixes) {
    return new TenantConfig(guildId, guildId * 100, List.of(prefixes), null);
  }
}
