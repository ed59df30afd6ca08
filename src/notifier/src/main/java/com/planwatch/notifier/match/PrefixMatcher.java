package com.planwatch.notifier.match;

import com.planwatch.notifier.event.FlightEvent;
import com.planwatch.notifier.tenant.TenantConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Selects the tenants subscribed to an event's callsign.
 *
 * <p>Comparison is a case-insensitive "starts with". Each tenant matches at most once, on the
 * first of its prefixes (in configured order) that applies. Blank prefixes never match.
 */
@Component
public class PrefixMatcher {

  public List<TenantMatch> match(FlightEvent event, Map<Long, TenantConfig> tenants) {
    String callsign = event.normalizedCallsign();
    List<TenantMatch> matches = new ArrayList<>();
    for (Map.Entry<Long, TenantConfig> entry : tenants.entrySet()) {
      TenantConfig config = entry.getValue();
      for (String prefix : config.prefixes()) {
        if (prefix == null || prefix.isBlank()) {
          continue;
        }
        String normalized = prefix.trim().toUpperCase(Locale.ROOT);
        if (callsign.startsWith(normalized)) {
          matches.add(new TenantMatch(entry.getKey(), config, normalized));
          break;
        }
      }
    }
    return matches;
  }
}
