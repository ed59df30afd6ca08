package com.planwatch.notifier.match;

import com.planwatch.notifier.tenant.TenantConfig;

/** A tenant whose subscription covers an event, with the prefix that matched. */
public record TenantMatch(long guildId, TenantConfig config, String matchedPrefix) {}
