package com.planwatch.notifier.tenant;

import java.util.Map;

/** Persistence contract for tenant configurations. */
public interface TenantConfigStore {
  /**
   * Reads every tenant configuration.
   *
   * @return mapping of guild id to configuration, ordered by guild id
   * @throws ConfigurationUnavailableException when the store cannot be read
   */
  Map<Long, TenantConfig> getAll();

  /**
   * Creates or merges the configuration of one tenant.
   *
   * @throws ConfigurationUnavailableException when the store cannot be written
   */
  void upsert(long guildId, TenantConfigUpdate update);
}
