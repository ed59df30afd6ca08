package com.planwatch.notifier.tenant;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.planwatch.notifier.config.NotifierProperties;
import java.nio.file.Path;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Exposes the SQLite-backed tenant store. */
@Configuration
public class TenantStoreConfig {

  @Bean(destroyMethod = "close")
  public SqliteTenantConfigStore tenantConfigStore(NotifierProperties properties, ObjectMapper objectMapper) {
    String path = properties.tenants() == null ? null : properties.tenants().dbPath();
    if (path == null || path.isBlank()) {
      throw new IllegalStateException("notifier.tenants.db-path is empty");
    }
    return new SqliteTenantConfigStore(Path.of(path), objectMapper);
  }
}
