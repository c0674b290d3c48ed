package com.acme.store.persistence.jdbc.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.flywaydb.core.Flyway;

/**
 * Pooled DataSource with the schema migrated before the first connection is handed out. The
 * transaction manager is created per DataSource bean, so the pool is exposed as the "default"
 * DataSource.
 */
@Slf4j
@Factory
public class DataSourceFactory implements AutoCloseable {

  private final List<HikariDataSource> pools = new CopyOnWriteArrayList<>();

  @Singleton
  @ConfigurationProperties("datasource")
  public DatasourceConfig datasourceConfig() {
    return new DatasourceConfig();
  }

  @Singleton
  @Named("default")
  public DataSource dataSource(DatasourceConfig config) {
    HikariConfig hikari = new HikariConfig();
    hikari.setJdbcUrl(config.getUrl());
    hikari.setDriverClassName(config.getDriverClassName());
    hikari.setUsername(config.getUsername());
    hikari.setPassword(config.getPassword());
    hikari.setMaximumPoolSize(config.getMaximumPoolSize());
    hikari.setPoolName("store-pool");
    HikariDataSource dataSource = new HikariDataSource(hikari);
    pools.add(dataSource);

    int applied =
        Flyway.configure()
            .dataSource(dataSource)
            .locations(config.getMigrationLocations().toArray(String[]::new))
            .load()
            .migrate()
            .migrationsExecuted;
    log.info("Datasource {} ready, {} migration(s) applied", config.getUrl(), applied);
    return dataSource;
  }

  @Override
  @PreDestroy
  public void close() {
    for (HikariDataSource pool : pools) {
      pool.close();
    }
    pools.clear();
  }
}
