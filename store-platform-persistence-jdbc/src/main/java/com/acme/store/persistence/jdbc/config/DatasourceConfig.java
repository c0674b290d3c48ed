package com.acme.store.persistence.jdbc.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Connection pool and schema migration settings. Pure POJO - no framework dependencies.
 */
public class DatasourceConfig {

  private String url = "jdbc:h2:mem:store;DB_CLOSE_DELAY=-1;DB_CLOSE_ON_EXIT=FALSE";
  private String driverClassName = "org.h2.Driver";
  private String username = "sa";
  private String password = "";
  private int maximumPoolSize = 10;
  private List<String> migrationLocations =
      new ArrayList<>(List.of("classpath:db/migration/h2"));

  public String getUrl() {
    return url;
  }

  public void setUrl(String url) {
    this.url = url;
  }

  public String getDriverClassName() {
    return driverClassName;
  }

  public void setDriverClassName(String driverClassName) {
    this.driverClassName = driverClassName;
  }

  public String getUsername() {
    return username;
  }

  public void setUsername(String username) {
    this.username = username;
  }

  public String getPassword() {
    return password;
  }

  public void setPassword(String password) {
    this.password = password;
  }

  public int getMaximumPoolSize() {
    return maximumPoolSize;
  }

  public void setMaximumPoolSize(int maximumPoolSize) {
    this.maximumPoolSize = maximumPoolSize;
  }

  /** Flyway locations applied at startup, platform tables first. */
  public List<String> getMigrationLocations() {
    return migrationLocations;
  }

  public void setMigrationLocations(List<String> migrationLocations) {
    this.migrationLocations = migrationLocations;
  }
}
