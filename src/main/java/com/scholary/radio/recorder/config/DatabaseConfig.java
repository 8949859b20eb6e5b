package com.scholary.radio.recorder.config;

import com.zaxxer.hikari.HikariDataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the SQLite database that holds schedules and the catalog.
 *
 * <p>The pool is capped at a single connection; SQLite serializes writers anyway and a single
 * connection avoids busy errors between the trigger, monitor and request threads.
 */
@Configuration
public class DatabaseConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(DatabaseConfig.class);

  @Bean
  public DataSource dataSource(RecorderProperties properties) {
    Path database = Paths.get(properties.database()).toAbsolutePath();
    try {
      Files.createDirectories(database.getParent());
    } catch (IOException e) {
      throw new IllegalStateException("Failed to create database directory: " + database, e);
    }

    HikariDataSource dataSource =
        DataSourceBuilder.create()
            .type(HikariDataSource.class)
            .driverClassName("org.sqlite.JDBC")
            .url("jdbc:sqlite:" + database)
            .build();
    dataSource.setMaximumPoolSize(1);
    dataSource.setPoolName("recorder-db");

    LOGGER.info("Using database: {}", database);
    return dataSource;
  }
}
