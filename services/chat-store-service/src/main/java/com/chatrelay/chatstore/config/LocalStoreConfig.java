package com.chatrelay.chatstore.config;

import com.chatrelay.chatstore.local.LocalMessageStore;
import com.chatrelay.chatstore.store.MessageStore;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.flywaydb.core.Flyway;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Embedded backend wiring.
 *
 * <p>Only activates when {@code chat-store.backend=local}. Uses a file-based HSQLDB at {@code
 * chat-store.local.path}; Flyway migrations are run on startup.
 */
@Configuration
@Slf4j
@ConditionalOnProperty(prefix = "chat-store", name = "backend", havingValue = "local")
public class LocalStoreConfig {

  static final String MIGRATIONS = "classpath:db/migration/local";

  @Bean(name = "localStoreDataSource", destroyMethod = "close")
  public HikariDataSource localStoreDataSource(ChatStoreProperties properties) {
    Path basePath = Paths.get(properties.local().path()).toAbsolutePath();
    Path dir = basePath.getParent();
    try {
      if (dir != null) {
        Files.createDirectories(dir);
      }
    } catch (Exception e) {
      throw new IllegalStateException("Cannot create local store directory " + dir, e);
    }

    HikariConfig cfg = new HikariConfig();
    cfg.setPoolName("chat-store-local");
    cfg.setDriverClassName("org.hsqldb.jdbc.JDBCDriver");
    cfg.setJdbcUrl("jdbc:hsqldb:file:" + basePath + ";hsqldb.tx=mvcc");
    cfg.setUsername("SA");
    cfg.setPassword("");
    cfg.setMaximumPoolSize(4);
    cfg.setMinimumIdle(1);
    cfg.setConnectionTimeout(5_000);

    log.info("Chat store backend: local (HSQLDB file: {})", basePath);
    return new HikariDataSource(cfg);
  }

  @Bean(initMethod = "migrate", name = "localStoreFlyway")
  public Flyway localStoreFlyway(@Qualifier("localStoreDataSource") DataSource dataSource) {
    return Flyway.configure().dataSource(dataSource).locations(MIGRATIONS).load();
  }

  @Bean(destroyMethod = "close")
  public MessageStore localMessageStore(
      @Qualifier("localStoreDataSource") DataSource dataSource,
      @Qualifier("localStoreFlyway") Flyway localStoreFlyway) {
    return new LocalMessageStore(
        new JdbcTemplate(dataSource),
        new TransactionTemplate(new DataSourceTransactionManager(dataSource)));
  }
}
