package io.intellixity.paging.examples.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.paging.examples.session.PagingMode;
import io.intellixity.paging.examples.session.PagingSession;
import io.intellixity.paging.examples.session.PagingSessions;
import io.intellixity.paging.examples.session.PagingSourceFactory;
import io.intellixity.paging.examples.session.internal.LruTtlCache;
import io.intellixity.paging.exec.PagingExecutors;
import io.intellixity.paging.exec.Propagation;
import io.intellixity.paging.jdbc.JdbcDriver;
import io.intellixity.paging.jdbc.JdbcHandle;
import io.intellixity.paging.jdbc.RowMapper;
import io.intellixity.paging.jdbc.SqlStatement;
import io.intellixity.paging.jdbc.postgres.PostgresPagingQueries;
import io.intellixity.paging.jdbc.postgres.PostgresPagingSources;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Set;

@Configuration
@EnableConfigurationProperties(PagingProperties.class)
public class PagingExampleConfig {
  static final String NUMBERS_TABLE = "numbers";
  static final String KEY_COLUMN = "value";

  @Bean(destroyMethod = "close")
  public HikariDataSource dataSource(PagingProperties props) {
    PagingProperties.Datasource db = props.getDatasource();
    if (db.getJdbcUrl() == null || db.getJdbcUrl().isBlank()) {
      throw new IllegalArgumentException("Missing paging.datasource.jdbc-url");
    }
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(db.getJdbcUrl());
    hc.setUsername(db.getUsername());
    hc.setPassword(db.getPassword());
    hc.setMaximumPoolSize(db.getMaximumPoolSize());
    hc.setPoolName("paging-examples");
    return new HikariDataSource(hc);
  }

  @Bean
  public JdbcDriver jdbcDriver(HikariDataSource dataSource, PagingProperties props) {
    return new JdbcDriver(new JdbcHandle("jdbc:numbers", dataSource, props.getDatasource().getSchema()), Propagation.REQUIRED);
  }

  @Bean
  public PostgresPagingQueries numbersQueries(PagingProperties props) {
    return PostgresPagingQueries.of(props.getDatasource().getSchema(), NUMBERS_TABLE, KEY_COLUMN, "bigint");
  }

  @Bean
  public PagingSourceFactory pagingSourceFactory(JdbcDriver driver, PostgresPagingQueries queries) {
    RowMapper<Long> value = RowMapper.firstLong();
    return mode -> (mode == PagingMode.KEYSET)
        ? PostgresPagingSources.keyed(driver, queries, value, value, PagingExecutors.io())
        : PostgresPagingSources.offset(driver, queries, value, PagingExecutors.io());
  }

  @Bean
  public PagingSessions pagingSessions(PagingSourceFactory factory, PagingProperties props) {
    PagingProperties.Sessions s = props.getSessions();
    LruTtlCache<String, PagingSession> cache =
        new LruTtlCache<>(s.getMaxEntries(), s.getTtlMillis(), s.getIdleMillis(), PagingSessions::onRemoval);
    return new PagingSessions(factory, cache, s.getDefaultPageSize(), s.getMaxPageSize());
  }

  @Bean
  public ApplicationRunner numbersSchema(JdbcDriver driver, PagingProperties props) {
    String schema = props.getDatasource().getSchema();
    String table = (schema == null || schema.isBlank())
        ? quote(NUMBERS_TABLE)
        : quote(schema) + "." + quote(NUMBERS_TABLE);
    String ddl = "CREATE TABLE IF NOT EXISTS " + table + " (" + quote(KEY_COLUMN) + " BIGINT PRIMARY KEY)";
    return args -> driver.execute(new SqlStatement(ddl, List.of(), SqlStatement.ExecKind.UPDATE), Set.of());
  }

  private static String quote(String ident) {
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }
}
