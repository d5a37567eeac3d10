package io.intellixity.paging.jdbc;

import javax.sql.DataSource;
import java.util.Objects;

/** JDBC connection source plus the identity used in logs (resolved by application code). */
public final class JdbcHandle {
  private final String id;
  private final DataSource client;
  private final String schema;

  public JdbcHandle(String id, DataSource client, String schema) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.schema = (schema == null || schema.isBlank()) ? null : schema;
  }

  public String id() { return id; }
  public DataSource client() { return client; }

  /** Schema name, or null for the connection's default. */
  public String schema() { return schema; }
}
