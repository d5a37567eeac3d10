package io.intellixity.paging.examples.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "paging")
public class PagingProperties {
  private final Datasource datasource = new Datasource();
  private final Sessions sessions = new Sessions();

  public Datasource getDatasource() { return datasource; }
  public Sessions getSessions() { return sessions; }

  public static class Datasource {
    private String jdbcUrl;
    private String username;
    private String password;
    private String schema = "public";
    private int maximumPoolSize = 10;

    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getSchema() { return schema; }
    public void setSchema(String schema) { this.schema = schema; }
    public int getMaximumPoolSize() { return maximumPoolSize; }
    public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
  }

  public static class Sessions {
    private int maxEntries = 1_000;
    private long ttlMillis = 30 * 60_000L;
    /** Sessions unused for this long are dropped; 0 disables idle expiry. */
    private long idleMillis = 10 * 60_000L;
    private int defaultPageSize = 20;
    private int maxPageSize = 500;

    public int getMaxEntries() { return maxEntries; }
    public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }
    public long getTtlMillis() { return ttlMillis; }
    public void setTtlMillis(long ttlMillis) { this.ttlMillis = ttlMillis; }
    public long getIdleMillis() { return idleMillis; }
    public void setIdleMillis(long idleMillis) { this.idleMillis = idleMillis; }
    public int getDefaultPageSize() { return defaultPageSize; }
    public void setDefaultPageSize(int defaultPageSize) { this.defaultPageSize = defaultPageSize; }
    public int getMaxPageSize() { return maxPageSize; }
    public void setMaxPageSize(int maxPageSize) { this.maxPageSize = maxPageSize; }
  }
}
