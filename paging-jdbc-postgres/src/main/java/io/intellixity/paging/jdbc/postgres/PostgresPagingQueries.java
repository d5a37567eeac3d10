package io.intellixity.paging.jdbc.postgres;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Postgres SQL for paging one table by a unique, ordered key column.\n
 *
 * Renders:\n
 * - count: {@code SELECT COUNT(*)}\n
 * - offset page: {@code LIMIT :limit OFFSET :offset}\n
 * - page boundaries: every {@code :limit}-th key by {@code row_number()}\n
 * - keyset page: {@code [:beginInclusive, :endExclusive)}, where a null end means "to the last row"\n
 *
 * Identifiers are double-quoted; {@code keySqlType} is used to type the nullable end bind.
 */
public final class PostgresPagingQueries {
  private static final Pattern SQL_TYPE = Pattern.compile("[A-Za-z][A-Za-z0-9_ ]*(\\(\\d+(,\\s*\\d+)?\\))?");

  private final String schema;
  private final String table;
  private final String keyColumn;
  private final String keySqlType;
  private final List<String> projection;
  private final boolean descending;

  public PostgresPagingQueries(String schema,
                               String table,
                               String keyColumn,
                               String keySqlType,
                               List<String> projection,
                               boolean descending) {
    this.schema = (schema == null || schema.isBlank()) ? null : schema;
    this.table = requireText(table, "table");
    this.keyColumn = requireText(keyColumn, "keyColumn");
    this.keySqlType = requireText(keySqlType, "keySqlType");
    if (!SQL_TYPE.matcher(keySqlType).matches()) throw new IllegalArgumentException("Unsupported keySqlType: " + keySqlType);
    List<String> cols = (projection == null || projection.isEmpty()) ? List.of(keyColumn) : projection;
    for (String c : cols) requireText(c, "projection column");
    this.projection = List.copyOf(cols);
    this.descending = descending;
  }

  /** Ascending paging over {@code keyColumn} selecting only the key. */
  public static PostgresPagingQueries of(String schema, String table, String keyColumn, String keySqlType) {
    return new PostgresPagingQueries(schema, table, keyColumn, keySqlType, List.of(), false);
  }

  public String table() { return table; }
  public String keyColumn() { return keyColumn; }
  public boolean descending() { return descending; }

  public String countSql() {
    return "SELECT COUNT(*) FROM " + from();
  }

  public String offsetPageSql() {
    return "SELECT " + select() + " FROM " + from() + " ORDER BY " + orderBy() + " LIMIT :limit OFFSET :offset";
  }

  /** Keys that start a page of {@code :limit} rows, in key order. */
  public String pageBoundariesSql() {
    String key = quoteIdent(keyColumn);
    return "SELECT " + key + " FROM (SELECT " + key + ", row_number() OVER (ORDER BY " + orderBy() + ") AS page_rn FROM "
        + from() + ") page_keys WHERE (page_rn - 1) % :limit = 0 ORDER BY " + orderBy();
  }

  public String keyedPageSql() {
    String key = quoteIdent(keyColumn);
    String end = "CAST(:endExclusive AS " + keySqlType + ")";
    String fromBegin = descending ? " <= " : " >= ";
    String beforeEnd = descending ? " > " : " < ";
    return "SELECT " + select() + " FROM " + from()
        + " WHERE " + key + fromBegin + ":beginInclusive AND (" + key + beforeEnd + end + " OR " + end + " IS NULL)"
        + " ORDER BY " + orderBy();
  }

  private String select() {
    List<String> cols = new ArrayList<>();
    for (String c : projection) cols.add(quoteIdent(c));
    return String.join(", ", cols);
  }

  private String from() {
    return (schema == null) ? quoteIdent(table) : quoteIdent(schema) + "." + quoteIdent(table);
  }

  private String orderBy() {
    return quoteIdent(keyColumn) + (descending ? " DESC" : " ASC");
  }

  static String quoteIdent(String ident) {
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  private static String requireText(String s, String name) {
    Objects.requireNonNull(s, name);
    if (s.isBlank()) throw new IllegalArgumentException(name + " is blank");
    return s;
  }
}
