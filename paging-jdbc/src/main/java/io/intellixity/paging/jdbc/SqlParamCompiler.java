package io.intellixity.paging.jdbc;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Compiles a SQL string containing named parameters (e.g. :limit) into JDBC SQL with '?' binds.
 *
 * Rules:
 * - Params are recognized as ':' followed by [A-Za-z_][A-Za-z0-9_]*\n
 * - '::' is treated as a SQL cast and not a param.\n
 * - Params inside single quotes or double-quoted identifiers are ignored.\n
 * - A param may appear several times; it is bound once per appearance.\n
 */
public final class SqlParamCompiler {
  private SqlParamCompiler() {}

  /** Compile named SQL plus params into a statement whose binds follow param appearance order. */
  public static SqlStatement compile(String sql, Map<String, ?> params, SqlStatement.ExecKind execKind) {
    return new SqlStatement(sql, bindsFor(sql, params), execKind);
  }

  public static SqlStatement compile(String sql, Map<String, ?> params) {
    return compile(sql, params, SqlStatement.ExecKind.QUERY);
  }

  /**
   * Resolve bind values for named params in a SQL string without rewriting the SQL.
   * Bind order matches appearance order of named params.
   */
  public static List<Object> bindsFor(String sql, Map<String, ?> params) {
    if (sql == null) return List.of();
    Map<String, ?> effective = (params == null) ? Map.of() : params;
    List<Object> binds = new ArrayList<>();
    scan(sql, null, name -> binds.add(getRequired(effective, name)));
    return binds;
  }

  /**
   * Rewrite a SQL string containing named params (":name") into JDBC SQL with '?' placeholders.\n
   * Purely lexical scanning; SQL without named params is returned unchanged.\n
   */
  public static String toJdbcSql(String sql) {
    if (sql == null) return "";
    StringBuilder out = new StringBuilder(sql.length() + 16);
    scan(sql, out, name -> out.append('?'));
    return out.toString();
  }

  /** Named params in appearance order (with repeats). */
  public static List<String> paramNames(String sql) {
    if (sql == null) return List.of();
    List<String> names = new ArrayList<>();
    scan(sql, null, names::add);
    return names;
  }

  private interface ParamSink {
    void param(String name);
  }

  private static void scan(String sql, StringBuilder out, ParamSink sink) {
    char quote = 0;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (quote != 0) {
        append(out, ch);
        if (ch == quote) {
          // Handle '' and "" escapes
          if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
            append(out, quote);
            i++;
          } else {
            quote = 0;
          }
        }
        continue;
      }

      if (ch == '\'' || ch == '"') {
        quote = ch;
        append(out, ch);
        continue;
      }

      if (ch == ':') {
        // Skip :: casts
        if (i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
          append(out, ':');
          append(out, ':');
          i++;
          continue;
        }

        int start = i + 1;
        if (start < sql.length() && isIdentStart(sql.charAt(start))) {
          int end = start + 1;
          while (end < sql.length() && isIdentPart(sql.charAt(end))) end++;
          sink.param(sql.substring(start, end));
          i = end - 1;
          continue;
        }
      }

      append(out, ch);
    }
  }

  private static void append(StringBuilder out, char ch) {
    if (out != null) out.append(ch);
  }

  private static Object getRequired(Map<String, ?> params, String name) {
    if (params.containsKey(name)) return params.get(name);
    throw new IllegalArgumentException("Missing query param: " + name);
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || (c >= '0' && c <= '9');
  }
}
