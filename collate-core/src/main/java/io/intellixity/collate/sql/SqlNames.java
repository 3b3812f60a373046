package io.intellixity.collate.sql;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/** Identifier helpers shared by every generated statement. */
public final class SqlNames {
  /** Postgres truncates longer identifiers (NAMEDATALEN - 1). */
  public static final int MAX_IDENTIFIER_BYTES = 63;

  private static final Pattern PLAIN_IDENT = Pattern.compile("[a-z_][a-z0-9_]*");

  private SqlNames() {}

  /** Strip the quoting character from a generated name. */
  public static String toSqlName(String name) {
    if (name == null) return null;
    return name.replace("\"", "");
  }

  /** Always quote (Postgres style). */
  public static String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  /**
   * Quote only when the identifier would not survive unquoted (upper case, operators, spaces...).
   * Plain lower-case names are emitted as-is so generated column names read naturally.
   */
  public static String quoteIdentIfNeeded(String ident) {
    if (ident == null) return null;
    if (PLAIN_IDENT.matcher(ident).matches()) return ident;
    return quoteIdent(ident);
  }

  public static boolean exceedsIdentifierLimit(String ident) {
    return ident != null && ident.getBytes(StandardCharsets.UTF_8).length > MAX_IDENTIFIER_BYTES;
  }

  /** Render {@code "schema"."name"} or {@code "name"} when no schema is configured. */
  public static String qualifiedTable(String schema, String name) {
    String table = quoteIdent(toSqlName(name));
    if (schema == null || schema.isBlank()) return table;
    return quoteIdent(schema) + "." + table;
  }
}
