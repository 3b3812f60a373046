package io.intellixity.collate.sql;

/** Anything that renders itself to SQL text. */
public interface SqlRenderable {
  String toSql();
}
