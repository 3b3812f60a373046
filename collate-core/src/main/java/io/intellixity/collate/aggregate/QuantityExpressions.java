package io.intellixity.collate.aggregate;

import io.intellixity.collate.config.ConfigurationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/** Normalization helpers for quantity/function/order arguments. */
public final class QuantityExpressions {
  private static final Pattern DISTINCT = Pattern.compile("^distinct[ (]");

  private QuantityExpressions() {}

  /**
   * Scalar → singleton list, collection → ordered list. {@code null} becomes {@code [null]}
   * (used for "no order").
   */
  public static List<Object> asList(Object v) {
    if (v == null) return Collections.singletonList(null);
    if (v instanceof Collection<?> c) return new ArrayList<>(c);
    if (v instanceof Object[] arr) {
      List<Object> out = new ArrayList<>(arr.length);
      Collections.addAll(out, arr);
      return out;
    }
    return List.of(v);
  }

  /** String → single-argument quantity; collection/array → tuple; {@link Quantity} as-is. */
  public static Quantity asQuantity(Object v) {
    if (v instanceof Quantity q) return q;
    if (v instanceof String s) return Quantity.of(s);
    if (v instanceof Collection<?> || v instanceof Object[]) {
      List<String> args = new ArrayList<>();
      for (Object o : asList(v)) {
        if (!(o instanceof String s)) throw new ConfigurationException("Quantity tuple elements must be SQL strings: " + v);
        args.add(s);
      }
      try {
        return new Quantity(args);
      } catch (IllegalArgumentException e) {
        throw new ConfigurationException("Invalid quantity " + v + ": " + e.getMessage(), e);
      }
    }
    throw new ConfigurationException("Unsupported quantity: " + v);
  }

  /**
   * Detect a leading {@code distinct} qualifier on a single-argument quantity.
   * Multi-argument quantities never carry one.
   */
  public static DistinctSplit splitDistinct(Quantity q) {
    if (q.arity() != 1) return new DistinctSplit("", q);
    String s = q.args().get(0);
    if (DISTINCT.matcher(s).find()) {
      return new DistinctSplit("distinct ", Quantity.of(s.substring(8).stripLeading()));
    }
    return new DistinctSplit("", q);
  }

  /**
   * Quote a literal for SQL based on its Java type: numbers pass through, everything else is
   * single-quoted. {@code quoteOverride} forces quoting ({@code TRUE}) or no quoting ({@code FALSE}).
   */
  public static String maybeQuote(Object v, Boolean quoteOverride) {
    String s = String.valueOf(v);
    if (quoteOverride == null) {
      return (v instanceof Number) ? s : quote(s);
    }
    return quoteOverride ? quote(s) : s;
  }

  public static String maybeQuote(Object v) {
    return maybeQuote(v, null);
  }

  private static String quote(String s) {
    return "'" + s.replace("'", "''") + "'";
  }

  public record DistinctSplit(String distinct, Quantity quantity) {}
}
