package io.intellixity.collate.aggregate;

import java.util.List;
import java.util.Objects;

/**
 * SQL arguments of one aggregate call. Usually a single expression; multi-argument functions
 * such as {@code corr} or {@code regr_slope} take a tuple.
 */
public record Quantity(List<String> args) {
  public Quantity {
    Objects.requireNonNull(args, "args");
    if (args.isEmpty()) throw new IllegalArgumentException("Quantity needs at least one argument");
    for (String a : args) {
      if (a == null || a.isBlank()) throw new IllegalArgumentException("Quantity argument is blank");
    }
    args = List.copyOf(args);
  }

  public static Quantity of(String... args) {
    return new Quantity(List.of(args));
  }

  public int arity() { return args.size(); }

  /** Default quantity name: the arguments joined with {@code _}. */
  public String defaultName() {
    return String.join("_", args);
  }
}
