package io.intellixity.collate.aggregate;

import io.intellixity.collate.config.ConfigurationException;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Values substituted into quantity templates and expression-name templates.
 * <p>
 * Doubled braces render as literal braces. Recognized placeholders are a closed set; unknown ones
 * outside single-quoted literals are rejected when an aggregate or
 * expression is constructed, not when SQL is rendered.
 *
 * @param collateDate     as-of date of the current select, or null outside a spacetime aggregation
 * @param collateInterval interval of the current window, or null outside a spacetime aggregation
 */
public record FormatParams(String collateDate, String collateInterval) {
  public static final String COLLATE_DATE = "collate_date";
  public static final String COLLATE_INTERVAL = "collate_interval";

  /** Placeholders allowed inside quantities and orders. */
  public static final Set<String> QUANTITY_PLACEHOLDERS = Set.of(COLLATE_DATE, COLLATE_INTERVAL);

  public static final FormatParams NONE = new FormatParams(null, null);

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_]*)}");

  public static FormatParams of(String date, String interval) {
    return new FormatParams(date, interval);
  }

  /**
   * Throw if {@code template} references a placeholder outside {@code allowed}. Brace text inside a
   * single-quoted SQL literal that is not a placeholder (a Postgres array literal) is accepted.
   */
  public static void checkPlaceholders(String template, Set<String> allowed, String what) {
    if (template == null) return;
    expand(template, allowed, null, what);
  }

  /** Double the braces of literal text so it renders unchanged. */
  public static String escape(String text) {
    if (text == null) return null;
    return text.replace("{", "{{").replace("}", "}}");
  }

  /** Substitute recognized placeholders; a referenced value that is unset is a configuration error. */
  public String apply(String template) {
    return format(template, Map.of());
  }

  String format(String template, Map<String, String> extra) {
    if (template == null || (template.indexOf('{') < 0 && template.indexOf('}') < 0)) return template;
    Map<String, String> values = new LinkedHashMap<>(extra);
    if (collateDate != null) values.put(COLLATE_DATE, collateDate);
    if (collateInterval != null) values.put(COLLATE_INTERVAL, collateInterval);
    Set<String> known = new HashSet<>(QUANTITY_PLACEHOLDERS);
    known.addAll(extra.keySet());
    return expand(template, known, values, template);
  }

  /**
   * Doubled braces stand for single ones; a braced name is a placeholder when it is known. Unknown names are kept verbatim inside quoted literals and at render
   * time; outside quotes they fail the construction-time check ({@code values == null}).
   */
  private static String expand(String template, Set<String> known, Map<String, String> values, String what) {
    StringBuilder out = new StringBuilder(template.length());
    boolean quoted = false;
    int n = template.length();
    int i = 0;
    while (i < n) {
      char c = template.charAt(i);
      if (c == '\'') {
        quoted = !quoted;
      } else if ((c == '{' || c == '}') && i + 1 < n && template.charAt(i + 1) == c) {
        out.append(c);
        i += 2;
        continue;
      } else if (c == '{') {
        Matcher m = PLACEHOLDER.matcher(template).region(i, n);
        if (m.lookingAt()) {
          String key = m.group(1);
          if (known.contains(key)) {
            out.append(values == null ? m.group() : valueOf(values, key, template));
          } else if (values == null && !quoted) {
            throw new ConfigurationException("Unknown placeholder {" + key + "} in " + what + ": " + template
                + " (allowed: " + known + ")");
          } else {
            out.append(m.group());
          }
          i = m.end();
          continue;
        }
      }
      out.append(c);
      i++;
    }
    return out.toString();
  }

  private static String valueOf(Map<String, String> values, String key, String template) {
    String v = values.get(key);
    if (v == null) throw new ConfigurationException("Placeholder {" + key + "} has no value here: " + template);
    return v;
  }
}
