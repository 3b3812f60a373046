package io.intellixity.collate.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.collate.aggregate.Aggregate;
import io.intellixity.collate.aggregate.Categorical;
import io.intellixity.collate.aggregate.ColumnSource;
import io.intellixity.collate.aggregate.Compare;
import io.intellixity.collate.aggregate.QuantityExpressions;
import io.intellixity.collate.aggregation.SpacetimeAggregation;
import io.intellixity.collate.imputation.ImputationException;
import io.intellixity.collate.imputation.ColumnType;
import io.intellixity.collate.imputation.ImputationRule;
import io.intellixity.collate.imputation.ImputationRules;
import io.intellixity.collate.imputation.ImputationType;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A feature-aggregation definition read from JSON.\n
 *
 * <pre>
 * { "prefix": "events", "from_obj": "events", "knowledge_date_column": "event_date",
 *   "aggregates_imputation": {"all": {"type": "mean"}},
 *   "aggregates": [{"quantity": "amount", "metrics": ["sum", "avg"]}],
 *   "categoricals_imputation": {"all": {"type": "null_category"}},
 *   "categoricals": [{"column": "status", "choices": ["open", null], "metrics": ["sum"]}],
 *   "array_categoricals": [{"column": "tags", "choices": ["red"], "metrics": ["sum"]}],
 *   "groups": ["entity_id"], "intervals": ["1 year", "all"] }
 * </pre>
 *
 * {@code groups} may also map names to expressions and {@code intervals} may map groups to their
 * own lists. Errors name the offending field.
 */
public final class AggregationDefinitions {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final String prefix;
  private final String fromObj;
  private final String knowledgeDateColumn;
  private final List<Aggregate> aggregates;
  private final List<Compare> categoricals;
  private final Map<String, String> groups;
  private final List<String> sharedIntervals;
  private final Map<String, List<String>> intervalsByGroup;

  private AggregationDefinitions(String prefix, String fromObj, String knowledgeDateColumn,
                                 List<Aggregate> aggregates, List<Compare> categoricals, Map<String, String> groups,
                                 List<String> sharedIntervals, Map<String, List<String>> intervalsByGroup) {
    this.prefix = prefix;
    this.fromObj = fromObj;
    this.knowledgeDateColumn = knowledgeDateColumn;
    this.aggregates = List.copyOf(aggregates);
    this.categoricals = List.copyOf(categoricals);
    this.groups = Collections.unmodifiableMap(groups);
    this.sharedIntervals = sharedIntervals == null ? null : List.copyOf(sharedIntervals);
    this.intervalsByGroup = Collections.unmodifiableMap(intervalsByGroup);
  }

  public static AggregationDefinitions parse(String json) {
    Objects.requireNonNull(json, "json");
    try {
      return fromTree(MAPPER.readTree(json));
    } catch (JsonProcessingException e) {
      throw new ConfigurationException("Malformed aggregation definition: " + e.getOriginalMessage(), e);
    }
  }

  public static AggregationDefinitions read(InputStream in) {
    Objects.requireNonNull(in, "in");
    try {
      return fromTree(MAPPER.readTree(in));
    } catch (IOException e) {
      throw new ConfigurationException("Failed to read aggregation definition", e);
    }
  }

  public static AggregationDefinitions fromPath(Path path) {
    try (InputStream in = Files.newInputStream(path)) {
      return read(in);
    } catch (IOException e) {
      throw new ConfigurationException("Failed to read aggregation definition from " + path, e);
    }
  }

  /** Load a classpath resource through the context class loader. */
  public static AggregationDefinitions fromResource(String resource) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = AggregationDefinitions.class.getClassLoader();
    InputStream in = cl.getResourceAsStream(resource);
    if (in == null) throw new ConfigurationException("Aggregation definition not found on classpath: " + resource);
    try (in) {
      return read(in);
    } catch (IOException e) {
      throw new ConfigurationException("Failed to close " + resource, e);
    }
  }

  public static AggregationDefinitions fromTree(JsonNode root) {
    if (root == null || !root.isObject()) throw new ConfigurationException("Aggregation definition must be an object");

    String fromObj = requiredText(root, "from_obj");
    String prefix = optionalText(root, "prefix");
    String kdc = optionalText(root, "knowledge_date_column");

    ImputationRules aggDefault = imputation(root.get("aggregates_imputation"), "aggregates_imputation", null);
    List<Aggregate> aggregates = new ArrayList<>();
    JsonNode aggs = root.get("aggregates");
    if (aggs != null && !aggs.isNull()) {
      if (!aggs.isArray()) throw new ConfigurationException("Field 'aggregates' must be an array");
      for (int i = 0; i < aggs.size(); i++) aggregates.add(aggregate(aggs.get(i), "aggregates[" + i + "]", aggDefault));
    }

    ImputationRules catDefault = imputation(root.get("categoricals_imputation"), "categoricals_imputation", null);
    List<Compare> categoricals = new ArrayList<>();
    JsonNode cats = root.get("categoricals");
    if (cats != null && !cats.isNull()) {
      if (!cats.isArray()) throw new ConfigurationException("Field 'categoricals' must be an array");
      for (int i = 0; i < cats.size(); i++) {
        String path = "categoricals[" + i + "]";
        JsonNode c = object(cats.get(i), path);
        categoricals.add(categorical(Categorical.builder(requiredText(c, "column", path)), c, path, catDefault));
      }
    }

    ImputationRules arrDefault = imputation(root.get("array_categoricals_imputation"), "array_categoricals_imputation", null);
    JsonNode arrs = root.get("array_categoricals");
    if (arrs != null && !arrs.isNull()) {
      if (!arrs.isArray()) throw new ConfigurationException("Field 'array_categoricals' must be an array");
      for (int i = 0; i < arrs.size(); i++) {
        String path = "array_categoricals[" + i + "]";
        JsonNode c = object(arrs.get(i), path);
        categoricals.add(categorical(Categorical.arrayBuilder(requiredText(c, "column", path)), c, path, arrDefault));
      }
    }

    if (aggregates.isEmpty() && categoricals.isEmpty()) {
      throw new ConfigurationException("Definition for '" + fromObj + "' has neither aggregates nor categoricals");
    }

    Map<String, String> groups = groups(root.get("groups"));
    List<String> shared = null;
    Map<String, List<String>> byGroup = new LinkedHashMap<>();
    JsonNode intervals = root.get("intervals");
    if (intervals == null || intervals.isNull()) {
      throw new ConfigurationException("Missing field 'intervals'");
    } else if (intervals.isObject()) {
      for (Iterator<Map.Entry<String, JsonNode>> it = intervals.fields(); it.hasNext(); ) {
        var e = it.next();
        byGroup.put(e.getKey(), textList(e.getValue(), "intervals." + e.getKey()));
      }
    } else {
      shared = textList(intervals, "intervals");
    }

    return new AggregationDefinitions(prefix, fromObj, kdc, aggregates, categoricals, groups, shared, byGroup);
  }

  public String prefix() { return prefix; }
  public String fromObj() { return fromObj; }
  public String knowledgeDateColumn() { return knowledgeDateColumn; }
  public List<Aggregate> aggregates() { return aggregates; }
  /** Categoricals, then array categoricals. */
  public List<Compare> categoricals() { return categoricals; }
  public Map<String, String> groups() { return groups; }

  /** Aggregates first, then categoricals, in definition order. */
  public List<ColumnSource> columnSources() {
    List<ColumnSource> out = new ArrayList<>(aggregates);
    out.addAll(categoricals);
    return out;
  }

  public SpacetimeAggregation toSpacetime(SpacetimeRun run) {
    Objects.requireNonNull(run, "run");
    SpacetimeAggregation.Builder b = SpacetimeAggregation.builder()
        .aggregates(columnSources())
        .groups(groups)
        .fromObj(fromObj)
        .prefix(prefix)
        .dateColumn(knowledgeDateColumn)
        .dates(run.dates())
        .stateTable(run.stateTable())
        .stateGroup(run.stateGroup())
        .schema(run.schema())
        .inputMinDate(run.inputMinDate())
        .outputDateColumn(run.outputDateColumn());
    if (sharedIntervals != null) b.intervals(sharedIntervals);
    b.intervals(intervalsByGroup);
    return b.build();
  }

  private static Aggregate aggregate(JsonNode n, String path, ImputationRules sectionDefault) {
    if (n == null || !n.isObject()) throw new ConfigurationException("Field '" + path + "' must be an object");
    Aggregate.Builder b = Aggregate.builder();
    JsonNode q = n.get("quantity");
    if (q == null || q.isNull()) throw new ConfigurationException("Missing field '" + path + ".quantity'");
    try {
      if (q.isTextual()) {
        b.quantity(q.asText());
      } else if (q.isArray()) {
        b.quantity(QuantityExpressions.asQuantity(textList(q, path + ".quantity")));
      } else if (q.isObject()) {
        for (Iterator<Map.Entry<String, JsonNode>> it = q.fields(); it.hasNext(); ) {
          var e = it.next();
          Object v = e.getValue().isArray() ? textList(e.getValue(), path + ".quantity." + e.getKey())
              : requireText(e.getValue(), path + ".quantity." + e.getKey());
          b.quantity(e.getKey(), QuantityExpressions.asQuantity(v));
        }
      } else {
        throw new ConfigurationException("Field '" + path + ".quantity' must be a string, array or object");
      }
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid '" + path + ".quantity': " + e.getMessage(), e);
    }
    b.functions(requiredTextList(n, "metrics", path));
    JsonNode order = n.get("order");
    if (order != null && !order.isNull()) b.orders(textList(order, path + ".order"));
    b.imputation(imputation(n.get("imputation"), path + ".imputation", sectionDefault));
    return b.build();
  }

  private static Compare categorical(Compare.Builder b, JsonNode n, String path, ImputationRules sectionDefault) {
    JsonNode choices = n.get("choices");
    if (choices == null || choices.isNull()) throw new ConfigurationException("Missing field '" + path + ".choices'");
    if (choices.isArray()) {
      List<Object> values = new ArrayList<>();
      for (JsonNode c : choices) values.add(scalar(c, path + ".choices"));
      b.choices(values);
    } else if (choices.isObject()) {
      Map<String, Object> values = new LinkedHashMap<>();
      for (Iterator<Map.Entry<String, JsonNode>> it = choices.fields(); it.hasNext(); ) {
        var e = it.next();
        values.put(e.getKey(), scalar(e.getValue(), path + ".choices." + e.getKey()));
      }
      b.choices(values);
    } else {
      throw new ConfigurationException("Field '" + path + ".choices' must be an array or object");
    }
    b.functions(requiredTextList(n, "metrics", path));
    if (n.path("include_null").asBoolean(false)) b.includeNull();
    JsonNode maxlen = n.get("maxlen");
    if (maxlen != null && !maxlen.isNull()) {
      if (!maxlen.canConvertToInt()) throw new ConfigurationException("Field '" + path + ".maxlen' must be an integer");
      b.maxlen(maxlen.asInt());
    }
    b.imputation(imputation(n.get("imputation"), path + ".imputation", sectionDefault));
    return b.build();
  }

  private static JsonNode object(JsonNode n, String path) {
    if (n == null || !n.isObject()) throw new ConfigurationException("Field '" + path + "' must be an object");
    return n;
  }

  /** {@code {"all": {...}, "<function>": {...}}} layered over {@code base}. */
  private static ImputationRules imputation(JsonNode n, String path, ImputationRules base) {
    ImputationRules rules = base == null ? ImputationRules.none(ColumnType.AGGREGATE) : base;
    if (n == null || n.isNull()) return base;
    if (!n.isObject()) throw new ConfigurationException("Field '" + path + "' must be an object");
    for (Iterator<Map.Entry<String, JsonNode>> it = n.fields(); it.hasNext(); ) {
      var e = it.next();
      rules = rules.forFunction(e.getKey(), rule(e.getValue(), path + "." + e.getKey()));
    }
    return rules;
  }

  private static ImputationRule rule(JsonNode n, String path) {
    if (n == null || !n.isObject()) throw new ConfigurationException("Field '" + path + "' must be an object");
    ImputationType type;
    try {
      type = ImputationType.fromId(requiredText(n, "type", path));
    } catch (ImputationException e) {
      throw new ConfigurationException("Field '" + path + ".type': " + e.getMessage(), e);
    }
    JsonNode value = n.get("value");
    String v = (value == null || value.isNull()) ? null : value.asText();
    if (type == ImputationType.CONSTANT && v == null) {
      throw new ConfigurationException("Missing field '" + path + ".value' for constant imputation");
    }
    return new ImputationRule(type, ColumnType.AGGREGATE, v, false);
  }

  private static Map<String, String> groups(JsonNode n) {
    if (n == null || n.isNull()) throw new ConfigurationException("Missing field 'groups'");
    Map<String, String> out = new LinkedHashMap<>();
    if (n.isObject()) {
      for (Iterator<Map.Entry<String, JsonNode>> it = n.fields(); it.hasNext(); ) {
        var e = it.next();
        out.put(e.getKey(), requireText(e.getValue(), "groups." + e.getKey()));
      }
    } else {
      for (String g : textList(n, "groups")) {
        if (out.put(g, g) != null) throw new ConfigurationException("Duplicate group '" + g + "' in 'groups'");
      }
    }
    if (out.isEmpty()) throw new ConfigurationException("Field 'groups' is empty");
    return out;
  }

  private static Object scalar(JsonNode n, String path) {
    if (n == null || n.isNull()) return null;
    if (n.isNumber()) return n.numberValue();
    if (n.isTextual() || n.isBoolean()) return n.isBoolean() ? n.asBoolean() : n.asText();
    throw new ConfigurationException("Field '" + path + "' must hold scalars");
  }

  private static List<String> requiredTextList(JsonNode parent, String field, String path) {
    JsonNode n = parent.get(field);
    if (n == null || n.isNull()) throw new ConfigurationException("Missing field '" + path + "." + field + "'");
    return textList(n, path + "." + field);
  }

  /** A string or an array of strings. */
  private static List<String> textList(JsonNode n, String path) {
    if (n.isTextual()) return List.of(n.asText());
    if (!n.isArray()) throw new ConfigurationException("Field '" + path + "' must be a string or an array of strings");
    List<String> out = new ArrayList<>(n.size());
    for (JsonNode e : n) out.add(requireText(e, path));
    return out;
  }

  private static String requireText(JsonNode n, String path) {
    if (n == null || !n.isTextual() || n.asText().isBlank()) {
      throw new ConfigurationException("Field '" + path + "' must be a non-blank string");
    }
    return n.asText();
  }

  private static String requiredText(JsonNode parent, String field) {
    return requireText(parent.get(field), field);
  }

  private static String requiredText(JsonNode parent, String field, String path) {
    return requireText(parent.get(field), path + "." + field);
  }

  private static String optionalText(JsonNode parent, String field) {
    JsonNode n = parent.get(field);
    if (n == null || n.isNull()) return null;
    return requireText(n, field);
  }
}
