package com.github.spud.sage.domain.fixfinder;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.sage.domain.loan.Difficulty;
import com.github.spud.sage.domain.rag.GuideCitation;
import com.github.spud.sage.util.JsonUtils;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 最终载荷归一化器
 * <p>
 * 把模型给出的任意 JSON 转换为规范的 {@link FixFinderResult} 字段：兼容多种字段拼写，枚举取安全默认值， 数值夹紧到声明区间，缺失字段补默认值，未知字段忽略。对任何
 * JSON 输入都不抛出
 */
@Slf4j
@Component
public class ResultNormalizer {

  public static final String HOME_READY = "HomeReady";
  public static final String HOME_POSSIBLE = "Home Possible";

  static final double DEFAULT_CONFIDENCE = 0.7;
  static final double DEFAULT_EFFORT_VS_BENEFIT = 5.0;
  static final double MAX_EFFORT_VS_BENEFIT = 10.0;
  static final int MAX_CITATIONS_PER_FIX = 3;
  static final int RECOMMENDED_PATH_LIMIT = 500;
  static final String DEFAULT_TIMELINE = "Varies";

  private static final int DESCRIPTION_KEYWORDS = 5;
  private static final int MIN_KEYWORD_LENGTH = 4;

  /**
   * 归一化最终载荷；citations 为本次循环收集的全部引用
   */
  public FixFinderResult normalize(JsonNode payload, List<GuideCitation> citations) {
    JsonNode root = payload != null && payload.isObject()
      ? payload : JsonUtils.objectMapper().createObjectNode();
    List<GuideCitation> pool = citations != null ? citations : List.of();

    List<EnhancedFixSuggestion> fixes = normalizeFixes(root.get("enhanced_fixes"), pool);
    List<FixSequence> sequences = normalizeSequences(root.get("fix_sequences"));

    log.debug("Normalized payload: fixes={}, sequences={}", fixes.size(), sequences.size());

    return FixFinderResult.builder()
      .enhancedFixes(fixes)
      .fixSequences(sequences)
      .recommendedPath(recommendedPath(root.get("recommended_path")))
      .productComparison(flatten(root.get("product_comparison")))
      .build();
  }

  List<EnhancedFixSuggestion> normalizeFixes(JsonNode rawFixes, List<GuideCitation> pool) {
    List<EnhancedFixSuggestion> fixes = new ArrayList<>();
    if (rawFixes == null || !rawFixes.isArray()) {
      return fixes;
    }
    int index = 0;
    for (JsonNode fix : rawFixes) {
      index++;
      if (!fix.isObject()) {
        continue;
      }
      String description = firstText(fix, "description", "fix").orElse("No description provided");
      fixes.add(EnhancedFixSuggestion.builder()
        .description(description)
        .impact(firstText(fix, "impact", "quantified_impact").orElse("Impact not specified"))
        .difficulty(difficulty(fix.get("difficulty")))
        .confidence(confidence(fix.get("confidence")))
        .priorityOrder(priority(fix, index))
        .estimatedTimeline(firstText(fix, "estimated_timeline").orElse(DEFAULT_TIMELINE))
        .unlocksProducts(products(first(fix, "unlocks_products", "products_unlocked")))
        .citations(linkCitations(description, pool))
        .tradeOffs(stringList(fix.get("trade_offs")))
        .build());
    }
    return fixes;
  }

  List<FixSequence> normalizeSequences(JsonNode rawSequences) {
    List<FixSequence> sequences = new ArrayList<>();
    if (rawSequences == null || !rawSequences.isArray()) {
      return sequences;
    }
    for (JsonNode seq : rawSequences) {
      if (!seq.isObject()) {
        continue;
      }
      List<EnhancedFixSuggestion> steps = normalizeSteps(seq.get("steps"));
      if (steps.isEmpty()) {
        log.debug("Dropping fix sequence without valid steps");
        continue;
      }
      sequences.add(FixSequence.builder()
        .sequenceName(firstText(seq, "sequence_name", "name")
          .orElse("Path " + (sequences.size() + 1)))
        .description(firstText(seq, "description").orElse(""))
        .steps(steps)
        .totalEffort(text(seq.get("total_effort")).flatMap(Effort::fromTag).orElse(Effort.MEDIUM))
        .effortVsBenefitScore(clamp(number(seq.get("effort_vs_benefit_score"))
          .orElse(DEFAULT_EFFORT_VS_BENEFIT), 0, MAX_EFFORT_VS_BENEFIT, DEFAULT_EFFORT_VS_BENEFIT))
        .productsUnlocked(products(first(seq, "products_unlocked", "unlocks_products")))
        .estimatedTotalTimeline(firstText(seq, "estimated_total_timeline")
          .orElse(DEFAULT_TIMELINE))
        .build());
    }
    return sequences;
  }

  /**
   * A step is valid when it is an object carrying a description
   */
  private List<EnhancedFixSuggestion> normalizeSteps(JsonNode rawSteps) {
    List<EnhancedFixSuggestion> steps = new ArrayList<>();
    if (rawSteps == null || !rawSteps.isArray()) {
      return steps;
    }
    for (JsonNode step : rawSteps) {
      if (!step.isObject()) {
        continue;
      }
      Optional<String> description = firstText(step, "description", "fix");
      if (description.isEmpty()) {
        continue;
      }
      steps.add(EnhancedFixSuggestion.builder()
        .description(description.get())
        .impact(firstText(step, "impact", "quantified_impact").orElse(""))
        .difficulty(difficulty(step.get("difficulty")))
        .confidence(confidence(step.get("confidence")))
        .priorityOrder(priority(step, steps.size() + 1))
        .estimatedTimeline(firstText(step, "estimated_timeline").orElse(DEFAULT_TIMELINE))
        .unlocksProducts(products(first(step, "unlocks_products", "products_unlocked")))
        .tradeOffs(stringList(step.get("trade_offs")))
        .build());
    }
    return steps;
  }

  static String recommendedPath(JsonNode raw) {
    if (raw == null || raw.isNull() || raw.isMissingNode()) {
      return "";
    }
    if (raw.isObject()) {
      Optional<String> primary = firstText(raw, "primary_recommendation");
      if (primary.isPresent()) {
        return primary.get();
      }
      return truncate(raw.toString(), RECOMMENDED_PATH_LIMIT);
    }
    if (raw.isArray()) {
      return truncate(joinValues(raw), RECOMMENDED_PATH_LIMIT);
    }
    return raw.asText();
  }

  /**
   * Nested objects become JSON text, arrays are comma-joined
   */
  static Map<String, String> flatten(JsonNode raw) {
    Map<String, String> flat = new LinkedHashMap<>();
    if (raw == null || !raw.isObject()) {
      return flat;
    }
    Iterator<Map.Entry<String, JsonNode>> fields = raw.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      JsonNode value = field.getValue();
      String text;
      if (value.isObject()) {
        text = value.toString();
      } else if (value.isArray()) {
        text = joinValues(value);
      } else if (value.isNull()) {
        text = "";
      } else {
        text = value.asText();
      }
      flat.put(field.getKey(), text);
    }
    return flat;
  }

  /**
   * Citations whose snippet contains one of the description's first words (4+ letters)
   */
  static List<GuideCitation> linkCitations(String description, List<GuideCitation> pool) {
    List<String> keywords = Arrays.stream(description.split("\\s+"))
      .limit(DESCRIPTION_KEYWORDS)
      .map(word -> word.replaceAll("[^\\p{L}\\p{N}]", "").toLowerCase(Locale.ROOT))
      .filter(word -> word.length() >= MIN_KEYWORD_LENGTH)
      .collect(Collectors.toList());
    if (keywords.isEmpty()) {
      return List.of();
    }
    return pool.stream()
      .filter(c -> {
        String snippet = c.getSnippet().toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(snippet::contains);
      })
      .limit(MAX_CITATIONS_PER_FIX)
      .collect(Collectors.toList());
  }

  static Difficulty difficulty(JsonNode raw) {
    return text(raw).flatMap(Difficulty::fromTag).orElse(Difficulty.MODERATE);
  }

  static double confidence(JsonNode raw) {
    return clamp(number(raw).orElse(DEFAULT_CONFIDENCE), 0, 1, DEFAULT_CONFIDENCE);
  }

  static int priority(JsonNode node, int fallback) {
    double value = number(first(node, "priority_order", "priority")).orElse((double) fallback);
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      value = fallback;
    }
    return (int) Math.max(1, Math.min(Math.round(value), Integer.MAX_VALUE));
  }

  /**
   * Product names mapped to their canonical spelling, unknown names dropped
   */
  static List<String> products(JsonNode raw) {
    return stringList(raw).stream()
      .map(ResultNormalizer::canonicalProduct)
      .flatMap(Optional::stream)
      .distinct()
      .collect(Collectors.toList());
  }

  static Optional<String> canonicalProduct(String name) {
    String key = name.replaceAll("[^A-Za-z]", "").toLowerCase(Locale.ROOT);
    return switch (key) {
      case "homeready" -> Optional.of(HOME_READY);
      case "homepossible" -> Optional.of(HOME_POSSIBLE);
      default -> Optional.empty();
    };
  }

  /**
   * A single string becomes a one-element list; non-text entries are dropped
   */
  static List<String> stringList(JsonNode raw) {
    if (raw == null || raw.isNull()) {
      return List.of();
    }
    if (raw.isTextual()) {
      return raw.asText().isBlank() ? List.of() : List.of(raw.asText());
    }
    if (!raw.isArray()) {
      return List.of();
    }
    return StreamSupport.stream(raw.spliterator(), false)
      .filter(JsonNode::isValueNode)
      .filter(n -> !n.isNull())
      .map(JsonNode::asText)
      .filter(s -> !s.isBlank())
      .collect(Collectors.toList());
  }

  static Optional<Double> number(JsonNode raw) {
    if (raw == null) {
      return Optional.empty();
    }
    if (raw.isNumber()) {
      return Optional.of(raw.asDouble());
    }
    if (raw.isTextual()) {
      try {
        return Optional.of(Double.parseDouble(raw.asText().trim()));
      } catch (NumberFormatException e) {
        return Optional.empty();
      }
    }
    return Optional.empty();
  }

  static double clamp(double value, double min, double max, double fallback) {
    if (Double.isNaN(value)) {
      return fallback;
    }
    return Math.min(Math.max(value, min), max);
  }

  private static JsonNode first(JsonNode node, String... names) {
    for (String name : names) {
      JsonNode value = node.get(name);
      if (value != null && !value.isNull() && !(value.isTextual() && value.asText().isBlank())
        && !(value.isArray() && value.isEmpty())) {
        return value;
      }
    }
    return null;
  }

  private static Optional<String> firstText(JsonNode node, String... names) {
    for (String name : names) {
      Optional<String> value = text(node.get(name));
      if (value.isPresent()) {
        return value;
      }
    }
    return Optional.empty();
  }

  private static Optional<String> text(JsonNode raw) {
    if (raw == null || !raw.isValueNode() || raw.isNull()) {
      return Optional.empty();
    }
    String value = raw.asText();
    return value.isBlank() ? Optional.empty() : Optional.of(value);
  }

  private static String joinValues(JsonNode array) {
    return StreamSupport.stream(array.spliterator(), false)
      .map(n -> n.isValueNode() ? n.asText() : n.toString())
      .collect(Collectors.joining(", "));
  }

  private static String truncate(String s, int max) {
    return s.length() > max ? s.substring(0, max) : s;
  }
}
