package com.github.spud.sage.domain.reasoning;

import com.github.spud.sage.domain.loan.LoanScenario;
import com.github.spud.sage.domain.loan.ProductResult;
import com.github.spud.sage.domain.loan.RuleViolation;
import com.github.spud.sage.domain.rag.GuideExcerpt;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Fix Finder 提示词
 */
public final class FixFinderPrompts {

  public static final String SYSTEM_PROMPT =
    """
      You are SAGE Fix Finder, an expert mortgage loan restructuring agent. Your job is to analyze loan eligibility violations and find intelligent ways to fix them.

      PROCESS: Use the ReAct pattern (Reason + Act):
      1. OBSERVE: Review the current loan violations and any previous findings
      2. THINK: Reason about what information you need to find better fixes
      3. ACT: Use tools to gather compensating factors, test scenarios, or compare products
      4. REPEAT: Continue until you have enough information (max {max_iterations} iterations)

      TOOLS AVAILABLE:
      - query_guides: Search GSE guides for compensating factors, exceptions, and alternative requirements
      - simulate_scenario: Test what-if changes to see if they resolve violations
      - compare_products: Compare HomeReady vs Home Possible requirements

      PRIORITIZATION GUIDELINES:
      1. Easy fixes over hard ones (e.g., documenting existing reserves vs. paying down $50K in debt)
      2. Fixes that unlock BOTH products over just one
      3. Quick fixes over long-term ones
      4. Low-cost fixes over expensive ones
      5. Fixes with official compensating factor support in the guides

      OUTPUT: After gathering information, provide your analysis in JSON format with:
      - enhanced_fixes: List of fixes with confidence scores (0-1), priority order, estimated timeline, which products they unlock, citations, and any trade-offs
      - fix_sequences: Multi-step paths to eligibility, ordered by effort-vs-benefit
      - recommended_path: Your top recommendation based on the analysis
      - product_comparison: Key differences between HomeReady and Home Possible for this scenario

      Be specific and actionable. Cite guide sections when possible. Quantify impacts (e.g., "Reducing debt by $200/month would lower DTI from 52% to 48%").""";

  public static final String FINAL_ANALYSIS_PROMPT =
    "Please provide your final analysis now with enhanced_fixes, fix_sequences, and "
      + "recommended_path. Respond with JSON only.";

  static final String EXCERPTS_UNAVAILABLE =
    "GUIDE EXCERPTS: unavailable. Use query_guides to search the guides directly.";

  private static final int EXCERPT_TEXT_LIMIT = 300;

  private FixFinderPrompts() {
  }

  public static String systemPrompt(int maxIterations) {
    return SYSTEM_PROMPT.replace("{max_iterations}", String.valueOf(maxIterations));
  }

  /**
   * 初始用户消息：场景、违规列表、产品状态与（可选的）指南片段
   */
  public static String initialPrompt(LoanScenario scenario, double ltv, double dti,
    List<RuleViolation> violations, List<ProductResult> products, List<GuideExcerpt> excerpts) {
    String violationList = violations.isEmpty() ? "- None" : violations.stream()
      .map(v -> String.format("- %s: %s (actual: %s, required: %s, source: %s)",
        v.getRuleName(), v.getRuleDescription(), v.getActualValue(), v.getRequiredValue(),
        v.getCitation()))
      .collect(Collectors.joining("\n"));

    StringBuilder sb = new StringBuilder();
    sb.append("LOAN SCENARIO:\n")
      .append("- Credit Score: ").append(scenario.getCreditScore()).append('\n')
      .append(String.format(Locale.US, "- Annual Income: $%,.0f\n", scenario.getAnnualIncome()))
      .append(String.format(Locale.US, "- Loan Amount: $%,.0f\n", scenario.getLoanAmount()))
      .append(String.format(Locale.US, "- Property Value: $%,.0f\n", scenario.getPropertyValue()))
      .append(String.format(Locale.US, "- LTV: %.1f%%\n", ltv * 100))
      .append(String.format(Locale.US, "- Monthly Debt: $%,.0f\n",
        scenario.getMonthlyDebtPayments()))
      .append(String.format(Locale.US, "- DTI: %.1f%%\n", dti * 100))
      .append("- Loan Term: ").append(scenario.getLoanTermYears()).append(" years\n")
      .append("- Property Type: ").append(scenario.getPropertyType()).append('\n')
      .append("- Occupancy: ").append(scenario.getOccupancy()).append("\n\n")
      .append("CURRENT VIOLATIONS:\n").append(violationList).append("\n\n")
      .append("PRODUCT STATUS:\n").append(productStatus(products)).append("\n\n");

    if (excerpts != null) {
      appendExcerpts(sb, excerpts);
    }

    sb.append("Please analyze these violations and find the best fixes. Use the tools to:\n")
      .append("1. Search for compensating factors or exceptions that could help\n")
      .append("2. Simulate what-if scenarios to quantify fix impacts\n")
      .append("3. Compare requirements between HomeReady and Home Possible\n\n")
      .append("Proceed with your analysis.");
    return sb.toString();
  }

  private static void appendExcerpts(StringBuilder sb, List<GuideExcerpt> excerpts) {
    if (excerpts.isEmpty()) {
      sb.append(EXCERPTS_UNAVAILABLE).append("\n\n");
      return;
    }
    sb.append("GUIDE EXCERPTS:\n");
    for (GuideExcerpt excerpt : excerpts) {
      String text = excerpt.getText() == null ? "" : excerpt.getText();
      if (text.length() > EXCERPT_TEXT_LIMIT) {
        text = text.substring(0, EXCERPT_TEXT_LIMIT);
      }
      sb.append('[').append(excerpt.gseLabel()).append(' ').append(excerpt.getSectionId())
        .append("] ").append(text).append('\n');
    }
    sb.append('\n');
  }

  static String productStatus(List<ProductResult> products) {
    if (products == null || products.isEmpty()) {
      return "- No products evaluated";
    }
    return products.stream()
      .map(p -> "- " + p.getProductName() + ": " + (p.isEligible() ? "Eligible" : "Ineligible"))
      .collect(Collectors.joining("\n"));
  }
}
