package com.github.spud.sage.domain.rules;

import com.github.spud.sage.domain.eligibility.EligibilityResult;
import com.github.spud.sage.domain.loan.Difficulty;
import com.github.spud.sage.domain.loan.FixSuggestion;
import com.github.spud.sage.domain.loan.LoanScenario;
import com.github.spud.sage.domain.loan.ProductResult;
import com.github.spud.sage.domain.loan.RuleViolation;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * HomeReady / Home Possible 资格规则引擎
 * <p>
 * 纯函数：scenario → ratios → violations → suggestions → recommendation，无 I/O
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RulesEngine {

  public static final String MIN_CREDIT_SCORE = "min_credit_score";
  public static final String MAX_DTI = "max_dti";
  public static final String MAX_LTV = "max_ltv";
  public static final String OCCUPANCY = "occupancy";
  public static final String PROPERTY_TYPE = "property_type";
  public static final String LOAN_LIMIT = "loan_limit";
  public static final String LOAN_TERM = "loan_term";

  private static final double HIGH_LTV_THRESHOLD = 0.95;
  private static final int MAX_HIGH_LTV_TERM_YEARS = 30;

  // rough multiplier from monthly payment to outstanding balance (~7% over 5 years)
  private static final int DEBT_PAYOFF_MULTIPLIER = 50;

  private final RulesProperties properties;

  /**
   * 计算 LTV；房产价值非正时视为最不利（1.0）
   */
  public double calculateLtv(double loanAmount, double propertyValue) {
    if (propertyValue <= 0) {
      return 1.0;
    }
    return loanAmount / propertyValue;
  }

  /**
   * 计算 DTI（月供 P&amp;I + 税费保险估算 + 既有月债务）/ 月收入；月收入非正时返回 1.0
   */
  public double calculateDti(LoanScenario scenario) {
    double monthlyIncome = scenario.monthlyIncome();
    if (monthlyIncome <= 0) {
      return 1.0;
    }
    double monthlyHousing = estimateMonthlyHousingPayment(scenario);
    return (monthlyHousing + scenario.getMonthlyDebtPayments()) / monthlyIncome;
  }

  /**
   * Fixed-rate principal and interest plus the estimated tax/insurance load
   */
  public double estimateMonthlyHousingPayment(LoanScenario scenario) {
    double monthlyRate = properties.getAssumedAnnualRate() / 12;
    int numPayments = Math.max(scenario.getLoanTermYears(), 1) * 12;

    double monthlyPi;
    if (monthlyRate > 0) {
      double growth = Math.pow(1 + monthlyRate, numPayments);
      monthlyPi = scenario.getLoanAmount() * (monthlyRate * growth) / (growth - 1);
    } else {
      monthlyPi = scenario.getLoanAmount() / numPayments;
    }

    double monthlyTaxesInsurance =
      scenario.getPropertyValue() * properties.getTaxInsuranceRate() / 12;
    return monthlyPi + monthlyTaxesInsurance;
  }

  /**
   * 完整资格检查：两个产品 + 修复建议 + 推荐语
   */
  public EligibilityResult checkEligibility(LoanScenario scenario) {
    double ltv = calculateLtv(scenario.getLoanAmount(), scenario.getPropertyValue());
    double dti = calculateDti(scenario);

    ProductResult homeReady = checkProduct(scenario, ltv, dti, ProductRules.HOME_READY);
    ProductResult homePossible = checkProduct(scenario, ltv, dti, ProductRules.HOME_POSSIBLE);

    List<RuleViolation> allViolations = new ArrayList<>(homeReady.getViolations());
    allViolations.addAll(homePossible.getViolations());

    log.debug("Eligibility computed: ltv={}, dti={}, homeReady={}, homePossible={}",
      ltv, dti, homeReady.isEligible(), homePossible.isEligible());

    return EligibilityResult.builder()
      .scenario(scenario)
      .calculatedLtv(round4(ltv))
      .calculatedDti(round4(dti))
      .product(homeReady)
      .product(homePossible)
      .recommendation(recommend(homeReady, homePossible, scenario))
      .fixSuggestions(generateFixSuggestions(scenario, allViolations, ltv, dti))
      .build();
  }

  public ProductResult checkProduct(LoanScenario scenario, ProductRules rules) {
    return checkProduct(scenario,
      calculateLtv(scenario.getLoanAmount(), scenario.getPropertyValue()),
      calculateDti(scenario), rules);
  }

  /**
   * 按固定顺序执行检查：信用分、DTI、LTV、自住、物业类型、贷款上限、高 LTV 期限
   */
  public ProductResult checkProduct(LoanScenario scenario, double ltv, double dti,
    ProductRules rules) {
    ProductResult.ProductResultBuilder result = ProductResult.builder()
      .productName(rules.getProductName())
      .gse(rules.getGse());

    int minCredit = rules.minCreditScoreFor(scenario);
    if (scenario.getCreditScore() < minCredit) {
      result.violation(RuleViolation.builder()
        .ruleName(MIN_CREDIT_SCORE)
        .ruleDescription("Minimum credit score requirement")
        .actualValue(String.valueOf(scenario.getCreditScore()))
        .requiredValue(">= " + minCredit)
        .citation(rules.creditCitationFor(scenario))
        .build());
    }

    if (dti > rules.getMaxDti()) {
      result.violation(RuleViolation.builder()
        .ruleName(MAX_DTI)
        .ruleDescription("Maximum debt-to-income ratio")
        .actualValue(percent1(dti))
        .requiredValue("<= " + percent0(rules.getMaxDti()))
        .citation(rules.getDtiCitation())
        .build());
    }

    double maxLtv = rules.maxLtvFor(scenario);
    if (ltv > maxLtv) {
      result.violation(RuleViolation.builder()
        .ruleName(MAX_LTV)
        .ruleDescription("Maximum loan-to-value ratio")
        .actualValue(percent1(ltv))
        .requiredValue("<= " + percent0(maxLtv))
        .citation(rules.ltvCitationFor(scenario))
        .build());
    }

    String occupancy = scenario.getOccupancy() == null ? "" : scenario.getOccupancy();
    if (!"primary".equalsIgnoreCase(occupancy)) {
      result.violation(RuleViolation.builder()
        .ruleName(OCCUPANCY)
        .ruleDescription("Property must be primary residence")
        .actualValue(occupancy)
        .requiredValue("primary")
        .citation(rules.getOccupancyCitation())
        .build());
    }

    if (!rules.allowsPropertyType(scenario.getPropertyType())) {
      result.violation(RuleViolation.builder()
        .ruleName(PROPERTY_TYPE)
        .ruleDescription("Eligible property type")
        .actualValue(String.valueOf(scenario.getPropertyType()))
        .requiredValue(rules.eligiblePropertyTypesText())
        .citation(rules.getPropertyTypeCitation())
        .build());
    }

    if (scenario.getLoanAmount() > properties.getHighCostLoanLimit()) {
      result.violation(RuleViolation.builder()
        .ruleName(LOAN_LIMIT)
        .ruleDescription("Maximum conforming loan amount")
        .actualValue(dollars(scenario.getLoanAmount()))
        .requiredValue("<= " + dollars(properties.getHighCostLoanLimit()))
        .citation(rules.getLoanLimitCitation())
        .build());
    }

    if (rules.isHighLtvTermLimited() && ltv > HIGH_LTV_THRESHOLD
      && scenario.getLoanTermYears() > MAX_HIGH_LTV_TERM_YEARS) {
      result.violation(RuleViolation.builder()
        .ruleName(LOAN_TERM)
        .ruleDescription("Maximum loan term for high LTV")
        .actualValue(scenario.getLoanTermYears() + " years")
        .requiredValue("<= " + MAX_HIGH_LTV_TERM_YEARS + " years")
        .citation(rules.getTermCitation())
        .build());
    }

    return result.build();
  }

  /**
   * 为每条不同的违规规则生成量化建议（首次出现优先），按难度升序稳定排序
   */
  public List<FixSuggestion> generateFixSuggestions(LoanScenario scenario,
    List<RuleViolation> violations, double ltv, double dti) {
    List<FixSuggestion> suggestions = new ArrayList<>();
    Set<String> seenRules = new HashSet<>();

    for (RuleViolation violation : violations) {
      if (!seenRules.add(violation.getRuleName())) {
        continue;
      }
      switch (violation.getRuleName()) {
        case MIN_CREDIT_SCORE -> suggestCreditFixes(scenario, suggestions);
        case MAX_DTI -> suggestDtiFixes(scenario, dti, suggestions);
        case MAX_LTV -> suggestLtvFixes(scenario, ltv, suggestions);
        case OCCUPANCY -> suggestions.add(new FixSuggestion(
          "HomeReady and Home Possible require primary residence occupancy",
          "Consider conventional financing options for investment or second homes",
          Difficulty.HARD));
        case PROPERTY_TYPE -> suggestions.add(new FixSuggestion(
          "Consider a different property type that is eligible",
          "Single-family homes, condos, and PUDs are eligible for both programs",
          Difficulty.HARD));
        case LOAN_LIMIT -> {
          double overLimit = scenario.getLoanAmount() - properties.getHighCostLoanLimit();
          suggestions.add(new FixSuggestion(
            "Reduce loan amount by " + dollars(overLimit),
            "Would bring loan under " + dollars(properties.getHighCostLoanLimit())
              + " conforming limit",
            Difficulty.HARD));
          suggestions.add(new FixSuggestion(
            "Consider jumbo loan products instead",
            "Jumbo loans have different eligibility requirements",
            Difficulty.MODERATE));
        }
        case LOAN_TERM -> suggestions.add(new FixSuggestion(
          "Choose a loan term of " + MAX_HIGH_LTV_TERM_YEARS + " years or less",
          "Would meet the term limit for loans above 95% LTV",
          Difficulty.EASY));
        default -> log.debug("No fix suggestion template for rule {}", violation.getRuleName());
      }
    }

    suggestions.sort(Comparator.comparing(FixSuggestion::getDifficulty));
    return suggestions;
  }

  private void suggestCreditFixes(LoanScenario scenario, List<FixSuggestion> suggestions) {
    // strictest floor first so the borrower sees the target that unlocks both products
    for (ProductRules rules : List.of(ProductRules.HOME_POSSIBLE, ProductRules.HOME_READY)) {
      int target = rules.minCreditScoreFor(scenario);
      int pointsNeeded = target - scenario.getCreditScore();
      if (pointsNeeded > 0) {
        suggestions.add(new FixSuggestion(
          "Improve credit score by " + pointsNeeded + " points to reach " + target,
          "Would meet " + rules.getProductName() + " minimum credit requirement",
          pointsNeeded <= 30 ? Difficulty.MODERATE : Difficulty.HARD));
      }
    }
  }

  private void suggestDtiFixes(LoanScenario scenario, double dti,
    List<FixSuggestion> suggestions) {
    double monthlyIncome = scenario.monthlyIncome();
    if (monthlyIncome <= 0) {
      suggestions.add(new FixSuggestion(
        "Document qualifying income",
        "DTI cannot be computed without monthly income",
        Difficulty.HARD));
      return;
    }

    for (ProductRules rules : List.of(ProductRules.HOME_POSSIBLE, ProductRules.HOME_READY)) {
      double ceiling = rules.getMaxDti();
      if (dti <= ceiling) {
        continue;
      }
      double monthlyReduction = (dti - ceiling) * monthlyIncome;
      double debtPayoff = monthlyReduction * DEBT_PAYOFF_MULTIPLIER;

      suggestions.add(new FixSuggestion(
        "Reduce monthly debt payments by " + dollars(monthlyReduction) + "/month for "
          + rules.getProductName(),
        "Would reduce DTI from " + percent1(dti) + " to " + percent0(ceiling) + " ("
          + rules.getProductName() + " eligible)",
        monthlyReduction <= 200 ? Difficulty.EASY : Difficulty.MODERATE));

      suggestions.add(new FixSuggestion(
        "Pay off approximately " + dollars(debtPayoff) + " in debt",
        "Would reduce DTI to meet " + rules.getProductName() + " requirement",
        debtPayoff <= 10_000 ? Difficulty.MODERATE : Difficulty.HARD));
    }
  }

  private void suggestLtvFixes(LoanScenario scenario, double ltv,
    List<FixSuggestion> suggestions) {
    double targetLtv = Math.min(ProductRules.HOME_READY.maxLtvFor(scenario),
      ProductRules.HOME_POSSIBLE.maxLtvFor(scenario));
    double propertyValue = scenario.getPropertyValue();
    if (propertyValue <= 0) {
      suggestions.add(new FixSuggestion(
        "Obtain an appraisal supporting the property value",
        "LTV cannot be computed without a property value",
        Difficulty.HARD));
      return;
    }

    double additionalDown = scenario.getLoanAmount() - propertyValue * targetLtv;
    if (additionalDown <= 0) {
      return;
    }
    suggestions.add(new FixSuggestion(
      "Increase down payment by " + dollars(additionalDown),
      "Would reduce LTV from " + percent1(ltv) + " to " + percent0(targetLtv),
      magnitudeDifficulty(additionalDown)));

    // same cash down payment on a cheaper property: (P - down) / P <= target
    double currentDown = propertyValue - scenario.getLoanAmount();
    if (currentDown > 0) {
      double maxPrice = currentDown / (1 - targetLtv);
      double priceReduction = propertyValue - maxPrice;
      if (priceReduction > 0 && maxPrice > 0) {
        suggestions.add(new FixSuggestion(
          "Negotiate purchase price reduction of " + dollars(priceReduction),
          "Would achieve " + percent0(targetLtv) + " LTV with current down payment",
          magnitudeDifficulty(priceReduction)));
      }
    }
  }

  private static Difficulty magnitudeDifficulty(double amount) {
    if (amount <= 5_000) {
      return Difficulty.EASY;
    }
    return amount <= 20_000 ? Difficulty.MODERATE : Difficulty.HARD;
  }

  /**
   * 四分支推荐：都合格 / 仅 HomeReady / 仅 Home Possible / 都不合格
   */
  public String recommend(ProductResult homeReady, ProductResult homePossible,
    LoanScenario scenario) {
    if (homeReady.isEligible() && homePossible.isEligible()) {
      if (scenario.getCreditScore() >= 700) {
        return "Congratulations! You are eligible for both HomeReady (Fannie Mae) and "
          + "Home Possible (Freddie Mac). With your credit score of "
          + scenario.getCreditScore() + ", you may qualify for better pricing through "
          + "either program. Compare lender offerings for both programs to find "
          + "the best rate and terms.";
      }
      return "Congratulations! You are eligible for both HomeReady (Fannie Mae) and "
        + "Home Possible (Freddie Mac). Both programs offer similar benefits including "
        + "low down payment options and reduced mortgage insurance costs. "
        + "Shop multiple lenders to compare rates.";
    }

    if (homeReady.isEligible()) {
      return "You are eligible for Fannie Mae HomeReady but not Freddie Mac Home Possible. "
        + "HomeReady has a lower credit score requirement (620 vs 660) and allows up to "
        + "50% DTI (vs 45%). Work with a lender who offers HomeReady to proceed.";
    }

    if (homePossible.isEligible()) {
      return "You are eligible for Freddie Mac Home Possible but not Fannie Mae HomeReady. "
        + "Home Possible offers similar benefits including low down payment and income "
        + "limit flexibility. Work with a lender who offers Home Possible to proceed.";
    }

    int hrViolations = homeReady.getViolations().size();
    int hpViolations = homePossible.getViolations().size();
    if (hpViolations < hrViolations) {
      return "You are not currently eligible for either program. Home Possible has "
        + hpViolations + " violation(s) compared to HomeReady's " + hrViolations + ". "
        + "Home Possible is the easier path; review the fix suggestions below to see how "
        + "you can become eligible.";
    }
    return "You are not currently eligible for either program. HomeReady (Fannie Mae) "
      + "has " + hrViolations + " violation(s) and Home Possible (Freddie Mac) has "
      + hpViolations + " violation(s). Review the fix suggestions below - "
      + "HomeReady may be easier to qualify for with its more flexible requirements.";
  }

  static String percent1(double ratio) {
    return String.format(Locale.US, "%.1f%%", ratio * 100);
  }

  static String percent0(double ratio) {
    return String.format(Locale.US, "%.0f%%", ratio * 100);
  }

  static String dollars(double amount) {
    return String.format(Locale.US, "$%,.0f", amount);
  }

  private static double round4(double value) {
    return Math.round(value * 10_000d) / 10_000d;
  }
}
