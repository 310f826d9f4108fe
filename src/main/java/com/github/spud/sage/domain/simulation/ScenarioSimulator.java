package com.github.spud.sage.domain.simulation;

import com.github.spud.sage.domain.loan.LoanScenario;
import com.github.spud.sage.domain.loan.ProductResult;
import com.github.spud.sage.domain.loan.RuleViolation;
import com.github.spud.sage.domain.rules.ProductRules;
import com.github.spud.sage.domain.rules.RulesEngine;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * What-if 场景模拟器
 * <p>
 * 覆盖值作用于场景副本，调用方的场景不会被修改；LTV/DTI 与阈值检查全部复用 {@link RulesEngine}
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScenarioSimulator {

  public static final String CREDIT_SCORE = "credit_score";
  public static final String ANNUAL_INCOME = "annual_income";
  public static final String LOAN_AMOUNT = "loan_amount";
  public static final String PROPERTY_VALUE = "property_value";
  public static final String MONTHLY_DEBT_PAYMENTS = "monthly_debt_payments";

  private final RulesEngine rulesEngine;

  public SimulationResult simulate(LoanScenario base, Map<String, ? extends Number> changes,
    String description) {
    LoanScenario.LoanScenarioBuilder modified = base.toBuilder();
    Map<String, String> applied = new LinkedHashMap<>();
    double magnitude = 0;

    if (changes != null) {
      for (Map.Entry<String, ? extends Number> change : changes.entrySet()) {
        Number value = change.getValue();
        if (value == null || !apply(modified, change.getKey(), value)) {
          log.debug("Ignoring simulation override {}={}", change.getKey(), value);
          continue;
        }
        applied.put(change.getKey(), String.format(Locale.US, "%,.0f", value.doubleValue()));
        magnitude += Math.abs(value.doubleValue());
      }
    }

    LoanScenario scenario = modified.build();
    double ltv = rulesEngine.calculateLtv(scenario.getLoanAmount(), scenario.getPropertyValue());
    double dti = rulesEngine.calculateDti(scenario);
    ProductResult homeReady = rulesEngine.checkProduct(scenario, ltv, dti, ProductRules.HOME_READY);
    ProductResult homePossible = rulesEngine.checkProduct(scenario, ltv, dti,
      ProductRules.HOME_POSSIBLE);

    Set<String> remaining = violationNames(homeReady, homePossible);
    Set<String> original = violationNames(
      rulesEngine.checkProduct(base, ProductRules.HOME_READY),
      rulesEngine.checkProduct(base, ProductRules.HOME_POSSIBLE));
    List<String> resolved = original.stream()
      .filter(name -> !remaining.contains(name))
      .collect(Collectors.toList());

    SimulationResult result = SimulationResult.builder()
      .description(description == null ? "" : description)
      .parameterChanges(applied)
      .homeReadyEligible(homeReady.isEligible())
      .homePossibleEligible(homePossible.isEligible())
      .homeReadyViolations(violationNames(homeReady))
      .homePossibleViolations(violationNames(homePossible))
      .violationsResolved(resolved)
      .remainingViolations(remaining)
      .modifiedLtv(ltv)
      .modifiedDti(dti)
      .feasibility(Feasibility.classify(magnitude))
      .build();

    log.debug("Simulation '{}': changes={}, remaining={}, feasibility={}",
      result.getDescription(), applied, remaining, result.getFeasibility());
    return result;
  }

  /**
   * 模拟结果的文本摘要，作为工具结果回传给模型
   */
  public String summarize(SimulationResult result) {
    return "Simulation: " + result.getDescription() + "\n"
      + "Changes: " + result.getParameterChanges() + "\n"
      + String.format(Locale.US, "Modified LTV: %.1f%%, Modified DTI: %.1f%%",
      result.getModifiedLtv() * 100, result.getModifiedDti() * 100) + "\n"
      + "HomeReady: " + status(result.isHomeReadyEligible(), result.getHomeReadyViolations())
      + "\n"
      + "Home Possible: "
      + status(result.isHomePossibleEligible(), result.getHomePossibleViolations()) + "\n"
      + "Resolved: " + (result.getViolationsResolved().isEmpty() ? "none"
      : String.join(", ", result.getViolationsResolved())) + "\n"
      + "Feasibility: " + result.getFeasibility().tag();
  }

  private static String status(boolean eligible, List<String> violations) {
    return eligible ? "Eligible" : "Ineligible (" + String.join(", ", violations) + ")";
  }

  private static boolean apply(LoanScenario.LoanScenarioBuilder builder, String key, Number value) {
    switch (key) {
      case CREDIT_SCORE -> builder.creditScore((int) Math.round(value.doubleValue()));
      case ANNUAL_INCOME -> builder.annualIncome(value.doubleValue());
      case LOAN_AMOUNT -> builder.loanAmount(value.doubleValue());
      case PROPERTY_VALUE -> builder.propertyValue(value.doubleValue());
      case MONTHLY_DEBT_PAYMENTS -> builder.monthlyDebtPayments(value.doubleValue());
      default -> {
        return false;
      }
    }
    return true;
  }

  private static Set<String> violationNames(ProductResult... products) {
    Set<String> names = new LinkedHashSet<>();
    for (ProductResult product : products) {
      for (RuleViolation violation : product.getViolations()) {
        names.add(violation.getRuleName());
      }
    }
    return names;
  }
}
