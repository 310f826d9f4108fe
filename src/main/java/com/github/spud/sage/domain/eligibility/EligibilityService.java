package com.github.spud.sage.domain.eligibility;

import com.github.spud.sage.domain.fixfinder.FixFinderProperties;
import com.github.spud.sage.domain.fixfinder.FixFinderResult;
import com.github.spud.sage.domain.fixfinder.ReasoningOrchestrator;
import com.github.spud.sage.domain.loan.LoanScenario;
import com.github.spud.sage.domain.loan.RuleViolation;
import com.github.spud.sage.domain.rag.RetrievalCoordinator;
import com.github.spud.sage.domain.rag.RetrievalProperties;
import com.github.spud.sage.domain.rag.RetrievalResult;
import com.github.spud.sage.domain.reasoning.ReasoningUnavailableException;
import com.github.spud.sage.domain.rules.RulesEngine;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 资格检查入口
 * <p>
 * 规则引擎的判定是最终结果；引用和 Fix Finder 只做补充，任一失败都退回到纯规则结果
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EligibilityService {

  private final RulesEngine rulesEngine;
  private final RetrievalCoordinator retrievalCoordinator;
  private final RetrievalProperties retrievalProperties;
  private final ReasoningOrchestrator reasoningOrchestrator;
  private final FixFinderProperties fixFinderProperties;

  public EligibilityResult check(LoanScenario scenario) {
    return check(scenario, EligibilityOptions.defaults());
  }

  public EligibilityResult check(LoanScenario scenario, EligibilityOptions options) {
    EligibilityResult result = rulesEngine.checkEligibility(scenario);
    List<RuleViolation> violations = result.allViolations();

    boolean runFixes = options.isIncludeFixes() && fixFinderProperties.isEnabled()
      && !violations.isEmpty();
    if (!options.isIncludeCitations() && !runFixes) {
      return result;
    }

    RetrievalResult retrieval = retrieve(scenario);
    EligibilityResult.EligibilityResultBuilder builder = result.toBuilder();
    if (options.isIncludeCitations()) {
      builder.supportingCitations(retrieval.citations(retrievalProperties.getSnippetLength()));
    }

    if (runFixes) {
      FixFinderResult fixes = findFixes(result, violations, options.isDemoMode(), retrieval);
      if (fixes != null) {
        builder.fixFinderResult(fixes);
      }
    }
    return builder.build();
  }

  private RetrievalResult retrieve(LoanScenario scenario) {
    try {
      return retrievalCoordinator.retrieveForScenario(scenario);
    } catch (RuntimeException e) {
      log.warn("Guide retrieval failed, continuing without citations: {}", e.getMessage());
      return RetrievalResult.builder().build();
    }
  }

  /**
   * @return null when reasoning is unavailable, the basic fix suggestions stand alone
   */
  private FixFinderResult findFixes(EligibilityResult result, List<RuleViolation> violations,
    boolean demoMode, RetrievalResult retrieval) {
    try {
      return reasoningOrchestrator.findFixes(result.getScenario(), violations,
        result.getProducts(), demoMode, retrieval);
    } catch (ReasoningUnavailableException e) {
      log.info("Reasoning model not configured, returning rules-only result");
      return null;
    } catch (RuntimeException e) {
      log.error("Fix finder failed, returning rules-only result: {}", e.getMessage(), e);
      return null;
    }
  }
}
