package com.github.spud.sage.domain.rules;

import com.github.spud.sage.domain.loan.Gse;
import com.github.spud.sage.domain.loan.LoanScenario;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import lombok.Builder;
import lombok.Value;

/**
 * 产品阈值配置
 * <p>
 * 信用分下限与 LTV 上限按物业类型变化（多单元、装配式住宅更严格）
 */
@Value
@Builder
public class ProductRules {

  /**
   * Fannie Mae Selling Guide B5-6-01, B5-6-02
   */
  public static final ProductRules HOME_READY = ProductRules.builder()
    .productName("HomeReady")
    .gse(Gse.FANNIE_MAE)
    .minCreditScore(620)
    .multiUnitMinCreditScore(620)
    .manufacturedMinCreditScore(620)
    .creditCitation("Fannie Mae Selling Guide B5-6-02")
    .multiUnitCreditCitation("Fannie Mae Selling Guide B5-6-02")
    .manufacturedCreditCitation("Fannie Mae Selling Guide B5-6-02")
    .maxDti(0.50)
    .dtiCitation("Fannie Mae Selling Guide B5-6-02")
    .maxLtv(0.97)
    .reducedMaxLtv(0.95)
    .ltvCitation("Fannie Mae Selling Guide B5-6-01")
    .multiUnitLtvCitation("Fannie Mae Selling Guide B5-6-01 (Multi-unit)")
    .manufacturedLtvCitation("Fannie Mae Selling Guide B5-6-01 (Manufactured Housing)")
    .occupancyCitation("Fannie Mae Selling Guide B5-6-01")
    .eligiblePropertyTypes(Set.of("single_family", "condo", "pud", "2_unit", "3_unit", "4_unit",
      "manufactured", "coop"))
    .propertyTypeCitation("Fannie Mae Selling Guide B5-6-01")
    .loanLimitCitation("Fannie Mae Selling Guide B5-6-01, FHFA Loan Limits")
    .highLtvTermLimited(true)
    .termCitation("Fannie Mae Selling Guide B5-6-01")
    .build();

  /**
   * Freddie Mac Guide 4501, 4501.5
   */
  public static final ProductRules HOME_POSSIBLE = ProductRules.builder()
    .productName("Home Possible")
    .gse(Gse.FREDDIE_MAC)
    .minCreditScore(660)
    .multiUnitMinCreditScore(700)
    .manufacturedMinCreditScore(680)
    .creditCitation("Freddie Mac Guide 4501.5")
    .multiUnitCreditCitation("Freddie Mac Guide 4501.5 (2-4 unit)")
    .manufacturedCreditCitation("Freddie Mac Guide 4501.5 (Manufactured Home)")
    .maxDti(0.45)
    .dtiCitation("Freddie Mac Guide 4501.5, 5401.2")
    .maxLtv(0.97)
    .reducedMaxLtv(0.95)
    .ltvCitation("Freddie Mac Guide 4501.7")
    .multiUnitLtvCitation("Freddie Mac Guide 4501.7 (Multi-unit)")
    .manufacturedLtvCitation("Freddie Mac Guide 4501.7, 5703.8 (Manufactured Home)")
    .occupancyCitation("Freddie Mac Guide 4501.4")
    .eligiblePropertyTypes(Set.of("single_family", "condo", "coop", "manufactured", "2_unit",
      "3_unit", "4_unit"))
    .propertyTypeCitation("Freddie Mac Guide 4501.3")
    .loanLimitCitation("Freddie Mac Guide 4203.1, FHFA Loan Limits")
    .highLtvTermLimited(false)
    .termCitation("Freddie Mac Guide 4501")
    .build();

  String productName;
  Gse gse;

  int minCreditScore;
  int multiUnitMinCreditScore;
  int manufacturedMinCreditScore;
  String creditCitation;
  String multiUnitCreditCitation;
  String manufacturedCreditCitation;

  double maxDti;
  String dtiCitation;

  double maxLtv;
  double reducedMaxLtv;
  String ltvCitation;
  String multiUnitLtvCitation;
  String manufacturedLtvCitation;

  String occupancyCitation;

  Set<String> eligiblePropertyTypes;
  String propertyTypeCitation;

  String loanLimitCitation;

  /**
   * LTV above 95% requires a term of at most 30 years
   */
  boolean highLtvTermLimited;
  String termCitation;

  public int minCreditScoreFor(LoanScenario scenario) {
    if (scenario.isMultiUnit()) {
      return multiUnitMinCreditScore;
    }
    if (scenario.isManufactured()) {
      return manufacturedMinCreditScore;
    }
    return minCreditScore;
  }

  public String creditCitationFor(LoanScenario scenario) {
    if (scenario.isMultiUnit()) {
      return multiUnitCreditCitation;
    }
    if (scenario.isManufactured()) {
      return manufacturedCreditCitation;
    }
    return creditCitation;
  }

  public double maxLtvFor(LoanScenario scenario) {
    return scenario.isMultiUnit() || scenario.isManufactured() ? reducedMaxLtv : maxLtv;
  }

  public String ltvCitationFor(LoanScenario scenario) {
    if (scenario.isManufactured()) {
      return manufacturedLtvCitation;
    }
    if (scenario.isMultiUnit()) {
      return multiUnitLtvCitation;
    }
    return ltvCitation;
  }

  public boolean allowsPropertyType(String propertyType) {
    return propertyType != null
      && eligiblePropertyTypes.contains(propertyType.toLowerCase(Locale.ROOT));
  }

  /**
   * Eligible property types, alphabetically joined
   */
  public String eligiblePropertyTypesText() {
    return String.join(", ", new TreeSet<>(eligiblePropertyTypes));
  }
}
