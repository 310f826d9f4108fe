package com.github.spud.sage.domain.loan;

import lombok.Builder;
import lombok.Value;

/**
 * 贷款场景输入（不可变）
 * <p>
 * 派生值 LTV / 月收入按需计算，不存储；模拟场景通过 {@link #toBuilder()} 生成副本
 */
@Value
@Builder(toBuilder = true)
public class LoanScenario {

  int creditScore;

  double annualIncome;

  boolean firstTimeBuyer;

  double loanAmount;

  double propertyValue;

  @Builder.Default
  int loanTermYears = 30;

  double monthlyDebtPayments;

  /**
   * single_family | condo | pud | 2_unit | 3_unit | 4_unit | manufactured | coop
   */
  @Builder.Default
  String propertyType = "single_family";

  @Builder.Default
  String propertyState = "";

  @Builder.Default
  String propertyCounty = "";

  /**
   * primary | secondary | investment
   */
  @Builder.Default
  String occupancy = "primary";

  public double monthlyIncome() {
    return annualIncome / 12;
  }

  public boolean isMultiUnit() {
    return "2_unit".equals(propertyType) || "3_unit".equals(propertyType)
      || "4_unit".equals(propertyType);
  }

  public boolean isManufactured() {
    return "manufactured".equals(propertyType);
  }

  /**
   * Property type as prose, e.g. {@code single family}
   */
  public String propertyTypeLabel() {
    return propertyType == null ? "" : propertyType.replace('_', ' ');
  }
}
