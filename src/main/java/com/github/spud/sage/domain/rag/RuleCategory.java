package com.github.spud.sage.domain.rag;

import com.github.spud.sage.domain.loan.Gse;

/**
 * 规则类别 → 每个产品一条查询模板，{@code {property_type}} 会被替换为物业类型描述
 */
public enum RuleCategory {

  CREDIT_SCORE("credit_score",
    "HomeReady minimum credit score requirements eligibility",
    "Home Possible minimum credit score requirements eligibility"),

  LTV("ltv",
    "HomeReady maximum LTV loan-to-value ratio requirements {property_type}",
    "Home Possible maximum LTV loan-to-value ratio requirements {property_type}"),

  DTI("dti",
    "HomeReady maximum DTI debt-to-income ratio requirements",
    "Home Possible maximum DTI debt-to-income ratio requirements"),

  OCCUPANCY("occupancy",
    "HomeReady occupancy requirements primary residence",
    "Home Possible occupancy requirements primary residence"),

  PROPERTY_TYPE("property_type",
    "HomeReady eligible property types {property_type}",
    "Home Possible eligible property types {property_type}"),

  INCOME_LIMIT("income_limit",
    "HomeReady income limits area median income AMI",
    "Home Possible income limits area median income AMI");

  private static final String PROPERTY_TYPE_PLACEHOLDER = "{property_type}";

  private final String tag;
  private final String homeReadyTemplate;
  private final String homePossibleTemplate;

  RuleCategory(String tag, String homeReadyTemplate, String homePossibleTemplate) {
    this.tag = tag;
    this.homeReadyTemplate = homeReadyTemplate;
    this.homePossibleTemplate = homePossibleTemplate;
  }

  public String tag() {
    return tag;
  }

  public String queryFor(Gse gse, String propertyTypeLabel) {
    String template = gse == Gse.FANNIE_MAE ? homeReadyTemplate : homePossibleTemplate;
    return template.replace(PROPERTY_TYPE_PLACEHOLDER,
      propertyTypeLabel == null ? "" : propertyTypeLabel);
  }
}
