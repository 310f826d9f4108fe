package com.github.spud.sage.domain.rules;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 规则引擎配置属性
 */
@Data
@Component
@ConfigurationProperties(prefix = "app.rules")
public class RulesProperties {

  /**
   * 高成本地区合规贷款上限（FHFA 2026），资格检查使用此值
   */
  private long highCostLoanLimit = 1_249_125;

  /**
   * 估算月供使用的年利率
   */
  private double assumedAnnualRate = 0.06;

  /**
   * 房产税与保险年费率（按房产价值）
   */
  private double taxInsuranceRate = 0.015;
}
