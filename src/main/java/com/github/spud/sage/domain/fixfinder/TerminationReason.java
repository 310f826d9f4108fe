package com.github.spud.sage.domain.fixfinder;

/**
 * ReAct 循环终止原因
 */
public enum TerminationReason {
  COMPLETED,        // 模型未请求工具或发出完成信号
  MAX_ITERATIONS,   // 达到最大迭代次数
  TIMEOUT,          // 调用超时
  ERROR             // 执行错误
}
