package com.github.spud.sage.domain.state;

/**
 * Fix Finder 状态枚举
 * <pre>
 * INIT → ITERATING → TOOL_EXECUTION → ITERATING (循环) → TERMINAL → FINALIZING → DONE
 * 超时 / 失败直接进入 FINALIZING
 * </pre>
 */
public enum FixFinderState {
  /**
   * 已创建，尚未调用模型
   */
  INIT,

  /**
   * 调用模型决定下一步
   */
  ITERATING,

  /**
   * 执行模型请求的工具
   */
  TOOL_EXECUTION,

  /**
   * 循环结束，等待最终分析
   */
  TERMINAL,

  /**
   * 组装最终结果
   */
  FINALIZING,

  /**
   * 完成（终态）
   */
  DONE
}
