package com.github.spud.sage.domain.state;

/**
 * Fix Finder 状态机事件
 */
public enum FixFinderEvent {
  START,
  TOOLS_REQUESTED,
  TOOLS_DONE,
  COMPLETE,
  MAX_ITERATIONS,
  FINALIZE,
  TIMEOUT,
  FAIL,
  FINISHED
}
