package com.github.spud.sage.domain.state;

import java.util.EnumSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.StateMachineEventResult;
import org.springframework.statemachine.config.StateMachineBuilder;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * 状态机驱动器 - 编排器与 StateMachine 的适配层
 * <pre>
 * 状态流转:
 *   INIT --(START)--> ITERATING
 *   ITERATING --(TOOLS_REQUESTED)--> TOOL_EXECUTION
 *   TOOL_EXECUTION --(TOOLS_DONE)--> ITERATING
 *   ITERATING | TOOL_EXECUTION --(COMPLETE)--> TERMINAL
 *   ITERATING --(MAX_ITERATIONS)--> TERMINAL
 *   ITERATING | TOOL_EXECUTION --(FAIL)--> TERMINAL
 *   TERMINAL --(FINALIZE)--> FINALIZING
 *   ITERATING | TOOL_EXECUTION --(TIMEOUT)--> FINALIZING
 *   INIT | TERMINAL --(FAIL)--> FINALIZING
 *   FINALIZING --(FINISHED)--> DONE
 * </pre>
 * 每次请求构建独立实例，不跨请求共享
 */
@Slf4j
@Component
public class StateMachineDriver {

  /**
   * 为一次 findFixes 调用创建并启动状态机
   */
  public StateMachine<FixFinderState, FixFinderEvent> create(String machineId) {
    StateMachine<FixFinderState, FixFinderEvent> sm;
    try {
      sm = build(machineId);
    } catch (Exception e) {
      throw new IllegalStateException("Failed to build fix finder state machine", e);
    }
    sm.startReactively().block();
    return sm;
  }

  static StateMachine<FixFinderState, FixFinderEvent> build(String machineId) throws Exception {
    StateMachineBuilder.Builder<FixFinderState, FixFinderEvent> builder =
      StateMachineBuilder.builder();

    builder.configureConfiguration()
      .withConfiguration()
      .machineId(machineId)
      .autoStartup(false);

    builder.configureStates()
      .withStates()
      .initial(FixFinderState.INIT)
      .states(EnumSet.allOf(FixFinderState.class))
      .end(FixFinderState.DONE);

    builder.configureTransitions()
      .withExternal()
      .source(FixFinderState.INIT).target(FixFinderState.ITERATING)
      .event(FixFinderEvent.START)
      .and()

      // 模型请求工具
      .withExternal()
      .source(FixFinderState.ITERATING).target(FixFinderState.TOOL_EXECUTION)
      .event(FixFinderEvent.TOOLS_REQUESTED)
      .and()
      .withExternal()
      .source(FixFinderState.TOOL_EXECUTION).target(FixFinderState.ITERATING)
      .event(FixFinderEvent.TOOLS_DONE)
      .and()

      // 循环正常结束
      .withExternal()
      .source(FixFinderState.ITERATING).target(FixFinderState.TERMINAL)
      .event(FixFinderEvent.COMPLETE)
      .and()
      .withExternal()
      .source(FixFinderState.TOOL_EXECUTION).target(FixFinderState.TERMINAL)
      .event(FixFinderEvent.COMPLETE)
      .and()
      .withExternal()
      .source(FixFinderState.ITERATING).target(FixFinderState.TERMINAL)
      .event(FixFinderEvent.MAX_ITERATIONS)
      .and()

      // 迭代出错仍进入最终分析
      .withExternal()
      .source(FixFinderState.ITERATING).target(FixFinderState.TERMINAL)
      .event(FixFinderEvent.FAIL)
      .and()
      .withExternal()
      .source(FixFinderState.TOOL_EXECUTION).target(FixFinderState.TERMINAL)
      .event(FixFinderEvent.FAIL)
      .and()
      .withExternal()
      .source(FixFinderState.TERMINAL).target(FixFinderState.FINALIZING)
      .event(FixFinderEvent.FINALIZE)
      .and()

      // 超时直接进入 FINALIZING，跳过最终分析
      .withExternal()
      .source(FixFinderState.INIT).target(FixFinderState.FINALIZING)
      .event(FixFinderEvent.FAIL)
      .and()
      .withExternal()
      .source(FixFinderState.ITERATING).target(FixFinderState.FINALIZING)
      .event(FixFinderEvent.TIMEOUT)
      .and()
      .withExternal()
      .source(FixFinderState.TOOL_EXECUTION).target(FixFinderState.FINALIZING)
      .event(FixFinderEvent.TIMEOUT)
      .and()
      .withExternal()
      .source(FixFinderState.TERMINAL).target(FixFinderState.FINALIZING)
      .event(FixFinderEvent.FAIL)
      .and()

      .withExternal()
      .source(FixFinderState.FINALIZING).target(FixFinderState.DONE)
      .event(FixFinderEvent.FINISHED);

    return builder.build();
  }

  /**
   * 获取当前状态
   */
  public FixFinderState getCurrentState(StateMachine<FixFinderState, FixFinderEvent> sm) {
    return sm.getState().getId();
  }

  /**
   * 发送事件并等待状态转换完成
   */
  public boolean sendEvent(StateMachine<FixFinderState, FixFinderEvent> sm, FixFinderEvent event) {
    log.debug("Sending event {} to state machine, current state: {}", event, getCurrentState(sm));

    StateMachineEventResult<FixFinderState, FixFinderEvent> result = sm
      .sendEvent(Mono.just(MessageBuilder.withPayload(event).build()))
      .blockFirst();

    boolean accepted = result != null
      && result.getResultType() == StateMachineEventResult.ResultType.ACCEPTED;

    if (accepted) {
      log.debug("Event {} accepted, new state: {}", event, getCurrentState(sm));
    } else {
      log.warn("Event {} rejected in state {}", event, getCurrentState(sm));
    }
    return accepted;
  }

  /**
   * 停止状态机
   */
  public void stop(StateMachine<FixFinderState, FixFinderEvent> sm) {
    sm.stopReactively().block();
  }

  public boolean isDone(StateMachine<FixFinderState, FixFinderEvent> sm) {
    return getCurrentState(sm) == FixFinderState.DONE;
  }
}
