package me.golemcore.coursemate.domain.system.toolloop;

import me.golemcore.coursemate.domain.model.RunContext;

/**
 * Bounded tool-calling loop: drives LLM calls and tool executions for one
 * query until a final answer exists.
 */
public interface ToolLoopSystem {

    ToolLoopTurnResult processTurn(RunContext context, int maxRounds);
}
