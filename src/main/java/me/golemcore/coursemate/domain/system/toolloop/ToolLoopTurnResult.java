package me.golemcore.coursemate.domain.system.toolloop;

import me.golemcore.coursemate.domain.model.RunContext;

/** Outcome of one query run through the tool loop. */
public record ToolLoopTurnResult(RunContext context, String answer, int llmCalls, int toolExecutions,
        boolean forcedFinal) {
}
