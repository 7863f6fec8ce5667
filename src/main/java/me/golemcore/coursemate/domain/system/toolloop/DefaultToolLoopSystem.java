package me.golemcore.coursemate.domain.system.toolloop;

import me.golemcore.coursemate.domain.exception.ToolNotFoundException;
import me.golemcore.coursemate.domain.model.LlmRequest;
import me.golemcore.coursemate.domain.model.LlmResponse;
import me.golemcore.coursemate.domain.model.Message;
import me.golemcore.coursemate.domain.model.RunContext;
import me.golemcore.coursemate.domain.model.ToolDefinition;
import me.golemcore.coursemate.domain.service.ToolRegistry;
import me.golemcore.coursemate.infrastructure.config.CoursemateProperties;
import me.golemcore.coursemate.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Tool loop orchestrator.
 *
 * <p>
 * Each round makes one LLM call with the registered tools offered. A final
 * response ends the run. A tool request is answered by executing every
 * invocation in order and sending all outcomes back in one user message. When
 * the round budget runs out, or a round had a failed tool execution, one more
 * call is made without tools so the model has to answer from what it has.
 *
 * <p>
 * LLM failures never escape: they become the answer text.
 */
public class DefaultToolLoopSystem implements ToolLoopSystem {

    private static final Logger log = LoggerFactory.getLogger(DefaultToolLoopSystem.class);

    private static final int DEFAULT_MAX_TOKENS = 800;

    private final LlmPort llmPort;
    private final ToolExecutorPort toolExecutor;
    private final HistoryWriter historyWriter;
    private final ToolRegistry toolRegistry;
    private final CoursemateProperties.LlmProperties settings;

    public DefaultToolLoopSystem(LlmPort llmPort, ToolExecutorPort toolExecutor, HistoryWriter historyWriter,
            ToolRegistry toolRegistry, CoursemateProperties.LlmProperties settings) {
        this.llmPort = llmPort;
        this.toolExecutor = toolExecutor;
        this.historyWriter = historyWriter;
        this.toolRegistry = toolRegistry;
        this.settings = settings;
    }

    @Override
    public ToolLoopTurnResult processTurn(RunContext context, int maxRounds) {
        ensureMessageLists(context);

        int rounds = Math.max(1, maxRounds);
        List<ToolDefinition> tools = toolRegistry != null ? toolRegistry.definitions() : List.of();

        for (int round = 1; round <= rounds; round++) {
            context.setRound(round);

            // 1) LLM call with tools offered
            LlmResponse response;
            try {
                response = llmPort.chat(buildRequest(context, tools)).join();
                context.setLlmCalls(context.getLlmCalls() + 1);
            } catch (RuntimeException e) {
                context.setLlmCalls(context.getLlmCalls() + 1);
                String error = "Error in round " + round + ": " + causeMessage(e);
                log.warn("[ToolLoop] LLM call failed in round {}: {}", round, causeMessage(e));
                return finish(context, error, error, false);
            }

            // 2) Final answer (no tool calls)
            if (response == null || !response.isToolRequest()) {
                String answer = response != null && response.getContent() != null ? response.getContent() : "";
                log.debug("[ToolLoop] Final answer in round {}", round);
                return finish(context, answer, null, false);
            }

            // 3) Append assistant message with tool calls
            historyWriter.appendAssistantToolCalls(context, response);

            // 4) Execute tools and append all outcomes in one message
            boolean roundFailed = executeTools(context, response.getToolCalls(), round);
            if (roundFailed) {
                log.info("[ToolLoop] Stopping after failed round {}", round);
                break;
            }
        }

        return forceFinalAnswer(context);
    }

    private boolean executeTools(RunContext context, List<Message.ToolCall> toolCalls, int round) {
        boolean failed = false;
        List<ToolExecutionOutcome> outcomes = new ArrayList<>();

        for (Message.ToolCall toolCall : toolCalls) {
            ToolExecutionOutcome outcome;
            try {
                outcome = toolExecutor.execute(context, toolCall);
                if (outcome == null) {
                    outcome = ToolExecutionOutcome.failure(toolCall,
                            "Tool execution failed in round " + round + ": no result");
                }
            } catch (ToolNotFoundException e) {
                log.error("[ToolLoop] Model requested unregistered tool '{}'", e.getToolName());
                outcome = ToolExecutionOutcome.failure(toolCall,
                        "Tool execution failed in round " + round + ": " + e.getMessage());
            } catch (RuntimeException e) {
                log.warn("[ToolLoop] Tool '{}' failed in round {}: {}", toolCall.getName(), round, e.getMessage());
                outcome = ToolExecutionOutcome.failure(toolCall,
                        "Tool execution failed in round " + round + ": " + causeMessage(e));
            }
            context.setToolExecutions(context.getToolExecutions() + 1);

            if (outcome.failed()) {
                failed = true;
                context.setLastError(outcome.content());
            }
            outcomes.add(outcome);
        }

        historyWriter.appendToolOutcomes(context, outcomes);
        return failed;
    }

    private ToolLoopTurnResult forceFinalAnswer(RunContext context) {
        try {
            LlmResponse response = llmPort.chat(buildRequest(context, List.of())).join();
            context.setLlmCalls(context.getLlmCalls() + 1);
            String answer = response != null && response.getContent() != null ? response.getContent() : "";
            return finish(context, answer, context.getLastError(), true);
        } catch (RuntimeException e) {
            context.setLlmCalls(context.getLlmCalls() + 1);
            String error = "Error generating final response: " + causeMessage(e);
            log.warn("[ToolLoop] Final LLM call failed: {}", causeMessage(e));
            return finish(context, error, error, true);
        }
    }

    private ToolLoopTurnResult finish(RunContext context, String answer, String error, boolean forcedFinal) {
        context.setTerminated(true);
        if (error != null) {
            context.setLastError(error);
        }
        log.debug("[ToolLoop] Done: {} LLM call(s), {} tool execution(s), forced final: {}",
                context.getLlmCalls(), context.getToolExecutions(), forcedFinal);
        return new ToolLoopTurnResult(context, answer, context.getLlmCalls(), context.getToolExecutions(),
                forcedFinal);
    }

    private void ensureMessageLists(RunContext context) {
        if (context.getMessages() == null) {
            context.setMessages(new ArrayList<>());
        }
        if (context.getSources() == null) {
            context.setSources(new ArrayList<>());
        }
    }

    private LlmRequest buildRequest(RunContext context, List<ToolDefinition> tools) {
        boolean offerTools = tools != null && !tools.isEmpty();
        return LlmRequest.builder()
                .model(settings != null ? settings.getModel() : null)
                .systemPrompt(context.getSystemPrompt())
                .messages(new ArrayList<>(context.getMessages()))
                .tools(offerTools ? tools : List.of())
                .toolChoice(offerTools ? LlmRequest.ToolChoice.AUTO : LlmRequest.ToolChoice.NONE)
                .temperature(settings != null ? settings.getTemperature() : 0.0)
                .maxTokens(settings != null ? settings.getMaxTokens() : DEFAULT_MAX_TOKENS)
                .sessionId(context.getSessionId())
                .build();
    }

    private static String causeMessage(Throwable error) {
        Throwable cursor = error;
        while ((cursor instanceof CompletionException || cursor instanceof ExecutionException)
                && cursor.getCause() != null) {
            cursor = cursor.getCause();
        }
        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }
}
