package me.golemcore.coursemate.domain.system.toolloop;

import me.golemcore.coursemate.domain.model.LlmRequest;
import me.golemcore.coursemate.domain.model.LlmResponse;
import me.golemcore.coursemate.domain.model.LlmUsage;
import me.golemcore.coursemate.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Decorator around {@link LlmPort} that logs token usage and latency after each
 * chat completion call.
 */
class UsageLoggingLlmPortDecorator implements LlmPort {

    private static final Logger log = LoggerFactory.getLogger(UsageLoggingLlmPortDecorator.class);

    private final LlmPort delegate;

    UsageLoggingLlmPortDecorator(LlmPort delegate) {
        this.delegate = delegate;
    }

    @Override
    public String getProviderId() {
        return delegate.getProviderId();
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        Instant start = Instant.now();
        return delegate.chat(request).thenApply(response -> {
            logUsage(request, response, start);
            return response;
        });
    }

    @Override
    public String getCurrentModel() {
        return delegate.getCurrentModel();
    }

    private void logUsage(LlmRequest request, LlmResponse response, Instant start) {
        if (response == null || response.getUsage() == null) {
            return;
        }
        LlmUsage usage = response.getUsage();
        String model = response.getModel() != null ? response.getModel() : delegate.getCurrentModel();
        log.info("[LLM] {}/{} session={} tokens in={} out={} latency={}ms",
                delegate.getProviderId(), model, request.getSessionId(),
                usage.getInputTokens(), usage.getOutputTokens(),
                Duration.between(start, Instant.now()).toMillis());
    }
}
