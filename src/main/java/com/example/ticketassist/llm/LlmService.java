package com.example.ticketassist.llm;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Service;

import com.example.ticketassist.config.AppConfig;
import com.example.ticketassist.telemetry.CollaboratorErrors;

/**
 * Hosted or local chat backend behind {@link GenerationClient}. Retries each provider with
 * jittered backoff before falling back to the secondary provider. Auth and invalid-request
 * failures are not retried. When both providers fail, the fallback's failure is thrown with the
 * primary's attached as suppressed.
 */
@Service
public class LlmService implements GenerationClient {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);
    private static final int MAX_RETRIES = 3;
    private static final long MIN_BACKOFF_MS = 1000;
    private static final long MAX_BACKOFF_MS = 10000;

    static final String SYSTEM_PROMPT = "Return exactly what the user asks. No extra text.";

    private final ChatModel primaryModel;
    private final ChatModel fallbackModel;
    private final AppConfig config;
    private final Tracer tracer;
    private final DoubleHistogram tokenUsage;
    private final DoubleHistogram operationDuration;
    private final LongCounter retryCounter;
    private final LongCounter fallbackCounter;
    private final LongCounter errorCounter;

    public LlmService(Map<String, ChatModel> chatModels, AppConfig config) {
        this.primaryModel = LlmConfig.resolveChatModel(config.provider(), chatModels);
        this.fallbackModel = LlmConfig.resolveChatModel(config.fallbackProvider(), chatModels);
        this.config = config;
        log.info("Primary LLM: {} (model={}), Fallback: {} (model={})",
            config.provider(), config.model(), config.fallbackProvider(), config.fallbackModel());

        this.tracer = GlobalOpenTelemetry.getTracer("ticket-assist");
        Meter meter = GlobalOpenTelemetry.getMeter("ticket-assist");

        this.tokenUsage = meter.histogramBuilder("gen_ai.client.token.usage")
            .setUnit("{token}").build();
        this.operationDuration = meter.histogramBuilder("gen_ai.client.operation.duration")
            .setUnit("s").build();
        this.retryCounter = meter.counterBuilder("gen_ai.client.retry.count")
            .build();
        this.fallbackCounter = meter.counterBuilder("gen_ai.client.fallback.count")
            .build();
        this.errorCounter = meter.counterBuilder("gen_ai.client.error.count")
            .build();
    }

    @Override
    public String complete(String prompt) {
        return generate(SYSTEM_PROMPT, prompt).content();
    }

    public LlmResponse generate(String systemPrompt, String userPrompt) {
        try {
            return generateWithRetry(primaryModel, config.provider(), config.model(), systemPrompt, userPrompt);
        } catch (RuntimeException primaryError) {
            log.warn("Primary provider {} failed, falling back to {}", config.provider(), config.fallbackProvider());
            fallbackCounter.add(1);
            try {
                return generateWithRetry(fallbackModel, config.fallbackProvider(), config.fallbackModel(),
                    systemPrompt, userPrompt);
            } catch (RuntimeException fallbackError) {
                if (fallbackError != primaryError) {
                    fallbackError.addSuppressed(primaryError);
                }
                throw fallbackError;
            }
        }
    }

    /** Rethrows the last failure once retries are exhausted or the failure is not retryable. */
    private LlmResponse generateWithRetry(
        ChatModel chatModel, String providerName, String model, String systemPrompt, String userPrompt
    ) {
        RuntimeException lastError = null;
        for (int attempt = 0; attempt < MAX_RETRIES; attempt++) {
            try {
                return generateOnce(chatModel, providerName, model, systemPrompt, userPrompt);
            } catch (RuntimeException e) {
                lastError = e;
                String errorType = CollaboratorErrors.classify(e);
                log.warn("LLM call failed (attempt {}/{}): provider={} model={} error={}",
                    attempt + 1, MAX_RETRIES, providerName, model, e.getMessage());
                if (!isRetryable(errorType)) {
                    log.error("Not retrying {} from provider={}", errorType, providerName);
                    throw e;
                }
                if (attempt > 0) {
                    retryCounter.add(1, providerModelAttrs(providerName, model));
                }
                if (attempt < MAX_RETRIES - 1) {
                    sleep(backoffWithJitter(attempt));
                }
            }
        }
        log.error("All {} retries exhausted for provider={}", MAX_RETRIES, providerName, lastError);
        throw lastError;
    }

    static boolean isRetryable(String errorType) {
        return !"auth_error".equals(errorType) && !"invalid_request".equals(errorType);
    }

    private LlmResponse generateOnce(
        ChatModel chatModel, String providerName, String model, String systemPrompt, String userPrompt
    ) {
        long start = System.nanoTime();

        Span span = tracer.spanBuilder("gen_ai.chat " + model)
            .setAttribute("gen_ai.operation.name", "chat")
            .setAttribute("gen_ai.provider.name", providerName)
            .setAttribute("gen_ai.request.model", model)
            .setAttribute("server.address", LlmConfig.PROVIDER_SERVERS.getOrDefault(providerName, "unknown"))
            .setAttribute("server.port", (long) LlmConfig.PROVIDER_PORTS.getOrDefault(providerName, 443))
            .setAttribute("gen_ai.request.temperature", config.temperature())
            .setAttribute("gen_ai.request.max_tokens", (long) config.maxTokens())
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            ChatResponse response = chatModel.call(buildPrompt(systemPrompt, userPrompt, model));

            var generation = response.getResult();
            var usage = response.getMetadata().getUsage();

            String content = generation.getOutput().getText();
            int inputTokens = usage != null && usage.getPromptTokens() != null ? usage.getPromptTokens() : 0;
            int outputTokens = usage != null && usage.getCompletionTokens() != null ? usage.getCompletionTokens() : 0;
            String responseModel = response.getMetadata().getModel() != null
                ? response.getMetadata().getModel() : model;
            String finishReason = generation.getMetadata().getFinishReason() != null
                ? generation.getMetadata().getFinishReason() : "";
            double duration = (System.nanoTime() - start) / 1_000_000_000.0;

            span.setAttribute("gen_ai.response.model", responseModel);
            span.setAttribute("gen_ai.usage.input_tokens", (long) inputTokens);
            span.setAttribute("gen_ai.usage.output_tokens", (long) outputTokens);
            if (!finishReason.isEmpty()) {
                span.setAttribute("gen_ai.response.finish_reasons", finishReason);
            }

            var attrs = providerModelAttrs(providerName, responseModel);
            tokenUsage.record(inputTokens, withTokenType(attrs, "input"));
            tokenUsage.record(outputTokens, withTokenType(attrs, "output"));
            operationDuration.record(duration, attrs);

            log.debug("LLM call complete: provider={} model={} tokens(in={}, out={}) in {}s",
                providerName, responseModel, inputTokens, outputTokens, String.format("%.2f", duration));
            return new LlmResponse(content, responseModel, providerName, inputTokens, outputTokens, finishReason);

        } catch (Exception e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.setAttribute("error.type", CollaboratorErrors.classify(e));
            errorCounter.add(1, Attributes.of(
                AttributeKey.stringKey("gen_ai.provider.name"), providerName,
                AttributeKey.stringKey("gen_ai.request.model"), model,
                AttributeKey.stringKey("error.type"), CollaboratorErrors.classify(e)
            ));
            throw e;
        } finally {
            span.end();
        }
    }

    private Prompt buildPrompt(String systemPrompt, String userPrompt, String model) {
        var messages = new ArrayList<Message>();
        if (systemPrompt != null && !systemPrompt.isEmpty()) {
            messages.add(new SystemMessage(systemPrompt));
        }
        messages.add(new UserMessage(userPrompt));

        var options = ChatOptions.builder()
            .model(model)
            .temperature(config.temperature())
            .maxTokens(config.maxTokens())
            .build();
        return new Prompt(List.copyOf(messages), options);
    }

    private long backoffWithJitter(int attempt) {
        long base = Math.min(MIN_BACKOFF_MS * (1L << attempt), MAX_BACKOFF_MS);
        long jitter = ThreadLocalRandom.current().nextLong(0, base / 4 + 1);
        return base + jitter;
    }

    private void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static Attributes providerModelAttrs(String provider, String model) {
        return Attributes.of(
            AttributeKey.stringKey("gen_ai.operation.name"), "chat",
            AttributeKey.stringKey("gen_ai.provider.name"), provider,
            AttributeKey.stringKey("gen_ai.request.model"), model
        );
    }

    private static Attributes withTokenType(Attributes base, String tokenType) {
        return base.toBuilder()
            .put(AttributeKey.stringKey("gen_ai.token.type"), tokenType)
            .build();
    }
}
