package me.golemcore.coder.adapter.outbound.llm;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicStreamingChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import dev.langchain4j.model.output.FinishReason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.domain.model.ConversationMessage;
import me.golemcore.coder.domain.model.ModelInfo;
import me.golemcore.coder.domain.model.ProviderException;
import me.golemcore.coder.domain.model.StepUsage;
import me.golemcore.coder.domain.model.StreamEvent;
import me.golemcore.coder.domain.model.StreamRequest;
import me.golemcore.coder.domain.system.LlmErrorClassifier;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Model stream adapter backed by langchain4j streaming chat models.
 *
 * <p>
 * Bridges the callback API of {@link StreamingChatModel} to stream events:
 * every response becomes one step with a single text part, followed by a
 * tool-input-start and tool-call pair for each requested tool. Anthropic models
 * are selected by provider id {@code anthropic}; everything else goes through
 * the OpenAI-compatible client.
 *
 * <p>
 * Rate limit errors carrying a {@code reset_seconds} hint are rethrown as
 * {@link ProviderException} with a retry-after delay.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jStreamAdapter implements LlmStreamProviderAdapter {

    private static final String PROVIDER_ID = "langchain4j";
    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String TEXT_ID = "text-0";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };
    private static final Pattern RESET_SECONDS_PATTERN = Pattern.compile("\"reset_seconds\"\\s*:\\s*(\\d+)");

    private final CoderProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public boolean isAvailable() {
        String apiKey = properties.getLlm().getLangchain4j().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public Flux<StreamEvent> stream(StreamRequest request) {
        return Flux.create(sink -> {
            EventBridge bridge = new EventBridge(sink);
            sink.onDispose(bridge::detach);
            StreamingChatModel model = createModel(request.model());
            sink.next(new StreamEvent.Start());
            sink.next(new StreamEvent.StartStep());
            model.chat(toChatRequest(request), bridge);
        });
    }

    // Visible for testing
    StreamingChatModel createModel(ModelInfo model) {
        CoderProperties.Langchain4jProperties config = properties.getLlm().getLangchain4j();
        String modelName = model != null && model.modelId() != null ? model.modelId() : config.getDefaultModel();
        if (model != null && PROVIDER_ANTHROPIC.equals(model.providerId())) {
            var builder = AnthropicStreamingChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(modelName)
                    .timeout(config.getTimeout());
            if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
                builder.baseUrl(config.getBaseUrl());
            }
            if (model.limit() != null && model.limit().output() > 0) {
                builder.maxTokens(model.limit().output());
            }
            return builder.build();
        }
        var builder = OpenAiStreamingChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .timeout(config.getTimeout());
        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private ChatRequest toChatRequest(StreamRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.systemPrompt()));
        }
        if (request.messages() != null) {
            for (ConversationMessage message : request.messages()) {
                if ("assistant".equals(message.role())) {
                    messages.add(AiMessage.from(message.content()));
                } else {
                    messages.add(UserMessage.from(message.content()));
                }
            }
        }
        return ChatRequest.builder().messages(messages).build();
    }

    private final class EventBridge implements StreamingChatResponseHandler {

        private final FluxSink<StreamEvent> sink;
        private final AtomicBoolean textStarted = new AtomicBoolean();
        private final AtomicBoolean detached = new AtomicBoolean();

        private EventBridge(FluxSink<StreamEvent> sink) {
            this.sink = sink;
        }

        private void detach() {
            detached.set(true);
        }

        private boolean isDetached(String callback) {
            if (detached.get()) {
                log.debug("[LLM] dropping {} callback, stream subscriber is gone", callback);
                return true;
            }
            return false;
        }

        @Override
        public void onPartialResponse(String partialResponse) {
            if (isDetached("partial response")) {
                return;
            }
            if (partialResponse == null || partialResponse.isEmpty()) {
                return;
            }
            if (textStarted.compareAndSet(false, true)) {
                sink.next(new StreamEvent.TextStart(TEXT_ID, null));
            }
            sink.next(new StreamEvent.TextDelta(TEXT_ID, partialResponse, null));
        }

        @Override
        public void onCompleteResponse(ChatResponse response) {
            if (isDetached("complete response")) {
                return;
            }
            if (textStarted.get()) {
                sink.next(new StreamEvent.TextEnd(TEXT_ID, null));
            }
            AiMessage aiMessage = response.aiMessage();
            if (aiMessage != null && aiMessage.hasToolExecutionRequests()) {
                for (ToolExecutionRequest toolRequest : aiMessage.toolExecutionRequests()) {
                    sink.next(new StreamEvent.ToolInputStart(toolRequest.id(), toolRequest.name()));
                    sink.next(new StreamEvent.ToolInputEnd(toolRequest.id()));
                    sink.next(new StreamEvent.ToolCall(toolRequest.id(), toolRequest.name(),
                            parseJsonArgs(toolRequest.arguments()), null));
                }
            }
            String finishReason = mapFinishReason(response.finishReason());
            sink.next(new StreamEvent.FinishStep(finishReason, toStepUsage(response), null));
            sink.next(new StreamEvent.Finish(finishReason));
            sink.complete();
        }

        @Override
        public void onError(Throwable error) {
            if (isDetached("error")) {
                log.debug("[LLM] late stream error: {}", error.getMessage());
                return;
            }
            sink.error(withRetryHint(error));
        }
    }

    private StepUsage toStepUsage(ChatResponse response) {
        dev.langchain4j.model.output.TokenUsage usage = response.tokenUsage();
        if (usage == null) {
            return StepUsage.builder().build();
        }
        return StepUsage.builder()
                .inputTokens(usage.inputTokenCount() != null ? usage.inputTokenCount() : 0)
                .outputTokens(usage.outputTokenCount() != null ? usage.outputTokenCount() : 0)
                .build();
    }

    static String mapFinishReason(FinishReason reason) {
        if (reason == null) {
            return "unknown";
        }
        switch (reason) {
        case STOP:
            return "stop";
        case LENGTH:
            return "length";
        case TOOL_EXECUTION:
            return "tool-calls";
        case CONTENT_FILTER:
            return "content-filter";
        default:
            return "other";
        }
    }

    private Throwable withRetryHint(Throwable error) {
        String code = LlmErrorClassifier.classifyFromThrowable(error);
        if (!LlmErrorClassifier.isRateLimitCode(code)) {
            return error;
        }
        long resetSeconds = extractResetSeconds(error);
        Long retryAfterMs = resetSeconds > 0 ? resetSeconds * 1000 + 1000 : null;
        log.warn("[LLM] Rate limit hit{}", resetSeconds > 0 ? " (server requested " + resetSeconds + "s)" : "");
        return new ProviderException(PROVIDER_ID, 429, error.getMessage(), retryAfterMs, Boolean.TRUE, error);
    }

    private long extractResetSeconds(Throwable e) {
        Throwable current = e;
        while (current != null) {
            String msg = current.getMessage();
            if (msg != null && msg.contains("reset_seconds")) {
                Matcher matcher = RESET_SECONDS_PATTERN.matcher(msg);
                if (matcher.find()) {
                    try {
                        return Long.parseLong(matcher.group(1));
                    } catch (NumberFormatException ignored) {
                        // fall through
                    }
                }
            }
            current = current.getCause();
        }
        return -1;
    }

    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse tool arguments: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }
}
