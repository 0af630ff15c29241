package com.z254.robi.llm.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.robi.config.RobiProperties;
import com.z254.robi.llm.LLMChunk;
import com.z254.robi.llm.LLMProvider;
import com.z254.robi.llm.LLMRequest;
import com.z254.robi.llm.LLMResponse;
import com.z254.robi.llm.MediaPart;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Gemini provider, spoken to through Google's OpenAI-compatible chat completions endpoint.
 * Media parts are sent inline: images and video as data URIs, audio as {@code input_audio}.
 */
@Component
@ConditionalOnProperty(prefix = "robi.llm.gemini", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class GeminiProvider implements LLMProvider {

    private static final String PROVIDER_ID = "gemini";
    private static final String CHAT_COMPLETIONS_PATH = "/chat/completions";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final RobiProperties.LLMProperties.GeminiProperties config;
    private final Timer llmCallTimer;
    private final Counter llmCallCounter;
    private final Counter llmErrorCounter;

    public GeminiProvider(
            RobiProperties robiProperties,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry,
            WebClient.Builder webClientBuilder) {
        this.config = robiProperties.getLlm().getGemini();
        this.objectMapper = objectMapper;

        this.webClient = webClientBuilder
                .baseUrl(config.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .build();

        this.llmCallTimer = Timer.builder("robi.llm.call.latency")
                .tag("provider", PROVIDER_ID)
                .register(meterRegistry);
        this.llmCallCounter = Counter.builder("robi.llm.calls")
                .tag("provider", PROVIDER_ID)
                .register(meterRegistry);
        this.llmErrorCounter = Counter.builder("robi.llm.errors")
                .tag("provider", PROVIDER_ID)
                .register(meterRegistry);
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public String getDefaultModel() {
        return config.getModel();
    }

    @Override
    @CircuitBreaker(name = "gemini")
    @Retry(name = "llm")
    public Mono<LLMResponse> complete(LLMRequest request) {
        llmCallCounter.increment();
        long startTime = System.currentTimeMillis();

        Map<String, Object> body = buildRequestBody(request, false);

        return webClient.post()
                .uri(CHAT_COMPLETIONS_PATH)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(config.getTimeout())
                .map(json -> parseResponse(json, startTime))
                .doOnSuccess(response -> {
                    long duration = System.currentTimeMillis() - startTime;
                    llmCallTimer.record(Duration.ofMillis(duration));
                    log.debug("Gemini completion: {}ms, {} tokens", duration, response.getTotalTokens());
                })
                .doOnError(e -> {
                    llmErrorCounter.increment();
                    log.error("Gemini completion error: {}", e.getMessage());
                });
    }

    @Override
    @CircuitBreaker(name = "gemini")
    public Flux<LLMChunk> stream(LLMRequest request) {
        llmCallCounter.increment();
        long startTime = System.currentTimeMillis();

        Map<String, Object> body = buildRequestBody(request, true);

        return webClient.post()
                .uri(CHAT_COMPLETIONS_PATH)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(body)
                .retrieve()
                .bodyToFlux(String.class)
                .filter(line -> !line.isEmpty() && !line.equals("[DONE]"))
                .map(line -> {
                    // SSE format: data: {...}
                    if (line.startsWith("data: ")) {
                        line = line.substring(6);
                    }
                    if (line.equals("[DONE]")) {
                        return LLMChunk.finished(null, request.getModel(), LLMResponse.FinishReason.STOP);
                    }
                    return parseStreamChunk(line);
                })
                .filter(Objects::nonNull)
                .doOnComplete(() -> llmCallTimer.record(Duration.ofMillis(System.currentTimeMillis() - startTime)))
                .doOnError(e -> {
                    llmErrorCounter.increment();
                    log.error("Gemini streaming error: {}", e.getMessage());
                });
    }

    @Override
    public Mono<Boolean> isAvailable() {
        return webClient.get()
                .uri("/models")
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(Duration.ofSeconds(5))
                .map(json -> true)
                .onErrorReturn(false);
    }

    Map<String, Object> buildRequestBody(LLMRequest request, boolean stream) {
        Map<String, Object> body = new HashMap<>();

        body.put("model", request.getModel() != null ? request.getModel() : config.getModel());
        body.put("stream", stream);
        body.put("messages", request.getMessages().stream().map(this::convertMessage).toList());

        if (request.getTemperature() != null) {
            body.put("temperature", request.getTemperature());
        }
        body.put("max_tokens", request.getMaxTokens() != null ? request.getMaxTokens() : config.getMaxTokens());

        return body;
    }

    private Map<String, Object> convertMessage(LLMRequest.Message message) {
        Map<String, Object> msg = new HashMap<>();
        msg.put("role", message.getRole());

        if (!message.hasMedia()) {
            msg.put("content", message.getContent() != null ? message.getContent() : "");
            return msg;
        }

        List<Map<String, Object>> parts = new ArrayList<>();
        if (message.getContent() != null && !message.getContent().isBlank()) {
            parts.add(Map.of("type", "text", "text", message.getContent()));
        }
        for (MediaPart part : message.getMedia()) {
            parts.add(convertMedia(part));
        }
        msg.put("content", parts);
        return msg;
    }

    private Map<String, Object> convertMedia(MediaPart part) {
        String base64 = Base64.getEncoder().encodeToString(part.data());
        if (part.kind() == MediaPart.Kind.AUDIO) {
            return Map.of("type", "input_audio",
                    "input_audio", Map.of("data", base64, "format", audioFormat(part.mimeType())));
        }
        return Map.of("type", "image_url",
                "image_url", Map.of("url", "data:" + part.mimeType() + ";base64," + base64));
    }

    private static String audioFormat(String mimeType) {
        String subtype = mimeType.contains("/") ? mimeType.substring(mimeType.indexOf('/') + 1) : mimeType;
        return switch (subtype.toLowerCase(Locale.ROOT)) {
            case "mpeg", "mp3" -> "mp3";
            case "ogg", "opus" -> "ogg";
            case "webm" -> "webm";
            default -> "wav";
        };
    }

    private LLMResponse parseResponse(JsonNode json, long startTime) {
        JsonNode choice = json.path("choices").path(0);
        JsonNode message = choice.path("message");

        String content = message.hasNonNull("content") ? message.get("content").asText() : null;

        LLMResponse.Usage usage = null;
        if (json.has("usage")) {
            JsonNode usageNode = json.get("usage");
            usage = LLMResponse.Usage.builder()
                    .promptTokens(usageNode.path("prompt_tokens").asInt())
                    .completionTokens(usageNode.path("completion_tokens").asInt())
                    .totalTokens(usageNode.path("total_tokens").asInt())
                    .build();
        }

        return LLMResponse.builder()
                .id(json.path("id").asText(null))
                .model(json.path("model").asText(config.getModel()))
                .providerId(PROVIDER_ID)
                .content(content)
                .finishReason(parseFinishReason(choice.path("finish_reason").asText("stop")))
                .usage(usage)
                .latencyMs(System.currentTimeMillis() - startTime)
                .build();
    }

    LLMChunk parseStreamChunk(String line) {
        try {
            JsonNode json = objectMapper.readTree(line);

            if (!json.has("choices") || json.get("choices").isEmpty()) {
                return null;
            }

            JsonNode choice = json.get("choices").get(0);
            JsonNode delta = choice.path("delta");

            String contentDelta = delta.hasNonNull("content") ? delta.get("content").asText() : null;

            boolean finished = choice.hasNonNull("finish_reason");
            LLMResponse.FinishReason finishReason = finished
                    ? parseFinishReason(choice.get("finish_reason").asText())
                    : null;

            return LLMChunk.builder()
                    .id(json.path("id").asText(null))
                    .model(json.path("model").asText(null))
                    .contentDelta(contentDelta)
                    .finished(finished)
                    .finishReason(finishReason)
                    .build();
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse stream chunk: {}", e.getMessage());
            return null;
        }
    }

    private LLMResponse.FinishReason parseFinishReason(String reason) {
        return switch (reason) {
            case "length" -> LLMResponse.FinishReason.LENGTH;
            case "content_filter" -> LLMResponse.FinishReason.CONTENT_FILTER;
            default -> LLMResponse.FinishReason.STOP;
        };
    }
}
