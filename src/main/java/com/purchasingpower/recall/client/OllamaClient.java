package com.purchasingpower.recall.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.recall.configuration.AppProperties;
import com.purchasingpower.recall.configuration.OllamaProperties;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Ollama LLM provider using the /api/chat endpoint in native JSON mode.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OllamaClient implements LLMProvider {

    private static final String SYSTEM_PROMPT =
        "You are the reflection engine of a personal knowledge graph. Output only valid JSON. Do not include conversational filler.";

    private final AppProperties properties;
    private WebClient ollamaWebClient;

    @PostConstruct
    public void init() {
        OllamaProperties ollama = properties.getOllama();
        int timeoutSeconds = ollama.getTimeoutSeconds();

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10000)
                .responseTimeout(Duration.ofSeconds(timeoutSeconds))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));

        this.ollamaWebClient = WebClient.builder()
                .baseUrl(ollama.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    @Override
    public String getProviderName() {
        return "Ollama (" + properties.getOllama().getChatModel() + ")";
    }

    @Override
    public String chat(String prompt, String purpose, String conversationId) {
        OllamaProperties ollama = properties.getOllama();
        log.info("🔵 [LLM REQUEST] Provider=Ollama, Purpose={}, Session={}, Model={}",
            purpose, conversationId, ollama.getChatModel());
        log.debug("🔵 [LLM REQUEST] Prompt length={}, First 200 chars: {}",
            prompt.length(),
            prompt.substring(0, Math.min(200, prompt.length())));

        long startTime = System.currentTimeMillis();

        Map<String, Object> body = Map.of(
                "model", ollama.getChatModel(),
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_PROMPT),
                        Map.of("role", "user", "content", prompt)
                ),
                "stream", false,
                "format", "json",
                "options", Map.of(
                        "num_ctx", ollama.getNumCtx(),
                        "temperature", 0.2,
                        "num_predict", 2048
                )
        );

        try {
            JsonNode response = ollamaWebClient.post()
                    .uri("/api/chat")
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();

            String content = response != null ? response.path("message").path("content").asText() : "";
            long latency = System.currentTimeMillis() - startTime;

            log.info("🟢 [LLM RESPONSE] Provider=Ollama, Latency={}ms, ResponseLength={}", latency, content.length());
            log.debug("🟢 [LLM RESPONSE] Content: {}", content.substring(0, Math.min(500, content.length())));
            return content;

        } catch (Exception e) {
            log.error("🔴 Ollama call failed for model {}: {}", ollama.getChatModel(), e.getMessage());
            throw new RuntimeException("Ollama chat failed. Ensure " + ollama.getChatModel() + " is downloaded and Ollama is running.", e);
        }
    }
}
