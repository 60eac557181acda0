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

package me.golemcore.careergraph.adapter.outbound.llm;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.careergraph.domain.exception.GraphErrorKind;
import me.golemcore.careergraph.domain.exception.GraphException;
import me.golemcore.careergraph.infrastructure.config.CareerGraphProperties;
import me.golemcore.careergraph.port.outbound.ExplanationPort;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/**
 * Explanation generator backed by a langchain4j chat model.
 *
 * <p>
 * Both supported providers speak the OpenAI chat protocol: {@code ollama}
 * targets a local Ollama server through its {@code /v1} endpoint, {@code openai}
 * targets the OpenAI API (or any compatible base URL). Provider {@code none}, or
 * {@code careergraph.explanation.enabled=false}, leaves the generator
 * unavailable.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jExplanationAdapter implements ExplanationPort {

    private static final String OLLAMA = "ollama";
    private static final String OPENAI = "openai";
    private static final String OLLAMA_PLACEHOLDER_KEY = "ollama";

    private final CareerGraphProperties properties;

    private volatile ChatModel chatModel;
    private volatile boolean initialized = false;

    private synchronized void ensureInitialized() {
        if (initialized)
            return;

        CareerGraphProperties.ExplanationProperties config = properties.getExplanation();
        String provider = providerOf(config);
        if (!config.isEnabled() || (!OLLAMA.equals(provider) && !OPENAI.equals(provider))) {
            log.info("[Explain] Explanation generator disabled (provider: {})", provider);
            initialized = true;
            return;
        }

        String apiKey = config.getApiKey();
        if (OPENAI.equals(provider) && (apiKey == null || apiKey.isBlank())) {
            log.warn("[Explain] OpenAI API key not configured, explanation generator unavailable");
            initialized = true;
            return;
        }

        try {
            var builder = OpenAiChatModel.builder()
                    .apiKey(apiKey != null && !apiKey.isBlank() ? apiKey : OLLAMA_PLACEHOLDER_KEY)
                    .modelName(config.getModel())
                    .maxRetries(0)
                    .timeout(config.getTimeout());

            if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
                builder.baseUrl(config.getBaseUrl());
            }

            chatModel = builder.build();
            log.info("[Explain] Explanation generator initialized: {} / {}", provider, config.getModel());
        } catch (RuntimeException e) {
            log.error("[Explain] Failed to initialize explanation generator", e);
        }

        initialized = true;
    }

    @Override
    public CompletableFuture<String> generate(String prompt) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            ChatModel model = chatModel;
            if (model == null) {
                throw new GraphException(GraphErrorKind.GENERATOR_UNAVAILABLE, "Explanation generator not available");
            }
            String text = model.chat(prompt);
            if (text == null || text.isBlank()) {
                throw new GraphException(GraphErrorKind.GENERATOR_UNAVAILABLE, "Explanation generator returned no text");
            }
            return text.trim();
        });
    }

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return chatModel != null;
    }

    @Override
    public String getProviderId() {
        return providerOf(properties.getExplanation());
    }

    private static String providerOf(CareerGraphProperties.ExplanationProperties config) {
        String provider = config.getProvider();
        return provider != null ? provider.trim().toLowerCase(Locale.ROOT) : "none";
    }
}
