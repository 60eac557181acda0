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

package me.golemcore.careergraph.adapter.outbound.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.careergraph.domain.exception.GraphErrorKind;
import me.golemcore.careergraph.domain.exception.GraphException;
import me.golemcore.careergraph.infrastructure.config.CareerGraphProperties;
import me.golemcore.careergraph.port.outbound.EmbeddingPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Embedding adapter using langchain4j's in-process all-MiniLM-L6-v2 model (ONNX,
 * 384 dimensions). The model is loaded lazily on first use.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code careergraph.embedding.model} - model name reported to callers
 * <li>{@code careergraph.embedding.dimension} - expected vector dimension
 * </ul>
 *
 * @see me.golemcore.careergraph.port.outbound.EmbeddingPort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jEmbeddingAdapter implements EmbeddingPort {

    private final CareerGraphProperties properties;

    private volatile EmbeddingModel embeddingModel;
    private volatile boolean initialized = false;

    private synchronized void ensureInitialized() {
        if (initialized)
            return;

        try {
            embeddingModel = new AllMiniLmL6V2EmbeddingModel();
            log.info("[Embedding] Text encoder initialized: {}", properties.getEmbedding().getModel());
        } catch (RuntimeException | LinkageError e) {
            log.error("[Embedding] Failed to initialize text encoder", e);
        }

        initialized = true;
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        return CompletableFuture.supplyAsync(() -> {
            EmbeddingModel model = requireModel();
            Response<Embedding> response = model.embed(text);
            return checkDimension(response.content().vector());
        });
    }

    @Override
    public CompletableFuture<List<float[]>> embedBatch(List<String> texts) {
        return CompletableFuture.supplyAsync(() -> {
            if (texts.isEmpty()) {
                return List.of();
            }
            EmbeddingModel model = requireModel();

            List<TextSegment> segments = texts.stream()
                    .map(TextSegment::from)
                    .toList();

            Response<List<Embedding>> response = model.embedAll(segments);

            return response.content().stream()
                    .map(Embedding::vector)
                    .map(this::checkDimension)
                    .toList();
        });
    }

    private EmbeddingModel requireModel() {
        ensureInitialized();
        EmbeddingModel model = embeddingModel;
        if (model == null) {
            throw new GraphException(GraphErrorKind.ENCODER_UNAVAILABLE, "Text encoder not available");
        }
        return model;
    }

    private float[] checkDimension(float[] vector) {
        int expected = properties.getEmbedding().getDimension();
        if (vector.length != expected) {
            throw new GraphException(GraphErrorKind.ENCODER_UNAVAILABLE,
                    "Text encoder produced " + vector.length + " dims, expected " + expected);
        }
        return vector;
    }
}
