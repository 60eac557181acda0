package me.golemcore.careergraph.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration for the matching engine, bound from application.properties under
 * the {@code careergraph.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - workspace location of the persisted
 * snapshot</li>
 * <li>{@link PersistenceProperties} - snapshot write retries</li>
 * <li>{@link EmbeddingProperties} - text encoder</li>
 * <li>{@link ExplanationProperties} - natural-language explanation
 * generator</li>
 * <li>{@link ReconciliationProperties} - nightly full rebuild</li>
 * <li>{@link StructuralProperties} - random-walk embedding training</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "careergraph")
@Data
public class CareerGraphProperties {

    private StorageProperties storage = new StorageProperties();
    private PersistenceProperties persistence = new PersistenceProperties();
    private EmbeddingProperties embedding = new EmbeddingProperties();
    private ExplanationProperties explanation = new ExplanationProperties();
    private ReconciliationProperties reconciliation = new ReconciliationProperties();
    private StructuralProperties structural = new StructuralProperties();
    private SearchProperties search = new SearchProperties();

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.careergraph/workspace";
        private String directory = "graph";
    }

    @Data
    public static class PersistenceProperties {
        private int maxAttempts = 3;
        private Duration retryBackoff = Duration.ofMillis(200);
    }

    @Data
    public static class EmbeddingProperties {
        private String model = "all-minilm-l6-v2";
        private int dimension = 384;
    }

    @Data
    public static class ExplanationProperties {
        private boolean enabled = true;
        private String provider = "ollama";
        private String model = "llama3.2";
        private String baseUrl = "http://localhost:11434/v1";
        private String apiKey;
        private Duration timeout = Duration.ofSeconds(60);
        private String fallback = "LLM service unavailable.";
    }

    @Data
    public static class ReconciliationProperties {
        private boolean enabled = true;
        private String cron = "0 23 1 * * *";
        private String zone;
        private String sourcePath = "jobs.csv";
    }

    @Data
    public static class StructuralProperties {
        private int dimensions = 32;
        private int walkLength = 20;
        private int walksPerNode = 50;
        private int window = 5;
        private int negativeSamples = 5;
        private int epochs = 1;
        private double learningRate = 0.025;
        private Long seed;
        private double fallbackScale = 0.01;
    }

    @Data
    public static class SearchProperties {
        private int defaultK = 8;
    }
}
