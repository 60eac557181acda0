package me.golemcore.careergraph.domain.service;

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
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.careergraph.domain.graph.EmbeddingStore;
import me.golemcore.careergraph.domain.graph.GraphState;
import me.golemcore.careergraph.domain.graph.KnowledgeGraph;
import me.golemcore.careergraph.domain.model.EmbeddingSpace;
import me.golemcore.careergraph.domain.model.GraphNode;
import me.golemcore.careergraph.domain.model.GraphSnapshot;
import me.golemcore.careergraph.domain.model.UpdateLogEntry;
import me.golemcore.careergraph.infrastructure.config.CareerGraphProperties;
import me.golemcore.careergraph.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Durable form of the {@link GraphState}: {@code snapshot.json} (graph, space,
 * dimension and vectors in one document) and the JSONL update log, both under
 * {@code careergraph.storage.directory}.
 *
 * <p>
 * The snapshot is replaced by a single atomic write, retried with backoff, so
 * the graph and its embeddings on disk always come from the same state. When
 * every attempt fails the in-memory state stays authoritative; the failure is
 * logged and reported through {@link #isHealthy()} until the next successful
 * write.
 */
@Service
@Slf4j
public class GraphSnapshotRepository {

    static final String SNAPSHOT_FILE = "snapshot.json";
    static final String UPDATE_LOG_FILE = "update-log.jsonl";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final CareerGraphProperties properties;

    private final AtomicInteger failureCount = new AtomicInteger();
    private volatile boolean healthy = true;
    private volatile String lastError;

    public GraphSnapshotRepository(StoragePort storagePort, ObjectMapper objectMapper,
            CareerGraphProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Loads the persisted state, or an empty TEXT-space state when the snapshot
     * is missing, unreadable or internally inconsistent.
     */
    public GraphState load() {
        GraphSnapshot snapshot;
        try {
            String json = storagePort.getText(directory(), SNAPSHOT_FILE).join();
            if (json == null) {
                log.info("[Snapshot] No snapshot found, starting empty");
                return emptyState();
            }
            snapshot = objectMapper.readValue(json, GraphSnapshot.class);
        } catch (IOException | RuntimeException e) { // NOSONAR - unreadable snapshot falls back to empty state
            log.warn("[Snapshot] Failed to read snapshot, starting empty: {}", e.getMessage());
            return emptyState();
        }

        GraphState state;
        try {
            state = restore(snapshot);
        } catch (RuntimeException e) { // NOSONAR - inconsistent snapshot falls back to empty state
            log.warn("[Snapshot] Inconsistent snapshot, starting empty: {}", e.getMessage());
            return emptyState();
        }
        log.info("[Snapshot] Loaded {} nodes, {} edges, {} embeddings ({} space)", state.getGraph().nodeCount(),
                state.getGraph().edgeCount(), state.getEmbeddings().size(), state.getSpace());
        return state;
    }

    /**
     * Writes the graph and its embeddings as one document. Never throws:
     * failures are recorded.
     *
     * @return whether the snapshot was written
     */
    public boolean saveSnapshot(GraphState state) {
        try {
            String json = objectMapper.writeValueAsString(toSnapshot(state));
            return withRetry("snapshot",
                    () -> storagePort.putTextAtomic(directory(), SNAPSHOT_FILE, json).join());
        } catch (JsonProcessingException e) {
            recordFailure("snapshot", e);
            return false;
        }
    }

    public boolean appendUpdateLog(List<UpdateLogEntry> entries) {
        if (entries.isEmpty()) {
            return true;
        }
        try {
            StringBuilder lines = new StringBuilder();
            for (UpdateLogEntry entry : entries) {
                lines.append(objectMapper.writeValueAsString(entry)).append('\n');
            }
            String content = lines.toString();
            return withRetry("update log", () -> storagePort.appendText(directory(), UPDATE_LOG_FILE, content)
                    .join());
        } catch (JsonProcessingException e) {
            recordFailure("update log", e);
            return false;
        }
    }

    public boolean clearUpdateLog() {
        return withRetry("update log reset",
                () -> storagePort.putTextAtomic(directory(), UPDATE_LOG_FILE, "").join());
    }

    public GraphSnapshot toSnapshot(GraphState state) {
        return GraphSnapshot.builder()
                .space(state.getSpace())
                .dimension(state.getDimension())
                .nodes(state.getGraph().nodes())
                .edges(state.getGraph().edges())
                .embeddings(new LinkedHashMap<>(state.embeddingsView()))
                .build();
    }

    public boolean isHealthy() {
        return healthy;
    }

    public int getFailureCount() {
        return failureCount.get();
    }

    public String getLastError() {
        return lastError;
    }

    private GraphState restore(GraphSnapshot snapshot) {
        if (snapshot.getSpace() == null || snapshot.getDimension() <= 0) {
            throw new IllegalStateException("missing space or dimension");
        }
        if (snapshot.getNodes() == null || snapshot.getEdges() == null || snapshot.getEmbeddings() == null) {
            throw new IllegalStateException("missing nodes, edges or embeddings");
        }
        KnowledgeGraph graph = new KnowledgeGraph();
        for (GraphNode node : snapshot.getNodes()) {
            graph.addNode(node.getId(), node.getType(), node.getMetadata());
        }
        for (GraphSnapshot.Edge edge : snapshot.getEdges()) {
            if (!graph.hasNode(edge.getSource()) || !graph.hasNode(edge.getTarget())) {
                throw new IllegalStateException("edge with unknown endpoint: " + edge.getSource() + " - "
                        + edge.getTarget());
            }
            graph.addEdge(edge.getSource(), edge.getTarget(), edge.getRelation());
        }

        int dimension = snapshot.getDimension();
        Map<String, float[]> vectors = snapshot.getEmbeddings();
        for (Map.Entry<String, float[]> entry : vectors.entrySet()) {
            if (!graph.hasNode(entry.getKey())) {
                throw new IllegalStateException("embedding without a graph node: " + entry.getKey());
            }
            if (entry.getValue() == null || entry.getValue().length != dimension) {
                throw new IllegalStateException("embedding of " + entry.getKey() + " does not have dimension "
                        + dimension);
            }
        }

        EmbeddingStore embeddings = new EmbeddingStore(dimension);
        for (String id : graph.nodeIds()) {
            float[] vector = vectors.get(id);
            if (vector != null) {
                embeddings.put(id, vector);
            }
        }
        return new GraphState(snapshot.getSpace(), graph, embeddings, loadUpdateLog());
    }

    private List<UpdateLogEntry> loadUpdateLog() {
        List<UpdateLogEntry> entries = new ArrayList<>();
        String content;
        try {
            content = storagePort.getText(directory(), UPDATE_LOG_FILE).join();
        } catch (RuntimeException e) { // NOSONAR - the log is informational only
            log.warn("[Snapshot] Failed to read update log: {}", e.getMessage());
            return entries;
        }
        if (content == null || content.isBlank()) {
            return entries;
        }
        for (String line : content.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                entries.add(objectMapper.readValue(line, UpdateLogEntry.class));
            } catch (IOException e) {
                log.warn("[Snapshot] Skipping unreadable update log line: {}", e.getMessage());
            }
        }
        return entries;
    }

    private boolean withRetry(String what, Runnable write) {
        int maxAttempts = Math.max(1, properties.getPersistence().getMaxAttempts());
        Duration backoff = properties.getPersistence().getRetryBackoff();
        RuntimeException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                write.run();
                if (!healthy) {
                    log.info("[Snapshot] Persistence recovered");
                }
                healthy = true;
                return true;
            } catch (RuntimeException e) {
                last = e;
                log.warn("[Snapshot] Failed to write {} (attempt {}/{}): {}", what, attempt, maxAttempts,
                        e.getMessage());
                if (attempt < maxAttempts && !sleep(backoff.multipliedBy(attempt))) {
                    break;
                }
            }
        }
        recordFailure(what, last);
        return false;
    }

    private void recordFailure(String what, Exception e) {
        failureCount.incrementAndGet();
        healthy = false;
        lastError = what + ": " + (e != null ? e.getMessage() : "unknown error");
        log.error("[Snapshot] Giving up writing {}; in-memory state stays authoritative", what, e);
    }

    private static boolean sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private GraphState emptyState() {
        return GraphState.empty(EmbeddingSpace.TEXT, properties.getEmbedding().getDimension());
    }

    private String directory() {
        return properties.getStorage().getDirectory();
    }
}
