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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.careergraph.domain.exception.GraphErrorKind;
import me.golemcore.careergraph.domain.exception.GraphException;
import me.golemcore.careergraph.domain.embedding.StructuralEmbeddingTrainer;
import me.golemcore.careergraph.domain.graph.EmbeddingStore;
import me.golemcore.careergraph.domain.graph.GraphState;
import me.golemcore.careergraph.domain.graph.GraphStateHolder;
import me.golemcore.careergraph.domain.graph.KnowledgeGraph;
import me.golemcore.careergraph.domain.model.CanonicalJobRow;
import me.golemcore.careergraph.domain.model.EmbeddingSpace;
import me.golemcore.careergraph.domain.model.NodeId;
import me.golemcore.careergraph.domain.model.NodeType;
import me.golemcore.careergraph.domain.model.RebuildResult;
import me.golemcore.careergraph.domain.model.ReconciliationState;
import me.golemcore.careergraph.infrastructure.config.CareerGraphProperties;
import me.golemcore.careergraph.port.outbound.JobSourcePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Full rebuild of the graph from the canonical job dataset. Loading, graph
 * construction, structural training and indexing all happen on private objects;
 * the live state is replaced in a single swap only when they succeed. The
 * incremental-update log is discarded, never replayed.
 */
@Service
@Slf4j
public class ReconciliationService {

    static final String POSTED_BY = "POSTED_BY";
    static final String REQUIRES_SKILL = "REQUIRES_SKILL";

    private final GraphStateHolder stateHolder;
    private final JobSourcePort jobSource;
    private final StructuralEmbeddingTrainer trainer;
    private final GraphSnapshotRepository snapshotRepository;
    private final CareerGraphProperties properties;
    private final Random random;
    private final Clock clock;

    private final AtomicReference<ReconciliationState> state = new AtomicReference<>(ReconciliationState.IDLE);
    private volatile RebuildResult lastResult;

    public ReconciliationService(GraphStateHolder stateHolder, JobSourcePort jobSource,
            StructuralEmbeddingTrainer trainer, GraphSnapshotRepository snapshotRepository,
            CareerGraphProperties properties, Random random, Clock clock) {
        this.stateHolder = stateHolder;
        this.jobSource = jobSource;
        this.trainer = trainer;
        this.snapshotRepository = snapshotRepository;
        this.properties = properties;
        this.random = random;
        this.clock = clock;
    }

    /**
     * Runs one rebuild on the calling thread.
     *
     * @throws IllegalStateException
     *             if a rebuild is already running
     * @throws GraphException
     *             SOURCE_INVALID when the dataset cannot be used; the previous
     *             state stays live
     */
    public RebuildResult rebuild() {
        if (!state.compareAndSet(ReconciliationState.IDLE, ReconciliationState.REBUILDING)) {
            throw new IllegalStateException("A rebuild is already running");
        }
        Instant startedAt = clock.instant();
        log.info("[Rebuild] Starting full rebuild");
        try {
            List<CanonicalJobRow> rows = jobSource.loadJobs();
            KnowledgeGraph graph = buildGraph(rows);

            boolean randomEmbeddings = false;
            Map<String, float[]> vectors;
            try {
                vectors = trainer.train(graph);
            } catch (RuntimeException e) { // NOSONAR - training must never block the rebuild
                log.warn("[Rebuild] Structural training failed, using random vectors: {}", e.getMessage());
                vectors = randomVectors(graph);
                randomEmbeddings = true;
            }

            EmbeddingStore embeddings = new EmbeddingStore(properties.getStructural().getDimensions());
            vectors.forEach(embeddings::put);
            GraphState next = new GraphState(EmbeddingSpace.STRUCTURAL, graph, embeddings, List.of());

            GraphState previous = stateHolder.swap(next, swapped -> {
                snapshotRepository.saveSnapshot(swapped);
                snapshotRepository.clearUpdateLog();
            });

            RebuildResult result = RebuildResult.builder()
                    .success(true)
                    .nodes(graph.nodeCount())
                    .edges(graph.edgeCount())
                    .randomEmbeddings(randomEmbeddings)
                    .discardedLogEntries(previous.getUpdateLog().size())
                    .startedAt(startedAt)
                    .finishedAt(clock.instant())
                    .message("Rebuilt from " + rows.size() + " job rows")
                    .build();
            lastResult = result;
            log.info("[Rebuild] Completed: {} nodes, {} edges, {} log entries discarded", result.getNodes(),
                    result.getEdges(), result.getDiscardedLogEntries());
            return result;
        } catch (GraphException e) {
            recordFailure(startedAt, e);
            throw e;
        } catch (RuntimeException e) {
            recordFailure(startedAt, e);
            throw new GraphException(GraphErrorKind.SOURCE_INVALID, "Rebuild failed: " + e.getMessage(), e);
        } finally {
            state.set(ReconciliationState.IDLE);
        }
    }

    public ReconciliationState getState() {
        return state.get();
    }

    public RebuildResult getLastResult() {
        return lastResult;
    }

    KnowledgeGraph buildGraph(List<CanonicalJobRow> rows) {
        KnowledgeGraph graph = new KnowledgeGraph();
        for (CanonicalJobRow row : rows) {
            String jobId = NodeId.of(NodeType.JOB, row.jobId()).value();
            String companyId = NodeId.of(NodeType.COMPANY, row.company()).value();

            Map<String, Object> jobMetadata = new LinkedHashMap<>();
            jobMetadata.put("title", row.title());
            jobMetadata.put("company", row.company());
            graph.addNode(jobId, NodeType.JOB, jobMetadata);
            graph.addNode(companyId, NodeType.COMPANY, Map.of("name", row.company()));
            graph.addEdge(jobId, companyId, POSTED_BY);

            String skills = row.requiredSkills() != null ? row.requiredSkills() : "";
            for (String skill : skills.split(",")) {
                String name = skill.trim();
                if (name.isEmpty()) {
                    continue;
                }
                String skillId = NodeId.of(NodeType.SKILL, name).value();
                graph.addNode(skillId, NodeType.SKILL, Map.of("name", name));
                graph.addEdge(jobId, skillId, REQUIRES_SKILL);
            }
        }
        log.debug("[Rebuild] Built graph: {} nodes, {} edges", graph.nodeCount(), graph.edgeCount());
        return graph;
    }

    private Map<String, float[]> randomVectors(KnowledgeGraph graph) {
        int dimensions = properties.getStructural().getDimensions();
        double scale = properties.getStructural().getFallbackScale();
        Map<String, float[]> vectors = new LinkedHashMap<>();
        for (String id : graph.nodeIds()) {
            float[] vector = new float[dimensions];
            for (int i = 0; i < dimensions; i++) {
                vector[i] = (float) (random.nextGaussian() * scale);
            }
            vectors.put(id, vector);
        }
        return vectors;
    }

    private void recordFailure(Instant startedAt, RuntimeException e) {
        log.error("[Rebuild] Aborted, keeping the current graph: {}", e.getMessage());
        lastResult = RebuildResult.builder()
                .success(false)
                .startedAt(startedAt)
                .finishedAt(clock.instant())
                .message(e.getMessage())
                .build();
    }
}
