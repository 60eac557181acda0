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
import me.golemcore.careergraph.domain.graph.GraphState;
import me.golemcore.careergraph.domain.graph.GraphStateHolder;
import me.golemcore.careergraph.domain.graph.KnowledgeGraph;
import me.golemcore.careergraph.domain.graph.VectorMath;
import me.golemcore.careergraph.domain.model.EmbeddingSpace;
import me.golemcore.careergraph.domain.model.NodeId;
import me.golemcore.careergraph.domain.model.NodeType;
import me.golemcore.careergraph.domain.model.UpdateLogEntry;
import me.golemcore.careergraph.domain.model.UpsertCommand;
import me.golemcore.careergraph.domain.model.UpsertResult;
import me.golemcore.careergraph.infrastructure.config.CareerGraphProperties;
import me.golemcore.careergraph.port.outbound.EmbeddingPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletionException;

/**
 * Online node upsert. Creates a node, its seed nodes and any missing neighbors,
 * links them, and derives an approximate embedding without retraining:
 * {@code 0.6 * mean(neighbor vectors) + 0.4 * text vector} in TEXT space, the
 * neighbor centroid (or a small random vector) in STRUCTURAL space.
 *
 * <p>
 * Re-adding an existing id is a no-op reported as {@link UpsertResult.Status#EXISTS}.
 * Graph, embeddings, index and update log change together under the write lock,
 * and the snapshot is persisted before the lock is released.
 */
@Service
@Slf4j
public class NodeUpsertService {

    static final double NEIGHBOR_WEIGHT = 0.6;
    static final double TEXT_WEIGHT = 0.4;

    private final GraphStateHolder stateHolder;
    private final EmbeddingPort embeddingPort;
    private final GraphSnapshotRepository snapshotRepository;
    private final CareerGraphProperties properties;
    private final Random random;
    private final Clock clock;

    public NodeUpsertService(GraphStateHolder stateHolder, EmbeddingPort embeddingPort,
            GraphSnapshotRepository snapshotRepository, CareerGraphProperties properties, Random random,
            Clock clock) {
        this.stateHolder = stateHolder;
        this.embeddingPort = embeddingPort;
        this.snapshotRepository = snapshotRepository;
        this.properties = properties;
        this.random = random;
        this.clock = clock;
    }

    /**
     * Raw {@code addNode}: validates the declared type, then upserts with the
     * given neighbors.
     *
     * @throws GraphException
     *             INVALID_TYPE when the type is unknown or disagrees with the id
     *             prefix
     */
    public UpsertResult addNode(String id, String type, List<String> neighbors, Map<String, Object> metadata) {
        NodeType nodeType = NodeType.fromWireName(type);
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Node id must not be blank");
        }
        NodeId nodeId = NodeId.declared(id.trim(), nodeType);
        UpsertCommand.UpsertCommandBuilder command = UpsertCommand.builder().node(nodeId);
        if (metadata != null) {
            command.metadata(metadata);
        }
        if (neighbors != null) {
            for (String neighbor : neighbors) {
                if (neighbor != null && !neighbor.isBlank()) {
                    command.neighbor(NodeId.parse(neighbor.trim()));
                }
            }
        }
        return upsert(command.build());
    }

    public UpsertResult upsert(UpsertCommand command) {
        String nodeId = command.getNode().value();
        EmbeddingSpace observedSpace = stateHolder.read(state -> state.getGraph().hasNode(nodeId)
                ? null
                : state.getSpace());
        if (observedSpace == null) {
            log.debug("[Upsert] Node already exists: {}", nodeId);
            return UpsertResult.exists(nodeId);
        }

        Map<String, float[]> textVectors = observedSpace == EmbeddingSpace.TEXT
                ? encodeTexts(command)
                : Map.of();

        return stateHolder.write(state -> apply(state, command, textVectors));
    }

    private UpsertResult apply(GraphState state, UpsertCommand command, Map<String, float[]> textVectors) {
        KnowledgeGraph graph = state.getGraph();
        String nodeId = command.getNode().value();
        if (graph.hasNode(nodeId)) {
            log.debug("[Upsert] Node already exists: {}", nodeId);
            return UpsertResult.exists(nodeId);
        }
        boolean textSpace = state.getSpace() == EmbeddingSpace.TEXT;
        int dimension = state.getDimension();

        Map<String, float[]> seedVectors = new LinkedHashMap<>();
        for (UpsertCommand.SeedNode seed : command.getSeeds()) {
            String seedId = seed.id().value();
            if (!graph.hasNode(seedId) && !seedVectors.containsKey(seedId)) {
                seedVectors.put(seedId, textSpace
                        ? checked(textVectors.get(seedKey(seed)), dimension, seedId)
                        : randomVector(dimension));
            }
        }

        List<float[]> neighborVectors = new ArrayList<>();
        for (NodeId neighbor : distinct(command.getNeighbors())) {
            float[] vector = seedVectors.containsKey(neighbor.value())
                    ? seedVectors.get(neighbor.value())
                    : state.getEmbeddings().get(neighbor.value()).orElse(null);
            if (vector != null) {
                neighborVectors.add(vector);
            }
        }
        float[] nodeVector = nodeVector(textSpace, textVectors.get(nodeKey(command)), neighborVectors, dimension,
                nodeId);

        List<String> created = new ArrayList<>();
        List<UpdateLogEntry> logEntries = new ArrayList<>();
        for (UpsertCommand.SeedNode seed : command.getSeeds()) {
            String seedId = seed.id().value();
            if (graph.addNode(seedId, seed.id().type(), seed.metadata())) {
                state.putEmbedding(seedId, seedVectors.get(seedId));
                created.add(seedId);
                logEntries.add(logEntry(seed.id()));
            }
        }

        graph.addNode(nodeId, command.getNode().type(), command.getMetadata());
        for (NodeId neighbor : distinct(command.getNeighbors())) {
            if (graph.addNode(neighbor.value(), neighbor.type(), Map.of())) {
                created.add(neighbor.value());
                logEntries.add(logEntry(neighbor));
            }
            graph.addEdge(nodeId, neighbor.value());
        }
        state.putEmbedding(nodeId, nodeVector);
        logEntries.add(logEntry(command.getNode()));
        logEntries.forEach(state::recordCreated);

        snapshotRepository.saveSnapshot(state);
        snapshotRepository.appendUpdateLog(logEntries);

        log.info("[Upsert] Created {} ({} neighbors, {} new nodes)", nodeId, command.getNeighbors().size(),
                created.size());
        return UpsertResult.builder()
                .status(UpsertResult.Status.OK)
                .node(nodeId)
                .createdNodes(created)
                .build();
    }

    private float[] nodeVector(boolean textSpace, float[] textVector, List<float[]> neighborVectors,
            int dimension, String nodeId) {
        if (textSpace) {
            float[] text = checked(textVector, dimension, nodeId);
            if (neighborVectors.isEmpty()) {
                return text;
            }
            return VectorMath.blend(VectorMath.mean(neighborVectors), NEIGHBOR_WEIGHT, text, TEXT_WEIGHT);
        }
        return neighborVectors.isEmpty() ? randomVector(dimension) : VectorMath.mean(neighborVectors);
    }

    private Map<String, float[]> encodeTexts(UpsertCommand command) {
        List<String> keys = new ArrayList<>();
        List<String> texts = new ArrayList<>();
        keys.add(nodeKey(command));
        texts.add(nodeText(command.getNode(), command.getMetadata()));
        for (UpsertCommand.SeedNode seed : command.getSeeds()) {
            keys.add(seedKey(seed));
            texts.add(seed.embeddingText());
        }

        List<float[]> vectors;
        try {
            vectors = embeddingPort.embedBatch(texts).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof GraphException graphException) {
                throw graphException;
            }
            throw new GraphException(GraphErrorKind.ENCODER_UNAVAILABLE,
                    "Text encoder failed: " + (e.getCause() != null ? e.getCause().getMessage() : e.getMessage()),
                    e);
        }

        Map<String, float[]> byKey = new HashMap<>();
        for (int i = 0; i < keys.size() && i < vectors.size(); i++) {
            byKey.put(keys.get(i), vectors.get(i));
        }
        return byKey;
    }

    /**
     * Node id followed by every metadata value; lists contribute each element.
     */
    static String nodeText(NodeId id, Map<String, Object> metadata) {
        StringBuilder text = new StringBuilder(id.value());
        for (Object value : metadata.values()) {
            if (value instanceof Collection<?> values) {
                for (Object element : values) {
                    if (element != null) {
                        text.append(' ').append(element);
                    }
                }
            } else if (value != null) {
                text.append(' ').append(value);
            }
        }
        return text.toString();
    }

    private float[] randomVector(int dimension) {
        double scale = properties.getStructural().getFallbackScale();
        float[] vector = new float[dimension];
        for (int i = 0; i < dimension; i++) {
            vector[i] = (float) (random.nextGaussian() * scale);
        }
        return vector;
    }

    private static float[] checked(float[] vector, int dimension, String nodeId) {
        if (vector == null) {
            throw new GraphException(GraphErrorKind.ENCODER_UNAVAILABLE, "No text embedding produced for " + nodeId);
        }
        if (vector.length != dimension) {
            throw new GraphException(GraphErrorKind.ENCODER_UNAVAILABLE, "Text embedding for " + nodeId
                    + " has dimension " + vector.length + ", graph expects " + dimension);
        }
        return vector;
    }

    private UpdateLogEntry logEntry(NodeId id) {
        return UpdateLogEntry.builder()
                .nodeId(id.value())
                .type(id.type())
                .timestamp(clock.instant())
                .build();
    }

    private static List<NodeId> distinct(List<NodeId> ids) {
        Map<String, NodeId> unique = new LinkedHashMap<>();
        for (NodeId id : ids) {
            unique.putIfAbsent(id.value(), id);
        }
        return new ArrayList<>(unique.values());
    }

    private static String nodeKey(UpsertCommand command) {
        return "node:" + command.getNode().value();
    }

    private static String seedKey(UpsertCommand.SeedNode seed) {
        return "seed:" + seed.id().value();
    }
}
