package me.golemcore.careergraph.domain.graph;

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

import lombok.Getter;
import me.golemcore.careergraph.domain.model.EmbeddingSpace;
import me.golemcore.careergraph.domain.model.UpdateLogEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The consistency unit: graph, embeddings, vector index and incremental-update
 * log, always mutated together. Every embedding lives in one
 * {@link EmbeddingSpace}, and the index covers exactly the ids of the embedding
 * store.
 */
@Getter
public class GraphState {

    private final EmbeddingSpace space;
    private final KnowledgeGraph graph;
    private final EmbeddingStore embeddings;
    private final VectorIndex index;
    private final List<UpdateLogEntry> updateLog;

    public GraphState(EmbeddingSpace space, KnowledgeGraph graph, EmbeddingStore embeddings,
            List<UpdateLogEntry> updateLog) {
        this.space = space;
        this.graph = graph;
        this.embeddings = embeddings;
        this.index = VectorIndex.build(embeddings.getDimension(), embeddings.asMap());
        this.updateLog = new ArrayList<>(updateLog);
    }

    public static GraphState empty(EmbeddingSpace space, int dimension) {
        return new GraphState(space, new KnowledgeGraph(), new EmbeddingStore(dimension), List.of());
    }

    public int getDimension() {
        return embeddings.getDimension();
    }

    /**
     * Writes the vector to both the embedding store and the index.
     */
    public void putEmbedding(String id, float[] vector) {
        embeddings.put(id, vector);
        index.add(id, vector);
    }

    public Map<String, float[]> embeddingsView() {
        return embeddings.asMap();
    }

    public List<UpdateLogEntry> getUpdateLog() {
        return Collections.unmodifiableList(updateLog);
    }

    public void recordCreated(UpdateLogEntry entry) {
        updateLog.add(entry);
    }
}
