package me.golemcore.careergraph.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Point-in-time view of the engine for operators.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphStatus {
    private int nodes;
    private int edges;
    private int embeddings;
    private int indexedVectors;
    private EmbeddingSpace space;
    private int dimension;
    private int pendingUpdates;
    private ReconciliationState reconciliationState;
    private RebuildResult lastRebuild;
    private Instant nextScheduledRebuild;
    private boolean persistenceHealthy;
    private int persistenceFailures;
    private String lastPersistenceError;
}
