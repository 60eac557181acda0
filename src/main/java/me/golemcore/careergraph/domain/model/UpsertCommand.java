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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Everything the upsert engine needs to create one node atomically: the node
 * itself, its neighbors, and the seed nodes (skills, companies) that must exist
 * with their own embeddings before the node is linked.
 */
@Value
@Builder
public class UpsertCommand {

    NodeId node;

    @Singular("metadataEntry")
    Map<String, Object> metadata;

    @Singular
    List<NodeId> neighbors;

    @Singular
    List<SeedNode> seeds;

    /**
     * A node created on demand with its own text-derived embedding.
     *
     * @param id
     *            node id
     * @param metadata
     *            metadata stored on creation
     * @param embeddingText
     *            text fed to the encoder
     */
    public record SeedNode(NodeId id, Map<String, Object> metadata, String embeddingText) {
    }
}
