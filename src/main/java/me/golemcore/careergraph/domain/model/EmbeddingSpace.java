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

/**
 * Vector space the live embeddings belong to. Vectors from different spaces are
 * never compared or indexed together.
 */
public enum EmbeddingSpace {

    /**
     * Vectors produced by the text encoder (optionally blended with neighbor
     * centroids by the online upsert path).
     */
    TEXT,

    /**
     * Vectors learned from graph topology by the full rebuild.
     */
    STRUCTURAL
}
