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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One vector per node id, all of the same dimension. Vectors are stored as given;
 * normalization happens at query time.
 */
public class EmbeddingStore {

    private final int dimension;
    private final Map<String, float[]> vectors = new LinkedHashMap<>();

    public EmbeddingStore(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
    }

    public int getDimension() {
        return dimension;
    }

    public Optional<float[]> get(String id) {
        return Optional.ofNullable(vectors.get(id));
    }

    public boolean contains(String id) {
        return vectors.containsKey(id);
    }

    /**
     * Stores the vector, replacing any previous one for the id.
     */
    public void put(String id, float[] vector) {
        if (vector.length != dimension) {
            throw new IllegalArgumentException(
                    "Embedding for " + id + " has dimension " + vector.length + ", expected " + dimension);
        }
        vectors.put(id, vector.clone());
    }

    public Map<String, float[]> asMap() {
        return Collections.unmodifiableMap(vectors);
    }

    public int size() {
        return vectors.size();
    }
}
