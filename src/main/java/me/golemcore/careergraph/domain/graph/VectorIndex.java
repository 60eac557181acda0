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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Exact cosine-similarity index over L2-normalized vectors in flat storage.
 * Position {@code i} in storage always belongs to the {@code i}-th inserted id.
 * Adding an id that is already indexed overwrites its vector in place, so every
 * id appears exactly once.
 */
public class VectorIndex {

    private final int dimension;
    private float[] data;
    private final List<String> ids = new ArrayList<>();
    private final Map<String, Integer> positions = new HashMap<>();

    public VectorIndex(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
        this.data = new float[dimension * 16];
    }

    /**
     * Index built from scratch over the given vectors, in iteration order.
     */
    public static VectorIndex build(int dimension, Map<String, float[]> vectors) {
        VectorIndex index = new VectorIndex(dimension);
        vectors.forEach(index::add);
        return index;
    }

    public void add(String id, float[] vector) {
        if (vector.length != dimension) {
            throw new IllegalArgumentException(
                    "Vector for " + id + " has dimension " + vector.length + ", expected " + dimension);
        }
        float[] normalized = VectorMath.normalize(vector);
        Integer existing = positions.get(id);
        if (existing != null) {
            System.arraycopy(normalized, 0, data, existing * dimension, dimension);
            return;
        }
        int position = ids.size();
        ensureCapacity(position + 1);
        System.arraycopy(normalized, 0, data, position * dimension, dimension);
        ids.add(id);
        positions.put(id, position);
    }

    /**
     * Top-k ids by descending cosine similarity; ties keep insertion order.
     */
    public List<Hit> search(float[] query, int k) {
        if (query.length != dimension) {
            throw new IllegalArgumentException(
                    "Query has dimension " + query.length + ", expected " + dimension);
        }
        if (ids.isEmpty() || k <= 0) {
            return List.of();
        }
        float[] normalized = VectorMath.normalize(query);
        List<Hit> hits = new ArrayList<>(ids.size());
        for (int position = 0; position < ids.size(); position++) {
            double score = 0;
            int offset = position * dimension;
            for (int i = 0; i < dimension; i++) {
                score += (double) data[offset + i] * normalized[i];
            }
            hits.add(new Hit(ids.get(position), score));
        }
        hits.sort((a, b) -> Double.compare(b.score(), a.score()));
        return List.copyOf(hits.subList(0, Math.min(k, hits.size())));
    }

    public boolean contains(String id) {
        return positions.containsKey(id);
    }

    public List<String> ids() {
        return Collections.unmodifiableList(ids);
    }

    public int size() {
        return ids.size();
    }

    public int getDimension() {
        return dimension;
    }

    private void ensureCapacity(int vectors) {
        if (vectors * dimension > data.length) {
            data = Arrays.copyOf(data, Math.max(data.length * 2, vectors * dimension));
        }
    }

    public record Hit(String id, double score) {
    }
}
