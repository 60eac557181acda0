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

import java.util.Collection;

/**
 * Small dense-vector helpers shared by the index, the scorers and the upsert
 * blend.
 */
public final class VectorMath {

    static final double EPSILON = 1e-9;

    private VectorMath() {
    }

    /**
     * Cosine similarity with an epsilon in the denominator, so zero vectors score
     * 0 instead of NaN.
     */
    public static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Dimension mismatch: " + a.length + " vs " + b.length);
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB) + EPSILON);
    }

    public static float[] normalize(float[] vector) {
        double norm = 0;
        for (float v : vector) {
            norm += (double) v * v;
        }
        norm = Math.sqrt(norm);
        float[] result = new float[vector.length];
        if (norm == 0) {
            return result;
        }
        for (int i = 0; i < vector.length; i++) {
            result[i] = (float) (vector[i] / norm);
        }
        return result;
    }

    public static float[] mean(Collection<float[]> vectors) {
        if (vectors.isEmpty()) {
            throw new IllegalArgumentException("Cannot average an empty set of vectors");
        }
        int dimension = vectors.iterator().next().length;
        double[] sum = new double[dimension];
        for (float[] vector : vectors) {
            if (vector.length != dimension) {
                throw new IllegalArgumentException("Dimension mismatch: " + vector.length + " vs " + dimension);
            }
            for (int i = 0; i < dimension; i++) {
                sum[i] += vector[i];
            }
        }
        float[] result = new float[dimension];
        for (int i = 0; i < dimension; i++) {
            result[i] = (float) (sum[i] / vectors.size());
        }
        return result;
    }

    /**
     * {@code a * wa + b * wb}, element-wise.
     */
    public static float[] blend(float[] a, double wa, float[] b, double wb) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Dimension mismatch: " + a.length + " vs " + b.length);
        }
        float[] result = new float[a.length];
        for (int i = 0; i < a.length; i++) {
            result[i] = (float) (wa * a[i] + wb * b[i]);
        }
        return result;
    }
}
