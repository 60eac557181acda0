package me.golemcore.careergraph.domain.embedding;

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
import me.golemcore.careergraph.domain.graph.KnowledgeGraph;
import me.golemcore.careergraph.infrastructure.config.CareerGraphProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Learns node embeddings from graph structure: uniform random walks (node2vec
 * with p = q = 1) feed a skip-gram model trained with negative sampling.
 *
 * <p>
 * Settings come from {@code careergraph.structural.*}: dimensions, walk length,
 * walks per node, context window, negative samples, epochs and the initial
 * learning rate, which decays linearly over training.
 */
@Component
@Slf4j
public class StructuralEmbeddingTrainer {

    private static final double MAX_EXP = 6.0;
    private static final double MIN_LEARNING_RATE_FACTOR = 1e-4;
    private static final double UNIGRAM_POWER = 0.75;

    private final CareerGraphProperties properties;
    private final Random random;

    public StructuralEmbeddingTrainer(CareerGraphProperties properties, Random random) {
        this.properties = properties;
        this.random = random;
    }

    /**
     * Trains one vector per node, in graph insertion order.
     *
     * @throws IllegalStateException
     *             when the graph has no edges or training diverges
     */
    public Map<String, float[]> train(KnowledgeGraph graph) {
        CareerGraphProperties.StructuralProperties settings = properties.getStructural();
        if (graph.edgeCount() == 0) {
            throw new IllegalStateException("Cannot learn structural embeddings: graph has no edges");
        }

        List<String> ids = graph.nodeIds();
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            positions.put(ids.get(i), i);
        }
        int[][] adjacency = new int[ids.size()][];
        for (int i = 0; i < ids.size(); i++) {
            adjacency[i] = graph.neighbors(ids.get(i)).stream().mapToInt(positions::get).toArray();
        }

        int dimensions = settings.getDimensions();
        float[][] input = new float[ids.size()][dimensions];
        float[][] output = new float[ids.size()][dimensions];
        for (float[] row : input) {
            for (int d = 0; d < dimensions; d++) {
                row[d] = (random.nextFloat() - 0.5f) / dimensions;
            }
        }

        double[] negativeTable = negativeSamplingTable(adjacency);
        List<Integer> starts = new ArrayList<>();
        for (int i = 0; i < ids.size(); i++) {
            if (adjacency[i].length > 0) {
                starts.add(i);
            }
        }

        long totalWalks = (long) settings.getEpochs() * settings.getWalksPerNode() * starts.size();
        long walksDone = 0;
        double initialRate = settings.getLearningRate();
        int[] walk = new int[Math.max(1, settings.getWalkLength())];
        float[] gradient = new float[dimensions];

        for (int epoch = 0; epoch < settings.getEpochs(); epoch++) {
            for (int round = 0; round < settings.getWalksPerNode(); round++) {
                Collections.shuffle(starts, random);
                for (int start : starts) {
                    double progress = (double) walksDone / Math.max(1, totalWalks);
                    double rate = Math.max(initialRate * MIN_LEARNING_RATE_FACTOR, initialRate * (1 - progress));
                    int length = randomWalk(adjacency, start, walk);
                    trainWalk(walk, length, settings, input, output, negativeTable, rate, gradient);
                    walksDone++;
                }
            }
        }

        Map<String, float[]> vectors = new LinkedHashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            for (float v : input[i]) {
                if (!Float.isFinite(v)) {
                    throw new IllegalStateException("Structural training diverged at node " + ids.get(i));
                }
            }
            vectors.put(ids.get(i), input[i]);
        }
        log.debug("[Rebuild] Trained {} structural vectors from {} walks", vectors.size(), walksDone);
        return vectors;
    }

    private int randomWalk(int[][] adjacency, int start, int[] walk) {
        walk[0] = start;
        int length = 1;
        int current = start;
        while (length < walk.length) {
            int[] neighbors = adjacency[current];
            if (neighbors.length == 0) {
                break;
            }
            current = neighbors[random.nextInt(neighbors.length)];
            walk[length++] = current;
        }
        return length;
    }

    private void trainWalk(int[] walk, int length, CareerGraphProperties.StructuralProperties settings,
            float[][] input, float[][] output, double[] negativeTable, double rate, float[] gradient) {
        int window = Math.max(1, settings.getWindow());
        for (int i = 0; i < length; i++) {
            int center = walk[i];
            int reduced = window - random.nextInt(window);
            int from = Math.max(0, i - reduced);
            int to = Math.min(length - 1, i + reduced);
            for (int j = from; j <= to; j++) {
                if (j == i) {
                    continue;
                }
                trainPair(walk[j], center, settings.getNegativeSamples(), input, output, negativeTable, rate,
                        gradient);
            }
        }
    }

    private void trainPair(int context, int target, int negatives, float[][] input, float[][] output,
            double[] negativeTable, double rate, float[] gradient) {
        float[] contextVector = input[context];
        Arrays.fill(gradient, 0f);
        for (int sample = 0; sample <= negatives; sample++) {
            int node;
            int label;
            if (sample == 0) {
                node = target;
                label = 1;
            } else {
                node = sampleNegative(negativeTable);
                if (node == target) {
                    continue;
                }
                label = 0;
            }
            float[] outputVector = output[node];
            double dot = 0;
            for (int d = 0; d < contextVector.length; d++) {
                dot += contextVector[d] * outputVector[d];
            }
            double g = (label - sigmoid(dot)) * rate;
            for (int d = 0; d < contextVector.length; d++) {
                gradient[d] += (float) (g * outputVector[d]);
                outputVector[d] += (float) (g * contextVector[d]);
            }
        }
        for (int d = 0; d < contextVector.length; d++) {
            contextVector[d] += gradient[d];
        }
    }

    /**
     * Cumulative distribution proportional to degree^0.75, the walk visit
     * frequency of a uniform random walk raised to the usual smoothing power.
     */
    private static double[] negativeSamplingTable(int[][] adjacency) {
        double[] cumulative = new double[adjacency.length];
        double total = 0;
        for (int i = 0; i < adjacency.length; i++) {
            total += Math.pow(adjacency[i].length, UNIGRAM_POWER);
            cumulative[i] = total;
        }
        for (int i = 0; i < cumulative.length; i++) {
            cumulative[i] /= total;
        }
        return cumulative;
    }

    private int sampleNegative(double[] cumulative) {
        double r = random.nextDouble();
        int index = Arrays.binarySearch(cumulative, r);
        if (index < 0) {
            index = -index - 1;
        }
        return Math.min(index, cumulative.length - 1);
    }

    private static double sigmoid(double x) {
        if (x > MAX_EXP) {
            return 1.0;
        }
        if (x < -MAX_EXP) {
            return 0.0;
        }
        return 1.0 / (1.0 + Math.exp(-x));
    }
}
