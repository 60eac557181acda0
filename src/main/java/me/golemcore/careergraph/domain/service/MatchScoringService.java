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

import me.golemcore.careergraph.domain.graph.GraphState;
import me.golemcore.careergraph.domain.graph.VectorMath;
import me.golemcore.careergraph.domain.model.GraphNode;
import me.golemcore.careergraph.domain.model.NodeType;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Pure scoring functions over a {@link GraphState}. Callers hold the read lock.
 */
@Component
public class MatchScoringService {

    static final double GRAPH_WEIGHT = 0.5;
    static final double EMBEDDING_WEIGHT = 0.5;

    /**
     * Skill names adjacent to a node, prefix stripped, in adjacency order.
     */
    public Set<String> skillNames(GraphState state, String nodeId) {
        Set<String> skills = new LinkedHashSet<>();
        for (String neighbor : state.getGraph().neighbors(nodeId)) {
            Optional<GraphNode> node = state.getGraph().getNode(neighbor);
            if (node.isPresent() && node.get().getType() == NodeType.SKILL) {
                skills.add(neighbor.startsWith(NodeType.SKILL.prefix())
                        ? neighbor.substring(NodeType.SKILL.prefix().length())
                        : neighbor);
            }
        }
        return skills;
    }

    /**
     * Fraction of the job's skills the candidate also has; 0 when the job has
     * none. Measures requirement coverage, so it is not symmetric.
     */
    public double graphOverlapScore(GraphState state, String jobId, String candidateId) {
        Set<String> jobSkills = skillNames(state, jobId);
        if (jobSkills.isEmpty()) {
            return 0.0;
        }
        Set<String> candidateSkills = skillNames(state, candidateId);
        long shared = jobSkills.stream().filter(candidateSkills::contains).count();
        return (double) shared / jobSkills.size();
    }

    /**
     * Cosine similarity of the stored vectors, or 0 when either is missing.
     */
    public double embeddingSimilarity(GraphState state, String a, String b) {
        Optional<float[]> first = state.getEmbeddings().get(a);
        Optional<float[]> second = state.getEmbeddings().get(b);
        if (first.isEmpty() || second.isEmpty()) {
            return 0.0;
        }
        return VectorMath.cosine(first.get(), second.get());
    }

    public double finalScore(double graphScore, double similarity) {
        return GRAPH_WEIGHT * graphScore + EMBEDDING_WEIGHT * similarity;
    }
}
