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
import me.golemcore.careergraph.domain.graph.VectorIndex;
import me.golemcore.careergraph.domain.model.CandidateRanking;
import me.golemcore.careergraph.domain.model.EmbeddingSpace;
import me.golemcore.careergraph.domain.model.GraphNode;
import me.golemcore.careergraph.domain.model.MatchEvaluation;
import me.golemcore.careergraph.domain.model.RankedCandidate;
import me.golemcore.careergraph.domain.model.SearchHit;
import me.golemcore.careergraph.port.outbound.EmbeddingPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionException;

/**
 * Read-path operations: evaluating one job/candidate pair, ranking candidates for
 * a job, and free-text search over the vector index. Graph access happens under
 * the read lock; explanations are generated after it is released.
 */
@Service
@Slf4j
public class MatchService {

    private final GraphStateHolder stateHolder;
    private final MatchScoringService scoringService;
    private final ExplanationService explanationService;
    private final EmbeddingPort embeddingPort;

    public MatchService(GraphStateHolder stateHolder, MatchScoringService scoringService,
            ExplanationService explanationService, EmbeddingPort embeddingPort) {
        this.stateHolder = stateHolder;
        this.scoringService = scoringService;
        this.explanationService = explanationService;
        this.embeddingPort = embeddingPort;
    }

    /**
     * @throws GraphException
     *             NOT_FOUND if either node is absent
     */
    public MatchEvaluation evaluateMatch(String jobId, String candidateId, boolean explain) {
        MatchEvaluation evaluation = stateHolder.read(state -> {
            requireNode(state, jobId);
            requireNode(state, candidateId);
            Set<String> jobSkills = scoringService.skillNames(state, jobId);
            Set<String> candidateSkills = scoringService.skillNames(state, candidateId);
            double graphScore = scoringService.graphOverlapScore(state, jobId, candidateId);
            double similarity = scoringService.embeddingSimilarity(state, jobId, candidateId);

            List<String> missing = new ArrayList<>();
            for (String skill : jobSkills) {
                if (!candidateSkills.contains(skill)) {
                    missing.add(skill);
                }
            }
            return MatchEvaluation.builder()
                    .jobNode(jobId)
                    .candidateNode(candidateId)
                    .graphScore(graphScore)
                    .embeddingSimilarity(similarity)
                    .finalScore(scoringService.finalScore(graphScore, similarity))
                    .jobSkills(new ArrayList<>(jobSkills))
                    .candidateSkills(new ArrayList<>(candidateSkills))
                    .missingSkills(missing)
                    .build();
        });

        if (explain) {
            evaluation.setExplanation(explanationService.explainMatch(evaluation));
        }
        return evaluation;
    }

    /**
     * Ranks the candidates by final score, best first. Unknown candidate ids are
     * skipped; equal scores keep their input order.
     *
     * @param topN
     *            maximum results, or {@code null} for all
     * @throws GraphException
     *             NOT_FOUND if the job is absent
     */
    public CandidateRanking rankCandidates(String jobId, List<String> candidateIds, Integer topN, boolean explain) {
        if (topN != null && topN < 0) {
            throw new IllegalArgumentException("topN must not be negative: " + topN);
        }
        Map<String, List<String>> candidateSkills = new LinkedHashMap<>();
        List<String> jobSkills = new ArrayList<>();

        List<RankedCandidate> ranked = stateHolder.read(state -> {
            requireNode(state, jobId);
            jobSkills.addAll(scoringService.skillNames(state, jobId));
            List<RankedCandidate> scored = new ArrayList<>();
            for (String candidateId : candidateIds != null ? candidateIds : List.<String>of()) {
                if (candidateId == null || !state.getGraph().hasNode(candidateId)) {
                    log.debug("[Match] Skipping unknown candidate: {}", candidateId);
                    continue;
                }
                double graphScore = scoringService.graphOverlapScore(state, jobId, candidateId);
                double similarity = scoringService.embeddingSimilarity(state, jobId, candidateId);
                scored.add(RankedCandidate.builder()
                        .candidate(candidateId)
                        .graphScore(graphScore)
                        .similarity(similarity)
                        .finalScore(scoringService.finalScore(graphScore, similarity))
                        .build());
                candidateSkills.put(candidateId, new ArrayList<>(scoringService.skillNames(state, candidateId)));
            }
            scored.sort((a, b) -> Double.compare(b.getFinalScore(), a.getFinalScore()));
            int limit = topN != null ? Math.min(topN, scored.size()) : scored.size();
            return new ArrayList<>(scored.subList(0, limit));
        });

        CandidateRanking ranking = CandidateRanking.builder().job(jobId).ranked(ranked).build();
        if (explain && !ranked.isEmpty()) {
            Map<String, List<String>> shown = new LinkedHashMap<>();
            for (RankedCandidate candidate : ranked) {
                shown.put(candidate.getCandidate(), candidateSkills.get(candidate.getCandidate()));
            }
            ranking.setExplanation(explanationService.explainRanking(jobSkills, shown));
        }
        return ranking;
    }

    /**
     * Nearest nodes to the encoded query. Returns nothing while the graph holds
     * structural vectors, which are not comparable with text vectors.
     */
    public List<SearchHit> searchByText(String query, int k) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query must not be blank");
        }
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive: " + k);
        }
        boolean textSpace = stateHolder.read(state -> state.getSpace() == EmbeddingSpace.TEXT);
        if (!textSpace) {
            log.warn("[Search] Text search is unavailable while the graph holds structural embeddings");
            return List.of();
        }

        float[] queryVector = encode(query);
        return stateHolder.read(state -> {
            if (state.getSpace() != EmbeddingSpace.TEXT || queryVector.length != state.getDimension()) {
                log.warn("[Search] Query vector does not match the {} space of the graph", state.getSpace());
                return List.<SearchHit>of();
            }
            List<SearchHit> hits = new ArrayList<>();
            for (VectorIndex.Hit hit : state.getIndex().search(queryVector, k)) {
                hits.add(SearchHit.builder()
                        .node(hit.id())
                        .score(hit.score())
                        .type(state.getGraph().getNode(hit.id()).map(GraphNode::getType).orElse(null))
                        .build());
            }
            return hits;
        });
    }

    private float[] encode(String query) {
        try {
            return embeddingPort.embed(query).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof GraphException graphException) {
                throw graphException;
            }
            throw new GraphException(GraphErrorKind.ENCODER_UNAVAILABLE,
                    "Text encoder failed: " + (e.getCause() != null ? e.getCause().getMessage() : e.getMessage()),
                    e);
        }
    }

    private static void requireNode(GraphState state, String id) {
        if (id == null || !state.getGraph().hasNode(id)) {
            throw GraphException.notFound("Node not found: " + id);
        }
    }
}
