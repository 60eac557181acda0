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

import me.golemcore.careergraph.domain.exception.GraphException;
import me.golemcore.careergraph.domain.graph.GraphState;
import me.golemcore.careergraph.domain.graph.GraphStateHolder;
import me.golemcore.careergraph.domain.model.GraphStatus;
import me.golemcore.careergraph.domain.model.NodeId;
import me.golemcore.careergraph.domain.model.NodeType;
import me.golemcore.careergraph.domain.model.SimilarJobsResult;
import me.golemcore.careergraph.domain.model.SimilarSkillsResult;
import me.golemcore.careergraph.domain.model.UpdateLogEntry;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Exploration queries over the graph: neighbors in embedding space for jobs and
 * skills, known-skill extraction from free text, and operator status.
 */
@Service
public class GraphQueryService {

    private final GraphStateHolder stateHolder;
    private final MatchScoringService scoringService;
    private final GraphSnapshotRepository snapshotRepository;
    private final ReconciliationService reconciliationService;

    public GraphQueryService(GraphStateHolder stateHolder, MatchScoringService scoringService,
            GraphSnapshotRepository snapshotRepository, ReconciliationService reconciliationService) {
        this.stateHolder = stateHolder;
        this.scoringService = scoringService;
        this.snapshotRepository = snapshotRepository;
        this.reconciliationService = reconciliationService;
    }

    /**
     * Jobs most similar to the given one by embedding, with the skills each
     * requires.
     *
     * @param job
     *            job key or full {@code job_} id
     */
    public SimilarJobsResult findSimilarJobs(String job, int topN) {
        String jobId = canonical(NodeType.JOB, job);
        return stateHolder.read(state -> {
            requireNode(state, jobId);
            List<String> similar = mostSimilar(state, jobId, NodeType.JOB, topN);
            Map<String, List<String>> skillsOfSimilar = new LinkedHashMap<>();
            for (String other : similar) {
                skillsOfSimilar.put(other, new ArrayList<>(scoringService.skillNames(state, other)));
            }
            return SimilarJobsResult.builder()
                    .queryJob(jobId)
                    .skills(new ArrayList<>(scoringService.skillNames(state, jobId)))
                    .similarJobs(similar)
                    .skillsOfSimilarJobs(skillsOfSimilar)
                    .build();
        });
    }

    /**
     * Skills most similar to the given one by embedding, with the jobs requiring
     * each.
     *
     * @param skill
     *            skill name or full {@code skill_} id
     */
    public SimilarSkillsResult findSimilarSkills(String skill, int topN) {
        String skillId = canonical(NodeType.SKILL, skill);
        return stateHolder.read(state -> {
            requireNode(state, skillId);
            List<String> similar = mostSimilar(state, skillId, NodeType.SKILL, topN);
            Map<String, List<String>> jobsForSimilar = new LinkedHashMap<>();
            for (String other : similar) {
                jobsForSimilar.put(other, adjacentOfType(state, other, NodeType.JOB));
            }
            return SimilarSkillsResult.builder()
                    .querySkill(skillId)
                    .relatedJobs(adjacentOfType(state, skillId, NodeType.JOB))
                    .similarSkills(similar)
                    .jobsForSimilarSkills(jobsForSimilar)
                    .build();
        });
    }

    /**
     * Names of known skill nodes that occur in the text as whole words,
     * case-insensitively. Lower-cased and sorted.
     */
    public List<String> extractKnownSkills(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String haystack = text.toLowerCase(Locale.ROOT);
        List<String> skillNames = stateHolder.read(state -> {
            List<String> names = new ArrayList<>();
            for (String id : state.getGraph().nodeIdsOfType(NodeType.SKILL)) {
                names.add(NodeId.parse(id).key());
            }
            return names;
        });

        Set<String> found = new TreeSet<>();
        for (String name : skillNames) {
            String needle = name.toLowerCase(Locale.ROOT).trim();
            if (needle.isEmpty()) {
                continue;
            }
            Pattern pattern = Pattern.compile("(?<![\\p{Alnum}_])" + Pattern.quote(needle) + "(?![\\p{Alnum}_])");
            if (pattern.matcher(haystack).find()) {
                found.add(needle);
            }
        }
        return new ArrayList<>(found);
    }

    public List<UpdateLogEntry> updateLog() {
        return stateHolder.read(state -> new ArrayList<>(state.getUpdateLog()));
    }

    public GraphStatus status() {
        GraphStatus status = stateHolder.read(state -> GraphStatus.builder()
                .nodes(state.getGraph().nodeCount())
                .edges(state.getGraph().edgeCount())
                .embeddings(state.getEmbeddings().size())
                .indexedVectors(state.getIndex().size())
                .space(state.getSpace())
                .dimension(state.getDimension())
                .pendingUpdates(state.getUpdateLog().size())
                .build());
        status.setReconciliationState(reconciliationService.getState());
        status.setLastRebuild(reconciliationService.getLastResult());
        status.setPersistenceHealthy(snapshotRepository.isHealthy());
        status.setPersistenceFailures(snapshotRepository.getFailureCount());
        status.setLastPersistenceError(snapshotRepository.getLastError());
        return status;
    }

    private List<String> mostSimilar(GraphState state, String queryId, NodeType type, int topN) {
        if (topN < 0) {
            throw new IllegalArgumentException("topN must not be negative: " + topN);
        }
        List<Map.Entry<String, Double>> scored = new ArrayList<>();
        for (String candidate : state.getGraph().nodeIdsOfType(type)) {
            if (!candidate.equals(queryId)) {
                scored.add(Map.entry(candidate, scoringService.embeddingSimilarity(state, queryId, candidate)));
            }
        }
        scored.sort((a, b) -> Double.compare(b.getValue(), a.getValue()));
        List<String> result = new ArrayList<>();
        for (int i = 0; i < Math.min(topN, scored.size()); i++) {
            result.add(scored.get(i).getKey());
        }
        return result;
    }

    private static List<String> adjacentOfType(GraphState state, String id, NodeType type) {
        List<String> result = new ArrayList<>();
        for (String neighbor : state.getGraph().neighbors(id)) {
            if (state.getGraph().getNode(neighbor).map(node -> node.getType() == type).orElse(false)) {
                result.add(neighbor);
            }
        }
        return result;
    }

    static String canonical(NodeType type, String keyOrId) {
        if (keyOrId == null || keyOrId.isBlank()) {
            throw new IllegalArgumentException(type.wireName() + " must not be blank");
        }
        String trimmed = keyOrId.trim();
        return trimmed.startsWith(type.prefix()) ? trimmed : NodeId.of(type, trimmed).value();
    }

    private static void requireNode(GraphState state, String id) {
        if (!state.getGraph().hasNode(id)) {
            throw GraphException.notFound("Node not found: " + id);
        }
    }
}
