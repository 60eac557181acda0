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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.careergraph.domain.exception.GraphException;
import me.golemcore.careergraph.domain.graph.GraphStateHolder;
import me.golemcore.careergraph.domain.model.AnomalyReport;
import me.golemcore.careergraph.domain.model.NodeType;
import org.springframework.stereotype.Service;

import java.util.OptionalInt;
import java.util.function.Predicate;

/**
 * Data-quality check for a skill claimed against a job or company: the skill is
 * connected when it lies within {@code maxDepth} hops of the target and its
 * embedding is at least {@code simThreshold} similar; otherwise it is an
 * anomaly.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnomalyService {

    public static final int DEFAULT_MAX_DEPTH = 3;
    public static final double DEFAULT_SIM_THRESHOLD = 0.25;

    private final GraphStateHolder stateHolder;
    private final MatchScoringService scoringService;

    /**
     * @param skill
     *            skill name or {@code skill_} id
     * @param target
     *            job or company key; a job with that key wins over a company
     * @throws GraphException
     *             NOT_FOUND when the skill or the target is absent
     */
    public AnomalyReport checkAnomaly(String skill, String target, int maxDepth, double simThreshold) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
        }
        String skillId = GraphQueryService.canonical(NodeType.SKILL, skill);
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("target must not be blank");
        }
        String targetKey = target.trim();

        AnomalyReport report = stateHolder.read(state -> {
            if (!state.getGraph().hasNode(skillId)) {
                throw GraphException.notFound("Skill not found: " + skillId);
            }
            String targetId = resolveTarget(targetKey, state.getGraph()::hasNode);

            OptionalInt path = state.getGraph().shortestPathLength(skillId, targetId);
            double similarity = scoringService.embeddingSimilarity(state, skillId, targetId);
            boolean connected = path.isPresent() && path.getAsInt() <= maxDepth && similarity >= simThreshold;
            return AnomalyReport.builder()
                    .skill(skillId)
                    .target(targetKey)
                    .targetNode(targetId)
                    .pathLength(path.isPresent() ? path.getAsInt() : null)
                    .similarity(similarity)
                    .connected(connected)
                    .anomaly(!connected)
                    .build();
        });

        if (report.isAnomaly()) {
            log.debug("[Anomaly] {} is not connected to {} (path: {}, similarity: {})", skillId,
                    report.getTargetNode(), report.getPathLength(), report.getSimilarity());
        }
        return report;
    }

    private static String resolveTarget(String target, Predicate<String> exists) {
        if (target.startsWith(NodeType.JOB.prefix()) || target.startsWith(NodeType.COMPANY.prefix())) {
            if (exists.test(target)) {
                return target;
            }
            throw GraphException.notFound("Target not found: " + target);
        }
        String jobId = NodeType.JOB.prefix() + target;
        if (exists.test(jobId)) {
            return jobId;
        }
        String companyId = NodeType.COMPANY.prefix() + target;
        if (exists.test(companyId)) {
            return companyId;
        }
        throw GraphException.notFound("Target not found as job or company: " + target);
    }
}
