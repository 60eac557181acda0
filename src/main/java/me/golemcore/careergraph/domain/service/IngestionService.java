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
import me.golemcore.careergraph.domain.model.NodeId;
import me.golemcore.careergraph.domain.model.NodeType;
import me.golemcore.careergraph.domain.model.ParsedCandidate;
import me.golemcore.careergraph.domain.model.ParsedJob;
import me.golemcore.careergraph.domain.model.UpsertCommand;
import me.golemcore.careergraph.domain.model.UpsertResult;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns free-text CVs and job postings into upserts: parses them, seeds the
 * skill and company nodes they mention, and links the candidate or job to them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionService {

    private final DocumentParser documentParser;
    private final NodeUpsertService nodeUpsertService;

    public UpsertResult ingestCandidate(String applicationId, String name, String email, String userId,
            String cvText) {
        String key = requireKey(applicationId, "applicationId");
        ParsedCandidate parsed = documentParser.parseCandidateText(cvText);

        Map<String, Object> metadata = new LinkedHashMap<>();
        putIfPresent(metadata, "name", name);
        putIfPresent(metadata, "email", email);
        putIfPresent(metadata, "userId", userId);
        metadata.put("applicationId", key);
        metadata.put("experience", parsed.experience());

        UpsertCommand.UpsertCommandBuilder command = UpsertCommand.builder()
                .node(NodeId.of(NodeType.CANDIDATE, key))
                .metadata(metadata);
        for (String skill : parsed.skills()) {
            NodeId skillId = NodeId.of(NodeType.SKILL, skill);
            command.seed(skillSeed(skillId));
            command.neighbor(skillId);
        }

        log.debug("[Ingest] Candidate {}: {} skills, {} experience lines", key, parsed.skills().size(),
                parsed.experience().size());
        return nodeUpsertService.upsert(command.build());
    }

    public UpsertResult ingestJob(String jobId, String title, String company, String jobText) {
        String key = requireKey(jobId, "jobId");
        ParsedJob parsed = documentParser.parseJobText(jobText);
        String resolvedTitle = firstNonBlank(title, parsed.title());
        String resolvedCompany = firstNonBlank(company, parsed.company());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("title", resolvedTitle);
        metadata.put("company", resolvedCompany);

        UpsertCommand.UpsertCommandBuilder command = UpsertCommand.builder()
                .node(NodeId.of(NodeType.JOB, key))
                .metadata(metadata);
        if (!resolvedCompany.isEmpty()) {
            NodeId companyId = NodeId.of(NodeType.COMPANY, resolvedCompany);
            command.seed(new UpsertCommand.SeedNode(companyId, Map.of("name", resolvedCompany),
                    companyId.value() + " " + resolvedCompany));
            command.neighbor(companyId);
        }
        for (String skill : parsed.requiredSkills()) {
            NodeId skillId = NodeId.of(NodeType.SKILL, skill);
            command.seed(skillSeed(skillId));
            command.neighbor(skillId);
        }

        log.debug("[Ingest] Job {}: {} required skills", key, parsed.requiredSkills().size());
        return nodeUpsertService.upsert(command.build());
    }

    private static UpsertCommand.SeedNode skillSeed(NodeId skillId) {
        return new UpsertCommand.SeedNode(skillId, Map.of("name", skillId.key()),
                skillId.value() + " " + skillId.key());
    }

    private static String requireKey(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value.trim();
    }

    private static String firstNonBlank(String preferred, String fallback) {
        if (preferred != null && !preferred.isBlank()) {
            return preferred.trim();
        }
        return fallback != null ? fallback.trim() : "";
    }

    private static void putIfPresent(Map<String, Object> metadata, String key, String value) {
        if (value != null && !value.isBlank()) {
            metadata.put(key, value);
        }
    }
}
