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
import me.golemcore.careergraph.domain.model.MatchEvaluation;
import me.golemcore.careergraph.infrastructure.config.CareerGraphProperties;
import me.golemcore.careergraph.port.outbound.ExplanationPort;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Best-effort natural-language explanations. Every call is bounded by
 * {@code careergraph.explanation.timeout}; any failure yields the configured
 * fallback text. Never called while a graph lock is held.
 */
@Service
@Slf4j
public class ExplanationService {

    private final ExplanationPort explanationPort;
    private final CareerGraphProperties properties;

    public ExplanationService(ExplanationPort explanationPort, CareerGraphProperties properties) {
        this.explanationPort = explanationPort;
        this.properties = properties;
    }

    public String explainMatch(MatchEvaluation evaluation) {
        String prompt = String.format(Locale.ROOT,
                "Job required skills: %s%nCandidate skills: %s%nScores -> graph:%.3f, sim:%.3f, final:%.3f%n%n"
                        + "Write a short evaluation: (1) match summary (2) missing skills (3) recommended next steps.",
                join(evaluation.getJobSkills()), join(evaluation.getCandidateSkills()),
                evaluation.getGraphScore(), evaluation.getEmbeddingSimilarity(), evaluation.getFinalScore());
        return generate(prompt);
    }

    public String explainRanking(Collection<String> jobSkills, Map<String, List<String>> candidateSkills) {
        StringBuilder prompt = new StringBuilder()
                .append("Job required skills: ").append(join(jobSkills)).append('\n')
                .append("Candidates and skills:\n");
        candidateSkills.forEach((candidate, skills) -> prompt.append("- ").append(candidate).append(": ")
                .append(join(skills)).append('\n'));
        prompt.append("\nExplain the ranking and suggest interview questions.");
        return generate(prompt.toString());
    }

    String generate(String prompt) {
        String fallback = properties.getExplanation().getFallback();
        if (!explanationPort.isAvailable()) {
            log.debug("[Explain] Generator {} unavailable, using fallback", explanationPort.getProviderId());
            return fallback;
        }

        Duration timeout = properties.getExplanation().getTimeout();
        CompletableFuture<String> future;
        try {
            future = explanationPort.generate(prompt);
        } catch (RuntimeException e) {
            log.warn("[Explain] Generator rejected the request, using fallback: {}", e.getMessage());
            return fallback;
        }
        try {
            String text = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return text != null && !text.isBlank() ? text : fallback;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Explain] Generator timed out after {}ms, using fallback", timeout.toMillis());
            return fallback;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return fallback;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Explain] Generator failed, using fallback: {}", cause.getMessage());
            return fallback;
        }
    }

    private static String join(Collection<String> values) {
        return values == null ? "" : String.join(", ", values);
    }
}
